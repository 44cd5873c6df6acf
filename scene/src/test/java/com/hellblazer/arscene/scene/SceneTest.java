/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the ARScene.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arscene.scene;

import com.hellblazer.arscene.tracking.SessionController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SceneTest {

    private static class Recording implements TrackingBehavior {
        private final List<String> visits;
        private final boolean      fail;

        Recording(List<String> visits, boolean fail) {
            this.visits = visits;
            this.fail = fail;
        }

        @Override
        public void attach(Node node) {
        }

        @Override
        public void onFrame(Node node, FrameContext context) {
            visits.add(node.getName());
            if (fail) {
                throw new IllegalStateException("boom");
            }
        }
    }

    private FakeSession  session;
    private Scene        scene;
    private List<String> visits;

    @BeforeEach
    void setUp() {
        session = new FakeSession();
        scene = new Scene(new SessionController(session));
        visits = new ArrayList<>();
    }

    @Test
    void testParentBeforeChild() {
        var root = node("root", false);
        var a = node("a", false);
        var b = node("b", false);
        var a1 = node("a1", false);
        root.addChild(a);
        root.addChild(b);
        a.addChild(a1);
        scene.addNode(root);

        scene.onFrame(FakeFrame.at(1));
        assertEquals(List.of("root", "a", "a1", "b"), visits);
    }

    @Test
    void testFailingNodeIsIsolated() {
        var broken = node("broken", true);
        var child = node("child", false);
        broken.addChild(child);
        scene.addNode(broken);
        scene.addNode(node("sibling", false));

        var context = scene.onFrame(FakeFrame.at(1));
        assertEquals(List.of("broken", "child", "sibling"), visits);
        assertEquals(1, context.time().frameNumber());

        scene.onFrame(FakeFrame.at(2));
        assertEquals(6, visits.size());
    }

    @Test
    void testUpdate() {
        scene.addNode(node("root", false));
        session.setFrame(FakeFrame.at(1));
        assertTrue(scene.update().isEmpty());

        scene.getSession().resume();
        var context = scene.update();
        assertTrue(context.isPresent());
        assertSame(scene.getSession(), context.get().session());
        assertEquals(FakeFrame.at(1).getTimestamp(), context.get().time().timestampNanos());
        assertEquals(List.of("root"), visits);

        session.setFrame(new FakeFrame(0L));
        assertTrue(scene.update().isEmpty());
        assertEquals(1, scene.getClock().getCurrentFrame());
    }

    @Test
    void testRoots() {
        var parent = node("parent", false);
        var child = node("child", false);
        parent.addChild(child);
        scene.addNode(child);
        scene.addNode(child);
        assertNull(child.getParent());
        assertEquals(List.of(child), scene.getNodes());
        scene.removeNode(child);
        assertTrue(scene.getNodes().isEmpty());
    }

    private Node node(String name, boolean fail) {
        return new Node(name, new Recording(visits, fail));
    }
}
