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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.tracking.Frame;
import com.hellblazer.arscene.tracking.SessionController;

/**
 * The root nodes of a scene, driven by the frames of one tracking session.
 * <p>
 * Nodes are visited parent before child. A node whose update throws is logged and skipped; its children and siblings
 * are still updated.
 *
 * @author hal.hildebrand
 */
public class Scene {
    private static final Logger log = LoggerFactory.getLogger(Scene.class);

    private final FrameClock        clock = new FrameClock();
    private final List<Node>        roots = new CopyOnWriteArrayList<>();
    private final SessionController session;

    public Scene(SessionController session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    public void addNode(Node node) {
        Objects.requireNonNull(node, "node");
        if (node.getParent() != null) {
            node.getParent().removeChild(node);
        }
        if (!roots.contains(node)) {
            roots.add(node);
        }
    }

    public FrameClock getClock() {
        return clock;
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(roots);
    }

    public SessionController getSession() {
        return session;
    }

    /**
     * Update every node from the frame
     *
     * @return the context the nodes were updated with
     */
    public FrameContext onFrame(Frame frame) {
        var context = new FrameContext(session, frame, clock.tick(frame.getTimestamp()));
        for (var root : roots) {
            visit(root, context);
        }
        return context;
    }

    public void removeNode(Node node) {
        roots.remove(node);
    }

    @Override
    public String toString() {
        return "Scene[" + roots.size() + " roots, " + clock + "]";
    }

    /**
     * Advance the session and update every node from the new frame
     *
     * @return the context of the frame, or empty if the session produced none
     */
    public Optional<FrameContext> update() {
        return session.update().map(this::onFrame);
    }

    private void visit(Node node, FrameContext context) {
        try {
            node.onFrame(context);
        } catch (RuntimeException e) {
            log.error("Frame {} update failed for {}", context.time().frameNumber(), node, e);
        }
        for (var child : node.getChildren()) {
            visit(child, context);
        }
    }
}
