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
package com.hellblazer.arscene.scene.tracking;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.scene.FakeAnchor;
import com.hellblazer.arscene.scene.FakeFrame;
import com.hellblazer.arscene.scene.FakeHit;
import com.hellblazer.arscene.scene.FakePlane;
import com.hellblazer.arscene.scene.FakeSession;
import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.scene.PlacementSettings;
import com.hellblazer.arscene.scene.Scene;
import com.hellblazer.arscene.tracking.CloudAnchorState;
import com.hellblazer.arscene.tracking.HitResult;
import com.hellblazer.arscene.tracking.HitResultFilter;
import com.hellblazer.arscene.tracking.InstantPlacementPoint;
import com.hellblazer.arscene.tracking.PlacementMode;
import com.hellblazer.arscene.tracking.Plane;
import com.hellblazer.arscene.tracking.ResolveResult;
import com.hellblazer.arscene.tracking.SessionConfig.CloudAnchorMode;
import com.hellblazer.arscene.tracking.SessionConfig.DepthMode;
import com.hellblazer.arscene.tracking.SessionConfig.InstantPlacementMode;
import com.hellblazer.arscene.tracking.SessionConfig.PlaneFindingMode;
import com.hellblazer.arscene.tracking.SessionController;
import com.hellblazer.arscene.tracking.TrackingState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class PlacementBehaviorTest {

    private static final Pose P = Pose.makeTranslation(0.5f, 0f, -2f);

    private FakePlane         floor;
    private int               frame;
    private List<FakeFrame>   frames;
    private SessionController controller;
    private Scene             scene;
    private FakeSession       session;

    @BeforeEach
    void setUp() {
        session = new FakeSession();
        controller = new SessionController(session);
        controller.setDisplayGeometry(0, 1080, 1920);
        scene = new Scene(controller);
        floor = new FakePlane(Pose.makeTranslation(0f, 0f, -2f), TrackingState.TRACKING);
        frames = new ArrayList<>();
        frame = 0;
    }

    @Test
    void testPlacementWithoutAutoAnchor() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL_AND_VERTICAL);
        scene.addNode(new Node("model", behavior));

        for (int i = 1; i <= 4; i++) {
            nextFrame(null);
            assertNull(behavior.getPose());
        }
        nextFrame(new FakeHit(floor, P));
        assertEquals(P, behavior.getPose());
        assertFalse(behavior.isAnchored());

        for (int i = 6; i <= 10; i++) {
            nextFrame(new FakeHit(floor, P));
            assertFalse(behavior.isAnchored());
        }
        assertEquals(P, behavior.getPose());
        assertEquals(10, frames.stream().filter(f -> !f.getHitTests().isEmpty()).count());
    }

    @Test
    void testAutoAnchor() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL_AND_VERTICAL);
        scene.addNode(new Node("model", behavior));
        behavior.setAutoAnchor(true);
        assertFalse(behavior.isAnchored());

        for (int i = 1; i <= 4; i++) {
            nextFrame(null);
            assertFalse(behavior.isAnchored());
        }
        nextFrame(new FakeHit(floor, P));
        assertFalse(behavior.isAnchored());
        assertEquals(P, behavior.getPose());

        nextFrame(new FakeHit(floor, P));
        assertTrue(behavior.isAnchored());
        assertNotNull(behavior.getAnchor());
        assertEquals(P, behavior.getAnchor().getPose());
        assertEquals(List.of(behavior.getAnchor()), List.copyOf(floor.getAnchors()));
        assertTrue(frames.get(5).getHitTests().isEmpty(), "no hit test once anchored");

        nextFrame(new FakeHit(floor, Pose.makeTranslation(3f, 0f, -2f)));
        assertTrue(frames.get(6).getHitTests().isEmpty());
        assertEquals(P, behavior.getPose());

        behavior.setAutoAnchor(false);
        assertFalse(behavior.isAnchored());
        assertEquals(1, floor.getAnchors().size());
    }

    @Test
    void testSetAutoAnchorAnchorsImmediately() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        scene.addNode(new Node("model", behavior));
        nextFrame(new FakeHit(floor, P));
        assertFalse(behavior.isAnchored());

        behavior.setAutoAnchor(true);
        assertTrue(behavior.isAnchored());
        assertTrue(behavior.isAutoAnchor());
    }

    @Test
    void testAnchorCandidates() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        scene.addNode(new Node("model", behavior));
        assertEquals(AnchorFailure.NO_POSE_SOURCE, behavior.createAnchor().failure().orElseThrow());

        var lost = new FakePlane(Pose.makeTranslation(0f, 0f, -2f), TrackingState.PAUSED);
        var nonTracking = new FakeHit(lost, Pose.makeTranslation(2f, 0f, -2f));
        nextFrame(nonTracking);
        assertSame(nonTracking, behavior.getHitResult());
        assertNull(behavior.getLastTrackingHitResult());
        assertNull(behavior.getPose(), "a non tracking hit keeps the pose");
        assertEquals(AnchorFailure.NO_POSE_SOURCE, behavior.createAnchor().failure().orElseThrow());

        var tracking = new FakeHit(floor, P);
        nextFrame(tracking);
        nextFrame(nonTracking);
        assertSame(tracking, behavior.getLastTrackingHitResult());
        assertEquals(P, behavior.getPose());

        var creation = behavior.anchor();
        assertTrue(creation.isCreated());
        assertEquals(P, behavior.getAnchor().getPose());
        assertTrue(lost.getAnchors().isEmpty());
    }

    @Test
    void testAnchorOnNonTrackingHit() {
        var settings = PlacementSettings.defaults().withAnchorOnNonTrackingHit(true);
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL, settings);
        scene.addNode(new Node("model", behavior));

        var point = mock(InstantPlacementPoint.class);
        var anchor = new FakeAnchor(P, TrackingState.PAUSED);
        when(point.getTrackingState()).thenReturn(TrackingState.PAUSED);
        when(point.createAnchor(P)).thenReturn(anchor);
        behavior.onHitResult(null, new FakeHit(point, P));
        assertNull(behavior.getPose());

        var creation = behavior.anchor();
        assertTrue(creation.isCreated());
        assertSame(anchor, behavior.getAnchor());
    }

    @Test
    void testHitResultListeners() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        var node = new Node("model", behavior);
        scene.addNode(node);
        var results = new ArrayList<HitResult>();
        behavior.addHitResultListener((n, hit) -> {
            assertSame(node, n);
            results.add(hit);
        });
        var hit = new FakeHit(floor, P);
        nextFrame(null);
        nextFrame(hit);
        assertEquals(2, results.size());
        assertNull(results.get(0));
        assertSame(hit, results.get(1));
    }

    @Test
    void testScreenPoint() {
        var behavior = new PlacementBehavior(PlacementMode.INSTANT);
        scene.addNode(new Node("model", behavior));
        nextFrame(null);
        var hitTest = frames.get(0).getHitTests();
        assertEquals(1, hitTest.size(), "instant only");
        assertArrayEquals(new float[] { 540f, 960f, 2f }, hitTest.get(0));

        behavior.setPlacementPosition(new Point3f(1f, 1f, -3f));
        nextFrame(null);
        assertArrayEquals(new float[] { 1080f, 0f, 3f }, frames.get(1).getHitTests().get(0));
        assertEquals(new Point3f(1f, 1f, -3f), behavior.getPlacementPosition());
    }

    @Test
    void testInstantPlacement() {
        var behavior = new PlacementBehavior();
        assertEquals(PlacementMode.BEST_AVAILABLE, behavior.getPlacementMode());
        assertEquals(PlacementBehavior.DEFAULT_PLACEMENT_POSITION, behavior.getPlacementPosition());
        scene.addNode(new Node("model", behavior));

        var point = mock(InstantPlacementPoint.class);
        when(point.getTrackingState()).thenReturn(TrackingState.TRACKING);
        var fm = new FakeFrame(FakeFrame.FRAME_INTERVAL_NANOS).withInstantHit(new FakeHit(point, P));
        frames.add(fm);
        scene.onFrame(fm);
        assertEquals(2, fm.getHitTests().size(), "surface first, then instant");
        assertEquals(P, behavior.getPose());
    }

    @Test
    void testRequireFeatures() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        scene.addNode(new Node("model", behavior));
        nextFrame(null);
        var configured = session.getConfigs().size();
        nextFrame(null);
        assertEquals(configured, session.getConfigs().size());

        behavior.setPlacementMode(PlacementMode.DEPTH);
        nextFrame(null);
        var config = controller.getConfig();
        assertEquals(DepthMode.AUTOMATIC, config.depthMode());
        assertEquals(PlaneFindingMode.HORIZONTAL, config.planeFindingMode());
        assertEquals(InstantPlacementMode.DISABLED, config.instantPlacementMode());
    }

    @Test
    void testDepthFallsBackToPlanes() {
        session.setDepthSupported(false);
        var behavior = new PlacementBehavior(PlacementMode.DEPTH);
        scene.addNode(new Node("model", behavior));
        nextFrame(new FakeHit(floor, P));

        assertEquals(DepthMode.DISABLED, controller.getConfig().depthMode());
        assertEquals(PlaneFindingMode.HORIZONTAL_AND_VERTICAL, controller.getConfig().planeFindingMode());
        assertEquals(P, behavior.getPose());
    }

    @Test
    void testDisabled() {
        var behavior = new PlacementBehavior(PlacementMode.DISABLED);
        scene.addNode(new Node("model", behavior));
        nextFrame(new FakeHit(floor, P));
        assertTrue(frames.get(0).getHitTests().isEmpty());
        assertNull(behavior.getHitResult());
    }

    @Test
    void testCameraNotTracking() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        scene.addNode(new Node("model", behavior));
        var fm = FakeFrame.at(1).withHit(new FakeHit(floor, P));
        fm.getCamera().setTrackingState(TrackingState.PAUSED);
        scene.onFrame(fm);
        assertTrue(fm.getHitTests().isEmpty());
        assertNull(behavior.getPose());
    }

    @Test
    void testPlacementModeRestrictsPlaneTypes() {
        var wall = new FakePlane(Pose.makeTranslation(0f, 0f, -3f), TrackingState.TRACKING);
        wall.setType(Plane.Type.VERTICAL);
        var wallPose = Pose.makeTranslation(0.5f, 0f, -3f);
        var behavior = new PlacementBehavior(PlacementMode.PLANE_VERTICAL);
        scene.addNode(new Node("picture", behavior));

        nextFrame(new FakeHit(floor, P));
        assertNull(behavior.getHitResult(), "a vertical mode ignores floors");
        assertNull(behavior.getPose());
        assertEquals(PlaneFindingMode.HORIZONTAL_AND_VERTICAL, controller.getConfig().planeFindingMode());

        nextFrame(new FakeHit(wall, wallPose));
        assertEquals(wallPose, behavior.getPose());

        behavior.setPlacementMode(PlacementMode.PLANE_HORIZONTAL);
        nextFrame(null);
        nextFrame(new FakeHit(wall, Pose.makeTranslation(1f, 0f, -3f)));
        assertNull(behavior.getHitResult(), "a horizontal mode ignores walls");
        assertEquals(wallPose, behavior.getPose());
    }

    @Test
    void testHitResultFilter() {
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL_AND_VERTICAL);
        scene.addNode(new Node("model", behavior));
        assertNull(behavior.getHitResultFilter());
        var filter = HitResultFilter.defaults().withPredicate(hit -> hit.getDistance() <= 2f);
        behavior.setHitResultFilter(filter);
        assertSame(filter, behavior.getHitResultFilter());

        var far = new FakeHit(floor, Pose.makeTranslation(0f, 0f, -4f), 4f);
        nextFrame(far);
        assertNull(behavior.getHitResult());
        assertNull(behavior.getPose());

        nextFrame(null);
        var near = new FakeHit(floor, P, 2f);
        var fm = FakeFrame.at(++frame).withHit(far).withHit(near);
        frames.add(fm);
        scene.onFrame(fm);
        assertSame(near, behavior.getHitResult());
        assertEquals(P, behavior.getPose());

        // the filter narrows the placement mode and never widens it
        behavior.setPlacementMode(PlacementMode.PLANE_VERTICAL);
        behavior.setHitResultFilter(HitResultFilter.defaults().withPlaneTypes(EnumSet.allOf(Plane.Type.class)));
        nextFrame(null);
        nextFrame(new FakeHit(floor, Pose.makeTranslation(1f, 0f, -2f)));
        assertNull(behavior.getHitResult());
        assertEquals(P, behavior.getPose());
    }

    @Test
    void testNoPlacementWhileResolving() {
        controller.configure(c -> c.withCloudAnchorMode(CloudAnchorMode.ENABLED));
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        scene.addNode(new Node("model", behavior));
        behavior.resolveCloudAnchor(controller, "cloud-1", null);

        nextFrame(new FakeHit(floor, P));
        assertTrue(frames.get(0).getHitTests().isEmpty());
        assertNull(behavior.getPose());

        var there = Pose.makeTranslation(1f, 0f, -2f);
        session.getResolves().get(0).complete(new ResolveResult<>(new FakeAnchor(there), CloudAnchorState.SUCCESS));
        nextFrame(new FakeHit(floor, P));
        assertTrue(behavior.isAnchored());
        assertEquals(there, behavior.getPose());
        assertTrue(frames.get(1).getHitTests().isEmpty());
    }

    @Test
    void testPlacementResumesAfterCancel() {
        controller.configure(c -> c.withCloudAnchorMode(CloudAnchorMode.ENABLED));
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL);
        scene.addNode(new Node("model", behavior));
        behavior.resolveCloudAnchor(controller, "cloud-1", null);
        nextFrame(new FakeHit(floor, P));
        assertNull(behavior.getPose());

        behavior.cancelCloudAnchorTask();
        nextFrame(new FakeHit(floor, P));
        assertEquals(P, behavior.getPose());
        assertFalse(behavior.isAnchored());
    }

    @Test
    void testRateLimit() {
        var settings = PlacementSettings.defaults().withMaxHitTestsPerSecond(5);
        var behavior = new PlacementBehavior(PlacementMode.PLANE_HORIZONTAL, settings);
        scene.addNode(new Node("model", behavior));
        for (int i = 0; i < 10; i++) {
            nextFrame(null);
        }
        var issued = frames.stream().filter(f -> !f.getHitTests().isEmpty()).count();
        assertEquals(5, issued);
        assertFalse(frames.get(0).getHitTests().isEmpty(), "the first frame is always eligible");
        assertTrue(frames.get(1).getHitTests().isEmpty());
        assertFalse(frames.get(2).getHitTests().isEmpty());
    }

    private void nextFrame(HitResult hit) {
        var fm = FakeFrame.at(++frame);
        if (hit != null) {
            fm.withHit(hit);
        }
        frames.add(fm);
        scene.onFrame(fm);
    }
}
