package com.hellblazer.arscene.scene;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.Camera;
import com.hellblazer.arscene.tracking.Frame;
import com.hellblazer.arscene.tracking.HitResult;
import com.hellblazer.arscene.tracking.Trackable;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Frame returning the hit results the test supplies and recording the hit tests issued against it
 *
 * @author hal.hildebrand
 */
public class FakeFrame implements Frame {

    /**
     * Camera 1.5m above the origin, looking down -Z
     */
    public static class FakeCamera implements Camera {
        private Pose          pose  = Pose.makeTranslation(0f, 1.5f, 0f);
        private TrackingState state = TrackingState.TRACKING;

        @Override
        public Pose getDisplayOrientedPose() {
            return pose;
        }

        @Override
        public Pose getPose() {
            return pose;
        }

        @Override
        public TrackingState getTrackingState() {
            return state;
        }

        public void setPose(Pose pose) {
            this.pose = pose;
        }

        public void setTrackingState(TrackingState state) {
            this.state = state;
        }
    }

    public static final long FRAME_INTERVAL_NANOS = 100_000_000L;

    /**
     * @return the frame number n, from 1, at 10 frames per second
     */
    public static FakeFrame at(int n) {
        return new FakeFrame(n * FRAME_INTERVAL_NANOS);
    }

    private final FakeCamera      camera            = new FakeCamera();
    private final List<HitResult> hits              = new ArrayList<>();
    private final List<float[]>   hitTests          = new ArrayList<>();
    private final List<HitResult> instantHits       = new ArrayList<>();
    private final long            timestamp;
    private final List<Trackable> updatedTrackables = new ArrayList<>();

    public FakeFrame(long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public FakeCamera getCamera() {
        return camera;
    }

    /**
     * @return the screen coordinates of every hit test issued, surface and instant
     */
    public List<float[]> getHitTests() {
        return hitTests;
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public Collection<Anchor> getUpdatedAnchors() {
        return List.of();
    }

    @Override
    public Collection<? extends Trackable> getUpdatedTrackables() {
        return updatedTrackables;
    }

    @Override
    public List<HitResult> hitTest(float x, float y) {
        hitTests.add(new float[] { x, y });
        return List.copyOf(hits);
    }

    @Override
    public List<HitResult> hitTestInstantPlacement(float x, float y, float approximateDistance) {
        hitTests.add(new float[] { x, y, approximateDistance });
        return List.copyOf(instantHits);
    }

    public FakeFrame withHit(HitResult hit) {
        hits.add(hit);
        return this;
    }

    public FakeFrame withInstantHit(HitResult hit) {
        instantHits.add(hit);
        return this;
    }

    public FakeFrame withUpdated(Trackable trackable) {
        updatedTrackables.add(trackable);
        return this;
    }
}
