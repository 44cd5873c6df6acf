package com.hellblazer.arscene.scene;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.tracking.HitResult;
import com.hellblazer.arscene.tracking.Trackable;

/**
 * @author hal.hildebrand
 */
public record FakeHit(Trackable trackable, Pose pose, float distance) implements HitResult {

    public FakeHit(Trackable trackable, Pose pose) {
        this(trackable, pose, 1f);
    }

    @Override
    public float getDistance() {
        return distance;
    }

    @Override
    public Pose getHitPose() {
        return pose;
    }

    @Override
    public Trackable getTrackable() {
        return trackable;
    }
}
