package com.hellblazer.arscene.scene;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.NotTrackingException;
import com.hellblazer.arscene.tracking.Plane;
import com.hellblazer.arscene.tracking.ResourceExhaustedException;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Unbounded plane whose pose, type and state the test controls. Upward facing unless set otherwise.
 *
 * @author hal.hildebrand
 */
public class FakePlane implements Plane {
    private final List<Anchor> anchors = new ArrayList<>();
    private Pose               centerPose;
    private boolean            exhausted;
    private TrackingState      state;
    private Type               type = Type.HORIZONTAL_UPWARD_FACING;

    public FakePlane(Pose centerPose, TrackingState state) {
        this.centerPose = centerPose;
        this.state = state;
    }

    @Override
    public Anchor createAnchor(Pose pose) {
        if (state != TrackingState.TRACKING) {
            throw new NotTrackingException("Plane is " + state);
        }
        if (exhausted) {
            throw new ResourceExhaustedException("Too many anchors");
        }
        var anchor = new FakeAnchor(pose);
        anchors.add(anchor);
        return anchor;
    }

    @Override
    public Collection<Anchor> getAnchors() {
        return List.copyOf(anchors);
    }

    @Override
    public Pose getCenterPose() {
        return centerPose;
    }

    @Override
    public TrackingState getTrackingState() {
        return state;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public boolean isPoseInPolygon(Pose pose) {
        return true;
    }

    public void setCenterPose(Pose centerPose) {
        this.centerPose = centerPose;
    }

    public void setExhausted(boolean exhausted) {
        this.exhausted = exhausted;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public void setTrackingState(TrackingState state) {
        this.state = state;
    }
}
