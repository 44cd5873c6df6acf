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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.scene.PlacementSettings;
import com.hellblazer.arscene.scene.TrackingBehavior;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Base of the behaviors that position a node from a tracked pose. The node follows the pose, instantly or by
 * smoothing, and is visible only while the tracking state is one of the visible states.
 *
 * @author hal.hildebrand
 */
public abstract class PoseBehavior implements TrackingBehavior {
    private static final Logger log = LoggerFactory.getLogger(PoseBehavior.class);

    private boolean                           keepPosition;
    private boolean                           keepRotation;
    private Node                              node;
    private Pose                              pose;
    private PlacementSettings                 settings;
    private final List<TrackingStateListener> stateListeners    = new CopyOnWriteArrayList<>();
    private final List<TrackingListener>      trackingListeners = new CopyOnWriteArrayList<>();
    private TrackingState                     trackingState;

    protected PoseBehavior(PlacementSettings settings, TrackingState initialState) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.trackingState = initialState;
    }

    public void addTrackingListener(TrackingListener listener) {
        trackingListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void addTrackingStateListener(TrackingStateListener listener) {
        stateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void attach(Node node) {
        if (this.node != null) {
            throw new IllegalStateException(this + " is already attached to " + this.node);
        }
        this.node = Objects.requireNonNull(node, "node");
        node.setSmoothSpeed(settings.smoothSpeed());
        if (pose != null) {
            follow(pose, false);
        }
    }

    /**
     * @return the node, or null before attachment
     */
    public Node getNode() {
        return node;
    }

    /**
     * @return the last tracked pose, null if none
     */
    public Pose getPose() {
        return pose;
    }

    public PlacementSettings getSettings() {
        return settings;
    }

    /**
     * @return the tracking state of what the node follows, null if it follows nothing
     */
    public TrackingState getTrackingState() {
        return trackingState;
    }

    public boolean isKeepPosition() {
        return keepPosition;
    }

    public boolean isKeepRotation() {
        return keepRotation;
    }

    public boolean isTracking() {
        return pose != null;
    }

    /**
     * @return true if nothing is followed, or its tracking state is a visible state
     */
    @Override
    public boolean isVisible() {
        return trackingState == null || settings.visibleTrackingStates().contains(trackingState);
    }

    public void removeTrackingListener(TrackingListener listener) {
        trackingListeners.remove(listener);
    }

    public void removeTrackingStateListener(TrackingStateListener listener) {
        stateListeners.remove(listener);
    }

    /**
     * @param keepPosition - if true, tracked poses leave the node's position unchanged
     */
    public void setKeepPosition(boolean keepPosition) {
        this.keepPosition = keepPosition;
    }

    /**
     * @param keepRotation - if true, tracked poses leave the node's rotation unchanged
     */
    public void setKeepRotation(boolean keepRotation) {
        this.keepRotation = keepRotation;
    }

    /**
     * Assign the tracked pose. Nothing happens unless the position or the rotation differs from the current pose.
     * Otherwise a non null pose moves the node, and the tracking listeners are notified.
     */
    public void setPose(Pose pose) {
        if (Pose.samePosition(this.pose, pose) && Pose.sameRotation(this.pose, pose)) {
            return;
        }
        this.pose = pose;
        if (pose != null && node != null) {
            follow(pose, settings.smoothPose());
        }
        for (var listener : trackingListeners) {
            listener.onTrackingChanged(node, pose != null, pose);
        }
    }

    public void setSettings(PlacementSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        if (node != null) {
            node.setSmoothSpeed(settings.smoothSpeed());
            node.updateVisibility();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + trackingState + ", " + pose + "]";
    }

    /**
     * Record a new tracking state, updating the node's visibility and notifying the listeners if it changed
     */
    protected void updateTrackingState(TrackingState state) {
        if (state == trackingState) {
            return;
        }
        log.debug("{} tracking state {} -> {}", node, trackingState, state);
        trackingState = state;
        if (node != null) {
            node.updateVisibility();
        }
        for (var listener : stateListeners) {
            listener.onTrackingStateChanged(node, state);
        }
    }

    private void follow(Pose pose, boolean smooth) {
        var current = node.getTransform();
        var target = current.withPosition(keepPosition ? current.position() : pose.position())
                            .withRotation(keepRotation ? current.rotation() : pose.rotation());
        node.driveTransform(this, target, smooth);
    }
}
