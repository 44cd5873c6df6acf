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

import com.hellblazer.arscene.scene.FrameContext;
import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.scene.TrackingBehavior;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Drives a node from the device camera. The node's transform is the display oriented camera pose of each frame and
 * cannot be written from outside.
 *
 * @author hal.hildebrand
 */
public class CameraBehavior implements TrackingBehavior {
    private Node          node;
    private TrackingState trackingState = TrackingState.STOPPED;

    @Override
    public void attach(Node node) {
        if (this.node != null) {
            throw new IllegalStateException(this + " is already attached to " + this.node);
        }
        this.node = node;
    }

    @Override
    public boolean drivesTransform() {
        return true;
    }

    /**
     * @return the camera tracking state of the last frame
     */
    public TrackingState getTrackingState() {
        return trackingState;
    }

    @Override
    public void onFrame(Node node, FrameContext context) {
        var camera = context.frame().getCamera();
        trackingState = camera.getTrackingState();
        var pose = camera.getDisplayOrientedPose();
        if (pose != null) {
            node.driveTransform(this, node.getTransform().withPosition(pose.position()).withRotation(pose.rotation()),
                                false);
        }
    }

    @Override
    public String toString() {
        return "CameraBehavior[" + trackingState + "]";
    }
}
