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
package com.hellblazer.arscene.tracking;

import com.hellblazer.arscene.geometry.Pose;

/**
 * One intersection of a hit test ray with the tracked scene. Valid only for the frame that produced it, except when
 * retained as the last known tracking hit.
 *
 * @author hal.hildebrand
 */
public interface HitResult {

    /**
     * Pin an anchor at the hit pose on the hit trackable
     *
     * @see Trackable#createAnchor(Pose)
     */
    default Anchor createAnchor() {
        return getTrackable().createAnchor(getHitPose());
    }

    /**
     * @return the distance from the camera to the hit, in meters
     */
    float getDistance();

    Pose getHitPose();

    Trackable getTrackable();

    /**
     * @return true if the hit trackable is currently tracking
     */
    default boolean isTracking() {
        return getTrackable().getTrackingState() == TrackingState.TRACKING;
    }
}
