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
 * The tracking subsystem's session. Implemented by a device binding; consumed through {@link SessionController}.
 *
 * @author hal.hildebrand
 */
public interface TrackingSession {

    enum CameraFacing {
        BACK, FRONT;
    }

    enum FeatureMapQuality {
        GOOD, INSUFFICIENT, SUFFICIENT;
    }

    void close();

    void configure(SessionConfig config);

    /**
     * Create an anchor at a world pose, attached to no trackable
     */
    Anchor createAnchor(Pose pose);

    /**
     * @return the estimated quality of the visual features seen from the pose in the last few seconds
     */
    FeatureMapQuality estimateFeatureMapQualityForHosting(Pose pose);

    CameraFacing getCameraFacing();

    /**
     * @return the geospatial localization, or null when geospatial mode is disabled
     */
    Earth getEarth();

    /**
     * Host the anchor's pose with the cloud anchor service
     *
     * @param ttlDays - the lifetime of the hosted anchor, in days
     */
    AnchorFuture<HostResult> hostCloudAnchorAsync(Anchor anchor, int ttlDays);

    boolean isDepthModeSupported(SessionConfig.DepthMode mode);

    void pause();

    AnchorFuture<ResolveResult<CloudAnchorState>> resolveCloudAnchorAsync(String cloudAnchorId);

    /**
     * @throws CameraNotAvailableException if the camera cannot be opened
     */
    void resume();

    /**
     * @param rotation - the display rotation, in quarter turns
     * @param width    - the viewport width, in pixels
     * @param height   - the viewport height, in pixels
     */
    void setDisplayGeometry(int rotation, int width, int height);

    /**
     * Advance to the latest camera image
     *
     * @return the new frame
     * @throws CameraNotAvailableException if the camera was lost
     * @throws FatalTrackingException      if the session cannot continue
     */
    Frame update();
}
