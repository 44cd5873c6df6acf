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

import javax.vecmath.Quat4f;

/**
 * Geospatial localization of the session. Only available while geospatial mode is enabled.
 *
 * @author hal.hildebrand
 */
public interface Earth {

    enum EarthState {
        ENABLED, ERROR_APK_VERSION_TOO_OLD, ERROR_GEOSPATIAL_MODE_DISABLED, ERROR_INTERNAL, ERROR_NOT_AUTHORIZED,
        ERROR_RESOURCE_EXHAUSTED;
    }

    EarthState getEarthState();

    TrackingState getTrackingState();

    /**
     * Resolve an anchor at an altitude above the rooftop, or the terrain where there is no building
     *
     * @param eusRotation - the rotation in the east-up-south frame
     */
    AnchorFuture<ResolveResult<GeospatialAnchorState>> resolveAnchorOnRooftopAsync(double latitude, double longitude,
                                                                                  double altitudeAboveRooftop,
                                                                                  Quat4f eusRotation);

    /**
     * Resolve an anchor at an altitude above the terrain
     *
     * @param eusRotation - the rotation in the east-up-south frame
     */
    AnchorFuture<ResolveResult<GeospatialAnchorState>> resolveAnchorOnTerrainAsync(double latitude, double longitude,
                                                                                  double altitudeAboveTerrain,
                                                                                  Quat4f eusRotation);
}
