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

import java.util.Objects;

/**
 * Immutable set of session feature modes
 *
 * @author hal.hildebrand
 */
public record SessionConfig(PlaneFindingMode planeFindingMode, DepthMode depthMode,
                            InstantPlacementMode instantPlacementMode, LightEstimationMode lightEstimationMode,
                            CloudAnchorMode cloudAnchorMode, GeospatialMode geospatialMode) {

    public enum CloudAnchorMode {
        DISABLED, ENABLED;
    }

    public enum DepthMode {
        AUTOMATIC, DISABLED, RAW_DEPTH_ONLY;
    }

    public enum GeospatialMode {
        DISABLED, ENABLED;
    }

    public enum InstantPlacementMode {
        DISABLED, LOCAL_Y_UP;
    }

    public enum LightEstimationMode {
        AMBIENT_INTENSITY, DISABLED, ENVIRONMENTAL_HDR;
    }

    public enum PlaneFindingMode {
        DISABLED, HORIZONTAL, HORIZONTAL_AND_VERTICAL, VERTICAL;

        public boolean includesHorizontal() {
            return this == HORIZONTAL || this == HORIZONTAL_AND_VERTICAL;
        }

        public boolean includesVertical() {
            return this == VERTICAL || this == HORIZONTAL_AND_VERTICAL;
        }

        /**
         * @return the mode finding every orientation found by either mode
         */
        public PlaneFindingMode union(PlaneFindingMode other) {
            var horizontal = includesHorizontal() || other.includesHorizontal();
            var vertical = includesVertical() || other.includesVertical();
            if (horizontal && vertical) {
                return HORIZONTAL_AND_VERTICAL;
            }
            if (horizontal) {
                return HORIZONTAL;
            }
            return vertical ? VERTICAL : DISABLED;
        }
    }

    /**
     * @return horizontal plane finding with ambient light estimation, everything else disabled
     */
    public static SessionConfig defaults() {
        return new SessionConfig(PlaneFindingMode.HORIZONTAL, DepthMode.DISABLED, InstantPlacementMode.DISABLED,
                                 LightEstimationMode.AMBIENT_INTENSITY, CloudAnchorMode.DISABLED,
                                 GeospatialMode.DISABLED);
    }

    public SessionConfig {
        Objects.requireNonNull(planeFindingMode, "planeFindingMode");
        Objects.requireNonNull(depthMode, "depthMode");
        Objects.requireNonNull(instantPlacementMode, "instantPlacementMode");
        Objects.requireNonNull(lightEstimationMode, "lightEstimationMode");
        Objects.requireNonNull(cloudAnchorMode, "cloudAnchorMode");
        Objects.requireNonNull(geospatialMode, "geospatialMode");
    }

    public boolean isDepthEnabled() {
        return depthMode != DepthMode.DISABLED;
    }

    public boolean isInstantPlacementEnabled() {
        return instantPlacementMode != InstantPlacementMode.DISABLED;
    }

    public boolean isPlaneFindingEnabled() {
        return planeFindingMode != PlaneFindingMode.DISABLED;
    }

    public SessionConfig withCloudAnchorMode(CloudAnchorMode mode) {
        return new SessionConfig(planeFindingMode, depthMode, instantPlacementMode, lightEstimationMode, mode,
                                 geospatialMode);
    }

    public SessionConfig withDepthMode(DepthMode mode) {
        return new SessionConfig(planeFindingMode, mode, instantPlacementMode, lightEstimationMode, cloudAnchorMode,
                                 geospatialMode);
    }

    public SessionConfig withGeospatialMode(GeospatialMode mode) {
        return new SessionConfig(planeFindingMode, depthMode, instantPlacementMode, lightEstimationMode,
                                 cloudAnchorMode, mode);
    }

    public SessionConfig withInstantPlacementMode(InstantPlacementMode mode) {
        return new SessionConfig(planeFindingMode, depthMode, mode, lightEstimationMode, cloudAnchorMode,
                                 geospatialMode);
    }

    public SessionConfig withLightEstimationMode(LightEstimationMode mode) {
        return new SessionConfig(planeFindingMode, depthMode, instantPlacementMode, mode, cloudAnchorMode,
                                 geospatialMode);
    }

    public SessionConfig withPlaneFindingMode(PlaneFindingMode mode) {
        return new SessionConfig(mode, depthMode, instantPlacementMode, lightEstimationMode, cloudAnchorMode,
                                 geospatialMode);
    }
}
