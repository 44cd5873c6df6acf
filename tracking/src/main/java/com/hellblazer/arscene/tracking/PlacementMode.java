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

import java.util.EnumSet;
import java.util.Set;

import com.hellblazer.arscene.tracking.SessionConfig.DepthMode;
import com.hellblazer.arscene.tracking.SessionConfig.InstantPlacementMode;
import com.hellblazer.arscene.tracking.SessionConfig.PlaneFindingMode;

/**
 * Which kinds of hit results may position a node, and the session features that implies
 *
 * @author hal.hildebrand
 */
public enum PlacementMode {
    /** No placement */
    DISABLED,
    /** Horizontal planes only */
    PLANE_HORIZONTAL,
    /** Vertical planes only */
    PLANE_VERTICAL,
    PLANE_HORIZONTAL_AND_VERTICAL,
    /**
     * Any surface sampled by the depth map. Devices without depth support fall back to plane placement.
     */
    DEPTH,
    /**
     * Immediate placement at an approximate distance with +Y up. The orientation is not aligned to the surface.
     */
    INSTANT,
    /**
     * Place instantly, then refine with planes and depth as they become available
     */
    BEST_AVAILABLE;

    /**
     * @return the config with the features required by this mode switched on. Features are never switched off, since
     *         other nodes may share the session; {@link #planeTypes()} restricts which planes this mode accepts.
     */
    public SessionConfig applyTo(SessionConfig config) {
        var result = config.withPlaneFindingMode(config.planeFindingMode().union(planeFindingMode()));
        if (isDepthEnabled() && !result.isDepthEnabled()) {
            result = result.withDepthMode(DepthMode.AUTOMATIC);
        }
        if (isInstantPlacementEnabled() && !result.isInstantPlacementEnabled()) {
            result = result.withInstantPlacementMode(InstantPlacementMode.LOCAL_Y_UP);
        }
        return result;
    }

    public boolean isDepthEnabled() {
        return switch (this) {
        case DEPTH, BEST_AVAILABLE -> true;
        default -> false;
        };
    }

    public boolean isInstantPlacementEnabled() {
        return this == INSTANT || this == BEST_AVAILABLE;
    }

    public boolean isPlaneEnabled() {
        return planeFindingMode() != PlaneFindingMode.DISABLED;
    }

    /**
     * @return the plane types whose hits this mode accepts
     */
    public Set<Plane.Type> planeTypes() {
        return switch (this) {
        case PLANE_HORIZONTAL -> EnumSet.of(Plane.Type.HORIZONTAL_UPWARD_FACING,
                                            Plane.Type.HORIZONTAL_DOWNWARD_FACING);
        case PLANE_VERTICAL -> EnumSet.of(Plane.Type.VERTICAL);
        case PLANE_HORIZONTAL_AND_VERTICAL, BEST_AVAILABLE -> EnumSet.allOf(Plane.Type.class);
        default -> EnumSet.noneOf(Plane.Type.class);
        };
    }

    public PlaneFindingMode planeFindingMode() {
        return switch (this) {
        case PLANE_HORIZONTAL -> PlaneFindingMode.HORIZONTAL;
        case PLANE_VERTICAL -> PlaneFindingMode.VERTICAL;
        case PLANE_HORIZONTAL_AND_VERTICAL, BEST_AVAILABLE -> PlaneFindingMode.HORIZONTAL_AND_VERTICAL;
        default -> PlaneFindingMode.DISABLED;
        };
    }
}
