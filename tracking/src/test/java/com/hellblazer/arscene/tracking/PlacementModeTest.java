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

import com.hellblazer.arscene.tracking.SessionConfig.DepthMode;
import com.hellblazer.arscene.tracking.SessionConfig.InstantPlacementMode;
import com.hellblazer.arscene.tracking.SessionConfig.PlaneFindingMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PlacementModeTest {

    @Test
    void testFeatureFlags() {
        assertFalse(PlacementMode.DISABLED.isPlaneEnabled());
        assertFalse(PlacementMode.DISABLED.isDepthEnabled());
        assertFalse(PlacementMode.DISABLED.isInstantPlacementEnabled());

        assertEquals(PlaneFindingMode.HORIZONTAL, PlacementMode.PLANE_HORIZONTAL.planeFindingMode());
        assertEquals(PlaneFindingMode.VERTICAL, PlacementMode.PLANE_VERTICAL.planeFindingMode());
        assertFalse(PlacementMode.PLANE_HORIZONTAL_AND_VERTICAL.isInstantPlacementEnabled());

        assertTrue(PlacementMode.DEPTH.isDepthEnabled());
        assertFalse(PlacementMode.DEPTH.isPlaneEnabled());

        assertTrue(PlacementMode.INSTANT.isInstantPlacementEnabled());
        assertFalse(PlacementMode.INSTANT.isPlaneEnabled());

        assertTrue(PlacementMode.BEST_AVAILABLE.isPlaneEnabled());
        assertTrue(PlacementMode.BEST_AVAILABLE.isDepthEnabled());
        assertTrue(PlacementMode.BEST_AVAILABLE.isInstantPlacementEnabled());
    }

    @Test
    void testApplyNeverDisables() {
        var config = SessionConfig.defaults()
                                  .withPlaneFindingMode(PlaneFindingMode.VERTICAL)
                                  .withDepthMode(DepthMode.RAW_DEPTH_ONLY);
        var applied = PlacementMode.PLANE_HORIZONTAL.applyTo(config);
        assertEquals(PlaneFindingMode.HORIZONTAL_AND_VERTICAL, applied.planeFindingMode());
        assertEquals(DepthMode.RAW_DEPTH_ONLY, applied.depthMode());
        assertEquals(InstantPlacementMode.DISABLED, applied.instantPlacementMode());

        assertEquals(config, PlacementMode.DISABLED.applyTo(config));
        assertEquals(InstantPlacementMode.LOCAL_Y_UP,
                     PlacementMode.INSTANT.applyTo(config).instantPlacementMode());
    }

    @Test
    void testPlaneTypes() {
        assertEquals(EnumSet.of(Plane.Type.VERTICAL), PlacementMode.PLANE_VERTICAL.planeTypes());
        assertFalse(PlacementMode.PLANE_HORIZONTAL.planeTypes().contains(Plane.Type.VERTICAL));
        assertTrue(PlacementMode.PLANE_HORIZONTAL.planeTypes().contains(Plane.Type.HORIZONTAL_UPWARD_FACING));
        assertEquals(EnumSet.allOf(Plane.Type.class), PlacementMode.BEST_AVAILABLE.planeTypes());
        assertTrue(PlacementMode.DEPTH.planeTypes().isEmpty());
        assertTrue(PlacementMode.INSTANT.planeTypes().isEmpty());
    }

    @Test
    void testPlaneFindingUnion() {
        assertEquals(PlaneFindingMode.DISABLED, PlaneFindingMode.DISABLED.union(PlaneFindingMode.DISABLED));
        assertEquals(PlaneFindingMode.VERTICAL, PlaneFindingMode.DISABLED.union(PlaneFindingMode.VERTICAL));
        assertEquals(PlaneFindingMode.HORIZONTAL_AND_VERTICAL,
                     PlaneFindingMode.VERTICAL.union(PlaneFindingMode.HORIZONTAL));
    }
}
