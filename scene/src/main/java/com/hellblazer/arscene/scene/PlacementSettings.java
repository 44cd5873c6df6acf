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
package com.hellblazer.arscene.scene;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Placement and smoothing constants
 *
 * @param maxHitTestsPerSecond     - the upper bound of placement hit tests, in hit tests per second
 * @param smoothSpeed              - the smoothing interpolation factor, per second. The fraction of the remaining
 *                                 distance covered in a frame is the frame interval in seconds times this speed,
 *                                 clamped to 1.
 * @param smoothPose               - whether tracked poses move nodes by smoothing rather than instantly
 * @param anchorPoseUpdateInterval - the minimum interval between anchor pose refreshes. ZERO refreshes on every frame,
 *                                 null never refreshes.
 * @param anchorOnNonTrackingHit   - whether a hit result that is not tracking may seed an anchor when no tracking
 *                                 hit result is known
 * @param visibleTrackingStates    - the tracking states in which tracked nodes are visible
 * @author hal.hildebrand
 */
public record PlacementSettings(int maxHitTestsPerSecond, float smoothSpeed, boolean smoothPose,
                                Duration anchorPoseUpdateInterval, boolean anchorOnNonTrackingHit,
                                Set<TrackingState> visibleTrackingStates) {

    public static final int      DEFAULT_MAX_HIT_TESTS_PER_SECOND = 30;
    public static final float    DEFAULT_SMOOTH_SPEED             = 5.0f;
    public static final Duration DEFAULT_ANCHOR_POSE_INTERVAL     = Duration.ZERO;

    private static final PlacementSettings DEFAULTS = new PlacementSettings(DEFAULT_MAX_HIT_TESTS_PER_SECOND,
                                                                            DEFAULT_SMOOTH_SPEED, true,
                                                                            DEFAULT_ANCHOR_POSE_INTERVAL, false,
                                                                            EnumSet.of(TrackingState.TRACKING));

    public static PlacementSettings defaults() {
        return DEFAULTS;
    }

    public PlacementSettings {
        if (maxHitTestsPerSecond <= 0) {
            throw new IllegalArgumentException("maxHitTestsPerSecond must be positive: " + maxHitTestsPerSecond);
        }
        if (!(smoothSpeed > 0f)) {
            throw new IllegalArgumentException("smoothSpeed must be positive: " + smoothSpeed);
        }
        if (anchorPoseUpdateInterval != null && anchorPoseUpdateInterval.isNegative()) {
            throw new IllegalArgumentException("anchorPoseUpdateInterval is negative: " + anchorPoseUpdateInterval);
        }
        visibleTrackingStates = Set.copyOf(Objects.requireNonNull(visibleTrackingStates, "visibleTrackingStates"));
    }

    /**
     * @return the minimum interval between two placement hit tests, in nanoseconds
     */
    public long hitTestIntervalNanos() {
        return (long) (1_000_000_000.0 / maxHitTestsPerSecond);
    }

    public PlacementSettings withAnchorOnNonTrackingHit(boolean anchor) {
        return new PlacementSettings(maxHitTestsPerSecond, smoothSpeed, smoothPose, anchorPoseUpdateInterval, anchor,
                                     visibleTrackingStates);
    }

    public PlacementSettings withAnchorPoseUpdateInterval(Duration interval) {
        return new PlacementSettings(maxHitTestsPerSecond, smoothSpeed, smoothPose, interval, anchorOnNonTrackingHit,
                                     visibleTrackingStates);
    }

    public PlacementSettings withMaxHitTestsPerSecond(int max) {
        return new PlacementSettings(max, smoothSpeed, smoothPose, anchorPoseUpdateInterval, anchorOnNonTrackingHit,
                                     visibleTrackingStates);
    }

    public PlacementSettings withSmoothPose(boolean smooth) {
        return new PlacementSettings(maxHitTestsPerSecond, smoothSpeed, smooth, anchorPoseUpdateInterval,
                                     anchorOnNonTrackingHit, visibleTrackingStates);
    }

    public PlacementSettings withSmoothSpeed(float speed) {
        return new PlacementSettings(maxHitTestsPerSecond, speed, smoothPose, anchorPoseUpdateInterval,
                                     anchorOnNonTrackingHit, visibleTrackingStates);
    }

    public PlacementSettings withVisibleTrackingStates(Set<TrackingState> states) {
        return new PlacementSettings(maxHitTestsPerSecond, smoothSpeed, smoothPose, anchorPoseUpdateInterval,
                                     anchorOnNonTrackingHit, states);
    }
}
