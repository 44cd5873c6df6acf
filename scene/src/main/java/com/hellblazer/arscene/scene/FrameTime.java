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

/**
 * Timing of one tracking frame
 *
 * @param frameNumber    - the frame count since the clock started, from 1
 * @param timestampNanos - the camera image timestamp
 * @param deltaNanos     - the time since the previous frame, 0 for the first frame
 * @author hal.hildebrand
 */
public record FrameTime(long frameNumber, long timestampNanos, long deltaNanos) {

    public double deltaSeconds() {
        return deltaNanos / 1_000_000_000.0;
    }

    /**
     * @return the seconds elapsed since the timestamp
     */
    public double secondsSince(long earlierTimestampNanos) {
        return (timestampNanos - earlierTimestampNanos) / 1_000_000_000.0;
    }
}
