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
 * Frame counter and frame interval tracking, driven by the camera image timestamps
 *
 * @author hal.hildebrand
 */
public class FrameClock {
    private long frameCounter;
    private long firstTimestampNanos;
    private long lastTimestampNanos;

    /**
     * Get the current frame number
     *
     * @return the count of frames ticked
     */
    public long getCurrentFrame() {
        return frameCounter;
    }

    /**
     * Calculate the average frames per second (FPS) since the first frame
     *
     * @return average FPS, or 0.0 if no time has elapsed
     */
    public double getAverageFPS() {
        if (frameCounter < 2 || lastTimestampNanos == firstTimestampNanos) {
            return 0.0;
        }
        return (frameCounter - 1) / ((lastTimestampNanos - firstTimestampNanos) / 1_000_000_000.0);
    }

    /**
     * Reset the frame counter to 0
     */
    public void reset() {
        frameCounter = 0L;
        firstTimestampNanos = 0L;
        lastTimestampNanos = 0L;
    }

    /**
     * Advance to the frame captured at the timestamp. A timestamp that does not advance yields a zero interval.
     *
     * @param timestampNanos - the camera image timestamp
     * @return the timing of the new frame
     */
    public FrameTime tick(long timestampNanos) {
        var delta = 0L;
        if (frameCounter == 0) {
            firstTimestampNanos = timestampNanos;
        } else {
            delta = Math.max(0L, timestampNanos - lastTimestampNanos);
        }
        frameCounter++;
        lastTimestampNanos = Math.max(lastTimestampNanos, timestampNanos);
        return new FrameTime(frameCounter, timestampNanos, delta);
    }

    /**
     * Get a string representation of the current frame clock state
     *
     * @return string containing frame count and average FPS
     */
    @Override
    public String toString() {
        return String.format("FrameClock[frame=%d, avgFPS=%.2f]", frameCounter, getAverageFPS());
    }
}
