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

import java.util.Collection;
import java.util.List;

/**
 * A snapshot of the tracking state produced by {@link TrackingSession#update()}
 *
 * @author hal.hildebrand
 */
public interface Frame {

    Camera getCamera();

    /**
     * @return the capture time of the camera image, in nanoseconds
     */
    long getTimestamp();

    /**
     * @return the anchors whose state changed in this frame
     */
    Collection<Anchor> getUpdatedAnchors();

    /**
     * @return the trackables whose state changed in this frame
     */
    Collection<? extends Trackable> getUpdatedTrackables();

    /**
     * Cast a ray from the screen point into the tracked scene
     *
     * @param x - the screen x, in pixels
     * @param y - the screen y, in pixels, growing downward
     * @return the intersections, closest first
     */
    List<HitResult> hitTest(float x, float y);

    /**
     * Cast an instant placement ray. Always produces a result while the camera is tracking.
     *
     * @param approximateDistance - the distance hint, in meters
     * @return the intersections, the instant placement point last
     */
    List<HitResult> hitTestInstantPlacement(float x, float y, float approximateDistance);
}
