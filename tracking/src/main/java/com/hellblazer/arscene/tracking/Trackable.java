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

import com.hellblazer.arscene.geometry.Pose;

/**
 * A real-world surface or feature detected and owned by the tracking subsystem. Nodes hold non-owning references.
 *
 * @author hal.hildebrand
 */
public interface Trackable {

    /**
     * Pin an anchor to this trackable
     *
     * @param pose - the world pose of the new anchor
     * @return the anchor, attached to this trackable
     * @throws NotTrackingException       if this trackable is not tracking
     * @throws SessionPausedException     if the session is paused
     * @throws ResourceExhaustedException if the anchor limit is reached
     * @throws IllegalStateException      if this kind of trackable cannot host anchors
     */
    Anchor createAnchor(Pose pose);

    /**
     * @return the anchors attached to this trackable
     */
    Collection<Anchor> getAnchors();

    /**
     * @return the centre pose of the trackable, or null if none is known yet
     */
    Pose getPose();

    TrackingState getTrackingState();
}
