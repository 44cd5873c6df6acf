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
 * A detected planar surface. The centre pose's +Y axis is the plane normal.
 *
 * @author hal.hildebrand
 */
public interface Plane extends Trackable {

    enum Type {
        HORIZONTAL_DOWNWARD_FACING, HORIZONTAL_UPWARD_FACING, VERTICAL;
    }

    Pose getCenterPose();

    @Override
    default Pose getPose() {
        return getCenterPose();
    }

    Type getType();

    /**
     * @return true if the pose's position, projected on the plane, lies within the plane's boundary polygon
     */
    boolean isPoseInPolygon(Pose pose);
}
