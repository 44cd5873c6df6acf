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
package com.hellblazer.arscene.scene.tracking;

/**
 * Why an anchor could not be created
 *
 * @author hal.hildebrand
 */
public enum AnchorFailure {
    /** No trackable, pose or hit result to anchor to */
    NO_POSE_SOURCE,
    /** The trackable is not tracking */
    NOT_TRACKING,
    /** Too many anchors are held */
    RESOURCE_EXHAUSTED,
    SESSION_PAUSED,
    /** The trackable cannot host anchors */
    UNSUPPORTED;
}
