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

import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.tracking.HitResult;

/**
 * Receives every placement hit test outcome, tracking or not
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface HitResultListener {

    /**
     * @param hitResult - the selected result, null when nothing usable was hit
     */
    void onHitResult(Node node, HitResult hitResult);
}
