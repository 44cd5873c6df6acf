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
import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.AnchorTaskState;

/**
 * Completion of a cloud, terrain or rooftop anchor task. Called at most once per task, never for a cancelled task.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface AnchorTaskListener {

    /**
     * @param anchor - the node's anchor after completion; for a successful resolve, the resolved anchor
     * @param state  - the terminal state of the task
     */
    void onTaskCompleted(Node node, Anchor anchor, AnchorTaskState state);
}
