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

/**
 * Handle on an asynchronous anchor task. Completion is observed by polling once per frame.
 *
 * @param <R> the result type
 * @author hal.hildebrand
 */
public interface AnchorFuture<R> {

    enum State {
        CANCELLED, DONE, PENDING;
    }

    /**
     * Cancel the task. Its result is dropped.
     *
     * @return true if the task was pending and is now cancelled
     */
    boolean cancel();

    /**
     * @return the result, or null unless the state is {@link State#DONE}
     */
    R getResult();

    State getState();
}
