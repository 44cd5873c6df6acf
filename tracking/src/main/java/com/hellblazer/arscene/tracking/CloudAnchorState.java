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
 * State of a cloud anchor host or resolve task
 *
 * @author hal.hildebrand
 */
public enum CloudAnchorState implements AnchorTaskState {
    /** No task was issued */
    NONE,
    TASK_IN_PROGRESS,
    SUCCESS,
    ERROR_INTERNAL,
    ERROR_NOT_AUTHORIZED,
    ERROR_RESOURCE_EXHAUSTED,
    ERROR_HOSTING_DATASET_PROCESSING_FAILED,
    ERROR_CLOUD_ID_NOT_FOUND,
    ERROR_RESOLVING_SDK_VERSION_TOO_OLD,
    ERROR_RESOLVING_SDK_VERSION_TOO_NEW,
    ERROR_HOSTING_SERVICE_UNAVAILABLE;

    @Override
    public boolean isError() {
        return name().startsWith("ERROR_");
    }

    @Override
    public boolean isInProgress() {
        return this == TASK_IN_PROGRESS;
    }

    @Override
    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
