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

import com.hellblazer.arscene.tracking.Frame;
import com.hellblazer.arscene.tracking.SessionController;

/**
 * Everything a node's frame update may consult: the session that produced the frame, the frame and its timing
 *
 * @author hal.hildebrand
 */
public record FrameContext(SessionController session, Frame frame, FrameTime time) {
}
