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
 * The tracking capability of a node, chosen when the node is constructed. A behavior belongs to a single node.
 *
 * @author hal.hildebrand
 */
public interface TrackingBehavior {

    /**
     * The behavior of nodes that are not tracked. Shared and stateless.
     */
    TrackingBehavior NONE = new TrackingBehavior() {
        @Override
        public void attach(Node node) {
        }

        @Override
        public void onFrame(Node node, FrameContext context) {
        }

        @Override
        public String toString() {
            return "none";
        }
    };

    static TrackingBehavior none() {
        return NONE;
    }

    /**
     * Called once, by the node's constructor
     *
     * @throws IllegalStateException if already attached to a node
     */
    void attach(Node node);

    /**
     * @return true if the behavior owns the node's transform, which then cannot be written from outside
     */
    default boolean drivesTransform() {
        return false;
    }

    /**
     * @return the behavior's contribution to the node's visibility
     */
    default boolean isVisible() {
        return true;
    }

    /**
     * Release whatever the behavior holds. Called when the node is destroyed.
     */
    default void onDestroy(Node node) {
    }

    /**
     * Update from the frame. Called once per frame, before the node's smoothing and before its children.
     */
    void onFrame(Node node, FrameContext context);
}
