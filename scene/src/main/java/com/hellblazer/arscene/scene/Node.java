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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;
import javax.vecmath.Tuple3f;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.geometry.Transform;

/**
 * A node of the scene graph: a local transform relative to its parent, a visibility, children and the
 * {@link TrackingBehavior} chosen at construction.
 * <p>
 * Nodes are updated on the thread driving the frames. Within a frame the behavior runs first, then smoothing, then the
 * children, so a child always sees the finalized transform of its parent.
 *
 * @author hal.hildebrand
 */
public class Node {
    /**
     * Smoothing snaps to its target once every component is within this distance
     */
    public static final float SMOOTH_EPSILON = 1e-4f;

    private static final Logger log = LoggerFactory.getLogger(Node.class);

    private boolean                  baseVisible = true;
    private final TrackingBehavior   behavior;
    private final List<Node>         children    = new CopyOnWriteArrayList<>();
    private boolean                  destroyed;
    private final List<NodeListener> listeners   = new CopyOnWriteArrayList<>();
    private final String             name;
    private Node                     parent;
    private float                    smoothSpeed = PlacementSettings.DEFAULT_SMOOTH_SPEED;
    private Transform                smoothTarget;
    private Transform                transform   = Transform.IDENTITY;
    private boolean                  visible;

    public Node(String name) {
        this(name, TrackingBehavior.none());
    }

    public Node(String name, TrackingBehavior behavior) {
        this.name = Objects.requireNonNull(name, "name");
        this.behavior = Objects.requireNonNull(behavior, "behavior");
        behavior.attach(this);
        visible = baseVisible && behavior.isVisible();
    }

    /**
     * Add the child, removing it from its previous parent
     *
     * @throws IllegalArgumentException if the child is this node or one of its ancestors
     */
    public void addChild(Node child) {
        Objects.requireNonNull(child, "child");
        for (var ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Adding " + child + " to " + this + " would create a cycle");
            }
        }
        if (child.parent == this) {
            return;
        }
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
        children.add(child);
        child.parent = this;
    }

    public void addListener(NodeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Release the behavior's resources, destroy the children and leave the parent
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        behavior.onDestroy(this);
        for (var child : children) {
            child.destroy();
        }
        if (parent != null) {
            parent.removeChild(this);
        }
        smoothTarget = null;
        log.debug("Destroyed {}", this);
    }

    /**
     * Set the transform on behalf of the node's behavior
     *
     * @param source - the behavior writing the transform; must be this node's
     * @param target - the new local transform
     * @param smooth - whether to move there by smoothing
     */
    public void driveTransform(TrackingBehavior source, Transform target, boolean smooth) {
        if (source != behavior) {
            throw new IllegalStateException(source + " does not drive " + this);
        }
        if (smooth) {
            smooth(target);
        } else {
            apply(target);
        }
    }

    public TrackingBehavior getBehavior() {
        return behavior;
    }

    /**
     * @param <T> the behavior type
     * @return the behavior, if it is of the type
     */
    public <T extends TrackingBehavior> Optional<T> getBehavior(Class<T> type) {
        return type.isInstance(behavior) ? Optional.of(type.cast(behavior)) : Optional.empty();
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public String getName() {
        return name;
    }

    public Node getParent() {
        return parent;
    }

    public float getSmoothSpeed() {
        return smoothSpeed;
    }

    /**
     * @return the transform smoothing is moving toward, if any
     */
    public Optional<Transform> getSmoothTarget() {
        return Optional.ofNullable(smoothTarget);
    }

    /**
     * @return the local transform, relative to the parent
     */
    public Transform getTransform() {
        return transform;
    }

    /**
     * @return the product of every ancestor's transform and this node's local transform
     */
    public Matrix4f getWorldMatrix() {
        var local = transform.toMatrix();
        if (parent == null) {
            return local;
        }
        var world = parent.getWorldMatrix();
        world.mul(local);
        return world;
    }

    public Point3f getWorldPosition() {
        return localToWorld(new Point3f());
    }

    public boolean isBaseVisible() {
        return baseVisible;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * @return true if the node's own visibility and its behavior's both allow it to be seen
     */
    public boolean isVisible() {
        return visible;
    }

    /**
     * Convert a point in this node's space to world space
     */
    public Point3f localToWorld(Tuple3f point) {
        var result = new Point3f(point);
        getWorldMatrix().transform(result);
        return result;
    }

    /**
     * Update for the frame: the behavior first, then smoothing
     */
    public void onFrame(FrameContext context) {
        if (destroyed) {
            return;
        }
        behavior.onFrame(this, context);
        smoothStep(context.time().deltaSeconds());
    }

    public void removeChild(Node child) {
        if (children.remove(child)) {
            child.parent = null;
        }
    }

    public void removeListener(NodeListener listener) {
        listeners.remove(listener);
    }

    public void setSmoothSpeed(float smoothSpeed) {
        if (!(smoothSpeed > 0f)) {
            throw new IllegalArgumentException("smoothSpeed must be positive: " + smoothSpeed);
        }
        this.smoothSpeed = smoothSpeed;
    }

    /**
     * Set the local transform, cancelling any smoothing
     *
     * @throws UnsupportedOperationException if the behavior drives the transform
     */
    public void setTransform(Transform transform) {
        requireWritable();
        apply(Objects.requireNonNull(transform, "transform"));
    }

    public void setVisible(boolean baseVisible) {
        this.baseVisible = baseVisible;
        updateVisibility();
    }

    /**
     * Move toward the target on the following frames. The fraction of the remaining distance covered per frame is the
     * frame interval in seconds times the smooth speed, clamped to 1.
     */
    public void smooth(Transform target) {
        smoothTarget = Objects.requireNonNull(target, "target");
    }

    @Override
    public String toString() {
        return "Node[" + name + ", " + behavior + "]";
    }

    /**
     * Set position and rotation, keeping the scale
     *
     * @throws UnsupportedOperationException if the behavior drives the transform
     */
    public void transform(Tuple3f position, Quat4f rotation, boolean smooth) {
        requireWritable();
        var target = transform.withPosition(position).withRotation(rotation);
        if (smooth) {
            smooth(target);
        } else {
            apply(target);
        }
    }

    /**
     * Recompute the visibility, notifying the listeners if it changed
     */
    public void updateVisibility() {
        var now = baseVisible && behavior.isVisible();
        if (now == visible) {
            return;
        }
        visible = now;
        for (var listener : listeners) {
            listener.onVisibilityChanged(this, now);
        }
    }

    /**
     * Convert a point in world space to this node's space
     */
    public Point3f worldToLocal(Tuple3f point) {
        var inverse = getWorldMatrix();
        inverse.invert();
        var result = new Point3f(point);
        inverse.transform(result);
        return result;
    }

    private void apply(Transform target) {
        smoothTarget = null;
        setLocal(target);
    }

    private void requireWritable() {
        if (behavior.drivesTransform()) {
            throw new UnsupportedOperationException("The transform of " + this + " is driven by " + behavior);
        }
    }

    private void setLocal(Transform target) {
        if (target.equals(transform)) {
            return;
        }
        transform = target;
        for (var listener : listeners) {
            listener.onTransformChanged(this);
        }
    }

    private void smoothStep(double deltaSeconds) {
        if (smoothTarget == null) {
            return;
        }
        var factor = (float) Math.max(0.0, Math.min(1.0, deltaSeconds * smoothSpeed));
        var next = transform.interpolate(smoothTarget, factor);
        if (next.epsilonEquals(smoothTarget, SMOOTH_EPSILON)) {
            next = smoothTarget;
            smoothTarget = null;
        }
        setLocal(next);
    }
}
