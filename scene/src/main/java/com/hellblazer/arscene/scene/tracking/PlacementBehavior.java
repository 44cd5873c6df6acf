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

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.scene.FrameContext;
import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.scene.PlacementSettings;
import com.hellblazer.arscene.tracking.HitResult;
import com.hellblazer.arscene.tracking.HitResultFilter;
import com.hellblazer.arscene.tracking.HitTests;
import com.hellblazer.arscene.tracking.PlacementMode;
import com.hellblazer.arscene.tracking.Plane;
import com.hellblazer.arscene.tracking.SessionController;

/**
 * Positions an unanchored node at the surface under a screen point, and optionally anchors it there.
 * <p>
 * While unanchored, each frame issues at most one hit test, no more often than
 * {@link PlacementSettings#maxHitTestsPerSecond()}. A tracking result moves the node to the hit pose and is retained
 * as the last tracking hit. With auto anchoring on, the node anchors as soon as a usable hit result is known. Once
 * anchored, the node follows its anchor and placement stops. Placement also pauses while an anchor task is in flight.
 * <p>
 * Plane hits are accepted only for the plane types of the placement mode. An optional {@link HitResultFilter} further
 * restricts the acceptable results.
 *
 * @author hal.hildebrand
 */
public class PlacementBehavior extends AnchorBehavior {
    public static final Point3f       DEFAULT_PLACEMENT_POSITION = new Point3f(0f, 0f, -2f);
    public static final PlacementMode DEFAULT_PLACEMENT_MODE     = PlacementMode.BEST_AVAILABLE;

    private static final Logger log = LoggerFactory.getLogger(PlacementBehavior.class);

    private boolean                       autoAnchor;
    private boolean                       featuresRequired;
    private HitResult                     hitResult;
    private HitResultFilter               hitResultFilter;
    private final List<HitResultListener> hitResultListeners = new CopyOnWriteArrayList<>();
    private Long                          lastHitTestNanos;
    private HitResult                     lastTrackingHitResult;
    private PlacementMode                 placementMode      = DEFAULT_PLACEMENT_MODE;
    private final Point3f                 placementPosition  = new Point3f(DEFAULT_PLACEMENT_POSITION);

    public PlacementBehavior() {
        this(DEFAULT_PLACEMENT_MODE, PlacementSettings.defaults());
    }

    public PlacementBehavior(PlacementMode placementMode) {
        this(placementMode, PlacementSettings.defaults());
    }

    public PlacementBehavior(PlacementMode placementMode, PlacementSettings settings) {
        super(null, settings);
        this.placementMode = Objects.requireNonNull(placementMode, "placementMode");
    }

    public void addHitResultListener(HitResultListener listener) {
        hitResultListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Anchor the node at the best known hit result, replacing any current anchor
     */
    public AnchorCreation anchor() {
        var creation = createAnchor();
        creation.anchor().ifPresent(this::setAnchor);
        return creation;
    }

    /**
     * Create an anchor at the best known hit result: the latest one if it is tracking, otherwise the last tracking
     * one, otherwise, if {@link PlacementSettings#anchorOnNonTrackingHit()} allows it, the latest one
     */
    public AnchorCreation createAnchor() {
        var candidate = anchorCandidate();
        if (candidate == null) {
            return AnchorCreation.failed(AnchorFailure.NO_POSE_SOURCE);
        }
        return AnchorCreation.attempt(candidate::createAnchor);
    }

    @Override
    public AnchorCreation createAnchor(SessionController session) {
        return createAnchor();
    }

    /**
     * @return the latest placement hit result, null if the last hit test found nothing
     */
    public HitResult getHitResult() {
        return hitResult;
    }

    /**
     * @return the additional hit result filter, null if none
     */
    public HitResultFilter getHitResultFilter() {
        return hitResultFilter;
    }

    /**
     * @return the latest tracking placement hit result, null if none
     */
    public HitResult getLastTrackingHitResult() {
        return lastTrackingHitResult;
    }

    public PlacementMode getPlacementMode() {
        return placementMode;
    }

    /**
     * @return the normalized screen position of the hit test ray, x and y in [-1, 1] with +y up, and the approximate
     *         distance as -z
     */
    public Point3f getPlacementPosition() {
        return new Point3f(placementPosition);
    }

    public boolean isAutoAnchor() {
        return autoAnchor;
    }

    /**
     * Record a placement hit result. A tracking result moves the node to its pose and is retained as the last tracking
     * hit; any other result leaves the pose unchanged. The listeners receive every result.
     */
    public void onHitResult(Node node, HitResult result) {
        hitResult = result;
        if (result != null && result.isTracking()) {
            lastTrackingHitResult = result;
            setPose(result.getHitPose());
        }
        for (var listener : hitResultListeners) {
            listener.onHitResult(node, result);
        }
    }

    @Override
    public void onFrame(Node node, FrameContext context) {
        super.onFrame(node, context);
        if (isAnchored()) {
            return;
        }
        if (autoAnchor && anchor().isCreated()) {
            return;
        }
        if (placementMode == PlacementMode.DISABLED) {
            return;
        }
        if (isCloudAnchorTaskInProgress()) {
            log.trace("Placement of {} waits for its anchor task", node);
            return;
        }
        var now = context.time().timestampNanos();
        if (lastHitTestNanos != null && now - lastHitTestNanos < getSettings().hitTestIntervalNanos()) {
            log.trace("Hit test of {} rate limited", node);
            return;
        }
        lastHitTestNanos = now;
        onHitResult(node, hitTest(context));
    }

    public void removeHitResultListener(HitResultListener listener) {
        hitResultListeners.remove(listener);
    }

    /**
     * @param autoAnchor - true to anchor as soon as a usable hit result is known, trying immediately; false to detach
     *                   any anchor
     */
    public void setAutoAnchor(boolean autoAnchor) {
        this.autoAnchor = autoAnchor;
        if (autoAnchor) {
            if (!isAnchored()) {
                anchor();
            }
        } else {
            detachAnchor();
        }
    }

    /**
     * @param hitResultFilter - a condition placement hit results must also satisfy, in addition to the placement mode's
     *                        own, or null for none
     */
    public void setHitResultFilter(HitResultFilter hitResultFilter) {
        this.hitResultFilter = hitResultFilter;
    }

    public void setPlacementMode(PlacementMode placementMode) {
        if (placementMode == this.placementMode) {
            return;
        }
        this.placementMode = Objects.requireNonNull(placementMode, "placementMode");
        featuresRequired = false;
    }

    /**
     * @param placementPosition - x and y in [-1, 1] with +y up, -z the approximate distance in meters
     */
    public void setPlacementPosition(Tuple3f placementPosition) {
        this.placementPosition.set(Objects.requireNonNull(placementPosition, "placementPosition"));
    }

    @Override
    public String toString() {
        return "PlacementBehavior[" + placementMode + ", anchored=" + isAnchored() + ", " + getPose() + "]";
    }

    private HitResult anchorCandidate() {
        if (hitResult != null && hitResult.isTracking()) {
            return hitResult;
        }
        if (lastTrackingHitResult != null) {
            return lastTrackingHitResult;
        }
        if (hitResult != null && getSettings().anchorOnNonTrackingHit()) {
            log.debug("Anchoring {} at a non tracking hit", getNode());
            return hitResult;
        }
        return null;
    }

    private HitResult hitTest(FrameContext context) {
        var session = context.session();
        if (!featuresRequired) {
            session.requireFeatures(placementMode);
            featuresRequired = true;
        }
        var config = session.getConfig();
        var depthAvailable = placementMode.isDepthEnabled() && config.isDepthEnabled();
        var planeTypes = placementMode.planeTypes();
        if (placementMode.isDepthEnabled() && !depthAvailable && planeTypes.isEmpty()) {
            planeTypes = EnumSet.allOf(Plane.Type.class);
        }
        var x = session.getDisplayWidth() / 2f * (1f + placementPosition.x);
        var y = session.getDisplayHeight() / 2f * (1f - placementPosition.y);
        log.debug("Hit test of {} at ({}, {})", getNode(), x, y);
        return HitTests.hitTest(context.frame(), x, y, planeTypes, depthAvailable,
                                placementMode.isInstantPlacementEnabled(), Math.abs(placementPosition.z),
                                hitResultFilter)
                       .orElse(null);
    }
}
