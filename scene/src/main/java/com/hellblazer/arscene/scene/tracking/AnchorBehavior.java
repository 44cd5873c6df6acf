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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

import javax.vecmath.Quat4f;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.scene.FrameContext;
import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.scene.PlacementSettings;
import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.AnchorFuture;
import com.hellblazer.arscene.tracking.AnchorTaskState;
import com.hellblazer.arscene.tracking.CloudAnchorState;
import com.hellblazer.arscene.tracking.Earth;
import com.hellblazer.arscene.tracking.Earth.EarthState;
import com.hellblazer.arscene.tracking.GeospatialAnchorState;
import com.hellblazer.arscene.tracking.HostResult;
import com.hellblazer.arscene.tracking.ResolveResult;
import com.hellblazer.arscene.tracking.SessionController;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Associates a node with zero or one anchor and keeps the node at the anchor's live pose.
 * <p>
 * The node is Unanchored or Anchored. Replacing or dropping the anchor detaches the previous one exactly once. While
 * anchored, each frame refreshes the anchor's tracking state and, when tracking and the update interval has elapsed,
 * the pose.
 * <p>
 * Independently, at most one asynchronous anchor task (cloud host, cloud resolve, terrain or rooftop resolve) may be
 * in flight. The task is polled each frame; when it reaches a terminal state its listener is invoked once. Cancelling
 * the task, or detaching the anchor, drops it without invoking the listener.
 *
 * @author hal.hildebrand
 */
public class AnchorBehavior extends PoseBehavior {

    /**
     * An in flight anchor task
     */
    private final class AnchorTask<R> {
        private final String                                 description;
        private final AnchorFuture<R>                        future;
        private final AnchorTaskListener                     listener;
        private final Consumer<R>                            onSuccess;
        private final Consumer<R>                            onTerminal;
        private final Function<R, ? extends AnchorTaskState> stateOf;

        private AnchorTask(String description, AnchorFuture<R> future, Function<R, ? extends AnchorTaskState> stateOf,
                           Consumer<R> onTerminal, Consumer<R> onSuccess, AnchorTaskListener listener) {
            this.description = description;
            this.future = future;
            this.stateOf = stateOf;
            this.onTerminal = onTerminal;
            this.onSuccess = onSuccess;
            this.listener = listener;
        }

        private void poll() {
            switch (future.getState()) {
            case PENDING:
                return;
            case CANCELLED:
                log.info("{} cancelled for {}", description, getNode());
                task = null;
                resetCloudAnchorState();
                return;
            default:
                break;
            }
            var result = future.getResult();
            var state = stateOf.apply(result);
            if (state.isInProgress()) {
                return;
            }
            task = null;
            onTerminal.accept(result);
            if (state.isSuccess()) {
                log.info("{} succeeded for {}", description, getNode());
                onSuccess.accept(result);
            } else {
                log.warn("{} failed for {}: {}", description, getNode(), state);
            }
            if (listener != null) {
                listener.onTaskCompleted(getNode(), anchor, state);
            }
        }
    }

    private static final Logger log = LoggerFactory.getLogger(AnchorBehavior.class);

    private Anchor                     anchor;
    private final List<AnchorListener> anchorListeners  = new CopyOnWriteArrayList<>();
    private String                     cloudAnchorId;
    private CloudAnchorState           cloudAnchorState = CloudAnchorState.NONE;
    private Long                       lastPoseUpdateNanos;
    private AnchorTask<?>              task;

    public AnchorBehavior() {
        this(null, PlacementSettings.defaults());
    }

    public AnchorBehavior(Anchor anchor) {
        this(anchor, PlacementSettings.defaults());
    }

    public AnchorBehavior(Anchor anchor, PlacementSettings settings) {
        super(settings, null);
        setAnchor(anchor);
    }

    public void addAnchorListener(AnchorListener listener) {
        anchorListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Cancel the in flight anchor task, if any, without invoking its listener. Idempotent.
     */
    public void cancelCloudAnchorTask() {
        if (task == null) {
            return;
        }
        var cancelled = task;
        task = null;
        cancelled.future.cancel();
        resetCloudAnchorState();
        log.info("Cancelled {} for {}", cancelled.description, getNode());
    }

    /**
     * Create an anchor at the node's current pose, attached to no trackable
     */
    public AnchorCreation createAnchor(SessionController session) {
        var pose = getPose();
        if (pose == null) {
            return AnchorCreation.failed(AnchorFailure.NO_POSE_SOURCE);
        }
        return AnchorCreation.attempt(() -> session.createAnchor(pose));
    }

    /**
     * @return a copy of the node with the same local transform, holding its own new anchor
     */
    public Optional<Node> createAnchoredCopy(SessionController session) {
        var source = getNode();
        return createAnchoredNode(session).map(copy -> {
            if (source != null) {
                copy.setTransform(source.getTransform());
                copy.setVisible(source.isBaseVisible());
            }
            return copy;
        });
    }

    /**
     * @return a new node holding its own new anchor at this node's pose
     */
    public Optional<Node> createAnchoredNode(SessionController session) {
        var name = getNode() == null ? "anchor" : getNode().getName() + "-anchor";
        return createAnchor(session).anchor().map(a -> new Node(name, new AnchorBehavior(a, getSettings())));
    }

    /**
     * Detach and drop the anchor, cancelling any anchor task without invoking its listener. Idempotent.
     */
    public void detachAnchor() {
        cancelCloudAnchorTask();
        setAnchor(null);
    }

    public Anchor getAnchor() {
        return anchor;
    }

    /**
     * @return the identifier of the hosted or resolved cloud anchor, null if none
     */
    public String getCloudAnchorId() {
        return cloudAnchorId;
    }

    /**
     * @return the state of the last cloud anchor task
     */
    public CloudAnchorState getCloudAnchorState() {
        return cloudAnchorState;
    }

    /**
     * Host the anchor with the cloud anchor service
     *
     * @param ttlDays  - the lifetime of the hosted anchor, in days
     * @param listener - notified once on completion, may be null
     * @throws IllegalStateException if a task is in progress or the node is not anchored
     */
    public void hostCloudAnchor(SessionController session, int ttlDays, AnchorTaskListener listener) {
        requireNoTask();
        if (anchor == null) {
            throw new IllegalStateException("No anchor to host for " + getNode());
        }
        var future = session.hostCloudAnchorAsync(anchor, ttlDays);
        cloudAnchorState = CloudAnchorState.TASK_IN_PROGRESS;
        start(new AnchorTask<HostResult>("Cloud anchor hosting", future, HostResult::state,
                                         r -> cloudAnchorState = r.state(), r -> cloudAnchorId = r.cloudAnchorId(),
                                         listener));
    }

    public boolean isAnchored() {
        return anchor != null;
    }

    public boolean isCloudAnchorTaskInProgress() {
        return task != null;
    }

    @Override
    public void onDestroy(Node node) {
        detachAnchor();
    }

    @Override
    public void onFrame(Node node, FrameContext context) {
        if (anchor != null) {
            var state = anchor.getTrackingState();
            updateTrackingState(state);
            if (state == TrackingState.TRACKING && poseUpdateDue(context.time().timestampNanos())) {
                setPose(anchor.getPose());
                lastPoseUpdateNanos = context.time().timestampNanos();
            }
        }
        if (task != null) {
            task.poll();
        }
    }

    public void removeAnchorListener(AnchorListener listener) {
        anchorListeners.remove(listener);
    }

    /**
     * Resolve a cloud anchor. On success the resolved anchor replaces the node's anchor.
     *
     * @param listener - notified once on completion, may be null
     * @throws IllegalStateException if a task is in progress
     */
    public void resolveCloudAnchor(SessionController session, String cloudAnchorId, AnchorTaskListener listener) {
        requireNoTask();
        var future = session.resolveCloudAnchorAsync(cloudAnchorId);
        cloudAnchorState = CloudAnchorState.TASK_IN_PROGRESS;
        start(new AnchorTask<ResolveResult<CloudAnchorState>>("Cloud anchor resolve " + cloudAnchorId, future,
                                                              ResolveResult::state, r -> cloudAnchorState = r.state(),
                                                              r -> {
                                                                  this.cloudAnchorId = cloudAnchorId;
                                                                  setAnchor(r.anchor());
                                                              }, listener));
    }

    /**
     * Resolve an anchor at an altitude above the rooftop at the location, or the terrain where there is no building.
     * On success the resolved anchor replaces the node's anchor.
     *
     * @param eusRotation - the rotation in the east-up-south frame
     * @param listener    - notified once on completion, may be null
     * @throws IllegalStateException    if a task is in progress, or the Earth is not enabled or has stopped
     * @throws IllegalArgumentException if the latitude is outside [-90, 90]
     */
    public void resolveRooftopAnchor(SessionController session, double latitude, double longitude,
                                     double altitudeAboveRooftop, Quat4f eusRotation, AnchorTaskListener listener) {
        requireNoTask();
        var earth = requireEarth(session, latitude);
        resolveGeospatial("Rooftop anchor resolve",
                          earth.resolveAnchorOnRooftopAsync(latitude, longitude, altitudeAboveRooftop, eusRotation), listener);
    }

    /**
     * Resolve an anchor at an altitude above the terrain at the location. On success the resolved anchor replaces the
     * node's anchor.
     *
     * @param eusRotation - the rotation in the east-up-south frame
     * @param listener    - notified once on completion, may be null
     * @throws IllegalStateException    if a task is in progress, or the Earth is not enabled or has stopped
     * @throws IllegalArgumentException if the latitude is outside [-90, 90]
     */
    public void resolveTerrainAnchor(SessionController session, double latitude, double longitude,
                                     double altitudeAboveTerrain, Quat4f eusRotation, AnchorTaskListener listener) {
        requireNoTask();
        var earth = requireEarth(session, latitude);
        resolveGeospatial("Terrain anchor resolve",
                          earth.resolveAnchorOnTerrainAsync(latitude, longitude, altitudeAboveTerrain, eusRotation), listener);
    }

    /**
     * Replace the anchor. Setting the current anchor does nothing. Otherwise the previous anchor is detached, the
     * pose is taken from the new anchor and the anchor listeners are notified. An anchor task bound to the previous
     * anchor is cancelled without invoking its listener.
     *
     * @param anchor - the new anchor, null to unanchor the node
     */
    public void setAnchor(Anchor anchor) {
        if (anchor == this.anchor) {
            return;
        }
        if (task != null) {
            cancelCloudAnchorTask();
        }
        var previous = this.anchor;
        if (previous != null) {
            previous.detach();
            log.info("Detached anchor of {}", getNode());
        }
        this.anchor = anchor;
        lastPoseUpdateNanos = null;
        if (anchor == null) {
            updateTrackingState(null);
            setPose(null);
        } else {
            log.info("Anchored {}", getNode());
            updateTrackingState(anchor.getTrackingState());
            setPose(anchor.getPose());
        }
        for (var listener : anchorListeners) {
            listener.onAnchorChanged(getNode(), anchor);
        }
    }

    private boolean poseUpdateDue(long timestampNanos) {
        var interval = getSettings().anchorPoseUpdateInterval();
        if (interval == null) {
            return false;
        }
        return lastPoseUpdateNanos == null || timestampNanos - lastPoseUpdateNanos >= interval.toNanos();
    }

    private Earth requireEarth(SessionController session, double latitude) {
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + latitude);
        }
        var earth = session.getEarth().orElseThrow(() -> new IllegalStateException("Geospatial mode is disabled"));
        if (earth.getEarthState() != EarthState.ENABLED) {
            throw new IllegalStateException("Earth is not enabled: " + earth.getEarthState());
        }
        if (earth.getTrackingState() == TrackingState.STOPPED) {
            throw new IllegalStateException("Earth tracking has stopped");
        }
        return earth;
    }

    private void resolveGeospatial(String description, AnchorFuture<ResolveResult<GeospatialAnchorState>> future,
                                   AnchorTaskListener listener) {
        start(new AnchorTask<>(description, future, ResolveResult::state, r -> log.debug("{}: {}", description, r),
                               r -> setAnchor(r.anchor()), listener));
    }

    private void requireNoTask() {
        if (task != null) {
            throw new IllegalStateException("An anchor task is already in progress: " + task.description);
        }
    }

    private void start(AnchorTask<?> newTask) {
        task = newTask;
        log.info("{} started for {}", newTask.description, getNode());
    }

    private void resetCloudAnchorState() {
        if (cloudAnchorState.isInProgress()) {
            cloudAnchorState = CloudAnchorState.NONE;
        }
    }
}
