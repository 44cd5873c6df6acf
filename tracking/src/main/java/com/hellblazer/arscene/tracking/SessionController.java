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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.tracking.SessionConfig.CloudAnchorMode;
import com.hellblazer.arscene.tracking.SessionConfig.DepthMode;
import com.hellblazer.arscene.tracking.SessionConfig.LightEstimationMode;
import com.hellblazer.arscene.tracking.SessionConfig.PlaneFindingMode;
import com.hellblazer.arscene.tracking.TrackingSession.CameraFacing;
import com.hellblazer.arscene.tracking.TrackingSession.FeatureMapQuality;

/**
 * Owns a {@link TrackingSession} and its lifecycle: CREATED, then RESUMED and PAUSED alternately, then CLOSED. All
 * calls are expected on the thread driving the frames.
 *
 * @author hal.hildebrand
 */
public class SessionController {

    public enum State {
        CLOSED, CREATED, PAUSED, RESUMED;
    }

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private SessionConfig                 config;
    private Frame                         currentFrame;
    private int                           displayHeight;
    private int                           displayRotation;
    private int                           displayWidth;
    private final List<SessionObserver>   observers = new CopyOnWriteArrayList<>();
    private final TrackingSession         session;
    private State                         state     = State.CREATED;

    public SessionController(TrackingSession session) {
        this(session, SessionConfig.defaults());
    }

    public SessionController(TrackingSession session, SessionConfig initial) {
        this.session = Objects.requireNonNull(session, "session");
        this.config = sanitize(Objects.requireNonNull(initial, "initial"));
        session.configure(config);
    }

    public void addObserver(SessionObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    /**
     * @return true unless the features seen from the camera pose are insufficient to host a cloud anchor
     */
    public boolean canHostCloudAnchor(Pose cameraPose) {
        return session.estimateFeatureMapQualityForHosting(cameraPose) != FeatureMapQuality.INSUFFICIENT;
    }

    /**
     * Close the session, pausing it first if resumed. Closing twice is a no-op.
     */
    public void close() {
        if (state == State.CLOSED) {
            return;
        }
        if (state == State.RESUMED) {
            pause();
        }
        session.close();
        currentFrame = null;
        state = State.CLOSED;
        log.info("Session closed");
    }

    /**
     * Apply a configuration change. Modes the device cannot honor are adjusted: an unsupported depth mode is disabled
     * and light estimation is disabled on a front facing camera. Observers are notified after the change is applied.
     *
     * @return the applied configuration
     */
    public SessionConfig configure(UnaryOperator<SessionConfig> change) {
        requireOpen();
        var updated = sanitize(Objects.requireNonNull(change.apply(config), "config"));
        session.configure(updated);
        config = updated;
        log.info("Session configured: {}", updated);
        for (var observer : observers) {
            observer.onConfigChanged(this, updated);
        }
        return updated;
    }

    /**
     * Create an anchor at a world pose, attached to no trackable
     */
    public Anchor createAnchor(Pose pose) {
        requireOpen();
        return session.createAnchor(pose);
    }

    public SessionConfig getConfig() {
        return config;
    }

    /**
     * @return the last frame produced by {@link #update()}
     */
    public Optional<Frame> getCurrentFrame() {
        return Optional.ofNullable(currentFrame);
    }

    public int getDisplayHeight() {
        return displayHeight;
    }

    public int getDisplayRotation() {
        return displayRotation;
    }

    public int getDisplayWidth() {
        return displayWidth;
    }

    /**
     * @return the geospatial localization, empty when geospatial mode is disabled
     */
    public Optional<Earth> getEarth() {
        requireOpen();
        if (config.geospatialMode() == SessionConfig.GeospatialMode.DISABLED) {
            return Optional.empty();
        }
        return Optional.ofNullable(session.getEarth());
    }

    public State getState() {
        return state;
    }

    /**
     * @throws IllegalStateException if cloud anchors are not enabled
     */
    public AnchorFuture<HostResult> hostCloudAnchorAsync(Anchor anchor, int ttlDays) {
        requireCloudAnchors();
        if (ttlDays < 1 || ttlDays > 365) {
            throw new IllegalArgumentException("ttlDays must be in [1, 365]: " + ttlDays);
        }
        return session.hostCloudAnchorAsync(Objects.requireNonNull(anchor, "anchor"), ttlDays);
    }

    public boolean isResumed() {
        return state == State.RESUMED;
    }

    public void pause() {
        requireOpen();
        if (state != State.RESUMED) {
            return;
        }
        session.pause();
        state = State.PAUSED;
        log.info("Session paused");
        for (var observer : observers) {
            observer.onPaused(this);
        }
    }

    public void removeObserver(SessionObserver observer) {
        observers.remove(observer);
    }

    /**
     * Switch on the session features the placement mode needs. Reconfigures only if something changes. Without depth
     * support, depth placement falls back to horizontal and vertical planes.
     *
     * @return true if the session was reconfigured
     */
    public boolean requireFeatures(PlacementMode mode) {
        var required = sanitize(mode.applyTo(config));
        if (mode.isDepthEnabled() && !required.isDepthEnabled()) {
            required = required.withPlaneFindingMode(required.planeFindingMode()
                                                             .union(PlaneFindingMode.HORIZONTAL_AND_VERTICAL));
        }
        if (required.equals(config)) {
            return false;
        }
        log.debug("Enabling features for placement mode {}", mode);
        var applied = required;
        configure(c -> applied);
        return true;
    }

    /**
     * @throws IllegalStateException if cloud anchors are not enabled
     */
    public AnchorFuture<ResolveResult<CloudAnchorState>> resolveCloudAnchorAsync(String cloudAnchorId) {
        requireCloudAnchors();
        return session.resolveCloudAnchorAsync(Objects.requireNonNull(cloudAnchorId, "cloudAnchorId"));
    }

    /**
     * Resume the session, applying the stored display geometry
     *
     * @throws CameraNotAvailableException if the camera cannot be opened. Observers are notified first.
     */
    public void resume() {
        requireOpen();
        if (state == State.RESUMED) {
            return;
        }
        try {
            session.resume();
        } catch (CameraNotAvailableException e) {
            fail(e);
            throw e;
        }
        if (displayWidth > 0 && displayHeight > 0) {
            session.setDisplayGeometry(displayRotation, displayWidth, displayHeight);
        }
        state = State.RESUMED;
        log.info("Session resumed");
        for (var observer : observers) {
            observer.onResumed(this);
        }
    }

    public void setDisplayGeometry(int rotation, int width, int height) {
        displayRotation = rotation;
        displayWidth = width;
        displayHeight = height;
        if (state == State.RESUMED) {
            session.setDisplayGeometry(rotation, width, height);
        }
    }

    @Override
    public String toString() {
        return "SessionController[" + state + ", " + displayWidth + "x" + displayHeight + "]";
    }

    /**
     * Advance the session to the latest camera image
     *
     * @return the new frame, or empty while not resumed or before the first camera image
     * @throws CameraNotAvailableException if the camera was lost. Observers are notified first.
     * @throws FatalTrackingException      if the session cannot continue. Observers are notified first.
     */
    public Optional<Frame> update() {
        if (state != State.RESUMED) {
            return Optional.empty();
        }
        Frame frame;
        try {
            frame = session.update();
        } catch (CameraNotAvailableException | FatalTrackingException e) {
            fail(e);
            throw e;
        }
        if (frame == null || frame.getTimestamp() == 0L) {
            return Optional.empty();
        }
        currentFrame = frame;
        return Optional.of(frame);
    }

    private void fail(TrackingException failure) {
        log.error("Session failed", failure);
        for (var observer : observers) {
            observer.onSessionFailed(this, failure);
        }
    }

    private void requireCloudAnchors() {
        requireOpen();
        if (config.cloudAnchorMode() != CloudAnchorMode.ENABLED) {
            throw new IllegalStateException("Cloud anchor mode is disabled");
        }
    }

    private void requireOpen() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("Session is closed");
        }
    }

    private SessionConfig sanitize(SessionConfig requested) {
        var result = requested;
        if (result.isDepthEnabled() && !session.isDepthModeSupported(result.depthMode())) {
            log.warn("Depth mode {} not supported, disabled", result.depthMode());
            result = result.withDepthMode(DepthMode.DISABLED);
        }
        if (result.lightEstimationMode() != LightEstimationMode.DISABLED
        && session.getCameraFacing() == CameraFacing.FRONT) {
            log.debug("Light estimation disabled for the front facing camera");
            result = result.withLightEstimationMode(LightEstimationMode.DISABLED);
        }
        return result;
    }
}
