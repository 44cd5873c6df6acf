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

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.scene.FrameContext;
import com.hellblazer.arscene.scene.Node;
import com.hellblazer.arscene.scene.PlacementSettings;
import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.Trackable;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Binds a node to a trackable. The node follows the trackable's pose while it is tracking and is visible only while
 * the trackable's state is one of the visible states. Without a trackable the state is {@link TrackingState#STOPPED}.
 *
 * @author hal.hildebrand
 */
public class TrackableBehavior extends PoseBehavior {
    private static final Logger log = LoggerFactory.getLogger(TrackableBehavior.class);

    private final List<TrackableListener> listeners = new CopyOnWriteArrayList<>();
    private Trackable                     trackable;

    public TrackableBehavior() {
        this(null, PlacementSettings.defaults());
    }

    public TrackableBehavior(Trackable trackable) {
        this(trackable, PlacementSettings.defaults());
    }

    public TrackableBehavior(Trackable trackable, PlacementSettings settings) {
        super(settings, TrackingState.STOPPED);
        setTrackable(trackable);
    }

    public void addTrackableListener(TrackableListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Pin an anchor to the trackable at the node's current pose
     */
    public AnchorCreation createAnchor() {
        if (trackable == null || getPose() == null) {
            return AnchorCreation.failed(AnchorFailure.NO_POSE_SOURCE);
        }
        if (trackable.getTrackingState() != TrackingState.TRACKING) {
            log.warn("Cannot anchor {}, trackable is {}", getNode(), trackable.getTrackingState());
            return AnchorCreation.failed(AnchorFailure.NOT_TRACKING);
        }
        var pose = getPose();
        return AnchorCreation.attempt(() -> trackable.createAnchor(pose));
    }

    /**
     * @return a new node anchored to the trackable at the node's current pose
     */
    public Optional<Node> createAnchoredNode() {
        return createAnchor().anchor()
                             .map(anchor -> new Node(nameOf() + "-anchor", new AnchorBehavior(anchor, getSettings())));
    }

    /**
     * @return the anchors attached to the trackable
     */
    public Collection<Anchor> getAnchors() {
        return trackable == null ? List.of() : trackable.getAnchors();
    }

    public Trackable getTrackable() {
        return trackable;
    }

    @Override
    public void onFrame(Node node, FrameContext context) {
        if (trackable != null && context.frame().getUpdatedTrackables().contains(trackable)) {
            refresh();
            for (var listener : listeners) {
                listener.onUpdated(node, trackable);
            }
        }
    }

    public void removeTrackableListener(TrackableListener listener) {
        listeners.remove(listener);
    }

    /**
     * Bind to the trackable. If it differs from the current one, the tracking state and pose are derived from it
     * immediately.
     */
    public void setTrackable(Trackable trackable) {
        if (trackable == this.trackable) {
            return;
        }
        this.trackable = trackable;
        if (trackable == null) {
            updateTrackingState(TrackingState.STOPPED);
            setPose(null);
        } else {
            refresh();
        }
    }

    private String nameOf() {
        return getNode() == null ? "trackable" : getNode().getName();
    }

    private void refresh() {
        var state = trackable.getTrackingState();
        updateTrackingState(state);
        if (state == TrackingState.TRACKING) {
            var pose = trackable.getPose();
            if (pose != null) {
                setPose(pose);
            }
        }
    }
}
