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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.NotTrackingException;
import com.hellblazer.arscene.tracking.ResourceExhaustedException;
import com.hellblazer.arscene.tracking.SessionPausedException;

/**
 * The outcome of an anchor creation attempt: the new anchor, or the cause of the failure
 *
 * @author hal.hildebrand
 */
public final class AnchorCreation {
    private static final Logger log = LoggerFactory.getLogger(AnchorCreation.class);

    /**
     * Create an anchor, mapping the tracking failures to their cause. Failures are logged.
     */
    public static AnchorCreation attempt(Supplier<Anchor> creator) {
        try {
            return created(creator.get());
        } catch (NotTrackingException e) {
            return logged(AnchorFailure.NOT_TRACKING, e);
        } catch (SessionPausedException e) {
            return logged(AnchorFailure.SESSION_PAUSED, e);
        } catch (ResourceExhaustedException e) {
            return logged(AnchorFailure.RESOURCE_EXHAUSTED, e);
        } catch (IllegalStateException e) {
            return logged(AnchorFailure.UNSUPPORTED, e);
        }
    }

    public static AnchorCreation created(Anchor anchor) {
        return new AnchorCreation(Objects.requireNonNull(anchor, "anchor"), null);
    }

    public static AnchorCreation failed(AnchorFailure failure) {
        return new AnchorCreation(null, Objects.requireNonNull(failure, "failure"));
    }

    private static AnchorCreation logged(AnchorFailure failure, RuntimeException e) {
        log.warn("Anchor creation failed, {}: {}", failure, e.getMessage());
        return failed(failure);
    }

    private final Anchor        anchor;
    private final AnchorFailure failure;

    private AnchorCreation(Anchor anchor, AnchorFailure failure) {
        this.anchor = anchor;
        this.failure = failure;
    }

    public Optional<Anchor> anchor() {
        return Optional.ofNullable(anchor);
    }

    public Optional<AnchorFailure> failure() {
        return Optional.ofNullable(failure);
    }

    public boolean isCreated() {
        return anchor != null;
    }

    @Override
    public String toString() {
        return isCreated() ? "AnchorCreation[created]" : "AnchorCreation[" + failure + "]";
    }
}
