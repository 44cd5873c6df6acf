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

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.EnumSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.arscene.tracking.TrackingState;

/**
 * Loads {@link PlacementSettings} overrides from a JSON classpath resource. Fields absent from the resource keep their
 * defaults:
 *
 * <pre>
 * {
 *   "maxHitTestsPerSecond": 30,
 *   "smoothSpeed": 5.0,
 *   "smoothPose": true,
 *   "anchorPoseUpdateIntervalMillis": 0,
 *   "anchorOnNonTrackingHit": false,
 *   "visibleTrackingStates": ["TRACKING"]
 * }
 * </pre>
 *
 * A null {@code anchorPoseUpdateIntervalMillis} disables anchor pose refresh.
 *
 * @author hal.hildebrand
 */
public class PlacementSettingsLoader {
    public static final String DEFAULT_RESOURCE = "/arscene-placement.json";

    private static final Logger log = LoggerFactory.getLogger(PlacementSettingsLoader.class);

    private final ObjectMapper objectMapper;

    public PlacementSettingsLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return the settings of the default resource, or the defaults if there is none
     */
    public PlacementSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * @param resource - the classpath resource name
     * @return the settings, or the defaults if the resource does not exist
     * @throws IllegalArgumentException if the resource is malformed
     */
    public PlacementSettings load(String resource) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("Placement settings resource not found: {}, using defaults", resource);
                return PlacementSettings.defaults();
            }
            var settings = parse(objectMapper.readTree(is), PlacementSettings.defaults());
            log.info("Loaded placement settings from {}: {}", resource, settings);
            return settings;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read placement settings: " + resource, e);
        }
    }

    /**
     * Apply the overrides of a JSON document to the base settings
     *
     * @throws IllegalArgumentException if the document is malformed
     */
    public PlacementSettings parse(JsonNode root, PlacementSettings base) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Placement settings must be a JSON object");
        }
        var settings = base;
        if (root.has("maxHitTestsPerSecond")) {
            settings = settings.withMaxHitTestsPerSecond(integer(root, "maxHitTestsPerSecond"));
        }
        if (root.has("smoothSpeed")) {
            settings = settings.withSmoothSpeed((float) number(root, "smoothSpeed"));
        }
        if (root.has("smoothPose")) {
            settings = settings.withSmoothPose(bool(root, "smoothPose"));
        }
        if (root.has("anchorPoseUpdateIntervalMillis")) {
            Duration interval = null;
            if (!root.get("anchorPoseUpdateIntervalMillis").isNull()) {
                interval = Duration.ofMillis(integer(root, "anchorPoseUpdateIntervalMillis"));
            }
            settings = settings.withAnchorPoseUpdateInterval(interval);
        }
        if (root.has("anchorOnNonTrackingHit")) {
            settings = settings.withAnchorOnNonTrackingHit(bool(root, "anchorOnNonTrackingHit"));
        }
        if (root.has("visibleTrackingStates")) {
            var states = root.get("visibleTrackingStates");
            if (!states.isArray()) {
                throw new IllegalArgumentException("visibleTrackingStates must be an array");
            }
            var visible = EnumSet.noneOf(TrackingState.class);
            for (var state : states) {
                try {
                    visible.add(TrackingState.valueOf(state.asText()));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown tracking state: " + state, e);
                }
            }
            settings = settings.withVisibleTrackingStates(visible);
        }
        return settings;
    }

    private boolean bool(JsonNode root, String field) {
        var node = root.get(field);
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(field + " must be a boolean: " + node);
        }
        return node.booleanValue();
    }

    private int integer(JsonNode root, String field) {
        var node = root.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer: " + node);
        }
        return node.intValue();
    }

    private double number(JsonNode root, String field) {
        var node = root.get(field);
        if (!node.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number: " + node);
        }
        return node.doubleValue();
    }
}
