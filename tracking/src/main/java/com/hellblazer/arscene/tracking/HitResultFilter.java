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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Configurable selection of hit results. The defaults accept any tracking plane hit inside its polygon, points with an
 * estimated surface normal, depth points and instant placement points.
 *
 * @author hal.hildebrand
 */
public final class HitResultFilter implements Predicate<HitResult> {

    public static HitResultFilter defaults() {
        return new HitResultFilter(EnumSet.allOf(Plane.Type.class), true, true, true,
                                   EnumSet.of(TrackingState.TRACKING),
                                   EnumSet.of(Point.OrientationMode.ESTIMATED_SURFACE_NORMAL), true, null, 0f, null);
    }

    private final Set<Plane.Type>                 planeTypes;
    private final boolean                         point;
    private final boolean                         depthPoint;
    private final boolean                         instantPlacementPoint;
    private final Set<TrackingState>              trackingStates;
    private final Set<Point.OrientationMode>      pointOrientationModes;
    private final boolean                         planePoseInPolygon;
    private final Camera                          camera;
    private final float                           minCameraDistance;
    private final Predicate<? super HitResult>    predicate;

    private HitResultFilter(Set<Plane.Type> planeTypes, boolean point, boolean depthPoint,
                            boolean instantPlacementPoint, Set<TrackingState> trackingStates,
                            Set<Point.OrientationMode> pointOrientationModes, boolean planePoseInPolygon,
                            Camera camera, float minCameraDistance, Predicate<? super HitResult> predicate) {
        this.planeTypes = planeTypes.isEmpty() ? EnumSet.noneOf(Plane.Type.class) : EnumSet.copyOf(planeTypes);
        this.point = point;
        this.depthPoint = depthPoint;
        this.instantPlacementPoint = instantPlacementPoint;
        this.trackingStates = trackingStates.isEmpty() ? EnumSet.noneOf(TrackingState.class)
                                                       : EnumSet.copyOf(trackingStates);
        this.pointOrientationModes = pointOrientationModes.isEmpty() ? EnumSet.noneOf(Point.OrientationMode.class)
                                                                     : EnumSet.copyOf(pointOrientationModes);
        this.planePoseInPolygon = planePoseInPolygon;
        this.camera = camera;
        this.minCameraDistance = minCameraDistance;
        this.predicate = predicate;
    }

    /**
     * @return the first matching result
     */
    public Optional<HitResult> firstMatch(Collection<HitResult> results) {
        return results.stream().filter(this).findFirst();
    }

    @Override
    public boolean test(HitResult hit) {
        var trackable = hit.getTrackable();
        if (!trackingStates.contains(trackable.getTrackingState())) {
            return false;
        }
        boolean valid;
        if (trackable instanceof Plane plane) {
            valid = planeTypes.contains(plane.getType())
            && (!planePoseInPolygon || plane.isPoseInPolygon(hit.getHitPose()))
            && (camera == null || hit.getHitPose().distanceToPlane(camera.getPose()) > minCameraDistance);
        } else if (trackable instanceof Point p) {
            valid = point && pointOrientationModes.contains(p.getOrientationMode());
        } else if (trackable instanceof DepthPoint) {
            valid = depthPoint;
        } else if (trackable instanceof InstantPlacementPoint) {
            valid = instantPlacementPoint;
        } else {
            valid = false;
        }
        return valid && (predicate == null || predicate.test(hit));
    }

    /**
     * @param camera      - the camera the plane must face
     * @param minDistance - the minimum distance from the plane to the camera, in meters
     */
    public HitResultFilter withMinCameraDistance(Camera camera, float minDistance) {
        return new HitResultFilter(planeTypes, point, depthPoint, instantPlacementPoint, trackingStates,
                                   pointOrientationModes, planePoseInPolygon, camera, minDistance, predicate);
    }

    public HitResultFilter withDepthPoints(boolean accept) {
        return new HitResultFilter(planeTypes, point, accept, instantPlacementPoint, trackingStates,
                                   pointOrientationModes, planePoseInPolygon, camera, minCameraDistance, predicate);
    }

    public HitResultFilter withInstantPlacementPoints(boolean accept) {
        return new HitResultFilter(planeTypes, point, depthPoint, accept, trackingStates, pointOrientationModes,
                                   planePoseInPolygon, camera, minCameraDistance, predicate);
    }

    public HitResultFilter withPlanePoseInPolygon(boolean required) {
        return new HitResultFilter(planeTypes, point, depthPoint, instantPlacementPoint, trackingStates,
                                   pointOrientationModes, required, camera, minCameraDistance, predicate);
    }

    public HitResultFilter withPlaneTypes(Set<Plane.Type> types) {
        return new HitResultFilter(types, point, depthPoint, instantPlacementPoint, trackingStates,
                                   pointOrientationModes, planePoseInPolygon, camera, minCameraDistance, predicate);
    }

    public HitResultFilter withPointOrientationModes(Set<Point.OrientationMode> modes) {
        return new HitResultFilter(planeTypes, point, depthPoint, instantPlacementPoint, trackingStates, modes,
                                   planePoseInPolygon, camera, minCameraDistance, predicate);
    }

    public HitResultFilter withPoints(boolean accept) {
        return new HitResultFilter(planeTypes, accept, depthPoint, instantPlacementPoint, trackingStates,
                                   pointOrientationModes, planePoseInPolygon, camera, minCameraDistance, predicate);
    }

    /**
     * @param additional - an extra condition every accepted result must also satisfy
     */
    public HitResultFilter withPredicate(Predicate<? super HitResult> additional) {
        return new HitResultFilter(planeTypes, point, depthPoint, instantPlacementPoint, trackingStates,
                                   pointOrientationModes, planePoseInPolygon, camera, minCameraDistance, additional);
    }

    public HitResultFilter withTrackingStates(Set<TrackingState> states) {
        return new HitResultFilter(planeTypes, point, depthPoint, instantPlacementPoint, states,
                                   pointOrientationModes, planePoseInPolygon, camera, minCameraDistance, predicate);
    }
}
