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
package com.hellblazer.arscene.geometry;

import java.util.Objects;

import javax.vecmath.Matrix3f;
import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * Immutable local transformation of a scene node: a translation, followed by the rotation, followed by the scaling.
 * The equivalent matrix is T * R * S.
 *
 * @author hal.hildebrand
 */
public final class Transform {
    public static final Transform IDENTITY = new Transform(new Point3f(), Quaternions.identity(),
                                                           new Vector3f(1f, 1f, 1f));

    static final Vector3f UNIT_SCALE = new Vector3f(1f, 1f, 1f);

    public static Transform of(Tuple3f position, Quat4f rotation) {
        return new Transform(position, rotation, UNIT_SCALE);
    }

    private final Point3f  position;
    private final Quat4f   rotation;
    private final Vector3f scale;

    public Transform(Tuple3f position, Quat4f rotation, Tuple3f scale) {
        this.position = new Point3f(Objects.requireNonNull(position, "position"));
        this.rotation = Quaternions.normalized(Objects.requireNonNull(rotation, "rotation"));
        this.scale = new Vector3f(Objects.requireNonNull(scale, "scale"));
    }

    /**
     * Component-wise comparison. Rotations q and -q are equal.
     */
    public boolean epsilonEquals(Transform other, float epsilon) {
        if (!position.epsilonEquals(other.position, epsilon) || !scale.epsilonEquals(other.scale, epsilon)) {
            return false;
        }
        if (rotation.epsilonEquals(other.rotation, epsilon)) {
            return true;
        }
        var negated = new Quat4f();
        negated.negate(other.rotation);
        return rotation.epsilonEquals(negated, epsilon);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Transform other)) {
            return false;
        }
        return position.equals(other.position) && rotation.equals(other.rotation) && scale.equals(other.scale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, rotation, scale);
    }

    /**
     * Interpolate between the receiver and the end transform: linear on position and scale, spherical on rotation
     *
     * @param end - the target transform
     * @param t   - the parameterization value, clamped to [0, 1]
     * @return the interpolated transform
     */
    public Transform interpolate(Transform end, float t) {
        var f = Math.max(0f, Math.min(1f, t));
        if (f == 0f) {
            return this;
        }
        if (f == 1f) {
            return end;
        }
        var p = new Point3f();
        p.interpolate(position, end.position, f);
        var s = new Vector3f();
        s.interpolate(scale, end.scale, f);
        return new Transform(p, Quaternions.slerp(rotation, end.rotation, f), s);
    }

    public Point3f position() {
        return new Point3f(position);
    }

    public Quat4f rotation() {
        return new Quat4f(rotation);
    }

    public Vector3f scale() {
        return new Vector3f(scale);
    }

    /**
     * @return the T * R * S matrix
     */
    public Matrix4f toMatrix() {
        var r = new Matrix3f();
        r.set(rotation);
        var m = new Matrix4f();
        m.m00 = r.m00 * scale.x;
        m.m01 = r.m01 * scale.y;
        m.m02 = r.m02 * scale.z;
        m.m03 = position.x;
        m.m10 = r.m10 * scale.x;
        m.m11 = r.m11 * scale.y;
        m.m12 = r.m12 * scale.z;
        m.m13 = position.y;
        m.m20 = r.m20 * scale.x;
        m.m21 = r.m21 * scale.y;
        m.m22 = r.m22 * scale.z;
        m.m23 = position.z;
        m.m33 = 1f;
        return m;
    }

    @Override
    public String toString() {
        return "Transform [position=" + position + ", rotation=" + rotation + ", scale=" + scale + "]";
    }

    public Transform withPosition(Tuple3f newPosition) {
        return new Transform(newPosition, rotation, scale);
    }

    public Transform withRotation(Quat4f newRotation) {
        return new Transform(position, newRotation, scale);
    }

    public Transform withScale(Tuple3f newScale) {
        return new Transform(position, rotation, newScale);
    }
}
