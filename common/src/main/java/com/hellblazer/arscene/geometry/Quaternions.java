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

import static java.lang.Math.acos;
import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import javax.vecmath.Quat4f;
import javax.vecmath.Vector3f;

/**
 * Quaternion helpers over {@link Quat4f}. None of these mutate their arguments.
 * <p>
 * Euler angles are in degrees and use the ZYX order: the returned x is the roll about X, y the pitch about Y and z the
 * yaw about Z, applied as yaw, then pitch, then roll.
 *
 * @author hal.hildebrand
 */
public final class Quaternions {

    /**
     * Below this angular separation slerp degenerates to a normalized lerp
     */
    private static final double NLERP_THRESHOLD = 0.99995;

    public static Quat4f identity() {
        return new Quat4f(0f, 0f, 0f, 1f);
    }

    /**
     * @return the product lhs * rhs, i.e. rotation by rhs followed by rotation by lhs
     */
    public static Quat4f multiply(Quat4f lhs, Quat4f rhs) {
        var result = new Quat4f();
        result.mul(lhs, rhs);
        return result;
    }

    /**
     * @return a unit length copy of q
     * @throws IllegalArgumentException if q has zero length or contains NaN
     */
    public static Quat4f normalized(Quat4f q) {
        var lengthSquared = q.x * q.x + q.y * q.y + q.z * q.z + q.w * q.w;
        if (!(lengthSquared > 0f)) {
            throw new IllegalArgumentException("Cannot normalize quaternion: " + q);
        }
        var result = new Quat4f(q);
        if (Math.abs(lengthSquared - 1f) > 1e-6f) {
            var inv = (float) (1.0 / sqrt(lengthSquared));
            result.set(q.x * inv, q.y * inv, q.z * inv, q.w * inv);
        }
        return result;
    }

    public static Quat4f conjugate(Quat4f q) {
        return new Quat4f(-q.x, -q.y, -q.z, q.w);
    }

    /**
     * Rotate the vector by the unit quaternion
     *
     * @param q - the rotation
     * @param v - the vector
     * @return the new Vector3f resulting from the rotation
     */
    public static Vector3f rotate(Quat4f q, Vector3f v) {
        // t = 2 * cross(q.xyz, v)
        var tx = 2f * (q.y * v.z - q.z * v.y);
        var ty = 2f * (q.z * v.x - q.x * v.z);
        var tz = 2f * (q.x * v.y - q.y * v.x);
        // v + w * t + cross(q.xyz, t)
        return new Vector3f(v.x + q.w * tx + (q.y * tz - q.z * ty), v.y + q.w * ty + (q.z * tx - q.x * tz),
                            v.z + q.w * tz + (q.x * ty - q.y * tx));
    }

    /**
     * Spherical Linear Interpolation along the shortest arc.
     *
     * @param from - the start rotation, unit length
     * @param to   - the target rotation, unit length
     * @param t    - the parameterization value in [0, 1]
     * @return the rotation at point (t) in the interpolation to the target
     */
    public static Quat4f slerp(Quat4f from, Quat4f to, float t) {
        var tx = to.x;
        var ty = to.y;
        var tz = to.z;
        var tw = to.w;
        double dot = from.x * tx + from.y * ty + from.z * tz + from.w * tw;
        if (dot < 0.0) {
            tx = -tx;
            ty = -ty;
            tz = -tz;
            tw = -tw;
            dot = -dot;
        }

        if (dot > NLERP_THRESHOLD) {
            return normalized(new Quat4f(lerp(from.x, tx, t), lerp(from.y, ty, t), lerp(from.z, tz, t),
                                         lerp(from.w, tw, t)));
        }

        double theta = acos(dot);
        double sinTheta = sin(theta);
        double fromFactor = sin((1.0 - t) * theta) / sinTheta;
        double toFactor = sin(t * theta) / sinTheta;

        return new Quat4f((float) (fromFactor * from.x + toFactor * tx), (float) (fromFactor * from.y + toFactor * ty),
                          (float) (fromFactor * from.z + toFactor * tz), (float) (fromFactor * from.w + toFactor * tw));
    }

    /**
     * Angular distance between two unit rotations
     *
     * @return the angle in radians, in [0, PI]
     */
    public static float angle(Quat4f a, Quat4f b) {
        var dot = Math.abs(a.x * b.x + a.y * b.y + a.z * b.z + a.w * b.w);
        return (float) (2.0 * acos(Math.min(1.0, dot)));
    }

    /**
     * @return the ZYX euler angles, in degrees, of the unit rotation
     */
    public static Vector3f toEulerAngles(Quat4f q) {
        var sinrCosp = 2.0 * (q.w * q.x + q.y * q.z);
        var cosrCosp = 1.0 - 2.0 * (q.x * q.x + q.y * q.y);
        var roll = atan2(sinrCosp, cosrCosp);

        var sinp = 2.0 * (q.w * q.y - q.z * q.x);
        var pitch = asin(Math.max(-1.0, Math.min(1.0, sinp)));

        var sinyCosp = 2.0 * (q.w * q.z + q.x * q.y);
        var cosyCosp = 1.0 - 2.0 * (q.y * q.y + q.z * q.z);
        var yaw = atan2(sinyCosp, cosyCosp);

        return new Vector3f((float) Math.toDegrees(roll), (float) Math.toDegrees(pitch), (float) Math.toDegrees(yaw));
    }

    /**
     * @return the unit rotation for the ZYX euler angles, in degrees
     */
    public static Quat4f fromEulerAngles(float x, float y, float z) {
        var hx = Math.toRadians(x) * 0.5;
        var hy = Math.toRadians(y) * 0.5;
        var hz = Math.toRadians(z) * 0.5;
        var cr = Math.cos(hx);
        var sr = Math.sin(hx);
        var cp = Math.cos(hy);
        var sp = Math.sin(hy);
        var cy = Math.cos(hz);
        var sy = Math.sin(hz);

        return new Quat4f((float) (sr * cp * cy - cr * sp * sy), (float) (cr * sp * cy + sr * cp * sy),
                          (float) (cr * cp * sy - sr * sp * cy), (float) (cr * cp * cy + sr * sp * sy));
    }

    private static float lerp(float from, float to, float t) {
        return from + t * (to - from);
    }

    private Quaternions() {
    }
}
