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

import javax.vecmath.Matrix4f;
import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;

/**
 * An immutable rigid transformation from an object's local frame to the world frame: a translation followed by a unit
 * rotation.
 * <p>
 * Poses are reported by the tracking subsystem for the device camera, trackables, anchors and hit results. A pose is a
 * snapshot; it is superseded on each frame and never mutated. The accessors returning vecmath tuples hand out copies.
 *
 * @author hal.hildebrand
 */
public final class Pose {
    public static final Pose IDENTITY = new Pose(0f, 0f, 0f, 0f, 0f, 0f, 1f);

    /**
     * Index of the X axis for {@link #getTransformedAxis(int)}
     */
    public static final int X_AXIS = 0;
    public static final int Y_AXIS = 1;
    public static final int Z_AXIS = 2;

    public static Pose makeRotation(float qx, float qy, float qz, float qw) {
        return new Pose(0f, 0f, 0f, qx, qy, qz, qw);
    }

    public static Pose makeRotation(Quat4f rotation) {
        return new Pose(new Point3f(), rotation);
    }

    public static Pose makeTranslation(float tx, float ty, float tz) {
        return new Pose(tx, ty, tz, 0f, 0f, 0f, 1f);
    }

    public static Pose makeTranslation(Tuple3f translation) {
        return makeTranslation(translation.x, translation.y, translation.z);
    }

    /**
     * @return true if both poses are null or both have the same translation
     */
    public static boolean samePosition(Pose a, Pose b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        return a.tx == b.tx && a.ty == b.ty && a.tz == b.tz;
    }

    /**
     * @return true if both poses are null or both have the same rotation
     */
    public static boolean sameRotation(Pose a, Pose b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        return a.qx == b.qx && a.qy == b.qy && a.qz == b.qz && a.qw == b.qw;
    }

    private final float tx, ty, tz;
    private final float qx, qy, qz, qw;

    public Pose(float tx, float ty, float tz, float qx, float qy, float qz, float qw) {
        var q = Quaternions.normalized(new Quat4f(qx, qy, qz, qw));
        this.tx = tx;
        this.ty = ty;
        this.tz = tz;
        this.qx = q.x;
        this.qy = q.y;
        this.qz = q.z;
        this.qw = q.w;
    }

    /**
     * @param translation - the world position
     * @param rotation    - the orientation, normalized on construction
     */
    public Pose(Tuple3f translation, Quat4f rotation) {
        this(translation.x, translation.y, translation.z, rotation.x, rotation.y, rotation.z, rotation.w);
    }

    /**
     * @param translation - array of (x, y, z)
     * @param rotation    - array of (qx, qy, qz, qw)
     */
    public Pose(float[] translation, float[] rotation) {
        this(translation[0], translation[1], translation[2], rotation[0], rotation[1], rotation[2], rotation[3]);
    }

    /**
     * @return the pose resulting from applying rhs and then this pose
     */
    public Pose compose(Pose rhs) {
        var q = rotation();
        var t = Quaternions.rotate(q, new Vector3f(rhs.tx, rhs.ty, rhs.tz));
        var r = Quaternions.multiply(q, rhs.rotation());
        return new Pose(t.x + tx, t.y + ty, t.z + tz, r.x, r.y, r.z, r.w);
    }

    /**
     * Signed distance from this pose to the camera along this pose's +Y axis. For a plane or hit pose whose Y axis is
     * the surface normal, a positive value means the camera is in front of the surface.
     *
     * @param cameraPose - the camera pose
     * @return the normal distance
     */
    public float distanceToPlane(Pose cameraPose) {
        var normal = getTransformedAxis(Y_AXIS);
        return (cameraPose.tx - tx) * normal.x + (cameraPose.ty - ty) * normal.y + (cameraPose.tz - tz) * normal.z;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Pose other)) {
            return false;
        }
        return samePosition(this, other) && sameRotation(this, other);
    }

    public boolean epsilonEquals(Pose other, float epsilon) {
        return Math.abs(tx - other.tx) <= epsilon && Math.abs(ty - other.ty) <= epsilon
        && Math.abs(tz - other.tz) <= epsilon && Quaternions.angle(rotation(), other.rotation()) <= epsilon;
    }

    /**
     * @return the ZYX euler angles of the rotation, in degrees
     */
    public Vector3f eulerAngles() {
        return Quaternions.toEulerAngles(rotation());
    }

    /**
     * The world direction of one of this pose's local axes
     *
     * @param axis - {@link #X_AXIS}, {@link #Y_AXIS} or {@link #Z_AXIS}
     * @return the unit direction vector
     */
    public Vector3f getTransformedAxis(int axis) {
        var local = switch (axis) {
        case X_AXIS -> new Vector3f(1f, 0f, 0f);
        case Y_AXIS -> new Vector3f(0f, 1f, 0f);
        case Z_AXIS -> new Vector3f(0f, 0f, 1f);
        default -> throw new IllegalArgumentException("Unknown axis: " + axis);
        };
        return Quaternions.rotate(rotation(), local);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tx, ty, tz, qx, qy, qz, qw);
    }

    public Pose inverse() {
        var inv = Quaternions.conjugate(rotation());
        var t = Quaternions.rotate(inv, new Vector3f(-tx, -ty, -tz));
        return new Pose(t.x, t.y, t.z, inv.x, inv.y, inv.z, inv.w);
    }

    public Point3f position() {
        return new Point3f(tx, ty, tz);
    }

    public float qw() {
        return qw;
    }

    public float qx() {
        return qx;
    }

    public float qy() {
        return qy;
    }

    public float qz() {
        return qz;
    }

    public Vector3f rotateVector(Vector3f vector) {
        return Quaternions.rotate(rotation(), vector);
    }

    public Quat4f rotation() {
        return new Quat4f(qx, qy, qz, qw);
    }

    /**
     * @return the column-major style rigid transformation matrix, translation in the fourth column
     */
    public Matrix4f toMatrix() {
        return new Matrix4f(rotation(), new Vector3f(tx, ty, tz), 1f);
    }

    @Override
    public String toString() {
        return String.format("Pose t:[x:%.3f, y:%.3f, z:%.3f], q:[x:%.2f, y:%.2f, z:%.2f, w:%.2f]", tx, ty, tz, qx, qy,
                             qz, qw);
    }

    /**
     * @return the transform with this pose's translation and rotation and unit scale
     */
    public Transform toTransform() {
        return new Transform(position(), rotation(), Transform.UNIT_SCALE);
    }

    public Point3f transformPoint(Tuple3f point) {
        var rotated = Quaternions.rotate(rotation(), new Vector3f(point));
        return new Point3f(rotated.x + tx, rotated.y + ty, rotated.z + tz);
    }

    public float tx() {
        return tx;
    }

    public float ty() {
        return ty;
    }

    public float tz() {
        return tz;
    }
}
