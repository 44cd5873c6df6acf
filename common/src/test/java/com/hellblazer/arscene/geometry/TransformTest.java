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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TransformTest {

    @Test
    void testInterpolate() {
        var start = Transform.IDENTITY;
        var end = new Transform(new Point3f(2f, 0f, -4f), Quaternions.fromEulerAngles(0f, 90f, 0f),
                                new Vector3f(3f, 3f, 3f));
        var mid = start.interpolate(end, 0.5f);
        assertTrue(mid.position().epsilonEquals(new Point3f(1f, 0f, -2f), 1e-5f));
        assertTrue(mid.scale().epsilonEquals(new Vector3f(2f, 2f, 2f), 1e-5f));
        assertEquals(Math.toRadians(45.0), Quaternions.angle(Quaternions.identity(), mid.rotation()), 1e-3);

        assertSame(start, start.interpolate(end, -1f));
        assertSame(end, start.interpolate(end, 7f));
    }

    @Test
    void testMatrixComposesTranslationRotationScale() {
        var transform = new Transform(new Point3f(1f, 0f, 0f), Quaternions.fromEulerAngles(0f, 0f, 90f),
                                      new Vector3f(2f, 2f, 2f));
        var p = new Point3f(1f, 0f, 0f);
        transform.toMatrix().transform(p);
        // scaled to (2,0,0), rotated to (0,2,0), translated to (1,2,0)
        assertTrue(p.epsilonEquals(new Point3f(1f, 2f, 0f), 1e-5f), p.toString());
    }

    @Test
    void testWithers() {
        var transform = Transform.IDENTITY.withPosition(new Point3f(0f, 1f, 0f));
        assertEquals(new Point3f(0f, 1f, 0f), transform.position());
        assertEquals(Transform.IDENTITY.rotation(), transform.rotation());
        assertNotEquals(Transform.IDENTITY, transform);
        assertEquals(transform, Transform.of(new Point3f(0f, 1f, 0f), Quaternions.identity()));
        assertTrue(transform.withScale(new Vector3f(2f, 2f, 2f))
                            .withScale(new Vector3f(1f, 1f, 1f))
                            .epsilonEquals(transform, 1e-6f));
    }
}
