/*
 * Copyright 2024 TsvStore.
 *
 * This file is part of TsvStore.
 *
 * TsvStore is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * TsvStore is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with TsvStore.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.tsvstore.core.utils;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestDynamicFloatArray
{
    @Test
    public void testAddAll()
    {
        DynamicFloatArray array = new DynamicFloatArray(16);
        float[] values = new float[100];
        for (int i = 0; i < values.length; ++i)
        {
            values[i] = i * 0.5f;
        }
        array.add(-1.0f);
        // only the first 90 values are taken
        array.addAll(values, 90);
        assertEquals(91, array.size());
        float[] floats = array.toArray();
        assertEquals(91, floats.length);
        assertEquals(-1.0f, floats[0], 0.0f);
        for (int i = 0; i < 90; ++i)
        {
            assertEquals(values[i], floats[i + 1], 0.0f);
            assertEquals(values[i], array.get(i + 1), 0.0f);
        }
    }

    @Test
    public void testNaNIsKept()
    {
        DynamicFloatArray array = new DynamicFloatArray();
        array.add(Float.NaN);
        array.add(2.0f);
        float[] floats = array.toArray();
        assertTrue(Float.isNaN(floats[0]));
        assertEquals(2.0f, floats[1], 0.0f);
    }
}
