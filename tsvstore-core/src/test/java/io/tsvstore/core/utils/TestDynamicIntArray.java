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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class TestDynamicIntArray
{
    @Test
    public void testAddAcrossChunks()
    {
        DynamicIntArray array = new DynamicIntArray(64);
        for (int i = 0; i < 1000; ++i)
        {
            array.add(i);
        }
        assertEquals(1000, array.size());
        int[] ints = array.toArray();
        assertEquals(1000, ints.length);
        for (int i = 0; i < ints.length; ++i)
        {
            assertEquals(i, ints[i]);
            assertEquals(i, array.get(i));
        }
    }

    @Test
    public void testToArrayOnChunkBoundary()
    {
        DynamicIntArray array = new DynamicIntArray(8);
        for (int i = 0; i < 16; ++i)
        {
            array.add(i * 2);
        }
        int[] ints = array.toArray();
        assertEquals(16, ints.length);
        assertEquals(30, ints[15]);
    }

    @Test
    public void testEmptyAndClear()
    {
        DynamicIntArray array = new DynamicIntArray();
        assertArrayEquals(new int[0], array.toArray());
        array.add(7);
        array.clear();
        assertEquals(0, array.size());
        array.add(9);
        assertArrayEquals(new int[]{9}, array.toArray());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testGetOutOfRange()
    {
        DynamicIntArray array = new DynamicIntArray();
        array.add(1);
        array.get(1);
    }
}
