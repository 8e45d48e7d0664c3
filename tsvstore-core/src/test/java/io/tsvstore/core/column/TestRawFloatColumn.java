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
package io.tsvstore.core.column;

import org.junit.Test;

import static io.tsvstore.core.column.ColumnTestUtils.floats;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestRawFloatColumn
{
    @Test
    public void testValuesInAddOrder()
    {
        RawFloatColumn column = (RawFloatColumn) Column.newColumn(ColumnType.RAW_FLOAT, "c", 255);
        column.add(floats(2.0f, Float.NaN));
        column.add(floats());
        column.add(floats(4.5f));
        assertEquals(3, column.size());
        column.finalizeColumn();

        assertEquals(3, column.size());
        assertEquals(2.0f, column.get(0), 0.0f);
        assertTrue(Float.isNaN(column.get(1)));
        assertEquals(4.5f, column.get(2), 0.0f);
        float[] values = column.getValues();
        values[0] = -1.0f;
        assertArrayEquals(new float[]{2.0f, Float.NaN, 4.5f}, column.getValues(), 0.0f);
    }
}
