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
package io.tsvstore.core.catalog;

import io.tsvstore.common.exception.InvalidConfigException;
import io.tsvstore.core.column.ColumnType;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestColumnConfig
{
    @Test
    public void testFromProperties() throws Exception
    {
        Properties properties = new Properties();
        properties.setProperty("columns.binned.float", "a, d");
        properties.setProperty("columns.raw.float", "c");
        properties.setProperty("columns.string", " b ,");
        ColumnConfig config = ColumnConfig.fromProperties(properties);
        assertEquals(Arrays.asList("a", "d"), config.getColumns(ColumnType.BINNED_FLOAT));
        assertEquals(Collections.singletonList("c"), config.getRawFloatColumns());
        assertEquals(Collections.singletonList("b"), config.getStringColumns());
        assertEquals(4, config.getNumColumns());
        config.validate();
    }

    @Test
    public void testMissingPropertiesAreEmpty()
    {
        ColumnConfig config = ColumnConfig.fromProperties(new Properties());
        assertEquals(0, config.getNumColumns());
        assertTrue(ColumnConfig.splitNames(null).isEmpty());
    }

    @Test
    public void testDuplicateInOneList()
    {
        ColumnConfig config = ColumnConfig.newBuilder().addRawFloatColumns("c", "c").build();
        try
        {
            config.validate();
            fail();
        }
        catch (InvalidConfigException e)
        {
            assertTrue(e.getMessage().contains("'c'"));
        }
    }

    @Test(expected = InvalidConfigException.class)
    public void testDuplicateAcrossLists() throws Exception
    {
        ColumnConfig.newBuilder().addBinnedFloatColumns("a").addStringColumns("a").build().validate();
    }

    @Test(expected = InvalidConfigException.class)
    public void testEmptyName() throws Exception
    {
        ColumnConfig.newBuilder().addStringColumns("").build().validate();
    }
}
