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

import io.tsvstore.core.utils.DynamicIntArray;
import io.tsvstore.core.vector.ColumnVector;
import io.tsvstore.core.vector.StringColumnVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A dictionary encoded string column.
 * <p>
 * Each distinct value gets the id of the order it is first seen in, starting
 * from 0. The ids are assigned while the row blocks are added, so the blocks
 * must be added in the order of the input files.
 * </p>
 */
public final class StringColumn extends Column
{
    private Map<String, Integer> dictionary = new HashMap<>();
    private List<String> keys = new ArrayList<>();
    private DynamicIntArray idBuffer = new DynamicIntArray();

    private String[] frozenKeys = null;
    private int[] ids = null;

    StringColumn(String name)
    {
        super(name);
    }

    @Override
    public ColumnType getType()
    {
        return ColumnType.STRING;
    }

    @Override
    protected void doAdd(ColumnVector slice)
    {
        StringColumnVector strings = (StringColumnVector) slice;
        for (int i = 0; i < strings.size(); ++i)
        {
            String value = strings.vector[i];
            Integer id = dictionary.get(value);
            if (id == null)
            {
                id = keys.size();
                dictionary.put(value, id);
                keys.add(value);
            }
            idBuffer.add(id);
        }
    }

    @Override
    protected void doFinalize()
    {
        frozenKeys = keys.toArray(new String[0]);
        ids = idBuffer.toArray();
        keys = null;
        idBuffer = null;
    }

    @Override
    public int size()
    {
        return ids != null ? ids.length : idBuffer.size();
    }

    public String get(int row)
    {
        checkReadable();
        return frozenKeys[ids[row]];
    }

    public int getId(int row)
    {
        checkReadable();
        return ids[row];
    }

    /**
     * @return the id of the value, or -1 if the value is not in this column
     */
    public int lookup(String value)
    {
        checkReadable();
        Integer id = dictionary.get(value);
        return id == null ? -1 : id;
    }

    public int getDictionarySize()
    {
        checkReadable();
        return frozenKeys.length;
    }

    /**
     * @return a copy of the dictionary, the value of id i is at index i
     */
    public String[] getDictionary()
    {
        checkReadable();
        return Arrays.copyOf(frozenKeys, frozenKeys.length);
    }
}
