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

import io.tsvstore.core.vector.ColumnVector;

/**
 * The closed set of column variants.
 */
public enum ColumnType
{
    BINNED_FLOAT(ColumnVector.Type.FLOAT),
    RAW_FLOAT(ColumnVector.Type.FLOAT),
    STRING(ColumnVector.Type.STRING);

    private final ColumnVector.Type vectorType;

    ColumnType(ColumnVector.Type vectorType)
    {
        this.vectorType = vectorType;
    }

    /**
     * @return the type of the row block vectors this kind of column is populated from
     */
    public ColumnVector.Type getVectorType()
    {
        return vectorType;
    }

    public boolean isFloat()
    {
        return vectorType == ColumnVector.Type.FLOAT;
    }
}
