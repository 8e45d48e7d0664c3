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

import io.tsvstore.core.utils.DynamicFloatArray;
import io.tsvstore.core.vector.ColumnVector;
import io.tsvstore.core.vector.FloatColumnVector;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * A float column whose values are replaced by the ids of the bins they fall into.
 * <p>
 * The raw values are buffered while row blocks are added. On finalization, at most
 * {@code maxBins} bins are built from the sorted non-missing values: each distinct
 * value gets its own bin if there are not more than {@code maxBins} of them, otherwise
 * the bounds are the equal-frequency quantiles of the values. Bin i (i >= 1) covers
 * the values in (upperBound[i-2], upperBound[i-1]]. Missing values (NaN) go to
 * {@link #MISSING_BIN}.
 * </p>
 */
public final class BinnedFloatColumn extends Column
{
    public static final int MISSING_BIN = 0;
    /**
     * Bin ids are stored as shorts, and bin 0 is reserved for missing values.
     */
    public static final int MAX_BINS_LIMIT = Short.MAX_VALUE - 1;

    private final int maxBins;
    private DynamicFloatArray buffer = new DynamicFloatArray();
    private short[] bins = null;
    private float[] upperBounds = null;

    BinnedFloatColumn(String name, int maxBins)
    {
        super(name);
        checkArgument(maxBins > 0 && maxBins <= MAX_BINS_LIMIT,
                "maxBins must be in [1, %s], but it is %s", MAX_BINS_LIMIT, maxBins);
        this.maxBins = maxBins;
    }

    @Override
    public ColumnType getType()
    {
        return ColumnType.BINNED_FLOAT;
    }

    @Override
    protected void doAdd(ColumnVector slice)
    {
        FloatColumnVector floats = (FloatColumnVector) slice;
        buffer.addAll(floats.vector, floats.size());
    }

    @Override
    protected void doFinalize()
    {
        float[] values = buffer.toArray();
        upperBounds = computeUpperBounds(values, maxBins);
        bins = new short[values.length];
        for (int i = 0; i < values.length; ++i)
        {
            bins[i] = (short) binOf(upperBounds, values[i]);
        }
        buffer = null;
    }

    static float[] computeUpperBounds(float[] values, int maxBins)
    {
        float[] sorted = new float[values.length];
        int n = 0;
        for (float value : values)
        {
            if (!Float.isNaN(value))
            {
                sorted[n++] = normalizeZero(value);
            }
        }
        Arrays.sort(sorted, 0, n);

        int numDistinct = 0;
        for (int i = 0; i < n; ++i)
        {
            if (i == 0 || sorted[i] != sorted[i - 1])
            {
                numDistinct++;
            }
        }
        float[] bounds = new float[Math.min(numDistinct, maxBins)];
        int numBounds = 0;
        if (numDistinct <= maxBins)
        {
            for (int i = 0; i < n; ++i)
            {
                if (i == 0 || sorted[i] != sorted[i - 1])
                {
                    bounds[numBounds++] = sorted[i];
                }
            }
            return bounds;
        }

        // equal-frequency bins, a bound repeated by a frequent value is kept once.
        for (int k = 1; k <= maxBins; ++k)
        {
            float bound = sorted[(int) ((long) k * n / maxBins) - 1];
            if (numBounds == 0 || bound > bounds[numBounds - 1])
            {
                bounds[numBounds++] = bound;
            }
        }
        return Arrays.copyOf(bounds, numBounds);
    }

    /**
     * Arrays.sort and Arrays.binarySearch order -0.0f before 0.0f, while == treats them
     * as equal, so both are mapped to 0.0f.
     */
    private static float normalizeZero(float value)
    {
        return value == 0.0f ? 0.0f : value;
    }

    static int binOf(float[] upperBounds, float value)
    {
        if (Float.isNaN(value))
        {
            return MISSING_BIN;
        }
        int pos = Arrays.binarySearch(upperBounds, normalizeZero(value));
        if (pos < 0)
        {
            // the insertion point, i.e., the first bound greater than value
            pos = -pos - 1;
        }
        // values above the last bound can not exist, all values are seen when the bounds are computed
        return Math.min(pos, upperBounds.length - 1) + 1;
    }

    @Override
    public int size()
    {
        return bins != null ? bins.length : buffer.size();
    }

    public int getMaxBins()
    {
        return maxBins;
    }

    /**
     * @return the id of the bin of the value at the row
     */
    public int getBin(int row)
    {
        checkReadable();
        return bins[row];
    }

    /**
     * @return the number of bins, the bin of missing values included
     */
    public int getNumBins()
    {
        checkReadable();
        return upperBounds.length + 1;
    }

    /**
     * @return a copy of the upper bounds of the non-missing bins, in ascending order
     */
    public float[] getBinUpperBounds()
    {
        checkReadable();
        return Arrays.copyOf(upperBounds, upperBounds.length);
    }

    /**
     * @return the value standing for the bin, i.e., its upper bound, or NaN for the missing bin
     */
    public float getBinRepresentative(int bin)
    {
        checkReadable();
        checkElementIndex(bin, upperBounds.length + 1, "bin");
        return bin == MISSING_BIN ? Float.NaN : upperBounds[bin - 1];
    }
}
