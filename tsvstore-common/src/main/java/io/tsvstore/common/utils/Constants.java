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
package io.tsvstore.common.utils;

/**
 * The property keys and default values of tsvstore.
 */
public final class Constants
{
    private Constants() { }

    public static final String NUM_THREADS_KEY = "store.num.threads";
    public static final String BINNED_MAX_BINS_KEY = "column.binned.max.bins";
    public static final String NULL_MARKERS_KEY = "tsv.null.markers";

    public static final String BINNED_FLOAT_COLUMNS_KEY = "columns.binned.float";
    public static final String RAW_FLOAT_COLUMNS_KEY = "columns.raw.float";
    public static final String STRING_COLUMNS_KEY = "columns.string";

    public static final int DEFAULT_MAX_BINS = 255;
    public static final String DEFAULT_NULL_MARKERS = ",\\N,NA";

    public static final char FIELD_DELIMITER = '\t';
}
