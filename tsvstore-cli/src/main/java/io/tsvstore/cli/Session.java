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
package io.tsvstore.cli;

import io.tsvstore.core.pipeline.ColumnStore;

/**
 * The state kept by the shell between commands.
 */
public class Session
{
    private ColumnStore store = null;

    /**
     * @return the store of the last successful LOAD, or null if nothing is loaded
     */
    public synchronized ColumnStore getStore()
    {
        return store;
    }

    public synchronized void setStore(ColumnStore store)
    {
        this.store = store;
    }
}
