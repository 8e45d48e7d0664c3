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
package io.tsvstore.cli.executor;

import io.tsvstore.cli.Session;
import io.tsvstore.core.column.BinnedFloatColumn;
import io.tsvstore.core.column.Column;
import io.tsvstore.core.column.StringColumn;
import io.tsvstore.core.pipeline.ColumnStore;
import net.sourceforge.argparse4j.inf.Namespace;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * STAT [-n column]
 * <p>
 * Print the summary of the last loaded store, or the details of one column in it.
 * </p>
 */
public class StatExecutor implements CommandExecutor
{
    private final Session session;

    public StatExecutor(Session session)
    {
        this.session = requireNonNull(session, "session is null");
    }

    @Override
    public void execute(Namespace ns, String command) throws Exception
    {
        ColumnStore store = session.getStore();
        if (store == null)
        {
            System.out.println("nothing is loaded, run LOAD first");
            return;
        }
        String columnName = ns.getString("column");
        if (columnName == null)
        {
            System.out.println(store.describe());
            return;
        }
        Column column = store.getColumn(columnName);
        if (column == null)
        {
            System.err.println(command + " failed: column '" + columnName + "' is not loaded");
            return;
        }
        System.out.println(describeColumn(column));
    }

    static String describeColumn(Column column)
    {
        StringBuilder builder = new StringBuilder();
        builder.append(column.getName()).append(": ").append(column.getType())
                .append(", ").append(column.size()).append(" values");
        switch (column.getType())
        {
            case BINNED_FLOAT:
                BinnedFloatColumn binned = (BinnedFloatColumn) column;
                builder.append("\nbins: ").append(binned.getNumBins())
                        .append("\nupper bounds: ").append(Arrays.toString(binned.getBinUpperBounds()));
                break;
            case STRING:
                StringColumn strings = (StringColumn) column;
                String[] dictionary = strings.getDictionary();
                builder.append("\ndistinct values: ").append(dictionary.length);
                // at most 10 values are printed
                int shown = Math.min(dictionary.length, 10);
                builder.append("\ndictionary: ").append(Arrays.toString(Arrays.copyOf(dictionary, shown)));
                if (shown < dictionary.length)
                {
                    builder.append(" ...");
                }
                break;
            default:
                break;
        }
        return builder.toString();
    }
}
