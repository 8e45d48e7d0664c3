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

import io.tsvstore.cli.Main;
import io.tsvstore.cli.Session;
import io.tsvstore.core.pipeline.ColumnStore;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

public class TestLoadExecutor
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path write(File dir, String name, String content) throws IOException
    {
        Path path = new File(dir, name).toPath();
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void testLoadDirectoryInNameOrder() throws Exception
    {
        File dataDir = folder.newFolder("data");
        Path header = write(folder.getRoot(), "header.tsv", "a\tb\tc\n");
        // written out of name order
        write(dataDir, "part-2.tsv", "3.0\ty\t4.0\n");
        write(dataDir, "part-1.tsv", "1.0\tx\t2.0\n");
        new File(dataDir, "nested").mkdir();

        Session session = new Session();
        Namespace ns = Main.newLoadParser().parseArgs(new String[]{
                "-h", header.toString(), "-i", dataDir.getPath(), "-b", "a", "-r", "c", "-s", "b", "-c", "2"});
        new LoadExecutor(session).execute(ns, "LOAD");

        ColumnStore store = session.getStore();
        assertNotNull(store);
        assertEquals(2, store.getNumRows());
        assertArrayEquals(new float[]{2.0f, 4.0f}, store.getRawFloatColumn("c").getValues(), 0.0f);
        assertEquals("x", store.getStringColumn("b").get(0));
    }

    @Test
    public void testLoadWithPropertiesFile() throws Exception
    {
        Path header = write(folder.getRoot(), "header.tsv", "a\tb\tc\n");
        Path file1 = write(folder.getRoot(), "1.tsv", "-\tx\t2.0\n");
        Path props = write(folder.getRoot(), "columns.properties",
                "columns.raw.float=a,c\ncolumns.string=b\ntsv.null.markers=-\nstore.num.threads=1\n");

        Session session = new Session();
        Namespace ns = Main.newLoadParser().parseArgs(new String[]{
                "-h", header.toString(), "-i", file1.toString(), "-f", props.toString()});
        new LoadExecutor(session).execute(ns, "LOAD");

        ColumnStore store = session.getStore();
        assertNotNull(store);
        assertEquals(3, store.getNumColumns());
        assertEquals(Float.NaN, store.getRawFloatColumn("a").get(0), 0.0f);
    }

    @Test
    public void testFailedLoadKeepsPreviousStore() throws Exception
    {
        Path header = write(folder.getRoot(), "header.tsv", "a\tb\tc\n");
        Session session = new Session();
        Namespace ns = Main.newLoadParser().parseArgs(new String[]{
                "-h", header.toString(), "-i", new File(folder.getRoot(), "absent.tsv").getPath(), "-r", "a"});
        new LoadExecutor(session).execute(ns, "LOAD");
        assertNull(session.getStore());
    }

    @Test
    public void testExpandInputs() throws Exception
    {
        File dir = folder.newFolder("parts");
        write(dir, "b.tsv", "");
        write(dir, "a.tsv", "");
        Path single = write(folder.getRoot(), "z.tsv", "");
        List<Path> files = LoadExecutor.expandInputs(Arrays.asList(single.toString(), dir.getPath()));
        assertEquals(3, files.size());
        assertEquals(single, files.get(0));
        assertEquals("a.tsv", files.get(1).getFileName().toString());
        assertEquals("b.tsv", files.get(2).getFileName().toString());
    }
}
