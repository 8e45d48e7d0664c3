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
package io.tsvstore.core.parser;

import com.google.common.collect.ImmutableSet;
import io.tsvstore.common.exception.RowBlockParseException;
import io.tsvstore.core.vector.RowBlock;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestTsvRowBlockParser
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final TsvRowBlockParser parser = new TsvRowBlockParser(TsvRowBlockParser.parseNullMarkers(",\\N,NA"));

    private Path write(String name, String content) throws IOException
    {
        File file = folder.newFile(name);
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file.toPath();
    }

    @Test
    public void testLayoutFollowsPositions() throws Exception
    {
        Path file = write("part-0.tsv", "1.0\tx\t2.0\n3.0\ty\t4.0\n");
        // float columns c then a, string column b
        RowBlock block = parser.parse(file, new int[]{2, 0}, new int[]{1});
        assertEquals(2, block.getNumRows());
        assertTrue(block.isConsistent());
        assertEquals(file.toString(), block.getPath());
        assertEquals(2.0f, block.getFloatColumn(0).get(0), 0.0f);
        assertEquals(4.0f, block.getFloatColumn(0).get(1), 0.0f);
        assertEquals(1.0f, block.getFloatColumn(1).get(0), 0.0f);
        assertEquals(3.0f, block.getFloatColumn(1).get(1), 0.0f);
        assertEquals("x", block.getStringColumn(0).get(0));
        assertEquals("y", block.getStringColumn(0).get(1));
    }

    @Test
    public void testNullMarkersAndEmptyLines() throws Exception
    {
        Path file = write("part-1.tsv", "\\N\ta\n\n NA \tb\n\tc\n5e-1\t\n");
        RowBlock block = parser.parse(file, new int[]{0}, new int[]{1});
        assertEquals(4, block.getNumRows());
        assertTrue(Float.isNaN(block.getFloatColumn(0).get(0)));
        assertTrue(Float.isNaN(block.getFloatColumn(0).get(1)));
        assertTrue(Float.isNaN(block.getFloatColumn(0).get(2)));
        assertEquals(0.5f, block.getFloatColumn(0).get(3), 0.0f);
        // trailing empty field is kept as an empty string
        assertEquals("", block.getStringColumn(0).get(3));
    }

    @Test
    public void testWithoutNullMarkers() throws Exception
    {
        Path file = write("part-2.tsv", "NA\n");
        TsvRowBlockParser strict = new TsvRowBlockParser(ImmutableSet.of());
        try
        {
            strict.parse(file, new int[]{0}, new int[0]);
            fail("NA is not a float without null markers");
        }
        catch (RowBlockParseException e)
        {
            assertTrue(e.getMessage().startsWith(file + ":1:"));
            assertTrue(e.getCause() instanceof NumberFormatException);
        }
    }

    @Test
    public void testTooFewFields() throws Exception
    {
        Path file = write("part-3.tsv", "1.0\tx\t2.0\n3.0\ty\n");
        try
        {
            parser.parse(file, new int[]{2, 0}, new int[]{1});
            fail("the second line has only two fields");
        }
        catch (RowBlockParseException e)
        {
            assertTrue(e.getMessage(), e.getMessage().startsWith(file + ":2:"));
            assertTrue(e.getMessage().contains("3 fields"));
        }
    }

    @Test(expected = RowBlockParseException.class)
    public void testBadFloat() throws Exception
    {
        parser.parse(write("part-4.tsv", "abc\tx\n"), new int[]{0}, new int[]{1});
    }

    @Test
    public void testFloatSuffixIsRejected() throws Exception
    {
        Path file = write("part-6.tsv", "1.0\tx\n1.0f\ty\n");
        try
        {
            parser.parse(file, new int[]{0}, new int[]{1});
            fail("1.0f is not a decimal float");
        }
        catch (RowBlockParseException e)
        {
            assertTrue(e.getMessage(), e.getMessage().startsWith(file + ":2:"));
            assertTrue(e.getCause() instanceof NumberFormatException);
        }
    }

    @Test
    public void testEmptyFile() throws Exception
    {
        RowBlock block = parser.parse(write("part-5.tsv", ""), new int[]{0}, new int[]{1});
        assertTrue(block.isEmpty());
        assertEquals(1, block.getNumFloatColumns());
    }

    @Test
    public void testParseNullMarkers()
    {
        assertEquals(ImmutableSet.of("", "\\N", "NA"), TsvRowBlockParser.parseNullMarkers(" , \\N ,NA"));
    }
}
