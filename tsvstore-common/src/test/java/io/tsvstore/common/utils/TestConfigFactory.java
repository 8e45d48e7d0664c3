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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class TestConfigFactory
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaultsFromClassPath()
    {
        ConfigFactory config = ConfigFactory.Instance();
        assertEquals("255", config.getProperty(Constants.BINNED_MAX_BINS_KEY));
        assertEquals(Constants.DEFAULT_NULL_MARKERS, config.getProperty(Constants.NULL_MARKERS_KEY));
        assertEquals("", config.getProperty(Constants.STRING_COLUMNS_KEY));
        assertNull(config.getProperty("test.absent.key"));
        assertEquals("fallback", config.getProperty("test.absent.key", "fallback"));
    }

    @Test
    public void testAddPropertyCallsBack()
    {
        ConfigFactory config = ConfigFactory.Instance();
        AtomicReference<String> updated = new AtomicReference<>();
        config.registerUpdateCallback("test.callback.key", updated::set);
        config.addProperty("test.callback.key", "v1");
        assertEquals("v1", updated.get());
        assertEquals("v1", config.getProperty("test.callback.key"));
    }

    @Test
    public void testLoadPropertiesOverrides() throws IOException
    {
        File file = folder.newFile("override.properties");
        Files.write(file.toPath(), "test.loaded.key=loaded\ntest.reload.key=7\n".getBytes(StandardCharsets.UTF_8));
        ConfigFactory config = ConfigFactory.Instance();
        AtomicReference<String> updated = new AtomicReference<>();
        config.registerUpdateCallback("test.reload.key", updated::set);
        config.loadProperties(file.getPath());
        assertEquals("loaded", config.getProperty("test.loaded.key"));
        assertEquals("7", updated.get());
    }
}
