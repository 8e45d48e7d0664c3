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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * The process-wide configuration of tsvstore.
 * <p>
 * The properties are loaded from the file given by TSVSTORE_CONFIG, or
 * $TSVSTORE_HOME/etc/tsvstore.properties if TSVSTORE_CONFIG is not set,
 * or tsvstore.properties under the class path if neither is set.
 * </p>
 */
public class ConfigFactory
{
    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static ConfigFactory instance = null;

    public static synchronized ConfigFactory Instance()
    {
        if (instance == null)
        {
            instance = new ConfigFactory();
        }
        return instance;
    }

    // Properties is thread safe, so we do not add synchronization to it.
    private final Properties prop;

    /**
     * By registering an update callback, other classes can get their
     * members updated when the properties are reloaded or updated.
     */
    public interface UpdateCallback
    {
        void update(String value);
    }

    private final Map<String, UpdateCallback> callbacks;

    private ConfigFactory()
    {
        prop = new Properties();
        callbacks = new HashMap<>();
        String storeConfig = System.getenv("TSVSTORE_CONFIG");
        String storeHome = System.getenv("TSVSTORE_HOME");
        if (storeHome != null)
        {
            prop.setProperty("tsvstore.home", storeHome);
        }
        if (storeConfig == null && storeHome != null)
        {
            if (!(storeHome.endsWith("/") || storeHome.endsWith("\\")))
            {
                storeHome += "/";
            }
            storeConfig = storeHome + "etc/tsvstore.properties";
        }

        // the defaults under the class path are always loaded, the external file overrides them.
        try (InputStream in = this.getClass().getResourceAsStream("/tsvstore.properties"))
        {
            if (in != null)
            {
                prop.load(in);
            }
        }
        catch (IOException e)
        {
            logger.error("failed to load tsvstore.properties from class path", e);
        }

        if (storeConfig != null)
        {
            try (InputStream in = openStream(storeConfig))
            {
                prop.load(in);
            }
            catch (IOException e)
            {
                logger.error("failed to load configuration from '" + storeConfig + "'", e);
            }
        }
    }

    private static InputStream openStream(String path) throws IOException
    {
        // Currently, we do not support other protocols such as ftp.
        if (path.startsWith("https://") || path.startsWith("http://"))
        {
            return new URL(path).openStream();
        }
        return new FileInputStream(path);
    }

    public synchronized void registerUpdateCallback(String key, UpdateCallback callback)
    {
        this.callbacks.put(key, callback);
    }

    public synchronized void loadProperties(String propFilePath) throws IOException
    {
        try (InputStream in = openStream(propFilePath))
        {
            this.prop.load(in);
        }
        for (Map.Entry<String, UpdateCallback> entry : this.callbacks.entrySet())
        {
            String value = this.prop.getProperty(entry.getKey());
            if (value != null)
            {
                entry.getValue().update(value);
            }
        }
    }

    public synchronized void addProperty(String key, String value)
    {
        this.prop.setProperty(key, value);
        if (this.callbacks.containsKey(key))
        {
            this.callbacks.get(key).update(value);
        }
    }

    public synchronized String getProperty(String key)
    {
        return this.prop.getProperty(key);
    }

    public synchronized String getProperty(String key, String defaultValue)
    {
        return this.prop.getProperty(key, defaultValue);
    }
}
