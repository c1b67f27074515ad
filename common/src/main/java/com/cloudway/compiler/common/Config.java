/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.common;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.UncheckedExecutionException;

import com.cloudway.compiler.common.util.ExtendedProperties;

/**
 * Toolkit configuration. The bundled {@code /toolkit.conf} resource supplies
 * the defaults; a user file may overlay it, and system properties named
 * {@code section.key} override both.
 */
public class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    public static final String CONF_PATH_KEY = "COMPILER_TOOLKIT_CONF";
    private static final String DEFAULTS_RESOURCE = "/toolkit.conf";

    private static class Configuration extends ExtendedProperties {
        long mtime;

        Configuration(ExtendedProperties defaults) {
            super(defaults);
        }
    }

    private static class ConfigurationLoader extends CacheLoader<Path, Configuration> {
        @Override
        public Configuration load(Path path) throws IOException {
            try (InputStream in = Files.newInputStream(path)) {
                Configuration conf = new Configuration(DEFAULTS);
                conf.load(in);
                conf.mtime = Files.getLastModifiedTime(path).toMillis();
                logger.fine(() -> "Loaded configuration from " + path);
                return conf;
            }
        }

        @Override
        public ListenableFuture<Configuration> reload(Path path, Configuration conf) throws Exception {
            long mtime = Files.getLastModifiedTime(path).toMillis();
            if (mtime != conf.mtime) {
                return super.reload(path, conf);
            } else {
                return Futures.immediateFuture(conf);
            }
        }
    }

    private static final ExtendedProperties DEFAULTS = loadDefaults();

    private static final LoadingCache<Path, Configuration> conf_cache =
        CacheBuilder.newBuilder().build(new ConfigurationLoader());

    private static ExtendedProperties loadDefaults() {
        ExtendedProperties defaults = new ExtendedProperties();
        try (InputStream in = Config.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                defaults.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return defaults;
    }

    private final ExtendedProperties conf;

    /**
     * Returns the configuration named by the {@code COMPILER_TOOLKIT_CONF}
     * system property or environment variable, or the bundled defaults when
     * neither is set.
     */
    public static Config getDefault() {
        String path = Optional.ofNullable(System.getProperty(CONF_PATH_KEY))
                              .orElseGet(() -> System.getenv(CONF_PATH_KEY));
        return path != null ? new Config(Paths.get(path)) : new Config();
    }

    /**
     * Creates a configuration backed by the bundled defaults only.
     */
    public Config() {
        this.conf = DEFAULTS;
    }

    /**
     * Creates a configuration that overlays the given file on the defaults.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public Config(Path path) {
        requireNonNull(path);
        try {
            conf_cache.refresh(path);
            this.conf = conf_cache.getUnchecked(path);
        } catch (UncheckedExecutionException ex) {
            if (ex.getCause() instanceof IOException) {
                throw new UncheckedIOException((IOException)ex.getCause());
            }
            throw ex;
        }
    }

    public Optional<String> get(String section, String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(section + "." + name));
        return val.isPresent() ? val : conf.getOptionalProperty(section, name);
    }

    public String get(String section, String name, String deflt) {
        return get(section, name).orElse(deflt);
    }

    public boolean getBoolean(String section, String name, boolean deflt) {
        return get(section, name).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String section, String name, int deflt) {
        return get(section, name).map(String::trim).map(Ints::tryParse).orElse(deflt);
    }

    /**
     * Returns a comma separated value as a list. A system property
     * override replaces the whole list.
     */
    public List<String> getList(String section, String name) {
        String override = System.getProperty(section + "." + name);
        if (override != null) {
            return ExtendedProperties.splitList(override);
        }
        return conf.getListProperty(section, name);
    }

    public ExtendedProperties getProperties() {
        return conf;
    }

    public String toString() {
        return conf.toString();
    }
}
