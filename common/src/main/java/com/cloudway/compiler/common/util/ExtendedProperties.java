/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.compiler.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ForwardingMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

/**
 * A sectioned property list. Keys before the first {@code [section]}
 * header belong to the global list, the rest are grouped by section.
 * Values are immutable once loaded, and lookups that miss fall back to
 * an optional defaults list.
 */
public class ExtendedProperties
{
    /**
     * The map that represents a single section of properties.
     */
    public static final class PropertyMap extends ForwardingMap<String, String>
    {
        private final ImmutableMap<String, String> delegate;
        private final PropertyMap defaults;

        PropertyMap(ImmutableMap<String, String> delegate, PropertyMap defaults) {
            this.delegate = delegate;
            this.defaults = defaults;
        }

        @Override
        protected ImmutableMap<String, String> delegate() {
            return delegate;
        }

        @Override
        public boolean containsKey(Object key) {
            return delegate.containsKey(key) || (defaults != null && defaults.containsKey(key));
        }

        @Override
        public String get(Object key) {
            String val = delegate.get(key);
            return (val == null && defaults != null) ? defaults.get(key) : val;
        }

        public Optional<String> getOptional(String key) {
            return Optional.ofNullable(get(key));
        }

        public String get(String key, String deflt) {
            return getOptional(key).orElse(deflt);
        }

        public boolean getBool(String key, boolean deflt) {
            return getOptional(key).map(Boolean::valueOf).orElse(deflt);
        }

        public int getInt(String key, int deflt) {
            return getOptional(key).map(String::trim).map(Ints::tryParse).orElse(deflt);
        }

        /**
         * Returns a comma separated value as a list of trimmed, non-empty items.
         */
        public List<String> getList(String key) {
            return getOptional(key).map(ExtendedProperties::splitList).orElse(ImmutableList.of());
        }
    }

    private static final Splitter LIST_SPLITTER =
        Splitter.on(',').trimResults().omitEmptyStrings();

    /**
     * Splits a comma separated value into trimmed, non-empty items.
     */
    public static List<String> splitList(String value) {
        return ImmutableList.copyOf(LIST_SPLITTER.split(value));
    }

    private static final PropertyMap EMPTY = new PropertyMap(ImmutableMap.of(), null);

    private PropertyMap global = EMPTY;
    private ImmutableMap<String, PropertyMap> sections = ImmutableMap.of();
    private final ExtendedProperties defaults;

    /**
     * Creates an empty property list with no default values.
     */
    public ExtendedProperties() {
        this(null);
    }

    /**
     * Creates an empty property list with the specified defaults.
     *
     * @param defaults the defaults, may be null
     */
    public ExtendedProperties(ExtendedProperties defaults) {
        this.defaults = defaults;
        if (defaults != null) {
            this.global = new PropertyMap(ImmutableMap.of(), defaults.global);
            this.sections = defaults.sections;
        }
    }

    /**
     * Returns the global property list.
     */
    public PropertyMap global() {
        return global;
    }

    /**
     * Returns the property list of the given section. An unknown section
     * yields an empty list.
     */
    public PropertyMap section(String name) {
        return MoreObjects.firstNonNull(sections.get(name), EMPTY);
    }

    /**
     * Returns all sections keyed by name.
     */
    public Map<String, PropertyMap> sections() {
        return sections;
    }

    public Optional<String> getOptionalProperty(String key) {
        return global.getOptional(key);
    }

    public Optional<String> getOptionalProperty(String section, String key) {
        return section(section).getOptional(key);
    }

    public String getProperty(String section, String key, String deflt) {
        return section(section).get(key, deflt);
    }

    public boolean getBooleanProperty(String section, String key, boolean deflt) {
        return section(section).getBool(key, deflt);
    }

    public int getIntProperty(String section, String key, int deflt) {
        return section(section).getInt(key, deflt);
    }

    public List<String> getListProperty(String section, String key) {
        return section(section).getList(key);
    }

    /**
     * Reads a sectioned property list from the input character stream.
     *
     * @param reader the input character stream
     * @throws IOException if an error occurred when reading from the input stream
     */
    public void load(Reader reader) throws IOException {
        new LoadingProperties().load(reader, this);
    }

    /**
     * Reads a sectioned property list from the input byte stream, which is
     * assumed to use the ISO 8859-1 character encoding.
     *
     * @param stream the input stream
     * @throws IOException if an error occurred when reading from the input stream
     */
    public void load(InputStream stream) throws IOException {
        new LoadingProperties().load(stream, this);
    }

    @SuppressWarnings("serial")
    static class LoadingProperties extends Properties {
        private final Map<String, String> global = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        private Map<String, String> current = global;

        /**
         * Overridden to switch the current section on {@code [name]} keys.
         */
        @Override
        public synchronized Object put(Object key, Object value) {
            if (key instanceof String && value instanceof String) {
                String skey = ((String)key).trim();
                if (skey.startsWith("[") && skey.endsWith("]")) {
                    String name = skey.substring(1, skey.length() - 1).trim();
                    current = sections.computeIfAbsent(name, x -> new LinkedHashMap<>());
                } else {
                    current.put(skey, unquote((String)value));
                }
            }
            return null;
        }

        private static final Pattern QUOTED_STRING = Pattern.compile("\"(.*)\"\\s*(#.*)?");

        static String unquote(String val) {
            Matcher m = QUOTED_STRING.matcher(val);
            if (m.matches()) {
                return m.group(1);
            }
            int i = val.indexOf('#');
            return i != -1 ? val.substring(0, i).trim() : val.trim();
        }

        void load(Reader from, ExtendedProperties to) throws IOException {
            super.load(from);
            populate(to);
        }

        void load(InputStream from, ExtendedProperties to) throws IOException {
            super.load(from);
            populate(to);
        }

        private void populate(ExtendedProperties to) {
            ExtendedProperties defaults = to.defaults;
            to.global = new PropertyMap(ImmutableMap.copyOf(global),
                                        defaults != null ? defaults.global : null);

            Map<String, PropertyMap> merged = new LinkedHashMap<>();
            if (defaults != null) {
                defaults.sections.forEach((name, map) ->
                    merged.put(name, new PropertyMap(ImmutableMap.of(), map)));
            }
            sections.forEach((name, map) ->
                merged.put(name, new PropertyMap(ImmutableMap.copyOf(map),
                                                 defaults != null ? defaults.sections.get(name) : null)));
            to.sections = ImmutableMap.copyOf(merged);
        }
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("global", global)
            .add("sections", sections)
            .add("defaults", defaults)
            .toString();
    }
}
