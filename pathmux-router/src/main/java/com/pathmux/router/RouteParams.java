package com.pathmux.router;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
   The values captured by a route pattern, in the order the captures appear
   in the pattern.
*/
public final class RouteParams
{
    private static final RouteParams EMPTY = new RouteParams(Collections.emptyList());
    private final List<Map.Entry<String, String>> _entries;

    private RouteParams(List<Map.Entry<String, String>> entries) {
        _entries = entries;
    }

    public static RouteParams empty() {
        return EMPTY;
    }

    /**
     * @param entries are the (name, value) pairs in capture order.
     *
     * @return a new RouteParams with a copy of entries.
     */
    public static RouteParams of(List<? extends Map.Entry<String, String>> entries) {
        if ( null == entries || entries.isEmpty() ) return EMPTY;
        List<Map.Entry<String, String>> copy = new ArrayList<>(entries.size());
        for ( Map.Entry<String, String> entry : entries ) {
            copy.add(new SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
        }
        return new RouteParams(Collections.unmodifiableList(copy));
    }

    public List<Map.Entry<String, String>> getEntries() {
        return _entries;
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>(_entries.size());
        for ( Map.Entry<String, String> entry : _entries ) {
            names.add(entry.getKey());
        }
        return names;
    }

    /**
     * @param name is the capture name.
     *
     * @return the captured value or null if nothing was captured by that
     *     name. A multi segment capture of zero segments is the empty string.
     */
    public String get(String name) {
        for ( Map.Entry<String, String> entry : _entries ) {
            if ( entry.getKey().equals(name) ) return entry.getValue();
        }
        return null;
    }

    /**
     * @param name is the capture name.
     *
     * @return the captured value parsed as a long, or null if nothing was
     *     captured by that name.
     *
     * @throws IllegalArgumentException if the value is not a number.
     */
    public Long getLong(String name) {
        String value = get(name);
        if ( null == value ) return null;
        try {
            return Long.parseLong(value);
        } catch ( NumberFormatException ex ) {
            throw new IllegalArgumentException(
                "Expected route param '"+name+"' to be a number, got '"+value+"'", ex);
        }
    }

    public boolean contains(String name) {
        return null != get(name);
    }

    public int size() {
        return _entries.size();
    }

    public boolean isEmpty() {
        return _entries.isEmpty();
    }

    /**
     * @return an unmodifiable map view that iterates in capture order.
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for ( Map.Entry<String, String> entry : _entries ) {
            map.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object obj) {
        if ( this == obj ) return true;
        if ( ! (obj instanceof RouteParams) ) return false;
        return _entries.equals(((RouteParams)obj)._entries);
    }

    @Override
    public int hashCode() {
        return _entries.hashCode();
    }

    @Override
    public String toString() {
        return "RouteParams"+_entries;
    }
}
