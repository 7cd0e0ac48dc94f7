package com.pathmux.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One compiled segment of a route pattern.
 */
public final class PathToken
{
    public enum Type {
        LITERAL,
        PARAM,
        SINGLE_WILDCARD,
        MULTI_WILDCARD,
        EXTENSION;
    }

    private final Type _type;
    // Literal text, or the capture name (null for anonymous wildcards).
    private final String _text;
    private final List<String> _extensions;

    private PathToken(Type type, String text, List<String> extensions) {
        _type = type;
        _text = text;
        _extensions = extensions;
    }

    public static PathToken literal(String text) {
        if ( null == text || text.isEmpty() ) {
            throw new IllegalArgumentException("Literal tokens must have text");
        }
        return new PathToken(Type.LITERAL, text, Collections.emptyList());
    }

    public static PathToken param(String name) {
        if ( null == name || name.isEmpty() ) {
            throw new IllegalArgumentException("Param tokens must have a name");
        }
        return new PathToken(Type.PARAM, name, Collections.emptyList());
    }

    public static PathToken singleWildcard(String name) {
        return new PathToken(Type.SINGLE_WILDCARD, emptyToNull(name), Collections.emptyList());
    }

    public static PathToken multiWildcard(String name) {
        return new PathToken(Type.MULTI_WILDCARD, emptyToNull(name), Collections.emptyList());
    }

    public static PathToken extension(List<String> extensions) {
        if ( null == extensions || extensions.isEmpty() ) {
            throw new IllegalArgumentException("Extension tokens need at least one extension");
        }
        return new PathToken(
            Type.EXTENSION,
            null,
            Collections.unmodifiableList(new ArrayList<>(extensions)));
    }

    private static String emptyToNull(String str) {
        return ( null == str || str.isEmpty() ) ? null : str;
    }

    public Type getType() {
        return _type;
    }

    /**
     * @return the literal text for LITERAL tokens, otherwise null.
     */
    public String getText() {
        return ( Type.LITERAL == _type ) ? _text : null;
    }

    /**
     * @return the capture name or null if this token binds nothing.
     */
    public String getName() {
        return ( Type.LITERAL == _type ) ? null : _text;
    }

    public List<String> getExtensions() {
        return _extensions;
    }

    public boolean isCapture() {
        return null != getName();
    }

    /**
     * Test a single segment. Never called for MULTI_WILDCARD tokens since
     * those consume a variable number of segments.
     *
     * @param segment is a non-empty path segment.
     *
     * @return true if this token accepts the segment.
     */
    public boolean matches(String segment) {
        switch ( _type ) {
        case LITERAL:
            return _text.equals(segment);
        case PARAM:
        case SINGLE_WILDCARD:
            return ! segment.isEmpty();
        case EXTENSION:
            return null != matchingExtension(segment);
        default:
            throw new IllegalStateException(
                "Token type="+_type+" does not match a single segment");
        }
    }

    /**
     * @param segment is the path segment to test.
     *
     * @return the first listed extension the segment ends with, or null.
     */
    public String matchingExtension(String segment) {
        if ( Type.EXTENSION != _type ) return null;
        for ( String extension : _extensions ) {
            if ( segment.endsWith("." + extension) ) return extension;
        }
        return null;
    }

    /**
     * Two tokens with the same shape key accept exactly the same segments,
     * capture names aside. Used to share trie edges between routes.
     *
     * @return the shape key.
     */
    public String getShapeKey() {
        switch ( _type ) {
        case LITERAL:
            return _text;
        case PARAM:
        case SINGLE_WILDCARD:
            return "*";
        case MULTI_WILDCARD:
            return "**";
        case EXTENSION:
            // Extensions never contain '/', so this can not collide:
            return "*./" + String.join("/", _extensions);
        default:
            throw new IllegalStateException("Unknown token type="+_type);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if ( this == obj ) return true;
        if ( ! (obj instanceof PathToken) ) return false;
        PathToken other = (PathToken)obj;
        return _type == other._type &&
            Objects.equals(_text, other._text) &&
            _extensions.equals(other._extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_type, _text, _extensions);
    }

    @Override
    public String toString() {
        switch ( _type ) {
        case LITERAL:
            return _text;
        case PARAM:
            return ":" + _text;
        case SINGLE_WILDCARD:
            return ( null == _text ) ? "*" : "*" + _text;
        case MULTI_WILDCARD:
            return ( null == _text ) ? "**" : "**" + _text;
        default:
            return ( 1 == _extensions.size() ) ?
                "*." + _extensions.get(0) :
                "*.{" + String.join(",", _extensions) + "}";
        }
    }
}
