package com.pathmux.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
   A compiled route pattern: the ordered tokens of a pattern string such as
   <code>/users/:id/files/**path</code>.

   <pre>
   segment             literal, exact match
   :name               named single segment capture
   *                   anonymous single segment wildcard
   *name               named single segment wildcard
   **                  anonymous multi segment capture (lazy, may be empty)
   **name              named multi segment capture (lazy, may be empty)
   *.ext               single segment ending in .ext
   *.{ext1,ext2}       single segment ending in any listed extension
   </pre>

   Leading, trailing and duplicate slashes are insignificant. Instances are
   immutable and equal when their tokens are equal.
*/
public final class PathPattern
{
    private final String _pattern;
    private final List<PathToken> _tokens;
    private final List<String> _paramNames;

    private PathPattern(String pattern, List<PathToken> tokens, List<String> paramNames) {
        _pattern = pattern;
        _tokens = Collections.unmodifiableList(tokens);
        _paramNames = Collections.unmodifiableList(paramNames);
    }

    /**
     * @param pattern is the route pattern to compile, null is treated as "/".
     *
     * @return the compiled pattern.
     *
     * @throws InvalidRoutePatternException if the pattern contains a
     *     malformed extension list, a nameless param or the same capture
     *     name twice.
     */
    public static PathPattern compile(String pattern) {
        String source = ( null == pattern ) ? "/" : pattern;
        List<PathToken> tokens = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for ( String segment : source.split("/") ) {
            if ( segment.isEmpty() ) continue;
            PathToken token = toToken(source, segment);
            String name = token.getName();
            if ( null != name && ! names.add(name) ) {
                throw new InvalidRoutePatternException(
                    source, "capture name '"+name+"' is used more than once");
            }
            tokens.add(token);
        }
        return new PathPattern(source, tokens, new ArrayList<>(names));
    }

    private static PathToken toToken(String pattern, String segment) {
        if ( segment.startsWith(":") ) {
            String name = segment.substring(1);
            if ( name.isEmpty() ) {
                throw new InvalidRoutePatternException(pattern, "':' must be followed by a param name");
            }
            return PathToken.param(name);
        }
        if ( segment.startsWith("**") ) {
            return PathToken.multiWildcard(segment.substring(2));
        }
        if ( segment.startsWith("*.") ) {
            return PathToken.extension(toExtensions(pattern, segment.substring(2)));
        }
        if ( segment.startsWith("*") ) {
            return PathToken.singleWildcard(segment.substring(1));
        }
        return PathToken.literal(segment);
    }

    private static List<String> toExtensions(String pattern, String suffix) {
        if ( suffix.isEmpty() ) {
            throw new InvalidRoutePatternException(pattern, "'*.' must be followed by an extension");
        }
        if ( ! suffix.startsWith("{") ) {
            if ( suffix.indexOf('{') >= 0 || suffix.indexOf('}') >= 0 ) {
                throw new InvalidRoutePatternException(pattern, "unbalanced brace in '*."+suffix+"'");
            }
            return Collections.singletonList(suffix);
        }
        if ( ! suffix.endsWith("}") || suffix.length() < 2 ) {
            throw new InvalidRoutePatternException(pattern, "unterminated extension list '*."+suffix+"'");
        }
        String body = suffix.substring(1, suffix.length()-1);
        if ( body.indexOf('{') >= 0 || body.indexOf('}') >= 0 ) {
            throw new InvalidRoutePatternException(pattern, "nested brace in '*."+suffix+"'");
        }
        if ( body.trim().isEmpty() ) {
            throw new InvalidRoutePatternException(pattern, "empty extension list '*."+suffix+"'");
        }
        List<String> extensions = new ArrayList<>();
        // -1 keeps trailing empty alternatives so "{jpg,}" is rejected:
        for ( String alternative : body.split(",", -1) ) {
            String extension = alternative.trim();
            if ( extension.isEmpty() ) {
                throw new InvalidRoutePatternException(pattern, "empty alternative in '*."+suffix+"'");
            }
            extensions.add(extension);
        }
        return extensions;
    }

    public String getPattern() {
        return _pattern;
    }

    public List<PathToken> getTokens() {
        return _tokens;
    }

    /**
     * @return the capture names in the order they appear in the pattern.
     */
    public List<String> getParamNames() {
        return _paramNames;
    }

    public int size() {
        return _tokens.size();
    }

    public boolean isEmpty() {
        return _tokens.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if ( this == obj ) return true;
        if ( ! (obj instanceof PathPattern) ) return false;
        return _tokens.equals(((PathPattern)obj)._tokens);
    }

    @Override
    public int hashCode() {
        return _tokens.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for ( PathToken token : _tokens ) {
            sb.append("/");
            sb.append(token);
        }
        if ( sb.length() == 0 ) return "/";
        return sb.toString();
    }
}
