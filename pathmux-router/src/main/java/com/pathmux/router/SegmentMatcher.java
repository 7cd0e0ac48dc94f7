package com.pathmux.router;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
   Matches the tokens of one compiled pattern against the segments of one
   request path.

   Every token except MULTI_WILDCARD consumes exactly one segment. A
   MULTI_WILDCARD at the end of a pattern takes all remaining segments,
   anywhere else it is lazy: it first captures zero segments and only grows
   by one segment at a time when the rest of the pattern fails to match.
*/
public class SegmentMatcher
{
    private SegmentMatcher() {}

    /**
     * @param pattern is the compiled pattern.
     *
     * @param segments are the non-empty path segments, see {@link PathSplitter}.
     *
     * @return the captured params or null if the pattern does not match.
     */
    public static RouteParams match(PathPattern pattern, List<String> segments) {
        List<Map.Entry<String, String>> bindings = new ArrayList<>();
        if ( ! match(pattern.getTokens(), 0, segments, 0, bindings, new BitSet()) ) {
            return null;
        }
        return RouteParams.of(bindings);
    }

    public static RouteParams match(PathPattern pattern, String path) {
        return match(pattern, PathSplitter.split(path));
    }

    // The outcome of a (tokenIdx, segmentIdx) state does not depend on the
    // bindings made so far, so a state that failed once always fails.
    private static boolean match(List<PathToken> tokens, int tokenIdx,
                                 List<String> segments, int segmentIdx,
                                 List<Map.Entry<String, String>> bindings,
                                 BitSet failed)
    {
        if ( tokenIdx == tokens.size() ) {
            return segmentIdx == segments.size();
        }
        int state = tokenIdx * (segments.size()+1) + segmentIdx;
        if ( failed.get(state) ) return false;

        PathToken token = tokens.get(tokenIdx);
        int mark = bindings.size();
        if ( PathToken.Type.MULTI_WILDCARD == token.getType() ) {
            if ( tokenIdx == tokens.size()-1 ) {
                bind(token, join(segments, segmentIdx, segments.size()), bindings);
                return true;
            }
            for ( int end = segmentIdx; end <= segments.size(); end++ ) {
                bind(token, join(segments, segmentIdx, end), bindings);
                if ( match(tokens, tokenIdx+1, segments, end, bindings, failed) ) {
                    return true;
                }
                truncate(bindings, mark);
            }
        } else if ( segmentIdx < segments.size() && token.matches(segments.get(segmentIdx)) ) {
            bind(token, segments.get(segmentIdx), bindings);
            if ( match(tokens, tokenIdx+1, segments, segmentIdx+1, bindings, failed) ) {
                return true;
            }
            truncate(bindings, mark);
        }
        failed.set(state);
        return false;
    }

    private static void bind(PathToken token, String value, List<Map.Entry<String, String>> bindings) {
        if ( ! token.isCapture() ) return;
        bindings.add(new SimpleImmutableEntry<>(token.getName(), value));
    }

    private static void truncate(List<?> list, int size) {
        while ( list.size() > size ) {
            list.remove(list.size()-1);
        }
    }

    private static String join(List<String> segments, int start, int end) {
        if ( start == end ) return "";
        return String.join("/", segments.subList(start, end));
    }
}
