package com.pathmux.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PathSplitter
{
    private PathSplitter() {}

    /**
     * Split a request path into its non-empty segments, so leading,
     * trailing and duplicate slashes are ignored. Segment values are not
     * decoded.
     *
     * @param path is the raw request path, may be null.
     *
     * @return the segments in order.
     */
    public static List<String> split(String path) {
        if ( null == path || path.isEmpty() ) return Collections.emptyList();
        List<String> segments = new ArrayList<>();
        int start = 0;
        int len = path.length();
        for ( int i=0; i <= len; i++ ) {
            if ( i < len && '/' != path.charAt(i) ) continue;
            if ( i > start ) {
                segments.add(path.substring(start, i));
            }
            start = i+1;
        }
        return segments;
    }
}
