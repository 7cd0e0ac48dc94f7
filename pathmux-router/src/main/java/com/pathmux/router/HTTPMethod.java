package com.pathmux.router;

import java.util.Locale;

public enum HTTPMethod
{
    CONNECT,
    DELETE,
    GET,
    HEAD,
    OPTIONS,
    PATCH,
    POST,
    PUT,
    TRACE;

    /**
     * @param method is the method name as it appears on the request line,
     *     in any case.
     *
     * @return the matching constant or null if the method is not known.
     */
    public static HTTPMethod parse(String method) {
        if ( null == method ) return null;
        try {
            return valueOf(method.trim().toUpperCase(Locale.ROOT));
        } catch ( IllegalArgumentException ex ) {
            return null;
        }
    }
}
