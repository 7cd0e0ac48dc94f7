package com.pathmux.router;

/**
 * Thrown when a route pattern can not be compiled. Patterns are compiled
 * when routes are registered, so this surfaces during application startup.
 */
public class InvalidRoutePatternException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    private String _pattern;

    public InvalidRoutePatternException(String pattern, String reason)
    {
        super("Invalid route pattern '"+pattern+"': "+reason);
        _pattern = pattern;
    }

    public InvalidRoutePatternException(String pattern, String reason, Throwable cause)
    {
        super("Invalid route pattern '"+pattern+"': "+reason, cause);
        _pattern = pattern;
    }

    public String getPattern() {
        return _pattern;
    }
}
