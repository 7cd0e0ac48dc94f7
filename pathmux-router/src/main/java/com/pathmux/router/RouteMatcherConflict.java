package com.pathmux.router;

/**
 * Two routes were registered for the same HTTP method with patterns that
 * match exactly the same set of paths.
 */
public class RouteMatcherConflict extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    public RouteMatcherConflict()
    {

    }

    public RouteMatcherConflict(String message)
    {
        super(message);
    }

    public RouteMatcherConflict(String message, Throwable cause)
    {
        super(message, cause);
    }

    public RouteMatcherConflict(Throwable cause)
    {
        super(cause);
    }
}
