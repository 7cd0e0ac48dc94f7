package com.pathmux.router;

/**
   A registered route: the route spec together with its compiled pattern and
   its position in registration order. Immutable.
*/
public final class RouteEntry<T>
{
    private final GenericRouteSpec<T> _routeSpec;
    private final PathPattern _pattern;
    private final int _order;

    RouteEntry(GenericRouteSpec<T> routeSpec, PathPattern pattern, int order) {
        _routeSpec = routeSpec;
        _pattern = pattern;
        _order = order;
    }

    public GenericRouteSpec<T> getRouteSpec() {
        return _routeSpec;
    }

    public PathPattern getPattern() {
        return _pattern;
    }

    public HTTPMethod getHttpMethod() {
        return _routeSpec.getHttpMethod();
    }

    public T getValue() {
        return _routeSpec.getValue();
    }

    /**
     * @return zero for the first route registered, one for the next and so on.
     */
    public int getOrder() {
        return _order;
    }

    @Override
    public String toString() {
        return "RouteEntry[order="+_order+", pattern="+_pattern+", routeSpec="+_routeSpec+"]";
    }
}
