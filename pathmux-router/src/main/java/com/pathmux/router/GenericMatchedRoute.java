package com.pathmux.router;

import java.util.Map;

public class GenericMatchedRoute<T>
{
    private GenericRouteSpec<T> _routeSpec = null;
    private RouteParams _routeParams = null;
    private boolean _defaultRoute;

    public GenericMatchedRoute(GenericRouteSpec<T> routeSpec, RouteParams routeParams)
    {
        this(routeSpec, routeParams, false);
    }

    public GenericMatchedRoute(GenericRouteSpec<T> routeSpec, RouteParams routeParams, boolean defaultRoute) {
        _routeSpec = routeSpec;
        _routeParams = ( null == routeParams ) ? RouteParams.empty() : routeParams;
        _defaultRoute = defaultRoute;
    }

    public GenericRouteSpec<T> getRouteSpec() {
        return _routeSpec;
    }

    public RouteParams getRouteParams() {
        return _routeParams;
    }

    public String getPath()
    {
        return _routeSpec.getPath();
    }

    public HTTPMethod getHttpMethod()
    {
        return _routeSpec.getHttpMethod();
    }

    public Map<String, String> getParams()
    {
        return _routeParams.asMap();
    }

    public String getParam(String key)
    {
        return _routeParams.get(key);
    }

    public T getValue()
    {
        return _routeSpec.getValue();
    }

    public boolean isDefaultRoute() {
        return _defaultRoute;
    }

    @Override
    public String toString() {
        return "GenericMatchedRoute[routeSpec="+_routeSpec+
            ",routeParams="+_routeParams+
            ( _defaultRoute ? ",default" : "" )+"]";
    }
}
