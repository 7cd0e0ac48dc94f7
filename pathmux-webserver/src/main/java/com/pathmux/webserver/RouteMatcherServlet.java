package com.pathmux.webserver;

import com.pathmux.router.GenericMatchedRoute;
import com.pathmux.router.GenericRouteMatcher;
import com.pathmux.router.HTTPMethod;
import com.pathmux.router.RouteParams;
import java.io.IOException;
import java.util.Set;
import java.util.stream.Collectors;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
   Routes every request through a {@link GenericRouteMatcher} and hands it
   to the matched {@link GenericRequestHandler}.

   Nothing matched: 405 with an Allow header when the path is routed for
   other methods, otherwise 404 (unless the matcher has a default).
*/
public class RouteMatcherServlet extends HttpServlet {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RouteMatcherServlet.class);
    public static final String MATCHED_ROUTE = "com.pathmux.router.GenericMatchedRoute";
    public static final String ROUTE_PARAMS = "com.pathmux.router.RouteParams";
    private transient GenericRouteMatcher<GenericRequestHandler> routeMatcher;

    public RouteMatcherServlet(GenericRouteMatcher<GenericRequestHandler> routeMatcher) {
        this.routeMatcher = routeMatcher;
    }

    public static GenericMatchedRoute<?> getMatchedRoute(HttpServletRequest request) {
        return (GenericMatchedRoute<?>)request.getAttribute(MATCHED_ROUTE);
    }

    public static RouteParams getRouteParams(HttpServletRequest request) {
        RouteParams params = (RouteParams)request.getAttribute(ROUTE_PARAMS);
        return ( null == params ) ? RouteParams.empty() : params;
    }

    @Override
    protected void service(HttpServletRequest request, HttpServletResponse response)
        throws ServletException, IOException
    {
        HTTPMethod method = HTTPMethod.parse(request.getMethod());
        if ( null == method ) {
            response.sendError(HttpServletResponse.SC_NOT_IMPLEMENTED);
            return;
        }
        String path = request.getRequestURI();
        GenericMatchedRoute<GenericRequestHandler> route = routeMatcher.match(method, path);
        if ( null == route || route.isDefaultRoute() ) {
            Set<HTTPMethod> allowed = routeMatcher.allowedMethods(path);
            if ( ! allowed.isEmpty() ) {
                if ( LOG.isDebugEnabled() ) {
                    LOG.debug(method+" "+path+" is not routed, allowed methods="+allowed);
                }
                response.setHeader("Allow", allowed.stream()
                                   .map(HTTPMethod::name)
                                   .collect(Collectors.joining(", ")));
                response.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
                return;
            }
            if ( null == route ) {
                if ( LOG.isDebugEnabled() ) LOG.debug("No route for "+method+" "+path);
                response.sendError(HttpServletResponse.SC_NOT_FOUND);
                return;
            }
        }
        request.setAttribute(MATCHED_ROUTE, route);
        request.setAttribute(ROUTE_PARAMS, route.getRouteParams());
        route.getValue().service(request, response);
    }
}
