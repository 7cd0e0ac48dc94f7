package com.pathmux.webserver;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.servlet.ServletException;
import java.io.IOException;

@FunctionalInterface
public interface GenericRequestHandler {
    /**
     * Called once the request was routed to this handler. The matched route
     * and its params are available through
     * {@link RouteMatcherServlet#getMatchedRoute(HttpServletRequest)} and
     * {@link RouteMatcherServlet#getRouteParams(HttpServletRequest)}.
     *
     * {@link javax.servlet.http.HttpServlet#service(HttpServletRequest, HttpServletResponse)}
     *
     * @param request servlet request.
     *
     * @param response servlet response.
     */
    public void service(HttpServletRequest request, HttpServletResponse response)
        throws ServletException, IOException;
}
