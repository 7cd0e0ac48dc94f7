package com.pathmux.webserver;

import com.pathmux.router.GenericRouteMatcher;
import com.pathmux.router.GenericRouteSpec;
import com.pathmux.router.RoutePrecedence;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import javax.inject.Inject;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.NetworkConnector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GuiceWebServer implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(GuiceWebServer.class);
    private static final int DEFAULT_PORT = 8080;

    private GenericRouteMatcher<GenericRequestHandler> routeMatcher;
    private WebServerConfig config;

    @Inject
    protected GuiceWebServer(
        Set<GenericRouteSpec<GenericRequestHandler>> routeSpecs,
        WebServerConfig config)
    {
        this.config = config;
        RoutePrecedence precedence = ( null == config.getRoutePrecedence() )
            ? RoutePrecedence.REGISTRATION_ORDER
            : config.getRoutePrecedence();
        routeMatcher = new GenericRouteMatcher<GenericRequestHandler>(precedence);
        for ( GenericRouteSpec<GenericRequestHandler> routeSpec : routeSpecs ) {
            LOG.debug("Injected routeSpec="+routeSpec);
        }
        routeMatcher.reload(routeSpecs);
    }

    public GenericRouteMatcher<GenericRequestHandler> getRouteMatcher() {
        return routeMatcher;
    }

    public void run() {
        run(( null == config.getPort() ) ? DEFAULT_PORT : config.getPort());
    }

    public void run(int port) {
        Server server = createServer(port);
        try {
            server.start();
            LOG.info("Listening on port {}", getPort(server));
            server.join();
        } catch ( RuntimeException ex ) {
            throw ex;
        } catch ( Exception ex ) {
            throw new RuntimeException(ex);
        }
    }

    public static int getPort(Server server) {
        Connector[] connectors = server.getConnectors();
        if ( null == connectors || connectors.length < 1 ) {
            return 0;
        }
        return Arrays.asList(connectors).stream()
            .map(connector ->
                 ( connector instanceof NetworkConnector ) ? ((NetworkConnector)connector).getLocalPort() : null)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(0);
    }

    /**
     * @param port to listen on, 0 picks a free port.
     *
     * @return a server that is not yet started.
     */
    public Server createServer(int port) {
        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder(new RouteMatcherServlet(routeMatcher)), "/*");

        Server server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setHost(config.getHost());
        connector.setPort(port);
        server.addConnector(connector);
        server.setHandler(context);
        return server;
    }
}
