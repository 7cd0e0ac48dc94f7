package com.pathmux.webserver;

import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import com.google.inject.multibindings.Multibinder;
import com.pathmux.router.GenericRouteSpec;
import com.pathmux.router.HTTPMethod;
import java.io.File;
import java.util.Arrays;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Provider;

public class WebServerModule extends AbstractModule {
    private static final TypeLiteral<GenericRouteSpec<GenericRequestHandler>> ROUTE_SPEC_TYPE =
        new TypeLiteral<GenericRouteSpec<GenericRequestHandler>>(){};

    private Provider<WebServerConfig> _configProvider;

    public WebServerModule() {
        this(WebServerConfig.builder().build());
    }

    public WebServerModule(String file) {
        this(null == file ? null : new File(file));
    }

    public WebServerModule(File file) {
        this(null == file ? null : new Provider<WebServerConfig>() {
                @Inject
                private WebServerConfig.Factory _factory;
                @Override
                public WebServerConfig get() {
                    return _factory.create(file);
                }
            });
    }

    public WebServerModule(WebServerConfig config) {
        this(() -> config);
    }

    public WebServerModule(Provider<WebServerConfig> configProvider) {
        _configProvider = configProvider;
    }

    @Override
    protected void configure() {
        bind(WebServerConfig.Factory.class).to(WebServerConfigFactoryImpl.class);
        if ( null != _configProvider ) {
            bind(WebServerConfig.class).toProvider(_configProvider);
        } else {
            bind(WebServerConfig.class).toInstance(WebServerConfig.builder().build());
        }
        // Declared so a server with no routes still injects an empty set:
        Multibinder.newSetBinder(binder(), ROUTE_SPEC_TYPE);
    }

    /**
     * Registers a route from any module. Routes are added to the matcher in
     * the order the injector iterates the set, which is the order of the
     * bindRoute calls within a module.
     *
     * @param binder is the binder of the calling module.
     *
     * @param method is the HTTP method to route.
     *
     * @param path is the route pattern.
     *
     * @param handlerClass is instantiated by the injector.
     *
     * @param middleware are names carried on the route spec.
     */
    public static void bindRoute(Binder binder, HTTPMethod method, String path,
                                 Class<? extends GenericRequestHandler> handlerClass,
                                 String... middleware)
    {
        Multibinder.newSetBinder(binder, ROUTE_SPEC_TYPE)
            .addBinding()
            .toProvider(new RouteSpecProvider(method, path, handlerClass, Arrays.asList(middleware)));
    }

    protected static class RouteSpecProvider implements Provider<GenericRouteSpec<GenericRequestHandler>> {
        @Inject
        private Injector _injector;
        private HTTPMethod _method;
        private String _path;
        private Class<? extends GenericRequestHandler> _handlerClass;
        private List<String> _middleware;

        private RouteSpecProvider(HTTPMethod method, String path,
                                  Class<? extends GenericRequestHandler> handlerClass,
                                  List<String> middleware)
        {
            _method = method;
            _path = path;
            _handlerClass = handlerClass;
            _middleware = middleware;
        }

        @Override
        public GenericRouteSpec<GenericRequestHandler> get() {
            return GenericRouteSpec.<GenericRequestHandler>builder()
                .withPath(_path)
                .withHTTPMethod(_method)
                .withValue(_injector.getInstance(_handlerClass))
                .withMiddleware(_middleware)
                .build();
        }

        @Override
        public boolean equals(Object other) {
            if ( ! (other instanceof RouteSpecProvider) ) return false;
            RouteSpecProvider that = (RouteSpecProvider)other;
            return _method == that._method && _path.equals(that._path) &&
                _handlerClass.equals(that._handlerClass) && _middleware.equals(that._middleware);
        }

        @Override
        public int hashCode() {
            return (_method.hashCode() * 31 + _path.hashCode()) * 31 + _handlerClass.hashCode();
        }
    }
}
