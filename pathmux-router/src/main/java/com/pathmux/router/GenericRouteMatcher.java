package com.pathmux.router;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
   The route matcher matches HTTP routes against a request path.

   Routes are registered with {@link #add} while the application starts.
   Every change publishes a complete new {@link RouteIndex} snapshot, so
   {@link #match} never takes a lock and never sees a half built index.
   {@link #reload} replaces all routes in one atomic swap.
*/
public class GenericRouteMatcher<T>
{
    private static final Logger LOG = LoggerFactory.getLogger(GenericRouteMatcher.class);

    private final AtomicReference<RouteIndex<T>> _index;

    public GenericRouteMatcher() {
        this(RoutePrecedence.REGISTRATION_ORDER);
    }

    public GenericRouteMatcher(RoutePrecedence precedence) {
        _index = new AtomicReference<>(
            RouteIndex.<T>builder()
            .withPrecedence(precedence)
            .build());
    }

    public List<GenericRouteSpec<T>> getAllRoutes() {
        return _index.get().getAllRoutes();
    }

    /**
     * @return the current snapshot, which never changes once returned.
     */
    public RouteIndex<T> getIndex() {
        return _index.get();
    }

    /**
     * Every call rebuilds the whole index, so registering many routes one
     * at a time is quadratic. Prefer {@link #addAll} or {@link #reload}.
     *
     * @param routeSpec is the route to add after all existing routes.
     *
     * @throws InvalidRoutePatternException if the path is not a valid pattern.
     *
     * @throws RouteMatcherConflict if an existing route for the same method
     *     matches exactly the same paths.
     */
    public synchronized void add(GenericRouteSpec<T> routeSpec) {
        publish(_index.get().toBuilder().add(routeSpec).build());
    }

    /**
     * Adds the routes in iteration order with a single rebuild. Nothing is
     * added if any route is invalid or conflicts.
     */
    public synchronized void addAll(Collection<? extends GenericRouteSpec<T>> routeSpecs) {
        publish(_index.get().toBuilder().addAll(routeSpecs).build());
    }

    public void add(String httpMethod, String path, T value) {

        HTTPMethod httpMethodEnum = HTTPMethod.valueOf(httpMethod);
        GenericRouteSpec<T> routeSpec = GenericRouteSpec.<T>builder()
            .withPath(path)
            .withHTTPMethod(httpMethodEnum)
            .withValue(value)
            .build();
        add(routeSpec);
    }

    public synchronized void setDefault(T defaultVal)
    {
        publish(_index.get().toBuilder().setDefault(defaultVal).build());
    }

    public synchronized void setPrecedence(RoutePrecedence precedence) {
        publish(_index.get().toBuilder().withPrecedence(precedence).build());
    }

    /**
     * Replace every route. In flight lookups finish against the old index.
     *
     * @param routeSpecs are the new routes in registration order.
     */
    public synchronized void reload(Collection<? extends GenericRouteSpec<T>> routeSpecs) {
        RouteIndex<T> current = _index.get();
        RouteIndex<T> index = RouteIndex.<T>builder()
            .withPrecedence(current.getPrecedence())
            .setDefault(current.getDefault())
            .addAll(routeSpecs)
            .build();
        publish(index);
        LOG.info("Reloaded "+index.size()+" routes");
    }

    private void publish(RouteIndex<T> index) {
        _index.set(index);
        if ( LOG.isDebugEnabled() ) LOG.debug("Published "+index);
    }

    public GenericMatchedRoute<T> match(HTTPMethod httpMethod, String path) {
        return _index.get().find(httpMethod, path);
    }

    public Set<HTTPMethod> allowedMethods(String path) {
        return _index.get().allowedMethods(path);
    }
}
