package com.pathmux.router;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
   An immutable snapshot of the registered routes, searched once per
   request. Build one with {@link #builder()}; once built it is never
   modified, so any number of threads may call {@link #find} concurrently.

   Routes are filtered by exact HTTP method, then searched in a per method
   trie. Unless {@link RoutePrecedence#MOST_SPECIFIC} is requested, the
   route registered first wins whenever several patterns match.
*/
public final class RouteIndex<T>
{
    private static final Logger LOG = LoggerFactory.getLogger(RouteIndex.class);

    private final List<RouteEntry<T>> _entries;
    private final Map<HTTPMethod, RouteTrie<T>> _tries;
    private final T _defaultValue;
    private final RoutePrecedence _precedence;

    public static <T> Builder<T> builder() {
        return new Builder<T>();
    }

    public static class Builder<T> {
        private List<RouteEntry<T>> _entries = new ArrayList<>();
        private T _defaultValue;
        private RoutePrecedence _precedence = RoutePrecedence.REGISTRATION_ORDER;

        protected Builder() {}

        /**
         * @param routeSpec is the route to register after all routes added
         *     so far.
         *
         * @return this
         *
         * @throws InvalidRoutePatternException if the route path is not a
         *     valid pattern.
         */
        public Builder<T> add(GenericRouteSpec<T> routeSpec) {
            if ( null == routeSpec.getHttpMethod() ) {
                throw new IllegalArgumentException("Route has no HTTP method: "+routeSpec);
            }
            PathPattern pattern = PathPattern.compile(routeSpec.getPath());
            _entries.add(new RouteEntry<>(routeSpec, pattern, _entries.size()));
            return this;
        }

        public Builder<T> add(HTTPMethod httpMethod, String path, T value) {
            return add(GenericRouteSpec.<T>builder()
                       .withPath(path)
                       .withHTTPMethod(httpMethod)
                       .withValue(value)
                       .build());
        }

        public Builder<T> add(String httpMethod, String path, T value) {
            return add(HTTPMethod.valueOf(httpMethod), path, value);
        }

        public Builder<T> addAll(Collection<? extends GenericRouteSpec<T>> routeSpecs) {
            for ( GenericRouteSpec<T> routeSpec : routeSpecs ) {
                add(routeSpec);
            }
            return this;
        }

        /**
         * @param defaultValue is returned in a default matched route when no
         *     route matches, null to return null instead.
         *
         * @return this
         */
        public Builder<T> setDefault(T defaultValue) {
            _defaultValue = defaultValue;
            return this;
        }

        public Builder<T> withPrecedence(RoutePrecedence precedence) {
            if ( null == precedence ) {
                throw new IllegalArgumentException("precedence must not be null");
            }
            _precedence = precedence;
            return this;
        }

        /**
         * @return the new index.
         *
         * @throws RouteMatcherConflict if two routes for the same method
         *     match exactly the same paths.
         */
        public RouteIndex<T> build() {
            return new RouteIndex<T>(this);
        }
    }

    private RouteIndex(Builder<T> builder) {
        _entries = Collections.unmodifiableList(new ArrayList<>(builder._entries));
        _defaultValue = builder._defaultValue;
        _precedence = builder._precedence;
        Map<HTTPMethod, RouteTrie<T>> tries = new EnumMap<>(HTTPMethod.class);
        for ( RouteEntry<T> entry : _entries ) {
            RouteTrie<T> trie = tries.get(entry.getHttpMethod());
            if ( null == trie ) {
                trie = new RouteTrie<>(_precedence);
                tries.put(entry.getHttpMethod(), trie);
            }
            trie.add(entry);
        }
        for ( RouteTrie<T> trie : tries.values() ) {
            trie.freeze();
        }
        _tries = Collections.unmodifiableMap(tries);
    }

    /**
     * @return a builder that starts with the routes, default and precedence
     *     of this index.
     */
    public Builder<T> toBuilder() {
        Builder<T> builder = new Builder<T>();
        builder._entries.addAll(_entries);
        builder._defaultValue = _defaultValue;
        builder._precedence = _precedence;
        return builder;
    }

    /**
     * @param httpMethod is the request method.
     *
     * @param path is the raw request path.
     *
     * @return the matched route with its captured params, a default route if
     *     nothing matched and a default was set, otherwise null.
     */
    public GenericMatchedRoute<T> find(HTTPMethod httpMethod, String path) {
        if ( null == httpMethod ) {
            throw new IllegalArgumentException("httpMethod must not be null");
        }
        List<String> segments = PathSplitter.split(path);
        RouteTrie.Lookup<T> lookup = lookup(httpMethod, segments);
        RouteEntry<T> entry = lookup.getEntry();
        if ( null != entry ) {
            RouteParams params = SegmentMatcher.match(entry.getPattern(), segments);
            if ( null == params ) {
                throw new IllegalStateException(
                    "Route index selected "+entry+" which does not match "+httpMethod+" "+path);
            }
            GenericMatchedRoute<T> result = new GenericMatchedRoute<T>(entry.getRouteSpec(), params);
            if ( LOG.isDebugEnabled() ) {
                LOG.debug("Route matched after visiting "+lookup.getNodesVisited()+" nodes: "+result);
            }
            return result;
        }
        if ( null == _defaultValue ) return null;
        return new GenericMatchedRoute<T>(
            GenericRouteSpec.<T>builder()
            .withPath(( null == path ) ? "/" : path)
            .withHTTPMethod(httpMethod)
            .withValue(_defaultValue)
            .build(),
            RouteParams.empty(),
            true);
    }

    RouteTrie.Lookup<T> lookup(HTTPMethod httpMethod, List<String> segments) {
        RouteTrie<T> trie = _tries.get(httpMethod);
        if ( null == trie ) {
            return RouteTrie.noMatch();
        }
        return trie.find(segments);
    }

    /**
     * @param path is the raw request path.
     *
     * @return every method with a route matching the path, ignoring the
     *     default route.
     */
    public Set<HTTPMethod> allowedMethods(String path) {
        List<String> segments = PathSplitter.split(path);
        Set<HTTPMethod> result = EnumSet.noneOf(HTTPMethod.class);
        for ( Map.Entry<HTTPMethod, RouteTrie<T>> entry : _tries.entrySet() ) {
            if ( null != entry.getValue().find(segments).getEntry() ) {
                result.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * @return every registered route spec in registration order.
     */
    public List<GenericRouteSpec<T>> getAllRoutes() {
        List<GenericRouteSpec<T>> result = new ArrayList<>(_entries.size());
        for ( RouteEntry<T> entry : _entries ) {
            result.add(entry.getRouteSpec());
        }
        return result;
    }

    public List<RouteEntry<T>> getEntries() {
        return _entries;
    }

    public T getDefault() {
        return _defaultValue;
    }

    public RoutePrecedence getPrecedence() {
        return _precedence;
    }

    public int size() {
        return _entries.size();
    }

    @Override
    public String toString() {
        return "RouteIndex[routes="+_entries.size()+", precedence="+_precedence+
            ", methods="+_tries.keySet()+"]";
    }
}
