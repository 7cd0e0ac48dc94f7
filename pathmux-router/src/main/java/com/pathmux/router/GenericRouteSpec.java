package com.pathmux.router;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
   Declares one route: the HTTP method, the path pattern, the handler value
   and the names of the middleware that wrap the handler.
*/
public class GenericRouteSpec<T>
{
    private String _path = null;
    private HTTPMethod _httpMethod = null;
    private T _value = null;
    private List<String> _middleware = Collections.emptyList();

    public static <T> Builder<T, GenericRouteSpec<T>> builder() {
        return new Builder<T, GenericRouteSpec<T>>(GenericRouteSpec<T>::new);
    }

    public static class Builder<T, RS extends GenericRouteSpec<T>> {
        private RS _proto;
        private UnaryOperator<RS> _copy;

        public Builder(UnaryOperator<RS> copy) {
            _copy = copy;
            _proto = copy.apply(null);
        }
        private GenericRouteSpec<T> proto() {
            return _proto;
        }
        public Builder<T, RS> withPath(String path) {
            proto()._path = path;
            return this;
        }
        public Builder<T, RS> withHTTPMethod(HTTPMethod httpMethod) {
            proto()._httpMethod = httpMethod;
            return this;
        }
        public Builder<T, RS> withValue(T value) {
            proto()._value = value;
            return this;
        }
        public Builder<T, RS> withMiddleware(String... names) {
            return withMiddleware(Arrays.asList(names));
        }
        public Builder<T, RS> withMiddleware(Collection<String> names) {
            if ( null == names ) {
                proto()._middleware = Collections.emptyList();
            } else {
                proto()._middleware = Collections.unmodifiableList(new ArrayList<>(names));
            }
            return this;
        }
        public RS build() {
            if ( null == proto()._httpMethod ) {
                throw new IllegalStateException("withHTTPMethod() must be called before build()");
            }
            if ( null == proto()._path ) {
                throw new IllegalStateException("withPath() must be called before build()");
            }
            return _copy.apply(_proto);
        }
    }

    protected GenericRouteSpec(GenericRouteSpec<T> copy) {
        if ( null == copy ) return;
        _path = copy._path;
        _httpMethod = copy._httpMethod;
        _value = copy._value;
        _middleware = copy._middleware;
    }

    public String getPath() {
        return this._path;
    }

    public HTTPMethod getHttpMethod() {
        return this._httpMethod;
    }

    public T getValue()
    {
        return _value;
    }

    /**
     * @return the names of the middleware chain for this route, outermost
     *     first. Running them is up to the dispatcher.
     */
    public List<String> getMiddleware() {
        return _middleware;
    }

    @Override
    public String toString()
    {
        return String.format("RouteSpec[path=%s, httpMethod=%s, value=%s, middleware=%s]",
                             _path,
                             _httpMethod,
                             _value,
                             _middleware);
    }
}
