package com.pathmux.router;

import java.util.Arrays;
import java.util.EnumSet;
import org.junit.Test;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;


public class TestRouteMatcher {
    @Test(expected = RouteMatcherConflict.class)
    public void testConflict() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/:name/bar", "A");
        routeMatcher.add("GET", ":buz/bar", "B");
    }

    @Test
    public void testConflictLeavesMatcherUnchanged() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/files/*name", "A");
        try {
            routeMatcher.add("GET", "/files/:id", "B");
            fail("Expected RouteMatcherConflict");
        } catch ( RouteMatcherConflict ex ) {
            assertThat(ex.getMessage(), containsString("/files/:id"));
        }
        assertEquals(1, routeMatcher.getAllRoutes().size());
        assertEquals("A", match(routeMatcher, "GET", "/files/x").getValue());
    }

    @Test
    public void testSameShapeDifferentMethodIsNotAConflict() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/users/:id", "get");
        routeMatcher.add("PUT", "/users/:id", "put");
        assertEquals("get", match(routeMatcher, "GET", "/users/1").getValue());
        assertEquals("put", match(routeMatcher, "PUT", "/users/1").getValue());
        assertNull(match(routeMatcher, "POST", "/users/1"));
    }

    @Test
    public void testIgnoreExtraSlashes() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/:name/bar", "A");
        assertEquals("A", match(routeMatcher, "GET", "/foo/bar/").getValue());
        assertEquals("A", match(routeMatcher, "GET", "//foo//bar").getValue());
        assertEquals("foo", match(routeMatcher, "GET", "/foo/bar/").getParam("name"));
    }

    @Test
    public void testRegistrationOrderWins() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/users/:id", "byId");
        routeMatcher.add("GET", "/users/admin", "admin");

        GenericMatchedRoute<String> route = match(routeMatcher, "GET", "/users/admin");
        assertEquals("byId", route.getValue());
        assertEquals("admin", route.getParam("id"));
        assertEquals("/users/:id", route.getPath());
    }

    @Test
    public void testRegistrationOrderIsNotMostSpecific() {
        // Every route matches /foo/bar/baz, the first one registered wins
        // even though it is the least specific:
        for ( int i=1; i <= 8; i++ ) {
            GenericRouteMatcher<Integer> routeMatcher = new GenericRouteMatcher<>();
            if ( i <= 1 ) routeMatcher.add("GET", "/foo/bar/baz", 1); // most specific
            if ( i <= 2 ) routeMatcher.add("GET", "/foo/bar/:baz", 2);
            if ( i <= 3 ) routeMatcher.add("GET", "/foo/:bar/baz", 3);
            if ( i <= 4 ) routeMatcher.add("GET", "/foo/:bar/:baz", 4);
            if ( i <= 5 ) routeMatcher.add("GET", "/:foo/bar/baz", 5);
            if ( i <= 6 ) routeMatcher.add("GET", "/:foo/bar/:baz", 6);
            if ( i <= 7 ) routeMatcher.add("GET", "/:foo/:bar/baz", 7);
            routeMatcher.add("GET", "/:foo/:bar/:baz", 8); // least specific
            assertEquals(i, match(routeMatcher, "GET","/foo/bar/baz").getValue().intValue());
        }
        // Least specific first:
        GenericRouteMatcher<Integer> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/:foo/:bar/:baz", 8);
        routeMatcher.add("GET", "/foo/bar/baz", 1);
        assertEquals(8, match(routeMatcher, "GET","/foo/bar/baz").getValue().intValue());
    }

    @Test
    public void testMostSpecific() {
        for ( int i=1; i <= 8; i++ ) {
            GenericRouteMatcher<Integer> routeMatcher = new GenericRouteMatcher<>(RoutePrecedence.MOST_SPECIFIC);
            routeMatcher.add("GET", "/:foo/:bar/:baz", 8); // least specific
            if ( i < 8 ) routeMatcher.add("GET", "/:foo/:bar/baz", 7);
            if ( i < 7 ) routeMatcher.add("GET", "/:foo/bar/:baz", 6);
            if ( i < 6 ) routeMatcher.add("GET", "/:foo/bar/baz", 5);
            if ( i < 5 ) routeMatcher.add("GET", "/foo/:bar/:baz", 4);
            if ( i < 4 ) routeMatcher.add("GET", "/foo/:bar/baz", 3);
            if ( i < 3 ) routeMatcher.add("GET", "/foo/bar/:baz", 2);
            if ( i < 2 ) routeMatcher.add("GET", "/foo/bar/baz", 1); // most specific
            assertEquals(i, match(routeMatcher, "GET","/foo/bar/baz").getValue().intValue());
        }
    }

    @Test
    public void testMostSpecificMustBeRequested() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/users/:id", "byId");
        routeMatcher.add("GET", "/users/admin", "admin");
        assertEquals(RoutePrecedence.REGISTRATION_ORDER, routeMatcher.getIndex().getPrecedence());
        assertNotEquals("admin", match(routeMatcher, "GET", "/users/admin").getValue());

        routeMatcher.setPrecedence(RoutePrecedence.MOST_SPECIFIC);
        GenericMatchedRoute<String> route = match(routeMatcher, "GET", "/users/admin");
        assertEquals("admin", route.getValue());
        assertTrue(route.getParams().isEmpty());
        assertEquals("byId", match(routeMatcher, "GET", "/users/bob").getValue());
    }

    @Test
    public void testMostSpecificTokenRanking() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>(RoutePrecedence.MOST_SPECIFIC);
        routeMatcher.add("GET", "/files/**path", "multi");
        routeMatcher.add("GET", "/files/:name", "param");
        routeMatcher.add("GET", "/files/*.json", "extension");
        routeMatcher.add("GET", "/files/index.json", "literal");

        assertEquals("literal", match(routeMatcher, "GET", "/files/index.json").getValue());
        assertEquals("extension", match(routeMatcher, "GET", "/files/other.json").getValue());
        assertEquals("param", match(routeMatcher, "GET", "/files/other.txt").getValue());
        assertEquals("multi", match(routeMatcher, "GET", "/files/a/b").getValue());
        assertEquals("multi", match(routeMatcher, "GET", "/files").getValue());

        // The same table in registration order lets the first route win:
        routeMatcher.setPrecedence(RoutePrecedence.REGISTRATION_ORDER);
        assertEquals("multi", match(routeMatcher, "GET", "/files/index.json").getValue());
        assertEquals("index.json", match(routeMatcher, "GET", "/files/index.json").getParam("path"));
    }

    @Test
    public void testDefaultRoute() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/users/:id", "user");
        assertNull(match(routeMatcher, "GET", "/nothing/here"));

        routeMatcher.setDefault("fallback");
        GenericMatchedRoute<String> route = match(routeMatcher, "GET", "/nothing/here");
        assertEquals("fallback", route.getValue());
        assertTrue(route.isDefaultRoute());
        assertTrue(route.getParams().isEmpty());
        assertEquals("/nothing/here", route.getPath());

        route = match(routeMatcher, "GET", "/users/5");
        assertFalse(route.isDefaultRoute());
        assertEquals("5", route.getParam("id"));
    }

    @Test
    public void testAllowedMethods() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/users/:id", "get");
        routeMatcher.add("DELETE", "/users/:id", "delete");
        routeMatcher.add("POST", "/users", "create");
        assertEquals(EnumSet.of(HTTPMethod.GET, HTTPMethod.DELETE), routeMatcher.allowedMethods("/users/9"));
        assertEquals(EnumSet.of(HTTPMethod.POST), routeMatcher.allowedMethods("/users"));
        assertTrue(routeMatcher.allowedMethods("/other").isEmpty());
    }

    @Test
    public void testReloadSwapsAllRoutes() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/old", "old");
        RouteIndex<String> before = routeMatcher.getIndex();

        routeMatcher.reload(Arrays.asList(
                                GenericRouteSpec.<String>builder()
                                .withPath("/new/:id")
                                .withHTTPMethod(HTTPMethod.GET)
                                .withValue("new")
                                .build()));

        assertNull(match(routeMatcher, "GET", "/old"));
        assertEquals("new", match(routeMatcher, "GET", "/new/1").getValue());
        // Snapshots taken earlier are never modified:
        assertEquals("old", before.find(HTTPMethod.GET, "/old").getValue());
        assertNull(before.find(HTTPMethod.GET, "/new/1"));
    }

    @Test
    public void testInvalidPatternIsRejectedAtRegistration() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        try {
            routeMatcher.add("GET", "/img/*.{}", "A");
            fail("Expected InvalidRoutePatternException");
        } catch ( InvalidRoutePatternException ex ) {
            assertEquals("/img/*.{}", ex.getPattern());
        }
        assertTrue(routeMatcher.getAllRoutes().isEmpty());
    }

    @Test
    public void testMiddlewareIsCarriedOnTheMatch() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add(GenericRouteSpec.<String>builder()
                         .withPath("/admin/**")
                         .withHTTPMethod(HTTPMethod.GET)
                         .withValue("admin")
                         .withMiddleware("auth", "audit")
                         .build());
        assertEquals(Arrays.asList("auth", "audit"),
                     match(routeMatcher, "GET", "/admin/users").getRouteSpec().getMiddleware());
    }

    @Test
    public void testAddAllIsOneSnapshot() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/first", "first");
        RouteIndex<String> before = routeMatcher.getIndex();
        routeMatcher.addAll(Arrays.asList(
                                GenericRouteSpec.<String>builder()
                                .withPath("/users/:id").withHTTPMethod(HTTPMethod.GET).withValue("byId").build(),
                                GenericRouteSpec.<String>builder()
                                .withPath("/users/admin").withHTTPMethod(HTTPMethod.GET).withValue("admin").build()));
        assertEquals(3, routeMatcher.getAllRoutes().size());
        assertEquals("byId", match(routeMatcher, "GET", "/users/admin").getValue());
        assertEquals("first", match(routeMatcher, "GET", "/first").getValue());
        assertEquals(1, before.size());
    }

    @Test
    public void testAddAllConflictAddsNothing() {
        GenericRouteMatcher<String> routeMatcher = new GenericRouteMatcher<>();
        routeMatcher.add("GET", "/first", "first");
        try {
            routeMatcher.addAll(Arrays.asList(
                                    GenericRouteSpec.<String>builder()
                                    .withPath("/a/:x").withHTTPMethod(HTTPMethod.GET).withValue("A").build(),
                                    GenericRouteSpec.<String>builder()
                                    .withPath("/a/:y").withHTTPMethod(HTTPMethod.GET).withValue("B").build()));
            fail("Expected RouteMatcherConflict");
        } catch ( RouteMatcherConflict ex ) {
            assertThat(ex.getMessage(), containsString("/a/:y"));
        }
        assertEquals(1, routeMatcher.getAllRoutes().size());
        assertNull(match(routeMatcher, "GET", "/a/1"));
    }

    protected <T> GenericMatchedRoute<T> match(GenericRouteMatcher<T> routeMatcher, String httpMethod, String path) {
        return routeMatcher.match(HTTPMethod.valueOf(httpMethod), path);
    }
}
