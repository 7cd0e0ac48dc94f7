package com.pathmux.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
   The routes of one HTTP method arranged as a trie with one level per
   pattern token. Literal tokens are keyed edges, every other token kind is
   a fallback edge keyed by its shape, tried after the literal edge.

   The trie only selects the winning route. Captures are always extracted
   afterwards by {@link SegmentMatcher}, so the trie never changes what a
   pattern matches or binds.

   Mutable until {@link #freeze()}, read only (and safe to share between
   threads) afterwards.
*/
class RouteTrie<T>
{
    private static class Node<T> {
        private final int id;
        private Map<String, Node<T>> literals;
        private List<Edge<T>> dynamics;
        // Leaf:
        private RouteEntry<T> route;
        // Lowest registration order of any route at or below this node:
        private int minOrder = Integer.MAX_VALUE;

        private Node(int id) {
            this.id = id;
        }
    }

    private static class Edge<T> {
        private final PathToken token;
        private final Node<T> child;

        private Edge(PathToken token, Node<T> child) {
            this.token = token;
            this.child = child;
        }
    }

    /**
     * The outcome of one lookup.
     */
    static final class Lookup<T> {
        private final RouteEntry<T> _entry;
        private final int _nodesVisited;

        private Lookup(RouteEntry<T> entry, int nodesVisited) {
            _entry = entry;
            _nodesVisited = nodesVisited;
        }

        /**
         * @return the winning route or null if no route matched.
         */
        RouteEntry<T> getEntry() {
            return _entry;
        }

        int getNodesVisited() {
            return _nodesVisited;
        }
    }

    private static class Search<T> {
        private final List<String> segments;
        // (node id, segment index) pairs reached so far. Only touched states
        // are stored, so the memo is sized by the lookup, not the trie:
        private final Set<Long> visited = new HashSet<>();
        private RouteEntry<T> best;
        private int nodesVisited;

        private Search(List<String> segments) {
            this.segments = segments;
        }

        private int bestOrder() {
            return ( null == best ) ? Integer.MAX_VALUE : best.getOrder();
        }
    }

    private final RoutePrecedence _precedence;
    private final Node<T> _root;
    private int _nodeCount = 0;
    private boolean _frozen = false;

    RouteTrie(RoutePrecedence precedence) {
        _precedence = precedence;
        _root = newNode();
    }

    private Node<T> newNode() {
        return new Node<>(_nodeCount++);
    }

    /**
     * @param entry is the route to add.
     *
     * @throws RouteMatcherConflict if a route with the same shape was
     *     already added.
     */
    void add(RouteEntry<T> entry) {
        if ( _frozen ) {
            throw new IllegalStateException("Routes can not be added after the trie is frozen");
        }
        Node<T> node = _root;
        lowerMinOrder(node, entry);
        for ( PathToken token : entry.getPattern().getTokens() ) {
            node = child(node, token);
            lowerMinOrder(node, entry);
        }
        if ( null != node.route ) {
            throw new RouteMatcherConflict(
                entry.getHttpMethod() + " " + entry.getRouteSpec().getPath() +
                " " + entry.getValue() + " conflicts with " + node.route.getRouteSpec() +
                " pattern="+node.route.getPattern());
        }
        node.route = entry;
    }

    private static <T> void lowerMinOrder(Node<T> node, RouteEntry<T> entry) {
        if ( entry.getOrder() < node.minOrder ) {
            node.minOrder = entry.getOrder();
        }
    }

    private Node<T> child(Node<T> node, PathToken token) {
        if ( PathToken.Type.LITERAL == token.getType() ) {
            if ( null == node.literals ) {
                node.literals = new LinkedHashMap<>();
            }
            Node<T> child = node.literals.get(token.getText());
            if ( null == child ) {
                child = newNode();
                node.literals.put(token.getText(), child);
            }
            return child;
        }
        if ( null == node.dynamics ) {
            node.dynamics = new ArrayList<>();
        }
        String shapeKey = token.getShapeKey();
        for ( Edge<T> edge : node.dynamics ) {
            if ( edge.token.getShapeKey().equals(shapeKey) ) return edge.child;
        }
        Edge<T> edge = new Edge<>(token, newNode());
        node.dynamics.add(edge);
        return edge.child;
    }

    /**
     * No more routes may be added after this call.
     */
    void freeze() {
        if ( _frozen ) return;
        _frozen = true;
        if ( RoutePrecedence.MOST_SPECIFIC != _precedence ) return;
        List<Node<T>> stack = new ArrayList<>();
        stack.add(_root);
        while ( ! stack.isEmpty() ) {
            Node<T> node = stack.remove(stack.size()-1);
            if ( null != node.literals ) {
                stack.addAll(node.literals.values());
            }
            if ( null == node.dynamics ) continue;
            // Stable, so equally specific edges stay in registration order:
            Collections.sort(node.dynamics, Comparator.comparingInt(edge -> specificity(edge.token)));
            for ( Edge<T> edge : node.dynamics ) {
                stack.add(edge.child);
            }
        }
    }

    private static int specificity(PathToken token) {
        switch ( token.getType() ) {
        case EXTENSION:       return 0;
        case PARAM:
        case SINGLE_WILDCARD: return 1;
        case MULTI_WILDCARD:  return 2;
        default:
            throw new IllegalStateException("Literal tokens are not dynamic edges: "+token);
        }
    }

    static <T> Lookup<T> noMatch() {
        return new Lookup<T>(null, 0);
    }

    /**
     * @param segments are the request path segments.
     *
     * @return the lookup outcome, never null.
     */
    Lookup<T> find(List<String> segments) {
        if ( ! _frozen ) {
            throw new IllegalStateException("freeze() must be called before find()");
        }
        Search<T> search = new Search<>(segments);
        if ( RoutePrecedence.MOST_SPECIFIC == _precedence ) {
            findMostSpecific(_root, 0, search);
        } else {
            findFirstRegistered(_root, 0, search);
        }
        return new Lookup<>(search.best, search.nodesVisited);
    }

    // Explores every path through the trie that can consume the segments,
    // skipping subtrees that can not hold a route registered before the
    // best one found so far.
    private void findFirstRegistered(Node<T> node, int idx, Search<T> search) {
        if ( node.minOrder >= search.bestOrder() ) return;
        if ( ! firstVisit(node, idx, search) ) return;

        List<String> segments = search.segments;
        if ( idx == segments.size() && null != node.route &&
             node.route.getOrder() < search.bestOrder() )
        {
            search.best = node.route;
        }
        if ( idx < segments.size() && null != node.literals ) {
            Node<T> child = node.literals.get(segments.get(idx));
            if ( null != child ) {
                findFirstRegistered(child, idx+1, search);
            }
        }
        if ( null == node.dynamics ) return;
        for ( Edge<T> edge : node.dynamics ) {
            if ( PathToken.Type.MULTI_WILDCARD == edge.token.getType() ) {
                for ( int end = idx; end <= segments.size(); end++ ) {
                    findFirstRegistered(edge.child, end, search);
                }
            } else if ( idx < segments.size() && edge.token.matches(segments.get(idx)) ) {
                findFirstRegistered(edge.child, idx+1, search);
            }
        }
    }

    // Depth first, literal edge before the (sorted) dynamic edges, first
    // route reached wins.
    private boolean findMostSpecific(Node<T> node, int idx, Search<T> search) {
        if ( ! firstVisit(node, idx, search) ) return false;

        List<String> segments = search.segments;
        if ( idx == segments.size() && null != node.route ) {
            search.best = node.route;
            return true;
        }
        if ( idx < segments.size() && null != node.literals ) {
            Node<T> child = node.literals.get(segments.get(idx));
            if ( null != child && findMostSpecific(child, idx+1, search) ) {
                return true;
            }
        }
        if ( null == node.dynamics ) return false;
        for ( Edge<T> edge : node.dynamics ) {
            if ( PathToken.Type.MULTI_WILDCARD == edge.token.getType() ) {
                for ( int end = idx; end <= segments.size(); end++ ) {
                    if ( findMostSpecific(edge.child, end, search) ) return true;
                }
            } else if ( idx < segments.size() &&
                        edge.token.matches(segments.get(idx)) &&
                        findMostSpecific(edge.child, idx+1, search) )
            {
                return true;
            }
        }
        return false;
    }

    // A (node, segment index) state yields the same routes every time it is
    // reached, so each is explored at most once per lookup.
    private boolean firstVisit(Node<T> node, int idx, Search<T> search) {
        if ( ! search.visited.add(((long)node.id << 32) | idx) ) return false;
        search.nodesVisited++;
        return true;
    }
}
