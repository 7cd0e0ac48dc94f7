package com.pathmux.router;

/**
 * Decides which route wins when more than one registered pattern matches a
 * request path.
 */
public enum RoutePrecedence
{
    /**
     * The route registered first wins, even if a later route is more
     * specific. This is the default.
     */
    REGISTRATION_ORDER,

    /**
     * Walk the path left to right preferring literal segments, then
     * extension patterns, then single segment captures and finally multi
     * segment captures. Must be selected explicitly.
     */
    MOST_SPECIFIC;
}
