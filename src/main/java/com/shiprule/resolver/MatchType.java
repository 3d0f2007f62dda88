package com.shiprule.resolver;

/**
 * How an item was assigned its profile.
 */
public enum MatchType {
    /** A profile's match condition held. */
    MATCHED,
    /** Nothing matched; the default profile applies. */
    DEFAULT,
    /** Nothing matched and there is no default profile. */
    UNMATCHED
}
