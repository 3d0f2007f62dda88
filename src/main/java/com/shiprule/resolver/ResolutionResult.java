package com.shiprule.resolver;

import com.shiprule.config.ShippingProfile;

import java.util.Optional;

/**
 * Result of resolving the shipping profile for one line item.
 */
public interface ResolutionResult {

    /**
     * Get the resolved profile. Empty when unmatched.
     */
    Optional<ShippingProfile> getProfile();

    /**
     * Get how the profile was chosen.
     */
    MatchType getMatchType();

    /**
     * Check if a profile applies (matched or default).
     */
    default boolean isResolved() {
        return getMatchType() != MatchType.UNMATCHED;
    }

    /**
     * Get human-readable explanation of the decision.
     */
    String getExplanation();
}
