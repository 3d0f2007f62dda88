package com.shiprule.resolver;

import com.shiprule.config.ShippingProfile;

import java.util.Optional;

/**
 * Default implementation of ResolutionResult.
 */
public class DefaultResolutionResult implements ResolutionResult {

    private static final ResolutionResult UNMATCHED = new DefaultResolutionResult(
            null, MatchType.UNMATCHED, "No matching profile and no default profile");

    private final ShippingProfile profile;
    private final MatchType matchType;
    private final String explanation;

    private DefaultResolutionResult(ShippingProfile profile, MatchType matchType, String explanation) {
        this.profile = profile;
        this.matchType = matchType;
        this.explanation = explanation;
    }

    @Override
    public Optional<ShippingProfile> getProfile() {
        return Optional.ofNullable(profile);
    }

    @Override
    public MatchType getMatchType() {
        return matchType;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "matchType=" + matchType +
                ", profile=" + (profile != null ? profile.id() : "none") +
                '}';
    }

    /**
     * Create a result for a profile whose condition held.
     */
    public static ResolutionResult matched(ShippingProfile profile, String condition) {
        return new DefaultResolutionResult(profile, MatchType.MATCHED,
                "Matched profile '" + profile.name() + "' (priority " + profile.priority() + ") on " + condition);
    }

    /**
     * Create a result for the default-profile fallback.
     */
    public static ResolutionResult fallback(ShippingProfile profile) {
        return new DefaultResolutionResult(profile, MatchType.DEFAULT,
                "No profile matched, using default profile '" + profile.name() + "'");
    }

    /**
     * Create a result for an unmatched item.
     */
    public static ResolutionResult unmatched() {
        return UNMATCHED;
    }
}
