package com.shiprule.calculation;

import com.shiprule.core.LineItem;
import com.shiprule.resolver.MatchType;

/**
 * Audit entry recording which profile an item resolved to.
 *
 * @param item        The line item
 * @param profileId   Resolved profile id, null when no profile applied
 * @param profileName Resolved profile name, {@value #NO_RULE_MATCH} when no profile applied
 * @param matchType   How the profile was chosen
 */
public record MatchedItem(
        LineItem item,
        String profileId,
        String profileName,
        MatchType matchType
) {
    public static final String NO_RULE_MATCH = "No Rule Match";

    public static MatchedItem unmatched(LineItem item) {
        return new MatchedItem(item, null, NO_RULE_MATCH, MatchType.UNMATCHED);
    }

    public boolean isMatched() {
        return profileId != null;
    }
}
