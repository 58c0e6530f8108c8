package com.giftsbuyer.domain.acquisition;

import com.giftsbuyer.domain.gift.Gift;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Applies exclusion rules in order, then delegates to {@link RangeMatcher}.
 *
 * Sold-out and non-limited checks always run before range matching, so a sold-out gift
 * is never reported as a range mismatch.
 */
public final class EligibilityEvaluator {

    private record ExclusionRule(ExclusionReason reason, Predicate<Gift> applies) {}

    private final List<ExclusionRule> rules;
    private final RangeMatcher rangeMatcher;

    public EligibilityEvaluator(RangeMatcher rangeMatcher, boolean upgradableOnly) {
        this.rangeMatcher = Objects.requireNonNull(rangeMatcher, "rangeMatcher");
        this.rules = List.of(
                new ExclusionRule(ExclusionReason.SOLD_OUT, Gift::soldOut),
                new ExclusionRule(ExclusionReason.NON_LIMITED_BLOCKED, g -> !g.limited()),
                new ExclusionRule(ExclusionReason.NON_UPGRADABLE_BLOCKED, g -> upgradableOnly && !g.upgradable())
        );
    }

    public EligibilityVerdict evaluate(Gift gift) {
        for (ExclusionRule rule : rules) {
            if (rule.applies().test(gift)) return EligibilityVerdict.excluded(rule.reason());
        }

        int supply = gift.supplyForMatching();
        RangeMatch m = rangeMatcher.match(gift.price(), supply);
        if (!m.matched()) {
            return EligibilityVerdict.rangeError(gift.price(), supply);
        }
        return EligibilityVerdict.eligible(m.quantity(), m.recipients());
    }
}
