package com.planningpoker.service;

import com.planningpoker.model.Vote;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lower median of the cast estimates in deck order. UNKNOWN (abstain) votes are ignored;
 * if nobody estimated, the outcome is UNKNOWN.
 */
public class MedianOutcomePolicy implements OutcomePolicy {

    @Override
    public Vote outcomeOf(Collection<Vote> votes) {
        List<Vote> estimates = votes.stream()
                .filter(Vote::isEstimate)
                .sorted()
                .collect(Collectors.toList());
        if (estimates.isEmpty()) {
            return Vote.UNKNOWN;
        }
        return estimates.get((estimates.size() - 1) / 2);
    }
}
