package com.planningpoker.service;

import com.planningpoker.model.Vote;

import java.util.Collection;

/**
 * Turns the revealed votes of an issue into a single outcome.
 */
public interface OutcomePolicy {
    Vote outcomeOf(Collection<Vote> votes);
}
