package com.planningpoker.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class VotingIssueTest {

    private VotingIssue issueWithVotes() {
        VotingIssue issue = new VotingIssue("issue-1", "PROJ-7");
        issue.recordVote("Alice", Vote.FIVE);
        issue.recordVote("Bob", Vote.EIGHT);
        issue.recordVote("Carol", Vote.UNKNOWN);
        return issue;
    }

    @Test
    void new_issue_is_opening_without_votes() {
        VotingIssue issue = new VotingIssue("issue-1", null);

        assertThat(issue.getState()).isEqualTo(VotingState.OPENING);
        assertThat(issue.getVotes()).isEmpty();
        assertThat(issue.getOutcome()).isNull();
    }

    @Test
    void first_vote_moves_issue_to_voting() {
        VotingIssue issue = new VotingIssue("issue-1", null);

        issue.recordVote("Alice", Vote.ONE);

        assertThat(issue.getState()).isEqualTo(VotingState.VOTING);
    }

    @Test
    void blinded_view_keeps_only_the_recipients_own_vote() {
        VotingIssue blinded = issueWithVotes().blindedFor("Bob");

        assertThat(blinded.getVotes()).containsExactly(
                entry("Alice", Vote.SECRET),
                entry("Bob", Vote.EIGHT),
                entry("Carol", Vote.SECRET));
        assertThat(blinded.id).isEqualTo("issue-1");
        assertThat(blinded.topicRef).isEqualTo("PROJ-7");
    }

    @Test
    void blinded_view_for_an_observer_hides_everything() {
        VotingIssue blinded = issueWithVotes().blindedFor("Dave");

        assertThat(blinded.getVotes().values()).containsOnly(Vote.SECRET);
    }

    @Test
    void blinding_does_not_touch_the_stored_votes() {
        VotingIssue issue = issueWithVotes();

        issue.blindedFor("Bob");

        assertThat(issue.getVotes()).containsEntry("Alice", Vote.FIVE);
    }

    @Test
    void closed_issue_is_shown_unblinded_to_everyone() {
        VotingIssue issue = issueWithVotes();
        issue.close(Vote.EIGHT);

        VotingIssue view = issue.blindedFor("Dave");

        assertThat(view.getVotes()).containsExactly(
                entry("Alice", Vote.FIVE),
                entry("Bob", Vote.EIGHT),
                entry("Carol", Vote.UNKNOWN));
        assertThat(view.getOutcome()).isEqualTo(Vote.EIGHT);
        assertThat(view.getState()).isEqualTo(VotingState.CLOSING);
    }

    @Test
    void secret_cannot_be_recorded() {
        VotingIssue issue = new VotingIssue("issue-1", null);

        assertThatThrownBy(() -> issue.recordVote("Alice", Vote.SECRET))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closed_issue_rejects_votes() {
        VotingIssue issue = issueWithVotes();
        issue.close(Vote.FIVE);

        assertThatThrownBy(() -> issue.recordVote("Alice", Vote.ONE))
                .isInstanceOf(IllegalStateException.class);
    }
}
