package fr.lapetina.multillm.domain.session;

import java.util.List;

/**
 * Outcomes of a fan-out, one per session, in session order.
 */
public record BroadcastResult(List<SessionOutcome> outcomes) {

    public BroadcastResult {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public List<SessionOutcome> succeeded() {
        return outcomes.stream().filter(SessionOutcome::isSuccess).toList();
    }

    public List<SessionOutcome> failed() {
        return outcomes.stream()
                .filter(o -> o.status() == SessionOutcome.Status.FAILED)
                .toList();
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(SessionOutcome::isSuccess);
    }

    public int size() {
        return outcomes.size();
    }
}
