package com.projectpulse.service.runtime;

import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.PostStatus;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record CycleOutcome(
        CycleType cycleType,
        Status status,
        List<CandidateResult> candidates,
        Set<Destination> succeeded,
        Set<Destination> retryable,
        Set<Destination> permanent
) {
    public enum Status {
        SKIPPED,
        COMPLETED
    }

    public CycleOutcome {
        candidates = List.copyOf(candidates);
        succeeded = copy(succeeded);
        retryable = copy(retryable);
        permanent = copy(permanent);
    }

    public static CycleOutcome skipped(CycleType cycleType) {
        return new CycleOutcome(cycleType, Status.SKIPPED, List.of(), Set.of(), Set.of(), Set.of());
    }

    public static CycleOutcome completed(CycleType cycleType, List<CandidateResult> candidates) {
        Set<Destination> succeeded = EnumSet.noneOf(Destination.class);
        Set<Destination> retryable = EnumSet.noneOf(Destination.class);
        Set<Destination> permanent = EnumSet.noneOf(Destination.class);
        for (CandidateResult candidate : candidates) {
            for (PostResult result : candidate.results().values()) {
                switch (result.status()) {
                    case SUCCEEDED -> succeeded.add(result.destination());
                    case FAILED_PERMANENT -> permanent.add(result.destination());
                    default -> retryable.add(result.destination());
                }
            }
        }
        return new CycleOutcome(cycleType, Status.COMPLETED, candidates, succeeded, retryable, permanent);
    }

    /**
     * 0 when nothing failed, 2 when every publish of the cycle failed, 1 otherwise.
     */
    public int exitCode() {
        int successes = 0;
        int failures = 0;
        for (CandidateResult candidate : candidates) {
            for (PostResult result : candidate.results().values()) {
                if (result.status() == PostStatus.SUCCEEDED) {
                    successes++;
                } else {
                    failures++;
                }
            }
        }
        if (failures == 0) {
            return 0;
        }
        return successes == 0 ? 2 : 1;
    }

    public boolean skipped() {
        return status == Status.SKIPPED;
    }

    private static Set<Destination> copy(Set<Destination> destinations) {
        return destinations.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(destinations));
    }

    public record CandidateResult(String signature, Set<Long> activityIds, Map<Destination, PostResult> results) {
        public CandidateResult {
            activityIds = Set.copyOf(activityIds);
            results = Map.copyOf(results);
        }

        public PostResult result(Destination destination) {
            return results.get(destination);
        }
    }
}
