package com.reviewflow.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks reviewers least-loaded first, then by reputation. The id tie-break keeps
 * the choice stable for identical candidate sets.
 */
@Component
public class ReviewerSelector {

    public static final Comparator<ReviewerCandidate> WORKLOAD_ORDER = Comparator
            .comparingInt(ReviewerCandidate::activeAssignmentCount)
            .thenComparing(Comparator.comparingInt(ReviewerCandidate::totalXp).reversed())
            .thenComparing(ReviewerCandidate::id);

    public Selection select(List<ReviewerCandidate> candidates, int minimumReviewers, boolean allowPartialAssignment) {
        Objects.requireNonNull(candidates, "candidates are required");
        if (minimumReviewers < 1) {
            throw new IllegalArgumentException("minimumReviewers must be at least 1");
        }

        List<ReviewerCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(WORKLOAD_ORDER);

        if (ordered.isEmpty()) {
            return Selection.failed("No eligible reviewers available. Need at least " + minimumReviewers);
        }

        if (ordered.size() < minimumReviewers) {
            if (!allowPartialAssignment) {
                return Selection.failed("Insufficient reviewers available. Found " + ordered.size()
                        + ", need " + minimumReviewers);
            }
            return new Selection(
                    List.copyOf(ordered),
                    null,
                    "Insufficient reviewers available. Assigning " + ordered.size() + " of "
                            + minimumReviewers + " requested"
            );
        }

        return new Selection(List.copyOf(ordered.subList(0, minimumReviewers)), null, null);
    }

    public record Selection(
            List<ReviewerCandidate> selected,
            String error,
            String warning
    ) {

        static Selection failed(String error) {
            return new Selection(List.of(), error, null);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
