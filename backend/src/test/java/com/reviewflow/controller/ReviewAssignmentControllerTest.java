package com.reviewflow.controller;

import com.reviewflow.model.ReviewAssignment;
import com.reviewflow.model.ReviewAssignmentStatus;
import com.reviewflow.model.UserRole;
import com.reviewflow.service.AssignmentResult;
import com.reviewflow.service.DeadlineMonitorService;
import com.reviewflow.service.DeadlineStatus;
import com.reviewflow.service.DeadlineUrgency;
import com.reviewflow.service.EligibilityCheck;
import com.reviewflow.service.ReshuffleFailureReason;
import com.reviewflow.service.ReshuffleResult;
import com.reviewflow.service.ReviewReassignmentService;
import com.reviewflow.service.ReviewAssignmentService;
import com.reviewflow.service.ReviewerCandidate;
import com.reviewflow.service.ReviewerPoolOptions;
import com.reviewflow.service.ReviewerPoolService;
import com.reviewflow.service.ReviewerWorkload;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewAssignmentController.class)
class ReviewAssignmentControllerTest {

    private static final UUID SUBMISSION_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID AUTHOR_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a2");
    private static final UUID REVIEWER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReviewAssignmentService reviewAssignmentService;

    @MockitoBean
    private ReviewerPoolService reviewerPoolService;

    @MockitoBean
    private DeadlineMonitorService deadlineMonitorService;

    @MockitoBean
    private ReviewReassignmentService reviewReassignmentService;

    @Test
    void autoAssign_returnsCreatedWithAssignedReviewers() throws Exception {
        ReviewerCandidate reviewer = new ReviewerCandidate(REVIEWER_ID, "alice", UserRole.REVIEWER, 120, 0, 1);
        UUID assignmentId = UUID.randomUUID();
        when(reviewAssignmentService.assignReviewers(eq(SUBMISSION_ID), eq(AUTHOR_ID), any()))
                .thenReturn(new AssignmentResult(true, List.of(reviewer), List.of(assignmentId), List.of(), List.of()));

        mockMvc.perform(post("/api/admin/assignments/auto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "submissionId": "%s",
                                  "authorUserId": "%s",
                                  "minimumReviewers": 1,
                                  "taskTypes": ["frontend"],
                                  "allowPartialAssignment": true
                                }
                                """.formatted(SUBMISSION_ID, AUTHOR_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.assignedReviewers[0].username").value("alice"))
                .andExpect(jsonPath("$.assignmentIds[0]").value(assignmentId.toString()));

        ArgumentCaptor<ReviewerPoolOptions> options = ArgumentCaptor.forClass(ReviewerPoolOptions.class);
        verify(reviewAssignmentService).assignReviewers(eq(SUBMISSION_ID), eq(AUTHOR_ID), options.capture());
        assertEquals(1, options.getValue().minimumReviewers());
        assertEquals(Set.of("frontend"), options.getValue().taskTypes());
        assertTrue(options.getValue().allowPartialAssignment());
    }

    @Test
    void autoAssign_returnsUnprocessableEntityOnBusinessFailure() throws Exception {
        when(reviewAssignmentService.assignReviewers(eq(SUBMISSION_ID), eq(AUTHOR_ID), any()))
                .thenReturn(AssignmentResult.failed(
                        List.of("No eligible reviewers available. Need at least 3"), List.of()));

        mockMvc.perform(post("/api/admin/assignments/auto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissionId\":\"%s\",\"authorUserId\":\"%s\"}".formatted(SUBMISSION_ID, AUTHOR_ID)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors[0]").value("No eligible reviewers available. Need at least 3"));
    }

    @Test
    void autoAssign_rejectsMissingFields() throws Exception {
        mockMvc.perform(post("/api/admin/assignments/auto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minimumReviewers\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.submissionId").value("submissionId is required"))
                .andExpect(jsonPath("$.fieldErrors.authorUserId").value("authorUserId is required"))
                .andExpect(jsonPath("$.fieldErrors.minimumReviewers").value("minimumReviewers must be at least 1"));

        verifyNoInteractions(reviewAssignmentService);
    }

    @Test
    void manualAssign_returnsNotFoundForUnknownSubmission() throws Exception {
        when(reviewAssignmentService.assignSpecificReviewers(eq(SUBMISSION_ID), anyList()))
                .thenReturn(AssignmentResult.failed(List.of(ReviewAssignmentService.SUBMISSION_NOT_FOUND), List.of()));

        mockMvc.perform(post("/api/admin/assignments/manual")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissionId\":\"%s\",\"reviewerIds\":[\"%s\"]}".formatted(SUBMISSION_ID, REVIEWER_ID)))
                .andExpect(status().isNotFound());
    }

    @Test
    void manualAssign_rejectsTooManyReviewers() throws Exception {
        String ids = String.join(",", List.of(
                quoted(UUID.randomUUID()), quoted(UUID.randomUUID()), quoted(UUID.randomUUID()),
                quoted(UUID.randomUUID()), quoted(UUID.randomUUID()), quoted(UUID.randomUUID())));

        mockMvc.perform(post("/api/admin/assignments/manual")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissionId\":\"%s\",\"reviewerIds\":[%s]}".formatted(SUBMISSION_ID, ids)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.reviewerIds").value("reviewerIds supports at most 5 reviewers"));
    }

    @Test
    void deadlines_listsStatuses() throws Exception {
        UUID assignmentId = UUID.randomUUID();
        when(deadlineMonitorService.getDeadlineStatuses()).thenReturn(List.of(new DeadlineStatus(
                assignmentId, SUBMISSION_ID, REVIEWER_ID, ReviewAssignmentStatus.PENDING,
                OffsetDateTime.now().plusHours(3), DeadlineUrgency.URGENT, 3.0)));

        mockMvc.perform(get("/api/admin/assignments/deadlines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].assignmentId").value(assignmentId.toString()))
                .andExpect(jsonPath("$[0].urgency").value("URGENT"))
                .andExpect(jsonPath("$[0].hoursRemaining").value(3.0));
    }

    @Test
    void urgent_listsOnlyUrgentStatuses() throws Exception {
        when(deadlineMonitorService.getUrgentAssignments()).thenReturn(List.of());

        mockMvc.perform(get("/api/admin/assignments/urgent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void extend_reportsOutcome() throws Exception {
        UUID assignmentId = UUID.randomUUID();
        when(deadlineMonitorService.extendDeadline(assignmentId, 24.0, "holiday")).thenReturn(true);

        mockMvc.perform(post("/api/admin/assignments/{id}/extend", assignmentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"additionalHours\": 24, \"reason\": \"holiday\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extended").value(true));
    }

    @Test
    void extend_returnsConflictWhenNotExtendable() throws Exception {
        UUID assignmentId = UUID.randomUUID();
        when(deadlineMonitorService.extendDeadline(assignmentId, 2.0, null)).thenReturn(false);

        mockMvc.perform(post("/api/admin/assignments/{id}/extend", assignmentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"additionalHours\": 2}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.extended").value(false));
    }

    @Test
    void extend_rejectsNonPositiveHours() throws Exception {
        mockMvc.perform(post("/api/admin/assignments/{id}/extend", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"additionalHours\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.additionalHours").value("additionalHours must be positive"));
    }

    @Test
    void workload_returnsCounts() throws Exception {
        when(reviewerPoolService.getReviewerWorkload(REVIEWER_ID)).thenReturn(new ReviewerWorkload(REVIEWER_ID, 2, 5, 1));

        mockMvc.perform(get("/api/admin/assignments/reviewers/{id}/workload", REVIEWER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeAssignments").value(2))
                .andExpect(jsonPath("$.completedThisWeek").value(5))
                .andExpect(jsonPath("$.missedReviews").value(1));
    }

    @Test
    void eligibility_returnsReasonOrNotFound() throws Exception {
        when(reviewAssignmentService.checkReviewerEligibility(REVIEWER_ID, SUBMISSION_ID))
                .thenReturn(Optional.of(EligibilityCheck.denied("Reviewer is paused from reviewing")));

        mockMvc.perform(get("/api/admin/assignments/reviewers/{id}/eligibility", REVIEWER_ID)
                        .param("submissionId", SUBMISSION_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canAssign").value(false))
                .andExpect(jsonPath("$.reason").value("Reviewer is paused from reviewing"));

        UUID unknownSubmission = UUID.randomUUID();
        when(reviewAssignmentService.checkReviewerEligibility(REVIEWER_ID, unknownSubmission))
                .thenReturn(Optional.empty());

        mockMvc.perform(get("/api/admin/assignments/reviewers/{id}/eligibility", REVIEWER_ID)
                        .param("submissionId", unknownSubmission.toString()))
                .andExpect(status().isNotFound());
    }

    @Test
    void reshuffle_returnsReleasedAndNewAssignment() throws Exception {
        OffsetDateTime now = OffsetDateTime.now();
        ReviewAssignment released = ReviewAssignment.pending(SUBMISSION_ID, AUTHOR_ID, now.minusHours(5), now.plusHours(43));
        released.setStatus(ReviewAssignmentStatus.REASSIGNED);
        ReviewAssignment replacement = ReviewAssignment.pending(SUBMISSION_ID, REVIEWER_ID, now, now.plusHours(43));
        when(reviewReassignmentService.reshuffle(released.getId(), "reviewer on leave", false))
                .thenReturn(new ReshuffleResult(true, false, released, replacement, REVIEWER_ID, null, null));

        mockMvc.perform(post("/api/admin/assignments/{id}/reshuffle", released.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"reviewer on leave\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.releasedAssignment.status").value("REASSIGNED"))
                .andExpect(jsonPath("$.newAssignment.reviewerId").value(REVIEWER_ID.toString()))
                .andExpect(jsonPath("$.candidateReviewerId").value(REVIEWER_ID.toString()));
    }

    @Test
    void reshuffle_acceptsEmptyBodyAsLiveRun() throws Exception {
        UUID assignmentId = UUID.randomUUID();
        when(reviewReassignmentService.reshuffle(eq(assignmentId), isNull(), eq(false)))
                .thenReturn(new ReshuffleResult(false, false, null, null, null,
                        ReshuffleFailureReason.NOT_FOUND, "Assignment not found"));

        mockMvc.perform(post("/api/admin/assignments/{id}/reshuffle", assignmentId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("not_found"));
    }

    @Test
    void reshuffle_returnsConflictWhenNoReplacementOrAlreadyProcessed() throws Exception {
        UUID assignmentId = UUID.randomUUID();
        when(reviewReassignmentService.reshuffle(assignmentId, null, false))
                .thenReturn(new ReshuffleResult(false, false, null, null, null,
                        ReshuffleFailureReason.NO_REPLACEMENT_AVAILABLE,
                        "No eligible reviewers available. Need at least 1"));
        UUID processedId = UUID.randomUUID();
        when(reviewReassignmentService.reshuffle(processedId, null, false))
                .thenReturn(new ReshuffleResult(false, false, null, null, null,
                        ReshuffleFailureReason.ALREADY_PROCESSED, "Assignment is COMPLETED"));

        mockMvc.perform(post("/api/admin/assignments/{id}/reshuffle", assignmentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("no_replacement_available"));
        mockMvc.perform(post("/api/admin/assignments/{id}/reshuffle", processedId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("already_processed"));
    }

    @Test
    void reshuffle_passesDryRunFlag() throws Exception {
        UUID assignmentId = UUID.randomUUID();
        when(reviewReassignmentService.reshuffle(assignmentId, null, true))
                .thenReturn(new ReshuffleResult(true, true, null, null, REVIEWER_ID, null, null));

        mockMvc.perform(post("/api/admin/assignments/{id}/reshuffle", assignmentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dryRun\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.candidateReviewerId").value(REVIEWER_ID.toString()));
    }

    @Test
    void reshuffle_rejectsOverlongReason() throws Exception {
        mockMvc.perform(post("/api/admin/assignments/{id}/reshuffle", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"%s\"}".formatted("x".repeat(121))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.reason").value("reason must be at most 120 characters"));

        verifyNoInteractions(reviewReassignmentService);
    }

    @Test
    void malformedAssignmentIdReturnsFieldError() throws Exception {
        mockMvc.perform(post("/api/admin/assignments/{id}/extend", "not-a-uuid")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"additionalHours\": 2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.assignmentId").value("assignmentId must be a valid UUID"));

        verifyNoInteractions(deadlineMonitorService);
    }

    @Test
    void unreadableBodyReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/admin/assignments/auto")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"submissionId\": \"oops\""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));

        verifyNoInteractions(reviewAssignmentService);
    }

    @Test
    void eligibilityRequiresSubmissionId() throws Exception {
        mockMvc.perform(get("/api/admin/assignments/reviewers/{id}/eligibility", REVIEWER_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.submissionId").value("submissionId is required"));
    }

    private static String quoted(UUID id) {
        return "\"" + id + "\"";
    }
}
