package com.procflow.integration.models.run;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.procflow.integration.enumerations.ProcFlowApprovalDecision;
import com.procflow.integration.enumerations.ProcFlowApprovalTimeoutAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable record of a suspended approval node.
 *
 * <p>An open approval has no {@code resolvedAt}. Approvals consumed by a resume are deleted;
 * approvals whose run failed elsewhere or whose deadline passed are kept, closed with
 * {@code closedReason}.</p>
 *
 * <p>The lifecycle settings ({@code deadline}, {@code timeoutAction}, {@code minApprovals} and
 * the escalation fields) are read from the review payload when the node suspends, see
 * {@link #fromReviewPayload}.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingApproval implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CLOSED_RUN_FAILED = "RUN_FAILED";
    public static final String CLOSED_EXPIRED = "EXPIRED";

    public static final String PAYLOAD_ASSIGNEES = "assignees";
    public static final String PAYLOAD_DEADLINE = "deadline";
    public static final String PAYLOAD_TIMEOUT_ACTION = "timeoutAction";
    public static final String PAYLOAD_MIN_APPROVALS = "minApprovals";
    public static final String PAYLOAD_ESCALATE_AT = "escalateAt";
    public static final String PAYLOAD_ESCALATION_ASSIGNEES = "escalationAssignees";

    private String runId;

    private String nodeId;

    @Builder.Default
    private Map<String, Object> reviewPayload = new LinkedHashMap<>();

    private Instant createdAt;

    private Instant resolvedAt;

    private ProcFlowApprovalDecision decision;

    private Map<String, Object> editedValues;

    private String closedReason;

    // ========================================================================
    // LIFECYCLE SETTINGS
    // ========================================================================

    @Builder.Default
    private List<String> assignees = new ArrayList<>();

    /**
     * No deadline means the approval waits indefinitely.
     */
    private Instant deadline;

    @Builder.Default
    private ProcFlowApprovalTimeoutAction timeoutAction = ProcFlowApprovalTimeoutAction.FAIL;

    @Builder.Default
    private int minApprovals = 1;

    /**
     * Reviewers whose approval counted toward {@code minApprovals} so far.
     */
    @Builder.Default
    private List<String> approvedBy = new ArrayList<>();

    private Instant escalateAt;

    @Builder.Default
    private List<String> escalationAssignees = new ArrayList<>();

    private boolean escalated;

    private Instant escalatedAt;

    @JsonIgnore
    public boolean isOpen() {
        return resolvedAt == null;
    }

    public boolean isExpired(Instant now) {
        return isOpen() && deadline != null && !deadline.isAfter(now);
    }

    public boolean isEscalationDue(Instant now) {
        return isOpen() && !escalated && escalateAt != null && !escalateAt.isAfter(now);
    }

    /**
     * Escalation assignees only count once the approval has been escalated.
     */
    public boolean isAssignedTo(String assignee) {
        return assignees.contains(assignee) || (escalated && escalationAssignees.contains(assignee));
    }

    public PendingApproval close(String reason) {
        return toBuilder()
                .resolvedAt(Instant.now())
                .closedReason(reason)
                .build();
    }

    /**
     * Records one approval toward the quorum.
     *
     * @return a copy with {@code reviewerId} added to {@code approvedBy}; an anonymous approval
     *         always counts, a repeated reviewer does not
     */
    public PendingApproval recordApproval(String reviewerId) {
        List<String> approvers = new ArrayList<>(approvedBy);
        if (reviewerId == null || !approvers.contains(reviewerId)) {
            approvers.add(reviewerId == null ? "anonymous-" + (approvers.size() + 1) : reviewerId);
        }
        return toBuilder().approvedBy(approvers).build();
    }

    public PendingApproval escalate(Instant now) {
        return toBuilder().escalated(true).escalatedAt(now).build();
    }

    @JsonIgnore
    public int getRemainingApprovals() {
        return Math.max(0, minApprovals - approvedBy.size());
    }

    public static PendingApproval fromReviewPayload(String runId, String nodeId, Map<String, Object> payload, Instant createdAt) {
        Map<String, Object> copy = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        Object minApprovals = copy.get(PAYLOAD_MIN_APPROVALS);
        return PendingApproval.builder()
                .runId(runId)
                .nodeId(nodeId)
                .reviewPayload(copy)
                .createdAt(createdAt)
                .assignees(strings(copy.get(PAYLOAD_ASSIGNEES)))
                .deadline(instant(copy.get(PAYLOAD_DEADLINE)))
                .timeoutAction(ProcFlowApprovalTimeoutAction.fromConfig(copy.get(PAYLOAD_TIMEOUT_ACTION)))
                .minApprovals(minApprovals instanceof Number number ? Math.max(1, number.intValue()) : 1)
                .escalateAt(instant(copy.get(PAYLOAD_ESCALATE_AT)))
                .escalationAssignees(strings(copy.get(PAYLOAD_ESCALATION_ASSIGNEES)))
                .build();
    }

    private static List<String> strings(Object value) {
        List<String> items = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            values.forEach(item -> items.add(String.valueOf(item)));
        }
        return items;
    }

    private static Instant instant(Object value) {
        if (value instanceof Instant moment) {
            return moment;
        }
        return value == null ? null : Instant.parse(String.valueOf(value));
    }
}
