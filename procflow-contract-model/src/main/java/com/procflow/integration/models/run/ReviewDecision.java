package com.procflow.integration.models.run;

import com.procflow.integration.enumerations.ProcFlowApprovalDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;

/**
 * A reviewer's answer to a pending approval.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDecision implements Serializable {

    private static final long serialVersionUID = 1L;

    private ProcFlowApprovalDecision decision;

    /**
     * Replacement values; only read when the decision is {@code EDITED}.
     */
    private Map<String, Object> editedValues;

    private String reviewerId;

    private String comment;

    public static ReviewDecision approved() {
        return ReviewDecision.builder().decision(ProcFlowApprovalDecision.APPROVED).build();
    }

    public static ReviewDecision rejected(String comment) {
        return ReviewDecision.builder().decision(ProcFlowApprovalDecision.REJECTED).comment(comment).build();
    }

    public static ReviewDecision edited(Map<String, Object> editedValues) {
        return ReviewDecision.builder().decision(ProcFlowApprovalDecision.EDITED).editedValues(editedValues).build();
    }
}
