package com.procflow.core.engine.rest.dto;

import com.procflow.integration.enumerations.ProcFlowApprovalDecision;
import com.procflow.integration.models.run.ReviewDecision;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Reviewer decision for a suspended approval node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeRunRequest {

    @NotNull(message = "decision is required")
    private ProcFlowApprovalDecision decision;

    /**
     * Replacement values; only read for {@code EDITED}.
     */
    private Map<String, Object> editedValues;

    private String reviewerId;

    private String comment;

    public ReviewDecision toReviewDecision() {
        return ReviewDecision.builder()
                .decision(decision)
                .editedValues(editedValues)
                .reviewerId(reviewerId)
                .comment(comment)
                .build();
    }
}
