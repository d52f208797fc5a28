package com.procflow.integration.models.workflow;

import com.procflow.integration.enumerations.ProcFlowTriggerType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TriggerConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotNull(message = "trigger type must not be null")
    @Builder.Default
    private ProcFlowTriggerType type = ProcFlowTriggerType.MANUAL;

    /**
     * Cron expression; stored but never scheduled.
     */
    private String schedule;

    /**
     * Webhook path; stored but never bound.
     */
    private String webhookPath;

    public static TriggerConfig manual() {
        return TriggerConfig.builder().type(ProcFlowTriggerType.MANUAL).build();
    }
}
