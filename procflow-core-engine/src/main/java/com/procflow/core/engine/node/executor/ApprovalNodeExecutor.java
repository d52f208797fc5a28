package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.RunVariables;
import com.procflow.core.util.CastUtil;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowApprovalDecision;
import com.procflow.integration.enumerations.ProcFlowApprovalTimeoutAction;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.commons.FileReference;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.ReviewDecision;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Human-in-the-loop review.
 *
 * <p>The first execution suspends the branch with a review payload built from the node config
 * and the outputs of the reviewed nodes ({@code reviewFrom}, or the direct predecessors).
 * {@link #resume} turns the reviewer's decision into the node result.</p>
 *
 * <p>The payload also carries the approval lifecycle: a {@code deadline} from
 * {@code timeoutHours} (or {@code deadlineHours}), the {@code timeoutAction} applied when it
 * passes, the {@code minApprovals} quorum and, with {@code escalationEnabled}, the
 * {@code escalateAt} instant and its {@code escalationAssignees}.</p>
 */
@Slf4j
public class ApprovalNodeExecutor extends AbstractProcFlowNodeExecutor {

    public static final String CONFIG_TITLE = "title";
    public static final String CONFIG_DESCRIPTION = "description";
    public static final String CONFIG_ASSIGNEES = "assignees";
    public static final String CONFIG_APPROVERS = "approvers";
    public static final String CONFIG_PRIORITY = "priority";
    public static final String CONFIG_DEADLINE_HOURS = "deadlineHours";
    public static final String CONFIG_TIMEOUT_HOURS = "timeoutHours";
    public static final String CONFIG_TIMEOUT_ACTION = "timeoutAction";
    public static final String CONFIG_MIN_APPROVALS = "minApprovals";
    public static final String CONFIG_ESCALATION_ENABLED = "escalationEnabled";
    public static final String CONFIG_ESCALATION_AFTER_HOURS = "escalationAfterHours";
    public static final String CONFIG_ESCALATION_ASSIGNEES = "escalationAssignees";
    public static final String CONFIG_REVIEW_FROM = "reviewFrom";
    public static final String CONFIG_FORM_FIELDS = "formFields";

    public static final String PAYLOAD_REVIEW_DATA = "reviewData";

    private static final String DEFAULT_PRIORITY = "normal";

    public ApprovalNodeExecutor() {
        super(ProcFlowNodeKind.APPROVAL);
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        NodeDefinition node = context.getNode();
        Optional<ProcFlowApprovalTimeoutAction> timeoutAction = timeoutAction(node);
        if (timeoutAction.isEmpty()) {
            return invalid("Approval node '" + node.getNodeId() + "' has an unknown timeoutAction '"
                    + node.configValue(CONFIG_TIMEOUT_ACTION) + "'");
        }

        Map<String, Object> reviewData = new LinkedHashMap<>();
        for (String reviewed : reviewedNodes(context)) {
            reviewData.put(reviewed, RunVariables.outputsOf(context.getVariables(), reviewed));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodeId", node.getNodeId());
        payload.put(CONFIG_TITLE, interpolateText(context, CONFIG_TITLE,
                node.getName() == null ? "Approval required" : node.getName()));
        payload.put(CONFIG_DESCRIPTION, interpolateText(context, CONFIG_DESCRIPTION, ""));
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        payload.put(PendingApproval.PAYLOAD_ASSIGNEES, assignees(context, CONFIG_ASSIGNEES, CONFIG_APPROVERS));
        payload.put(CONFIG_PRIORITY, node.configString(CONFIG_PRIORITY, DEFAULT_PRIORITY));
        payload.put(PendingApproval.PAYLOAD_DEADLINE, deadline(node, now).map(Instant::toString).orElse(null));
        payload.put(PendingApproval.PAYLOAD_TIMEOUT_ACTION, timeoutAction.get().name());
        payload.put(PendingApproval.PAYLOAD_MIN_APPROVALS, minApprovals(node));
        if (escalationEnabled(node)) {
            payload.put(PendingApproval.PAYLOAD_ESCALATE_AT,
                    hoursFrom(now, node.configValue(CONFIG_ESCALATION_AFTER_HOURS)).map(Instant::toString).orElse(null));
            payload.put(PendingApproval.PAYLOAD_ESCALATION_ASSIGNEES, assignees(context, CONFIG_ESCALATION_ASSIGNEES));
        }
        payload.put(PAYLOAD_REVIEW_DATA, reviewData);
        payload.put(AiExtractionNodeExecutor.OUTPUT_SOURCE_FILES, sourceFiles(reviewData));
        payload.put(AiExtractionNodeExecutor.OUTPUT_ANOMALIES, anomalies(reviewData));
        Object formFields = node.configValue(CONFIG_FORM_FIELDS);
        payload.put(CONFIG_FORM_FIELDS, formFields instanceof Collection<?> fields ? new ArrayList<>(fields) : List.of());

        log.debug("Approval requested: runId={}, nodeId={}, reviewed={}",
                context.getRunId(), context.getNodeId(), reviewData.keySet());
        return Mono.just(ExecutorResult.suspend(payload));
    }

    @Override
    public Mono<ExecutorResult> resume(ExecutionContext context, PendingApproval approval, ReviewDecision decision) {
        if (decision == null || decision.getDecision() == null) {
            return invalid("A review decision is required to resume node '" + context.getNodeId() + "'");
        }
        switch (decision.getDecision()) {
            case REJECTED:
                String reason = decision.getComment() == null || decision.getComment().isBlank()
                        ? "Rejected by reviewer"
                        : "Rejected by reviewer: " + decision.getComment();
                return Mono.just(ExecutorResult.fail(ProcFlowErrorKind.REJECTED_BY_REVIEWER, false, reason));
            case APPROVED:
            case EDITED:
            default:
                Map<String, Object> outputs = reviewedValues(approval);
                if (decision.getDecision() == ProcFlowApprovalDecision.EDITED
                        && decision.getEditedValues() != null) {
                    outputs.putAll(decision.getEditedValues());
                }
                outputs.put("decision", decision.getDecision().name());
                if (decision.getReviewerId() != null) {
                    outputs.put("reviewerId", decision.getReviewerId());
                }
                if (decision.getComment() != null) {
                    outputs.put("comment", decision.getComment());
                }
                if (approval != null && !approval.getApprovedBy().isEmpty()) {
                    outputs.put("approvedBy", new ArrayList<>(approval.getApprovedBy()));
                }
                return Mono.just(ExecutorResult.proceed(outputs));
        }
    }

    private static List<String> reviewedNodes(ExecutionContext context) {
        Object reviewFrom = context.getNode().configValue(CONFIG_REVIEW_FROM);
        if (reviewFrom instanceof Collection<?> ids) {
            return ids.stream().map(String::valueOf).toList();
        }
        if (reviewFrom instanceof String id && !id.isBlank()) {
            return List.of(id);
        }
        return context.getDefinition().incomingEdges(context.getNodeId()).stream()
                .map(EdgeDefinition::getSource)
                .distinct()
                .toList();
    }

    private static String interpolateText(ExecutionContext context, String key, String defaultValue) {
        String template = context.getNode().configString(key, defaultValue);
        return context.getEvaluator().interpolate(template, context.getVariables());
    }

    /**
     * Accepts a list of ids, a list of {@code {id}} / {@code {value}} objects or a single id,
     * read from the first of {@code keys} that is configured.
     */
    static List<String> assignees(ExecutionContext context, String... keys) {
        Object configured = null;
        for (String key : keys) {
            configured = context.getNode().configValue(key);
            if (configured != null) {
                break;
            }
        }
        Object resolved = context.interpolate(configured);
        List<String> ids = new ArrayList<>();
        if (resolved instanceof Collection<?> items) {
            items.forEach(item -> addAssignee(ids, item));
        } else {
            addAssignee(ids, resolved);
        }
        return ids;
    }

    private static void addAssignee(List<String> ids, Object item) {
        Object id = item;
        if (item instanceof Map<?, ?> map) {
            id = map.get("id") != null ? map.get("id") : map.get("value");
        }
        if (id != null && !CastUtil.castAsString(id).isBlank() && !ids.contains(CastUtil.castAsString(id))) {
            ids.add(CastUtil.castAsString(id));
        }
    }

    private static Optional<Instant> deadline(NodeDefinition node, Instant now) {
        Object hours = node.configValue(CONFIG_TIMEOUT_HOURS);
        return hoursFrom(now, hours != null ? hours : node.configValue(CONFIG_DEADLINE_HOURS));
    }

    private static Optional<Instant> hoursFrom(Instant now, Object hours) {
        if (hours instanceof Number number && number.doubleValue() > 0) {
            long seconds = Math.round(number.doubleValue() * 3600);
            return Optional.of(now.plus(Duration.ofSeconds(seconds)));
        }
        return Optional.empty();
    }

    /**
     * Empty when the configured action is not one of {@link ProcFlowApprovalTimeoutAction}.
     */
    public static Optional<ProcFlowApprovalTimeoutAction> timeoutAction(NodeDefinition node) {
        try {
            return Optional.of(ProcFlowApprovalTimeoutAction.fromConfig(node.configValue(CONFIG_TIMEOUT_ACTION)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static int minApprovals(NodeDefinition node) {
        return node.configValue(CONFIG_MIN_APPROVALS) instanceof Number number ? Math.max(1, number.intValue()) : 1;
    }

    public static boolean escalationEnabled(NodeDefinition node) {
        Object flag = node.configValue(CONFIG_ESCALATION_ENABLED);
        return flag instanceof Boolean enabled ? enabled : flag != null && Boolean.parseBoolean(String.valueOf(flag));
    }

    private static List<Object> sourceFiles(Map<String, Object> reviewData) {
        List<Object> files = new ArrayList<>();
        for (Object outputs : reviewData.values()) {
            Object listed = ((Map<?, ?>) outputs).get(AiExtractionNodeExecutor.OUTPUT_SOURCE_FILES);
            if (listed instanceof Collection<?> items) {
                items.stream().filter(item -> !files.contains(item)).forEach(files::add);
            }
            for (Object value : ((Map<?, ?>) outputs).values()) {
                FileReference.from(value).filter(file -> !files.contains(file)).ifPresent(files::add);
            }
        }
        return files;
    }

    private static List<Object> anomalies(Map<String, Object> reviewData) {
        List<Object> anomalies = new ArrayList<>();
        reviewData.forEach((nodeId, outputs) -> {
            Object listed = ((Map<?, ?>) outputs).get(AiExtractionNodeExecutor.OUTPUT_ANOMALIES);
            if (listed instanceof Collection<?> items) {
                anomalies.addAll(items);
            }
        });
        return anomalies;
    }

    /**
     * Flattens the reviewed node outputs into one map; later nodes win on clashing names.
     */
    static Map<String, Object> reviewedValues(PendingApproval approval) {
        Map<String, Object> values = new LinkedHashMap<>();
        Object reviewData = approval == null ? null : approval.getReviewPayload().get(PAYLOAD_REVIEW_DATA);
        if (reviewData instanceof Map<?, ?> byNode) {
            for (Object outputs : byNode.values()) {
                if (outputs instanceof Map<?, ?> fields) {
                    fields.forEach((field, value) -> {
                        String name = String.valueOf(field);
                        if (!AiExtractionNodeExecutor.OUTPUT_ANOMALIES.equals(name)
                                && !AiExtractionNodeExecutor.OUTPUT_SOURCE_FILES.equals(name)) {
                            values.put(name, value);
                        }
                    });
                }
            }
        }
        return values;
    }
}
