package com.procflow.core.engine.validation;

import com.procflow.core.engine.node.ProcFlowNodeExecutorRegistry;
import com.procflow.core.engine.node.executor.AiExtractionNodeExecutor;
import com.procflow.core.engine.node.executor.ApprovalNodeExecutor;
import com.procflow.core.engine.node.executor.JoinNodeExecutor;
import com.procflow.core.engine.node.executor.support.FieldRuleChecker;
import com.procflow.integration.contract.expression.IProcFlowExpressionEvaluator;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.enumerations.ProcFlowTriggerType;
import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.exception.ProcFlowValidationException;
import com.procflow.integration.models.workflow.DefinitionValidationResult;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural and semantic checks on workflow definitions, run once before a definition is
 * stored or a run is started.
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>Bean constraints declared on the model</li>
 *   <li>Exactly one START node; unique node ids without {@code .}</li>
 *   <li>Edges between existing nodes; every node reachable from START; no cycles</li>
 *   <li>Decision nodes with outgoing edges; conditions that parse</li>
 *   <li>A registered executor for every kind used</li>
 * </ul>
 *
 * <h2>Warnings</h2>
 * Forks with fewer than two targets, joins with fewer than two predecessors, no END node,
 * triggers that never fire and conditions on edges leaving non-decision nodes.
 */
@Slf4j
public class ProcFlowDefinitionValidator {

    private final ValidatorFactory validatorFactory;
    private final IProcFlowExpressionEvaluator evaluator;
    private final ProcFlowNodeExecutorRegistry registry;

    public ProcFlowDefinitionValidator(IProcFlowExpressionEvaluator evaluator, ProcFlowNodeExecutorRegistry registry) {
        this.evaluator = evaluator;
        this.registry = registry;
        this.validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    public DefinitionValidationResult validate(WorkflowDefinition definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (definition == null) {
            return DefinitionValidationResult.of(List.of("definition must not be null"), warnings);
        }

        checkConstraints(definition, errors);
        if (definition.getNodes() == null || definition.getEdges() == null) {
            if (definition.getEdges() == null) {
                errors.add("edges must not be null");
            }
            return DefinitionValidationResult.of(errors, warnings);
        }
        Map<String, NodeDefinition> nodes = checkNodes(definition, errors);
        checkEdges(definition, nodes, errors);
        if (errors.isEmpty()) {
            checkReachability(definition, nodes, errors);
            checkAcyclic(definition, nodes, errors);
        }
        checkNodeSemantics(definition, nodes, errors, warnings);
        checkTrigger(definition, warnings);

        DefinitionValidationResult result = DefinitionValidationResult.of(errors, warnings);
        log.debug("Definition validated: definitionId={}, version={}, errors={}, warnings={}",
                definition.getId(), definition.getVersion(), errors.size(), warnings.size());
        return result;
    }

    /**
     * @throws ProcFlowValidationException listing every error
     */
    public DefinitionValidationResult requireValid(WorkflowDefinition definition) {
        DefinitionValidationResult result = validate(definition);
        if (!result.isValid()) {
            throw ProcFlowValidationException.invalidDefinition(definition == null ? null : definition.getId(), result.getErrors());
        }
        return result;
    }

    /**
     * Checks trigger input against the start node's declared input fields.
     *
     * @throws ProcFlowValidationException on missing required fields or values of the wrong type
     */
    public void validateTriggerInput(WorkflowDefinition definition, Map<String, Object> triggerInput) {
        NodeDefinition start = definition.startNode()
                .orElseThrow(() -> ProcFlowValidationException.invalidDefinition(definition.getId(),
                        List.of("definition must have exactly one START node")));
        Map<String, Object> input = triggerInput == null ? Map.of() : triggerInput;
        List<String> errors = new ArrayList<>(reservedKeys(definition, input));
        errors.addAll(FieldRuleChecker.messages(FieldRuleChecker.check(start.getInputFields(), input)));
        if (!errors.isEmpty()) {
            throw ProcFlowValidationException.invalidTriggerInput(definition.getId(), errors);
        }
    }

    /**
     * Trigger keys share the variable namespace with node outputs ({@code nodeId.field}), so a
     * key may neither contain a dot nor equal a node id.
     */
    private static List<String> reservedKeys(WorkflowDefinition definition, Map<String, Object> input) {
        List<String> errors = new ArrayList<>();
        for (String key : input.keySet()) {
            if (key == null || key.isBlank()) {
                errors.add("Trigger input keys must not be blank");
            } else if (key.contains(".")) {
                errors.add("Trigger input key '" + key + "' must not contain '.'");
            } else if (definition.node(key).isPresent()) {
                errors.add("Trigger input key '" + key + "' collides with node id '" + key + "'");
            }
        }
        return errors;
    }

    // ========================================================================
    // CHECKS
    // ========================================================================

    private void checkConstraints(WorkflowDefinition definition, List<String> errors) {
        Validator validator = validatorFactory.getValidator();
        validator.validate(definition).stream()
                .sorted(Comparator.comparing((ConstraintViolation<WorkflowDefinition> violation) -> violation.getPropertyPath().toString()))
                .forEach(violation -> errors.add(violation.getPropertyPath() + ": " + violation.getMessage()));
    }

    private static Map<String, NodeDefinition> checkNodes(WorkflowDefinition definition, List<String> errors) {
        Map<String, NodeDefinition> nodes = new LinkedHashMap<>();
        if (definition.getNodes() == null) {
            return nodes;
        }
        for (NodeDefinition node : definition.getNodes()) {
            if (node == null || node.getNodeId() == null || node.getNodeId().isBlank()) {
                continue;
            }
            if (node.getNodeId().contains(".")) {
                errors.add("node id '" + node.getNodeId() + "' must not contain '.'");
            }
            if (nodes.putIfAbsent(node.getNodeId(), node) != null) {
                errors.add("duplicate node id '" + node.getNodeId() + "'");
            }
        }
        long starts = nodes.values().stream().filter(node -> node.getKind() == ProcFlowNodeKind.START).count();
        if (starts != 1) {
            errors.add("definition must have exactly one START node but has " + starts);
        }
        return nodes;
    }

    private static void checkEdges(WorkflowDefinition definition, Map<String, NodeDefinition> nodes, List<String> errors) {
        if (definition.getEdges() == null) {
            return;
        }
        for (EdgeDefinition edge : definition.getEdges()) {
            if (edge == null) {
                errors.add("edges must not contain null entries");
                continue;
            }
            if (edge.getSource() != null && !nodes.containsKey(edge.getSource())) {
                errors.add("edge source '" + edge.getSource() + "' does not exist");
            }
            if (edge.getTarget() != null && !nodes.containsKey(edge.getTarget())) {
                errors.add("edge target '" + edge.getTarget() + "' does not exist");
            }
            if (edge.getTarget() != null && nodes.get(edge.getTarget()) != null
                    && nodes.get(edge.getTarget()).getKind() == ProcFlowNodeKind.START) {
                errors.add("edge " + edge.getSource() + " -> " + edge.getTarget() + " must not target the START node");
            }
        }
    }

    private static void checkReachability(WorkflowDefinition definition, Map<String, NodeDefinition> nodes, List<String> errors) {
        String startId = definition.startNode().map(NodeDefinition::getNodeId).orElse(null);
        if (startId == null) {
            return;
        }
        Set<String> reached = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(List.of(startId));
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (reached.add(current)) {
                definition.outgoingEdges(current).forEach(edge -> pending.add(edge.getTarget()));
            }
        }
        nodes.keySet().stream()
                .filter(nodeId -> !reached.contains(nodeId))
                .forEach(nodeId -> errors.add("node '" + nodeId + "' is not reachable from the START node"));
    }

    private static void checkAcyclic(WorkflowDefinition definition, Map<String, NodeDefinition> nodes, List<String> errors) {
        Map<String, Integer> state = new HashMap<>();
        for (String nodeId : nodes.keySet()) {
            if (!state.containsKey(nodeId)) {
                String cycleAt = findCycle(definition, nodeId, state);
                if (cycleAt != null) {
                    errors.add("definition contains a cycle through node '" + cycleAt + "'");
                    return;
                }
            }
        }
    }

    /**
     * Iterative depth-first search; state 1 is on the current path, 2 is finished.
     */
    private static String findCycle(WorkflowDefinition definition, String root, Map<String, Integer> state) {
        Deque<Map.Entry<String, Integer>> stack = new ArrayDeque<>();
        stack.push(Map.entry(root, 0));
        state.put(root, 1);
        while (!stack.isEmpty()) {
            Map.Entry<String, Integer> frame = stack.pop();
            List<EdgeDefinition> edges = definition.outgoingEdges(frame.getKey());
            int index = frame.getValue();
            if (index < edges.size()) {
                stack.push(Map.entry(frame.getKey(), index + 1));
                String next = edges.get(index).getTarget();
                Integer nextState = state.get(next);
                if (Objects.equals(nextState, 1)) {
                    return next;
                }
                if (nextState == null) {
                    state.put(next, 1);
                    stack.push(Map.entry(next, 0));
                }
            } else {
                state.put(frame.getKey(), 2);
            }
        }
        return null;
    }

    private void checkNodeSemantics(WorkflowDefinition definition, Map<String, NodeDefinition> nodes,
                                    List<String> errors, List<String> warnings) {
        boolean hasEnd = false;
        Set<ProcFlowNodeKind> unregistered = new LinkedHashSet<>();
        for (NodeDefinition node : nodes.values()) {
            if (node.getKind() == null) {
                continue;
            }
            if (!registry.isRegistered(node.getKind())) {
                unregistered.add(node.getKind());
            }
            List<EdgeDefinition> outgoing = definition.outgoingEdges(node.getNodeId());
            switch (node.getKind()) {
                case END:
                    hasEnd = true;
                    break;
                case DECISION:
                    if (outgoing.isEmpty()) {
                        errors.add("decision node '" + node.getNodeId() + "' has no outgoing edges");
                    }
                    break;
                case FORK:
                    if (outgoing.stream().map(EdgeDefinition::getTarget).distinct().count() < 2) {
                        warnings.add("fork node '" + node.getNodeId() + "' has fewer than 2 targets");
                    }
                    break;
                case JOIN:
                    checkJoin(definition, node, errors, warnings);
                    break;
                case APPROVAL:
                    checkApproval(node, errors, warnings);
                    break;
                case AI_EXTRACTION:
                    if (node.getOutputFields().isEmpty() && !(node.configValue(AiExtractionNodeExecutor.CONFIG_SCHEMA) instanceof Map)) {
                        warnings.add("extraction node '" + node.getNodeId() + "' declares no output fields");
                    }
                    break;
                default:
                    break;
            }
            for (EdgeDefinition edge : outgoing) {
                if (!edge.hasCondition()) {
                    continue;
                }
                checkCondition(edge, errors);
                if (node.getKind() != ProcFlowNodeKind.DECISION) {
                    warnings.add("edge " + edge.getSource() + " -> " + edge.getTarget()
                            + " has a condition but its source is not a decision node");
                }
            }
        }
        if (!unregistered.isEmpty()) {
            errors.add("no executor registered for node kinds " + unregistered);
        }
        if (!nodes.isEmpty() && !hasEnd) {
            warnings.add("definition has no END node");
        }
    }

    private static void checkJoin(WorkflowDefinition definition, NodeDefinition node, List<String> errors, List<String> warnings) {
        long predecessors = definition.incomingEdges(node.getNodeId()).stream()
                .map(EdgeDefinition::getSource)
                .distinct()
                .count();
        if (predecessors < 2) {
            warnings.add("join node '" + node.getNodeId() + "' has fewer than 2 predecessors");
        }
        Object expected = node.configValue(JoinNodeExecutor.CONFIG_EXPECTED);
        if (expected != null && !(expected instanceof Number number && number.longValue() > 0)) {
            errors.add("join node '" + node.getNodeId() + "' has a non-positive or non-numeric 'expected'");
        } else if (expected instanceof Number number && number.longValue() > predecessors) {
            errors.add("join node '" + node.getNodeId() + "' expects " + number + " arrivals but has "
                    + predecessors + " predecessors");
        }
    }

    private static void checkApproval(NodeDefinition node, List<String> errors, List<String> warnings) {
        String nodeId = node.getNodeId();
        if (ApprovalNodeExecutor.timeoutAction(node).isEmpty()) {
            errors.add("approval node '" + nodeId + "' has an unknown timeoutAction '"
                    + node.configValue(ApprovalNodeExecutor.CONFIG_TIMEOUT_ACTION) + "'");
        }
        Object minApprovals = node.configValue(ApprovalNodeExecutor.CONFIG_MIN_APPROVALS);
        if (minApprovals != null && !(minApprovals instanceof Number number && number.intValue() > 0)) {
            errors.add("approval node '" + nodeId + "' has a non-positive or non-numeric 'minApprovals'");
        }
        for (String key : List.of(ApprovalNodeExecutor.CONFIG_TIMEOUT_HOURS, ApprovalNodeExecutor.CONFIG_DEADLINE_HOURS,
                ApprovalNodeExecutor.CONFIG_ESCALATION_AFTER_HOURS)) {
            Object hours = node.configValue(key);
            if (hours != null && !(hours instanceof Number number && number.doubleValue() > 0)) {
                errors.add("approval node '" + nodeId + "' has a non-positive or non-numeric '" + key + "'");
            }
        }
        if (ApprovalNodeExecutor.escalationEnabled(node)) {
            if (node.configValue(ApprovalNodeExecutor.CONFIG_ESCALATION_AFTER_HOURS) == null) {
                errors.add("approval node '" + nodeId + "' enables escalation without 'escalationAfterHours'");
            }
            if (node.configValue(ApprovalNodeExecutor.CONFIG_ESCALATION_ASSIGNEES) == null) {
                warnings.add("approval node '" + nodeId + "' escalates to nobody");
            }
        }
    }

    private void checkCondition(EdgeDefinition edge, List<String> errors) {
        try {
            evaluator.validateSyntax(edge.getCondition());
        } catch (ProcFlowExpressionException e) {
            errors.add("condition on edge " + edge.getSource() + " -> " + edge.getTarget() + " is invalid: " + e.getMessage());
        }
    }

    private static void checkTrigger(WorkflowDefinition definition, List<String> warnings) {
        if (definition.getTrigger() != null && definition.getTrigger().getType() != ProcFlowTriggerType.MANUAL) {
            warnings.add("trigger type " + definition.getTrigger().getType()
                    + " is accepted but never fires; start runs through the API");
        }
    }
}
