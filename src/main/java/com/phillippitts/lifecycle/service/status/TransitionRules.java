package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.status.AgentStatus;
import com.phillippitts.lifecycle.domain.status.FeedbackStatus;
import com.phillippitts.lifecycle.domain.status.MessageStatus;
import com.phillippitts.lifecycle.domain.status.ModelSessionStatus;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.domain.status.TaskStatus;
import com.phillippitts.lifecycle.domain.status.WorkflowStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.phillippitts.lifecycle.domain.EntityKind.AGENT;
import static com.phillippitts.lifecycle.domain.EntityKind.FEEDBACK;
import static com.phillippitts.lifecycle.domain.EntityKind.MESSAGE;
import static com.phillippitts.lifecycle.domain.EntityKind.MODEL_SESSION;
import static com.phillippitts.lifecycle.domain.EntityKind.TASK;
import static com.phillippitts.lifecycle.domain.EntityKind.WORKFLOW;

/**
 * Immutable table of allowed transitions per entity kind.
 *
 * <p>Besides the explicit rules, every kind may move from any non-error status into its
 * error status ({@link EntityKind#errorStatus()}).
 *
 * <p>Extra rules are added with {@link #with(TransitionRule)} or parsed from configuration
 * strings of the form {@code FROM->TO}.
 */
public final class TransitionRules {

    static final String ARROW = "->";

    private final Map<EntityKind, List<TransitionRule>> rules;

    private TransitionRules(Map<EntityKind, List<TransitionRule>> rules) {
        EnumMap<EntityKind, List<TransitionRule>> copy = new EnumMap<>(EntityKind.class);
        rules.forEach((kind, list) -> copy.put(kind, List.copyOf(list)));
        this.rules = copy;
    }

    public static TransitionRules empty() {
        return new TransitionRules(Map.of());
    }

    /**
     * Built-in rule tables for every entity kind.
     */
    public static TransitionRules defaults() {
        return empty()
                // Agent loop
                .with(TransitionRule.of(AGENT, AgentStatus.INITIAL, AgentStatus.THINKING, AgentStatus.ITERATION_START))
                .with(TransitionRule.of(AGENT, AgentStatus.THINKING,
                        AgentStatus.THINKING_END, AgentStatus.THINKING_ERROR, AgentStatus.WEIRD_LLM_OUTPUT))
                .with(TransitionRule.of(AGENT, AgentStatus.THINKING_END, AgentStatus.THOUGHT,
                        AgentStatus.SELF_QUESTION, AgentStatus.FINAL_ANSWER, AgentStatus.EXECUTING_ACTION))
                .with(TransitionRule.of(AGENT, AgentStatus.THINKING_ERROR,
                        AgentStatus.ITERATION_END, AgentStatus.AGENTIC_LOOP_ERROR))
                .with(TransitionRule.of(AGENT, AgentStatus.EXECUTING_ACTION,
                        AgentStatus.USING_TOOL, AgentStatus.FINAL_ANSWER))
                .with(TransitionRule.of(AGENT, AgentStatus.USING_TOOL, AgentStatus.USING_TOOL_END,
                        AgentStatus.USING_TOOL_ERROR, AgentStatus.TOOL_DOES_NOT_EXIST))
                .with(TransitionRule.of(AGENT, AgentStatus.USING_TOOL_END,
                        AgentStatus.OBSERVATION, AgentStatus.ITERATION_END))
                .with(TransitionRule.of(AGENT, AgentStatus.THOUGHT, AgentStatus.EXECUTING_ACTION,
                        AgentStatus.SELF_QUESTION, AgentStatus.FINAL_ANSWER))
                .with(TransitionRule.of(AGENT, AgentStatus.SELF_QUESTION,
                        AgentStatus.THINKING, AgentStatus.OBSERVATION))
                .with(TransitionRule.of(AGENT, AgentStatus.OBSERVATION,
                        AgentStatus.THINKING, AgentStatus.FINAL_ANSWER))
                .with(TransitionRule.of(AGENT, AgentStatus.ITERATION_START,
                        AgentStatus.THINKING, AgentStatus.MAX_ITERATIONS_ERROR))
                .with(TransitionRule.of(AGENT, AgentStatus.ITERATION_END,
                        AgentStatus.ITERATION_START, AgentStatus.FINAL_ANSWER))
                .with(new TransitionRule(AGENT,
                        Set.of(AgentStatus.USING_TOOL_ERROR, AgentStatus.TOOL_DOES_NOT_EXIST,
                                AgentStatus.ISSUES_PARSING_LLM_OUTPUT, AgentStatus.WEIRD_LLM_OUTPUT,
                                AgentStatus.MAX_ITERATIONS_ERROR),
                        Set.of(AgentStatus.ITERATION_END, AgentStatus.AGENTIC_LOOP_ERROR), null))
                // Task
                .with(TransitionRule.of(TASK, TaskStatus.PENDING, TaskStatus.TODO))
                .with(TransitionRule.of(TASK, TaskStatus.TODO, TaskStatus.DOING, TaskStatus.BLOCKED))
                .with(TransitionRule.of(TASK, TaskStatus.DOING, TaskStatus.DONE, TaskStatus.ERROR,
                        TaskStatus.BLOCKED, TaskStatus.AWAITING_VALIDATION))
                .with(TransitionRule.of(TASK, TaskStatus.AWAITING_VALIDATION,
                        TaskStatus.VALIDATED, TaskStatus.REVISE))
                .with(TransitionRule.of(TASK, TaskStatus.VALIDATED, TaskStatus.DONE))
                .with(TransitionRule.of(TASK, TaskStatus.ERROR, TaskStatus.REVISE, TaskStatus.BLOCKED))
                .with(TransitionRule.of(TASK, TaskStatus.REVISE, TaskStatus.DOING))
                .with(TransitionRule.of(TASK, TaskStatus.BLOCKED, TaskStatus.TODO, TaskStatus.ERROR))
                // Workflow
                .with(TransitionRule.of(WORKFLOW, WorkflowStatus.INITIAL, WorkflowStatus.RUNNING))
                .with(TransitionRule.of(WORKFLOW, WorkflowStatus.RUNNING, WorkflowStatus.FINISHED,
                        WorkflowStatus.ERRORED, WorkflowStatus.BLOCKED, WorkflowStatus.STOPPING))
                .with(TransitionRule.of(WORKFLOW, WorkflowStatus.STOPPING, WorkflowStatus.STOPPED))
                .with(TransitionRule.of(WORKFLOW, WorkflowStatus.BLOCKED,
                        WorkflowStatus.RUNNING, WorkflowStatus.ERRORED))
                .with(TransitionRule.of(WORKFLOW, WorkflowStatus.STOPPED, WorkflowStatus.INITIAL))
                // Message
                .with(TransitionRule.of(MESSAGE, MessageStatus.INITIAL, MessageStatus.QUEUED))
                .with(TransitionRule.of(MESSAGE, MessageStatus.QUEUED,
                        MessageStatus.PROCESSING, MessageStatus.ERROR))
                .with(TransitionRule.of(MESSAGE, MessageStatus.PROCESSING,
                        MessageStatus.PROCESSED, MessageStatus.ERROR))
                .with(TransitionRule.of(MESSAGE, MessageStatus.PROCESSED,
                        MessageStatus.RETRIEVING, MessageStatus.CLEARING))
                .with(TransitionRule.of(MESSAGE, MessageStatus.RETRIEVING,
                        MessageStatus.RETRIEVED, MessageStatus.ERROR))
                .with(TransitionRule.of(MESSAGE, MessageStatus.CLEARING,
                        MessageStatus.CLEARED, MessageStatus.ERROR))
                // Feedback
                .with(TransitionRule.of(FEEDBACK, FeedbackStatus.PENDING, FeedbackStatus.PROCESSED))
                // Model session
                .with(TransitionRule.of(MODEL_SESSION, ModelSessionStatus.INITIALIZING, ModelSessionStatus.READY))
                .with(TransitionRule.of(MODEL_SESSION, ModelSessionStatus.READY,
                        ModelSessionStatus.ACTIVE, ModelSessionStatus.TERMINATED))
                .with(TransitionRule.of(MODEL_SESSION, ModelSessionStatus.ACTIVE, ModelSessionStatus.CLEANING_UP))
                .with(TransitionRule.of(MODEL_SESSION, ModelSessionStatus.CLEANING_UP, ModelSessionStatus.CLEANED_UP))
                .with(TransitionRule.of(MODEL_SESSION, ModelSessionStatus.CLEANED_UP, ModelSessionStatus.TERMINATED))
                .with(TransitionRule.of(MODEL_SESSION, ModelSessionStatus.ERROR,
                        ModelSessionStatus.CLEANING_UP, ModelSessionStatus.TERMINATED));
    }

    public TransitionRules with(TransitionRule rule) {
        Map<EntityKind, List<TransitionRule>> next = new EnumMap<>(EntityKind.class);
        next.putAll(rules);
        List<TransitionRule> list = new ArrayList<>(next.getOrDefault(rule.entityKind(), List.of()));
        list.add(rule);
        next.put(rule.entityKind(), list);
        return new TransitionRules(next);
    }

    /**
     * Adds rules parsed from configuration. Keys are entity kind keys, values are lists of
     * {@code FROM->TO} strings.
     *
     * @throws IllegalArgumentException on an unknown kind, unknown status or malformed rule
     */
    public TransitionRules withConfigured(Map<String, ? extends Collection<String>> configured) {
        TransitionRules result = this;
        if (configured == null) {
            return result;
        }
        for (Map.Entry<String, ? extends Collection<String>> entry : configured.entrySet()) {
            EntityKind kind = EntityKind.fromKey(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown entity kind: " + entry.getKey()));
            for (String ruleText : entry.getValue()) {
                result = result.with(parse(kind, ruleText));
            }
        }
        return result;
    }

    /**
     * Parses {@code FROM->TO} into a rule for the given kind.
     *
     * @throws IllegalArgumentException if the string is malformed or names unknown statuses
     */
    public static TransitionRule parse(EntityKind kind, String ruleText) {
        if (ruleText == null || !ruleText.contains(ARROW)) {
            throw new IllegalArgumentException("Transition rule must look like FROM->TO: " + ruleText);
        }
        String[] parts = ruleText.split(ARROW, -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Transition rule must look like FROM->TO: " + ruleText);
        }
        StatusType from = kind.statusOf(parts[0]).orElseThrow(() -> new IllegalArgumentException(
                "Unknown " + kind.key() + " status '" + parts[0].trim() + "' in rule " + ruleText));
        StatusType to = kind.statusOf(parts[1]).orElseThrow(() -> new IllegalArgumentException(
                "Unknown " + kind.key() + " status '" + parts[1].trim() + "' in rule " + ruleText));
        return TransitionRule.of(kind, from, to);
    }

    public List<TransitionRule> rulesFor(EntityKind kind) {
        return rules.getOrDefault(kind, List.of());
    }

    /**
     * Returns true if the context's current-to-target pair is permitted and every guard on a
     * covering rule accepts it. Entering the kind's error status from any other status is
     * always permitted.
     */
    public boolean permits(TransitionContext context) {
        EntityKind kind = context.entityKind();
        StatusType from = context.currentStatus();
        StatusType to = context.targetStatus();
        if (isErrorEntry(kind, from, to)) {
            return true;
        }
        for (TransitionRule rule : rulesFor(kind)) {
            if (rule.covers(from, to) && rule.guard().test(context)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Statuses reachable from {@code from} in one step, ignoring guards.
     */
    public Set<StatusType> availableTransitions(EntityKind kind, StatusType from) {
        Set<StatusType> targets = new LinkedHashSet<>();
        for (TransitionRule rule : rulesFor(kind)) {
            if (rule.from().contains(from)) {
                targets.addAll(rule.to());
            }
        }
        if (from != kind.errorStatus()) {
            targets.add(kind.errorStatus());
        }
        return targets;
    }

    private static boolean isErrorEntry(EntityKind kind, StatusType from, StatusType to) {
        return to == kind.errorStatus() && from != to;
    }
}
