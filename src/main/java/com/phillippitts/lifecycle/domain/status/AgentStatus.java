package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

/**
 * Statuses of an agent inside its think/act/observe loop.
 */
public enum AgentStatus implements StatusType {
    IDLE,
    INITIAL,
    THINKING,
    THINKING_END,
    THINKING_ERROR,
    THOUGHT,
    EXECUTING_ACTION,
    USING_TOOL,
    USING_TOOL_END,
    USING_TOOL_ERROR,
    TOOL_DOES_NOT_EXIST,
    OBSERVATION,
    FINAL_ANSWER,
    TASK_COMPLETED,
    MAX_ITERATIONS_ERROR,
    ISSUES_PARSING_LLM_OUTPUT,
    SELF_QUESTION,
    ITERATING,
    ITERATION_START,
    ITERATION_END,
    ITERATION_COMPLETE,
    MAX_ITERATIONS_EXCEEDED,
    AGENTIC_LOOP_ERROR,
    WEIRD_LLM_OUTPUT;

    @Override
    public EntityKind entityKind() {
        return EntityKind.AGENT;
    }
}
