package com.pipewright.prompt;

import com.pipewright.core.model.TaskDefinition;

/**
 * Produces the single message sent to a task's worker.
 */
public interface PayloadRenderer {

    String render(TaskDefinition task, RunContext context) throws PayloadRenderException;
}
