package com.pipewright.core.lifecycle;

import com.pipewright.core.model.TaskPhase;

/**
 * Receives phase transitions of a task lifecycle. Called on the task's thread.
 */
@FunctionalInterface
public interface PhaseListener {

    PhaseListener NONE = (task, phase) -> {};

    void onPhase(String task, TaskPhase phase);
}
