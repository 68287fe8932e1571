package com.codegen.gencore.api;

/**
 * Observability hook for the generation run lifecycle.
 *
 * Implementations are registered with the GenerationPlan and are called
 * synchronously, on the thread that mutated the plan, after the change has been
 * written to the store. They must be lightweight and must not call back into
 * the plan.
 *
 * A listener that throws does not undo the recorded change; the plan logs the
 * failure and carries on.
 */
public interface GenerationListener {

    /**
     * Called after a new run became the active run.
     *
     * @param runId the id returned by begin().
     */
    void onRunBegin(String runId);

    /**
     * Called when an active run was closed because another run began.
     *
     * @param runId the run that was still active.
     */
    void onRunSuperseded(String runId);

    /**
     * Called after a step outcome was attached to the active run.
     *
     * @param record the stored record.
     */
    void onStepRecorded(StepRecord record);

    /**
     * Called after the active run was completed.
     *
     * @param runId   the completed run.
     * @param summary its final aggregate.
     */
    void onRunComplete(String runId, RunSummary summary);
}
