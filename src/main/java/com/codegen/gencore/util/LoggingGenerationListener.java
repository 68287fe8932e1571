package com.codegen.gencore.util;

import com.codegen.gencore.api.GenerationListener;
import com.codegen.gencore.api.RunSummary;
import com.codegen.gencore.api.StepRecord;
import com.codegen.gencore.api.StepStatus;

import lombok.extern.log4j.Log4j2;

/**
 * Writes the run lifecycle to the log. Failed steps are logged at warn, every
 * other step at debug.
 */
@Log4j2
public final class LoggingGenerationListener implements GenerationListener {

    @Override
    public void onRunBegin(String runId) {
        log.info("[{}] begin", runId);
    }

    @Override
    public void onRunSuperseded(String runId) {
        log.warn("[{}] superseded before completion", runId);
    }

    @Override
    public void onStepRecorded(StepRecord record) {
        if (record.status() == StepStatus.FAILED)
            log.warn("[{}] {} failed after {}ms", record.runId(), record.stepKey(), record.duration());
        else
            log.debug("[{}] {} {} ({} file(s), {}ms)", record.runId(), record.stepKey(),
                    record.status().wireName(), record.filesProduced(), record.duration());
    }

    @Override
    public void onRunComplete(String runId, RunSummary summary) {
        log.info("[{}] complete: {} step(s), {} executed, {} cached, {} failed, {} file(s)", runId,
                summary.total(), summary.executed(), summary.cached(), summary.failed(), summary.filesProduced());
    }
}
