package com.codegen.gencore.wiring;

import com.codegen.gencore.engine.GenerationPlan;
import com.codegen.gencore.util.ErrorRateLimiter;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor consumer that writes step outcomes into the {@link GenerationPlan}.
 *
 * Runs on the reporter's single consumer thread, which makes it the only writer
 * of the step ledger while the reporter is in use. A failing write is logged
 * and the event dropped; the consumer thread must stay alive for the events
 * behind it.
 */
public final class StepEventHandler implements EventHandler<StepEvent> {
    private static final Logger log = LogManager.getLogger(StepEventHandler.class);

    private final GenerationPlan plan;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    private volatile long processedSequence = -1;
    private volatile long failures;

    public StepEventHandler(GenerationPlan plan) {
        this.plan = plan;
    }

    @Override
    public void onEvent(StepEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.stepKey() == null || event.status() == null) {
                log.error("Dropping malformed step event at sequence {}", sequence);
                failures++;
                return;
            }
            plan.recordStep(event.stepKey(), event.status(), event.filesProduced(), event.duration(),
                    event.cached());
        } catch (RuntimeException e) {
            failures++;
            errLimiter.log("Failed to record step " + event.stepKey() + ": " + e.getMessage(), e);
        } finally {
            event.clear();
            processedSequence = sequence;
        }
    }

    /** Highest ring-buffer sequence fully handled, -1 before the first event. */
    public long processedSequence() {
        return processedSequence;
    }

    public long failures() {
        return failures;
    }
}
