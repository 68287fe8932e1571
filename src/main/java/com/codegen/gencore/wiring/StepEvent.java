package com.codegen.gencore.wiring;

import com.codegen.gencore.api.StepStatus;

/**
 * A mutable carrier for one step outcome inside the Disruptor ring buffer.
 *
 * Instances are pre-allocated when the ring buffer is built and reused for the
 * lifetime of the reporter; producers overwrite every field through
 * {@link #set} before publishing.
 */
public final class StepEvent {
    private String stepKey;
    private StepStatus status;
    private Integer filesProduced;
    private Long duration;
    private boolean cached;

    public void set(String stepKey, StepStatus status, Integer filesProduced, Long duration, boolean cached) {
        this.stepKey = stepKey;
        this.status = status;
        this.filesProduced = filesProduced;
        this.duration = duration;
        this.cached = cached;
    }

    public String stepKey() {
        return stepKey;
    }

    public StepStatus status() {
        return status;
    }

    public Integer filesProduced() {
        return filesProduced;
    }

    public Long duration() {
        return duration;
    }

    public boolean cached() {
        return cached;
    }

    public void clear() {
        stepKey = null;
        status = null;
        filesProduced = null;
        duration = null;
        cached = false;
    }
}
