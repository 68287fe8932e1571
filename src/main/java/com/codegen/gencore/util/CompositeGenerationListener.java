package com.codegen.gencore.util;

import com.codegen.gencore.api.GenerationListener;
import com.codegen.gencore.api.RunSummary;
import com.codegen.gencore.api.StepRecord;

import java.util.Arrays;

/**
 * Fans one {@link GenerationListener} slot out to several listeners, in
 * registration order.
 */
public class CompositeGenerationListener implements GenerationListener {
    private volatile GenerationListener[] listeners = new GenerationListener[0];

    public synchronized void add(GenerationListener listener) {
        GenerationListener[] old = listeners;
        GenerationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunBegin(String runId) {
        for (GenerationListener l : listeners)
            l.onRunBegin(runId);
    }

    @Override
    public void onRunSuperseded(String runId) {
        for (GenerationListener l : listeners)
            l.onRunSuperseded(runId);
    }

    @Override
    public void onStepRecorded(StepRecord record) {
        for (GenerationListener l : listeners)
            l.onStepRecorded(record);
    }

    @Override
    public void onRunComplete(String runId, RunSummary summary) {
        for (GenerationListener l : listeners)
            l.onRunComplete(runId, summary);
    }
}
