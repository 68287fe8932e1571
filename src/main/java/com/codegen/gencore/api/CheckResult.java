package com.codegen.gencore.api;

import java.time.Instant;

/**
 * Build cache decision for a proposed step input. Both variants are normal
 * outcomes.
 */
public sealed interface CheckResult permits CheckResult.Changed, CheckResult.Unchanged {

    /**
     * The step must run.
     *
     * @param previousHash the stored input hash, or null if the step was never
     *                     recorded.
     */
    record Changed(String previousHash) implements CheckResult {
    }

    /** Prior output can be reused. */
    record Unchanged(Instant lastRun, String outputRef) implements CheckResult {
    }
}
