package com.codegen.gencore.api;

/**
 * Outcome of connecting two kinds or validating that they are directly
 * connected.
 */
public sealed interface EdgeVerdict permits EdgeVerdict.Ok, EdgeVerdict.Invalid {

    Ok OK = new Ok();

    default boolean isOk() {
        return this instanceof Ok;
    }

    record Ok() implements EdgeVerdict {
    }

    /** Self-loop, cycle, undefined kind, or no direct edge. */
    record Invalid(String message) implements EdgeVerdict {
    }
}
