package com.codegen.gencore.api;

/** Outcome of defining a kind. */
public sealed interface DefineResult permits DefineResult.Ok, DefineResult.Exists {

    /** The kind was registered by this call. */
    record Ok(Kind kind) implements DefineResult {
    }

    /** A kind with this name already existed; nothing changed. */
    record Exists(String kind) implements DefineResult {
    }
}
