package com.codegen.gencore.api;

/** An outgoing edge of a kind, seen from the consumed kind. */
public record Consumer(String toKind, String transformName) {
}
