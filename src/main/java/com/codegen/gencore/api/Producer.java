package com.codegen.gencore.api;

/** An incoming edge of a kind, seen from the produced kind. */
public record Producer(String fromKind, String transformName) {
}
