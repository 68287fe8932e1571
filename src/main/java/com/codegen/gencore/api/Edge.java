package com.codegen.gencore.api;

/**
 * A directed transform: an artifact of kind {@code from} is converted into kind
 * {@code to} by the transform named {@code transform} (may be null).
 */
public record Edge(String from, String to, String relation, String transform) {
}
