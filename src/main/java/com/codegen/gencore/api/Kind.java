package com.codegen.gencore.api;

/**
 * A named artifact category in the generation pipeline, e.g. a spec format, an
 * intermediate model or a per-language output. Identity is the name.
 *
 * @param name     unique kind name.
 * @param category category tag such as {@code source}, {@code model} or
 *                 {@code artifact}; fixed at definition.
 */
public record Kind(String name, String category) {
}
