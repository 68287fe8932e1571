package com.codegen.gencore.api;

/** One step of a route: the kind reached and the edge used to reach it. */
public record Hop(String kind, String relation, String transform) {
}
