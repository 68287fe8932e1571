package com.codegen.gencore.api;

import java.util.List;

/** Outcome of a shortest-route query between two kinds. */
public sealed interface RouteResult permits RouteResult.Ok, RouteResult.Unreachable {

    /** Hops in travel order, excluding the starting kind. */
    record Ok(List<Hop> path) implements RouteResult {
        public Ok {
            path = List.copyOf(path);
        }
    }

    record Unreachable(String message) implements RouteResult {
    }
}
