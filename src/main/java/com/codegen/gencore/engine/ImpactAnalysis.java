package com.codegen.gencore.engine;

import com.codegen.gencore.api.Consumer;
import com.codegen.gencore.api.ImpactReport;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Answers "what must regenerate if kind X changes" and cascades the answer into
 * the build cache.
 *
 * Works only through the public operations of {@link KindGraph} and
 * {@link BuildCache}. The link between the two is the step-key convention: the
 * generator segment of a step key is the transform name carried by an edge.
 */
@Log4j2
public final class ImpactAnalysis {
    private final KindGraph graph;
    private final BuildCache cache;

    public ImpactAnalysis(KindGraph graph, BuildCache cache) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /** Downstream kinds and the transforms that produce them. */
    public ImpactReport impactOf(String kind) {
        List<String> downstream = graph.dependents(kind);
        Set<String> transforms = new LinkedHashSet<>();

        List<String> sources = new ArrayList<>(downstream.size() + 1);
        sources.add(kind);
        sources.addAll(downstream);
        for (String source : sources) {
            for (Consumer c : graph.consumers(source)) {
                if (c.transformName() != null)
                    transforms.add(c.transformName());
            }
        }
        return new ImpactReport(kind, downstream, new ArrayList<>(transforms));
    }

    /**
     * Marks stale every cache entry produced by a transform downstream of
     * {@code kind}.
     *
     * @return distinct invalidated step keys.
     */
    public List<String> invalidateDownstream(String kind) {
        ImpactReport impact = impactOf(kind);
        Set<String> invalidated = new LinkedHashSet<>();
        for (String transform : impact.transforms())
            invalidated.addAll(cache.invalidateByKind(transform));
        log.info("Change to {} invalidated {} step(s) across {} transform(s)",
                kind, invalidated.size(), impact.transforms().size());
        return new ArrayList<>(invalidated);
    }
}
