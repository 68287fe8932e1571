package com.codegen.gencore.io;

import com.codegen.gencore.api.DefineResult;
import com.codegen.gencore.api.EdgeVerdict;
import com.codegen.gencore.engine.KindGraph;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads {@link TaxonomyDefinition}s and applies them to a {@link KindGraph}.
 *
 * <p>
 * All kinds are defined before any edge is connected, so edges may be listed in
 * any order relative to the kinds they reference. Edges are connected in file
 * order, which is also the order routes break ties in. A taxonomy that the
 * graph rejects (cycle, self-loop, unknown kind) fails the whole load with an
 * {@link IllegalStateException}; kinds and edges applied before the failing
 * edge stay in the graph.
 */
public final class TaxonomyLoader {
    private static final Logger log = LogManager.getLogger(TaxonomyLoader.class);

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper mapper;

    public TaxonomyLoader() {
        this(new ObjectMapper());
    }

    public TaxonomyLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Counts of what an {@link #apply} call changed. */
    public record LoadReport(int kindsDefined, int kindsExisting, int edgesConnected) {
    }

    public TaxonomyDefinition parse(String json) {
        try {
            return mapper.readValue(json, TaxonomyDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed taxonomy JSON: " + e.getOriginalMessage(), e);
        }
    }

    public TaxonomyDefinition parseFile(Path path) {
        try {
            return mapper.readValue(Files.readAllBytes(path), TaxonomyDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load taxonomy from " + path, e);
        }
    }

    public TaxonomyDefinition parseResource(String resource) {
        try (InputStream in = TaxonomyLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Taxonomy resource not found: " + resource);
            return mapper.readValue(in, TaxonomyDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load taxonomy resource " + resource, e);
        }
    }

    /** Reads {@code classpath:<resource>} or a file path. */
    public TaxonomyDefinition read(String location) {
        if (location.startsWith(CLASSPATH_PREFIX))
            return parseResource(location.substring(CLASSPATH_PREFIX.length()));
        return parseFile(Path.of(location));
    }

    public LoadReport apply(TaxonomyDefinition def, KindGraph graph) {
        int defined = 0, existing = 0, connected = 0;

        if (def.getKinds() != null) {
            for (TaxonomyDefinition.KindDef kd : def.getKinds()) {
                if (kd.getName() == null || kd.getCategory() == null)
                    throw new IllegalArgumentException("Kind needs 'name' and 'category': " + kd);
                if (graph.define(kd.getName(), kd.getCategory()) instanceof DefineResult.Ok)
                    defined++;
                else
                    existing++;
            }
        }

        if (def.getEdges() != null) {
            for (TaxonomyDefinition.EdgeDef ed : def.getEdges()) {
                if (ed.getFrom() == null || ed.getTo() == null || ed.getRelation() == null)
                    throw new IllegalArgumentException("Edge needs 'from', 'to' and 'relation': " + ed);
                EdgeVerdict verdict = graph.connect(ed.getFrom(), ed.getTo(), ed.getRelation(), ed.getTransform());
                if (verdict instanceof EdgeVerdict.Invalid invalid)
                    throw new IllegalStateException("Taxonomy '" + def.getName() + "' rejected edge "
                            + ed.getFrom() + " -> " + ed.getTo() + ": " + invalid.message());
                connected++;
            }
        }

        log.info("Applied taxonomy '{}': {} kind(s) defined, {} already present, {} edge(s)",
                def.getName(), defined, existing, connected);
        return new LoadReport(defined, existing, connected);
    }
}
