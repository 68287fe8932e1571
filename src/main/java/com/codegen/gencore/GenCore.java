package com.codegen.gencore;

import com.codegen.gencore.api.GenerationListener;
import com.codegen.gencore.engine.BuildCache;
import com.codegen.gencore.engine.GenerationPlan;
import com.codegen.gencore.engine.ImpactAnalysis;
import com.codegen.gencore.engine.KindGraph;
import com.codegen.gencore.io.CoreConfig;
import com.codegen.gencore.io.TaxonomyLoader;
import com.codegen.gencore.store.InMemoryRelationStore;
import com.codegen.gencore.store.JsonFileRelationStore;
import com.codegen.gencore.store.RelationStore;
import com.codegen.gencore.util.CompositeGenerationListener;
import com.codegen.gencore.util.KindGraphExplain;
import com.codegen.gencore.util.LoggingGenerationListener;
import com.codegen.gencore.util.RunStatsListener;
import com.codegen.gencore.web.DiagnosticsPayloads;
import com.codegen.gencore.web.DiagnosticsServer;
import com.codegen.gencore.wiring.StepReporter;

import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assembles the generation core from a {@link CoreConfig}.
 * <p>
 * This class handles:
 * <ul>
 * <li>Opening the configured relation store (in memory or JSON files)</li>
 * <li>Building the kind graph, build cache and generation plan on that
 * store</li>
 * <li>Applying the configured taxonomy</li>
 * <li>Registering the logging and run statistics listeners</li>
 * <li>Lazily starting the async step reporter and the diagnostics server</li>
 * </ul>
 */
public class GenCore implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GenCore.class);

    private final CoreConfig config;
    private final RelationStore store;
    private final KindGraph graph;
    private final BuildCache cache;
    private final GenerationPlan plan;
    private final ImpactAnalysis impact;
    private final CompositeGenerationListener listeners = new CompositeGenerationListener();
    private final RunStatsListener runStats = new RunStatsListener();

    private StepReporter reporter;
    private DiagnosticsServer diagnostics;

    public GenCore() {
        this(CoreConfig.load());
    }

    public GenCore(CoreConfig config) {
        this(config, openStore(config));
    }

    public GenCore(CoreConfig config, RelationStore store) {
        config.validate();
        this.config = config;
        this.store = store;
        this.graph = new KindGraph(store);
        this.cache = new BuildCache(store);
        this.plan = new GenerationPlan(store);
        plan.setHistoryLimit(config.getHistoryLimit());
        this.impact = new ImpactAnalysis(graph, cache);

        listeners.add(new LoggingGenerationListener());
        listeners.add(runStats);
        plan.setListener(listeners);

        if (config.getTaxonomy() != null && !config.getTaxonomy().isBlank()) {
            TaxonomyLoader loader = new TaxonomyLoader();
            loader.apply(loader.read(config.getTaxonomy()), graph);
        }

        if (config.getDiagnosticsPort() > 0)
            startDiagnostics(config.getDiagnosticsPort());

        log.info("Generation core ready: storage={}, {} kind(s)", config.getStorage(),
                graph.graph().kinds().size());
    }

    private static RelationStore openStore(CoreConfig config) {
        if (CoreConfig.STORAGE_FILE.equals(config.getStorage()))
            return new JsonFileRelationStore(Path.of(config.getStorageDir()));
        return new InMemoryRelationStore();
    }

    /** Adds a listener to the run lifecycle; existing listeners stay registered. */
    public void addListener(GenerationListener listener) {
        listeners.add(listener);
    }

    /** The async step reporter, started on first use. */
    public synchronized StepReporter reporter() {
        if (reporter == null)
            reporter = new StepReporter(plan, config.getRingBufferSize());
        return reporter;
    }

    /**
     * Starts the diagnostics server.
     *
     * @param port port to bind, 0 for an ephemeral one.
     * @return the server, already listening.
     */
    public synchronized DiagnosticsServer startDiagnostics(int port) {
        if (diagnostics == null) {
            diagnostics = new DiagnosticsServer(new DiagnosticsPayloads(graph, cache, plan));
            diagnostics.start(port);
        }
        return diagnostics;
    }

    public KindGraphExplain explain() {
        return new KindGraphExplain(graph);
    }

    public CoreConfig config() {
        return config;
    }

    public RelationStore store() {
        return store;
    }

    public KindGraph graph() {
        return graph;
    }

    public BuildCache cache() {
        return cache;
    }

    public GenerationPlan plan() {
        return plan;
    }

    public ImpactAnalysis impact() {
        return impact;
    }

    public RunStatsListener runStats() {
        return runStats;
    }

    @Override
    public synchronized void close() {
        if (reporter != null) {
            reporter.close();
            reporter = null;
        }
        if (diagnostics != null) {
            diagnostics.stop();
            diagnostics = null;
        }
    }
}
