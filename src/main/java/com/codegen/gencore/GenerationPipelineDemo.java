package com.codegen.gencore;

import com.codegen.gencore.api.CheckResult;
import com.codegen.gencore.api.Consumer;
import com.codegen.gencore.api.RunHistoryEntry;
import com.codegen.gencore.api.StepStatus;
import com.codegen.gencore.io.CoreConfig;
import com.codegen.gencore.io.StandardTaxonomy;
import com.codegen.gencore.store.InMemoryRelationStore;
import com.codegen.gencore.wiring.StepReporter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/**
 * Simulates two generation passes over the standard taxonomy.
 *
 * The first pass builds every target of every concept. Then one concept spec
 * is edited and the second pass regenerates only that concept's steps; the
 * rest come from the build cache. Generators run on a small thread pool and
 * report through the async {@link StepReporter}.
 */
@Log4j2
public class GenerationPipelineDemo {
    private static final String NAMESPACE = "concept";

    public static void main(String[] args) throws Exception {
        log.info("Starting generation pipeline demo...");

        CoreConfig config = CoreConfig.load();
        try (GenCore core = new GenCore(config, new InMemoryRelationStore())) {
            if (!core.graph().contains(StandardTaxonomy.CONCEPT_MANIFEST))
                StandardTaxonomy.bootstrap(core.graph());

            Map<String, String> specs = new LinkedHashMap<>();
            specs.put("user", "concept User { state name: String }");
            specs.put("article", "concept Article { state title: String }");
            specs.put("comment", "concept Comment { state body: String }");

            List<Consumer> generators = core.graph().consumers(StandardTaxonomy.CONCEPT_MANIFEST);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                runPass(core, pool, generators, specs);

                specs.put("article", "concept Article { state title: String  state body: String }");
                core.cache().invalidateBySource(sourceOf("article"));
                runPass(core, pool, generators, specs);
            } finally {
                pool.shutdown();
                pool.awaitTermination(5, TimeUnit.SECONDS);
            }

            for (RunHistoryEntry e : core.plan().history()) {
                log.info("{} {} total={} executed={} cached={} failed={}", e.run(), e.status().wireName(),
                        e.total(), e.executed(), e.cached(), e.failed());
            }
            System.out.println(core.runStats().dump());
        }
    }

    private static void runPass(GenCore core, ExecutorService pool, List<Consumer> generators,
            Map<String, String> specs) throws InterruptedException {
        String run = core.plan().begin();
        StepReporter reporter = core.reporter();

        List<Callable<Object>> tasks = new ArrayList<>();
        for (Map.Entry<String, String> spec : specs.entrySet()) {
            String inputHash = sha256(spec.getValue());
            for (Consumer generator : generators) {
                if (generator.transformName() == null)
                    continue;
                String stepKey = NAMESPACE + ":" + generator.transformName() + ":" + spec.getKey();
                tasks.add(Executors.callable(
                        () -> generate(core, reporter, stepKey, sourceOf(spec.getKey()), inputHash)));
            }
        }
        pool.invokeAll(tasks);

        if (!reporter.drain(Duration.ofSeconds(5)))
            log.warn("Step reporter did not drain before completing {}", run);
        core.plan().complete();
        log.info("Summary: {}", core.plan().summary(run));
    }

    private static void generate(GenCore core, StepReporter reporter, String stepKey, String source,
            String inputHash) {
        long start = System.nanoTime();
        CheckResult check = core.cache().check(stepKey, inputHash, true);
        if (check instanceof CheckResult.Unchanged) {
            reporter.report(stepKey, StepStatus.CACHED, 0, elapsedMillis(start), true);
            return;
        }
        int files = 1 + ThreadLocalRandom.current().nextInt(4);
        String outputHash = sha256(stepKey + "#" + inputHash);
        core.cache().record(stepKey, inputHash, outputHash, "generated/" + stepKey.replace(':', '/'), source, true);
        reporter.report(stepKey, StepStatus.DONE, files, elapsedMillis(start), false);
    }

    private static String sourceOf(String concept) {
        return "specs/" + concept + ".concept";
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String sha256(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest)
                sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
