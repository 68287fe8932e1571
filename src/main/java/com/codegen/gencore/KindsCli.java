package com.codegen.gencore;

import com.codegen.gencore.api.Consumer;
import com.codegen.gencore.api.Producer;
import com.codegen.gencore.engine.KindGraph;
import com.codegen.gencore.io.CoreConfig;
import com.codegen.gencore.store.InMemoryRelationStore;
import com.codegen.gencore.util.KindGraphExplain;

import java.io.PrintStream;
import java.util.List;

/**
 * Command line view over the configured kind taxonomy.
 *
 * <pre>
 * list                 taxonomy grouped by category
 * path &lt;from&gt; &lt;to&gt;     shortest transform chain
 * consumers &lt;kind&gt;     kinds produced from a kind
 * producers &lt;kind&gt;     kinds a kind is produced from
 * order                kinds in dependency order
 * mermaid              Mermaid flowchart of the graph
 * </pre>
 */
public final class KindsCli {

    private KindsCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            usage(err);
            return 2;
        }
        CoreConfig config = CoreConfig.load();
        try (GenCore core = new GenCore(config, new InMemoryRelationStore())) {
            return dispatch(args, core.graph(), core.explain(), out, err);
        }
    }

    static int dispatch(String[] args, KindGraph graph, KindGraphExplain explain, PrintStream out,
            PrintStream err) {
        switch (args[0]) {
            case "list":
                out.print(explain.dumpTaxonomy());
                return 0;
            case "order":
                graph.topologicalOrder().forEach(out::println);
                return 0;
            case "mermaid":
                out.print(explain.toMermaid());
                return 0;
            case "path":
                if (args.length != 3)
                    break;
                if (!graph.contains(args[1]) || !graph.contains(args[2])) {
                    err.println("Unknown kind: " + (graph.contains(args[1]) ? args[2] : args[1]));
                    return 1;
                }
                String route = explain.explainRoute(args[1], args[2]);
                out.print(route);
                return route.startsWith("No path") ? 1 : 0;
            case "consumers":
                if (args.length != 2)
                    break;
                if (!requireKind(graph, args[1], err))
                    return 1;
                List<Consumer> consumers = graph.consumers(args[1]);
                for (Consumer c : consumers)
                    out.println(c.toKind() + (c.transformName() != null ? "\t" + c.transformName() : ""));
                return 0;
            case "producers":
                if (args.length != 2)
                    break;
                if (!requireKind(graph, args[1], err))
                    return 1;
                List<Producer> producers = graph.producers(args[1]);
                for (Producer p : producers)
                    out.println(p.fromKind() + (p.transformName() != null ? "\t" + p.transformName() : ""));
                return 0;
            default:
                err.println("Unknown command: " + args[0]);
        }
        usage(err);
        return 2;
    }

    private static boolean requireKind(KindGraph graph, String kind, PrintStream err) {
        if (graph.contains(kind))
            return true;
        err.println("Unknown kind: " + kind);
        return false;
    }

    private static void usage(PrintStream err) {
        err.println("usage: kinds <list | path <from> <to> | consumers <kind> | producers <kind> | order | mermaid>");
    }
}
