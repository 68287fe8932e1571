package com.codegen.gencore.web;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Supplier;

/**
 * Read-only HTTP view over the kind graph, build cache and run history.
 *
 * <p>
 * Every endpoint answers with JSON built by {@link DiagnosticsPayloads}. Nothing
 * here mutates state; the server can be started alongside a running pipeline.
 */
public class DiagnosticsServer {
    private static final Logger log = LogManager.getLogger(DiagnosticsServer.class);
    private static final String JSON = "application/json";

    private final DiagnosticsPayloads payloads;
    private Javalin app;

    public DiagnosticsServer(DiagnosticsPayloads payloads) {
        this.payloads = payloads;
    }

    /**
     * Starts the server.
     *
     * @param port port to listen on, 0 for an ephemeral port.
     */
    public void start(int port) {
        log.info("Starting diagnostics server on port {}", port);

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
        });

        app.get("/api/kinds", json(payloads::kinds));
        app.get("/api/route/{from}/{to}",
                ctx -> respond(ctx, () -> payloads.route(ctx.pathParam("from"), ctx.pathParam("to"))));
        app.get("/api/dependents/{kind}", ctx -> respond(ctx, () -> payloads.dependents(ctx.pathParam("kind"))));
        app.get("/api/cache", json(payloads::cacheStatus));
        app.get("/api/cache/stale", json(payloads::staleSteps));
        app.get("/api/runs", json(payloads::history));
        app.get("/api/runs/{run}", ctx -> respond(ctx, () -> payloads.runSteps(ctx.pathParam("run"))));
        app.get("/api/runs/{run}/summary", ctx -> respond(ctx, () -> payloads.summary(ctx.pathParam("run"))));

        app.start(port);
        log.info("Diagnostics server listening on port {}", app.port());
    }

    /** The bound port, or -1 when not started. */
    public int port() {
        return app != null ? app.port() : -1;
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private Handler json(Supplier<String> body) {
        return ctx -> respond(ctx, body);
    }

    private void respond(Context ctx, Supplier<String> body) {
        try {
            ctx.contentType(JSON).result(body.get());
        } catch (RuntimeException e) {
            log.error("Diagnostics request {} failed", ctx.path(), e);
            ctx.status(500).contentType(JSON).result(payloads.error(e.getMessage()));
        }
    }
}
