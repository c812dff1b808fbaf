package relief.siting.controllers;

import io.javalin.http.Context;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import relief.siting.OptimizationRunner;
import relief.siting.parameters.OptimizationParams;
import relief.siting.utils.Log;

public class OptimizationController {
    private final Path cellsCsv;
    private volatile OptimizationRunner runner = null;
    private final ExecutorService executor;

    public OptimizationController(Path cellsCsv) {
        this(cellsCsv, Executors.newSingleThreadExecutor());
    }

    OptimizationController(Path cellsCsv, ExecutorService executor) {
        this.cellsCsv = cellsCsv;
        this.executor = executor;
    }

    public void getStatus(Context ctx) {
        Log.info("Optimization status requested");
        if (runner == null) {
            ctx.json(Map.of("status", "idle", "message", "No optimization running"));
        } else {
            ctx.json(runner.getStatus());
        }
    }

    public void postStop(Context ctx) {
        Log.info("Optimization stop requested");

        if (runner != null && runner.isRunning()) {
            Log.warn("Optimization stopped by user");
            runner.stop();
            ctx.json(Map.of("message", "Optimization stopping"));
        } else {
            Log.debug("Stop requested but no optimization running");
            ctx.status(400).json(Map.of("error", "No running optimization to stop"));
        }
    }

    public void getResults(Context ctx) {
        Log.info("Optimization results requested");

        if (runner == null) {
            ctx.status(404).json(Map.of("error", "No optimization has been run"));
        } else if (runner.isRunning()) {
            ctx.status(400).json(Map.of("error", "Optimization still running"));
        } else {
            ctx.json(runner.getResults());
        }
    }

    public void getFacilities(Context ctx) {
        Log.info("Selected facilities requested");

        if (runner == null) {
            ctx.status(404).json(Map.of("error", "No optimization has been run"));
        } else if (runner.isRunning()) {
            ctx.status(400).json(Map.of("error", "Optimization still running"));
        } else {
            ctx.json(Map.of("facilities", runner.getFacilities()));
        }
    }

    public void getProgress(Context ctx) {
        Log.info("Optimization progress requested");

        if (runner == null) {
            ctx.status(404).json(Map.of("error", "No optimization has been run"));
        } else {
            ctx.json(Map.of("running", runner.isRunning(), "events", runner.getProgressHistory()));
        }
    }

    public void postRun(Context ctx) {
        Log.info("Optimization run requested");

        OptimizationParams params;
        try {
            params = parseParams(ctx);
            Log.debug("Optimization parameters: " + params);
        } catch (IllegalArgumentException e) {
            handleInvalidParams(ctx, e);
            return;
        }

        if (!startRun(params)) {
            Log.warn("Attempted to start an optimization while one is already active");
            ctx.status(409).json(Map.of("error", "Optimization already running"));
            return;
        }
        ctx.json(Map.of("message", "Optimization started"));
    }

    /**
     * Queues a new run unless one is active. The runner counts as running from the moment it is
     * queued, so concurrent requests cannot both start one.
     *
     * @return false when a run is already active
     */
    synchronized boolean startRun(OptimizationParams params) {
        if (runner != null && runner.isRunning()) return false;

        OptimizationRunner next = new OptimizationRunner(params, cellsCsv);
        next.markQueued();
        runner = next;
        executor.submit(() -> {
            try {
                next.run();
                Log.info("Optimization run completed");
            } catch (Exception e) {
                Log.error("Optimization run failed: %s", e.getMessage(), e);
                next.setError(e.getMessage());
            }
        });
        return true;
    }

    private OptimizationParams parseParams(Context ctx) {
        if (ctx.body().isBlank()) {
            return new OptimizationParams(); // use defaults
        } else {
            OptimizationParams params = ctx.bodyAsClass(OptimizationParams.class);
            params.validate();
            return params;
        }
    }

    private void handleInvalidParams(Context ctx, IllegalArgumentException e) {
        Log.error("Invalid optimization parameters: %s", e.getMessage());
        ctx.status(400).json(Map.of("error", "Invalid parameters", "details", e.getMessage()));
    }
}
