package relief.siting;

import io.javalin.Javalin;
import java.nio.file.Path;
import java.util.Map;
import relief.siting.controllers.DataController;
import relief.siting.controllers.OptimizationController;
import relief.siting.core.CellLoader;
import relief.siting.utils.Log;

public class Main {
    private static final int DEFAULT_PORT = 8080;
    private static final String DEFAULT_DATA_DIR = "data";

    public static void main(String[] args) {
        int port = port(System.getenv("SITING_PORT"));
        String dataDir = System.getenv("SITING_DATA_DIR");
        Path cellsCsv = Path.of(dataDir == null || dataDir.isBlank() ? DEFAULT_DATA_DIR : dataDir, CellLoader.DEFAULT_FILE);

        Javalin app = Javalin.create(config -> {
                    config.http.defaultContentType = "application/json";
                    config.bundledPlugins.enableCors(cors -> cors.addRule(it -> it.anyHost()));
                })
                .start(port);

        DataController dataController = new DataController(cellsCsv);
        OptimizationController optimizationController = new OptimizationController(cellsCsv);

        app.get("/health", ctx -> {
            Log.info("Health check requested");
            ctx.json(Map.of("status", "UP"));
        });

        Log.info("═══════════════════════════════════════════════════════════");
        Log.info("Server started successfully on http://localhost:%d", port);
        Log.info("Cell data: %s", cellsCsv.toAbsolutePath());
        Log.info("═══════════════════════════════════════════════════════════");
        Log.info("API Endpoints:");
        Log.info("  Utility:");
        Log.info("    GET  /health                     - Health check");
        Log.info("    GET  /cells                      - Loaded cells and statistics");
        Log.info("");
        Log.info("  Optimization:");
        Log.info("    POST /optimize/run               - Start a two-tier run");
        Log.info("    GET  /optimize/status            - Get current status");
        Log.info("    POST /optimize/stop              - Stop running optimization");
        Log.info("    GET  /optimize/results           - Get result metrics");
        Log.info("    GET  /optimize/facilities        - Get selected facilities");
        Log.info("    GET  /optimize/progress          - Get progress events");
        Log.info("═══════════════════════════════════════════════════════════");

        app.get("/cells", dataController::getCells);

        app.post("/optimize/run", optimizationController::postRun);
        app.get("/optimize/status", optimizationController::getStatus);
        app.post("/optimize/stop", optimizationController::postStop);
        app.get("/optimize/results", optimizationController::getResults);
        app.get("/optimize/facilities", optimizationController::getFacilities);
        app.get("/optimize/progress", optimizationController::getProgress);
    }

    static int port(String value) {
        if (value == null || value.isBlank()) return DEFAULT_PORT;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            Log.warn("Ignoring invalid SITING_PORT '%s', using %d", value, DEFAULT_PORT);
            return DEFAULT_PORT;
        }
    }
}
