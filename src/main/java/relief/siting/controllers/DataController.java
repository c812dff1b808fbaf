package relief.siting.controllers;

import io.javalin.http.Context;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import relief.siting.core.Cell;
import relief.siting.core.CellLoader;
import relief.siting.utils.DomainStatistics;
import relief.siting.utils.Log;

public class DataController {
    private final Path cellsCsv;

    public DataController(Path cellsCsv) {
        this.cellsCsv = cellsCsv;
    }

    public void getCells(Context ctx) {
        Log.info("Cell data requested");
        if (!Files.exists(cellsCsv)) {
            Log.error("CSV not found at %s", cellsCsv.toAbsolutePath().toString());
            ctx.status(500)
                    .json(Map.of(
                            "status", "error",
                            "message", cellsCsv.getFileName() + " not found"));
            return;
        }

        try {
            List<Cell> cells = CellLoader.load(cellsCsv);
            ctx.json(Map.of(
                    "status", "success",
                    "count", cells.size(),
                    "statistics", DomainStatistics.of(cells),
                    "data", cells));
        } catch (IOException e) {
            Log.error("Failed to read %s: %s", cellsCsv.getFileName(), e.getMessage(), e);
            ctx.status(500)
                    .json(Map.of(
                            "status", "error",
                            "message", "Failed to read " + cellsCsv.getFileName(),
                            "details", e.getMessage()));
        }
    }
}
