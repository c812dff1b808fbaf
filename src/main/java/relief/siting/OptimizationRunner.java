package relief.siting;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import relief.siting.core.Cell;
import relief.siting.core.CellLoader;
import relief.siting.core.OptimizationResult;
import relief.siting.core.SitingPipeline;
import relief.siting.parameters.OptimizationParams;
import relief.siting.utils.FacilityResult;
import relief.siting.utils.Log;
import relief.siting.utils.ProgressEvent;

public class OptimizationRunner {
    private final OptimizationParams params;
    private final Path cellsCsv;
    private volatile boolean running = false;
    private volatile boolean stopped = false;
    private volatile String error = null;
    private volatile String currentStage = null;

    private final List<ProgressEvent> progressHistory = new CopyOnWriteArrayList<>();
    private volatile OptimizationResult result = null;

    public OptimizationRunner(OptimizationParams params, Path cellsCsv) {
        this.params = params;
        this.cellsCsv = cellsCsv;
    }

    // ========== RUN ==========

    /** Marks the runner as running before it reaches the executor. */
    public void markQueued() {
        running = true;
    }

    public void run() throws Exception {
        running = true;
        progressHistory.clear();
        result = null;
        try {
            List<Cell> cells = CellLoader.load(cellsCsv);
            checkStopped();

            SitingPipeline pipeline = new SitingPipeline(params);
            pipeline.setStopSignal(() -> stopped);
            pipeline.setProgressListener(event -> {
                currentStage = event.stage;
                progressHistory.add(event);
            });
            result = pipeline.run(cells);

            if (!result.isSuccess()) {
                error = result.reason;
                Log.warn("Optimization finished without a plan: %s", result.reason);
            }
        } catch (InterruptedException e) {
            this.error = SitingPipeline.STOPPED_REASON;
            Log.warn("Optimization stopped by user before it started");
        } catch (Exception e) {
            this.error = "OptimizationRunner error: " + e.getMessage();
            Log.error("OptimizationRunner error: %s", e.getMessage(), e);
            throw e;
        } finally {
            running = false;
        }
    }

    // ========== STATUS & RESULTS ==========

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("running", running);
        status.put("stopped", stopped);
        status.put("progressEvents", progressHistory.size());
        if (currentStage != null) {
            status.put("stage", currentStage);
        }
        if (error != null) {
            status.put("error", error);
        }
        if (!running && result != null) {
            status.put("completed", true);
            status.put("result", result.status.name());
        }
        return status;
    }

    public Map<String, Object> getResults() {
        OptimizationResult r = result;
        if (r == null) {
            return Map.of("error", error != null ? error : "No results available");
        }
        Map<String, Object> out = new HashMap<>();
        out.put("status", r.status.name());
        if (r.reason != null) out.put("reason", r.reason);
        out.put("facilityCount", r.facilities.size());
        out.put("depotCount", r.depotCount);
        out.put("distributionCount", r.distributionCount);
        out.put("totalExpectedImpact", r.totalExpectedImpact);
        out.put("budgetUsed", r.budgetUsed);
        out.put("budgetRemaining", r.budgetRemaining);
        out.put("depotBudgetUsed", r.depotBudgetUsed);
        out.put("distributionBudgetUsed", r.distributionBudgetUsed);
        out.put("coveragePercentage", r.coveragePercentage);
        out.put("depotCoveragePercentage", r.depotCoveragePercentage);
        out.put("cellsCovered", r.cellsCovered);
        out.put("totalCells", r.totalCells);
        out.put("iterations", r.iterations);
        out.put("adjustmentsMade", r.adjustmentsMade);
        out.put("meanEfficiencyScore", r.meanEfficiencyScore);
        out.put("timedOut", r.timedOut);
        out.put("executionTimeMs", r.elapsedMs);
        out.put("timestamp", r.timestamp);
        return out;
    }

    public List<FacilityResult> getFacilities() {
        OptimizationResult r = result;
        return r == null ? List.of() : FacilityResult.of(r.facilities);
    }

    public List<ProgressEvent> getProgressHistory() {
        return new ArrayList<>(progressHistory);
    }

    // ========== CONTROL ==========

    public void stop() {
        stopped = true;
    }

    public boolean isRunning() {
        return running;
    }

    public void setError(String error) {
        this.error = error;
    }

    public boolean isStopped() {
        return stopped;
    }

    public String getError() {
        return error;
    }

    private void checkStopped() throws InterruptedException {
        if (stopped) {
            throw new InterruptedException("Optimization stopped by user.");
        }
    }
}
