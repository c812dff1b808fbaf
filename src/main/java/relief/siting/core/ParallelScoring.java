package relief.siting.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import relief.siting.utils.Log;

/**
 * Chunked fan-out for per-cell work. Chunks share no mutable state and are gathered in
 * submission order. A chunk that throws only loses its own results.
 */
public final class ParallelScoring {

    public static final int DEFAULT_CHUNK_SIZE = 256;
    public static final int MAX_WORKERS = 8;

    private ParallelScoring() {}

    public static int workerCount() {
        return Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Applies {@code mapper} to every cell, dropping cells it maps to {@code null}.
     *
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public static <T> List<T> map(List<Cell> cells, int chunkSize, Function<Cell, T> mapper) {
        if (cells.isEmpty()) return new ArrayList<>();
        int workers = workerCount();
        if (cells.size() <= chunkSize || workers == 1) {
            // Small pools: thread start-up costs more than the work
            List<T> out = new ArrayList<>();
            try {
                collect(cells, mapper, out);
            } catch (RuntimeException e) {
                Log.warn("Scoring of %d cells failed, chunk dropped: %s", cells.size(), e.getMessage(), e);
                return new ArrayList<>();
            }
            return out;
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<List<T>>> futures = new ArrayList<>();
            for (int start = 0; start < cells.size(); start += chunkSize) {
                List<Cell> chunk = cells.subList(start, Math.min(cells.size(), start + chunkSize));
                futures.add(executor.submit(() -> {
                    List<T> part = new ArrayList<>(chunk.size());
                    collect(chunk, mapper, part);
                    return part;
                }));
            }

            List<T> out = new ArrayList<>(cells.size());
            int failedChunks = 0;
            for (Future<List<T>> f : futures) {
                try {
                    out.addAll(f.get());
                } catch (ExecutionException e) {
                    failedChunks++;
                    Log.warn("Scoring chunk failed, its cells are dropped: %s", e.getCause().getMessage(), e.getCause());
                }
            }
            if (failedChunks > 0) {
                Log.warn("%d of %d scoring chunks failed", failedChunks, futures.size());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Scoring interrupted");
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T> void collect(List<Cell> cells, Function<Cell, T> mapper, List<T> out) {
        for (Cell c : cells) {
            T v = mapper.apply(c);
            if (v != null) out.add(v);
        }
    }
}
