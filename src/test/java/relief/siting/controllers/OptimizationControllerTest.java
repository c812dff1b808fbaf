package relief.siting.controllers;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import relief.siting.parameters.OptimizationParams;

class OptimizationControllerTest {

    @TempDir
    Path dir;

    @Test
    void queuedRunBlocksSecondStart() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        // Occupy the worker so the run stays queued
        executor.submit(() -> {
            release.await();
            return null;
        });
        OptimizationController controller = new OptimizationController(dir.resolve("cells.csv"), executor);

        try {
            assertTrue(controller.startRun(new OptimizationParams()));
            assertFalse(controller.startRun(new OptimizationParams()));
        } finally {
            release.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }
}
