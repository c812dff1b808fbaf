package relief.siting.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParallelScoringTest {

    @Test
    void keepsInputOrderAcrossChunks() {
        List<Cell> cells = CellFixtures.lattice(20, 20, 0.01, 4L);

        List<String> ids = ParallelScoring.map(cells, 16, c -> c.id);

        List<String> expected = new ArrayList<>();
        for (Cell c : cells) expected.add(c.id);
        assertEquals(expected, ids);
    }

    @Test
    void dropsNullResults() {
        List<Cell> cells = CellFixtures.lattice(4, 4, 0.01, 4L);

        List<String> ids = ParallelScoring.map(cells, 256, c -> c.id.endsWith("00") ? c.id : null);

        assertEquals(List.of("c0000", "c0100", "c0200", "c0300"), ids);
    }

    @Test
    void failingChunkOnlyLosesItsOwnCells() {
        assumeTrue(ParallelScoring.workerCount() > 1);
        List<Cell> cells = CellFixtures.lattice(10, 10, 0.01, 4L);

        List<String> ids = ParallelScoring.map(cells, 10, c -> {
            if (c.id.equals("c0305")) throw new IllegalStateException("bad cell");
            return c.id;
        });

        // Row 3 is exactly one chunk of ten
        assertEquals(90, ids.size());
        assertEquals("c0209", ids.get(29));
        assertEquals("c0400", ids.get(30));
    }
}
