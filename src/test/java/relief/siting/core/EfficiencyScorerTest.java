package relief.siting.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import relief.siting.parameters.ScoringWeights;

class EfficiencyScorerTest {

    private final EfficiencyScorer scorer =
            new EfficiencyScorer(new ScoringWeights(), 1000.0, CostModel.distributionDefaults());

    @Test
    void scoresWeightedFactors() {
        Cell c = CellFixtures.cell("a", 40.0, -75.0, 1000, 500.0, 0.3, 0.6);
        // 0.5 * 0.5 + 0.3 * (1 - 0.6) + 0.2 * 0.3
        assertEquals(0.43, scorer.efficiency(c), 1e-9);
    }

    @Test
    void efficiencyClampsRatiosOnUncheckedCells() {
        Cell odd = CellFixtures.cell("odd", 40.0, -75.0, 1000, 500.0, 1.4, -0.2);
        assertFalse(odd.isWellFormed());
        // 0.5 * 0.5 + 0.3 * (1 - 0) + 0.2 * 1
        assertEquals(0.75, scorer.efficiency(odd), 1e-9);
        assertTrue(scorer.score(odd).isEmpty());
    }

    @Test
    void derivesCostsFromExpectedImpact() {
        Cell c = CellFixtures.cell("a", 40.0, -75.0, 1000, 500.0, 0.3, 0.6);
        ScoredCandidate s = scorer.score(c).orElseThrow();
        // impact = min(500 * 0.4, 1000 * 0.3)
        assertEquals(200.0, s.expectedImpact, 1e-9);
        assertEquals(100_000 + 200 * 60, s.setupCost, 1e-9);
        assertEquals(10_000 + 200 * 12, s.recurringCost, 1e-9);
    }

    @Test
    void capsSetupAndRecurringCosts() {
        Cell big = CellFixtures.cell("big", 40.0, -75.0, 100_000, 50_000.0, 0.3, 0.6);
        ScoredCandidate s = scorer.score(big).orElseThrow();
        assertEquals(300_000.0, s.setupCost, 1e-9);
        assertEquals(30_000.0, s.recurringCost, 1e-9);
    }

    @Test
    void needFallsBackToPopulationTimesRisk() {
        Cell c = new Cell("r", 40.0, -75.0, 200, 3.0, null, 0.0, 0.0, 1.0);
        assertEquals(600.0, c.needIndex, 1e-9);
        assertEquals(0.5 * 0.6, scorer.efficiency(c), 1e-9);
    }

    @Test
    void skipsUnpopulatedAndMalformedCells() {
        assertFalse(scorer.score(CellFixtures.cell("empty", 40.0, -75.0, 0, 10.0)).isPresent());
        assertFalse(scorer.score(CellFixtures.cell("nolat", Double.NaN, -75.0, 100, 10.0)).isPresent());
        assertFalse(scorer.score(new Cell("ratio", 40.0, -75.0, 100, 0.0, 10.0, 1.5, 0.0, 1.0)).isPresent());
        assertFalse(scorer.score(null).isPresent());
    }

    @Test
    void clampsRatiosWhenScoringDirectly() {
        Cell c = new Cell("x", 40.0, -75.0, 100, 0.0, 0.0, 1.5, 0.0, -0.5);
        assertEquals(0.3 + 0.2, scorer.efficiency(c), 1e-9);
    }

    @Test
    void higherPovertyScoresHigherAllElseEqual() {
        Optional<ScoredCandidate> rich = scorer.score(CellFixtures.cell("a", 40.0, -75.0, 1000, 300.0, 0.1, 0.9));
        Optional<ScoredCandidate> poor = scorer.score(CellFixtures.cell("b", 40.0, -75.0, 1000, 300.0, 0.4, 0.9));
        assertTrue(poor.orElseThrow().efficiencyScore > rich.orElseThrow().efficiencyScore);
    }
}
