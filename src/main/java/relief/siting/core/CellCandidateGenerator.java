package relief.siting.core;

import java.util.List;

/**
 * One candidate per scorable cell. Used by the distribution tier.
 */
public final class CellCandidateGenerator implements CandidateGenerator {

    private final EfficiencyScorer scorer;
    private final int chunkSize;

    public CellCandidateGenerator(EfficiencyScorer scorer) {
        this(scorer, ParallelScoring.DEFAULT_CHUNK_SIZE);
    }

    public CellCandidateGenerator(EfficiencyScorer scorer, int chunkSize) {
        this.scorer = scorer;
        this.chunkSize = chunkSize;
    }

    @Override
    public List<ScoredCandidate> generate(List<Cell> pool) {
        return ParallelScoring.map(pool, chunkSize, c -> scorer.score(c).orElse(null));
    }
}
