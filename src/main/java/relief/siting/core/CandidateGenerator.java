package relief.siting.core;

import java.util.List;

/**
 * Turns a cell pool into the scored candidates one tier chooses from.
 */
public interface CandidateGenerator {

    /**
     * @param pool cells eligible for this tier
     * @return candidates in any order; the allocator sorts them
     */
    List<ScoredCandidate> generate(List<Cell> pool);
}
