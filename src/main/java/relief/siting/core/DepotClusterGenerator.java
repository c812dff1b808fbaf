package relief.siting.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import relief.siting.utils.Log;

/**
 * Depot-tier candidates. The region is cut into {@code partitions x partitions} sub-regions
 * (quadrants by default) and each populated sub-region proposes a single anchor:
 * <ul>
 *   <li>the anchor is the member cell nearest to the need-weighted centroid among members
 *       whose own need is at or below the sub-region median, so a depot does not take one of
 *       the best distribution sites;</li>
 *   <li>the candidate's score is the summed efficiency of all members, so the highest-need
 *       sub-regions are served first;</li>
 *   <li>its impact is the summed impact of every scored cell within the depot radius.</li>
 * </ul>
 */
public final class DepotClusterGenerator implements CandidateGenerator {

    private final EfficiencyScorer scorer;
    private final int partitions;
    private final double serviceRadius;

    public DepotClusterGenerator(EfficiencyScorer scorer, int partitions, double serviceRadius) {
        this.scorer = scorer;
        this.partitions = partitions;
        this.serviceRadius = serviceRadius;
    }

    @Override
    public List<ScoredCandidate> generate(List<Cell> pool) {
        List<ScoredCandidate> scored =
                ParallelScoring.map(pool, ParallelScoring.DEFAULT_CHUNK_SIZE, c -> scorer.score(c).orElse(null));
        if (scored.isEmpty()) return new ArrayList<>();

        List<Cell> scoredCells = new ArrayList<>(scored.size());
        for (ScoredCandidate s : scored) scoredCells.add(s.cell);
        ZoneGrid grid = ZoneGrid.over(scoredCells, partitions);

        Map<Integer, List<ScoredCandidate>> regions = new TreeMap<>();
        for (ScoredCandidate s : scored) {
            regions.computeIfAbsent(grid.zoneOf(s.cell), k -> new ArrayList<>()).add(s);
        }

        CostModel costs = scorer.costModel();
        List<ScoredCandidate> out = new ArrayList<>(regions.size());
        for (Map.Entry<Integer, List<ScoredCandidate>> e : regions.entrySet()) {
            List<ScoredCandidate> members = e.getValue();
            Cell anchor = representative(members);

            double regionScore = 0.0;
            for (ScoredCandidate m : members) regionScore += m.efficiencyScore;

            double catchment = 0.0;
            for (ScoredCandidate s : scored) {
                if (GeoDistance.miles(anchor, s.cell) <= serviceRadius) catchment += s.expectedImpact;
            }

            out.add(new ScoredCandidate(
                    anchor, regionScore, costs.setupCost(catchment), costs.recurringCost(catchment), catchment));
            Log.debug("Depot region %d: %d cells, anchor %s, score %.3f, catchment %.0f",
                    e.getKey(), members.size(), anchor.id, regionScore, catchment);
        }
        return out;
    }

    static Cell representative(List<ScoredCandidate> members) {
        double needSum = 0.0, latSum = 0.0, lonSum = 0.0;
        for (ScoredCandidate m : members) {
            needSum += m.cell.needIndex;
            latSum += m.cell.lat * m.cell.needIndex;
            lonSum += m.cell.lon * m.cell.needIndex;
        }
        double cLat, cLon;
        if (needSum > 0) {
            cLat = latSum / needSum;
            cLon = lonSum / needSum;
        } else {
            cLat = 0.0;
            cLon = 0.0;
            for (ScoredCandidate m : members) {
                cLat += m.cell.lat;
                cLon += m.cell.lon;
            }
            cLat /= members.size();
            cLon /= members.size();
        }

        double median = medianNeed(members);
        final double centerLat = cLat, centerLon = cLon;
        return members.stream()
                .map(m -> m.cell)
                .filter(c -> c.needIndex <= median)
                .min(Comparator.comparingDouble((Cell c) -> GeoDistance.miles(centerLat, centerLon, c.lat, c.lon))
                        .thenComparing(c -> c.id))
                .orElse(members.get(0).cell);
    }

    private static double medianNeed(List<ScoredCandidate> members) {
        double[] needs = new double[members.size()];
        for (int i = 0; i < needs.length; i++) needs[i] = members.get(i).cell.needIndex;
        Arrays.sort(needs);
        int mid = needs.length / 2;
        return needs.length % 2 == 1 ? needs[mid] : (needs[mid - 1] + needs[mid]) / 2.0;
    }
}
