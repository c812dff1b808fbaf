package relief.siting.utils;

import java.util.List;
import relief.siting.core.Cell;

// Summary of a loaded cell set
public class DomainStatistics {
    public static final double HIGH_NEED_RISK_SCORE = 4.0;

    public int totalCells;
    public long totalPopulation;
    public double totalNeed;
    public double averageRiskScore;
    public int highNeedCells;

    public DomainStatistics() {}

    public static DomainStatistics of(List<Cell> cells) {
        DomainStatistics s = new DomainStatistics();
        double riskSum = 0.0;
        for (Cell c : cells) {
            s.totalCells++;
            s.totalPopulation += c.population;
            s.totalNeed += c.needIndex;
            riskSum += c.riskScore;
            if (c.riskScore > HIGH_NEED_RISK_SCORE) s.highNeedCells++;
        }
        s.averageRiskScore = s.totalCells == 0 ? 0.0 : riskSum / s.totalCells;
        return s;
    }
}
