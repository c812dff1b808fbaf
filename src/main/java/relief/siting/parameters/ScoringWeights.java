package relief.siting.parameters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoringWeights {
    public double need = 0.5;
    public double accessBarrier = 0.3;
    public double poverty = 0.2;

    public ScoringWeights() {}

    public ScoringWeights(double need, double accessBarrier, double poverty) {
        this.need = need;
        this.accessBarrier = accessBarrier;
        this.poverty = poverty;
    }

    /**
     * Validate the weight vector.
     * @throws IllegalArgumentException if a weight is negative or the weights do not sum to 1
     */
    public void validate() {
        if (!Double.isFinite(need) || need < 0) throw new IllegalArgumentException("Invalid need weight: " + need);
        if (!Double.isFinite(accessBarrier) || accessBarrier < 0)
            throw new IllegalArgumentException("Invalid accessBarrier weight: " + accessBarrier);
        if (!Double.isFinite(poverty) || poverty < 0)
            throw new IllegalArgumentException("Invalid poverty weight: " + poverty);
        double total = need + accessBarrier + poverty;
        if (Math.abs(total - 1.0) > 0.01) {
            throw new IllegalArgumentException(String.format("Weights must sum to 1.0 (current sum: %.2f)", total));
        }
    }

    @Override
    public String toString() {
        return "{need = " + need + ", accessBarrier = " + accessBarrier + ", poverty = " + poverty + "}";
    }
}
