package by.radioegor146.cobfuscator.opaque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning values for opaque predicate generation. None of them affect correctness: they only
 * shape how many entropic globals get created and where inserted predicates end up.
 */
public class OperandSourceConfig {

    private static final Logger logger = LoggerFactory.getLogger(OperandSourceConfig.class);

    private final double newVariableProbability;
    private final int proceduralWeight;
    private final int blockWeight;
    private final int stmtWeight;

    public OperandSourceConfig(double newVariableProbability, int proceduralWeight, int blockWeight,
                               int stmtWeight) {
        this.newVariableProbability = newVariableProbability;
        this.proceduralWeight = proceduralWeight;
        this.blockWeight = blockWeight;
        this.stmtWeight = stmtWeight;
    }

    /**
     * Chance that an entropic operand is a freshly created global even though existing ones
     * could be reused.
     */
    public double getNewVariableProbability() { return newVariableProbability; }
    public int getProceduralWeight() { return proceduralWeight; }
    public int getBlockWeight() { return blockWeight; }
    public int getStmtWeight() { return stmtWeight; }

    public int getWeight(Granularity granularity) {
        switch (granularity) {
            case PROCEDURAL:
                return proceduralWeight;
            case BLOCK:
                return blockWeight;
            case STMT:
                return stmtWeight;
            default:
                throw new IllegalArgumentException("Unknown granularity " + granularity);
        }
    }

    public static OperandSourceConfig createDefault() {
        return new Builder().build();
    }

    public void validateAndWarn() {
        if (newVariableProbability >= 0.9) {
            logger.warn("Entropic variables are almost never reused (probability {}), expect many new globals",
                    newVariableProbability);
        }
        if (proceduralWeight + blockWeight + stmtWeight == 0) {
            logger.warn("All granularity weights are zero, insertions will be spread uniformly");
        }
    }

    @Override
    public String toString() {
        return String.format("OperandSourceConfig{newVariableProbability=%s, weights=%d:%d:%d}",
                newVariableProbability, proceduralWeight, blockWeight, stmtWeight);
    }

    public static class Builder {
        private double newVariableProbability = 0.25;
        private int proceduralWeight = 10;
        private int blockWeight = 70;
        private int stmtWeight = 20;

        public Builder setNewVariableProbability(double newVariableProbability) {
            this.newVariableProbability = newVariableProbability;
            return this;
        }

        public Builder setProceduralWeight(int proceduralWeight) {
            this.proceduralWeight = proceduralWeight;
            return this;
        }

        public Builder setBlockWeight(int blockWeight) {
            this.blockWeight = blockWeight;
            return this;
        }

        public Builder setStmtWeight(int stmtWeight) {
            this.stmtWeight = stmtWeight;
            return this;
        }

        public OperandSourceConfig build() {
            if (newVariableProbability < 0 || newVariableProbability > 1) {
                throw new IllegalArgumentException("New variable probability must be within [0, 1]");
            }
            if (proceduralWeight < 0 || blockWeight < 0 || stmtWeight < 0) {
                throw new IllegalArgumentException("Granularity weights must not be negative");
            }
            return new OperandSourceConfig(newVariableProbability, proceduralWeight, blockWeight, stmtWeight);
        }
    }
}
