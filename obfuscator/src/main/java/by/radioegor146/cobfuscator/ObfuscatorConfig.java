package by.radioegor146.cobfuscator;

import by.radioegor146.cobfuscator.flatten.CaseIdStyle;
import by.radioegor146.cobfuscator.transform.AugmentOpaqueUnit;
import by.radioegor146.cobfuscator.transform.ControlFlowFlattenUnit;
import by.radioegor146.cobfuscator.transform.InsertOpaqueUnit;
import by.radioegor146.cobfuscator.transform.ObfuscationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one obfuscation run needs: which file to read and write, and either a saved
 * pipeline to load or the units to run.
 */
public class ObfuscatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ObfuscatorConfig.class);

    private final Path inputPath;
    private final Path outputPath;
    private final Long seed;
    private final Path pipelinePath;
    private final Path savePipelinePath;
    private final List<ObfuscationUnit> units;

    public ObfuscatorConfig(Path inputPath, Path outputPath, Long seed, Path pipelinePath,
                            Path savePipelinePath, List<ObfuscationUnit> units) {
        this.inputPath = inputPath;
        this.outputPath = outputPath;
        this.seed = seed;
        this.pipelinePath = pipelinePath;
        this.savePipelinePath = savePipelinePath;
        this.units = Collections.unmodifiableList(new ArrayList<>(units));
    }

    public Path getInputPath() { return inputPath; }
    public Path getOutputPath() { return outputPath; }
    public Long getSeed() { return seed; }
    public Path getPipelinePath() { return pipelinePath; }
    public Path getSavePipelinePath() { return savePipelinePath; }
    public List<ObfuscationUnit> getUnits() { return units; }

    /**
     * Logs warnings for combinations that are legal but probably not what was meant.
     */
    public void validateAndWarn() {
        if (pipelinePath != null && !units.isEmpty()) {
            logger.warn("A pipeline file is given, the {} units selected by flags are ignored", units.size());
        }
        if (pipelinePath == null && units.isEmpty()) {
            logger.warn("No transformations selected, the output will only be reformatted");
        }
        if (savePipelinePath != null && seed == null && pipelinePath == null) {
            logger.warn("Saving a pipeline without a seed, replaying it will not reproduce this output");
        }
        int flattenIndex = -1;
        for (int i = 0; i < units.size(); i++) {
            ObfuscationUnit unit = units.get(i);
            if (unit instanceof ControlFlowFlattenUnit) {
                flattenIndex = i;
                if (((ControlFlowFlattenUnit) unit).getStyle() == CaseIdStyle.SEQUENTIAL
                        && !((ControlFlowFlattenUnit) unit).isRandomiseCases()) {
                    logger.warn("Sequential, ordered case ids leave the original block order easy to recover");
                }
            } else if (flattenIndex >= 0
                    && (unit instanceof InsertOpaqueUnit || unit instanceof AugmentOpaqueUnit)) {
                logger.warn("{} runs after flattening and will mostly see dispatch code", unit.getName());
            }
        }
    }

    @Override
    public String toString() {
        return String.format("ObfuscatorConfig{input=%s, output=%s, seed=%s, pipeline=%s, units=%s}",
                inputPath, outputPath, seed, pipelinePath, units);
    }

    /**
     * Builder class for constructing ObfuscatorConfig instances.
     */
    public static class Builder {
        private Path inputPath;
        private Path outputPath;
        private Long seed;
        private Path pipelinePath;
        private Path savePipelinePath;
        private final List<ObfuscationUnit> units = new ArrayList<>();

        public Builder setInputPath(Path inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder setOutputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder setSeed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder setPipelinePath(Path pipelinePath) {
            this.pipelinePath = pipelinePath;
            return this;
        }

        public Builder setSavePipelinePath(Path savePipelinePath) {
            this.savePipelinePath = savePipelinePath;
            return this;
        }

        public Builder addUnit(ObfuscationUnit unit) {
            this.units.add(unit);
            return this;
        }

        public ObfuscatorConfig build() {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            return new ObfuscatorConfig(inputPath, outputPath, seed, pipelinePath, savePipelinePath, units);
        }
    }
}
