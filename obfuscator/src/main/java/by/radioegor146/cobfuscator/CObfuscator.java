package by.radioegor146.cobfuscator;

import by.radioegor146.cobfuscator.transform.CSource;
import by.radioegor146.cobfuscator.transform.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Reads a C file, runs it through a pipeline and writes the result.
 */
public class CObfuscator {

    private static final Logger logger = LoggerFactory.getLogger(CObfuscator.class);

    /**
     * Builds the pipeline the configuration asks for. A seed given in the configuration wins
     * over one stored in a pipeline file.
     */
    public Pipeline createPipeline(ObfuscatorConfig config) throws IOException {
        if (config.getPipelinePath() == null) {
            return new Pipeline(config.getSeed(), config.getUnits());
        }
        String json = new String(Files.readAllBytes(config.getPipelinePath()), StandardCharsets.UTF_8);
        Pipeline loaded = Pipeline.fromJson(json);
        logger.info("Loaded {} transformations from {}", loaded.getUnits().size(), config.getPipelinePath());
        if (config.getSeed() != null) {
            return new Pipeline(config.getSeed(), loaded.getUnits());
        }
        return loaded;
    }

    /**
     * @return false when a unit stopped the pipeline and nothing was written
     */
    public boolean process(ObfuscatorConfig config) throws IOException {
        Pipeline pipeline = createPipeline(config);
        if (config.getSavePipelinePath() != null) {
            Files.write(config.getSavePipelinePath(), pipeline.toJson().getBytes(StandardCharsets.UTF_8));
            logger.info("Pipeline saved to {}", config.getSavePipelinePath());
        }

        logger.info("Processing {}...", config.getInputPath());
        CSource source = CSource.read(config.getInputPath());
        CSource result = pipeline.process(source);
        if (result == null) {
            logger.error("Obfuscation of {} did not complete, no output written", config.getInputPath());
            return false;
        }
        result.write(config.getOutputPath());
        logger.info("Obfuscated source written to {}", config.getOutputPath());
        return true;
    }
}
