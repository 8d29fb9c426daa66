package by.radioegor146.cobfuscator;

import by.radioegor146.cobfuscator.flatten.CaseIdStyle;
import by.radioegor146.cobfuscator.opaque.Granularity;
import by.radioegor146.cobfuscator.opaque.InsertionKind;
import by.radioegor146.cobfuscator.opaque.OperandSourceConfig;
import by.radioegor146.cobfuscator.opaque.OperandStyle;
import by.radioegor146.cobfuscator.rename.RenameStyle;
import by.radioegor146.cobfuscator.transform.ArithmeticEncodeUnit;
import by.radioegor146.cobfuscator.transform.AugmentOpaqueUnit;
import by.radioegor146.cobfuscator.transform.ControlFlowFlattenUnit;
import by.radioegor146.cobfuscator.transform.FuncArgumentRandomiseUnit;
import by.radioegor146.cobfuscator.transform.IdentifierRenameUnit;
import by.radioegor146.cobfuscator.transform.InsertOpaqueUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.File;
import java.util.List;
import java.util.concurrent.Callable;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String VERSION = "1.0.0";

    @CommandLine.Command(name = "c-obfuscator", mixinStandardHelpOptions = true, version = "c-obfuscator " + VERSION,
            description = "Obfuscates a C source file while keeping its behaviour")
    static class CObfuscatorRunner implements Callable<Integer> {

        @CommandLine.Parameters(index = "0", description = "C source file to obfuscate")
        private File inputFile;

        @CommandLine.Parameters(index = "1", description = "Output C source file")
        private File outputFile;

        @CommandLine.Option(names = {"-s", "--seed"}, description = "Random seed, makes the output reproducible")
        private Long seed;

        @CommandLine.Option(names = {"-p", "--pipeline"}, description = "Load the transformations from a saved pipeline JSON file")
        private File pipelineFile;

        @CommandLine.Option(names = {"--save-pipeline"}, description = "Save the pipeline that is run as JSON")
        private File savePipelineFile;

        @CommandLine.Option(names = {"--rename"}, description = "Rename identifiers: ${COMPLETION-CANDIDATES}")
        private RenameStyle renameStyle;

        @CommandLine.Option(names = {"--minimise-idents"}, description = "Reuse generated names wherever scoping allows")
        private boolean minimiseIdents;

        @CommandLine.Option(names = {"--spurious-args"}, paramLabel = "N", defaultValue = "0",
                description = "Add N unused parameters to every eligible function")
        private int spuriousArgs;

        @CommandLine.Option(names = {"--spurious-arg-probability"}, defaultValue = "0.5",
                description = "Chance that a spurious argument passes an existing variable instead of a literal")
        private double spuriousArgProbability;

        @CommandLine.Option(names = {"--randomise-args"}, description = "Shuffle the parameter order of every eligible function")
        private boolean randomiseArgs;

        @CommandLine.Option(names = {"--encode-arithmetic"}, paramLabel = "DEPTH", defaultValue = "0",
                description = "Encode integer arithmetic up to the given depth (0 disables)")
        private int encodeDepth;

        @CommandLine.Option(names = {"--insert"}, paramLabel = "N", defaultValue = "0",
                description = "Insert N opaque predicates per function (0 disables)")
        private int insertNumber;

        @CommandLine.Option(names = {"--insert-granularities"}, split = ",", defaultValue = "PROCEDURAL,BLOCK,STMT",
                description = "Code sizes insertions wrap: ${COMPLETION-CANDIDATES}")
        private List<Granularity> granularities;

        @CommandLine.Option(names = {"--insert-kinds"}, split = ",",
                defaultValue = "CHECK,FALSE,ELSE,IF_ELSE,WHILE_FALSE,DO_WHILE,EITHER",
                description = "Constructs insertions build: ${COMPLETION-CANDIDATES}")
        private List<InsertionKind> kinds;

        @CommandLine.Option(names = {"--augment"}, paramLabel = "N", defaultValue = "0",
                description = "Add up to N opaque predicates to each existing condition (0 disables)")
        private int augmentNumber;

        @CommandLine.Option(names = {"--augment-probability"}, defaultValue = "1.0",
                description = "Chance that an existing condition is augmented")
        private double augmentProbability;

        @CommandLine.Option(names = {"--predicate-styles"}, split = ",", defaultValue = "INPUT,ENTROPY",
                description = "Where predicate operands come from: ${COMPLETION-CANDIDATES}")
        private List<OperandStyle> predicateStyles;

        @CommandLine.Option(names = {"--new-entropy-probability"}, defaultValue = "0.25",
                description = "Chance of creating a new entropic variable instead of reusing one")
        private double newEntropyProbability;

        @CommandLine.Option(names = {"--flatten"}, description = "Flatten the control flow of every function")
        private boolean flatten;

        @CommandLine.Option(names = {"--flatten-style"}, defaultValue = "SEQUENTIAL",
                description = "Case id style: ${COMPLETION-CANDIDATES}")
        private CaseIdStyle flattenStyle;

        @CommandLine.Option(names = {"--randomise-cases"}, description = "Shuffle the order of dispatch cases")
        private boolean randomiseCases;

        @Override
        public Integer call() throws Exception {
            ObfuscatorConfig config;
            try {
                config = buildConfig();
            } catch (IllegalArgumentException e) {
                logger.error("Invalid options: {}", e.getMessage());
                return 2;
            }
            config.validateAndWarn();

            try {
                return new CObfuscator().process(config) ? 0 : 1;
            } catch (ObfuscationException e) {
                logger.error("{}", e.getMessage());
                return 1;
            }
        }

        ObfuscatorConfig buildConfig() {
            OperandSourceConfig operandConfig = new OperandSourceConfig.Builder()
                    .setNewVariableProbability(newEntropyProbability)
                    .build();
            operandConfig.validateAndWarn();

            ObfuscatorConfig.Builder builder = new ObfuscatorConfig.Builder()
                    .setInputPath(inputFile.toPath())
                    .setOutputPath(outputFile.toPath())
                    .setSeed(seed)
                    .setPipelinePath(pipelineFile == null ? null : pipelineFile.toPath())
                    .setSavePipelinePath(savePipelineFile == null ? null : savePipelineFile.toPath());

            if (renameStyle != null) {
                builder.addUnit(new IdentifierRenameUnit(renameStyle, minimiseIdents));
            } else if (minimiseIdents) {
                logger.warn("--minimise-idents has no effect without --rename");
            }
            if (spuriousArgs > 0 || randomiseArgs) {
                builder.addUnit(new FuncArgumentRandomiseUnit(spuriousArgs, spuriousArgProbability, randomiseArgs));
            }
            if (encodeDepth > 0) {
                builder.addUnit(new ArithmeticEncodeUnit(encodeDepth));
            }
            if (insertNumber > 0) {
                builder.addUnit(new InsertOpaqueUnit(predicateStyles, granularities, kinds, insertNumber, operandConfig));
            }
            if (augmentNumber > 0) {
                builder.addUnit(new AugmentOpaqueUnit(predicateStyles, augmentProbability, augmentNumber, operandConfig));
            }
            if (flatten) {
                builder.addUnit(new ControlFlowFlattenUnit(randomiseCases, flattenStyle));
            }
            return builder.build();
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new CObfuscatorRunner()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }
}
