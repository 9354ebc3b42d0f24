package org.chakravyuha;

import org.chakravyuha.flatten.TrivialBlockPolicy;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.IrPrinter;
import org.chakravyuha.ir.parse.IrParseException;
import org.chakravyuha.ir.parse.IrParser;
import org.chakravyuha.report.ObfuscationReport;
import org.chakravyuha.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String VERSION = "1.0.0";

    @CommandLine.Command(name = "chakravyuha", mixinStandardHelpOptions = true, version = "chakravyuha " + VERSION,
            description = "Obfuscates a textual IR module with string encryption, control-flow flattening and fake code")
    static class ChakravyuhaRunner implements Callable<Integer> {

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", description = "IR file to obfuscate")
        private File inputFile;

        @CommandLine.Option(names = {"-o", "--output"}, description = "Output IR file (default: standard output)")
        private File outputFile;

        @CommandLine.Option(names = {"--report"}, description = "Write a JSON report of the run to this file")
        private File reportFile;

        @CommandLine.Option(names = {"-l", "--level"}, defaultValue = "medium",
                description = "Obfuscation level: low, medium, high (default: ${DEFAULT-VALUE})")
        private ObfuscationLevel level;

        @CommandLine.Option(names = {"-c", "--cycles"}, defaultValue = "1",
                description = "Number of obfuscation cycles (default: ${DEFAULT-VALUE})")
        private int cycles;

        @CommandLine.Option(names = {"--string-encryption"}, negatable = true, defaultValue = "true",
                description = "Encrypt constant strings and decrypt them at their uses")
        private boolean stringEncryption = true;

        @CommandLine.Option(names = {"--flatten"}, negatable = true, defaultValue = "true",
                description = "Flatten the control flow of every eligible function")
        private boolean flatten = true;

        @CommandLine.Option(names = {"--fake-code"}, negatable = true, defaultValue = "true",
                description = "Insert never-taken fake blocks, loops and conditionals")
        private boolean fakeCode = true;

        @CommandLine.Option(names = {"--seed"}, description = "Seed for all random choices, for reproducible output")
        private Long seed;

        @CommandLine.Option(names = {"--exclude-trivial-blocks"},
                description = "Keep blocks holding only a ret or unreachable out of the dispatcher")
        private boolean excludeTrivialBlocks;

        @CommandLine.Option(names = {"--no-verify"}, description = "Skip IR verification of flattened functions")
        private boolean noVerify;

        @Override
        public Integer call() {
            ObfuscatorConfig config;
            try {
                config = ObfuscatorConfig.builder()
                        .setInputPath(inputFile.toPath())
                        .setOutputPath(outputFile == null ? null : outputFile.toPath())
                        .setReportPath(reportFile == null ? null : reportFile.toPath())
                        .setLevel(level)
                        .setCycles(cycles)
                        .setSeed(seed)
                        .setTrivialBlockPolicy(excludeTrivialBlocks ? TrivialBlockPolicy.EXCLUDE : TrivialBlockPolicy.INCLUDE)
                        .setVerify(!noVerify)
                        .setProtectionConfig(new ProtectionConfig(stringEncryption, flatten, fakeCode))
                        .build();
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            }
            config.validateAndWarn();

            try {
                IrModule module = IrParser.parse(config.getInputPath());
                ObfuscationReport report = new ChakravyuhaObfuscator().obfuscate(module, config);
                writeModule(module, config.getOutputPath());
                if (config.getReportPath() != null) {
                    new ReportWriter().write(report, config.getReportPath());
                }
                return 0;
            } catch (IrParseException e) {
                logger.error("Failed to parse {}: {}", config.getInputPath(), e.getMessage());
                return 1;
            } catch (IOException e) {
                logger.error("I/O error: {}", e.getMessage(), e);
                return 1;
            }
        }

        private void writeModule(IrModule module, Path output) throws IOException {
            String text = IrPrinter.print(module);
            if (output == null) {
                PrintWriter out = spec.commandLine().getOut();
                out.print(text);
                out.flush();
                return;
            }
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, text.getBytes(StandardCharsets.UTF_8));
            logger.info("Obfuscated IR written to {}", output);
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new ChakravyuhaRunner()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }
}
