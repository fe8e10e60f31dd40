package com.tessera.modeling.service;

import com.tessera.modeling.api.exceptions.ModelCompilationException;
import com.tessera.modeling.core.config.EngineConfig;
import com.tessera.modeling.core.telemetry.TracingService;
import com.tessera.modeling.service.report.Diagnostic;
import com.tessera.modeling.service.report.ReportWriter;
import com.tessera.modeling.service.report.SolutionReport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command line: {@code ModelEngineApplication <model-file> [data-file]}.
 *
 * <p>Prints a JSON solution report to stdout and exits 0, whatever the solver status.
 * A compilation failure prints a JSON diagnostic and exits 2; bad arguments or unreadable
 * files exit 1. Logs go to stderr.
 */
public class ModelEngineApplication {
    private static final Logger logger = Logger.getLogger(ModelEngineApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_COMPILATION_FAILED = 2;

    private final EngineConfig config;
    private final ReportWriter reportWriter = new ReportWriter();

    ModelEngineApplication(EngineConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        configureLogging();
        ModelEngineApplication app = new ModelEngineApplication(EngineConfig.fromEnvironment());
        int exitCode = app.run(args, System.out, System.err);
        TracingService.getInstance().shutdown();
        System.exit(exitCode);
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: ModelEngineApplication <model-file> [data-file]");
            return EXIT_USAGE;
        }
        Path modelPath = Paths.get(args[0]);
        Path dataPath = args.length == 2 ? Paths.get(args[1]) : null;
        if (!Files.isRegularFile(modelPath)) {
            err.println("Model file not found: " + modelPath);
            return EXIT_USAGE;
        }
        if (dataPath != null && !Files.isRegularFile(dataPath)) {
            err.println("Data file not found: " + dataPath);
            return EXIT_USAGE;
        }

        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try (ModelEngine engine = ModelEngine.create(config, TracingService.getInstance().getTracer())) {
            logger.info(String.format("Solving %s (parallelism %d, time limit %ds)", modelPath,
                    config.parallelism(), config.solveTimeLimit().toSeconds()));
            SolutionReport report = engine.solve(modelPath, dataPath);
            reportWriter.write(report, writer);
            return EXIT_OK;
        } catch (ModelCompilationException e) {
            logger.warning("Compilation failed: " + e.getMessage());
            return writeDiagnostic(Diagnostic.of(e), writer, err);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read input: " + e.getMessage(), e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int writeDiagnostic(Diagnostic diagnostic, Writer writer, PrintStream err) {
        try {
            reportWriter.write(diagnostic, writer);
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_USAGE;
        }
        return EXIT_COMPILATION_FAILED;
    }

    private static void configureLogging() {
        try (InputStream config = ModelEngineApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
                return;
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }
}
