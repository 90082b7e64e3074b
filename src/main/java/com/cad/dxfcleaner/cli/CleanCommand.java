package com.cad.dxfcleaner.cli;

import ch.qos.logback.classic.Level;
import com.cad.dxfcleaner.cli.exception.OptionsValidationException;
import com.cad.dxfcleaner.cli.model.CleanOptions;
import com.cad.dxfcleaner.cli.model.ValidatedCleanOptions;
import com.cad.dxfcleaner.cli.output.CleanResultsPrinter;
import com.cad.dxfcleaner.cli.validation.CleanOptionsValidator;
import com.cad.dxfcleaner.service.CleanResult;
import com.cad.dxfcleaner.service.CleanerConfig;
import com.cad.dxfcleaner.service.DxfCleanerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command that cleans a single DXF file.
 */
@Command(
        name = "dxf-cleaner",
        mixinStandardHelpOptions = true,
        version = "dxf-cleaner 1.0.0",
        description = "Extracts layers and entities from a DXF file and rebuilds a clean, self-consistent drawing."
)
public class CleanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanCommand.class);

    static final String BASE_PACKAGE = "com.cad.dxfcleaner";

    @Mixin
    private CleanOptions options = new CleanOptions();

    private final CleanOptionsValidator validator = new CleanOptionsValidator();
    private final CleanResultsPrinter printer = new CleanResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedCleanOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("Error: {}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        CleanerConfig config = CleanerConfig.builder()
                .inputFile(validated.getInputFile())
                .outputDir(validated.getOutputDir())
                .templateDir(validated.getTemplateDir())
                .entityWhitelist(validated.getEntityWhitelist())
                .entityHandleStart(options.getHandleStart())
                .dryRun(options.isDryRun())
                .build();

        try {
            CleanResult result = new DxfCleanerService(config).clean();
            if (!result.isSuccess()) {
                printer.printFailure(options, result);
                return 1;
            }
            printer.printSuccess(options, result);
            return 0;
        } catch (RuntimeException e) {
            log.error("Cleaning failed with exception", e);
            return 1;
        }
    }

    private void enableDebugLogging() {
        Logger appLogger = LoggerFactory.getLogger(BASE_PACKAGE);
        if (appLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
