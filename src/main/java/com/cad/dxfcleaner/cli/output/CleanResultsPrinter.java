package com.cad.dxfcleaner.cli.output;

import com.cad.dxfcleaner.cli.model.CleanOptions;
import com.cad.dxfcleaner.cli.model.ValidatedCleanOptions;
import com.cad.dxfcleaner.service.CleanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible only for printing CLI output for the clean command.
 * No validation, no execution.
 */
public class CleanResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CleanResultsPrinter.class);

    public void printBanner(CleanOptions o, ValidatedCleanOptions v) {
        log.info("=================================================");
        log.info("DXF Cleaner");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile());
        log.info("Output Directory: {}", v.getOutputDir());
        log.info("Template Directory: {}", v.getTemplateDir());
        log.info("Entity Types: {}", String.join(", ", v.getEntityWhitelist().getKinds()));
        log.info("Handle Start: {}", o.getHandleStart());
        if (o.isDryRun()) {
            log.info("Dry Run: no file will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(CleanOptions o, CleanResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CLEANING SUCCESSFUL");
        log.info("=================================================");
        log.info("Layers: {}", result.getLayersParsed());
        log.info("Entities: {}", result.getEntitiesParsed());
        log.info("Handles Synthesized: {}", result.getHandlesSynthesized());
        log.info("Header Template: {}{}", result.getHeaderLayout(), result.isBuiltInHeader() ? " (built-in)" : "");
        log.info("Footer Template: {}", result.isBuiltInFooter() ? "built-in" : "file");

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings:");
            result.getWarnings().forEach(w -> log.info("  {}", w));
        }

        if (!result.getInfos().isEmpty()) {
            log.info("");
            log.info("Notes:");
            result.getInfos().forEach(n -> log.info("  {}", n));
        }

        log.info("");
        if (o.isDryRun()) {
            log.info("Output Path (not written): {}", result.getOutputPath());
        } else {
            log.info("Output Path: {}", result.getOutputPath());
        }
        log.info("Cleaning of {} completed successfully!", o.getInputFile().getFileName());
        log.info("=================================================");
    }

    public void printFailure(CleanOptions o, CleanResult result) {
        log.error("Cleaning of {} failed: {}", o.getInputFile().getFileName(), result.getErrorMessage());
    }
}
