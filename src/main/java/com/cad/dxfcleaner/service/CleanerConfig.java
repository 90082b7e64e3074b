package com.cad.dxfcleaner.service;

import com.cad.dxfcleaner.model.EntityWhitelist;
import com.cad.dxfcleaner.rebuild.EntityHandleAllocator;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Settings for one cleaning run.
 */
@Value
@Builder
public class CleanerConfig {

    /**
     * Source drawing.
     */
    @NonNull
    Path inputFile;

    /**
     * Directory receiving the cleaned drawing; created when absent.
     */
    @Builder.Default
    Path outputDir = Path.of(OutputPathResolver.DEFAULT_OUTPUT_DIR);

    /**
     * Replaces the input extension in the output file name.
     */
    @Builder.Default
    String outputSuffix = OutputPathResolver.DEFAULT_SUFFIX;

    /**
     * Directory holding the header and footer template files.
     */
    @Builder.Default
    Path templateDir = Path.of(".");

    /**
     * Entity kinds kept from the ENTITIES section.
     */
    @Builder.Default
    EntityWhitelist entityWhitelist = EntityWhitelist.defaults();

    /**
     * First value of the synthesized entity handle counter (decimal).
     */
    @Builder.Default
    int entityHandleStart = EntityHandleAllocator.DEFAULT_START;

    /**
     * Build the output but do not write it.
     */
    boolean dryRun;
}
