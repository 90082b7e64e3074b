package com.cad.dxfcleaner.cli.model;

import com.cad.dxfcleaner.model.EntityWhitelist;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Derived values needed by the executor. Keeps CleanCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCleanOptions {
    Path inputFile;
    Path outputDir;
    Path templateDir;
    EntityWhitelist entityWhitelist;
}
