package com.cad.dxfcleaner.service;

import java.nio.file.Path;

/**
 * Derives the cleaned file name: the input stem plus a fixed suffix, placed
 * in the output directory.
 */
public class OutputPathResolver {

    public static final String DEFAULT_OUTPUT_DIR = "Output";
    public static final String DEFAULT_SUFFIX = "_cleaned.dxf";

    public Path resolve(Path inputFile, Path outputDir, String suffix) {
        String fileName = inputFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return outputDir.resolve(stem + suffix);
    }
}
