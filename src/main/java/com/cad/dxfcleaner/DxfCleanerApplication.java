package com.cad.dxfcleaner;

import com.cad.dxfcleaner.cli.CleanCommand;
import picocli.CommandLine;

/**
 * Main entry point for the DXF Cleaner.
 * Reads one DXF drawing, keeps its layers and whitelisted entities, and writes
 * a normalized copy with regenerated table and block scaffolding.
 */
public class DxfCleanerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CleanCommand()).execute(args);
        System.exit(exitCode);
    }
}
