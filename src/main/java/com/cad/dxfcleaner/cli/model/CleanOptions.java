package com.cad.dxfcleaner.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;

/**
 * Holds all CLI options for the clean command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CleanOptions {

	@Parameters(index = "0", arity = "1", paramLabel = "<input>", description = "DXF file to clean")
	private Path inputFile;

	@Option(names = { "--output-dir", "-o" }, defaultValue = "Output",
			description = "Directory for the cleaned file (default: ${DEFAULT-VALUE})")
	private Path outputDir;

	@Option(names = { "--template-dir", "-t" },
			description = "Directory holding dxf_header_header.txt and dxf_footer.txt (defaults to current directory)")
	private Path templateDir;

	@Option(names = { "--entity-types", "-e" }, split = ",", defaultValue = "LINE,CIRCLE,ARC",
			description = "Comma-separated entity kinds to keep (default: ${DEFAULT-VALUE})")
	private List<String> entityTypes;

	@Option(names = { "--handle-start" }, defaultValue = "50",
			description = "First synthesized entity handle, decimal (default: ${DEFAULT-VALUE})")
	private int handleStart;

	@Option(names = { "--dry-run" }, description = "Parse and rebuild without writing the output file")
	private boolean dryRun;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

}
