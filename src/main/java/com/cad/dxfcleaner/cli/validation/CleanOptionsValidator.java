package com.cad.dxfcleaner.cli.validation;

import com.cad.dxfcleaner.cli.exception.OptionsValidationException;
import com.cad.dxfcleaner.cli.model.CleanOptions;
import com.cad.dxfcleaner.cli.model.ValidatedCleanOptions;
import com.cad.dxfcleaner.model.EntityWhitelist;
import com.cad.dxfcleaner.service.OutputPathResolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class CleanOptionsValidator {

	static final String DXF_EXTENSION = ".dxf";

	public ValidatedCleanOptions validate(CleanOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = o.getInputFile();
		if (input == null) {
			errors.add("An input DXF file is required.");
		} else if (!Files.isRegularFile(input)) {
			errors.add("Input file '" + input + "' not found");
		} else if (!input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(DXF_EXTENSION)) {
			errors.add("Input file must be a DXF file: " + input);
		}

		if (o.getTemplateDir() != null && !Files.isDirectory(o.getTemplateDir())) {
			errors.add("Template directory does not exist or is not a directory: " + o.getTemplateDir());
		}

		if (o.getHandleStart() < 1) {
			errors.add("Handle start must be >= 1. Got: " + o.getHandleStart());
		}

		EntityWhitelist whitelist = null;
		try {
			whitelist = EntityWhitelist.of(o.getEntityTypes() == null ? List.of() : o.getEntityTypes());
		} catch (IllegalArgumentException e) {
			errors.add(e.getMessage() + " (--entity-types / -e).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path normalizedInput = input.toAbsolutePath().normalize();
		Path outputDir = (o.getOutputDir() == null ? Path.of(OutputPathResolver.DEFAULT_OUTPUT_DIR) : o.getOutputDir()).toAbsolutePath()
				.normalize();
		Path templateDir = (o.getTemplateDir() == null ? Path.of(".") : o.getTemplateDir()).toAbsolutePath()
				.normalize();

		return new ValidatedCleanOptions(normalizedInput, outputDir, templateDir, whitelist);
	}
}
