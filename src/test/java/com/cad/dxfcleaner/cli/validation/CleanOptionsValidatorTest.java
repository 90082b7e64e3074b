package com.cad.dxfcleaner.cli.validation;

import com.cad.dxfcleaner.cli.exception.OptionsValidationException;
import com.cad.dxfcleaner.cli.model.CleanOptions;
import com.cad.dxfcleaner.cli.model.ValidatedCleanOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CleanOptionsValidator.
 */
class CleanOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final CleanOptionsValidator validator = new CleanOptionsValidator();
    private Path input;

    @BeforeEach
    void setUp() throws Exception {
        input = Files.writeString(tempDir.resolve("plan.DXF"), "0\nEOF\n");
    }

    @Test
    void testDefaultsAreNormalized() {
        ValidatedCleanOptions validated = validator.validate(parse(input.toString()));

        assertThat(validated.getInputFile()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getOutputDir()).isEqualTo(Path.of("Output").toAbsolutePath().normalize());
        assertThat(validated.getTemplateDir()).isEqualTo(Path.of(".").toAbsolutePath().normalize());
        assertThat(validated.getEntityWhitelist().getKinds()).containsExactlyInAnyOrder("LINE", "CIRCLE", "ARC");
    }

    @Test
    void testExplicitOptions() {
        ValidatedCleanOptions validated = validator.validate(parse(
                input.toString(), "-o", tempDir.resolve("out").toString(), "-t", tempDir.toString(),
                "-e", "line, lwpolyline"));

        assertThat(validated.getOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
        assertThat(validated.getTemplateDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(validated.getEntityWhitelist().getKinds()).containsExactlyInAnyOrder("LINE", "LWPOLYLINE");
    }

    @Test
    void testMissingInputFile() {
        Path missing = tempDir.resolve("missing.dxf");

        assertThatThrownBy(() -> validator.validate(parse(missing.toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e ->
                        assertThat(e.getErrors()).containsExactly("Input file '" + missing + "' not found"));
    }

    @Test
    void testWrongExtension() throws Exception {
        Path text = Files.writeString(tempDir.resolve("plan.txt"), "0\nEOF\n");

        assertThatThrownBy(() -> validator.validate(parse(text.toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e ->
                        assertThat(e.getErrors()).containsExactly("Input file must be a DXF file: " + text));
    }

    @Test
    void testCollectsAllErrors() {
        CleanOptions options = parse(input.toString(), "-t", tempDir.resolve("none").toString(),
                "--handle-start", "0", "-e", " , ");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(3)
                        .anyMatch(error -> error.startsWith("Template directory does not exist"))
                        .contains("Handle start must be >= 1. Got: 0")
                        .anyMatch(error -> error.endsWith("(--entity-types / -e).")));
    }

    private static CleanOptions parse(String... args) {
        CleanOptions options = new CleanOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
