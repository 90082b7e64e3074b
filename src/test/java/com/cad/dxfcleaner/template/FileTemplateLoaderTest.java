package com.cad.dxfcleaner.template;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FileTemplateLoader.
 */
class FileTemplateLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadsDefaultFileNames() throws Exception {
        Files.writeString(tempDir.resolve(FileTemplateLoader.DEFAULT_HEADER_FILE), "999\nheader\n0\nTABLE\n2\nLAYER");
        Files.writeString(tempDir.resolve(FileTemplateLoader.DEFAULT_FOOTER_FILE), "ENDSEC\n0\nEOF");

        FileTemplateLoader loader = new FileTemplateLoader(tempDir);

        assertThat(loader.loadHeader()).contains("999\nheader\n0\nTABLE\n2\nLAYER");
        assertThat(loader.loadFooter()).contains("ENDSEC\n0\nEOF");
    }

    @Test
    void testNormalizesWindowsLineEndings() throws Exception {
        Path header = tempDir.resolve("header.txt");
        Files.write(header, "0\r\nTABLE\r\n2\r\nLAYER\r\n".getBytes(StandardCharsets.UTF_8));

        FileTemplateLoader loader = new FileTemplateLoader(header, tempDir.resolve("footer.txt"));

        assertThat(loader.loadHeader()).contains("0\nTABLE\n2\nLAYER\n");
    }

    @Test
    void testMissingFilesAreEmpty() {
        FileTemplateLoader loader = new FileTemplateLoader(tempDir.resolve("nowhere"));

        assertThat(loader.loadHeader()).isEmpty();
        assertThat(loader.loadFooter()).isEmpty();
    }

    @Test
    void testDirectoryInPlaceOfFileIsEmpty() throws Exception {
        Files.createDirectory(tempDir.resolve(FileTemplateLoader.DEFAULT_HEADER_FILE));

        assertThat(new FileTemplateLoader(tempDir).loadHeader()).isEmpty();
    }

    @Test
    void testNormalizeLineEndings() {
        assertThat(FileTemplateLoader.normalizeLineEndings("a\r\nb\rc\nd")).isEqualTo("a\nb\nc\nd");
    }
}
