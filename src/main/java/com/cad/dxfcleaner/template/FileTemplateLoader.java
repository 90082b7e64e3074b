package com.cad.dxfcleaner.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads header and footer templates from a directory.
 *
 * Line endings are normalized to {@code \n} so the layer-table marker in the
 * header matches regardless of the platform the file was written on.
 */
public class FileTemplateLoader implements TemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(FileTemplateLoader.class);

    public static final String DEFAULT_HEADER_FILE = "dxf_header_header.txt";
    public static final String DEFAULT_FOOTER_FILE = "dxf_footer.txt";

    private final Path headerPath;
    private final Path footerPath;

    public FileTemplateLoader(Path templateDir) {
        this(templateDir.resolve(DEFAULT_HEADER_FILE), templateDir.resolve(DEFAULT_FOOTER_FILE));
    }

    public FileTemplateLoader(Path headerPath, Path footerPath) {
        this.headerPath = headerPath;
        this.footerPath = footerPath;
    }

    @Override
    public Optional<String> loadHeader() {
        return load(headerPath, "Header");
    }

    @Override
    public Optional<String> loadFooter() {
        return load(footerPath, "Footer");
    }

    private Optional<String> load(Path path, String label) {
        if (!Files.isRegularFile(path)) {
            log.debug("{} template not found at {}", label, path.toAbsolutePath());
            return Optional.empty();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("Loaded {} template from {}", label.toLowerCase(), path);
            return Optional.of(normalizeLineEndings(content));
        } catch (IOException e) {
            log.warn("{} template at {} could not be read: {}", label, path.toAbsolutePath(), e.getMessage());
            return Optional.empty();
        }
    }

    static String normalizeLineEndings(String content) {
        return content.replace("\r\n", "\n").replace('\r', '\n');
    }
}
