package com.cad.dxfcleaner.template;

import java.util.Optional;

/**
 * Supplies the header and footer blobs. An empty result means the template
 * is unavailable and the caller falls back to {@link BuiltInTemplates}.
 */
public interface TemplateLoader {

    Optional<String> loadHeader();

    Optional<String> loadFooter();
}
