package com.cad.dxfcleaner.template;

/**
 * Minimal header and footer used when the template files are unavailable.
 */
public class BuiltInTemplates {

    /** Comment line that identifies the built-in header. */
    public static final String HEADER_SIGNATURE = "DXF Cleaner Generated File";

    static final String MINIMAL_HEADER = "minimal-header.ftl";
    static final String MINIMAL_FOOTER = "minimal-footer.ftl";

    private final TemplateRenderer renderer;

    public BuiltInTemplates(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    public String minimalHeader() {
        return renderer.render(MINIMAL_HEADER);
    }

    public String minimalFooter() {
        return renderer.render(MINIMAL_FOOTER);
    }

    public static boolean isMinimalHeader(String header) {
        return header.contains(HEADER_SIGNATURE);
    }
}
