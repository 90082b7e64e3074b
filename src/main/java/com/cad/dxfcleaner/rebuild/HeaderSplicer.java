package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.model.CleanDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the header template with the canonical LAYER table opening spliced in.
 *
 * When the template cannot be spliced the output degrades instead of failing:
 * the built-in minimal header gets its layer count placeholder patched, any
 * other template is emitted unmodified. Both cases are reported as warnings.
 */
public class HeaderSplicer {
    private static final Logger log = LoggerFactory.getLogger(HeaderSplicer.class);

    /** Layer count as written in the built-in minimal header. */
    static final String MINIMAL_LAYER_COUNT_PLACEHOLDER = "70\n1";

    private final StructuralSkeleton skeleton;

    public HeaderSplicer(StructuralSkeleton skeleton) {
        this.skeleton = skeleton;
    }

    public HeaderTemplate.Layout splice(String headerText, int layerCount, DxfOutputBuilder out,
                                        CleanDiagnostics diagnostics) {
        HeaderTemplate header = HeaderTemplate.of(headerText);

        switch (header.getLayout()) {
            case SPLICEABLE -> {
                out.raw(header.getPrefix());
                out.raw(skeleton.layerTableOpening(layerCount));
            }
            case MINIMAL_BUILT_IN -> {
                reportFallback(header, diagnostics, "patching the built-in layer count");
                out.raw(header.getText().replace(MINIMAL_LAYER_COUNT_PLACEHOLDER, "70\n" + layerCount));
                out.ensureLineBreak();
            }
            case OPAQUE -> {
                reportFallback(header, diagnostics, "using the full template unmodified");
                out.raw(header.getText());
                out.ensureLineBreak();
            }
        }
        return header.getLayout();
    }

    private void reportFallback(HeaderTemplate header, CleanDiagnostics diagnostics, String action) {
        String message = String.format(
                "Header template format unexpected: found %d LAYER table marker(s), expected exactly 1; %s",
                header.getMarkerCount(), action);
        log.warn(message);
        diagnostics.warn(message);
    }
}
