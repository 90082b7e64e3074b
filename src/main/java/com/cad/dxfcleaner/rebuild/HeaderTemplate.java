package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.template.BuiltInTemplates;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Header template split at its layer-table insertion point.
 *
 * The insertion point is the single occurrence of the {@code TABLE/2/LAYER}
 * line sequence.
 * Everything before it is kept; the layer table declaration itself and all
 * text after it are replaced by the regenerated layer table. A header with
 * no marker, or with more than one, cannot be spliced.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HeaderTemplate {

    public static final String LAYER_TABLE_MARKER = "TABLE\n2\nLAYER";

    public enum Layout {
        /**
         * Exactly one marker; the layer table is inserted there.
         */
        SPLICEABLE,

        /**
         * No usable marker, but the text is the built-in minimal header whose
         * layer count placeholder can be patched in place.
         */
        MINIMAL_BUILT_IN,

        /**
         * No usable marker; the text is emitted unmodified.
         */
        OPAQUE
    }

    String text;
    Layout layout;
    int markerCount;

    public static HeaderTemplate of(String text) {
        int markers = countMarkers(text);
        Layout layout;
        if (markers == 1) {
            layout = Layout.SPLICEABLE;
        } else if (BuiltInTemplates.isMinimalHeader(text)) {
            layout = Layout.MINIMAL_BUILT_IN;
        } else {
            layout = Layout.OPAQUE;
        }
        return new HeaderTemplate(text, layout, markers);
    }

    /**
     * Text preceding the insertion point.
     *
     * @throws IllegalStateException if the template is not spliceable
     */
    public String getPrefix() {
        if (layout != Layout.SPLICEABLE) {
            throw new IllegalStateException("Header template has no single layer table marker");
        }
        return text.substring(0, text.indexOf(LAYER_TABLE_MARKER));
    }

    private static int countMarkers(String text) {
        int count = 0;
        int from = 0;
        int at;
        while ((at = text.indexOf(LAYER_TABLE_MARKER, from)) >= 0) {
            count++;
            from = at + LAYER_TABLE_MARKER.length();
        }
        return count;
    }
}
