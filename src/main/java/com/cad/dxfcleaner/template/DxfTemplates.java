package com.cad.dxfcleaner.template;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The two opaque text blobs wrapped around the rebuilt content.
 *
 * The header is expected to stop inside the TABLES section at the LAYER
 * table declaration; the footer is appended after a closing code 0 and must
 * close every section it opens, ending with EOF.
 */
@Value
@Builder
public class DxfTemplates {
    @NonNull
    String header;

    @NonNull
    String footer;

    boolean builtInHeader;
    boolean builtInFooter;
}
