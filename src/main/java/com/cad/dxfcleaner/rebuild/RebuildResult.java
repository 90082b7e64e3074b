package com.cad.dxfcleaner.rebuild;

import lombok.Builder;
import lombok.Value;

/**
 * Rebuilt drawing text and what went into it.
 */
@Value
@Builder
public class RebuildResult {
    String content;
    HeaderTemplate.Layout headerLayout;
    int layersWritten;
    int entitiesWritten;
    int handlesSynthesized;
}
