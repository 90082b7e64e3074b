package com.cad.dxfcleaner.service;

import com.cad.dxfcleaner.rebuild.HeaderTemplate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a cleaning run.
 */
@Value
@Builder
public class CleanResult {
    boolean success;
    String errorMessage;
    Path outputPath;
    String content;

    int layersParsed;
    int entitiesParsed;
    int handlesSynthesized;
    HeaderTemplate.Layout headerLayout;
    boolean builtInHeader;
    boolean builtInFooter;

    @Singular
    List<String> warnings;

    @Singular
    List<String> infos;

    public static CleanResult failure(String errorMessage) {
        return CleanResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
