package com.cad.dxfcleaner.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Warnings and informational notes accumulated during one cleaning run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class CleanDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }
}
