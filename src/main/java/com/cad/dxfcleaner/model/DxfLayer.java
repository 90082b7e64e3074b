package com.cad.dxfcleaner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * A LAYER table record.
 *
 * Properties exclude the codes the rebuild regenerates canonically
 * (handle, owner, subclass markers, flags). Color, line type and line
 * weight are read-only views over the properties; serialization replays
 * the properties and never consults them.
 */
@Value
@Builder
public class DxfLayer {
    public static final String DEFAULT_LAYER_NAME = "0";

    /** Codes dropped at capture time because the rebuild regenerates them. */
    public static final Set<String> REGENERATED_CODES = Set.of("5", "330", "100", "70");

    static final String DEFAULT_COLOR = "7";
    static final String DEFAULT_LINE_TYPE = "CONTINUOUS";
    static final String DEFAULT_LINE_WEIGHT = "0";

    @NonNull
    String name;

    @Singular
    List<GroupCodePair> properties;

    public static DxfLayer defaultLayer() {
        return DxfLayer.builder().name(DEFAULT_LAYER_NAME).build();
    }

    public String getColor() {
        return lastValueOf("62", DEFAULT_COLOR);
    }

    public String getLineType() {
        return lastValueOf("6", DEFAULT_LINE_TYPE);
    }

    public String getLineWeight() {
        return lastValueOf("370", DEFAULT_LINE_WEIGHT);
    }

    public boolean isDefaultLayer() {
        return DEFAULT_LAYER_NAME.equals(name);
    }

    private String lastValueOf(String code, String fallback) {
        String value = fallback;
        for (GroupCodePair property : properties) {
            if (property.hasCode(code)) {
                value = property.getValue();
            }
        }
        return value;
    }
}
