package com.cad.dxfcleaner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A drawable record captured from the ENTITIES section.
 *
 * Properties keep the exact encounter order of the source. The layer is
 * derived from the last group code 8 seen, defaulting to layer "0".
 */
@Value
@Builder(toBuilder = true)
public class DxfEntity {
    public static final String HANDLE_CODE = "5";
    public static final String LAYER_CODE = "8";
    public static final String DEFAULT_LAYER = "0";

    @NonNull
    String kind;

    @Singular
    List<GroupCodePair> properties;

    public String getLayer() {
        String layer = DEFAULT_LAYER;
        for (GroupCodePair property : properties) {
            if (property.hasCode(LAYER_CODE)) {
                layer = property.getValue();
            }
        }
        return layer;
    }

    public boolean hasHandle() {
        return getHandle().isPresent();
    }

    /**
     * First captured handle (code 5), if any.
     */
    public Optional<String> getHandle() {
        return properties.stream()
                .filter(p -> p.hasCode(HANDLE_CODE))
                .map(GroupCodePair::getValue)
                .findFirst();
    }

    /**
     * Returns a copy whose first property is the given handle. The captured
     * properties follow unchanged.
     */
    public DxfEntity withLeadingHandle(String handle) {
        List<GroupCodePair> withHandle = new ArrayList<>(properties.size() + 1);
        withHandle.add(GroupCodePair.of(HANDLE_CODE, handle));
        withHandle.addAll(properties);
        return toBuilder()
                .clearProperties()
                .properties(withHandle)
                .build();
    }
}
