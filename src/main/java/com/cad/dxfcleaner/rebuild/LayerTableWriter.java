package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.model.CleanDiagnostics;
import com.cad.dxfcleaner.model.DxfLayer;
import com.cad.dxfcleaner.model.GroupCodePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the LAYER table records and closes the table.
 *
 * Layer "0" comes first, then the others in insertion order. Each record
 * starts with a canonical header; captured properties are then replayed in
 * order, skipping any code already written for the record except 100.
 * A plot style handle (390) is appended when none was captured.
 */
public class LayerTableWriter {
    private static final Logger log = LoggerFactory.getLogger(LayerTableWriter.class);

    static final String SUBCLASS_CODE = "100";
    static final String PLOT_STYLE_CODE = "390";
    static final String DEFAULT_PLOT_STYLE = "F";

    public List<DxfLayer> orderLayers(Map<String, DxfLayer> layers) {
        List<DxfLayer> ordered = new ArrayList<>(layers.size());
        DxfLayer defaultLayer = layers.get(DxfLayer.DEFAULT_LAYER_NAME);
        if (defaultLayer != null) {
            ordered.add(defaultLayer);
        }
        for (DxfLayer layer : layers.values()) {
            if (!layer.isDefaultLayer()) {
                ordered.add(layer);
            }
        }
        return ordered;
    }

    /**
     * Handles per layer name. Derived from the name; a clash with a handle
     * already claimed in the registry moves to the next free value. Every
     * assigned handle is claimed.
     */
    public Map<String, String> assignHandles(List<DxfLayer> ordered, HandleRegistry registry,
                                             CleanDiagnostics diagnostics) {
        Map<String, String> handles = new LinkedHashMap<>();

        for (DxfLayer layer : ordered) {
            int derived = LayerHandles.derive(layer.getName());
            int candidate = derived;
            while (registry.isTaken(LayerHandles.toHex(candidate))) {
                candidate = (candidate + 1) % LayerHandles.HANDLE_SPACE;
                if (candidate == derived) {
                    throw new IllegalStateException("No free layer handle left for " + layer.getName());
                }
            }
            String handle = LayerHandles.toHex(candidate);
            if (candidate != derived) {
                String message = String.format("Layer handle %s for '%s' already in use, assigned %s",
                        LayerHandles.toHex(derived), layer.getName(), handle);
                log.warn(message);
                diagnostics.warn(message);
            }
            registry.claim(handle);
            handles.put(layer.getName(), handle);
        }
        return handles;
    }

    public int write(Map<String, DxfLayer> layers, HandleRegistry registry, DxfOutputBuilder out,
                     CleanDiagnostics diagnostics) {
        List<DxfLayer> ordered = orderLayers(layers);
        Map<String, String> handles = assignHandles(ordered, registry, diagnostics);

        for (DxfLayer layer : ordered) {
            writeRecord(layer, handles.get(layer.getName()), out);
        }
        out.pair("0", "ENDTAB");
        return ordered.size();
    }

    void writeRecord(DxfLayer layer, String handle, DxfOutputBuilder out) {
        List<GroupCodePair> canonical = List.of(
                GroupCodePair.of("5", handle),
                GroupCodePair.of("330", StructuralSkeleton.LAYER_TABLE_HANDLE),
                GroupCodePair.of(SUBCLASS_CODE, "AcDbSymbolTableRecord"),
                GroupCodePair.of(SUBCLASS_CODE, "AcDbLayerTableRecord"),
                GroupCodePair.of("2", layer.getName()),
                GroupCodePair.of("70", "0"));

        Set<String> written = new HashSet<>();
        out.pair("0", "LAYER");
        for (GroupCodePair pair : canonical) {
            out.pair(pair);
            written.add(pair.getCode());
        }

        for (GroupCodePair property : layer.getProperties()) {
            if (!written.contains(property.getCode()) || property.hasCode(SUBCLASS_CODE)) {
                out.pair(property);
                written.add(property.getCode());
            } else {
                log.debug("Layer '{}': dropping repeated code {}", layer.getName(), property.getCode());
            }
        }

        if (!written.contains(PLOT_STYLE_CODE)) {
            out.pair(PLOT_STYLE_CODE, DEFAULT_PLOT_STYLE);
        }
    }
}
