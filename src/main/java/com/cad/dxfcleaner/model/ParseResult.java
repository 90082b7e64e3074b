package com.cad.dxfcleaner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layers and entities captured from one drawing.
 *
 * Layers are keyed by name in insertion order; a later record with the same
 * name replaces the earlier one but keeps its position. Layer "0" is always
 * present once {@link #ensureDefaultLayer()} has run.
 */
public class ParseResult {
    private final Map<String, DxfLayer> layers = new LinkedHashMap<>();
    private final List<DxfEntity> entities = new ArrayList<>();

    public void addLayer(DxfLayer layer) {
        layers.put(layer.getName(), layer);
    }

    public void addEntity(DxfEntity entity) {
        entities.add(entity);
    }

    /**
     * Synthesizes an empty layer "0" when the source never declared one.
     *
     * @return true if a layer was synthesized
     */
    public boolean ensureDefaultLayer() {
        if (layers.containsKey(DxfLayer.DEFAULT_LAYER_NAME)) {
            return false;
        }
        layers.put(DxfLayer.DEFAULT_LAYER_NAME, DxfLayer.defaultLayer());
        return true;
    }

    public Optional<DxfLayer> findLayer(String name) {
        return Optional.ofNullable(layers.get(name));
    }

    public Map<String, DxfLayer> getLayers() {
        return Collections.unmodifiableMap(layers);
    }

    public List<DxfEntity> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public int getLayerCount() {
        return layers.size();
    }

    public int getEntityCount() {
        return entities.size();
    }
}
