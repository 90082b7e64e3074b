package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.template.TemplateRenderer;

import java.util.Map;
import java.util.Set;

/**
 * Fixed structure written around the captured records: the canonical LAYER
 * table opening and the constant STYLE, VIEW, UCS, APPID, DIMSTYLE and
 * BLOCK_RECORD tables followed by the BLOCKS section and the ENTITIES header.
 * None of it is derived from the input.
 */
public class StructuralSkeleton {

    static final String LAYER_TABLE_OPENING = "layer-table-open.ftl";
    static final String TABLES_AND_BLOCKS = "structural-skeleton.ftl";

    /** Handle of the LAYER table itself; owner of every layer record. */
    public static final String LAYER_TABLE_HANDLE = "2";

    /**
     * Handles fixed by the skeleton and the built-in header and footer.
     * Regenerated layer handles steer clear of these.
     */
    public static final Set<String> RESERVED_HANDLES = Set.of(
            "1", "2", "3", "5", "6", "7", "8", "9", "A", "C", "D",
            "12", "14", "15", "16", "1C", "1D", "1E", "1F", "20", "21",
            "31", "4A", "4C", "55");

    private final TemplateRenderer renderer;
    private String tablesAndBlocks;

    public StructuralSkeleton(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Lines from {@code TABLE} through the layer count, ready to follow a
     * header prefix that ends with the table's code 0 marker.
     */
    public String layerTableOpening(int layerCount) {
        return renderer.render(LAYER_TABLE_OPENING, Map.of("layerCount", layerCount));
    }

    public String tablesAndBlocks() {
        if (tablesAndBlocks == null) {
            tablesAndBlocks = renderer.render(TABLES_AND_BLOCKS);
        }
        return tablesAndBlocks;
    }
}
