package com.cad.dxfcleaner.parser;

/**
 * Structural context the parser is currently in.
 */
public enum SectionState {
    /**
     * Outside any tracked section (HEADER, CLASSES, OBJECTS, or between sections).
     */
    NONE,

    /**
     * Inside the ENTITIES section.
     */
    ENTITIES,

    /**
     * Inside the BLOCKS section. Tracked but not extracted.
     */
    BLOCKS,

    /**
     * Inside the TABLES section, outside the LAYER table.
     */
    TABLES,

    /**
     * Inside the LAYER table of the TABLES section.
     */
    TABLES_LAYER;

    public boolean isWithinTables() {
        return this == TABLES || this == TABLES_LAYER;
    }
}
