package com.cad.dxfcleaner.parser;

import com.cad.dxfcleaner.model.GroupCodePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * State machine over section and table boundaries.
 *
 * Headers are recognized by fixed offsets from their code 0 marker:
 * <pre>
 *   0          &lt;- cursor
 *   SECTION    (or TABLE)
 *   2
 *   ENTITIES   &lt;- name, three lines after the marker
 * </pre>
 * Rules are tried in order: section header, section end, then (inside
 * TABLES only) layer table header and table end. A section with an
 * untracked name moves the tracker to {@link SectionState#NONE}.
 */
public class SectionTracker {
    private static final Logger log = LoggerFactory.getLogger(SectionTracker.class);

    static final String MARKER_CODE = "0";
    static final String SECTION = "SECTION";
    static final String ENDSEC = "ENDSEC";
    static final String TABLE = "TABLE";
    static final String ENDTAB = "ENDTAB";
    static final String LAYER_TABLE_NAME = "LAYER";

    /** Lines between a code 0 marker and the name of the section or table it opens. */
    static final int HEADER_NAME_OFFSET = 3;
    /** Lines making up a section or table header: marker pair plus name pair. */
    static final int HEADER_LINES = 4;
    /** Lines making up a bare end marker pair. */
    static final int END_MARKER_LINES = 2;

    private static final Map<String, SectionState> TRACKED_SECTIONS = Map.of(
            "ENTITIES", SectionState.ENTITIES,
            "BLOCKS", SectionState.BLOCKS,
            "TABLES", SectionState.TABLES
    );

    private SectionState state = SectionState.NONE;

    public SectionState getState() {
        return state;
    }

    /**
     * Applies the first matching transition rule at the cursor position.
     * On a match the cursor is moved past the recognized header or marker.
     *
     * @return true if a structural marker was consumed
     */
    public boolean advance(TokenCursor cursor) {
        Optional<GroupCodePair> marker = cursor.pairAt(0);
        if (marker.isEmpty() || !marker.get().hasCode(MARKER_CODE)) {
            return false;
        }
        String keyword = marker.get().getValue();

        if (SECTION.equals(keyword)) {
            Optional<String> name = cursor.lineAt(HEADER_NAME_OFFSET);
            if (name.isPresent()) {
                enterSection(name.get());
                cursor.advanceLines(HEADER_LINES);
                return true;
            }
        }

        if (ENDSEC.equals(keyword)) {
            transition(SectionState.NONE, ENDSEC);
            cursor.advanceLines(END_MARKER_LINES);
            return true;
        }

        if (state.isWithinTables()) {
            if (TABLE.equals(keyword)
                    && cursor.lineAt(HEADER_NAME_OFFSET).filter(LAYER_TABLE_NAME::equals).isPresent()) {
                transition(SectionState.TABLES_LAYER, "TABLE LAYER");
                cursor.advanceLines(HEADER_LINES);
                return true;
            }
            if (ENDTAB.equals(keyword)) {
                transition(SectionState.TABLES, ENDTAB);
                cursor.advanceLines(END_MARKER_LINES);
                return true;
            }
        }

        return false;
    }

    private void enterSection(String sectionName) {
        SectionState next = TRACKED_SECTIONS.getOrDefault(sectionName, SectionState.NONE);
        transition(next, "SECTION " + sectionName);
    }

    private void transition(SectionState next, String trigger) {
        if (next != state) {
            log.debug("Section state {} -> {} on {}", state, next, trigger);
        }
        state = next;
    }
}
