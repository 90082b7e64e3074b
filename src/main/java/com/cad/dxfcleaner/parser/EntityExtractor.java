package com.cad.dxfcleaner.parser;

import com.cad.dxfcleaner.model.DxfEntity;
import com.cad.dxfcleaner.model.GroupCodePair;

/**
 * Reads one entity record from the ENTITIES section.
 *
 * The cursor must sit on the {@code 0/<kind>} marker. Every following pair up
 * to the next code 0 is kept verbatim and in order.
 */
public class EntityExtractor {

    public DxfEntity extract(TokenCursor cursor) {
        DxfEntity.DxfEntityBuilder entity = DxfEntity.builder()
                .kind(cursor.current().getValue());
        cursor.advancePair();

        while (cursor.hasPair()) {
            GroupCodePair pair = cursor.current();
            if (pair.hasCode(SectionTracker.MARKER_CODE)) {
                break;
            }
            entity.property(pair);
            cursor.advancePair();
        }
        return entity.build();
    }

    /**
     * Moves past a record that is not kept, leaving the cursor on the next code 0.
     */
    public void skip(TokenCursor cursor) {
        cursor.advancePair();
        while (cursor.hasPair() && !cursor.current().hasCode(SectionTracker.MARKER_CODE)) {
            cursor.advancePair();
        }
    }
}
