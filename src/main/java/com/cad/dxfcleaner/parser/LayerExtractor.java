package com.cad.dxfcleaner.parser;

import com.cad.dxfcleaner.model.DxfLayer;
import com.cad.dxfcleaner.model.GroupCodePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads one LAYER record from inside the LAYER table.
 *
 * The cursor must sit on the {@code 0/LAYER} marker. Pairs are consumed up to,
 * but not including, the next code 0. Code 2 names the layer (last one wins);
 * codes the rebuild regenerates are dropped; everything else is kept in order.
 */
public class LayerExtractor {
    private static final Logger log = LoggerFactory.getLogger(LayerExtractor.class);

    static final String NAME_CODE = "2";

    /**
     * @return the layer, or empty when the record carries no name
     */
    public Optional<DxfLayer> extract(TokenCursor cursor) {
        int startLine = cursor.getPosition() + 1;
        cursor.advancePair();

        String name = null;
        List<GroupCodePair> properties = new ArrayList<>();

        while (cursor.hasPair()) {
            GroupCodePair pair = cursor.current();
            if (pair.hasCode(SectionTracker.MARKER_CODE)) {
                break;
            }
            if (pair.hasCode(NAME_CODE)) {
                name = pair.getValue();
            } else if (!DxfLayer.REGENERATED_CODES.contains(pair.getCode())) {
                properties.add(pair);
            }
            cursor.advancePair();
        }

        if (name == null) {
            log.debug("Discarding LAYER record without a name at line {}", startLine);
            return Optional.empty();
        }

        return Optional.of(DxfLayer.builder()
                .name(name)
                .properties(properties)
                .build());
    }
}
