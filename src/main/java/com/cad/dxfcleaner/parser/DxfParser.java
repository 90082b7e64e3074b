package com.cad.dxfcleaner.parser;

import com.cad.dxfcleaner.model.CleanDiagnostics;
import com.cad.dxfcleaner.model.DxfLayer;
import com.cad.dxfcleaner.model.EntityWhitelist;
import com.cad.dxfcleaner.model.GroupCodePair;
import com.cad.dxfcleaner.model.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Parser for DXF code/value line streams.
 * Collects LAYER table records and whitelisted entities into a {@link ParseResult}.
 *
 * Parsing only:
 * - Tracks section and table context
 * - Captures layer and entity records
 * - Reports diagnostics
 *
 * It does NOT regenerate handles or emit output.
 */
public class DxfParser {
    private static final Logger log = LoggerFactory.getLogger(DxfParser.class);

    static final String LAYER_RECORD = "LAYER";

    private final EntityWhitelist whitelist;
    private final LayerExtractor layerExtractor = new LayerExtractor();
    private final EntityExtractor entityExtractor = new EntityExtractor();

    public DxfParser(EntityWhitelist whitelist) {
        this.whitelist = whitelist;
    }

    public ParseResult parse(List<String> lines, CleanDiagnostics diagnostics) {
        TokenCursor cursor = new TokenCursor(lines);
        SectionTracker tracker = new SectionTracker();
        ParseResult result = new ParseResult();
        Map<String, Integer> skippedKinds = new TreeMap<>();
        int namelessLayers = 0;

        while (cursor.hasPair()) {
            if (tracker.advance(cursor)) {
                continue;
            }

            GroupCodePair pair = cursor.current();
            if (!pair.hasCode(SectionTracker.MARKER_CODE)) {
                cursor.advancePair();
                continue;
            }

            SectionState state = tracker.getState();
            if (state == SectionState.TABLES_LAYER && pair.getValue().equals(LAYER_RECORD)) {
                Optional<DxfLayer> layer = layerExtractor.extract(cursor);
                if (layer.isPresent()) {
                    result.addLayer(layer.get());
                } else {
                    namelessLayers++;
                }
            } else if (state == SectionState.ENTITIES) {
                if (whitelist.allows(pair.getValue())) {
                    result.addEntity(entityExtractor.extract(cursor));
                } else {
                    skippedKinds.merge(pair.getValue(), 1, Integer::sum);
                    entityExtractor.skip(cursor);
                }
            } else {
                cursor.advancePair();
            }
        }

        if (cursor.getPosition() < cursor.getLineCount()) {
            log.debug("Ignoring unpaired trailing line {}", cursor.getPosition() + 1);
        }
        if (namelessLayers > 0) {
            diagnostics.info("Discarded " + namelessLayers + " LAYER record(s) without a name");
        }
        if (!skippedKinds.isEmpty()) {
            log.debug("Skipped entity kinds outside the whitelist: {}", skippedKinds);
            diagnostics.info("Skipped entities outside the whitelist: " + skippedKinds);
        }
        if (result.ensureDefaultLayer()) {
            log.debug("Layer {} not declared, synthesized an empty one", DxfLayer.DEFAULT_LAYER_NAME);
        }

        log.info("Parsed {} layers and {} entities", result.getLayerCount(), result.getEntityCount());
        return result;
    }
}
