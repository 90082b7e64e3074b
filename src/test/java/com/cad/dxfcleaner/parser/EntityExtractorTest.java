package com.cad.dxfcleaner.parser;

import com.cad.dxfcleaner.model.DxfEntity;
import com.cad.dxfcleaner.model.GroupCodePair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for EntityExtractor.
 */
class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Test
    void testCapturesEveryPairInOrder() {
        TokenCursor cursor = new TokenCursor(List.of(
                "0", "CIRCLE",
                "5", "2F",
                "100", "AcDbEntity",
                "8", "Holes",
                "100", "AcDbCircle",
                "10", "5.0",
                "20", "5.0",
                "40", "1.5",
                "0", "ENDSEC"));

        DxfEntity entity = extractor.extract(cursor);

        assertThat(entity.getKind()).isEqualTo("CIRCLE");
        assertThat(entity.getProperties()).extracting(GroupCodePair::getCode)
                .containsExactly("5", "100", "8", "100", "10", "20", "40");
        assertThat(entity.getLayer()).isEqualTo("Holes");
        assertThat(cursor.current()).isEqualTo(GroupCodePair.of("0", "ENDSEC"));
    }

    @Test
    void testLayerFollowsLastCode8() {
        TokenCursor cursor = new TokenCursor(List.of(
                "0", "LINE", "8", "A", "10", "0", "8", "B"));

        DxfEntity entity = extractor.extract(cursor);

        assertThat(entity.getLayer()).isEqualTo("B");
        assertThat(entity.getProperties()).hasSize(3);
    }

    @Test
    void testLayerDefaultsToZero() {
        TokenCursor cursor = new TokenCursor(List.of("0", "ARC", "40", "2.0"));

        assertThat(extractor.extract(cursor).getLayer()).isEqualTo("0");
    }

    @Test
    void testSkipLeavesCursorOnNextRecord() {
        TokenCursor cursor = new TokenCursor(List.of(
                "0", "TEXT", "1", "hello", "8", "Notes", "0", "LINE"));

        extractor.skip(cursor);

        assertThat(cursor.current()).isEqualTo(GroupCodePair.of("0", "LINE"));
    }
}
