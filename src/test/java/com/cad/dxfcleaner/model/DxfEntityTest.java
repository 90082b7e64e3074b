package com.cad.dxfcleaner.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DxfEntity.
 */
class DxfEntityTest {

    @Test
    void testWithLeadingHandlePrependsAndLeavesOriginalUntouched() {
        DxfEntity original = DxfEntity.builder()
                .kind("LINE")
                .property(GroupCodePair.of("8", "Walls"))
                .property(GroupCodePair.of("10", "0.0"))
                .build();

        DxfEntity handled = original.withLeadingHandle("32");

        assertThat(handled.getProperties()).containsExactly(
                GroupCodePair.of("5", "32"),
                GroupCodePair.of("8", "Walls"),
                GroupCodePair.of("10", "0.0"));
        assertThat(handled.getKind()).isEqualTo("LINE");
        assertThat(original.hasHandle()).isFalse();
        assertThat(original.getProperties()).hasSize(2);
    }

    @Test
    void testPropertiesAreImmutable() {
        DxfEntity entity = DxfEntity.builder().kind("ARC").build();

        assertThatThrownBy(() -> entity.getProperties().add(GroupCodePair.of("8", "X")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
