package com.cad.dxfcleaner.rebuild;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LayerHandles.
 */
class LayerHandlesTest {

    @ParameterizedTest
    @CsvSource({
            "0, D1",
            "Walls, 349",
            "Doors, 2CE",
            "Defpoints, 1FF",
            "Électrique, 103"
    })
    void testHandleIsCrcOfUtf8NameModulo1000(String name, String expected) {
        assertThat(LayerHandles.deriveHex(name)).isEqualTo(expected);
    }

    @Test
    void testDerivationIsStable() {
        assertThat(LayerHandles.derive("Walls")).isEqualTo(LayerHandles.derive(new String("Walls")));
    }

    @Test
    void testHandlesStayBelowOneThousand() {
        for (int i = 0; i < 500; i++) {
            assertThat(LayerHandles.derive("Layer-" + i)).isBetween(0, 999);
        }
    }

    @Test
    void testKnownCollisionExists() {
        assertThat(LayerHandles.deriveHex("L13")).isEqualTo(LayerHandles.deriveHex("L45"));
    }
}
