package com.cad.dxfcleaner.template;

import com.cad.dxfcleaner.exception.TemplateRenderException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BuiltInTemplates and the bundled FreeMarker templates.
 */
class BuiltInTemplatesTest {

    private final TemplateRenderer renderer = new TemplateRenderer();
    private final BuiltInTemplates builtIns = new BuiltInTemplates(renderer);

    @Test
    void testMinimalHeaderStopsInsideLayerTable() {
        String header = builtIns.minimalHeader();

        assertThat(header).startsWith("999\n" + BuiltInTemplates.HEADER_SIGNATURE + "\n0\nSECTION\n2\nHEADER\n");
        assertThat(header).contains("$ACADVER\n1\nAC1021");
        assertThat(header).endsWith("0\nTABLE\n2\nLAYER\n5\n2\n330\n0\n100\nAcDbSymbolTable\n70\n1");
        assertThat(BuiltInTemplates.isMinimalHeader(header)).isTrue();
    }

    @Test
    void testMinimalFooterClosesDrawing() {
        String footer = builtIns.minimalFooter();

        assertThat(footer).startsWith("ENDSEC\n0\nSECTION\n2\nOBJECTS\n");
        assertThat(footer).endsWith("0\nENDSEC\n0\nEOF");
    }

    @Test
    void testForeignHeaderIsNotMinimal() {
        assertThat(BuiltInTemplates.isMinimalHeader("999\nSomething else\n0\nEOF")).isFalse();
    }

    @Test
    void testMissingTemplateFails() {
        assertThatThrownBy(() -> renderer.render("no-such-template.ftl"))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("no-such-template.ftl");
    }

    @Test
    void testLayerTableOpeningRendersCount() {
        assertThat(renderer.render("layer-table-open.ftl", Map.of("layerCount", 12345)))
                .isEqualTo("TABLE\n2\nLAYER\n5\n2\n330\n0\n100\nAcDbSymbolTable\n70\n12345\n");
    }
}
