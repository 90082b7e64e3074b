package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.template.BuiltInTemplates;
import com.cad.dxfcleaner.template.TemplateRenderer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HeaderTemplate layout detection.
 */
class HeaderTemplateTest {

    @Test
    void testSingleMarkerIsSpliceable() {
        HeaderTemplate header = HeaderTemplate.of("999\nx\n0\nTABLE\n2\nLAYER\n70\n1");

        assertThat(header.getLayout()).isEqualTo(HeaderTemplate.Layout.SPLICEABLE);
        assertThat(header.getMarkerCount()).isEqualTo(1);
        assertThat(header.getPrefix()).isEqualTo("999\nx\n0\n");
    }

    @Test
    void testBuiltInHeaderIsSpliceable() {
        String minimal = new BuiltInTemplates(new TemplateRenderer()).minimalHeader();

        assertThat(HeaderTemplate.of(minimal).getLayout()).isEqualTo(HeaderTemplate.Layout.SPLICEABLE);
    }

    @Test
    void testMissingMarkerIsOpaque() {
        HeaderTemplate header = HeaderTemplate.of("0\nSECTION\n2\nHEADER\n0\nENDSEC");

        assertThat(header.getLayout()).isEqualTo(HeaderTemplate.Layout.OPAQUE);
        assertThat(header.getMarkerCount()).isZero();
        assertThatThrownBy(header::getPrefix).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRepeatedMarkerIsNotSpliceable() {
        HeaderTemplate header = HeaderTemplate.of("TABLE\n2\nLAYER\nTABLE\n2\nLAYER");

        assertThat(header.getLayout()).isEqualTo(HeaderTemplate.Layout.OPAQUE);
        assertThat(header.getMarkerCount()).isEqualTo(2);
    }

    @Test
    void testSignedHeaderWithoutMarkerIsMinimal() {
        HeaderTemplate header = HeaderTemplate.of("999\n" + BuiltInTemplates.HEADER_SIGNATURE + "\n0\nEOF");

        assertThat(header.getLayout()).isEqualTo(HeaderTemplate.Layout.MINIMAL_BUILT_IN);
    }
}
