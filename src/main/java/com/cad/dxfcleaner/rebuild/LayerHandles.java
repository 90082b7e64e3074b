package com.cad.dxfcleaner.rebuild;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Derives a layer record handle from the layer name.
 *
 * The handle is the CRC-32 of the name's UTF-8 bytes reduced modulo
 * {@value #HANDLE_SPACE}, written as upper-case hex. It is stable across runs
 * and JVMs but not collision free; {@link LayerTableWriter} resolves clashes.
 */
public final class LayerHandles {

    static final int HANDLE_SPACE = 1000;

    private LayerHandles() {
    }

    public static int derive(String layerName) {
        CRC32 crc = new CRC32();
        crc.update(layerName.getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % HANDLE_SPACE);
    }

    public static String toHex(int handle) {
        return Integer.toHexString(handle).toUpperCase(Locale.ROOT);
    }

    public static String deriveHex(String layerName) {
        return toHex(derive(layerName));
    }
}
