package com.cad.dxfcleaner.service;

import com.cad.dxfcleaner.exception.DxfReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a drawing as trimmed lines. Input is decoded as UTF-8 with malformed
 * bytes dropped; {@code \n}, {@code \r\n} and {@code \r} all end a line.
 */
public class DxfFileReader {
    private static final Logger log = LoggerFactory.getLogger(DxfFileReader.class);

    public List<String> readLines(Path source) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);

        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(source), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line.strip());
            }
        } catch (IOException e) {
            throw new DxfReadException(source, e);
        }

        log.debug("Read {} lines from {}", lines.size(), source);
        return lines;
    }
}
