package com.cad.dxfcleaner.model;

import lombok.Value;

/**
 * A single (group code, value) pair as read from the drawing stream.
 * The code is kept textual; it is never validated as a number.
 */
@Value(staticConstructor = "of")
public class GroupCodePair {
    String code;
    String value;

    public boolean hasCode(String expected) {
        return code.equals(expected);
    }
}
