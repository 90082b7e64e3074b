package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.model.GroupCodePair;

/**
 * Accumulates output text. Every line written through {@link #line} or
 * {@link #pair} is terminated with {@code \n}; {@link #raw} appends text as is.
 */
public class DxfOutputBuilder {

    private final StringBuilder sb = new StringBuilder();

    public DxfOutputBuilder line(String line) {
        sb.append(line).append('\n');
        return this;
    }

    public DxfOutputBuilder pair(String code, String value) {
        return line(code).line(value);
    }

    public DxfOutputBuilder pair(GroupCodePair pair) {
        return pair(pair.getCode(), pair.getValue());
    }

    public DxfOutputBuilder raw(String text) {
        sb.append(text);
        return this;
    }

    /**
     * Terminates the current line if text appended through {@link #raw} left it open.
     */
    public DxfOutputBuilder ensureLineBreak() {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        return this;
    }

    public int length() {
        return sb.length();
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
