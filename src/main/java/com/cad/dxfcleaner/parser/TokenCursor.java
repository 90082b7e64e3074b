package com.cad.dxfcleaner.parser;

import com.cad.dxfcleaner.model.GroupCodePair;

import java.util.List;
import java.util.Optional;

/**
 * Walks a list of trimmed lines as (group code, value) pairs.
 *
 * The line at the cursor position is a group code and the following line its
 * value. Lookahead is positional so callers can recognize fixed-layout headers.
 * A trailing line without a value is never yielded as a pair.
 */
public class TokenCursor {

    private final List<String> lines;
    private int position;

    public TokenCursor(List<String> lines) {
        this.lines = List.copyOf(lines);
        this.position = 0;
    }

    public boolean hasPair() {
        return position + 1 < lines.size();
    }

    public GroupCodePair current() {
        return pairAt(0).orElseThrow(() -> new IllegalStateException(
                "No complete pair at line " + (position + 1)));
    }

    /**
     * Pair starting {@code lineOffset} lines after the cursor, if both of its
     * lines exist.
     */
    public Optional<GroupCodePair> pairAt(int lineOffset) {
        int index = position + lineOffset;
        if (index < 0 || index + 1 >= lines.size()) {
            return Optional.empty();
        }
        return Optional.of(GroupCodePair.of(lines.get(index), lines.get(index + 1)));
    }

    /**
     * Raw line {@code lineOffset} lines after the cursor.
     */
    public Optional<String> lineAt(int lineOffset) {
        int index = position + lineOffset;
        if (index < 0 || index >= lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(index));
    }

    public void advanceLines(int count) {
        position = Math.min(position + count, lines.size());
    }

    public void advancePair() {
        advanceLines(2);
    }

    public int getPosition() {
        return position;
    }

    public int getLineCount() {
        return lines.size();
    }
}
