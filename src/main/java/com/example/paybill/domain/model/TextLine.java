package com.example.paybill.domain.model;

import java.util.List;

/**
 * One reconstructed line of a page: the tokens sharing a rounded vertical coordinate, ordered left to right.
 * The joined {@link #text()} is what every downstream parsing step pattern-matches against.
 */
public record TextLine(
        int pageNumber,
        int y,
        List<PositionedToken> tokens,
        String text
) {
    public TextLine {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        text = text == null ? "" : text;
    }

    public String trimmedText() {
        return text.trim();
    }
}
