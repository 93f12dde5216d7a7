package com.example.paybill.domain.model;

/**
 * Text fragment produced by the PDF text extractor together with its page coordinates.
 * {@code y} grows towards the top of the page, so larger values are read first.
 */
public record PositionedToken(
        float x,
        float y,
        String text,
        float width
) {
    public PositionedToken {
        text = text == null ? "" : text;
        width = Math.max(width, 0f);
    }
}
