package com.example.paybill.application.parser;

import com.example.paybill.domain.model.PositionedToken;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Every token found in the header zone of page one, in line order, plus their joined text.
 */
public final class HeaderTokenPool {

    private final List<PositionedToken> tokens;
    private final String rawText;

    public HeaderTokenPool(List<PositionedToken> tokens) {
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.rawText = this.tokens.stream()
                .map(PositionedToken::text)
                .collect(Collectors.joining(" "));
    }

    public List<PositionedToken> tokens() {
        return tokens;
    }

    public String rawText() {
        return rawText;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * @return the first token whose text contains a match of {@code pattern}
     */
    public Optional<PositionedToken> find(Pattern pattern) {
        for (PositionedToken token : tokens) {
            if (pattern.matcher(token.text()).find()) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} when the joined header text contains a match of {@code pattern}
     */
    public boolean textContains(Pattern pattern) {
        return pattern.matcher(rawText).find();
    }
}
