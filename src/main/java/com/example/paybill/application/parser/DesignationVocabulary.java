package com.example.paybill.application.parser;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Known job titles printed next to employee names. Titles are tried longest first so that
 * "Insurance Medical Officer" wins over any shorter title it contains.
 */
public final class DesignationVocabulary {

    public static final DesignationVocabulary DEFAULT = new DesignationVocabulary(List.of(
            "Specialist",
            "Insurance Medical Officer",
            "Administrative Officer",
            "Junior Clerk",
            "Senior Clerk",
            "Junior Pharmacist",
            "Senior Pharmacist",
            "Matron",
            "Laboratory Technician",
            "Physiotherapist",
            "Head Nurse",
            "Staff Nurse",
            "Superintendent",
            "Peon",
            "Sweeper",
            "Watchman",
            "Driver",
            "Class-IV",
            "Class-III"
    ));

    private final List<String> titles;

    public DesignationVocabulary(List<String> titles) {
        this.titles = titles.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    /**
     * Finds the longest known title occurring anywhere in {@code text}, ignoring case.
     *
     * @param text line text with pay-scale fragments already removed
     * @return the title as printed and the text before it
     */
    public Optional<Match> find(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String title : titles) {
            int index = lower.indexOf(title.toLowerCase(Locale.ROOT));
            if (index >= 0) {
                int end = index + title.length();
                return Optional.of(new Match(text.substring(index, end), text.substring(0, index)));
            }
        }
        return Optional.empty();
    }

    /**
     * A designation found inside a line.
     */
    public record Match(String designation, String namePart) {
    }
}
