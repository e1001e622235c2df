package com.marketpulse.model;

import java.util.List;
import java.util.Locale;

/**
 * Roles a dataset column can play, each with the column-name synonyms that identify it.
 * Synonyms are listed in priority order.
 */
public enum ColumnRole {

    TEXT(MatchMode.EXACT, List.of("feedback", "review", "comment", "content", "text", "body")),
    TIME(MatchMode.CONTAINS, List.of("date", "time", "created")),
    ENGAGEMENT(MatchMode.EXACT, List.of("likes", "like_count", "likes_count", "upvotes", "reactions", "engagement"));

    public enum MatchMode { EXACT, CONTAINS }

    private final MatchMode mode;
    private final List<String> synonyms;

    ColumnRole(MatchMode mode, List<String> synonyms) {
        this.mode = mode;
        this.synonyms = synonyms;
    }

    public MatchMode mode() {
        return mode;
    }

    public List<String> synonyms() {
        return synonyms;
    }

    public boolean matches(String columnName, String synonym) {
        String name = columnName.toLowerCase(Locale.ROOT);
        return mode == MatchMode.EXACT ? name.equals(synonym) : name.contains(synonym);
    }
}
