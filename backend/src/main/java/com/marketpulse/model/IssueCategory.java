package com.marketpulse.model;

import java.util.List;

/** Problem categories searched for in negative feedback, in reporting order. */
public enum IssueCategory {
    QUALITY("Quality", List.of("quality", "broken", "defect", "faulty", "poor")),
    SERVICE("Service", List.of("service", "support", "customer service", "help", "response")),
    PRICE("Price", List.of("price", "expensive", "cost", "overpriced", "refund")),
    DELIVERY("Delivery", List.of("delivery", "shipping", "late", "delayed", "never arrived")),
    PERFORMANCE("Performance", List.of("slow", "lag", "crash", "bug", "error", "not working"));

    private final String title;
    private final List<String> keywords;

    IssueCategory(String title, List<String> keywords) {
        this.title = title;
        this.keywords = keywords;
    }

    public String title() {
        return title;
    }

    public List<String> keywords() {
        return keywords;
    }

    /** Substring match against already lower-cased text. */
    public boolean matches(String lowerText) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
