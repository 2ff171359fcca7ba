package com.lending.scope.domain;

/**
 * Which selection tier produced a peer cohort. Kept on the cohort for auditability.
 */
public enum SelectionWindow {
    PRIMARY("primary"),
    EXPANDED("expanded"),
    TOP_K("top_k"),
    CATEGORY("category"),
    NONE("none");

    private final String label;

    SelectionWindow(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
