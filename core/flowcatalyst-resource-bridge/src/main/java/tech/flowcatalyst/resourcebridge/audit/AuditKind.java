package tech.flowcatalyst.resourcebridge.audit;

/**
 * Kind of mutation an audit entry documents.
 */
public enum AuditKind {
    ADDITION("created"),
    CHANGE("changed"),
    DELETION("deleted");

    private final String historyLabel;

    AuditKind(String historyLabel) {
        this.historyLabel = historyLabel;
    }

    /**
     * Past-tense label used in history listings.
     */
    public String historyLabel() {
        return historyLabel;
    }
}
