package com.lodestar.succession.audit;

public enum AuditExportFormat {
    CSV("text/csv"),
    JSON("application/json");

    private final String contentType;

    AuditExportFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
