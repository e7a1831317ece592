package ai.paraflow.report;

public enum ReportFormat {
    TEXT,
    JSON;

    public ReportFormatter formatter() {
        return switch (this) {
            case TEXT -> new TextReportFormatter();
            case JSON -> new JsonReportFormatter();
        };
    }
}
