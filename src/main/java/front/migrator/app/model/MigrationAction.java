package front.migrator.app.model;

public enum MigrationAction {
    APPLIED("applied"),
    DRY_RUN("dry_run"),
    SKIPPED("skipped"),
    NO_MATCH("no_match"),
    FAILED("failed");

    private final String value;

    MigrationAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
