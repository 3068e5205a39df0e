package front.migrator.app.model;

public enum MatchMethod {
    MESSAGE_ID("message-id"),
    NONE("none");

    private final String value;

    MatchMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
