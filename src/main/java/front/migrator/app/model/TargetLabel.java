package front.migrator.app.model;

import lombok.Value;

@Value
public class TargetLabel {

    public enum Type { SYSTEM, USER }

    String id;
    String name;
    Type type;

    public static Type typeOf(String gmailType) {
        return "system".equalsIgnoreCase(gmailType) ? Type.SYSTEM : Type.USER;
    }
}
