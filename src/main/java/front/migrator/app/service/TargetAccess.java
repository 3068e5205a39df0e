package front.migrator.app.service;

import java.util.Optional;

/**
 * The Gmail capabilities granted to a run. A dry run gets a reader and no writer, so no code
 * path in the migration can reach a mutating call.
 */
public final class TargetAccess {
    private final GmailReader reader;
    private final GmailWriter writer;

    private TargetAccess(GmailReader reader, GmailWriter writer) {
        this.reader = reader;
        this.writer = writer;
    }

    public static TargetAccess readOnly(GmailReader reader) {
        return new TargetAccess(reader, null);
    }

    public static TargetAccess readWrite(GmailReader reader, GmailWriter writer) {
        if (writer == null) {
            throw new IllegalArgumentException("writer is required for read-write access");
        }
        return new TargetAccess(reader, writer);
    }

    public GmailReader reader() {
        return reader;
    }

    public Optional<GmailWriter> writer() {
        return Optional.ofNullable(writer);
    }

    public boolean isReadOnly() {
        return writer == null;
    }
}
