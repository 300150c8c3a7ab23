package in.riskgov.domain.common;

/**
 * Snapshot could not be written or read.
 */
public class PersistenceException extends RuntimeException {

    private final String snapshotKey;

    public PersistenceException(String snapshotKey, String message, Throwable cause) {
        super(String.format("[%s] %s", snapshotKey, message), cause);
        this.snapshotKey = snapshotKey;
    }

    public String getSnapshotKey() {
        return snapshotKey;
    }
}
