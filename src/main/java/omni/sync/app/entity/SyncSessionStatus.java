package omni.sync.app.entity;

public enum SyncSessionStatus {
    RUNNING,
    /** Pagination exhausted. */
    COMPLETED,
    /** Stopped by the item cap or the deadline; the next run resumes. */
    PARTIAL,
    FAILED
}
