package omni.sync.app.service.sync;

public enum StopReason {
    /** The provider has no further pages. */
    EXHAUSTED,
    /** The per-run item cap was reached. */
    ITEM_CAP,
    /** The per-run wall-clock deadline passed. */
    DEADLINE
}
