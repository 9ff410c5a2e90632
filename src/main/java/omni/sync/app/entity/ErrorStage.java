package omni.sync.app.entity;

public enum ErrorStage {
    INGESTION,
    NORMALIZATION
}
