package omni.sync.app.entity;

public enum CredentialStatus {
    ACTIVE,
    INVALID
}
