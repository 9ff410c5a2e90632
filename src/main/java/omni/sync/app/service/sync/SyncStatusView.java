package omni.sync.app.service.sync;

import omni.sync.app.entity.CredentialStatus;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSessionStatus;

import java.time.Instant;

public record SyncStatusView(Provider provider,
                             boolean connected,
                             CredentialStatus credentialStatus,
                             Instant lastSuccessfulSyncAt,
                             Instant lastRunAt,
                             String lastError,
                             SyncSessionStatus lastSessionStatus,
                             boolean reconnectRequired) {
}
