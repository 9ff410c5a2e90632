package omni.sync.app.controller;

import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncSessionStatus;
import omni.sync.app.service.sync.StopReason;

import java.time.Instant;

public record SyncSessionView(String id,
                              Provider provider,
                              String jobId,
                              String batchId,
                              SyncSessionStatus status,
                              int pages,
                              int itemsFetched,
                              int itemsWritten,
                              int itemsMalformed,
                              StopReason stopReason,
                              String error,
                              Instant startedAt,
                              Instant completedAt) {

    public static SyncSessionView from(SyncSession session) {
        return new SyncSessionView(session.getId(), session.getProvider(), session.getJobId(), session.getBatchId(),
                session.getStatus(), session.getPages(), session.getItemsFetched(), session.getItemsWritten(),
                session.getItemsMalformed(), session.getStopReason(), session.getError(),
                session.getStartedAt(), session.getCompletedAt());
    }
}
