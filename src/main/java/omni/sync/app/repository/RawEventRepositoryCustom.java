package omni.sync.app.repository;

import omni.sync.app.entity.RawEvent;

import java.util.List;

public interface RawEventRepositoryCustom {

    /**
     * Appends all events with one batched insert.
     *
     * @return number of rows written
     */
    int insertAll(List<RawEvent> events);
}
