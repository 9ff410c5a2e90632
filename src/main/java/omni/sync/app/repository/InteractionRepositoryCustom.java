package omni.sync.app.repository;

import omni.sync.app.entity.Interaction;

import java.util.List;

public interface InteractionRepositoryCustom {

    /**
     * Inserts all interactions in one batch. Rows whose (user, source, source id) already
     * exists are ignored.
     *
     * @return number of rows actually inserted
     */
    int insertIgnoringDuplicates(List<Interaction> interactions);
}
