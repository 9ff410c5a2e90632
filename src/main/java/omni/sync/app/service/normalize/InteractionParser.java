package omni.sync.app.service.normalize;

import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;

/**
 * Projects one provider payload into an interaction.
 */
public interface InteractionParser {

    Provider provider();

    /**
     * @throws omni.sync.app.exception.MalformedPayloadException if the payload cannot be interpreted
     */
    Interaction parse(RawEvent event);
}
