package com.smpost.application.port.in;

import java.util.UUID;

public interface RestoreReadModelUseCase {

    /**
     * Clears the read model and republishes every stored stream.
     *
     * @return number of events republished
     */
    int rebuildAll();

    /**
     * Republishes one stream, e.g. after a publish failure.
     *
     * @return number of events republished
     */
    int republish(UUID aggregateId);
}
