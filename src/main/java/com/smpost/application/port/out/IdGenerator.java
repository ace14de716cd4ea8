package com.smpost.application.port.out;

import java.util.UUID;

/**
 * Port for generating post and comment identifiers.
 * Ids are generated outside the aggregate so replaying a stream never creates new ones.
 */
public interface IdGenerator {

    /**
     * Generates a new unique, time-ordered identifier.
     */
    UUID generate();
}
