package com.smpost.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.smpost.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * UUIDv7 ids: time-ordered, so posts sort by creation without a separate column.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator = Generators.timeBasedEpochGenerator();

    @Override
    public UUID generate() {
        return generator.generate();
    }
}
