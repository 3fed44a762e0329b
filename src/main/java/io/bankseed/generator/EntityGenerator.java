package io.bankseed.generator;

import io.bankseed.model.EntityType;

/**
 * Produces one batch of records for a single entity type. Output must depend only on the
 * request: the same request against the same registry contents yields the same records.
 */
public interface EntityGenerator {
    EntityType type();

    GeneratedBatch generate(GenerationRequest request);
}
