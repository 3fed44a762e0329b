package io.bankseed.generator;

import io.bankseed.model.EntityType;

import java.util.SplittableRandom;

/**
 * Read-only view of identifiers produced by earlier stages.
 */
public interface RegistryView {

    /**
     * Picks an identifier of {@code type} using {@code rng}.
     *
     * @throws io.bankseed.error.IntegrityException when no identifier of the type exists
     */
    String pick(EntityType type, SplittableRandom rng);

    /**
     * Owning base id of a registered identifier, or {@code null} when unknown.
     */
    String baseIdOf(String recordId);

    int size(EntityType type);
}
