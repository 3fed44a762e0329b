package io.bankseed.generator;

import io.bankseed.model.EntityType;

import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class GeneratorRegistry {
    private final Map<EntityType, EntityGenerator> generators;

    private GeneratorRegistry(Map<EntityType, EntityGenerator> generators) {
        this.generators = Collections.unmodifiableMap(generators);
    }

    public static GeneratorRegistry defaults(ZoneId zone) {
        Builder builder = builder();
        for (EntityType type : EntityType.values()) {
            builder.register(switch (type.paradigm()) {
                case PROFILE -> new ProfileGenerator(type, zone);
                case ARCHIVE -> new ArchiveGenerator(type, zone);
                case DOCUMENT -> new DocumentGenerator(type, zone);
                case EVENT -> new EventGenerator(type, zone);
            });
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this registry with {@code replacement} registered for its type.
     */
    public GeneratorRegistry with(EntityGenerator replacement) {
        Map<EntityType, EntityGenerator> copy = new EnumMap<>(EntityType.class);
        copy.putAll(generators);
        copy.put(replacement.type(), replacement);
        return new GeneratorRegistry(copy);
    }

    public EntityGenerator get(EntityType type) {
        EntityGenerator generator = generators.get(type);
        if (generator == null) {
            throw new IllegalStateException("No generator registered for " + type.key());
        }
        return generator;
    }

    public static final class Builder {
        private final Map<EntityType, EntityGenerator> generators = new EnumMap<>(EntityType.class);

        private Builder() {
        }

        public Builder register(EntityGenerator generator) {
            generators.put(generator.type(), generator);
            return this;
        }

        public GeneratorRegistry build() {
            return new GeneratorRegistry(new EnumMap<>(generators));
        }
    }
}
