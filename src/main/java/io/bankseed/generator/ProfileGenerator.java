package io.bankseed.generator;

import io.bankseed.model.EntityType;
import io.bankseed.model.Paradigm;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.SplittableRandom;

/**
 * Subject profiles. A profile owns itself: its base id is its own id. Every customer is
 * assigned a relationship manager drawn from the managers already produced.
 */
public final class ProfileGenerator extends AbstractEntityGenerator {
    private static final String[] SURNAMES = {"Wang", "Li", "Zhang", "Liu", "Chen", "Yang", "Zhao", "Huang", "Zhou", "Wu"};
    private static final String[] GIVEN = {"Wei", "Fang", "Min", "Jing", "Lei", "Yan", "Jun", "Tao", "Hui", "Qiang"};
    private static final String[] CITIES = {"Beijing", "Shanghai", "Shenzhen", "Hangzhou", "Chengdu", "Wuhan", "Nanjing"};
    private static final String[] RISK = {"low", "medium", "high"};
    private static final String[] MANAGER_LEVELS = {"junior", "senior", "principal"};

    public ProfileGenerator(EntityType type, ZoneId zone) {
        super(type, zone);
        if (type.paradigm() != Paradigm.PROFILE) {
            throw new IllegalArgumentException("Not a profile type: " + type);
        }
    }

    @Override
    protected void build(RecordDraft draft, SplittableRandom rng, RegistryView registry) {
        String name = choose(SURNAMES, rng) + " " + choose(GIVEN, rng);
        draft.field("name", name);
        draft.field("create_time", draft.logicalTimeMs());
        if (type() == EntityType.CUSTOMER) {
            String manager = registry.pick(EntityType.MANAGER, rng);
            draft.reference(EntityType.MANAGER, manager);
            draft.field("customer_id", draft.recordId());
            draft.field("manager_id", manager);
            draft.field("gender", rng.nextBoolean() ? "F" : "M");
            draft.field("birth_date", LocalDate.of(1950, 1, 1).plusDays(rng.nextInt(365 * 55)).toString());
            draft.field("city", choose(CITIES, rng));
            draft.field("risk_level", choose(RISK, rng));
        } else {
            draft.field("manager_id", draft.recordId());
            draft.field("level", choose(MANAGER_LEVELS, rng));
            draft.field("city", choose(CITIES, rng));
        }
    }
}
