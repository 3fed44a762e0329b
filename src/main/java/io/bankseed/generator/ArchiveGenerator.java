package io.bankseed.generator;

import io.bankseed.model.EntityType;
import io.bankseed.model.Paradigm;

import java.time.ZoneId;
import java.util.SplittableRandom;

/**
 * Dimension archives. Accounts belong to a customer and take that customer as their base id.
 */
public final class ArchiveGenerator extends AbstractEntityGenerator {
    private static final String[] PRODUCT_CATEGORIES = {"fund", "bond", "wealth", "insurance", "gold"};
    private static final String[] DEPOSIT_KINDS = {"demand", "fixed_3m", "fixed_6m", "fixed_1y", "fixed_3y", "notice"};
    private static final String[] CITIES = {"Beijing", "Shanghai", "Shenzhen", "Hangzhou", "Chengdu", "Wuhan", "Nanjing"};
    private static final String[] BRANCH_LEVELS = {"head", "city", "sub"};

    public ArchiveGenerator(EntityType type, ZoneId zone) {
        super(type, zone);
        if (type.paradigm() != Paradigm.ARCHIVE) {
            throw new IllegalArgumentException("Not an archive type: " + type);
        }
    }

    @Override
    protected void build(RecordDraft draft, SplittableRandom rng, RegistryView registry) {
        draft.field("create_time", draft.logicalTimeMs());
        switch (type()) {
            case PRODUCT -> {
                draft.field("product_id", draft.recordId());
                draft.field("category", choose(PRODUCT_CATEGORIES, rng));
                draft.field("risk_level", 1 + rng.nextInt(5));
                draft.field("min_amount", amount(rng, 1_000.0d, 50_000.0d));
            }
            case DEPOSIT_TYPE -> {
                draft.field("deposit_type_id", draft.recordId());
                draft.field("name", DEPOSIT_KINDS[(int) (draft.sequence() % DEPOSIT_KINDS.length)]);
                draft.field("annual_rate", Math.round((0.2d + rng.nextDouble() * 3.0d) * 100.0d) / 100.0d);
            }
            case BRANCH -> {
                draft.field("branch_id", draft.recordId());
                draft.field("city", choose(CITIES, rng));
                draft.field("level", choose(BRANCH_LEVELS, rng));
            }
            case ACCOUNT -> {
                String customer = registry.pick(EntityType.CUSTOMER, rng);
                draft.reference(EntityType.CUSTOMER, customer);
                draft.reference(EntityType.BRANCH, registry.pick(EntityType.BRANCH, rng));
                draft.reference(EntityType.DEPOSIT_TYPE, registry.pick(EntityType.DEPOSIT_TYPE, rng));
                draft.baseId(customer);
                draft.field("account_id", draft.recordId());
                draft.field("open_time", draft.logicalTimeMs());
                draft.field("balance", amount(rng, 0.01d, 500_000.0d));
            }
            default -> throw new IllegalStateException("Unhandled archive type: " + type());
        }
    }
}
