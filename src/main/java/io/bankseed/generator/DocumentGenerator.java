package io.bankseed.generator;

import io.bankseed.error.IntegrityException;
import io.bankseed.model.EntityType;
import io.bankseed.model.Paradigm;

import java.time.ZoneId;
import java.util.SplittableRandom;

/**
 * Business documents. Every document is owned by a customer, directly or through an account.
 */
public final class DocumentGenerator extends AbstractEntityGenerator {
    private static final String[] CHANNELS = {"counter", "atm", "mobile", "web", "pos"};
    private static final String[] DIRECTIONS = {"in", "out"};
    private static final String[] LOAN_PURPOSES = {"housing", "car", "education", "consumer", "business"};
    private static final String[] ORDER_SIDES = {"buy", "redeem"};

    public DocumentGenerator(EntityType type, ZoneId zone) {
        super(type, zone);
        if (type.paradigm() != Paradigm.DOCUMENT) {
            throw new IllegalArgumentException("Not a document type: " + type);
        }
    }

    @Override
    protected void build(RecordDraft draft, SplittableRandom rng, RegistryView registry) {
        draft.field("detail_id", draft.recordId());
        draft.field("detail_time", draft.logicalTimeMs());
        switch (type()) {
            case TRANSACTION -> {
                String account = registry.pick(EntityType.ACCOUNT, rng);
                draft.reference(EntityType.ACCOUNT, account);
                String owner = registry.baseIdOf(account);
                if (owner == null) {
                    throw new IntegrityException("Account " + account + " has no owning customer");
                }
                draft.baseId(owner);
                draft.field("account_id", account);
                draft.field("direction", choose(DIRECTIONS, rng));
                draft.field("channel", choose(CHANNELS, rng));
                draft.field("amount", amount(rng, 1.0d, 20_000.0d));
            }
            case LOAN_APPLICATION -> {
                String customer = registry.pick(EntityType.CUSTOMER, rng);
                draft.reference(EntityType.CUSTOMER, customer);
                draft.baseId(customer);
                draft.field("purpose", choose(LOAN_PURPOSES, rng));
                draft.field("term_months", 6 * (1 + rng.nextInt(60)));
                draft.field("amount", amount(rng, 5_000.0d, 2_000_000.0d));
            }
            case INVESTMENT_ORDER -> {
                String customer = registry.pick(EntityType.CUSTOMER, rng);
                draft.reference(EntityType.CUSTOMER, customer);
                draft.reference(EntityType.PRODUCT, registry.pick(EntityType.PRODUCT, rng));
                draft.baseId(customer);
                draft.field("side", choose(ORDER_SIDES, rng));
                draft.field("amount", amount(rng, 100.0d, 500_000.0d));
            }
            default -> throw new IllegalStateException("Unhandled document type: " + type());
        }
    }
}
