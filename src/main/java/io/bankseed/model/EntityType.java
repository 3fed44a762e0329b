package io.bankseed.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum EntityType {
    MANAGER(Paradigm.PROFILE, "cdp_manager_profile", "M"),
    CUSTOMER(Paradigm.PROFILE, "cdp_customer_profile", "C", MANAGER),
    PRODUCT(Paradigm.ARCHIVE, "cdp_product_archive", "P"),
    DEPOSIT_TYPE(Paradigm.ARCHIVE, "cdp_deposit_type_archive", "DT"),
    BRANCH(Paradigm.ARCHIVE, "cdp_branch_archive", "B"),
    ACCOUNT(Paradigm.ARCHIVE, "cdp_account_archive", "A", CUSTOMER, BRANCH, DEPOSIT_TYPE),
    TRANSACTION(Paradigm.DOCUMENT, "cdp_account_transaction", "T", ACCOUNT),
    LOAN_APPLICATION(Paradigm.DOCUMENT, "cdp_loan_application", "L", CUSTOMER),
    INVESTMENT_ORDER(Paradigm.DOCUMENT, "cdp_investment_order", "I", CUSTOMER, PRODUCT),
    CUSTOMER_EVENT(Paradigm.EVENT, "cdp_customer_event", "E", CUSTOMER),
    APP_EVENT(Paradigm.EVENT, "cdp_app_event", "AE", CUSTOMER),
    WEB_EVENT(Paradigm.EVENT, "cdp_web_event", "WE", CUSTOMER);

    private final Paradigm paradigm;
    private final String table;
    private final String prefix;
    private final List<EntityType> dependencies;

    EntityType(Paradigm paradigm, String table, String prefix, EntityType... dependencies) {
        this.paradigm = paradigm;
        this.table = table;
        this.prefix = prefix;
        this.dependencies = List.of(dependencies);
    }

    public Paradigm paradigm() {
        return paradigm;
    }

    public String table() {
        return table;
    }

    public String prefix() {
        return prefix;
    }

    public List<EntityType> dependencies() {
        return dependencies;
    }

    /**
     * Time-driven types get a daily volume; the rest get a fixed count.
     */
    public boolean isTimeDriven() {
        return paradigm.phase() > 0;
    }

    /**
     * Number of same-phase dependency hops below this type; cross-phase dependencies count as zero.
     */
    public int depth() {
        int depth = 0;
        for (EntityType dep : dependencies) {
            if (dep.paradigm.phase() == paradigm.phase()) {
                depth = Math.max(depth, dep.depth() + 1);
            }
        }
        return depth;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EntityType> fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace('-', '_');
        for (EntityType value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
