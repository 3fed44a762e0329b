package io.bankseed.generator;

import io.bankseed.model.EntityType;
import io.bankseed.model.Paradigm;
import io.bankseed.util.Jsons;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Behavioral events, all attributed to a customer.
 */
public final class EventGenerator extends AbstractEntityGenerator {
    private static final String[] CUSTOMER_EVENTS = {"login", "transfer", "balance_inquiry", "card_apply", "complaint"};
    private static final String[] APP_EVENTS = {"app_open", "page_view", "button_click", "push_open", "app_close"};
    private static final String[] WEB_EVENTS = {"page_view", "search", "form_submit", "download", "logout"};
    private static final String[] DEVICES = {"ios", "android", "harmony", "windows", "macos"};

    public EventGenerator(EntityType type, ZoneId zone) {
        super(type, zone);
        if (type.paradigm() != Paradigm.EVENT) {
            throw new IllegalArgumentException("Not an event type: " + type);
        }
    }

    @Override
    protected void build(RecordDraft draft, SplittableRandom rng, RegistryView registry) {
        String customer = registry.pick(EntityType.CUSTOMER, rng);
        draft.reference(EntityType.CUSTOMER, customer);
        draft.baseId(customer);
        String[] names = switch (type()) {
            case CUSTOMER_EVENT -> CUSTOMER_EVENTS;
            case APP_EVENT -> APP_EVENTS;
            case WEB_EVENT -> WEB_EVENTS;
            default -> throw new IllegalStateException("Unhandled event type: " + type());
        };
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("device", choose(DEVICES, rng));
        property.put("duration_ms", 100 + rng.nextInt(120_000));
        property.put("session", Long.toHexString(rng.nextLong()));
        draft.field("event_id", draft.recordId());
        draft.field("event", choose(names, rng));
        draft.field("event_time", draft.logicalTimeMs());
        draft.field("event_property", Jsons.toCompactJson(property));
    }
}
