package cockpit.jobs.model;

import java.util.Locale;

/**
 * Where a template takes its target devices from.
 */
public enum InventorySource {
    ALL,
    INVENTORY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InventorySource parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("inventorySource must be 'all' or 'inventory'");
        }
    }
}
