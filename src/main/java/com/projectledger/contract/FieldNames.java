package com.projectledger.contract;

import java.util.AbstractMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Field names are matched ignoring case and underscores, so
 * {@code owning_org_node_id}, {@code owningOrgNodeId} and
 * {@code OwningOrgNodeID} all name the same field.
 */
public final class FieldNames {

    private FieldNames() {
    }

    public static String normalize(String name) {
        return name.replace("_", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up {@code name} in {@code fields}. An empty result means no such
     * field; a present field may still hold null, hence the wrapper.
     */
    public static Optional<Map.Entry<String, Object>> find(Map<String, Object> fields, String name) {
        if (fields.containsKey(name)) {
            return Optional.of(new AbstractMap.SimpleEntry<>(name, fields.get(name)));
        }
        String wanted = normalize(name);
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (normalize(entry.getKey()).equals(wanted)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
