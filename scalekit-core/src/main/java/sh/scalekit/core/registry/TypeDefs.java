// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import sh.scalekit.core.error.TypeRegistryException;

/**
 * Conversion of JSON-shaped definitions into {@link TypeDef}s.
 *
 * <p>Accepted shapes:
 * <pre>{@code
 * {"a": "u32", "b": "Vec<Text>"}                    struct
 * {"a": "u32", "_alias": {"a": "aJson"}}            struct with JSON key alias
 * {"_enum": ["A", "B"]}                             payload-less enum
 * {"_enum": {"A": 0, "B": 5}}                       payload-less enum, explicit indexes
 * {"_enum": {"A": "Null", "B": {"x": "u8"}}}        enum with payloads
 * {"_enum": {...}, "_indexes": [0, 7]}              enum with sparse indexes
 * }</pre>
 */
public final class TypeDefs {

    public static final String ENUM_KEY = "_enum";
    public static final String ALIAS_KEY = "_alias";
    public static final String INDEXES_KEY = "_indexes";

    public static final TypeDef NULL = new TypeDef.NamedDef("Null");

    private TypeDefs() {
        // Utility class
    }

    /**
     * Returns whether {@code def} is the unit type ({@code Null} or {@code ()}).
     */
    public static boolean isNull(final TypeDef def) {
        if (def instanceof TypeDef.NamedDef named) {
            return "Null".equals(named.name());
        }
        return def instanceof TypeDef.TupleDef tuple && tuple.elements().isEmpty();
    }

    /**
     * Converts a descriptor value: a {@link String} is parsed, a {@link Map} is read as
     * a JSON definition, a {@link TypeDef} is returned unchanged.
     *
     * @throws TypeRegistryException if the value is not a valid definition
     */
    public static TypeDef from(final Object value) {
        if (value instanceof TypeDef def) {
            return def;
        }
        if (value instanceof String s) {
            return TypeDefParser.parse(s);
        }
        if (value instanceof Map<?, ?> map) {
            return fromJson(map);
        }
        throw TypeRegistryException.invalidDescriptor(String.valueOf(value), "unsupported definition value");
    }

    /**
     * Reads a JSON-shaped struct or enum definition.
     */
    public static TypeDef fromJson(final Map<?, ?> json) {
        if (json.containsKey(ENUM_KEY)) {
            return enumDef(json);
        }
        final Map<?, ?> aliases = json.get(ALIAS_KEY) instanceof Map<?, ?> m ? m : Map.of();
        final List<TypeDef.FieldDef> fields = new ArrayList<>();
        for (Map.Entry<?, ?> entry : json.entrySet()) {
            final String name = String.valueOf(entry.getKey());
            if (ALIAS_KEY.equals(name)) {
                continue;
            }
            if (name.startsWith("_")) {
                throw TypeRegistryException.invalidDescriptor(String.valueOf(json), "unsupported key '" + name + "'");
            }
            final Object alias = aliases.get(name);
            fields.add(new TypeDef.FieldDef(name, alias == null ? name : alias.toString(), from(entry.getValue())));
        }
        return new TypeDef.StructDef(fields);
    }

    private static TypeDef enumDef(final Map<?, ?> json) {
        final Object variants = json.get(ENUM_KEY);
        final List<String> names = new ArrayList<>();
        final List<TypeDef> payloads = new ArrayList<>();
        final List<Integer> indexes = new ArrayList<>();
        if (variants instanceof List<?> list) {
            for (Object name : list) {
                names.add(String.valueOf(name));
                payloads.add(NULL);
            }
        } else if (variants instanceof Map<?, ?> map) {
            final boolean explicitIndexes = !map.isEmpty() && map.values().stream().allMatch(Number.class::isInstance);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                names.add(String.valueOf(entry.getKey()));
                if (explicitIndexes) {
                    payloads.add(NULL);
                    indexes.add(((Number) entry.getValue()).intValue());
                } else {
                    payloads.add(entry.getValue() == null ? NULL : from(entry.getValue()));
                }
            }
        } else {
            throw TypeRegistryException.invalidDescriptor(String.valueOf(json), "_enum must be a list or an object");
        }
        if (json.get(INDEXES_KEY) instanceof List<?> explicit) {
            indexes.clear();
            for (Object index : explicit) {
                if (!(index instanceof Number n)) {
                    throw TypeRegistryException.invalidDescriptor(String.valueOf(json), "non-numeric index " + index);
                }
                indexes.add(n.intValue());
            }
        }
        if (!indexes.isEmpty() && indexes.size() != names.size()) {
            throw TypeRegistryException.invalidDescriptor(String.valueOf(json),
                    indexes.size() + " index(es) for " + names.size() + " variant(s)");
        }
        final List<TypeDef.VariantDef> defs = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            defs.add(new TypeDef.VariantDef(names.get(i), indexes.isEmpty() ? i : indexes.get(i), payloads.get(i)));
        }
        return new TypeDef.EnumDef(defs);
    }
}
