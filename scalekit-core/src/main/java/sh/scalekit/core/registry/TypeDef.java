// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.scalekit.core.codec.Json;

/**
 * Parsed form of a type descriptor.
 *
 * <p>Every definition has a canonical {@link #descriptor()} string that
 * {@link TypeDefParser#parse(String)} reads back into an equal definition:
 * <pre>{@code
 * TypeDef def = TypeDefParser.parse("BTreeMap<u32, Vec<Text>>");
 * def.descriptor();   // "BTreeMap<u32,Vec<Text>>"
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface TypeDef {

    /**
     * Returns the canonical descriptor, also used as the resolution cache key.
     */
    String descriptor();

    static TypeDef named(final String name) {
        return new NamedDef(name);
    }

    /** A reference to a registered or built-in name. */
    record NamedDef(String name) implements TypeDef {
        public NamedDef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String descriptor() {
            return name;
        }
    }

    /** A reference to a portable type id, registered as {@code Lookup<id>}. */
    record LookupDef(int id) implements TypeDef {
        @Override
        public String descriptor() {
            return TypeRegistry.lookupName(id);
        }
    }

    record VecDef(TypeDef element) implements TypeDef {
        @Override
        public String descriptor() {
            return "Vec<" + element.descriptor() + ">";
        }
    }

    record VecFixedDef(TypeDef element, int length) implements TypeDef {
        @Override
        public String descriptor() {
            return "[" + element.descriptor() + ";" + length + "]";
        }
    }

    record TupleDef(List<TypeDef> elements) implements TypeDef {
        public TupleDef {
            elements = List.copyOf(elements);
        }

        @Override
        public String descriptor() {
            final String inner = elements.stream().map(TypeDef::descriptor).collect(Collectors.joining(","));
            return elements.size() == 1 ? "(" + inner + ",)" : "(" + inner + ")";
        }
    }

    record OptionDef(TypeDef inner) implements TypeDef {
        @Override
        public String descriptor() {
            return "Option<" + inner.descriptor() + ">";
        }
    }

    record CompactDef(TypeDef inner) implements TypeDef {
        @Override
        public String descriptor() {
            return "Compact<" + inner.descriptor() + ">";
        }
    }

    record ResultDef(TypeDef ok, TypeDef err) implements TypeDef {
        @Override
        public String descriptor() {
            return "Result<" + ok.descriptor() + "," + err.descriptor() + ">";
        }
    }

    record SetDef(TypeDef element) implements TypeDef {
        @Override
        public String descriptor() {
            return "BTreeSet<" + element.descriptor() + ">";
        }
    }

    record MapDef(TypeDef key, TypeDef value) implements TypeDef {
        @Override
        public String descriptor() {
            return "BTreeMap<" + key.descriptor() + "," + value.descriptor() + ">";
        }
    }

    /**
     * A struct field; {@code jsonKey} differs from {@code name} only when aliased.
     */
    record FieldDef(String name, String jsonKey, TypeDef type) {
        public FieldDef(final String name, final TypeDef type) {
            this(name, name, type);
        }
    }

    /**
     * Ordered named fields. Descriptor is a JSON object, with an {@code _alias} map for
     * fields whose JSON key differs from their name.
     */
    record StructDef(List<FieldDef> fields) implements TypeDef {
        public StructDef {
            fields = List.copyOf(fields);
        }

        @Override
        public String descriptor() {
            return toJsonNode().toString();
        }

        ObjectNode toJsonNode() {
            final ObjectNode node = Json.NODES.objectNode();
            ObjectNode aliases = null;
            for (FieldDef field : fields) {
                node.set(field.name(), nested(field.type()));
                if (!field.name().equals(field.jsonKey())) {
                    if (aliases == null) {
                        aliases = Json.NODES.objectNode();
                    }
                    aliases.put(field.name(), field.jsonKey());
                }
            }
            if (aliases != null) {
                node.set(TypeDefs.ALIAS_KEY, aliases);
            }
            return node;
        }
    }

    /** One enum variant with its discriminant and payload definition. */
    record VariantDef(String name, int index, TypeDef payload) {
        public VariantDef(final String name, final int index) {
            this(name, index, TypeDefs.NULL);
        }
    }

    /**
     * Tagged union. Descriptor is {@code {"_enum":[...]}} for payload-less enums and
     * {@code {"_enum":{...}}} otherwise, plus {@code _indexes} when the indexes are not
     * {@code 0..n-1}.
     */
    record EnumDef(List<VariantDef> variants) implements TypeDef {
        public EnumDef {
            variants = List.copyOf(variants);
        }

        public boolean isBasic() {
            return variants.stream().allMatch(v -> TypeDefs.isNull(v.payload()));
        }

        public boolean isSequential() {
            for (int i = 0; i < variants.size(); i++) {
                if (variants.get(i).index() != i) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String descriptor() {
            return toJsonNode().toString();
        }

        ObjectNode toJsonNode() {
            final ObjectNode node = Json.NODES.objectNode();
            if (isBasic()) {
                final ArrayNode names = node.putArray(TypeDefs.ENUM_KEY);
                variants.forEach(v -> names.add(v.name()));
            } else {
                final ObjectNode payloads = node.putObject(TypeDefs.ENUM_KEY);
                variants.forEach(v -> payloads.set(v.name(), nested(v.payload())));
            }
            if (!isSequential()) {
                final ArrayNode indexes = node.putArray(TypeDefs.INDEXES_KEY);
                variants.forEach(v -> indexes.add(v.index()));
            }
            return node;
        }
    }

    private static JsonNode nested(final TypeDef def) {
        if (def instanceof StructDef struct) {
            return struct.toJsonNode();
        }
        if (def instanceof EnumDef enumDef) {
            return enumDef.toJsonNode();
        }
        return Json.NODES.textNode(def.descriptor());
    }
}
