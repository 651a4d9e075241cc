// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scalekit.core.DebugLogger;
import sh.scalekit.core.codec.Names;
import sh.scalekit.core.error.TypeRegistryException;
import sh.scalekit.core.registry.SignedExtension;
import sh.scalekit.core.registry.TypeDef;
import sh.scalekit.core.registry.TypeDefParser;
import sh.scalekit.core.registry.TypeDefs;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.metadata.model.Field;
import sh.scalekit.metadata.model.Metadata;
import sh.scalekit.metadata.model.PortableType;
import sh.scalekit.metadata.model.PortableTypeGraph;
import sh.scalekit.metadata.model.PrimitiveKind;
import sh.scalekit.metadata.model.SignedExtensionMetadata;
import sh.scalekit.metadata.model.TypeDefinition;
import sh.scalekit.metadata.model.TypeParameter;
import sh.scalekit.metadata.model.VariantDefinition;

/**
 * Registers a metadata type graph into a {@link TypeRegistry}.
 *
 * <p>Every node is registered as {@code Lookup<id>}. Registration runs in a fork of
 * the target registry: each node is converted to a {@link TypeDef}, registered and
 * resolved on its own, and only then copied into the target. Nodes that fail are
 * handled per {@link MetadataConfig#nodeFailurePolicy()}.
 *
 * <p>
 * <strong>Node conversion:</strong>
 * <ul>
 * <li>lookup overrides registered for the node's {@code ::}-joined path win</li>
 * <li>{@code Option}, {@code Result}, {@code BTreeMap}, {@code BTreeSet}, {@code Cow}
 * and {@code Box} paths map to their built-in shapes</li>
 * <li>no fields is {@code Null}; one unnamed field is an alias of that field's type;
 * several unnamed fields are a tuple; named fields are a struct with camel-cased keys</li>
 * <li>{@code Vec<u8>} is {@code Bytes}, {@code [u8; N]} is a fixed raw value and bit
 * sequences are {@code BitVec}</li>
 * <li>legacy textual types are cleaned up and parsed as descriptors</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class PortableTypeRegistrar {

    private static final Logger LOG = LoggerFactory.getLogger(PortableTypeRegistrar.class);

    private static final Set<String> WRAPPERS = Set.of("Option", "Result", "BTreeMap", "BTreeSet", "Cow", "Box");
    private static final int MAX_REPORTED_FAILURES = 5;

    private PortableTypeRegistrar() {
        // Utility class
    }

    public static RegistrationReport register(final TypeRegistry registry, final Metadata metadata) {
        return register(registry, metadata, MetadataConfig.withDefaults());
    }

    /**
     * Registers {@code metadata}'s type graph into {@code registry}.
     *
     * @return which nodes were registered, which failed and which path names were added
     * @throws TypeRegistryException if a node fails and the policy is {@link NodeFailurePolicy#FAIL};
     *                               nothing is registered in that case
     */
    public static RegistrationReport register(final TypeRegistry registry, final Metadata metadata,
            final MetadataConfig config) {
        final PortableTypeGraph graph = metadata.lookup();
        final Map<Integer, String> failures = new LinkedHashMap<>();
        final Map<Integer, TypeDef> defs = new LinkedHashMap<>();
        for (PortableType type : graph.types()) {
            try {
                defs.put(type.id(), toTypeDef(type, graph, registry));
            } catch (TypeRegistryException e) {
                failures.put(type.id(), e.getMessage());
            }
        }

        final TypeRegistry fork = registry.fork();
        final Map<String, Object> lookups = new LinkedHashMap<>();
        defs.forEach((id, def) -> lookups.put(TypeRegistry.lookupName(id), def));
        fork.registerTypes(lookups);
        for (Integer id : defs.keySet()) {
            try {
                fork.resolve(TypeRegistry.lookupName(id));
            } catch (TypeRegistryException e) {
                failures.put(id, e.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            if (config.nodeFailurePolicy() == NodeFailurePolicy.FAIL) {
                throw new TypeRegistryException(failures.size() + " metadata type node(s) failed to resolve: "
                        + summarize(graph, failures));
            }
            failures.forEach((id, message) ->
                    LOG.warn("Skipping metadata type {} ({}): {}", id, describe(graph, id), message));
        }

        final List<Integer> registered = new ArrayList<>();
        final Map<String, Object> out = new LinkedHashMap<>();
        defs.forEach((id, def) -> {
            if (!failures.containsKey(id)) {
                registered.add(id);
                out.put(TypeRegistry.lookupName(id), def);
            }
        });
        final Map<String, Integer> derivedNames = config.registerPathNames()
                ? pathNames(registry, graph, failures)
                : Map.of();
        derivedNames.forEach((name, id) -> out.put(name, new TypeDef.LookupDef(id)));
        registry.registerTypes(out);

        if (config.signedExtensions()) {
            installSignedExtensions(registry, metadata, defs, failures);
        }

        LOG.debug("Registered {} metadata type(s), {} path name(s), {} failure(s)",
                registered.size(), derivedNames.size(), failures.size());
        DebugLogger.logMetadata("[REGISTER] v%s: %s type(s), %s path name(s), %s failure(s)",
                metadata.version(), registered.size(), derivedNames.size(), failures.size());
        return new RegistrationReport(registered, failures, derivedNames);
    }

    /**
     * Converts one node into a registry definition. References to other nodes become
     * {@code Lookup<id>} names.
     *
     * @throws TypeRegistryException if the node refers to an id missing from the graph or
     *                               carries an unparseable legacy type name
     */
    public static TypeDef toTypeDef(final PortableType type, final PortableTypeGraph graph,
            final TypeRegistry registry) {
        if (!type.path().isEmpty()) {
            final Optional<TypeDef> override = registry.lookupOverride(type.pathName());
            if (override.isPresent()) {
                return override.get();
            }
        }
        final TypeDefinition definition = type.definition();
        if (definition instanceof TypeDefinition.Composite composite) {
            return composite(type, composite, graph);
        }
        if (definition instanceof TypeDefinition.Variant variant) {
            return variant(type, variant, graph);
        }
        if (definition instanceof TypeDefinition.Sequence sequence) {
            return isU8(graph, sequence.type())
                    ? TypeDef.named("Bytes")
                    : new TypeDef.VecDef(lookup(graph, sequence.type()));
        }
        if (definition instanceof TypeDefinition.Array array) {
            final TypeDef element = isU8(graph, array.type()) ? TypeDef.named("u8") : lookup(graph, array.type());
            return new TypeDef.VecFixedDef(element, array.length());
        }
        if (definition instanceof TypeDefinition.Tuple tuple) {
            if (tuple.types().isEmpty()) {
                return TypeDefs.NULL;
            }
            final List<TypeDef> elements = new ArrayList<>(tuple.types().size());
            tuple.types().forEach(id -> elements.add(lookup(graph, id)));
            return new TypeDef.TupleDef(elements);
        }
        if (definition instanceof TypeDefinition.Primitive primitive) {
            return TypeDef.named(primitive.kind().typeName());
        }
        if (definition instanceof TypeDefinition.Compact compact) {
            return new TypeDef.CompactDef(lookup(graph, compact.type()));
        }
        if (definition instanceof TypeDefinition.BitSequence) {
            return TypeDef.named("BitVec");
        }
        final TypeDefinition.Historic historic = (TypeDefinition.Historic) definition;
        return TypeDefParser.parse(HistoricNames.sanitize(historic.typeName()));
    }

    private static TypeDef composite(final PortableType type, final TypeDefinition.Composite composite,
            final PortableTypeGraph graph) {
        final List<TypeParameter> params = type.params();
        switch (type.simpleName()) {
            case "BTreeMap":
                if (params.size() == 2 && params.get(0).type() != null && params.get(1).type() != null) {
                    return new TypeDef.MapDef(lookup(graph, params.get(0).type()), lookup(graph, params.get(1).type()));
                }
                break;
            case "BTreeSet":
                if (params.size() == 1 && params.get(0).type() != null) {
                    return new TypeDef.SetDef(lookup(graph, params.get(0).type()));
                }
                break;
            case "Cow":
            case "Box":
                if (params.size() == 1 && params.get(0).type() != null) {
                    return lookup(graph, params.get(0).type());
                }
                break;
            default:
                break;
        }
        return fields(composite.fields(), graph);
    }

    private static TypeDef variant(final PortableType type, final TypeDefinition.Variant variant,
            final PortableTypeGraph graph) {
        final List<TypeParameter> params = type.params();
        if ("Option".equals(type.simpleName()) && params.size() == 1 && params.get(0).type() != null) {
            return new TypeDef.OptionDef(lookup(graph, params.get(0).type()));
        }
        if ("Result".equals(type.simpleName()) && params.size() == 2
                && params.get(0).type() != null && params.get(1).type() != null) {
            return new TypeDef.ResultDef(lookup(graph, params.get(0).type()), lookup(graph, params.get(1).type()));
        }
        final List<TypeDef.VariantDef> variants = new ArrayList<>(variant.variants().size());
        for (VariantDefinition v : variant.variants()) {
            variants.add(new TypeDef.VariantDef(v.name(), v.index(), fields(v.fields(), graph)));
        }
        return new TypeDef.EnumDef(variants);
    }

    /**
     * Maps a field list to {@code Null}, an alias, a tuple or a struct.
     */
    private static TypeDef fields(final List<Field> fields, final PortableTypeGraph graph) {
        if (fields.isEmpty()) {
            return TypeDefs.NULL;
        }
        if (fields.stream().noneMatch(Field::isNamed)) {
            if (fields.size() == 1) {
                return lookup(graph, fields.get(0).type());
            }
            final List<TypeDef> elements = new ArrayList<>(fields.size());
            fields.forEach(f -> elements.add(lookup(graph, f.type())));
            return new TypeDef.TupleDef(elements);
        }
        final List<TypeDef.FieldDef> defs = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            final Field field = fields.get(i);
            final String name = field.isNamed() ? Names.camelCase(field.name()) : "field" + i;
            defs.add(new TypeDef.FieldDef(name, lookup(graph, field.type())));
        }
        return new TypeDef.StructDef(defs);
    }

    private static TypeDef lookup(final PortableTypeGraph graph, final int id) {
        graph.require(id);
        return new TypeDef.LookupDef(id);
    }

    private static boolean isU8(final PortableTypeGraph graph, final int id) {
        return graph.get(id)
                .map(PortableType::definition)
                .filter(d -> d instanceof TypeDefinition.Primitive p && p.kind() == PrimitiveKind.U8)
                .isPresent();
    }

    /**
     * Derives PascalCase names from node paths. Names shared by several nodes, names of
     * generic wrappers and names of built-in types are skipped.
     */
    private static Map<String, Integer> pathNames(final TypeRegistry registry, final PortableTypeGraph graph,
            final Map<Integer, String> failures) {
        final Map<String, List<Integer>> byName = new LinkedHashMap<>();
        for (PortableType type : graph.types()) {
            if (type.path().isEmpty() || WRAPPERS.contains(type.simpleName()) || failures.containsKey(type.id())) {
                continue;
            }
            final String name = type.path().stream().map(Names::pascalCase).collect(Collectors.joining());
            byName.computeIfAbsent(name, k -> new ArrayList<>()).add(type.id());
        }
        final Map<String, Integer> names = new LinkedHashMap<>();
        byName.forEach((name, ids) -> {
            if (ids.size() != 1) {
                LOG.debug("Path name {} is shared by types {}, not registering it", name, ids);
            } else if (registry.isRegistered(name) && registry.getDefinition(name).isEmpty()) {
                LOG.debug("Path name {} would shadow a built-in type, not registering it", name);
            } else {
                names.put(name, ids.get(0));
            }
        });
        return names;
    }

    private static void installSignedExtensions(final TypeRegistry registry, final Metadata metadata,
            final Map<Integer, TypeDef> defs, final Map<Integer, String> failures) {
        final List<SignedExtensionMetadata> declared = metadata.extrinsic().signedExtensions();
        if (metadata.version() < MetadataDecoder.V14) {
            // legacy metadata names extensions without types; use the registry's known tables
            registry.setSignedExtensionNames(declared.stream().map(SignedExtensionMetadata::identifier).toList());
            return;
        }
        final List<SignedExtension> extensions = new ArrayList<>(declared.size());
        for (SignedExtensionMetadata extension : declared) {
            extensions.add(new SignedExtension(extension.identifier(),
                    extensionPart(extension.type(), defs, failures),
                    extensionPart(extension.additionalSigned(), defs, failures)));
        }
        registry.registerSignedExtensionTypes(extensions);
        registry.setSignedExtensions(extensions);
    }

    private static TypeDef extensionPart(final int id, final Map<Integer, TypeDef> defs,
            final Map<Integer, String> failures) {
        final TypeDef def = defs.get(id);
        if (def != null && !failures.containsKey(id) && TypeDefs.isNull(def)) {
            return TypeDefs.NULL;
        }
        return new TypeDef.LookupDef(id);
    }

    private static String describe(final PortableTypeGraph graph, final int id) {
        return graph.get(id)
                .map(t -> t.path().isEmpty() ? t.definition().getClass().getSimpleName() : t.pathName())
                .orElse("?");
    }

    private static String summarize(final PortableTypeGraph graph, final Map<Integer, String> failures) {
        final String shown = failures.entrySet().stream()
                .limit(MAX_REPORTED_FAILURES)
                .map(e -> "#" + e.getKey() + " " + describe(graph, e.getKey()) + ": " + e.getValue())
                .collect(Collectors.joining("; "));
        return failures.size() > MAX_REPORTED_FAILURES ? shown + "; ..." : shown;
    }
}
