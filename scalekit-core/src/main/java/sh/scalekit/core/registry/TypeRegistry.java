// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scalekit.core.DebugLogger;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.codec.Names;
import sh.scalekit.core.codec.composite.EnumType;
import sh.scalekit.core.codec.composite.MapType;
import sh.scalekit.core.codec.composite.OptionType;
import sh.scalekit.core.codec.composite.ResultType;
import sh.scalekit.core.codec.composite.SetType;
import sh.scalekit.core.codec.composite.StructType;
import sh.scalekit.core.codec.composite.TupleType;
import sh.scalekit.core.codec.composite.VecFixedType;
import sh.scalekit.core.codec.composite.VecType;
import sh.scalekit.core.codec.primitive.BitVecType;
import sh.scalekit.core.codec.primitive.BoolType;
import sh.scalekit.core.codec.primitive.BytesType;
import sh.scalekit.core.codec.primitive.CompactType;
import sh.scalekit.core.codec.primitive.IntType;
import sh.scalekit.core.codec.primitive.NullType;
import sh.scalekit.core.codec.primitive.RawType;
import sh.scalekit.core.codec.primitive.TextType;
import sh.scalekit.core.error.CodecConstructionException;
import sh.scalekit.core.error.TypeRegistryException;

/**
 * Runtime table of type definitions and the resolver that turns descriptors into
 * {@link CodecType}s.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * TypeRegistry registry = new TypeRegistry();
 * registry.register("Balance", "u128");
 * registry.register("Account", "{\"nonce\":\"u32\",\"free\":\"Balance\"}");
 *
 * Struct account = registry.createType("Account", Map.of("nonce", 1, "free", 10), Struct.class);
 * byte[] bytes = account.encode();
 * }</pre>
 *
 * <p>
 * <strong>Resolution:</strong> a descriptor is parsed into a {@link TypeDef} and
 * resolved once; the resulting type graph is cached and shared by every value
 * created from it. Aliases are followed transitively; a chain of aliases that
 * returns to its start is rejected, while a type that refers to itself through a
 * composite is resolved with a {@link LazyCodecType} placeholder. Types produced by
 * a failed resolution never reach the cache.
 *
 * <p>
 * <strong>Forks:</strong> {@link #fork()} returns a child that sees this registry's
 * definitions but keeps its own registrations, cache, signed extensions and lookup
 * overrides.
 *
 * <p>
 * <strong>Thread Safety:</strong> mutations are serialized by one lock and clear the
 * resolution cache; lookups and {@code createType} read concurrent maps without
 * locking. Forks cache independently, so they should be taken after the parent is
 * fully populated.
 *
 * @since 0.1.0
 */
public final class TypeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);

    private static final String LOOKUP_PREFIX = "Lookup";

    private final @Nullable TypeRegistry parent;
    private final Map<String, Definition> definitions = new ConcurrentHashMap<>();
    private final Map<String, CodecType<?>> cache = new ConcurrentHashMap<>();
    private final Map<String, TypeDef> lookupOverrides = new ConcurrentHashMap<>();
    private final Map<String, SignedExtension> knownSignedExtensions = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile @Nullable List<SignedExtension> signedExtensions;
    private volatile long generation;

    /**
     * Either a descriptor definition or a factory.
     */
    private record Definition(@Nullable TypeDef def, @Nullable CodecFactory factory) {
    }

    /**
     * Creates a root registry with the built-in types registered.
     */
    public TypeRegistry() {
        this(null);
        registerBuiltins();
    }

    private TypeRegistry(final @Nullable TypeRegistry parent) {
        this.parent = parent;
    }

    /**
     * Returns the registration name of a portable type id, e.g. {@code Lookup42}.
     */
    public static String lookupName(final int id) {
        return LOOKUP_PREFIX + id;
    }

    /**
     * Creates a child registry layered over this one.
     */
    public TypeRegistry fork() {
        return new TypeRegistry(this);
    }

    public Optional<TypeRegistry> parent() {
        return Optional.ofNullable(parent);
    }

    // ---------------------------------------------------------------- registration

    /**
     * Registers a descriptor or alias under {@code name}, replacing any previous
     * definition.
     *
     * @throws TypeRegistryException if the descriptor cannot be parsed
     */
    public void register(final String name, final String descriptor) {
        register(name, TypeDefParser.parse(descriptor));
    }

    public void register(final String name, final TypeDef def) {
        Objects.requireNonNull(def, "def");
        put(name, new Definition(def, null));
        DebugLogger.logRegistry("[REGISTER] %s = %s", name, def.descriptor());
    }

    public void register(final String name, final CodecFactory factory) {
        Objects.requireNonNull(factory, "factory");
        put(name, new Definition(null, factory));
        DebugLogger.logRegistry("[REGISTER] %s = <factory>", name);
    }

    /**
     * Registers many definitions at once. Values may be descriptor strings,
     * {@link TypeDef}s, {@link CodecFactory}s or JSON-shaped maps. Every value is
     * converted before anything is registered, so a bad entry registers nothing.
     *
     * @throws TypeRegistryException if any value is not a valid definition
     */
    public void registerTypes(final Map<String, ?> types) {
        final Map<String, Definition> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : types.entrySet()) {
            final String name = requireName(entry.getKey());
            final Object value = entry.getValue();
            try {
                converted.put(name, value instanceof CodecFactory factory
                        ? new Definition(null, factory)
                        : new Definition(TypeDefs.from(value), null));
            } catch (TypeRegistryException e) {
                throw e.withContext("registering '" + name + "'");
            }
        }
        lock.lock();
        try {
            definitions.putAll(converted);
            invalidate();
        } finally {
            lock.unlock();
        }
        LOG.debug("Registered {} type definition(s)", converted.size());
    }

    // ---------------------------------------------------------------- queries

    boolean isCached(final String key) {
        return cache.containsKey(key);
    }

    /**
     * Resolves {@code name}, or returns empty if it cannot be resolved. Never modifies
     * the definition table.
     */
    public Optional<CodecType<?>> get(final String name) {
        try {
            return Optional.of(resolve(name));
        } catch (TypeRegistryException e) {
            LOG.debug("Type '{}' is not resolvable: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns the descriptor definition registered for {@code name} here or in a
     * parent. Factory registrations have no descriptor and yield empty.
     */
    public Optional<TypeDef> getDefinition(final String name) {
        final Definition definition = findDefinition(name);
        return definition == null ? Optional.empty() : Optional.ofNullable(definition.def());
    }

    public boolean isRegistered(final String name) {
        return findDefinition(name) != null;
    }

    /**
     * Returns the descriptor definitions registered directly on this registry, sorted
     * by name. Parent definitions and factories are not included.
     */
    public Map<String, TypeDef> definitions() {
        final Map<String, TypeDef> out = new TreeMap<>();
        definitions.forEach((name, definition) -> {
            if (definition.def() != null) {
                out.put(name, definition.def());
            }
        });
        return Collections.unmodifiableMap(out);
    }

    // ---------------------------------------------------------------- resolution

    /**
     * Resolves a descriptor to its codec type.
     *
     * @throws TypeRegistryException if the descriptor is malformed or refers to an
     *                               unknown type, or if it is a pure alias cycle
     */
    public CodecType<?> resolve(final String descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        final CodecType<?> cached = cache.get(descriptor);
        if (cached != null) {
            return cached;
        }
        return resolve(TypeDefParser.parse(descriptor));
    }

    public CodecType<?> resolve(final TypeDef def) {
        Objects.requireNonNull(def, "def");
        final CodecType<?> cached = cache.get(def.descriptor());
        if (cached != null) {
            return cached;
        }
        final long startGeneration = generation;
        final Resolver resolver = new Resolver();
        final CodecType<?> type = resolver.resolve(def, List.of(), null);
        resolver.commit(startGeneration);
        DebugLogger.logRegistry("[RESOLVE] %s (%s new type(s))", def.descriptor(), resolver.pending.size());
        return type;
    }

    /**
     * Resolves {@code descriptor} and constructs a value from {@code input}.
     *
     * @throws TypeRegistryException       if the type cannot be resolved
     * @throws sh.scalekit.core.error.CodecConstructionException if the input does not fit
     * @throws sh.scalekit.core.error.ScaleDecodingException     if byte input is malformed
     */
    public Codec createType(final String descriptor, final @Nullable Object input) {
        return resolve(descriptor).create(input);
    }

    /**
     * Like {@link #createType(String, Object)}. With {@code strict}, byte input must
     * be consumed completely; otherwise bytes after the value are ignored.
     *
     * @throws sh.scalekit.core.error.ScaleDecodingException if strict and bytes are left over
     */
    public Codec createType(final String descriptor, final @Nullable Object input, final boolean strict) {
        return resolve(descriptor).create(input, strict);
    }

    /**
     * Like {@link #createType(String, Object)}, checking the value class.
     */
    public <T extends Codec> T createType(final String descriptor, final @Nullable Object input,
            final Class<T> codecClass) {
        final Codec codec = createType(descriptor, input);
        if (!codecClass.isInstance(codec)) {
            throw new CodecConstructionException("'" + descriptor + "' produced "
                    + codec.getClass().getSimpleName() + ", not " + codecClass.getSimpleName());
        }
        return codecClass.cast(codec);
    }

    /**
     * Constructs a value of the portable type registered for {@code lookupId}.
     */
    public Codec createType(final int lookupId, final @Nullable Object input) {
        return createType(lookupName(lookupId), input);
    }

    // ---------------------------------------------------------------- signed extensions

    /**
     * Makes extensions known by identifier, for later use by
     * {@link #setSignedExtensionNames(List)}.
     */
    public void registerSignedExtensionTypes(final Collection<SignedExtension> extensions) {
        lock.lock();
        try {
            for (SignedExtension extension : extensions) {
                knownSignedExtensions.put(extension.identifier(), extension);
            }
        } finally {
            lock.unlock();
        }
    }

    public void setSignedExtensions(final List<SignedExtension> extensions) {
        lock.lock();
        try {
            this.signedExtensions = List.copyOf(extensions);
        } finally {
            lock.unlock();
        }
        DebugLogger.logRegistry("[SIGNED_EXTENSIONS] %s", identifiers(extensions));
    }

    /**
     * Activates extensions by identifier. Identifiers without a known definition are
     * logged and treated as contributing nothing.
     */
    public void setSignedExtensionNames(final List<String> identifiers) {
        final List<SignedExtension> resolved = new ArrayList<>(identifiers.size());
        for (String identifier : identifiers) {
            final SignedExtension known = findSignedExtension(identifier);
            if (known == null) {
                LOG.warn("Unknown signed extension '{}', treating it as having no extra or additional data",
                        identifier);
                resolved.add(SignedExtension.noop(identifier));
            } else {
                resolved.add(known);
            }
        }
        setSignedExtensions(resolved);
    }

    /**
     * Returns the active extensions, inherited from the parent when none were set here.
     */
    public List<SignedExtension> signedExtensions() {
        final List<SignedExtension> own = signedExtensions;
        if (own != null) {
            return own;
        }
        return parent != null ? parent.signedExtensions() : List.of();
    }

    /**
     * Returns a struct definition over the non-{@code Null} extra data of the active
     * extensions, keyed by camel-cased identifier.
     */
    public TypeDef.StructDef signedExtensionExtra() {
        final List<TypeDef.FieldDef> fields = new ArrayList<>();
        for (SignedExtension extension : signedExtensions()) {
            if (!TypeDefs.isNull(extension.extra())) {
                fields.add(new TypeDef.FieldDef(Names.camelCase(extension.identifier()), extension.extra()));
            }
        }
        return new TypeDef.StructDef(fields);
    }

    /**
     * Returns a struct definition over the non-{@code Null} additional signed data of
     * the active extensions, keyed by camel-cased identifier.
     */
    public TypeDef.StructDef signedExtensionAdditional() {
        final List<TypeDef.FieldDef> fields = new ArrayList<>();
        for (SignedExtension extension : signedExtensions()) {
            if (!TypeDefs.isNull(extension.additional())) {
                fields.add(new TypeDef.FieldDef(Names.camelCase(extension.identifier()), extension.additional()));
            }
        }
        return new TypeDef.StructDef(fields);
    }

    // ---------------------------------------------------------------- lookup overrides

    /**
     * Replaces the definition derived for metadata types whose {@code ::}-joined path
     * equals {@code path}, e.g. {@code sp_core::crypto::AccountId32}.
     */
    public void registerLookupOverride(final String path, final String descriptor) {
        final TypeDef def = TypeDefParser.parse(descriptor);
        lock.lock();
        try {
            lookupOverrides.put(requireName(path), def);
        } finally {
            lock.unlock();
        }
    }

    public Optional<TypeDef> lookupOverride(final String path) {
        final TypeDef own = lookupOverrides.get(path);
        if (own != null) {
            return Optional.of(own);
        }
        return parent != null ? parent.lookupOverride(path) : Optional.empty();
    }

    // ---------------------------------------------------------------- internals

    private void put(final String name, final Definition definition) {
        requireName(name);
        lock.lock();
        try {
            definitions.put(name, definition);
            invalidate();
        } finally {
            lock.unlock();
        }
    }

    private void invalidate() {
        generation++;
        cache.clear();
    }

    private @Nullable Definition findDefinition(final String name) {
        final Definition own = definitions.get(name);
        if (own != null) {
            return own;
        }
        return parent != null ? parent.findDefinition(name) : null;
    }

    private @Nullable SignedExtension findSignedExtension(final String identifier) {
        final SignedExtension own = knownSignedExtensions.get(identifier);
        if (own != null) {
            return own;
        }
        return parent != null ? parent.findSignedExtension(identifier) : null;
    }

    private static String requireName(final String name) {
        if (name == null || name.isBlank()) {
            throw new TypeRegistryException("Type name cannot be null or blank");
        }
        return name;
    }

    private static List<String> identifiers(final List<SignedExtension> extensions) {
        final List<String> ids = new ArrayList<>(extensions.size());
        extensions.forEach(e -> ids.add(e.identifier()));
        return ids;
    }

    private void registerBuiltins() {
        final Map<String, CodecFactory> builtins = new LinkedHashMap<>();
        builtins.put("bool", BoolType::new);
        builtins.put("Bool", BoolType::new);
        for (int bits = 8; bits <= 256; bits *= 2) {
            final int width = bits;
            builtins.put("u" + width, r -> new IntType(r, width, false));
            builtins.put("i" + width, r -> new IntType(r, width, true));
        }
        builtins.put("char", r -> new IntType(r, "char", 32, false));
        for (String alias : List.of("Text", "String", "Str", "str", "Type")) {
            builtins.put(alias, TextType::new);
        }
        builtins.put("Bytes", BytesType::new);
        builtins.put("Raw", r -> new RawType(r, "Raw", RawType.UNBOUNDED));
        builtins.put("Null", NullType::new);
        builtins.put("BitVec", BitVecType::new);
        builtins.put("H160", r -> new RawType(r, "H160", 20));
        builtins.put("H256", r -> new RawType(r, "H256", 32));
        builtins.put("H512", r -> new RawType(r, "H512", 64));
        builtins.forEach((name, factory) -> definitions.put(name, new Definition(null, factory)));
    }

    /**
     * One top-level resolution. New types are staged in {@link #pending} and only
     * published to the shared cache once the whole graph resolved.
     */
    private final class Resolver {

        private final Map<String, CodecType<?>> pending = new HashMap<>();
        private final Map<String, LazyCodecType> inProgress = new HashMap<>();

        /**
         * @param chain names of the aliases followed since the last composite boundary
         * @param name  the registered name being resolved, used to name structs and enums
         */
        CodecType<?> resolve(final TypeDef def, final List<String> chain, final @Nullable String name) {
            if (def instanceof TypeDef.NamedDef named) {
                return resolveNamed(named.name(), chain);
            }
            if (def instanceof TypeDef.LookupDef lookup) {
                return resolveNamed(lookupName(lookup.id()), chain);
            }
            if (name != null) {
                return build(def, name);
            }
            final String key = def.descriptor();
            final CodecType<?> known = known(key);
            if (known != null) {
                return known;
            }
            final CodecType<?> type = build(def, key);
            pending.put(key, type);
            return type;
        }

        private CodecType<?> resolveNamed(final String name, final List<String> chain) {
            final CodecType<?> known = known(name);
            if (known != null) {
                return known;
            }
            final LazyCodecType placeholder = inProgress.get(name);
            if (placeholder != null) {
                final int start = chain.indexOf(name);
                if (start >= 0) {
                    final List<String> cycle = new ArrayList<>(chain.subList(start, chain.size()));
                    cycle.add(name);
                    throw TypeRegistryException.aliasCycle(cycle);
                }
                return placeholder;
            }
            final Definition definition = findDefinition(name);
            if (definition == null) {
                throw TypeRegistryException.unknownType(name);
            }
            final CodecType<?> type;
            if (definition.factory() != null) {
                type = definition.factory().create(TypeRegistry.this);
            } else {
                final LazyCodecType lazy = new LazyCodecType(name, TypeRegistry.this);
                inProgress.put(name, lazy);
                final List<String> next = new ArrayList<>(chain);
                next.add(name);
                try {
                    type = resolve(definition.def(), next, name);
                } finally {
                    inProgress.remove(name);
                }
                lazy.bind(type);
            }
            pending.put(name, type);
            return type;
        }

        private CodecType<?> child(final TypeDef def) {
            return resolve(def, List.of(), null);
        }

        private CodecType<?> build(final TypeDef def, final String typeName) {
            final String canonical = def.descriptor();
            try {
                if (def instanceof TypeDef.VecDef vec) {
                    final CodecType<?> element = child(vec.element());
                    return isU8(element) ? resolveNamed("Bytes", List.of()) : new VecType(TypeRegistry.this, canonical, element);
                }
                if (def instanceof TypeDef.VecFixedDef fixed) {
                    final CodecType<?> element = child(fixed.element());
                    if (isU8(element)) {
                        return new RawType(TypeRegistry.this, canonical, fixed.length());
                    }
                    return new VecFixedType(TypeRegistry.this, canonical, element, fixed.length());
                }
                if (def instanceof TypeDef.TupleDef tuple) {
                    if (tuple.elements().isEmpty()) {
                        return resolveNamed("Null", List.of());
                    }
                    final List<CodecType<?>> elements = new ArrayList<>(tuple.elements().size());
                    tuple.elements().forEach(e -> elements.add(child(e)));
                    return new TupleType(TypeRegistry.this, canonical, elements);
                }
                if (def instanceof TypeDef.OptionDef option) {
                    return new OptionType(TypeRegistry.this, canonical, child(option.inner()));
                }
                if (def instanceof TypeDef.CompactDef compact) {
                    return compact(canonical, child(compact.inner()));
                }
                if (def instanceof TypeDef.ResultDef result) {
                    return new ResultType(TypeRegistry.this, canonical, child(result.ok()), child(result.err()));
                }
                if (def instanceof TypeDef.SetDef set) {
                    return new SetType(TypeRegistry.this, canonical, child(set.element()));
                }
                if (def instanceof TypeDef.MapDef map) {
                    return new MapType(TypeRegistry.this, canonical, child(map.key()), child(map.value()));
                }
                if (def instanceof TypeDef.StructDef struct) {
                    final List<StructType.Field> fields = new ArrayList<>(struct.fields().size());
                    for (TypeDef.FieldDef field : struct.fields()) {
                        fields.add(new StructType.Field(field.name(), field.jsonKey(), child(field.type())));
                    }
                    return new StructType(TypeRegistry.this, typeName, fields);
                }
                if (def instanceof TypeDef.EnumDef enumDef) {
                    final List<EnumType.Variant> variants = new ArrayList<>(enumDef.variants().size());
                    for (TypeDef.VariantDef variant : enumDef.variants()) {
                        variants.add(new EnumType.Variant(variant.name(), variant.index(), child(variant.payload())));
                    }
                    return new EnumType(TypeRegistry.this, typeName, variants);
                }
            } catch (IllegalArgumentException e) {
                throw TypeRegistryException.invalidDescriptor(canonical, e.getMessage());
            }
            throw TypeRegistryException.invalidDescriptor(canonical, "unsupported definition");
        }

        /**
         * Unwraps single-field newtypes down to the integer a compact is defined over.
         * {@code Compact<()>} resolves to {@code Null}.
         */
        private CodecType<?> compact(final String canonical, final CodecType<?> inner) {
            CodecType<?> current = concrete(inner);
            while (true) {
                if (current instanceof StructType struct && struct.fields().size() == 1) {
                    current = concrete(struct.fields().get(0).type());
                } else if (current instanceof TupleType tuple && tuple.types().size() == 1) {
                    current = concrete(tuple.types().get(0));
                } else {
                    break;
                }
            }
            if (current instanceof NullType) {
                return current;
            }
            if (current instanceof IntType integer && !integer.isSigned()) {
                return new CompactType(TypeRegistry.this, canonical, integer);
            }
            throw TypeRegistryException.invalidDescriptor(canonical,
                    "compact requires an unsigned integer, got " + (current == null ? inner.name() : current.name()));
        }

        private boolean isU8(final CodecType<?> type) {
            return concrete(type) instanceof IntType integer
                    && integer.bitLength() == 8
                    && !integer.isSigned()
                    && "u8".equals(integer.name());
        }

        /**
         * Follows bound placeholders; returns {@code null} for one still unbound.
         */
        private @Nullable CodecType<?> concrete(final CodecType<?> type) {
            CodecType<?> current = type;
            while (current instanceof LazyCodecType lazy) {
                if (!lazy.isBound()) {
                    return null;
                }
                current = lazy.target();
            }
            return current;
        }

        private @Nullable CodecType<?> known(final String key) {
            final CodecType<?> cached = cache.get(key);
            return cached != null ? cached : pending.get(key);
        }

        void commit(final long startGeneration) {
            lock.lock();
            try {
                if (generation == startGeneration) {
                    pending.forEach(cache::putIfAbsent);
                }
            } finally {
                lock.unlock();
            }
        }
    }
}
