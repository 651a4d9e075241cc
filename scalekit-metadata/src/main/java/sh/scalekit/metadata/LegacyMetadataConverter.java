// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import static sh.scalekit.metadata.Structs.bytes;
import static sh.scalekit.metadata.Structs.enumValue;
import static sh.scalekit.metadata.Structs.integer;
import static sh.scalekit.metadata.Structs.optional;
import static sh.scalekit.metadata.Structs.sequence;
import static sh.scalekit.metadata.Structs.structs;
import static sh.scalekit.metadata.Structs.text;
import static sh.scalekit.metadata.Structs.texts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.composite.EnumValue;
import sh.scalekit.core.codec.composite.Sequence;
import sh.scalekit.core.codec.composite.Struct;
import sh.scalekit.core.codec.primitive.Text;
import sh.scalekit.metadata.model.ConstantMetadata;
import sh.scalekit.metadata.model.ExtrinsicMetadata;
import sh.scalekit.metadata.model.Field;
import sh.scalekit.metadata.model.Metadata;
import sh.scalekit.metadata.model.PalletMetadata;
import sh.scalekit.metadata.model.PortableType;
import sh.scalekit.metadata.model.PortableTypeGraph;
import sh.scalekit.metadata.model.SignedExtensionMetadata;
import sh.scalekit.metadata.model.StorageEntryMetadata;
import sh.scalekit.metadata.model.StorageHasher;
import sh.scalekit.metadata.model.TypeDefinition;
import sh.scalekit.metadata.model.VariantDefinition;

/**
 * Normalizes legacy (v13) metadata into the portable form.
 *
 * <p>Every distinct type name becomes a {@link TypeDefinition.Historic} node; ids are
 * assigned in order of first use. Calls, events and errors of a module become
 * variant nodes with path {@code [Module, Call|Event|Error]}, and double and n-map
 * keys become tuple nodes.
 *
 * <p>Instances are single use.
 */
final class LegacyMetadataConverter {

    private static final String NULL = "Null";

    private final int version;
    private final List<PortableType> types = new ArrayList<>();
    private final Map<String, Integer> historicIds = new HashMap<>();

    LegacyMetadataConverter(final int version) {
        this.version = version;
    }

    Metadata convert(final Struct body) {
        final List<PalletMetadata> pallets = new ArrayList<>();
        for (Struct module : structs(body, "modules")) {
            pallets.add(module(module));
        }
        final Struct extrinsic = body.getAs("extrinsic", Struct.class);
        final List<SignedExtensionMetadata> extensions = new ArrayList<>();
        for (String identifier : texts(extrinsic, "signedExtensions")) {
            extensions.add(new SignedExtensionMetadata(identifier, historic(NULL), historic(NULL)));
        }
        return new Metadata(version, new PortableTypeGraph(types), pallets,
                new ExtrinsicMetadata(null, integer(extrinsic, "version"), extensions), null);
    }

    private PalletMetadata module(final Struct module) {
        final String name = text(module, "name");
        final Struct storage = (Struct) optional(module, "storage");
        final List<StorageEntryMetadata> entries = new ArrayList<>();
        if (storage != null) {
            for (Struct item : structs(storage, "items")) {
                entries.add(storageEntry(item));
            }
        }
        final List<ConstantMetadata> constants = new ArrayList<>();
        for (Struct constant : structs(module, "constants")) {
            constants.add(new ConstantMetadata(text(constant, "name"), historic(text(constant, "type")),
                    bytes(constant, "value"), texts(constant, "docs")));
        }
        return new PalletMetadata(
                name,
                integer(module, "index"),
                storage == null ? null : text(storage, "prefix"),
                entries,
                calls(name, optional(module, "calls")),
                events(name, optional(module, "events")),
                errors(name, sequence(module, "errors")),
                constants);
    }

    private @Nullable Integer calls(final String module, final @Nullable Codec calls) {
        if (calls == null) {
            return null;
        }
        final List<VariantDefinition> variants = new ArrayList<>();
        int index = 0;
        for (Struct call : Structs.structs((Sequence) calls)) {
            final List<Field> fields = new ArrayList<>();
            for (Struct arg : structs(call, "args")) {
                final String typeName = text(arg, "type");
                fields.add(new Field(text(arg, "name"), historic(typeName), typeName, List.of()));
            }
            variants.add(new VariantDefinition(text(call, "name"), fields, index++, texts(call, "docs")));
        }
        return add(List.of(module, "Call"), new TypeDefinition.Variant(variants));
    }

    private @Nullable Integer events(final String module, final @Nullable Codec events) {
        if (events == null) {
            return null;
        }
        final List<VariantDefinition> variants = new ArrayList<>();
        int index = 0;
        for (Struct event : Structs.structs((Sequence) events)) {
            final List<Field> fields = new ArrayList<>();
            for (String typeName : texts(event, "args")) {
                fields.add(new Field(null, historic(typeName), typeName, List.of()));
            }
            variants.add(new VariantDefinition(text(event, "name"), fields, index++, texts(event, "docs")));
        }
        return add(List.of(module, "Event"), new TypeDefinition.Variant(variants));
    }

    private @Nullable Integer errors(final String module, final Sequence errors) {
        if (errors.size() == 0) {
            return null;
        }
        final List<VariantDefinition> variants = new ArrayList<>();
        int index = 0;
        for (Struct error : Structs.structs(errors)) {
            variants.add(new VariantDefinition(text(error, "name"), List.of(), index++, texts(error, "docs")));
        }
        return add(List.of(module, "Error"), new TypeDefinition.Variant(variants));
    }

    private StorageEntryMetadata storageEntry(final Struct item) {
        final EnumValue type = enumValue(item, "type");
        final StorageEntryMetadata.StorageEntryType entryType;
        switch (type.variantName()) {
            case "Plain":
                entryType = new StorageEntryMetadata.PlainType(historic(((Text) type.value()).value()));
                break;
            case "Map": {
                final Struct map = type.valueAs(Struct.class);
                entryType = new StorageEntryMetadata.MapType(
                        List.of(hasher(map, "hasher")),
                        historic(text(map, "key")),
                        historic(text(map, "value")));
                break;
            }
            case "DoubleMap": {
                final Struct map = type.valueAs(Struct.class);
                entryType = new StorageEntryMetadata.MapType(
                        List.of(hasher(map, "hasher"), hasher(map, "key2Hasher")),
                        tuple(List.of(historic(text(map, "key1")), historic(text(map, "key2")))),
                        historic(text(map, "value")));
                break;
            }
            default: {
                final Struct map = type.valueAs(Struct.class);
                final List<Integer> keys = new ArrayList<>();
                for (String key : texts(map, "keyVec")) {
                    keys.add(historic(key));
                }
                entryType = new StorageEntryMetadata.MapType(
                        MetadataDecoder.hashers(sequence(map, "hashers")),
                        keys.size() == 1 ? keys.get(0) : tuple(keys),
                        historic(text(map, "value")));
                break;
            }
        }
        return new StorageEntryMetadata(text(item, "name"), MetadataDecoder.modifier(item), entryType,
                bytes(item, "fallback"), texts(item, "docs"));
    }

    private static StorageHasher hasher(final Struct map, final String field) {
        return StorageHasher.fromVariant(enumValue(map, field).variantName());
    }

    private int historic(final String typeName) {
        final Integer known = historicIds.get(typeName);
        if (known != null) {
            return known;
        }
        final int id = add(List.of(), new TypeDefinition.Historic(typeName));
        historicIds.put(typeName, id);
        return id;
    }

    private int tuple(final List<Integer> elements) {
        return add(List.of(), new TypeDefinition.Tuple(elements));
    }

    private int add(final List<String> path, final TypeDefinition definition) {
        final int id = types.size();
        types.add(new PortableType(id, path, List.of(), definition, List.of()));
        return id;
    }
}
