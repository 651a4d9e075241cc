// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import static sh.scalekit.metadata.Structs.bytes;
import static sh.scalekit.metadata.Structs.enumValue;
import static sh.scalekit.metadata.Structs.id;
import static sh.scalekit.metadata.Structs.integer;
import static sh.scalekit.metadata.Structs.optional;
import static sh.scalekit.metadata.Structs.optionalId;
import static sh.scalekit.metadata.Structs.optionalText;
import static sh.scalekit.metadata.Structs.structs;
import static sh.scalekit.metadata.Structs.text;
import static sh.scalekit.metadata.Structs.texts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scalekit.core.DebugLogger;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.composite.EnumValue;
import sh.scalekit.core.codec.composite.Sequence;
import sh.scalekit.core.codec.composite.Struct;
import sh.scalekit.core.codec.primitive.Text;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.error.ScaleException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.metadata.model.ConstantMetadata;
import sh.scalekit.metadata.model.ExtrinsicMetadata;
import sh.scalekit.metadata.model.Field;
import sh.scalekit.metadata.model.Metadata;
import sh.scalekit.metadata.model.PalletMetadata;
import sh.scalekit.metadata.model.PortableType;
import sh.scalekit.metadata.model.PortableTypeGraph;
import sh.scalekit.metadata.model.PrimitiveKind;
import sh.scalekit.metadata.model.SignedExtensionMetadata;
import sh.scalekit.metadata.model.StorageEntryMetadata;
import sh.scalekit.metadata.model.StorageHasher;
import sh.scalekit.metadata.model.TypeDefinition;
import sh.scalekit.metadata.model.TypeParameter;
import sh.scalekit.metadata.model.VariantDefinition;
import sh.scalekit.primitives.Hex;

/**
 * Decodes runtime metadata blobs.
 *
 * <p>A blob starts with the magic {@code 0x6d657461} ("meta") and one version byte.
 * Versions 13 and 14 are supported; both are normalized into a {@link Metadata}
 * with a portable type graph. The body itself is decoded by the codec system,
 * using the schemas in {@link MetadataSchemas}.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * Metadata metadata = MetadataDecoder.decode(bytes);
 * PalletMetadata balances = metadata.pallet("Balances").orElseThrow();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class MetadataDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataDecoder.class);

    /** The envelope magic, {@code "meta"} in ASCII. */
    public static final int MAGIC = 0x6d657461;

    public static final int V13 = 13;
    public static final int V14 = 14;

    private static final int ENVELOPE_LENGTH = 5;

    private MetadataDecoder() {
        // Utility class
    }

    /**
     * Lazily built registry of the metadata schemas, shared by all decodes.
     */
    private static final class Schemas {
        static final TypeRegistry REGISTRY = MetadataSchemas.newRegistry();
    }

    /**
     * Decodes a hex-encoded metadata blob.
     *
     * @throws ScaleDecodingException if the input is not hex or not valid metadata
     */
    public static Metadata decode(final String hex) {
        final byte[] bytes;
        try {
            bytes = Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new ScaleDecodingException("Metadata is not valid hex: " + e.getMessage(), e);
        }
        return decode(bytes);
    }

    /**
     * Decodes a metadata blob.
     *
     * @param bytes the blob, starting with the magic
     * @return the normalized metadata
     * @throws ScaleDecodingException if the magic or version is wrong or the body is malformed
     */
    public static Metadata decode(final byte[] bytes) {
        final int version = version(bytes);
        final byte[] body = Arrays.copyOfRange(bytes, ENVELOPE_LENGTH, bytes.length);
        final Metadata metadata;
        if (version == V14) {
            metadata = fromV14(decodeBody(MetadataSchemas.V14, body));
        } else {
            metadata = new LegacyMetadataConverter(version).convert(decodeBody(MetadataSchemas.V13, body));
        }
        LOG.debug("Decoded metadata v{}: {} type(s), {} pallet(s)",
                version, metadata.lookup().size(), metadata.pallets().size());
        DebugLogger.logMetadata("[DECODE] v%s, %s byte(s), %s type(s), %s pallet(s)",
                version, bytes.length, metadata.lookup().size(), metadata.pallets().size());
        return metadata;
    }

    /**
     * Reads and validates the envelope.
     *
     * @return the metadata version
     * @throws ScaleDecodingException if the magic is wrong or the version is unsupported
     */
    public static int version(final byte[] bytes) {
        if (bytes.length < ENVELOPE_LENGTH) {
            throw ScaleDecodingException.at(0, "Metadata too short: " + bytes.length + " byte(s)");
        }
        final int magic = (bytes[0] & 0xFF) << 24 | (bytes[1] & 0xFF) << 16 | (bytes[2] & 0xFF) << 8 | bytes[3] & 0xFF;
        if (magic != MAGIC) {
            throw ScaleDecodingException.at(0, "Invalid metadata magic " + Hex.encode(bytes, 0, 4)
                    + ", expected 0x6d657461");
        }
        final int version = bytes[4] & 0xFF;
        if (version != V13 && version != V14) {
            throw ScaleDecodingException.at(4, "Unsupported metadata version " + version);
        }
        return version;
    }

    private static Struct decodeBody(final String schema, final byte[] body) {
        try {
            return (Struct) Schemas.REGISTRY.resolve(schema).decodeExact(body);
        } catch (ScaleException e) {
            throw new ScaleDecodingException(schema + " -> " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- v14

    private static Metadata fromV14(final Struct body) {
        final List<PortableType> types = new ArrayList<>();
        for (Struct entry : structs(body, "lookup")) {
            types.add(portableType(entry));
        }
        final List<PalletMetadata> pallets = new ArrayList<>();
        for (Struct pallet : structs(body, "pallets")) {
            pallets.add(pallet(pallet));
        }
        final Struct extrinsic = body.getAs("extrinsic", Struct.class);
        final List<SignedExtensionMetadata> extensions = new ArrayList<>();
        for (Struct extension : structs(extrinsic, "signedExtensions")) {
            extensions.add(new SignedExtensionMetadata(
                    text(extension, "identifier"), id(extension, "type"), id(extension, "additionalSigned")));
        }
        return new Metadata(V14,
                new PortableTypeGraph(types),
                pallets,
                new ExtrinsicMetadata(id(extrinsic, "type"), integer(extrinsic, "version"), extensions),
                id(body, "type"));
    }

    private static PortableType portableType(final Struct entry) {
        final Struct type = entry.getAs("type", Struct.class);
        final List<TypeParameter> params = new ArrayList<>();
        for (Struct param : structs(type, "params")) {
            params.add(new TypeParameter(text(param, "name"), optionalId(param, "type")));
        }
        return new PortableType(id(entry, "id"), texts(type, "path"), params,
                definition(enumValue(type, "def")), texts(type, "docs"));
    }

    private static TypeDefinition definition(final EnumValue def) {
        final Codec payload = def.value();
        switch (def.variantName()) {
            case "Composite":
                return new TypeDefinition.Composite(fields((Struct) payload));
            case "Variant": {
                final List<VariantDefinition> variants = new ArrayList<>();
                for (Struct variant : structs((Struct) payload, "variants")) {
                    variants.add(new VariantDefinition(text(variant, "name"), fields(variant),
                            integer(variant, "index"), texts(variant, "docs")));
                }
                return new TypeDefinition.Variant(variants);
            }
            case "Sequence":
                return new TypeDefinition.Sequence(id((Struct) payload, "type"));
            case "Array":
                return new TypeDefinition.Array(integer((Struct) payload, "len"), id((Struct) payload, "type"));
            case "Tuple":
                return new TypeDefinition.Tuple(Structs.ids((Sequence) payload));
            case "Primitive":
                return new TypeDefinition.Primitive(PrimitiveKind.fromVariant(((EnumValue) payload).variantName()));
            case "Compact":
                return new TypeDefinition.Compact(id((Struct) payload, "type"));
            case "BitSequence":
                return new TypeDefinition.BitSequence(
                        id((Struct) payload, "bitStoreType"), id((Struct) payload, "bitOrderType"));
            case "HistoricMetaCompat":
                return new TypeDefinition.Historic(((Text) payload).value());
            default:
                throw new ScaleDecodingException("Unsupported type definition '" + def.variantName() + "'");
        }
    }

    private static List<Field> fields(final Struct owner) {
        final List<Field> fields = new ArrayList<>();
        for (Struct field : structs(owner, "fields")) {
            fields.add(new Field(optionalText(field, "name"), id(field, "type"),
                    optionalText(field, "typeName"), texts(field, "docs")));
        }
        return fields;
    }

    private static PalletMetadata pallet(final Struct pallet) {
        final Struct storage = (Struct) optional(pallet, "storage");
        final List<StorageEntryMetadata> entries = new ArrayList<>();
        if (storage != null) {
            for (Struct item : structs(storage, "items")) {
                entries.add(storageEntry(item));
            }
        }
        final List<ConstantMetadata> constants = new ArrayList<>();
        for (Struct constant : structs(pallet, "constants")) {
            constants.add(new ConstantMetadata(text(constant, "name"), id(constant, "type"),
                    bytes(constant, "value"), texts(constant, "docs")));
        }
        return new PalletMetadata(
                text(pallet, "name"),
                integer(pallet, "index"),
                storage == null ? null : text(storage, "prefix"),
                entries,
                typeRef(pallet, "calls"),
                typeRef(pallet, "events"),
                typeRef(pallet, "errors"),
                constants);
    }

    private static @Nullable Integer typeRef(final Struct pallet, final String field) {
        final Codec ref = optional(pallet, field);
        return ref == null ? null : id((Struct) ref, "type");
    }

    private static StorageEntryMetadata storageEntry(final Struct item) {
        final EnumValue type = enumValue(item, "type");
        final StorageEntryMetadata.StorageEntryType entryType;
        if (type.isVariant("Plain")) {
            entryType = new StorageEntryMetadata.PlainType(id(type.value()));
        } else {
            final Struct map = type.valueAs(Struct.class);
            entryType = new StorageEntryMetadata.MapType(hashers(Structs.sequence(map, "hashers")),
                    id(map, "key"), id(map, "value"));
        }
        return new StorageEntryMetadata(text(item, "name"), modifier(item), entryType,
                bytes(item, "fallback"), texts(item, "docs"));
    }

    static StorageEntryMetadata.Modifier modifier(final Struct item) {
        return enumValue(item, "modifier").isVariant("Optional")
                ? StorageEntryMetadata.Modifier.OPTIONAL
                : StorageEntryMetadata.Modifier.DEFAULT;
    }

    static List<StorageHasher> hashers(final Sequence hashers) {
        final List<StorageHasher> out = new ArrayList<>(hashers.size());
        for (Codec hasher : hashers) {
            out.add(StorageHasher.fromVariant(((EnumValue) hasher).variantName()));
        }
        return out;
    }
}
