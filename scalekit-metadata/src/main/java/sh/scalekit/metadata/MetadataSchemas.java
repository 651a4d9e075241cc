// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.util.LinkedHashMap;
import java.util.Map;

import sh.scalekit.core.registry.TypeRegistry;

/**
 * Fixed type definitions of the metadata formats themselves.
 *
 * <p>Metadata bodies are decoded with the codec system: the definitions below are
 * registered into a bootstrap {@link TypeRegistry} and the body is created as a
 * {@code MetadataV13} or {@code MetadataV14} struct. Field order matches the wire
 * layout.
 */
final class MetadataSchemas {

    static final String V13 = "MetadataV13";
    static final String V14 = "MetadataV14";

    private static final Map<String, String> SHARED = new LinkedHashMap<>();
    private static final Map<String, String> PORTABLE = new LinkedHashMap<>();
    private static final Map<String, String> LEGACY = new LinkedHashMap<>();

    static {
        SHARED.put("StorageHasher", """
                {"_enum": ["Blake2_128", "Blake2_256", "Blake2_128Concat", "Twox128", "Twox256",
                           "Twox64Concat", "Identity"]}""");
        SHARED.put("StorageEntryModifier", "{\"_enum\": [\"Optional\", \"Default\"]}");

        // scale-info portable registry
        PORTABLE.put("SiLookupTypeId", "Compact<u32>");
        PORTABLE.put("PortableType", "{\"id\": \"SiLookupTypeId\", \"type\": \"Si1Type\"}");
        PORTABLE.put("Si1Type", """
                {"path": "Vec<Text>", "params": "Vec<Si1TypeParameter>", "def": "Si1TypeDef",
                 "docs": "Vec<Text>"}""");
        PORTABLE.put("Si1TypeParameter", "{\"name\": \"Text\", \"type\": \"Option<SiLookupTypeId>\"}");
        PORTABLE.put("Si1TypeDef", """
                {"_enum": {
                  "Composite": "Si1TypeDefComposite",
                  "Variant": "Si1TypeDefVariant",
                  "Sequence": "Si1TypeDefSequence",
                  "Array": "Si1TypeDefArray",
                  "Tuple": "Vec<SiLookupTypeId>",
                  "Primitive": "Si0TypeDefPrimitive",
                  "Compact": "Si1TypeDefCompact",
                  "BitSequence": "Si1TypeDefBitSequence",
                  "HistoricMetaCompat": "Text"}}""");
        PORTABLE.put("Si1TypeDefComposite", "{\"fields\": \"Vec<Si1Field>\"}");
        PORTABLE.put("Si1Field", """
                {"name": "Option<Text>", "type": "SiLookupTypeId", "typeName": "Option<Text>",
                 "docs": "Vec<Text>"}""");
        PORTABLE.put("Si1TypeDefVariant", "{\"variants\": \"Vec<Si1Variant>\"}");
        PORTABLE.put("Si1Variant", """
                {"name": "Text", "fields": "Vec<Si1Field>", "index": "u8", "docs": "Vec<Text>"}""");
        PORTABLE.put("Si1TypeDefSequence", "{\"type\": \"SiLookupTypeId\"}");
        PORTABLE.put("Si1TypeDefArray", "{\"len\": \"u32\", \"type\": \"SiLookupTypeId\"}");
        PORTABLE.put("Si1TypeDefCompact", "{\"type\": \"SiLookupTypeId\"}");
        PORTABLE.put("Si1TypeDefBitSequence", "{\"bitStoreType\": \"SiLookupTypeId\", \"bitOrderType\": \"SiLookupTypeId\"}");
        PORTABLE.put("Si0TypeDefPrimitive", """
                {"_enum": ["Bool", "Char", "Str", "U8", "U16", "U32", "U64", "U128", "U256",
                           "I8", "I16", "I32", "I64", "I128", "I256"]}""");

        // v14 descriptor tables
        PORTABLE.put("StorageEntryTypeV14", "{\"_enum\": {\"Plain\": \"SiLookupTypeId\", \"Map\": \"StorageEntryMapV14\"}}");
        PORTABLE.put("StorageEntryMapV14", """
                {"hashers": "Vec<StorageHasher>", "key": "SiLookupTypeId", "value": "SiLookupTypeId"}""");
        PORTABLE.put("StorageEntryMetadataV14", """
                {"name": "Text", "modifier": "StorageEntryModifier", "type": "StorageEntryTypeV14",
                 "fallback": "Bytes", "docs": "Vec<Text>"}""");
        PORTABLE.put("PalletStorageMetadataV14", "{\"prefix\": \"Text\", \"items\": \"Vec<StorageEntryMetadataV14>\"}");
        PORTABLE.put("PalletTypeRefV14", "{\"type\": \"SiLookupTypeId\"}");
        PORTABLE.put("PalletConstantMetadataV14", """
                {"name": "Text", "type": "SiLookupTypeId", "value": "Bytes", "docs": "Vec<Text>"}""");
        PORTABLE.put("PalletMetadataV14", """
                {"name": "Text",
                 "storage": "Option<PalletStorageMetadataV14>",
                 "calls": "Option<PalletTypeRefV14>",
                 "events": "Option<PalletTypeRefV14>",
                 "constants": "Vec<PalletConstantMetadataV14>",
                 "errors": "Option<PalletTypeRefV14>",
                 "index": "u8"}""");
        PORTABLE.put("SignedExtensionMetadataV14", """
                {"identifier": "Text", "type": "SiLookupTypeId", "additionalSigned": "SiLookupTypeId"}""");
        PORTABLE.put("ExtrinsicMetadataV14", """
                {"type": "SiLookupTypeId", "version": "u8", "signedExtensions": "Vec<SignedExtensionMetadataV14>"}""");
        PORTABLE.put(V14, """
                {"lookup": "Vec<PortableType>", "pallets": "Vec<PalletMetadataV14>",
                 "extrinsic": "ExtrinsicMetadataV14", "type": "SiLookupTypeId"}""");

        // v13: types are carried as their textual names
        LEGACY.put("MapTypeV13", """
                {"hasher": "StorageHasher", "key": "Type", "value": "Type", "linked": "bool"}""");
        LEGACY.put("DoubleMapTypeV13", """
                {"hasher": "StorageHasher", "key1": "Type", "key2": "Type", "value": "Type",
                 "key2Hasher": "StorageHasher"}""");
        LEGACY.put("NMapTypeV13", "{\"keyVec\": \"Vec<Type>\", \"hashers\": \"Vec<StorageHasher>\", \"value\": \"Type\"}");
        LEGACY.put("StorageEntryTypeV13", """
                {"_enum": {"Plain": "Type", "Map": "MapTypeV13", "DoubleMap": "DoubleMapTypeV13",
                           "NMap": "NMapTypeV13"}}""");
        LEGACY.put("StorageEntryMetadataV13", """
                {"name": "Text", "modifier": "StorageEntryModifier", "type": "StorageEntryTypeV13",
                 "fallback": "Bytes", "docs": "Vec<Text>"}""");
        LEGACY.put("StorageMetadataV13", "{\"prefix\": \"Text\", \"items\": \"Vec<StorageEntryMetadataV13>\"}");
        LEGACY.put("FunctionArgumentMetadataV9", "{\"name\": \"Text\", \"type\": \"Type\"}");
        LEGACY.put("FunctionMetadataV9", """
                {"name": "Text", "args": "Vec<FunctionArgumentMetadataV9>", "docs": "Vec<Text>"}""");
        LEGACY.put("EventMetadataV9", "{\"name\": \"Text\", \"args\": \"Vec<Type>\", \"docs\": \"Vec<Text>\"}");
        LEGACY.put("ModuleConstantMetadataV9", """
                {"name": "Text", "type": "Type", "value": "Bytes", "docs": "Vec<Text>"}""");
        LEGACY.put("ErrorMetadataV9", "{\"name\": \"Text\", \"docs\": \"Vec<Text>\"}");
        LEGACY.put("ModuleMetadataV13", """
                {"name": "Text",
                 "storage": "Option<StorageMetadataV13>",
                 "calls": "Option<Vec<FunctionMetadataV9>>",
                 "events": "Option<Vec<EventMetadataV9>>",
                 "constants": "Vec<ModuleConstantMetadataV9>",
                 "errors": "Vec<ErrorMetadataV9>",
                 "index": "u8"}""");
        LEGACY.put("ExtrinsicMetadataV11", "{\"version\": \"u8\", \"signedExtensions\": \"Vec<Text>\"}");
        LEGACY.put(V13, "{\"modules\": \"Vec<ModuleMetadataV13>\", \"extrinsic\": \"ExtrinsicMetadataV11\"}");
    }

    private MetadataSchemas() {
        // Utility class
    }

    /**
     * Creates a registry holding every metadata schema.
     */
    static TypeRegistry newRegistry() {
        final TypeRegistry registry = new TypeRegistry();
        registry.registerTypes(SHARED);
        registry.registerTypes(PORTABLE);
        registry.registerTypes(LEGACY);
        return registry;
    }

    /**
     * Returns every schema definition by name, in registration order.
     */
    static Map<String, String> all() {
        final Map<String, String> all = new LinkedHashMap<>(SHARED);
        all.putAll(PORTABLE);
        all.putAll(LEGACY);
        return all;
    }
}
