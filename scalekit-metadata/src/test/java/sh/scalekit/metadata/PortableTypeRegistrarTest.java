// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.codec.composite.EnumValue;
import sh.scalekit.core.codec.composite.MapType;
import sh.scalekit.core.codec.composite.OptionType;
import sh.scalekit.core.codec.composite.Struct;
import sh.scalekit.core.codec.primitive.Bytes;
import sh.scalekit.core.codec.primitive.RawType;
import sh.scalekit.core.error.TypeRegistryException;
import sh.scalekit.core.registry.TypeDef;
import sh.scalekit.core.registry.TypeDefs;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.metadata.model.ExtrinsicMetadata;
import sh.scalekit.metadata.model.Field;
import sh.scalekit.metadata.model.Metadata;
import sh.scalekit.metadata.model.PortableType;
import sh.scalekit.metadata.model.PortableTypeGraph;
import sh.scalekit.metadata.model.PrimitiveKind;
import sh.scalekit.metadata.model.TypeDefinition;
import sh.scalekit.metadata.model.TypeParameter;
import sh.scalekit.metadata.model.VariantDefinition;
import sh.scalekit.primitives.Hex;

class PortableTypeRegistrarTest {

    private TypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
    }

    private static PortableType node(final int id, final TypeDefinition definition) {
        return new PortableType(id, definition);
    }

    private static PortableType node(final int id, final List<String> path, final List<TypeParameter> params,
            final TypeDefinition definition) {
        return new PortableType(id, path, params, definition, List.of());
    }

    private static TypeDefinition primitive(final PrimitiveKind kind) {
        return new TypeDefinition.Primitive(kind);
    }

    private static Field named(final String name, final int type) {
        return new Field(name, type, null, List.of());
    }

    private static Field unnamed(final int type) {
        return new Field(null, type, null, List.of());
    }

    private static Metadata metadata(final PortableType... types) {
        return new Metadata(14, new PortableTypeGraph(List.of(types)), List.of(),
                new ExtrinsicMetadata(null, 4, List.of()), null);
    }

    @Nested
    @DisplayName("Node conversion")
    class Conversion {

        private final PortableTypeGraph graph = new PortableTypeGraph(List.of(
                node(0, primitive(PrimitiveKind.U8)),
                node(1, primitive(PrimitiveKind.U32)),
                node(2, primitive(PrimitiveKind.STR))));

        private TypeDef convert(final TypeDefinition definition) {
            return PortableTypeRegistrar.toTypeDef(node(9, definition), graph, registry);
        }

        private TypeDef convert(final List<String> path, final List<TypeParameter> params,
                final TypeDefinition definition) {
            return PortableTypeRegistrar.toTypeDef(node(9, path, params, definition), graph, registry);
        }

        @Test
        void testPrimitives() {
            assertEquals(TypeDef.named("u32"), convert(primitive(PrimitiveKind.U32)));
            assertEquals(TypeDef.named("Text"), convert(primitive(PrimitiveKind.STR)));
            assertEquals(TypeDef.named("char"), convert(primitive(PrimitiveKind.CHAR)));
            assertEquals(TypeDef.named("BitVec"), convert(new TypeDefinition.BitSequence(0, 1)));
        }

        @Test
        void testByteSpecializations() {
            assertEquals(TypeDef.named("Bytes"), convert(new TypeDefinition.Sequence(0)));
            assertEquals(new TypeDef.VecDef(new TypeDef.LookupDef(1)), convert(new TypeDefinition.Sequence(1)));
            assertEquals(new TypeDef.VecFixedDef(TypeDef.named("u8"), 32), convert(new TypeDefinition.Array(32, 0)));
            assertEquals(new TypeDef.VecFixedDef(new TypeDef.LookupDef(1), 4), convert(new TypeDefinition.Array(4, 1)));
        }

        @Test
        void testComposites() {
            assertSame(TypeDefs.NULL, convert(new TypeDefinition.Composite(List.of())));
            assertEquals(new TypeDef.LookupDef(1), convert(new TypeDefinition.Composite(List.of(unnamed(1)))));
            assertEquals(new TypeDef.TupleDef(List.of(new TypeDef.LookupDef(1), new TypeDef.LookupDef(2))),
                    convert(new TypeDefinition.Composite(List.of(unnamed(1), unnamed(2)))));
            assertEquals(new TypeDef.StructDef(List.of(
                            new TypeDef.FieldDef("freeBalance", new TypeDef.LookupDef(1)),
                            new TypeDef.FieldDef("memo", new TypeDef.LookupDef(2)))),
                    convert(new TypeDefinition.Composite(List.of(named("free_balance", 1), named("memo", 2)))));
        }

        @Test
        void testTuplesAndCompacts() {
            assertSame(TypeDefs.NULL, convert(new TypeDefinition.Tuple(List.of())));
            assertEquals(new TypeDef.TupleDef(List.of(new TypeDef.LookupDef(0), new TypeDef.LookupDef(1))),
                    convert(new TypeDefinition.Tuple(List.of(0, 1))));
            assertEquals(new TypeDef.CompactDef(new TypeDef.LookupDef(1)), convert(new TypeDefinition.Compact(1)));
        }

        @Test
        void testVariants() {
            TypeDef def = convert(new TypeDefinition.Variant(List.of(
                    new VariantDefinition("Idle", List.of(), 0, List.of()),
                    new VariantDefinition("Paid", List.of(unnamed(1)), 3, List.of()),
                    new VariantDefinition("Sent", List.of(named("to", 2), named("amount", 1)), 4, List.of()))));

            TypeDef.EnumDef enumDef = assertInstanceOf(TypeDef.EnumDef.class, def);
            assertEquals(new TypeDef.VariantDef("Idle", 0, TypeDefs.NULL), enumDef.variants().get(0));
            assertEquals(new TypeDef.VariantDef("Paid", 3, new TypeDef.LookupDef(1)), enumDef.variants().get(1));
            assertInstanceOf(TypeDef.StructDef.class, enumDef.variants().get(2).payload());
        }

        @Test
        @DisplayName("Well-known generic paths map to built-in shapes")
        void testWellKnownPaths() {
            TypeDefinition optionShape = new TypeDefinition.Variant(List.of(
                    new VariantDefinition("None", List.of(), 0, List.of()),
                    new VariantDefinition("Some", List.of(unnamed(1)), 1, List.of())));
            assertEquals(new TypeDef.OptionDef(new TypeDef.LookupDef(1)),
                    convert(List.of("Option"), List.of(new TypeParameter("T", 1)), optionShape));

            TypeDefinition resultShape = new TypeDefinition.Variant(List.of(
                    new VariantDefinition("Ok", List.of(unnamed(1)), 0, List.of()),
                    new VariantDefinition("Err", List.of(unnamed(2)), 1, List.of())));
            assertEquals(new TypeDef.ResultDef(new TypeDef.LookupDef(1), new TypeDef.LookupDef(2)),
                    convert(List.of("Result"), List.of(new TypeParameter("T", 1), new TypeParameter("E", 2)),
                            resultShape));

            TypeDefinition wrapped = new TypeDefinition.Composite(List.of(unnamed(5)));
            assertEquals(new TypeDef.MapDef(new TypeDef.LookupDef(2), new TypeDef.LookupDef(1)),
                    convert(List.of("BTreeMap"), List.of(new TypeParameter("K", 2), new TypeParameter("V", 1)),
                            wrapped));
            assertEquals(new TypeDef.SetDef(new TypeDef.LookupDef(1)),
                    convert(List.of("BTreeSet"), List.of(new TypeParameter("T", 1)), wrapped));
            assertEquals(new TypeDef.LookupDef(2),
                    convert(List.of("Cow"), List.of(new TypeParameter("T", 2)), wrapped));
        }

        @Test
        void testHistoricNamesAreParsed() {
            assertEquals(new TypeDef.VecDef(TypeDef.named("Hash")),
                    convert(new TypeDefinition.Historic("Vec<<T as frame_system::Config>::Hash>")));
            assertEquals(new TypeDef.CompactDef(TypeDef.named("Balance")),
                    convert(new TypeDefinition.Historic("Compact<T::Balance>")));
        }

        @Test
        void testLookupOverrideWins() {
            registry.registerLookupOverride("sp_core::crypto::AccountId32", "H256");

            TypeDef def = convert(List.of("sp_core", "crypto", "AccountId32"), List.of(),
                    new TypeDefinition.Composite(List.of(unnamed(1))));

            assertEquals(TypeDef.named("H256"), def);
        }

        @Test
        void testDanglingReference() {
            TypeRegistryException ex = assertThrows(TypeRegistryException.class,
                    () -> convert(new TypeDefinition.Sequence(42)));
            assertEquals("Dangling portable type id 42", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Registering the demo runtime")
    class DemoRuntime {

        private RegistrationReport report;

        @BeforeEach
        void register() {
            report = PortableTypeRegistrar.register(registry, MetadataDecoder.decode(MetadataFixtures.demoV14()));
        }

        @Test
        void testReport() {
            assertFalse(report.hasFailures());
            assertEquals(12, report.registered().size());
            assertEquals(Map.of(
                    "PalletDemoInfo", MetadataFixtures.INFO,
                    "DemoNode", MetadataFixtures.NODE,
                    "PalletDemoCall", MetadataFixtures.CALL,
                    "SpCoreCryptoAccountId32", MetadataFixtures.ACCOUNT), report.derivedNames());
        }

        @Test
        void testStructByPathName() {
            Struct info = registry.createType("PalletDemoInfo", Hex.decode("0x0700000001"), Struct.class);

            assertEquals("{\"a\":7,\"b\":true}", info.toJson().toString());
            assertEquals("0x0700000001", Hex.encode(registry.createType(MetadataFixtures.INFO, info).encode()));
        }

        @Test
        @DisplayName("A self-referential node resolves through its Option wrapper")
        void testRecursiveNode() {
            Struct node = registry.createType("DemoNode", Hex.decode("0x01010200"), Struct.class);

            assertEquals("{\"value\":1,\"next\":{\"value\":2,\"next\":null}}", node.toJson().toString());
            assertInstanceOf(OptionType.class, registry.resolve(TypeRegistry.lookupName(MetadataFixtures.OPTION_NODE)));
        }

        @Test
        void testByteShapes() {
            assertInstanceOf(Bytes.class, registry.createType(MetadataFixtures.BYTES, "0x6869"));
            CodecType<?> account = registry.resolve("SpCoreCryptoAccountId32");
            RawType raw = assertInstanceOf(RawType.class, account);
            assertEquals(32, raw.length());
        }

        @Test
        void testCallEnum() {
            EnumValue call = registry.createType("PalletDemoCall", Hex.decode("0x00086869"), EnumValue.class);

            assertEquals("remark", call.variantName());
            assertEquals("{\"remark\":{\"remarkData\":\"0x6869\"}}", call.toJson().toString());
        }

        @Test
        void testSignedExtensions() {
            assertEquals(List.of("CheckNonce", "CheckGenesis"),
                    registry.signedExtensions().stream().map(e -> e.identifier()).toList());
            assertEquals(List.of(new TypeDef.FieldDef("checkNonce", new TypeDef.LookupDef(MetadataFixtures.COMPACT_U32))),
                    registry.signedExtensionExtra().fields());
            assertEquals(List.of(new TypeDef.FieldDef("checkGenesis", new TypeDef.LookupDef(MetadataFixtures.HASH))),
                    registry.signedExtensionAdditional().fields());

            Struct extra = registry.createType(registry.signedExtensionExtra().descriptor(),
                    Map.of("checkNonce", 5), Struct.class);
            assertEquals("0x14", Hex.encode(extra.encode()));
        }
    }

    @Nested
    class Options {

        @Test
        void testPathNamesCanBeDisabled() {
            MetadataConfig config = MetadataConfig.builder().registerPathNames(false).build();

            RegistrationReport report = PortableTypeRegistrar.register(registry,
                    MetadataDecoder.decode(MetadataFixtures.demoV14()), config);

            assertTrue(report.derivedNames().isEmpty());
            assertFalse(registry.isRegistered("PalletDemoInfo"));
            assertTrue(registry.isRegistered(TypeRegistry.lookupName(MetadataFixtures.INFO)));
        }

        @Test
        void testSignedExtensionsCanBeDisabled() {
            MetadataConfig config = MetadataConfig.builder().signedExtensions(false).build();

            PortableTypeRegistrar.register(registry, MetadataDecoder.decode(MetadataFixtures.demoV14()), config);

            assertTrue(registry.signedExtensions().isEmpty());
        }

        @Test
        @DisplayName("Path names shared by several nodes are not registered")
        void testAmbiguousPathNames() {
            Metadata metadata = metadata(
                    node(0, primitive(PrimitiveKind.U32)),
                    node(1, List.of("pallet", "Id"), List.of(new TypeParameter("T", 0)),
                            new TypeDefinition.Composite(List.of(unnamed(0)))),
                    node(2, List.of("pallet", "Id"), List.of(new TypeParameter("T", 1)),
                            new TypeDefinition.Composite(List.of(unnamed(1)))),
                    node(3, List.of("pallet", "Unique"), List.of(), new TypeDefinition.Composite(List.of())));

            RegistrationReport report = PortableTypeRegistrar.register(registry, metadata);

            assertEquals(Map.of("PalletUnique", 3), report.derivedNames());
            assertFalse(registry.isRegistered("PalletId"));
        }

        @Test
        void testBuiltInsAreNotShadowed() {
            Metadata metadata = metadata(
                    node(0, primitive(PrimitiveKind.U8)),
                    node(1, List.of("Bytes"), List.of(), new TypeDefinition.Composite(List.of(unnamed(0)))));

            RegistrationReport report = PortableTypeRegistrar.register(registry, metadata);

            assertTrue(report.derivedNames().isEmpty());
            assertEquals("0x0461", Hex.encode(registry.createType("Bytes", "0x61").encode()));
        }

        @Test
        void testGenericMapNode() {
            Metadata metadata = metadata(
                    node(0, primitive(PrimitiveKind.U32)),
                    node(1, primitive(PrimitiveKind.BOOL)),
                    node(2, List.of("BTreeMap"), List.of(new TypeParameter("K", 0), new TypeParameter("V", 1)),
                            new TypeDefinition.Composite(List.of(unnamed(3)))),
                    node(3, new TypeDefinition.Sequence(4)),
                    node(4, new TypeDefinition.Tuple(List.of(0, 1))));

            PortableTypeRegistrar.register(registry, metadata);

            assertInstanceOf(MapType.class, registry.resolve("Lookup2"));
            assertEquals("0x040700000001",
                    Hex.encode(registry.createType(2, Map.of("7", true)).encode()));
        }
    }

    @Nested
    @DisplayName("Node failure policy")
    class FailurePolicy {

        // node 1 refers to a missing id, node 3 is an alias of itself
        private final Metadata broken = metadata(
                node(0, primitive(PrimitiveKind.U32)),
                node(1, List.of("demo", "Broken"), List.of(), new TypeDefinition.Composite(List.of(named("x", 99)))),
                node(2, List.of("demo", "Fine"), List.of(), new TypeDefinition.Composite(List.of(named("y", 0)))),
                node(3, List.of("demo", "Loop"), List.of(), new TypeDefinition.Composite(List.of(unnamed(3)))));

        @Test
        void testWarnAndSkip() {
            Logger logger = (Logger) LoggerFactory.getLogger(PortableTypeRegistrar.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            RegistrationReport report;
            try {
                report = PortableTypeRegistrar.register(registry, broken);
            } finally {
                logger.detachAppender(appender);
            }

            assertTrue(report.hasFailures());
            assertEquals(List.of(1, 3), List.copyOf(report.failures().keySet()));
            assertEquals("Dangling portable type id 99", report.failures().get(1));
            assertEquals("Alias cycle detected: Lookup3 -> Lookup3", report.failures().get(3));
            assertEquals(List.of(0, 2), report.registered());
            assertEquals(Map.of("DemoFine", 2), report.derivedNames());

            assertFalse(registry.isRegistered("Lookup1"));
            assertFalse(registry.isRegistered("Lookup3"));
            assertEquals("0x05000000", Hex.encode(registry.createType("DemoFine", Map.of("y", 5)).encode()));

            List<ILoggingEvent> warnings = appender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .toList();
            assertEquals(2, warnings.size());
            assertTrue(warnings.get(0).getFormattedMessage().contains("demo::Broken"));
        }

        @Test
        @DisplayName("FAIL leaves the target registry untouched")
        void testFail() {
            MetadataConfig config = MetadataConfig.builder().nodeFailurePolicy(NodeFailurePolicy.FAIL).build();

            TypeRegistryException ex = assertThrows(TypeRegistryException.class,
                    () -> PortableTypeRegistrar.register(registry, broken, config));

            assertTrue(ex.getMessage().startsWith("2 metadata type node(s) failed to resolve"), ex.getMessage());
            assertTrue(ex.getMessage().contains("#1 demo::Broken: Dangling portable type id 99"));
            assertFalse(registry.isRegistered("Lookup0"));
            assertFalse(registry.isRegistered("DemoFine"));
        }

        @Test
        void testReregistrationReplacesDefinitions() {
            PortableTypeRegistrar.register(registry, metadata(node(0, primitive(PrimitiveKind.U32))));
            assertEquals("0x07000000", Hex.encode(registry.createType(0, 7).encode()));

            PortableTypeRegistrar.register(registry, metadata(node(0, primitive(PrimitiveKind.U16))));

            assertEquals("0x0700", Hex.encode(registry.createType(0, 7).encode()));
        }
    }
}
