// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.codec.composite.Struct;
import sh.scalekit.core.codec.primitive.Bool;
import sh.scalekit.core.codec.primitive.BytesType;
import sh.scalekit.core.codec.primitive.CompactType;
import sh.scalekit.core.codec.primitive.IntType;
import sh.scalekit.core.codec.primitive.RawType;
import sh.scalekit.core.error.CodecConstructionException;
import sh.scalekit.core.error.TypeRegistryException;
import sh.scalekit.primitives.Hex;

class TypeRegistryTest {

    private final TypeRegistry registry = new TypeRegistry();

    @Nested
    class Resolution {

        @Test
        void testUnknownType() {
            TypeRegistryException e = assertThrows(TypeRegistryException.class, () -> registry.resolve("Nope"));
            assertEquals("Unknown type 'Nope'", e.getMessage());
            assertTrue(registry.get("Nope").isEmpty());
        }

        @Test
        void testAliasesResolveTransitively() {
            registry.register("Balance", "u128");
            registry.register("FreeBalance", "Balance");

            CodecType<?> type = registry.resolve("FreeBalance");

            assertInstanceOf(IntType.class, type);
            assertEquals(128, ((IntType) type).bitLength());
            assertSame(type, registry.resolve("Balance"));
        }

        @Test
        void testAliasCycleIsRejected() {
            registry.register("A", "B");
            registry.register("B", "A");

            TypeRegistryException e = assertThrows(TypeRegistryException.class, () -> registry.resolve("A"));
            assertEquals("Alias cycle detected: A -> B -> A", e.getMessage());
        }

        @Test
        @DisplayName("A type may refer to itself through a composite")
        void testRecursiveType() {
            registry.register("Node", "{\"value\":\"u8\",\"next\":\"Option<Node>\"}");

            Struct node = registry.createType("Node", Map.of("value", 1, "next", Map.of("value", 2)), Struct.class);

            assertEquals("0x01010200", Hex.encode(node.encode()));
            assertEquals(node, registry.createType("Node", Hex.decode("0x01010200")));
            assertEquals("{\"value\":1,\"next\":{\"value\":2,\"next\":null}}", node.toJson().toString());
        }

        @Test
        void testByteSpecializations() {
            assertInstanceOf(BytesType.class, registry.resolve("Vec<u8>"));
            CodecType<?> raw = registry.resolve("[u8; 4]");
            assertInstanceOf(RawType.class, raw);
            assertEquals(4, ((RawType) raw).length());
        }

        @Test
        void testCompactUnwrapsNewtypes() {
            registry.register("Wrapper", "{\"inner\":\"u64\"}");

            assertInstanceOf(CompactType.class, registry.resolve("Compact<Wrapper>"));
            assertInstanceOf(CompactType.class, registry.resolve("Compact<(u32,)>"));
            assertThrows(TypeRegistryException.class, () -> registry.resolve("Compact<i32>"));
            assertThrows(TypeRegistryException.class, () -> registry.resolve("Compact<Text>"));
        }

        @Test
        void testFailedResolutionLeavesNoTrace() {
            registry.register("Holder", "{\"item\":\"Missing\"}");
            TypeRegistryException first = assertThrows(TypeRegistryException.class,
                    () -> registry.resolve("Vec<Holder>"));

            assertFalse(registry.isCached("Holder"));
            assertFalse(registry.isCached("Vec<Holder>"));
            TypeRegistryException second = assertThrows(TypeRegistryException.class,
                    () -> registry.resolve("Vec<Holder>"));
            assertEquals(first.getMessage(), second.getMessage());
            assertTrue(registry.get("Vec<Holder>").isEmpty());
            assertFalse(registry.isCached("Holder"));

            registry.register("Missing", "u16");

            assertEquals("0x040500", Hex.encode(registry.createType("Vec<Holder>", List.of(List.of(5))).encode()));
        }

        @Test
        void testFactoryIsInvokedOnce() {
            CodecFactory factory = mock(CodecFactory.class);
            when(factory.create(any(TypeRegistry.class)))
                    .thenAnswer(invocation -> new IntType(invocation.getArgument(0), "Custom", 32, false));
            registry.register("Custom", factory);

            CodecType<?> first = registry.resolve("Custom");
            registry.resolve("Vec<Custom>");
            CodecType<?> again = registry.resolve("Custom");

            assertSame(first, again);
            verify(factory, times(1)).create(registry);
        }

        @Test
        void testConcurrentResolutionYieldsUsableTypes() throws Exception {
            registry.register("Account", "{\"nonce\":\"u32\",\"free\":\"u128\"}");
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    final int nonce = i;
                    results.add(executor.submit(() -> Hex.encode(
                            registry.createType("Vec<Account>", List.of(List.of(nonce, 1))).encode())));
                }
                for (int i = 0; i < results.size(); i++) {
                    String expected = "0x04" + String.format("%02x", i) + "000000"
                            + "01" + "00".repeat(15);
                    assertEquals(expected, results.get(i).get(5, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    class Registration {

        @Test
        void testLastWriteWins() {
            registry.register("Index", "u8");
            assertEquals(8, ((IntType) registry.resolve("Index")).bitLength());

            registry.register("Index", "u16");

            assertEquals(16, ((IntType) registry.resolve("Index")).bitLength());
            assertEquals("u16", registry.getDefinition("Index").orElseThrow().descriptor());
        }

        @Test
        void testRegisterTypesIsAllOrNothing() {
            Map<String, Object> types = new LinkedHashMap<>();
            types.put("Good", "u8");
            types.put("Bad", "Vec<");

            TypeRegistryException e = assertThrows(TypeRegistryException.class, () -> registry.registerTypes(types));

            assertTrue(e.getMessage().startsWith("registering 'Bad' -> Invalid type descriptor 'Vec<'"),
                    e.getMessage());
            assertFalse(registry.isRegistered("Good"));
        }

        @Test
        void testRegisterTypesAcceptsMixedValues() {
            Map<String, Object> types = new LinkedHashMap<>();
            types.put("Id", "u32");
            types.put("Pair", Map.of("left", "Id"));
            types.put("Flag", TypeDef.named("bool"));
            registry.registerTypes(types);

            assertEquals(List.of("Flag", "Id", "Pair"), List.copyOf(registry.definitions().keySet()));
            assertEquals("0x07000000", Hex.encode(registry.createType("Pair", Map.of("left", 7)).encode()));
        }

        @Test
        void testBuiltinsAreFactories() {
            assertTrue(registry.isRegistered("u32"));
            assertTrue(registry.getDefinition("u32").isEmpty());
            assertFalse(registry.definitions().containsKey("u32"));
        }

        @Test
        void testBlankNameIsRejected() {
            assertThrows(TypeRegistryException.class, () -> registry.register(" ", "u8"));
        }
    }

    @Nested
    class Forks {

        @Test
        void testForkSeesParentButKeepsOwnDefinitions() {
            registry.register("Balance", "u64");
            registry.register("Id", "u32");
            TypeRegistry child = registry.fork();

            child.register("Balance", "u128");

            assertEquals(128, ((IntType) child.resolve("Balance")).bitLength());
            assertEquals(64, ((IntType) registry.resolve("Balance")).bitLength());
            assertEquals(32, ((IntType) child.resolve("Id")).bitLength());
            assertSame(registry, child.parent().orElseThrow());

            child.register("Extra", "u8");

            assertFalse(registry.isRegistered("Extra"));
        }

        @Test
        void testLookupOverridesAreInherited() {
            registry.registerLookupOverride("sp_core::crypto::AccountId32", "[u8; 32]");
            TypeRegistry child = registry.fork();

            assertEquals("[u8;32]", child.lookupOverride("sp_core::crypto::AccountId32").orElseThrow().descriptor());
            assertTrue(child.lookupOverride("sp_runtime::MultiAddress").isEmpty());
        }
    }

    @Nested
    class SignedExtensions {

        @Test
        void testExtraAndAdditionalSkipNullParts() {
            registry.registerSignedExtensionTypes(List.of(
                    SignedExtension.of("CheckNonce", "Compact<u32>", "Null"),
                    SignedExtension.of("CheckGenesis", "Null", "H256")));

            registry.setSignedExtensionNames(List.of("CheckNonce", "CheckGenesis"));

            assertEquals(List.of("checkNonce"), fieldNames(registry.signedExtensionExtra()));
            assertEquals(List.of("checkGenesis"), fieldNames(registry.signedExtensionAdditional()));
            assertEquals("0x14", Hex.encode(
                    registry.resolve(registry.signedExtensionExtra()).create(Map.of("checkNonce", 5)).encode()));
        }

        @Test
        void testUnknownExtensionLogsWarningAndContributesNothing() {
            Logger logger = (Logger) LoggerFactory.getLogger(TypeRegistry.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
            try {
                registry.setSignedExtensionNames(List.of("CheckSomethingNew"));
            } finally {
                logger.detachAppender(appender);
            }

            assertEquals(1, appender.list.size());
            assertEquals(Level.WARN, appender.list.get(0).getLevel());
            assertTrue(appender.list.get(0).getFormattedMessage().contains("CheckSomethingNew"));
            assertEquals("CheckSomethingNew", registry.signedExtensions().get(0).identifier());
            assertTrue(registry.signedExtensionExtra().fields().isEmpty());
        }

        @Test
        void testForkInheritsActiveExtensions() {
            registry.setSignedExtensions(List.of(SignedExtension.of("CheckWeight", "Null", "Null")));
            TypeRegistry child = registry.fork();

            assertEquals(1, child.signedExtensions().size());

            child.setSignedExtensions(List.of());

            assertTrue(child.signedExtensions().isEmpty());
            assertEquals(1, registry.signedExtensions().size());
        }

        private List<String> fieldNames(final TypeDef.StructDef def) {
            List<String> names = new ArrayList<>();
            def.fields().forEach(f -> names.add(f.name()));
            return names;
        }
    }

    @Test
    void testCreateTypeByLookupId() {
        registry.register(TypeRegistry.lookupName(5), "u16");

        assertEquals("0x0700", Hex.encode(registry.createType(5, 7).encode()));
        assertEquals("Lookup5", TypeRegistry.lookupName(5));
    }

    @Test
    void testCreateTypeChecksValueClass() {
        assertThrows(CodecConstructionException.class, () -> registry.createType("u8", 1, Bool.class));
    }
}
