// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.error;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class ScaleExceptionTest {

    @Test
    void withContextKeepsKindAndCause() {
        ScaleDecodingException original = ScaleDecodingException.at(4, "bool: invalid byte 0x2");

        ScaleDecodingException wrapped = original.withContext("Vec[1]");

        assertEquals("Vec[1] -> bool: invalid byte 0x2 (at offset 4)", wrapped.getMessage());
        assertSame(original, wrapped.getCause());
    }

    @Test
    void contextsNestOutermostFirst() {
        ScaleException error = new CodecConstructionException("u8: value 300 out of range")
                .withContext("Vec[2]")
                .withContext("Struct: failed on 'inner'");

        assertInstanceOf(CodecConstructionException.class, error);
        assertEquals("Struct: failed on 'inner' -> Vec[2] -> u8: value 300 out of range", error.getMessage());
    }

    @Test
    void registryFactoryMessages() {
        assertEquals("Unknown type 'Foo'", TypeRegistryException.unknownType("Foo").getMessage());
        assertEquals("Alias cycle detected: A -> B -> A",
                TypeRegistryException.aliasCycle(List.of("A", "B", "A")).getMessage());
        assertTrue(TypeRegistryException.invalidDescriptor("Vec<", "unbalanced brackets")
                .getMessage().contains("'Vec<'"));
    }
}
