// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MetadataConfigTest {

    @Test
    void testDefaults() {
        MetadataConfig config = MetadataConfig.withDefaults();

        assertEquals(NodeFailurePolicy.WARN_AND_SKIP, config.nodeFailurePolicy());
        assertTrue(config.registerPathNames());
        assertTrue(config.signedExtensions());
        assertEquals(config, MetadataConfig.builder().build());
    }

    @Test
    void testBuilder() {
        MetadataConfig config = MetadataConfig.builder()
                .nodeFailurePolicy(NodeFailurePolicy.FAIL)
                .registerPathNames(false)
                .signedExtensions(false)
                .build();

        assertEquals(NodeFailurePolicy.FAIL, config.nodeFailurePolicy());
        assertFalse(config.registerPathNames());
        assertFalse(config.signedExtensions());
    }

    @Test
    void testNullPolicyFallsBackToDefault() {
        MetadataConfig config = new MetadataConfig(null, false, true);

        assertEquals(NodeFailurePolicy.WARN_AND_SKIP, config.nodeFailurePolicy());
    }
}
