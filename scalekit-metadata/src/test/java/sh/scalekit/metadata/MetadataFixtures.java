// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.metadata;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import sh.scalekit.primitives.ScaleWriter;

/**
 * Hand-encoded metadata blobs for tests.
 */
final class MetadataFixtures {

    // type ids of the v14 demo runtime
    static final int U32 = 0;
    static final int BOOL = 1;
    static final int INFO = 2;
    static final int U8 = 3;
    static final int BYTES = 4;
    static final int NODE = 5;
    static final int OPTION_NODE = 6;
    static final int UNIT = 7;
    static final int CALL = 8;
    static final int COMPACT_U32 = 9;
    static final int HASH = 10;
    static final int ACCOUNT = 11;

    // Si1TypeDef variants
    private static final int COMPOSITE = 0;
    private static final int VARIANT = 1;
    private static final int SEQUENCE = 2;
    private static final int ARRAY = 3;
    private static final int TUPLE = 4;
    private static final int PRIMITIVE = 5;
    private static final int COMPACT = 6;

    private static final int PRIM_BOOL = 0;
    private static final int PRIM_U8 = 3;
    private static final int PRIM_U32 = 5;

    private static final int OPTIONAL = 0;
    private static final int DEFAULT = 1;
    private static final int BLAKE2_128_CONCAT = 2;
    private static final int TWOX_64_CONCAT = 5;

    private MetadataFixtures() {
    }

    record F(@Nullable String name, int type, @Nullable String typeName) {
    }

    static F field(final @Nullable String name, final int type, final @Nullable String typeName) {
        return new F(name, type, typeName);
    }

    /**
     * A v14 runtime with one pallet {@code Demo} (index 7) holding a map of
     * {@code pallet_demo::Info} structs, a plain counter, one call enum and one constant.
     */
    static byte[] demoV14() {
        final ScaleWriter w = envelope(14);
        w.writeCompact(12);
        primitive(w, U32, PRIM_U32);
        primitive(w, BOOL, PRIM_BOOL);
        composite(w, INFO, List.of("pallet_demo", "Info"), field("a", U32, "u32"), field("b", BOOL, "bool"));
        primitive(w, U8, PRIM_U8);

        type(w, BYTES, List.of(), Map.of());
        w.writeByte(SEQUENCE).writeCompact(U8);
        end(w);

        composite(w, NODE, List.of("demo", "Node"),
                field("value", U8, "u8"), field("next", OPTION_NODE, "Option<Box<Node>>"));

        type(w, OPTION_NODE, List.of("Option"), Map.of("T", NODE));
        w.writeByte(VARIANT).writeCompact(2);
        variant(w, "None", 0);
        variant(w, "Some", 1, field(null, NODE, "T"));
        end(w);

        type(w, UNIT, List.of(), Map.of());
        w.writeByte(TUPLE).writeCompact(0);
        end(w);

        type(w, CALL, List.of("pallet_demo", "Call"), Map.of());
        w.writeByte(VARIANT).writeCompact(2);
        variant(w, "remark", 0, field("remark_data", BYTES, "Vec<u8>"));
        variant(w, "noop", 1);
        end(w);

        type(w, COMPACT_U32, List.of(), Map.of());
        w.writeByte(COMPACT).writeCompact(U32);
        end(w);

        type(w, HASH, List.of(), Map.of());
        w.writeByte(ARRAY).writeLittleEndian(BigInteger.valueOf(32), 4).writeCompact(U8);
        end(w);

        composite(w, ACCOUNT, List.of("sp_core", "crypto", "AccountId32"), field(null, HASH, "[u8; 32]"));

        // pallets
        w.writeCompact(1);
        text(w, "Demo");
        w.writeByte(1);
        text(w, "Demo");
        w.writeCompact(2);
        text(w, "Infos");
        w.writeByte(OPTIONAL).writeByte(1).writeCompact(1).writeByte(BLAKE2_128_CONCAT);
        w.writeCompact(U32).writeCompact(INFO);
        bytes(w, new byte[] {0});
        texts(w, "Infos by id.");
        text(w, "Counter");
        w.writeByte(DEFAULT).writeByte(0).writeCompact(U32);
        bytes(w, new byte[4]);
        texts(w);
        w.writeByte(1).writeCompact(CALL);
        w.writeByte(0);
        w.writeCompact(1);
        text(w, "MaxLen");
        w.writeCompact(U32);
        bytes(w, new byte[] {16, 0, 0, 0});
        texts(w, "Maximum remark length.");
        w.writeByte(0);
        w.writeByte(7);

        // extrinsic
        w.writeCompact(UNIT).writeByte(4).writeCompact(2);
        text(w, "CheckNonce");
        w.writeCompact(COMPACT_U32).writeCompact(UNIT);
        text(w, "CheckGenesis");
        w.writeCompact(UNIT).writeCompact(HASH);

        // runtime type
        w.writeCompact(UNIT);
        return w.toByteArray();
    }

    /**
     * A v13 runtime with a {@code Balances} module (index 5): three storage entries
     * (plain, map and double map), a {@code transfer} call, a {@code Transfer} event,
     * one constant and one error.
     */
    static byte[] balancesV13() {
        final ScaleWriter w = envelope(13);
        w.writeCompact(1);
        text(w, "Balances");

        w.writeByte(1);
        text(w, "Balances");
        w.writeCompact(3);
        text(w, "TotalIssuance");
        w.writeByte(DEFAULT).writeByte(0);
        text(w, "T::Balance");
        bytes(w, new byte[16]);
        texts(w, "The total units issued.");
        text(w, "Account");
        w.writeByte(DEFAULT).writeByte(1).writeByte(BLAKE2_128_CONCAT);
        text(w, "T::AccountId");
        text(w, "T::Balance");
        w.writeByte(0);
        bytes(w, new byte[16]);
        texts(w);
        text(w, "Locks");
        w.writeByte(OPTIONAL).writeByte(2).writeByte(TWOX_64_CONCAT);
        text(w, "T::AccountId");
        text(w, "LockIdentifier");
        text(w, "T::Balance");
        w.writeByte(BLAKE2_128_CONCAT);
        bytes(w, new byte[] {0});
        texts(w);

        // calls
        w.writeByte(1).writeCompact(1);
        text(w, "transfer");
        w.writeCompact(2);
        text(w, "dest");
        text(w, "T::AccountId");
        text(w, "value");
        text(w, "Compact<T::Balance>");
        texts(w, "Transfer some balance.");

        // events
        w.writeByte(1).writeCompact(1);
        text(w, "Transfer");
        texts(w, "AccountId", "AccountId", "Balance");
        texts(w);

        // constants
        w.writeCompact(1);
        text(w, "ExistentialDeposit");
        text(w, "T::Balance");
        final byte[] deposit = new byte[16];
        deposit[0] = (byte) 0xf4;
        deposit[1] = 0x01;
        bytes(w, deposit);
        texts(w);

        // errors
        w.writeCompact(1);
        text(w, "InsufficientBalance");
        texts(w);

        w.writeByte(5);

        // extrinsic
        w.writeByte(4);
        texts(w, "CheckNonce", "CheckWeight");
        return w.toByteArray();
    }

    static ScaleWriter envelope(final int version) {
        return new ScaleWriter().writeBytes(new byte[] {0x6d, 0x65, 0x74, 0x61}).writeByte(version);
    }

    private static void primitive(final ScaleWriter w, final int id, final int kind) {
        type(w, id, List.of(), Map.of());
        w.writeByte(PRIMITIVE).writeByte(kind);
        end(w);
    }

    private static void composite(final ScaleWriter w, final int id, final List<String> path, final F... fields) {
        type(w, id, path, Map.of());
        w.writeByte(COMPOSITE);
        fields(w, fields);
        end(w);
    }

    private static void type(final ScaleWriter w, final int id, final List<String> path,
            final Map<String, Integer> params) {
        w.writeCompact(id);
        texts(w, path.toArray(new String[0]));
        w.writeCompact(params.size());
        params.forEach((name, type) -> {
            text(w, name);
            w.writeByte(1).writeCompact(type);
        });
    }

    private static void end(final ScaleWriter w) {
        texts(w);
    }

    private static void variant(final ScaleWriter w, final String name, final int index, final F... fields) {
        text(w, name);
        fields(w, fields);
        w.writeByte(index);
        texts(w);
    }

    private static void fields(final ScaleWriter w, final F... fields) {
        w.writeCompact(fields.length);
        for (F field : fields) {
            optionalText(w, field.name());
            w.writeCompact(field.type());
            optionalText(w, field.typeName());
            texts(w);
        }
    }

    private static void optionalText(final ScaleWriter w, final @Nullable String value) {
        if (value == null) {
            w.writeByte(0);
        } else {
            w.writeByte(1);
            text(w, value);
        }
    }

    static void text(final ScaleWriter w, final String value) {
        bytes(w, value.getBytes(StandardCharsets.UTF_8));
    }

    static void texts(final ScaleWriter w, final String... values) {
        w.writeCompact(values.length);
        for (String value : values) {
            text(w, value);
        }
    }

    static void bytes(final ScaleWriter w, final byte[] value) {
        w.writeCompact(value.length).writeBytes(value);
    }
}
