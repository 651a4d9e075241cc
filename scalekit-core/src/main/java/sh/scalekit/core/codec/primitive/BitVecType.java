// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.util.List;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleReader;

/**
 * Bit sequence stored least-significant bit first over {@code u8}: a compact bit
 * count followed by {@code ceil(bits / 8)} bytes.
 */
public final class BitVecType extends AbstractCodecType<BitVec> {

    public BitVecType(final TypeRegistry registry) {
        super(registry, "BitVec", BitVec.class);
    }

    /**
     * Packs a list of bits, bit {@code i} going to byte {@code i / 8} at position {@code i % 8}.
     */
    public BitVec of(final List<Boolean> bits) {
        final byte[] packed = new byte[(bits.size() + 7) / 8];
        for (int i = 0; i < bits.size(); i++) {
            if (bits.get(i)) {
                packed[i / 8] |= (byte) (1 << (i % 8));
            }
        }
        return new BitVec(this, bits.size(), packed);
    }

    @Override
    protected BitVec decodeValue(final ScaleReader reader) {
        final int bits = Compact.decodeLength(reader);
        return new BitVec(this, bits, reader.readBytes((int) ((bits + 7L) / 8)));
    }

    @Override
    protected BitVec fromHex(final String hex) {
        final byte[] content = Hex.decode(hex);
        return new BitVec(this, content.length * 8, content);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected BitVec fromValue(final Object value) {
        if (value instanceof List<?> list && list.stream().allMatch(Boolean.class::isInstance)) {
            return of((List<Boolean>) list);
        }
        throw incompatible(value);
    }

    @Override
    protected BitVec fromCodec(final Codec codec) {
        if (codec instanceof Raw || codec instanceof Bytes) {
            final byte[] content = ByteContent.of(codec);
            return new BitVec(this, content.length * 8, content);
        }
        return super.fromCodec(codec);
    }

    @Override
    protected BitVec defaultValue() {
        return new BitVec(this, 0, new byte[0]);
    }
}
