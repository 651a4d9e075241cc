// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleReader;

/**
 * Length-prefixed bytes, also the resolution of {@code Vec<u8>}.
 *
 * <p>A {@code byte[]} input is SCALE (prefixed); a hex string or a list of numbers is
 * the content itself.
 */
public final class BytesType extends AbstractCodecType<Bytes> {

    public BytesType(final TypeRegistry registry) {
        super(registry, "Bytes", Bytes.class);
    }

    public Bytes of(final byte[] content) {
        return new Bytes(this, content.clone());
    }

    @Override
    protected Bytes decodeValue(final ScaleReader reader) {
        final int length = Compact.decodeLength(reader);
        return new Bytes(this, reader.readBytes(length));
    }

    @Override
    protected Bytes fromHex(final String hex) {
        return new Bytes(this, Hex.decode(hex));
    }

    @Override
    protected Bytes fromValue(final Object value) {
        final byte[] content = ByteContent.of(value);
        if (content == null) {
            throw incompatible(value);
        }
        return new Bytes(this, content);
    }

    @Override
    protected Bytes fromCodec(final Codec codec) {
        final byte[] content = ByteContent.of(codec);
        return content != null ? new Bytes(this, content) : super.fromCodec(codec);
    }

    @Override
    protected Bytes defaultValue() {
        return new Bytes(this, new byte[0]);
    }
}
