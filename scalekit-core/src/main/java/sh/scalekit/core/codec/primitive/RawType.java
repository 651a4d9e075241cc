// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleReader;

/**
 * Unprefixed byte content.
 *
 * <p>With a fixed length ({@code [u8;32]}, {@code H256}) exactly that many bytes are
 * read and written. With {@link #UNBOUNDED} the value consumes whatever remains in
 * the reader, which only makes sense as the last item of a buffer.
 */
public final class RawType extends AbstractCodecType<Raw> {

    public static final int UNBOUNDED = -1;

    private final int length;

    public RawType(final TypeRegistry registry, final String name, final int length) {
        super(registry, name, Raw.class);
        if (length < UNBOUNDED) {
            throw new IllegalArgumentException("Invalid raw length " + length);
        }
        this.length = length;
    }

    /**
     * Returns the fixed length, or {@link #UNBOUNDED}.
     */
    public int length() {
        return length;
    }

    public boolean isFixed() {
        return length != UNBOUNDED;
    }

    public Raw of(final byte[] content) {
        if (isFixed() && content.length != length) {
            throw invalid("expected " + length + " byte(s), got " + content.length);
        }
        return new Raw(this, content.clone());
    }

    @Override
    protected Raw decodeValue(final ScaleReader reader) {
        return new Raw(this, isFixed() ? reader.readBytes(length) : reader.readRemaining());
    }

    @Override
    protected Raw fromHex(final String hex) {
        return of(Hex.decode(hex));
    }

    @Override
    protected Raw fromValue(final Object value) {
        final byte[] content = ByteContent.of(value);
        if (content == null) {
            throw incompatible(value);
        }
        return of(content);
    }

    @Override
    protected Raw fromCodec(final Codec codec) {
        final byte[] content = ByteContent.of(codec);
        return content != null ? of(content) : super.fromCodec(codec);
    }

    @Override
    protected Raw defaultValue() {
        return new Raw(this, new byte[isFixed() ? length : 0]);
    }
}
