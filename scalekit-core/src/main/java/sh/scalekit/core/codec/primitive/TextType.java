// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.primitive;

import java.util.Objects;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.Compact;
import sh.scalekit.primitives.Hex;
import sh.scalekit.primitives.ScaleReader;
import sh.scalekit.primitives.Utf8;

/**
 * Length-prefixed UTF-8 text.
 *
 * <p>Input handling:
 * <ul>
 * <li>a {@code 0x} string is the hex of the UTF-8 content (no length prefix)</li>
 * <li>a {@code byte[]} is SCALE, i.e. length-prefixed</li>
 * <li>{@link Raw} and {@link Bytes} codecs contribute their content</li>
 * <li>any other object is converted with {@code toString()}</li>
 * </ul>
 */
public final class TextType extends AbstractCodecType<Text> {

    public TextType(final TypeRegistry registry) {
        super(registry, "Text", Text.class);
    }

    public Text of(final String value) {
        return new Text(this, Objects.requireNonNull(value, "value"));
    }

    @Override
    protected Text decodeValue(final ScaleReader reader) {
        final int length = Compact.decodeLength(reader);
        return new Text(this, Utf8.decode(reader.readBytes(length)));
    }

    @Override
    protected Text fromHex(final String hex) {
        return fromUtf8(Hex.decode(hex));
    }

    @Override
    protected Text fromValue(final Object value) {
        return new Text(this, value.toString());
    }

    @Override
    protected Text fromCodec(final Codec codec) {
        if (codec instanceof Raw raw) {
            return fromUtf8(raw.bytes());
        }
        if (codec instanceof Bytes bytes) {
            return fromUtf8(bytes.bytes());
        }
        return new Text(this, codec.toString());
    }

    @Override
    protected Text defaultValue() {
        return new Text(this, "");
    }

    private Text fromUtf8(final byte[] content) {
        try {
            return new Text(this, Utf8.decode(content));
        } catch (IllegalArgumentException e) {
            throw invalid(e.getMessage());
        }
    }
}
