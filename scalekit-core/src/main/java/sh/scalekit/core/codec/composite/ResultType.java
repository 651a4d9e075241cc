// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.List;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * {@code Result<T, E>}: an enum with {@code Ok} at index 0 and {@code Err} at index 1.
 */
public final class ResultType extends AbstractCodecType<Result> {

    private final EnumType variants;

    public ResultType(final TypeRegistry registry, final String name, final CodecType<?> ok, final CodecType<?> err) {
        super(registry, name, Result.class);
        this.variants = new EnumType(registry, name, List.of(
                new EnumType.Variant("Ok", 0, ok),
                new EnumType.Variant("Err", 1, err)));
    }

    public CodecType<?> okType() {
        return variants.variants().get(0).payload();
    }

    public CodecType<?> errType() {
        return variants.variants().get(1).payload();
    }

    public Result ok(final Object value) {
        return new Result(this, variants.of("Ok", value));
    }

    public Result err(final Object value) {
        return new Result(this, variants.of("Err", value));
    }

    @Override
    protected Result decodeValue(final ScaleReader reader) {
        return new Result(this, variants.decode(reader));
    }

    @Override
    protected Result fromValue(final Object value) {
        return new Result(this, variants.create(value));
    }

    @Override
    protected Result fromCodec(final Codec codec) {
        if (codec instanceof Result other) {
            return new Result(this, variants.create(other.asEnum()));
        }
        return new Result(this, variants.create(codec));
    }

    @Override
    protected Result defaultValue() {
        return new Result(this, variants.create(null));
    }
}
