// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec.composite;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.scalekit.core.codec.AbstractCodecType;
import sh.scalekit.core.codec.Codec;
import sh.scalekit.core.codec.CodecType;
import sh.scalekit.core.codec.Names;
import sh.scalekit.core.codec.primitive.Int;
import sh.scalekit.core.codec.primitive.NullType;
import sh.scalekit.core.error.ScaleDecodingException;
import sh.scalekit.core.registry.TypeRegistry;
import sh.scalekit.primitives.ScaleReader;

/**
 * Tagged union: one discriminant byte holding the variant index, then the payload.
 *
 * <p>Indexes are taken as declared and may be sparse. An enum without variants is
 * uninhabited and every construction attempt fails.
 */
public final class EnumType extends AbstractCodecType<EnumValue> {

    /**
     * One variant.
     *
     * @param name    the variant name
     * @param index   the discriminant, {@code [0, 255]}
     * @param payload the payload type; {@code Null} for payload-less variants
     */
    public record Variant(String name, int index, CodecType<?> payload) {

        public Variant {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(payload, "payload");
            if (index < 0 || index > 0xFF) {
                throw new IllegalArgumentException("Variant index must fit in a byte, got " + index);
            }
        }

        public boolean hasPayload() {
            return !(payload instanceof NullType);
        }
    }

    private final List<Variant> variants;
    private final Map<Integer, Variant> byIndex = new HashMap<>();
    private final Map<String, Variant> byName = new LinkedHashMap<>();
    private final boolean basic;

    public EnumType(final TypeRegistry registry, final String name, final List<Variant> variants) {
        super(registry, name, EnumValue.class);
        this.variants = List.copyOf(variants);
        for (Variant variant : this.variants) {
            if (byIndex.putIfAbsent(variant.index(), variant) != null) {
                throw new IllegalArgumentException(name + ": duplicate variant index " + variant.index());
            }
            if (byName.putIfAbsent(variant.name(), variant) != null) {
                throw new IllegalArgumentException(name + ": duplicate variant name " + variant.name());
            }
        }
        this.basic = this.variants.stream().noneMatch(Variant::hasPayload);
    }

    public List<Variant> variants() {
        return variants;
    }

    /**
     * Returns {@code true} when no variant carries a payload.
     */
    public boolean isBasic() {
        return basic;
    }

    public @Nullable Variant variant(final int index) {
        return byIndex.get(index);
    }

    /**
     * Finds a variant by exact name, then case-insensitively, then by camel-cased name.
     */
    public @Nullable Variant variant(final String name) {
        final Variant exact = byName.get(name);
        if (exact != null) {
            return exact;
        }
        for (Variant variant : variants) {
            if (variant.name().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))
                    || Names.camelCase(variant.name()).equals(name)) {
                return variant;
            }
        }
        return null;
    }

    /**
     * Creates a value of the named variant from a payload input.
     */
    public EnumValue of(final String variantName, final @Nullable Object payload) {
        final Variant variant = variant(variantName);
        if (variant == null) {
            throw invalid("unknown variant '" + variantName + "'");
        }
        return withPayload(variant, payload);
    }

    @Override
    protected EnumValue decodeValue(final ScaleReader reader) {
        final int offset = reader.position();
        final int index = reader.readUnsignedByte();
        final Variant variant = byIndex.get(index);
        if (variant == null) {
            throw ScaleDecodingException.at(offset, name() + ": invalid discriminant " + index);
        }
        return new EnumValue(this, variant, Contexts.decode(variant.payload(), reader, () -> context(variant)));
    }

    @Override
    protected EnumValue fromValue(final Object value) {
        if (value instanceof String s) {
            return of(s, null);
        }
        if (value instanceof Number n) {
            return fromIndex(n.intValue());
        }
        if (value instanceof Map<?, ?> map && map.size() == 1) {
            final Map.Entry<?, ?> entry = map.entrySet().iterator().next();
            return of(String.valueOf(entry.getKey()), entry.getValue());
        }
        throw incompatible(value);
    }

    @Override
    protected EnumValue fromCodec(final Codec codec) {
        if (codec instanceof EnumValue other) {
            return of(other.variantName(), other.value());
        }
        if (codec instanceof Int index) {
            return fromIndex(index.intValueExact());
        }
        return super.fromCodec(codec);
    }

    @Override
    protected EnumValue defaultValue() {
        if (variants.isEmpty()) {
            throw invalid("enum has no variants");
        }
        return withPayload(variants.get(0), null);
    }

    private EnumValue fromIndex(final int index) {
        final Variant variant = byIndex.get(index);
        if (variant == null) {
            throw invalid("unknown variant index " + index);
        }
        return withPayload(variant, null);
    }

    private EnumValue withPayload(final Variant variant, final @Nullable Object payload) {
        return new EnumValue(this, variant, Contexts.create(variant.payload(), payload, () -> context(variant)));
    }

    private static String context(final Variant variant) {
        return "Enum(" + variant.name() + ")";
    }
}
