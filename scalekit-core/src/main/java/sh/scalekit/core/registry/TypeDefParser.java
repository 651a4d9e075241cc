// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sh.scalekit.core.codec.Json;
import sh.scalekit.core.error.TypeRegistryException;

/**
 * Parses descriptor strings into {@link TypeDef}s.
 *
 * <p>Supported forms: names ({@code u32}, {@code AccountId}), {@code Lookup<id>},
 * generics ({@code Vec<T>}, {@code Option<T>}, {@code Compact<T>},
 * {@code Result<T,E>}, {@code BTreeSet<T>}, {@code BTreeMap<K,V>},
 * {@code HashMap<K,V>}, {@code Box<T>}), tuples ({@code (A,B)}, {@code ()}),
 * fixed arrays ({@code [T;N]}) and JSON objects for structs and enums.
 */
public final class TypeDefParser {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern LOOKUP = Pattern.compile("Lookup(\\d+)");
    private static final Pattern GENERIC = Pattern.compile("([A-Za-z_][A-Za-z0-9_:]*)<(.+)>");
    private static final Pattern FIXED = Pattern.compile("\\[(.+);(\\d+)]");

    private TypeDefParser() {
        // Utility class
    }

    /**
     * Parses a descriptor.
     *
     * @param descriptor the descriptor text; whitespace outside JSON strings is ignored
     * @return the definition
     * @throws TypeRegistryException if the descriptor is malformed
     */
    public static TypeDef parse(final String descriptor) {
        if (descriptor == null) {
            throw TypeRegistryException.invalidDescriptor("null", "descriptor cannot be null");
        }
        final String normalized = stripWhitespace(descriptor);
        if (normalized.isEmpty()) {
            throw TypeRegistryException.invalidDescriptor(descriptor, "empty descriptor");
        }
        return parseNormalized(normalized, descriptor);
    }

    private static TypeDef parseNormalized(final String s, final String original) {
        if (s.startsWith("{")) {
            try {
                return TypeDefs.fromJson(Json.parseObject(s));
            } catch (IllegalArgumentException e) {
                throw TypeRegistryException.invalidDescriptor(original, e.getMessage());
            }
        }
        if (s.startsWith("(")) {
            return tuple(s, original);
        }
        final Matcher fixed = FIXED.matcher(s);
        if (fixed.matches()) {
            final int length;
            try {
                length = Integer.parseInt(fixed.group(2));
            } catch (NumberFormatException e) {
                throw TypeRegistryException.invalidDescriptor(original, "array length out of range");
            }
            return new TypeDef.VecFixedDef(parseNormalized(fixed.group(1), original), length);
        }
        final Matcher lookup = LOOKUP.matcher(s);
        if (lookup.matches()) {
            return new TypeDef.LookupDef(Integer.parseInt(lookup.group(1)));
        }
        final Matcher generic = GENERIC.matcher(s);
        if (generic.matches()) {
            return generic(generic.group(1), split(generic.group(2), original), original);
        }
        if (NAME.matcher(s).matches()) {
            return new TypeDef.NamedDef(s);
        }
        throw TypeRegistryException.invalidDescriptor(original, "unrecognized syntax '" + s + "'");
    }

    private static TypeDef generic(final String wrapper, final List<String> args, final String original) {
        switch (wrapper) {
            case "Vec":
                return new TypeDef.VecDef(one(wrapper, args, original));
            case "Option":
                return new TypeDef.OptionDef(one(wrapper, args, original));
            case "Compact":
                return new TypeDef.CompactDef(one(wrapper, args, original));
            case "BTreeSet":
                return new TypeDef.SetDef(one(wrapper, args, original));
            case "Box":
                return one(wrapper, args, original);
            case "Result":
                requireArity(wrapper, args, 2, original);
                return new TypeDef.ResultDef(parseNormalized(args.get(0), original), parseNormalized(args.get(1), original));
            case "BTreeMap":
            case "HashMap":
                requireArity(wrapper, args, 2, original);
                return new TypeDef.MapDef(parseNormalized(args.get(0), original), parseNormalized(args.get(1), original));
            default:
                throw TypeRegistryException.invalidDescriptor(original, "unknown generic wrapper '" + wrapper + "'");
        }
    }

    private static TypeDef one(final String wrapper, final List<String> args, final String original) {
        requireArity(wrapper, args, 1, original);
        return parseNormalized(args.get(0), original);
    }

    private static void requireArity(final String wrapper, final List<String> args, final int arity,
            final String original) {
        if (args.size() != arity) {
            throw TypeRegistryException.invalidDescriptor(original,
                    wrapper + " takes " + arity + " parameter(s), got " + args.size());
        }
    }

    private static TypeDef tuple(final String s, final String original) {
        if (!s.endsWith(")") || closingIndex(s, 0, original) != s.length() - 1) {
            throw TypeRegistryException.invalidDescriptor(original, "unbalanced parentheses in '" + s + "'");
        }
        final String inner = s.substring(1, s.length() - 1);
        if (inner.isEmpty()) {
            return new TypeDef.TupleDef(List.of());
        }
        final boolean trailingComma = inner.endsWith(",");
        final List<String> parts = split(trailingComma ? inner.substring(0, inner.length() - 1) : inner, original);
        if (parts.size() == 1 && !trailingComma) {
            return parseNormalized(parts.get(0), original);
        }
        final List<TypeDef> elements = new ArrayList<>(parts.size());
        for (String part : parts) {
            elements.add(parseNormalized(part, original));
        }
        return new TypeDef.TupleDef(elements);
    }

    /**
     * Splits on commas that are not nested inside brackets, braces or JSON strings.
     */
    static List<String> split(final String s, final String original) {
        final List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
                continue;
            }
            switch (c) {
                case '"':
                    quoted = true;
                    break;
                case '<':
                case '(':
                case '[':
                case '{':
                    depth++;
                    break;
                case '>':
                case ')':
                case ']':
                case '}':
                    depth--;
                    if (depth < 0) {
                        throw TypeRegistryException.invalidDescriptor(original, "unbalanced brackets");
                    }
                    break;
                case ',':
                    if (depth == 0) {
                        parts.add(requireNonEmpty(s.substring(start, i), original));
                        start = i + 1;
                    }
                    break;
                default:
                    break;
            }
        }
        if (depth != 0 || quoted) {
            throw TypeRegistryException.invalidDescriptor(original, "unbalanced brackets");
        }
        parts.add(requireNonEmpty(s.substring(start), original));
        return parts;
    }

    private static int closingIndex(final String s, final int open, final String original) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
                continue;
            }
            if (c == '"') {
                quoted = true;
            } else if (c == '(' || c == '<' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == '>' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw TypeRegistryException.invalidDescriptor(original, "unbalanced brackets");
    }

    private static String requireNonEmpty(final String part, final String original) {
        if (part.isEmpty()) {
            throw TypeRegistryException.invalidDescriptor(original, "empty type parameter");
        }
        return part;
    }

    private static String stripWhitespace(final String s) {
        final StringBuilder sb = new StringBuilder(s.length());
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (quoted) {
                sb.append(c);
                if (c == '\\' && i + 1 < s.length()) {
                    sb.append(s.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
                sb.append(c);
            } else if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
