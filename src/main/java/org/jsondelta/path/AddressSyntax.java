package org.jsondelta.path;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Text form shared by every address kind.
 *
 * <p>Field names are joined by {@code .}; brackets hold an index {@code [3]}, identity key
 * components {@code [id=a]}, {@code [sku=x,rev=2]}, {@code [id=a::2]}, or nothing ({@code []}, array
 * patterns only). Inside a field name {@code \ . [ ] *} are escaped with a backslash; inside a
 * bracket {@code \ [ ] , = : *} are. The root address is the empty string.
 */
public final class AddressSyntax {
    private static final String FIELD_SPECIALS = "\\.[]*";
    private static final String BRACKET_SPECIALS = "\\[],=:*";

    private AddressSyntax() {}

    public static String escapeField(String name) {
        return escape(name, FIELD_SPECIALS);
    }

    public static String escapeBracket(String text) {
        return escape(text, BRACKET_SPECIALS);
    }

    public static String render(List<? extends PathSegment> segments) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            PathSegment segment = segments.get(i);
            if (segment.type() == PathSegment.Type.FIELD && i > 0) {
                sb.append('.');
            }
            sb.append(segment.text());
        }
        return sb.toString();
    }

    /**
     * Splits address or pattern text into raw, still-escaped segment tokens. Bracket tokens keep
     * their brackets. Only structural errors are reported here; the tokens themselves are checked by
     * {@link #segment(String)}.
     */
    public static List<String> tokens(String text) {
        Objects.requireNonNull(text, "text");
        List<String> tokens = new ArrayList<>();
        int length = text.length();
        if (length == 0) {
            return tokens;
        }
        int i = 0;
        boolean afterDot = false;
        while (true) {
            if (!afterDot && i < length && text.charAt(i) == '[') {
                int end = bracketEnd(text, i);
                tokens.add(text.substring(i, end + 1));
                i = end + 1;
            } else {
                int end = fieldEnd(text, i);
                tokens.add(text.substring(i, end));
                i = end;
            }
            if (i == length) {
                return tokens;
            }
            char c = text.charAt(i);
            if (c == '.') {
                i++;
                afterDot = true;
                if (i < length && text.charAt(i) == '[') {
                    throw new AddressSyntaxException(text, i + 1, "'[' must not follow '.'");
                }
            } else if (c == '[') {
                afterDot = false;
            } else {
                throw new AddressSyntaxException(text, i + 1, "expected '.' or '['");
            }
        }
    }

    /**
     * Parses one raw token as produced by {@link #tokens(String)}. Wildcards other than {@code []}
     * are rejected; patterns handle {@code *} themselves.
     */
    public static PathSegment segment(String token) {
        Objects.requireNonNull(token, "token");
        if (!token.startsWith("[")) {
            rejectUnescaped(token, token, '*', "wildcard '*' is only valid in patterns");
            return PathSegment.field(unescape(token, token));
        }
        String content = token.substring(1, token.length() - 1);
        if (content.isEmpty()) {
            return PathSegment.wildcard();
        }
        if (isDigits(content)) {
            return PathSegment.index(parseIndex(token, content));
        }
        if (indexOfUnescaped(content, '=', 0) >= 0) {
            return parseKey(token, content);
        }
        throw new AddressSyntaxException(token, 0, "bracket must hold an index or key=value pairs");
    }

    static List<PathSegment> parse(String text, Set<PathSegment.Type> allowed, String kind) {
        List<PathSegment> segments = new ArrayList<>();
        for (String token : tokens(text)) {
            PathSegment segment;
            try {
                segment = segment(token);
            } catch (AddressSyntaxException e) {
                throw new AddressSyntaxException(text, text.indexOf(token) + 1, e.getMessage());
            }
            if (!allowed.contains(segment.type())) {
                throw new AddressSyntaxException(
                    text,
                    text.indexOf(token) + 1,
                    segment.type().name().toLowerCase() + " segment not allowed in " + kind);
            }
            segments.add(segment);
        }
        return segments;
    }

    static void requireTypes(List<? extends PathSegment> segments, Set<PathSegment.Type> allowed, String kind) {
        for (PathSegment segment : segments) {
            Objects.requireNonNull(segment, "segment");
            if (!allowed.contains(segment.type())) {
                throw new IllegalArgumentException(
                    segment.type().name().toLowerCase() + " segment not allowed in " + kind);
            }
        }
    }

    static Set<PathSegment.Type> types(PathSegment.Type first, PathSegment.Type... rest) {
        return EnumSet.of(first, rest);
    }

    private static PathSegment.Key parseKey(String token, String content) {
        List<String> parts = splitUnescaped(content, ',');
        List<PathSegment.KeyComponent> components = new ArrayList<>(parts.size());
        int occurrence = 1;
        for (int p = 0; p < parts.size(); p++) {
            String part = parts.get(p);
            int eq = indexOfUnescaped(part, '=', 0);
            if (eq < 0) {
                throw new AddressSyntaxException(token, 0, "key component without '='");
            }
            String rawField = part.substring(0, eq);
            String rawValue = part.substring(eq + 1);
            if (rawField.isEmpty()) {
                throw new AddressSyntaxException(token, 0, "empty key field");
            }
            if (p == parts.size() - 1) {
                int marker = occurrenceMarker(rawValue);
                if (marker >= 0) {
                    occurrence = parseOccurrence(token, rawValue.substring(marker + 2));
                    rawValue = rawValue.substring(0, marker);
                }
            }
            rejectUnescaped(token, rawField, ':', "unescaped ':' in key field");
            rejectUnescaped(token, rawValue, '=', "unescaped '=' in key value");
            rejectUnescaped(token, rawValue, ':', "unescaped ':' in key value");
            rejectUnescaped(token, rawValue, '*', "unescaped '*' in key value");
            components.add(new PathSegment.KeyComponent(unescape(token, rawField), unescape(token, rawValue)));
        }
        return new PathSegment.Key(components, occurrence);
    }

    private static int occurrenceMarker(String rawValue) {
        int marker = -1;
        int from = 0;
        int found;
        while ((found = indexOfUnescaped(rawValue, ':', from)) >= 0) {
            if (found + 1 < rawValue.length() && rawValue.charAt(found + 1) == ':') {
                marker = found;
                from = found + 2;
            } else {
                from = found + 1;
            }
        }
        if (marker >= 0 && isDigits(rawValue.substring(marker + 2))) {
            return marker;
        }
        return -1;
    }

    private static int parseOccurrence(String token, String digits) {
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new AddressSyntaxException(token, 0, "occurrence out of range");
        }
        if (value < 2 || digits.charAt(0) == '0') {
            throw new AddressSyntaxException(token, 0, "occurrence suffix must be a number of at least 2");
        }
        return value;
    }

    private static int parseIndex(String token, String digits) {
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw new AddressSyntaxException(token, 0, "index must not have leading zeros");
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new AddressSyntaxException(token, 0, "index out of range");
        }
    }

    private static int bracketEnd(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 == text.length()) {
                    throw new AddressSyntaxException(text, i + 1, "dangling escape");
                }
                i++;
            } else if (c == '[') {
                throw new AddressSyntaxException(text, i + 1, "nested '['");
            } else if (c == ']') {
                return i;
            }
        }
        throw new AddressSyntaxException(text, open + 1, "unterminated '['");
    }

    private static int fieldEnd(String text, int start) {
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 == text.length()) {
                    throw new AddressSyntaxException(text, i + 1, "dangling escape");
                }
                i++;
            } else if (c == '.' || c == '[') {
                return i;
            } else if (c == ']') {
                throw new AddressSyntaxException(text, i + 1, "unexpected ']'");
            }
        }
        return text.length();
    }

    private static List<String> splitUnescaped(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int found;
        while ((found = indexOfUnescaped(text, separator, start)) >= 0) {
            parts.add(text.substring(start, found));
            start = found + 1;
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int indexOfUnescaped(String text, char target, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }

    private static void rejectUnescaped(String token, String raw, char target, String message) {
        if (indexOfUnescaped(raw, target, 0) >= 0) {
            throw new AddressSyntaxException(token, 0, message);
        }
    }

    private static String unescape(String token, String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\') {
                if (i + 1 == raw.length()) {
                    throw new AddressSyntaxException(token, 0, "dangling escape");
                }
                c = raw.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String escape(String text, String specials) {
        Objects.requireNonNull(text, "text");
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (specials.indexOf(c) >= 0) {
                if (sb == null) {
                    sb = new StringBuilder(text.length() + 4).append(text, 0, i);
                }
                sb.append('\\');
            }
            if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
