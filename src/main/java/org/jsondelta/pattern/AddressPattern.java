package org.jsondelta.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsondelta.path.Address;
import org.jsondelta.path.AddressSyntax;
import org.jsondelta.path.AddressSyntaxException;
import org.jsondelta.path.PathSegment;

/**
 * Segment-wise glob over addresses.
 *
 * <p>Segments are written like address segments. {@code *} and {@code [*]} stand for exactly one
 * segment of any kind, {@code []} for exactly one array step (index or key). A pattern ending in an
 * unescaped {@code *} glued to its last segment, such as {@code items[id=b]*}, also matches every
 * address nested below. Without it, pattern and address must have the same number of segments.
 */
public final class AddressPattern {
    private enum StepKind {
        LITERAL,
        ANY,
        ANY_ELEMENT
    }

    private record Step(StepKind kind, PathSegment literal) {
        boolean accepts(PathSegment segment) {
            return switch (kind) {
                case ANY -> true;
                case ANY_ELEMENT -> segment.isBracket();
                case LITERAL -> literal.equals(segment);
            };
        }
    }

    private final String text;
    private final List<Step> steps;
    private final boolean subtree;

    private AddressPattern(String text, List<Step> steps, boolean subtree) {
        this.text = text;
        this.steps = List.copyOf(steps);
        this.subtree = subtree;
    }

    public static AddressPattern compile(String text) {
        Objects.requireNonNull(text, "text");
        String body = text;
        boolean subtree = false;
        if (endsWithGluedStar(text)) {
            subtree = true;
            body = text.substring(0, text.length() - 1);
        }
        List<Step> steps = new ArrayList<>();
        for (String token : AddressSyntax.tokens(body)) {
            steps.add(step(text, token));
        }
        return new AddressPattern(text, steps, subtree);
    }

    public static boolean matches(Address address, String pattern) {
        return compile(pattern).matches(address);
    }

    public boolean matches(Address address) {
        Objects.requireNonNull(address, "address");
        List<PathSegment> segments = address.segments();
        if (subtree ? segments.size() < steps.size() : segments.size() != steps.size()) {
            return false;
        }
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).accepts(segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    public String text() {
        return text;
    }

    /**
     * True for patterns ending in a glued {@code *}, which also match nested addresses.
     */
    public boolean matchesSubtree() {
        return subtree;
    }

    private static Step step(String text, String token) {
        if ("*".equals(token) || "[*]".equals(token)) {
            return new Step(StepKind.ANY, null);
        }
        if ("[]".equals(token)) {
            return new Step(StepKind.ANY_ELEMENT, null);
        }
        try {
            return new Step(StepKind.LITERAL, AddressSyntax.segment(token));
        } catch (AddressSyntaxException e) {
            throw new AddressSyntaxException(text, text.indexOf(token) + 1, "invalid pattern segment '" + token + "'");
        }
    }

    private static boolean endsWithGluedStar(String text) {
        int length = text.length();
        if (length < 2 || text.charAt(length - 1) != '*' || text.charAt(length - 2) == '.') {
            return false;
        }
        int backslashes = 0;
        for (int i = length - 2; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 0;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof AddressPattern that && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
