package org.jsondelta.path;

import java.util.List;
import java.util.Objects;

/**
 * One step of an address.
 *
 * <p>{@link Field} and {@link Index} appear in position addresses; identity addresses add {@link Key};
 * array patterns replace every bracket with {@link Wildcard}.
 */
public interface PathSegment {
    enum Type {
        FIELD,
        INDEX,
        KEY,
        WILDCARD
    }

    Type type();

    /**
     * Canonical escaped text of this segment as it appears inside an address.
     */
    String text();

    default boolean isBracket() {
        return type() != Type.FIELD;
    }

    static Field field(String name) {
        return new Field(name);
    }

    static Index index(int index) {
        return new Index(index);
    }

    static Wildcard wildcard() {
        return Wildcard.INSTANCE;
    }

    record Field(String name) implements PathSegment {
        public Field {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public Type type() {
            return Type.FIELD;
        }

        @Override
        public String text() {
            return AddressSyntax.escapeField(name);
        }
    }

    record Index(int index) implements PathSegment {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        }

        @Override
        public Type type() {
            return Type.INDEX;
        }

        @Override
        public String text() {
            return "[" + index + "]";
        }
    }

    /**
     * Identity-key selector {@code [k=v]}, {@code [k1=v1,k2=v2]} or {@code [k=v::n]}. Occurrence
     * {@code 1} is the first element carrying the key text and is not rendered.
     */
    record Key(List<KeyComponent> components, int occurrence) implements PathSegment {
        public Key {
            Objects.requireNonNull(components, "components");
            if (components.isEmpty()) {
                throw new IllegalArgumentException("key segment needs at least one component");
            }
            components = List.copyOf(components);
            if (occurrence < 1) {
                throw new IllegalArgumentException("occurrence must be positive: " + occurrence);
            }
        }

        public List<String> fields() {
            return components.stream().map(KeyComponent::field).toList();
        }

        public List<String> values() {
            return components.stream().map(KeyComponent::value).toList();
        }

        @Override
        public Type type() {
            return Type.KEY;
        }

        @Override
        public String text() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < components.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                KeyComponent component = components.get(i);
                sb.append(AddressSyntax.escapeBracket(component.field()))
                    .append('=')
                    .append(AddressSyntax.escapeBracket(component.value()));
            }
            if (occurrence > 1) {
                sb.append("::").append(occurrence);
            }
            return sb.append(']').toString();
        }
    }

    record KeyComponent(String field, String value) {
        public KeyComponent {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
            if (field.isEmpty()) {
                throw new IllegalArgumentException("key field must not be empty");
            }
        }
    }

    enum Wildcard implements PathSegment {
        INSTANCE;

        @Override
        public Type type() {
            return Type.WILDCARD;
        }

        @Override
        public String text() {
            return "[]";
        }
    }
}
