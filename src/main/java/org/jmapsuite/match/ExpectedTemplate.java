package org.jmapsuite.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonKind;
import org.jmapsuite.json.JsonValues;

/**
 * Acceptable response shape supplied by a test author.
 *
 * <p>The set of variants is closed: {@link Any}, {@link Literal}, {@link TypedLiteral},
 * {@link SupersetOf}, {@link ExactMapping} and {@link Sequence}. {@link StructuralMatcher}
 * dispatches over exactly these types.
 */
public interface ExpectedTemplate {
    /**
     * Short human readable rendering used in mismatch diagnostics.
     */
    String describe();

    /**
     * Matches any value, including an absent one.
     */
    record Any() implements ExpectedTemplate {
        @Override
        public String describe() {
            return "<any>";
        }
    }

    /**
     * Plain value compared by JSON equality; numbers compare by value.
     */
    record Literal(BsonValue value) implements ExpectedTemplate {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String describe() {
            return JsonValues.render(value);
        }
    }

    /**
     * Asserts the JSON type of the actual value and, when a literal is given, its value.
     */
    record TypedLiteral(JsonKind kind, BsonValue literal) implements ExpectedTemplate {
        public TypedLiteral {
            Objects.requireNonNull(kind, "kind");
            if (kind == JsonKind.OBJECT || kind == JsonKind.ARRAY) {
                throw new IllegalArgumentException("typed literals only cover scalar kinds, got " + kind.label());
            }
            if (literal != null && JsonKind.of(literal) != kind) {
                throw new IllegalArgumentException(
                        "literal " + JsonValues.render(literal) + " is not of kind " + kind.label());
            }
        }

        public boolean hasLiteral() {
            return literal != null;
        }

        @Override
        public String describe() {
            if (literal == null) {
                return "<" + kind.label() + ">";
            }
            return "<" + kind.label() + " " + JsonValues.render(literal) + ">";
        }
    }

    /**
     * Object containing at least the required keys; extra keys are ignored.
     */
    record SupersetOf(Map<String, ExpectedTemplate> required) implements ExpectedTemplate {
        public SupersetOf {
            required = copyFields(required);
        }

        @Override
        public String describe() {
            return "<superset of " + required.keySet() + ">";
        }
    }

    /**
     * Object with exactly the given keys.
     */
    record ExactMapping(Map<String, ExpectedTemplate> fields) implements ExpectedTemplate {
        public ExactMapping {
            fields = copyFields(fields);
        }

        @Override
        public String describe() {
            return "<object with keys " + fields.keySet() + ">";
        }
    }

    /**
     * Array whose elements match in order; lengths must agree.
     */
    record Sequence(List<ExpectedTemplate> elements) implements ExpectedTemplate {
        public Sequence {
            Objects.requireNonNull(elements, "elements");
            final List<ExpectedTemplate> copied = new ArrayList<>(elements.size());
            for (ExpectedTemplate element : elements) {
                copied.add(Objects.requireNonNull(element, "element"));
            }
            elements = List.copyOf(copied);
        }

        @Override
        public String describe() {
            return "<array of " + elements.size() + ">";
        }
    }

    private static Map<String, ExpectedTemplate> copyFields(final Map<String, ExpectedTemplate> source) {
        Objects.requireNonNull(source, "fields");
        final Map<String, ExpectedTemplate> copied = new LinkedHashMap<>();
        for (Map.Entry<String, ExpectedTemplate> entry : source.entrySet()) {
            copied.put(
                    Objects.requireNonNull(entry.getKey(), "field name"),
                    Objects.requireNonNull(entry.getValue(), "template for " + entry.getKey()));
        }
        return Collections.unmodifiableMap(copied);
    }
}
