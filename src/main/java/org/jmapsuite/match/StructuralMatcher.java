package org.jmapsuite.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonKind;
import org.jmapsuite.json.JsonValues;

/**
 * Compares decoded JSON against an {@link ExpectedTemplate} and records every mismatch path.
 *
 * <p>Pure: neither argument is modified.
 */
public final class StructuralMatcher {
    private static final String ROOT = "$";

    private StructuralMatcher() {}

    public static MatchResult matches(final BsonValue actual, final ExpectedTemplate expected) {
        Objects.requireNonNull(expected, "expected");
        final List<Mismatch> mismatches = new ArrayList<>();
        compare(ROOT, actual, expected, mismatches);
        return MatchResult.of(mismatches);
    }

    private static void compare(
            final String path,
            final BsonValue actual,
            final ExpectedTemplate expected,
            final List<Mismatch> mismatches) {
        if (expected instanceof ExpectedTemplate.Any) {
            return;
        }
        if (expected instanceof ExpectedTemplate.TypedLiteral typed) {
            compareTyped(path, actual, typed, mismatches);
            return;
        }
        if (expected instanceof ExpectedTemplate.SupersetOf superset) {
            compareFields(path, actual, superset.required(), true, expected, mismatches);
            return;
        }
        if (expected instanceof ExpectedTemplate.ExactMapping exact) {
            compareFields(path, actual, exact.fields(), false, expected, mismatches);
            return;
        }
        if (expected instanceof ExpectedTemplate.Sequence sequence) {
            compareSequence(path, actual, sequence.elements(), expected, mismatches);
            return;
        }
        if (expected instanceof ExpectedTemplate.Literal literal) {
            compareLiteral(path, actual, literal.value(), mismatches);
            return;
        }
        throw new IllegalArgumentException("unsupported template type: " + expected.getClass().getName());
    }

    private static void compareTyped(
            final String path,
            final BsonValue actual,
            final ExpectedTemplate.TypedLiteral expected,
            final List<Mismatch> mismatches) {
        if (actual == null) {
            mismatches.add(new Mismatch(path, "missing value", expected.describe(), null));
            return;
        }
        final JsonKind actualKind = JsonKind.of(actual);
        if (actualKind != expected.kind()) {
            mismatches.add(new Mismatch(
                    path,
                    "expected JSON " + expected.kind().label() + " but found " + actualKind.label(),
                    expected.describe(),
                    actual));
            return;
        }
        if (expected.hasLiteral() && !JsonValues.jsonEquals(actual, expected.literal())) {
            mismatches.add(new Mismatch(path, "value mismatch", expected.describe(), actual));
        }
    }

    private static void compareFields(
            final String path,
            final BsonValue actual,
            final Map<String, ExpectedTemplate> fields,
            final boolean allowExtraKeys,
            final ExpectedTemplate expected,
            final List<Mismatch> mismatches) {
        if (actual == null) {
            mismatches.add(new Mismatch(path, "missing value", expected.describe(), null));
            return;
        }
        if (!actual.isDocument()) {
            mismatches.add(new Mismatch(
                    path,
                    "expected JSON object but found " + JsonKind.of(actual).label(),
                    expected.describe(),
                    actual));
            return;
        }
        final BsonDocument document = actual.asDocument();
        for (Map.Entry<String, ExpectedTemplate> field : fields.entrySet()) {
            final String fieldPath = path + "." + field.getKey();
            if (!document.containsKey(field.getKey())) {
                if (!(field.getValue() instanceof ExpectedTemplate.Any)) {
                    mismatches.add(new Mismatch(fieldPath, "missing key", field.getValue().describe(), null));
                }
                continue;
            }
            compare(fieldPath, document.get(field.getKey()), field.getValue(), mismatches);
        }
        if (allowExtraKeys) {
            return;
        }
        final TreeSet<String> extraKeys = new TreeSet<>(document.keySet());
        extraKeys.removeAll(fields.keySet());
        for (String extraKey : extraKeys) {
            mismatches.add(new Mismatch(path + "." + extraKey, "unexpected key", "<absent>", document.get(extraKey)));
        }
    }

    private static void compareSequence(
            final String path,
            final BsonValue actual,
            final List<ExpectedTemplate> elements,
            final ExpectedTemplate expected,
            final List<Mismatch> mismatches) {
        if (actual == null) {
            mismatches.add(new Mismatch(path, "missing value", expected.describe(), null));
            return;
        }
        if (!actual.isArray()) {
            mismatches.add(new Mismatch(
                    path,
                    "expected JSON array but found " + JsonKind.of(actual).label(),
                    expected.describe(),
                    actual));
            return;
        }
        final BsonArray array = actual.asArray();
        if (array.size() != elements.size()) {
            mismatches.add(new Mismatch(
                    path + ".length",
                    "array size mismatch",
                    String.valueOf(elements.size()),
                    new BsonInt32(array.size())));
        }
        final int limit = Math.min(array.size(), elements.size());
        for (int i = 0; i < limit; i++) {
            compare(path + "[" + i + "]", array.get(i), elements.get(i), mismatches);
        }
    }

    private static void compareLiteral(
            final String path,
            final BsonValue actual,
            final BsonValue expected,
            final List<Mismatch> mismatches) {
        if (actual == null) {
            mismatches.add(new Mismatch(path, "missing value", JsonValues.render(expected), null));
            return;
        }
        if (JsonValues.jsonEquals(actual, expected)) {
            return;
        }
        final JsonKind expectedKind = JsonKind.of(expected);
        final JsonKind actualKind = JsonKind.of(actual);
        if (expectedKind == JsonKind.OBJECT && actualKind == JsonKind.OBJECT) {
            final BsonDocument expectedDocument = expected.asDocument();
            final BsonDocument actualDocument = actual.asDocument();
            final TreeSet<String> keys = new TreeSet<>(expectedDocument.keySet());
            keys.addAll(actualDocument.keySet());
            for (String key : keys) {
                final String fieldPath = path + "." + key;
                if (!expectedDocument.containsKey(key)) {
                    mismatches.add(new Mismatch(fieldPath, "unexpected key", "<absent>", actualDocument.get(key)));
                    continue;
                }
                if (!actualDocument.containsKey(key)) {
                    mismatches.add(new Mismatch(fieldPath, "missing key", JsonValues.render(expectedDocument.get(key)), null));
                    continue;
                }
                compareLiteral(fieldPath, actualDocument.get(key), expectedDocument.get(key), mismatches);
            }
            return;
        }
        if (expectedKind == JsonKind.ARRAY && actualKind == JsonKind.ARRAY) {
            final BsonArray expectedArray = expected.asArray();
            final BsonArray actualArray = actual.asArray();
            if (expectedArray.size() != actualArray.size()) {
                mismatches.add(new Mismatch(
                        path + ".length",
                        "array size mismatch",
                        String.valueOf(expectedArray.size()),
                        new BsonInt32(actualArray.size())));
            }
            final int limit = Math.min(expectedArray.size(), actualArray.size());
            for (int i = 0; i < limit; i++) {
                compareLiteral(path + "[" + i + "]", actualArray.get(i), expectedArray.get(i), mismatches);
            }
            return;
        }
        final String reason = expectedKind == actualKind
                ? "value mismatch"
                : "expected JSON " + expectedKind.label() + " but found " + actualKind.label();
        mismatches.add(new Mismatch(path, reason, JsonValues.render(expected), actual));
    }
}
