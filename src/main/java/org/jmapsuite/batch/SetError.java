package org.jmapsuite.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;

/**
 * Error object reported for one id in {@code notCreated}, {@code notUpdated} or {@code notDestroyed}.
 */
public record SetError(String type, String description, List<String> properties, BsonDocument raw) {
    public SetError {
        Objects.requireNonNull(type, "type");
        properties = List.copyOf(Objects.requireNonNull(properties, "properties"));
        raw = Objects.requireNonNull(raw, "raw").clone();
    }

    static SetError from(final BsonValue value) {
        if (value == null || !value.isDocument()) {
            final BsonDocument raw = new BsonDocument();
            return new SetError("", null, List.of(), raw);
        }
        final BsonDocument document = value.asDocument();
        final String type = JsonValues.readString(document, "type");
        final List<String> properties = new ArrayList<>();
        final BsonValue propertiesValue = document.get("properties");
        if (propertiesValue != null && propertiesValue.isArray()) {
            for (BsonValue property : propertiesValue.asArray()) {
                if (property.isString()) {
                    properties.add(property.asString().getValue());
                }
            }
        }
        return new SetError(
                type == null ? "" : type,
                JsonValues.readString(document, "description"),
                properties,
                document);
    }

    public Optional<String> descriptionText() {
        return Optional.ofNullable(description);
    }
}
