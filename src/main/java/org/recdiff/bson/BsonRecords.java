package org.recdiff.bson;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.recdiff.model.DiffRecord;
import org.recdiff.model.FieldDescriptor;
import org.recdiff.model.MapRecord;
import org.recdiff.model.RecordCollection;
import org.recdiff.model.RecordType;

/**
 * Adapts BSON documents to comparable records.
 *
 * <p>Conversion is schema driven: a field declaring a record type becomes a nested record, a field
 * declaring an item type becomes a {@link RecordCollection} (arrays keyed by position, sub-documents
 * keyed by name), everything else becomes plain Java values. Document keys the type does not declare
 * are ignored.
 */
public final class BsonRecords {
    public static final String ID_FIELD = "_id";

    private BsonRecords() {}

    public static MapRecord toRecord(final RecordType type, final Document document) {
        Objects.requireNonNull(document, "document");
        return toRecord(type, BsonDocument.parse(document.toJson()));
    }

    public static MapRecord toRecord(final RecordType type, final BsonDocument document) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(document, "document");
        final MapRecord.Builder builder = MapRecord.builder(type);
        for (final FieldDescriptor field : type.fields().values()) {
            if (document.containsKey(field.name())) {
                builder.set(field.name(), convertField(document.get(field.name()), field, type));
            }
        }
        return builder.build();
    }

    /**
     * Infers one record type covering every key seen in {@code samples}.
     *
     * <p>Sub-documents become nested record types named {@code typeName.key}; arrays whose elements are all
     * documents carrying {@code _id} become keyed collections. {@code _id} is the identity field when present.
     */
    public static RecordType inferType(final String typeName, final BsonDocument... samples) {
        return inferType(typeName, List.of(samples));
    }

    public static RecordType inferType(final String typeName, final List<BsonDocument> samples) {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(samples, "samples");
        final Set<String> keys = new LinkedHashSet<>();
        for (final BsonDocument sample : samples) {
            keys.addAll(Objects.requireNonNull(sample, "sample").keySet());
        }

        final RecordType.Builder builder = RecordType.builder(typeName);
        for (final String key : keys) {
            final List<BsonValue> values = valuesOf(samples, key);
            final String nestedName = typeName + "." + key;
            if (!values.isEmpty() && values.stream().allMatch(BsonValue::isDocument)) {
                final List<BsonDocument> nested = new ArrayList<>(values.size());
                values.forEach(value -> nested.add(value.asDocument()));
                builder.field(FieldDescriptor.builder(key).recordType(inferType(nestedName, nested)).build());
            } else if (isIdentifiedDocumentArray(values)) {
                final List<BsonDocument> items = new ArrayList<>();
                values.forEach(value -> value.asArray().forEach(item -> items.add(item.asDocument())));
                builder.field(FieldDescriptor.builder(key).itemType(inferType(nestedName, items)).build());
            } else {
                builder.field(key);
            }
        }
        if (keys.contains(ID_FIELD)) {
            builder.identity(ID_FIELD);
        }
        return builder.build();
    }

    /**
     * Converts a BSON value to the Java value the comparison engine works with.
     */
    public static Object toJava(final BsonValue value) {
        if (value == null) {
            return null;
        }
        switch (value.getBsonType()) {
            case NULL:
            case UNDEFINED:
                return null;
            case STRING:
                return value.asString().getValue();
            case INT32:
                return value.asInt32().getValue();
            case INT64:
                return value.asInt64().getValue();
            case DOUBLE:
                return value.asDouble().getValue();
            case DECIMAL128:
                final Decimal128 decimal = value.asDecimal128().getValue();
                if (decimal.isNaN() || decimal.isInfinite()) {
                    return decimal;
                }
                return decimal.bigDecimalValue();
            case BOOLEAN:
                return value.asBoolean().getValue();
            case DATE_TIME:
                return Instant.ofEpochMilli(value.asDateTime().getValue());
            case OBJECT_ID:
                return value.asObjectId().getValue();
            case SYMBOL:
                return value.asSymbol().getSymbol();
            case ARRAY:
                final BsonArray array = value.asArray();
                final List<Object> items = new ArrayList<>(array.size());
                for (final BsonValue item : array) {
                    items.add(toJava(item));
                }
                return items;
            case DOCUMENT:
                final Map<String, Object> entries = new LinkedHashMap<>();
                for (final Map.Entry<String, BsonValue> entry : value.asDocument().entrySet()) {
                    entries.put(entry.getKey(), toJava(entry.getValue()));
                }
                return entries;
            default:
                return value;
        }
    }

    private static Object convertField(final BsonValue value, final FieldDescriptor field, final RecordType owner) {
        if (field.recordType().isPresent() && value.isDocument()) {
            return toRecord(field.recordType().get(), value.asDocument());
        }
        if (field.itemType().isPresent()) {
            final RecordType itemType = field.itemType().get();
            if (value.isArray()) {
                final List<DiffRecord> items = new ArrayList<>(value.asArray().size());
                for (final BsonValue item : value.asArray()) {
                    items.add(toRecord(itemType, requireDocument(item, field, owner)));
                }
                return RecordCollection.ofList(itemType, items);
            }
            if (value.isDocument()) {
                final Map<String, DiffRecord> items = new LinkedHashMap<>();
                for (final Map.Entry<String, BsonValue> entry : value.asDocument().entrySet()) {
                    items.put(entry.getKey(), toRecord(itemType, requireDocument(entry.getValue(), field, owner)));
                }
                return RecordCollection.ofMap(itemType, items);
            }
            if (value.isNull()) {
                return null;
            }
            throw new IllegalArgumentException(
                    owner.name() + "." + field.name() + " must be an array or a document (actual: "
                            + value.getBsonType() + ")");
        }
        return toJava(value);
    }

    private static BsonDocument requireDocument(final BsonValue item, final FieldDescriptor field, final RecordType owner) {
        if (!item.isDocument()) {
            throw new IllegalArgumentException(
                    owner.name() + "." + field.name() + " items must be documents (actual: " + item.getBsonType() + ")");
        }
        return item.asDocument();
    }

    private static List<BsonValue> valuesOf(final List<BsonDocument> samples, final String key) {
        final List<BsonValue> values = new ArrayList<>();
        for (final BsonDocument sample : samples) {
            final BsonValue value = sample.get(key);
            if (value != null && !value.isNull()) {
                values.add(value);
            }
        }
        return values;
    }

    private static boolean isIdentifiedDocumentArray(final List<BsonValue> values) {
        if (values.isEmpty() || !values.stream().allMatch(BsonValue::isArray)) {
            return false;
        }
        boolean sawItem = false;
        for (final BsonValue value : values) {
            for (final BsonValue item : value.asArray()) {
                if (!item.isDocument() || !item.asDocument().containsKey(ID_FIELD)) {
                    return false;
                }
                sawItem = true;
            }
        }
        return sawItem;
    }
}
