package org.recdiff.obs;

import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Converts plain event and report values to BSON. Anything without a natural BSON form is written as its
 * string representation, so rendering never fails on an unexpected field value.
 */
public final class BsonValues {
    private BsonValues() {
    }

    public static BsonValue of(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bson) {
            return bson;
        }
        if (value instanceof String text) {
            return new BsonString(text);
        }
        if (value instanceof Boolean flag) {
            return BsonBoolean.valueOf(flag);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new BsonInt32(((Number) value).intValue());
        }
        if (value instanceof Long longValue) {
            return new BsonInt64(longValue);
        }
        if (value instanceof Double || value instanceof Float) {
            return new BsonDouble(((Number) value).doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            BsonDocument document = new BsonDocument();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                document.append(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return document;
        }
        if (value instanceof Iterable<?> items) {
            BsonArray array = new BsonArray();
            for (Object item : items) {
                array.add(of(item));
            }
            return array;
        }
        return new BsonString(String.valueOf(value));
    }
}
