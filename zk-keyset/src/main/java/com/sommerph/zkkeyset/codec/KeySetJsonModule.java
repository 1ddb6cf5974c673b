package com.sommerph.zkkeyset.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.sommerph.zkkeyset.keyset.KeyOrder;
import com.sommerph.zkkeyset.keyset.KeySet;
import com.sommerph.zkkeyset.keyset.KeySetException;
import com.sommerph.zkkeyset.keyset.SortKey;
import com.sommerph.zkkeyset.model.key.SizedKey;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of {@link KeySet}.
 * <p>
 * JSON object keys must be strings, so a key set is written as an array of
 * {@code [[primary, secondary], key]} pairs in sort key order rather than as an object.
 * Decoding rebuilds the set under the order this module was created with.
 */
public class KeySetJsonModule extends SimpleModule {

    public KeySetJsonModule(KeyOrder order) {
        super("KeySetJsonModule");
        addSerializer(new KeySetSerializer());
        addDeserializer(KeySet.class, new KeySetDeserializer(order, null));
    }

    static class KeySetSerializer extends StdSerializer<KeySet<?>> {

        KeySetSerializer() {
            super(KeySet.class, false);
        }

        @Override
        public void serialize(KeySet<?> keySet, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            for (Map.Entry<SortKey, ? extends SizedKey> entry : keySet.entries()) {
                gen.writeStartArray();
                gen.writeStartArray();
                gen.writeNumber(entry.getKey().getPrimary());
                gen.writeNumber(entry.getKey().getSecondary());
                gen.writeEndArray();
                provider.defaultSerializeValue(entry.getValue(), gen);
                gen.writeEndArray();
            }
            gen.writeEndArray();
        }
    }

    static class KeySetDeserializer extends StdDeserializer<KeySet<?>> implements ContextualDeserializer {

        private final KeyOrder order;
        private final JavaType keyType;

        KeySetDeserializer(KeyOrder order, JavaType keyType) {
            super(KeySet.class);
            this.order = order;
            this.keyType = keyType;
        }

        @Override
        public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
            JavaType type = ctxt.getContextualType();
            if (type == null && property != null) {
                type = property.getType();
            }
            JavaType contained = type == null ? null : type.containedTypeOrUnknown(0);
            // a raw KeySet resolves to Object, which is left unknown and rejected on read
            if (contained == null || !SizedKey.class.isAssignableFrom(contained.getRawClass())) {
                return new KeySetDeserializer(order, null);
            }
            return new KeySetDeserializer(order, contained);
        }

        @Override
        public KeySet<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (keyType == null) {
                return ctxt.reportInputMismatch(this, "Key type of KeySet is unknown");
            }
            if (!p.isExpectedStartArrayToken()) {
                return ctxt.reportInputMismatch(this, "Expected an array of [sortKey, key] pairs, got %s", p.currentToken());
            }
            List<Map.Entry<SortKey, SizedKey>> entries = new ArrayList<>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                expect(p, ctxt, JsonToken.START_ARRAY, "start of [sortKey, key] pair");
                p.nextToken();
                SortKey sortKey = readSortKey(p, ctxt);
                p.nextToken();
                SizedKey key = ctxt.readValue(p, keyType);
                p.nextToken();
                expect(p, ctxt, JsonToken.END_ARRAY, "end of [sortKey, key] pair");
                entries.add(Map.entry(sortKey, key));
            }
            try {
                return KeySet.fromEntries(order, entries);
            } catch (KeySetException | IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Invalid key set: " + e.getMessage(), e);
            }
        }

        private static SortKey readSortKey(JsonParser p, DeserializationContext ctxt) throws IOException {
            expect(p, ctxt, JsonToken.START_ARRAY, "start of sort key");
            p.nextToken();
            int primary = readSize(p, ctxt);
            p.nextToken();
            int secondary = readSize(p, ctxt);
            p.nextToken();
            expect(p, ctxt, JsonToken.END_ARRAY, "end of sort key");
            return new SortKey(primary, secondary);
        }

        private static int readSize(JsonParser p, DeserializationContext ctxt) throws IOException {
            expect(p, ctxt, JsonToken.VALUE_NUMBER_INT, "sort key component");
            int value = p.getIntValue();
            if (value < 0) {
                ctxt.reportInputMismatch(SortKey.class, "Sort key component must not be negative: %d", value);
            }
            return value;
        }

        private static void expect(JsonParser p, DeserializationContext ctxt, JsonToken token, String what) throws IOException {
            if (p.currentToken() != token) {
                ctxt.reportWrongTokenException(KeySet.class, token, "Expected %s", what);
            }
        }
    }

}
