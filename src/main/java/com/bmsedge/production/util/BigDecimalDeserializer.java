package com.bmsedge.production.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Lenient quantity deserializer for operator-entered values such as
 * {@code 1250}, {@code "1,250.5"} or {@code "310 kg"}. Unreadable input becomes null.
 */
public class BigDecimalDeserializer extends JsonDeserializer<BigDecimal> {

    @Override
    public BigDecimal deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {

        JsonToken token = parser.getCurrentToken();

        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDecimalValue();
        }

        if (token == JsonToken.VALUE_STRING) {
            return parseQuantity(parser.getText());
        }

        // {} or [] sent by some form widgets for an empty field
        if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
            parser.skipChildren();
        }
        return null;
    }

    public static BigDecimal parseQuantity(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.trim().toLowerCase();
        if (cleaned.endsWith("kg")) {
            cleaned = cleaned.substring(0, cleaned.length() - 2).trim();
        }
        cleaned = cleaned.replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
