package com.mouse.keeper.deserializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.mouse.keeper.utils.CookieUtils;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads account cookies written either as {@code {"session": "..."}} or as a raw
 * {@code "session=...; other=..."} header string.
 */
public class CookieMapDeserializer extends JsonDeserializer<Map<String, String>> {

    @Override
    public Map<String, String> deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {

        if (parser.currentToken() == JsonToken.VALUE_NULL) {
            return new LinkedHashMap<>();
        }

        if (parser.currentToken() == JsonToken.VALUE_STRING) {
            return CookieUtils.parseCookieHeader(parser.getText());
        }

        if (parser.currentToken() != JsonToken.START_OBJECT) {
            parser.skipChildren();
            return new LinkedHashMap<>();
        }

        Map<String, String> cookies = new LinkedHashMap<>();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String cookieName = parser.currentName();
            parser.nextToken();

            // Nested structures are not cookie values
            if (parser.currentToken() == JsonToken.START_OBJECT || parser.currentToken() == JsonToken.START_ARRAY) {
                parser.skipChildren();
                continue;
            }
            if (parser.currentToken() != JsonToken.VALUE_NULL) {
                cookies.put(cookieName, parser.getValueAsString());
            }
        }

        return cookies;
    }
}
