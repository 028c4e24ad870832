package com.cypher.bridge.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the text form of AGE {@code agtype} values into plain Java values.
 *
 * <p>Vertices, edges and paths are printed as JSON followed by a type annotation
 * such as {@code ::vertex}. Annotations outside string literals are removed and
 * the remainder is parsed as JSON into maps, lists, numbers, strings, booleans or null. Text that does
 * not parse is returned unchanged.</p>
 */
public class AgtypeDecoder {

    private static final Pattern ANNOTATION = Pattern.compile("::(vertex|edge|path|numeric)\\b");

    private final JsonMapper mapper;

    public AgtypeDecoder() {
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    public Object decode(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = stripAnnotations(text);
        try {
            return mapper.readValue(cleaned, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    static String stripAnnotations(String text) {
        if (text.indexOf("::") < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        Matcher matcher = ANNOTATION.matcher(text);
        boolean inString = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(text.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                i++;
            } else if (c == ':' && matcher.region(i, text.length()).lookingAt()) {
                i = matcher.end();
            } else {
                if (c == '"') {
                    inString = true;
                }
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
