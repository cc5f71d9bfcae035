package com.example.cachesync.decode;

import com.example.cachesync.model.DecodedEvent;
import com.example.cachesync.model.ChangeKind;
import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.FieldValue;
import com.example.cachesync.model.RawPayload;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort decoding of binary (protobuf) document events. Only recovers the
 * {@code parentId} and {@code childId} identifiers; every other field, nested map and list is
 * lost. Never generalise this beyond identifier extraction.
 */
@Slf4j
public class IdentifierScanStrategy implements DecodingStrategy {

    public static final String NAME = "identifier-scan";

    static final List<String> IDENTIFIER_FIELDS = List.of("parentId", "childId");

    private static final Pattern IDENTIFIER_TOKEN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_\\-]{0,127}");

    // tag of Value.string_value (field 17, length-delimited)
    private static final char STRING_VALUE_TAG_1 = (char) 0x8A;
    private static final char STRING_VALUE_TAG_2 = (char) 0x01;
    private static final int MARKER_WINDOW = 16;

    private final Map<String, Pattern> keyPatterns = new LinkedHashMap<>();
    private final Map<String, Pattern> fallbackPatterns = new LinkedHashMap<>();

    public IdentifierScanStrategy() {
        for (String field : IDENTIFIER_FIELDS) {
            // the key must stand alone: childIdentity or grandchildId do not count
            String key = "(?<![A-Za-z0-9])" + Pattern.quote(field);
            keyPatterns.put(field, Pattern.compile(key + "(?![A-Za-z0-9])"));
            fallbackPatterns.put(field, Pattern.compile(
                    key + "[^A-Za-z0-9]{1," + MARKER_WINDOW + "}?(" + IDENTIFIER_TOKEN.pattern() + ")"));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<DecodedEvent> tryDecode(RawPayload payload) {
        if (!(payload instanceof RawPayload.Binary binary)) {
            return Optional.empty();
        }
        // one char per byte so offsets and length prefixes line up
        String text = new String(binary.bytes(), StandardCharsets.ISO_8859_1);

        Map<String, FieldValue> values = new LinkedHashMap<>();
        for (String field : IDENTIFIER_FIELDS) {
            String identifier = extract(text, field);
            if (identifier != null) {
                values.put(field, new FieldValue.StringValue(identifier));
            }
        }
        if (values.isEmpty()) {
            return Optional.empty();
        }
        log.warn("Decoded {} with lossy identifier scan, recovered fields {}", binary.describe(), values.keySet());
        return Optional.of(new DecodedEvent(ChangeKind.CREATED, DocumentFields.of(values), NAME));
    }

    String extract(String text, String field) {
        Matcher key = keyPatterns.get(field).matcher(text);
        while (key.find()) {
            String framed = extractLengthPrefixed(text, key.end());
            if (framed != null) {
                return framed;
            }
        }
        Matcher matcher = fallbackPatterns.get(field).matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Reads a {@code string_value} that follows the map key within a few bytes:
     * tag 0x8A 0x01, a single-byte length, then the UTF-8 characters.
     */
    private String extractLengthPrefixed(String text, int from) {
        int limit = Math.min(text.length() - 3, from + MARKER_WINDOW);
        for (int i = from; i < limit; i++) {
            if (text.charAt(i) == STRING_VALUE_TAG_1 && text.charAt(i + 1) == STRING_VALUE_TAG_2) {
                int length = text.charAt(i + 2);
                int start = i + 3;
                if (length == 0 || length > 127 || start + length > text.length()) {
                    return null;
                }
                String candidate = text.substring(start, start + length);
                return IDENTIFIER_TOKEN.matcher(candidate).matches() ? candidate : null;
            }
        }
        return null;
    }
}
