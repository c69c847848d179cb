package com.jsonparser.generator.runtime.protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.jsonparser.generator.runtime.ParseException;
import com.jsonparser.generator.runtime.ParseFailure;
import com.jsonparser.generator.runtime.ParsedRecord;
import com.jsonparser.generator.schema.FieldKind;
import com.jsonparser.generator.schema.FieldSpec;

/**
 * Turns the record line written by a generated artifact back into typed values.
 *
 * Values are not escaped on the wire, so a string containing the delimiter
 * shifts every later value.
 */
public class ResultDecoder {

    private static final Pattern DELIMITER = Pattern.compile(Pattern.quote(WireProtocol.DELIMITER));

    private final List<FieldSpec> fields;
    private final WireProtocol protocol;

    public ResultDecoder(List<FieldSpec> fields, WireProtocol protocol) {
        this.fields = List.copyOf(fields);
        this.protocol = protocol;
    }

    public ParsedRecord decode(String rawOutput) throws ParseException {
        String output = rawOutput == null ? "" : rawOutput.trim();
        String[] parts = DELIMITER.split(output, -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }

        if (!WireProtocol.SUCCESS_SENTINEL.equals(parts[0])) {
            throw rejected(rawOutput);
        }

        return protocol == WireProtocol.KEYED
                ? decodeKeyed(parts, rawOutput)
                : decodePositional(parts);
    }

    /**
     * Classifies output that did not report success.
     */
    public ParseException rejected(String rawOutput) {
        String output = rawOutput == null ? "" : rawOutput;
        if (output.contains(WireProtocol.FAILURE_SENTINEL)) {
            return new ParseException(ParseFailure.PARSE_FAILURE_SENTINEL, "parsing failed", output.trim());
        }
        return new ParseException(ParseFailure.MALFORMED_OUTPUT, "unexpected parser output", output.trim());
    }

    private ParsedRecord decodePositional(String[] parts) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            if (i + 1 >= parts.length) {
                break;
            }
            FieldSpec field = fields.get(i);
            values.put(field.getName(), coerce(field.requireKind(), parts[i + 1]));
        }
        return ParsedRecord.of(values);
    }

    private ParsedRecord decodeKeyed(String[] parts, String rawOutput) throws ParseException {
        Map<String, String> tokens = new LinkedHashMap<>();
        for (int i = 1; i < parts.length; i++) {
            int separator = parts[i].indexOf(WireProtocol.KEY_SEPARATOR);
            if (separator < 0) {
                throw new ParseException(ParseFailure.MALFORMED_OUTPUT,
                        "keyed value without separator: " + parts[i], rawOutput.trim());
            }
            tokens.put(parts[i].substring(0, separator), parts[i].substring(separator + 1));
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            String token = tokens.get(field.getName());
            if (token != null) {
                values.put(field.getName(), coerce(field.requireKind(), token));
            }
        }
        return ParsedRecord.of(values);
    }

    private static Object coerce(FieldKind kind, String token) {
        return switch (kind) {
            case STRING, INTEGER -> token;
            case BOOLEAN -> "true".equals(token);
        };
    }
}
