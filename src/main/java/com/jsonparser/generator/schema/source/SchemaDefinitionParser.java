package com.jsonparser.generator.schema.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.schema.FieldSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for schema definition files.
 *
 * Format:
 * - Record name: record Person
 * - Field: name : string   (or name = string)
 * - Comments: # comment
 *
 * Names and types are not checked here; the validator reports those.
 */
public class SchemaDefinitionParser {
    private static final Logger log = LoggerFactory.getLogger(SchemaDefinitionParser.class);

    private static final Pattern RECORD_PATTERN = Pattern.compile(
            "^record(?:\\s+(\\S*))?\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern FIELD_PATTERN = Pattern.compile(
            "^([^:=\\s]*)\\s*[:=]\\s*(\\S*)\\s*$"
    );

    public SchemaDefinition parse(Path schemaFile) throws IOException {
        List<String> lines = Files.readAllLines(schemaFile);
        return parse(lines);
    }

    public SchemaDefinition parse(List<String> lines) {
        SchemaDefinition definition = new SchemaDefinition();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                parseLine(trimmed, definition);
            } catch (IllegalArgumentException e) {
                definition.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse schema line {}: {}", lineNum, e.getMessage());
            }
        }

        return definition;
    }

    private void parseLine(String line, SchemaDefinition definition) {
        Matcher recordMatcher = RECORD_PATTERN.matcher(line);
        if (recordMatcher.matches()) {
            if (definition.getRecordName() != null) {
                throw new IllegalArgumentException("Record name already declared as " + definition.getRecordName());
            }
            String name = recordMatcher.group(1);
            definition.setRecordName(name == null ? "" : name);
            log.debug("Parsed record name: {}", name);
            return;
        }

        Matcher fieldMatcher = FIELD_PATTERN.matcher(line);
        if (!fieldMatcher.matches()) {
            throw new IllegalArgumentException("Invalid field declaration: " + line);
        }

        FieldSpec field = FieldSpec.declared(fieldMatcher.group(1), fieldMatcher.group(2));
        definition.addField(field);
        log.debug("Parsed field: {} ({})", field.getName(), field.getDeclaredType());
    }
}
