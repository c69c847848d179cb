package com.jsonparser.generator.runtime.protocol;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.jsonparser.generator.runtime.ParseException;
import com.jsonparser.generator.runtime.ParseFailure;
import com.jsonparser.generator.runtime.ParsedRecord;
import com.jsonparser.generator.schema.FieldKind;
import com.jsonparser.generator.schema.FieldSpec;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ResultDecoder.
 */
class ResultDecoderTest {

    private static final List<FieldSpec> PERSON = List.of(
            FieldSpec.of("name", FieldKind.STRING),
            FieldSpec.of("age", FieldKind.INTEGER),
            FieldSpec.of("is_student", FieldKind.BOOLEAN));

    private final ResultDecoder positional = new ResultDecoder(PERSON, WireProtocol.POSITIONAL);
    private final ResultDecoder keyed = new ResultDecoder(PERSON, WireProtocol.KEYED);

    @Test
    void testDecodePositional() throws ParseException {
        ParsedRecord record = positional.decode("SUCCESS|John Doe|25|true");

        assertThat(record.asMap()).containsExactly(
                entry("name", "John Doe"),
                entry("age", "25"),
                entry("is_student", true));
        assertThat(record.getLong("age")).isEqualTo(25L);
    }

    @Test
    void testDefaultsFromArtifact() throws ParseException {
        ParsedRecord record = positional.decode("SUCCESS||0|false");

        assertThat(record.getString("name")).isEmpty();
        assertThat(record.getIntegerText("age")).isEqualTo("0");
        assertThat(record.getBoolean("is_student")).isFalse();
    }

    @Test
    void testTokensAreTrimmed() throws ParseException {
        ParsedRecord record = positional.decode("  SUCCESS| John |7 | true \n");

        assertThat(record.getString("name")).isEqualTo("John");
        assertThat(record.getIntegerText("age")).isEqualTo("7");
        assertThat(record.getBoolean("is_student")).isTrue();
    }

    @Test
    void testBooleanOnlyTrueLiteral() throws ParseException {
        ParsedRecord record = positional.decode("SUCCESS|a|1|TRUE");

        assertThat(record.getBoolean("is_student")).isFalse();
    }

    @Test
    void testShortLineTruncates() throws ParseException {
        ParsedRecord record = positional.decode("SUCCESS|John");

        assertThat(record.size()).isEqualTo(1);
        assertThat(record.contains("age")).isFalse();
    }

    @Test
    void testExtraTokensIgnored() throws ParseException {
        ParsedRecord record = positional.decode("SUCCESS|John|1|false|surplus");

        assertThat(record.asMap()).containsOnlyKeys("name", "age", "is_student");
    }

    @Test
    void testFailureSentinel() {
        ParseException e = catchThrowableOfType(
                () -> positional.decode("ERROR|Failed to parse JSON\n"), ParseException.class);

        assertThat(e.getFailure()).isEqualTo(ParseFailure.PARSE_FAILURE_SENTINEL);
        assertThat(e.getMessage()).contains("Failed to parse JSON");
        assertThat(e.getRawOutput()).isEqualTo("ERROR|Failed to parse JSON");
    }

    @Test
    void testMalformedOutput() {
        assertThatThrownBy(() -> positional.decode("Segmentation fault"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Segmentation fault")
                .extracting(e -> ((ParseException) e).getFailure())
                .isEqualTo(ParseFailure.MALFORMED_OUTPUT);
    }

    @Test
    void testEmptyOutput() {
        assertThatThrownBy(() -> positional.decode(""))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getFailure())
                .isEqualTo(ParseFailure.MALFORMED_OUTPUT);
    }

    @Test
    void testDecodeKeyedInSchemaOrder() throws ParseException {
        ParsedRecord record = keyed.decode("SUCCESS|is_student=true|name=Ann|age=-3|unknown=x");

        assertThat(record.asMap()).containsExactly(
                entry("name", "Ann"),
                entry("age", "-3"),
                entry("is_student", true));
    }

    @Test
    void testKeyedValueMayContainSeparator() throws ParseException {
        ParsedRecord record = keyed.decode("SUCCESS|name=a=b|age=1|is_student=false");

        assertThat(record.getString("name")).isEqualTo("a=b");
    }

    @Test
    void testKeyedTokenWithoutSeparator() {
        assertThatThrownBy(() -> keyed.decode("SUCCESS|Ann|age=1"))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getFailure())
                .isEqualTo(ParseFailure.MALFORMED_OUTPUT);
    }
}
