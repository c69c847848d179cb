package com.jsonparser.generator.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.build.BuildException;
import com.jsonparser.generator.build.BuildFailure;
import com.jsonparser.generator.codegen.mapper.CTypeMapper;
import com.jsonparser.generator.codegen.model.GeneratedSource;
import com.jsonparser.generator.runtime.ExecutionMode;
import com.jsonparser.generator.runtime.protocol.WireProtocol;
import com.jsonparser.generator.schema.FieldKind;
import com.jsonparser.generator.schema.FieldSpec;
import com.jsonparser.generator.schema.RecordSchema;
import com.jsonparser.generator.schema.validation.SchemaValidationException;
import com.jsonparser.generator.schema.validation.SchemaValidator;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a schema into C source: a struct definition, a single-pass parsing
 * routine and a serializer writing the record line, plus the driver program
 * that exposes them as an executable.
 */
public class CodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    static final String HEADER_TEMPLATE = "record_header.h.ftl";
    static final String PARSER_TEMPLATE = "record_parser.c.ftl";
    static final String ONESHOT_DRIVER_TEMPLATE = "driver_oneshot.c.ftl";
    static final String WORKER_DRIVER_TEMPLATE = "driver_worker.c.ftl";

    private final Configuration freemarkerConfig;
    private final WireProtocol protocol;
    private final SchemaValidator validator;

    public CodeGenerator(WireProtocol protocol) {
        this(createFreemarkerConfig(), protocol);
    }

    CodeGenerator(Configuration freemarkerConfig, WireProtocol protocol) {
        this.freemarkerConfig = freemarkerConfig;
        this.protocol = protocol;
        this.validator = new SchemaValidator();
    }

    private static Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(CodeGenerator.class, "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Marker closing the header part of the generated source.
     */
    public static String headerEndMarker(String schemaName) {
        return "#endif // " + headerGuard(schemaName) + "\n";
    }

    /**
     * Generate the header and implementation for a schema.
     *
     * @throws SchemaValidationException if the schema is not valid
     * @throws BuildException            if a template cannot be loaded or rendered
     */
    public GeneratedSource generate(RecordSchema schema) throws SchemaValidationException, BuildException {
        validator.requireValid(schema);

        Map<String, Object> model = templateModel(schema);
        String header = render(HEADER_TEMPLATE, model);
        String implementation = render(PARSER_TEMPLATE, model);
        log.debug("Generated {} bytes of C source for {}", header.length() + implementation.length(), schema.getName());

        return GeneratedSource.builder()
                .schemaName(schema.getName())
                .source(header + implementation)
                .headerEndMarker(headerEndMarker(schema.getName()))
                .build();
    }

    /**
     * Generate the driver program for the given execution mode.
     */
    public String generateDriver(RecordSchema schema, ExecutionMode mode) throws SchemaValidationException, BuildException {
        validator.requireValid(schema);

        String template = switch (mode) {
            case SUBPROCESS -> ONESHOT_DRIVER_TEMPLATE;
            case WORKER -> WORKER_DRIVER_TEMPLATE;
        };
        return render(template, templateModel(schema));
    }

    public static String driverFileName(String schemaName, ExecutionMode mode) {
        return switch (mode) {
            case SUBPROCESS -> "main_" + schemaName + ".c";
            case WORKER -> "worker_" + schemaName + ".c";
        };
    }

    private Map<String, Object> templateModel(RecordSchema schema) {
        List<Map<String, Object>> fields = schema.getFields().stream()
                .map(CodeGenerator::fieldModel)
                .toList();

        Map<String, Object> model = new HashMap<>();
        model.put("typeName", typeName(schema.getName()));
        model.put("headerFile", schema.getName() + ".h");
        model.put("headerGuard", headerGuard(schema.getName()));
        model.put("fields", fields);
        model.put("hasInteger", hasKind(schema, FieldKind.INTEGER));
        model.put("hasBoolean", hasKind(schema, FieldKind.BOOLEAN));
        model.put("keyedProtocol", protocol == WireProtocol.KEYED);
        model.put("successSentinel", WireProtocol.SUCCESS_SENTINEL);
        model.put("failureSentinel", WireProtocol.FAILURE_SENTINEL);
        return model;
    }

    private static Map<String, Object> fieldModel(FieldSpec field) {
        FieldKind kind = field.requireKind();
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("name", field.getName());
        model.put("member", memberName(field.getName()));
        model.put("ctype", CTypeMapper.toCType(kind));
        model.put("kind", kind.name());
        return model;
    }

    private static boolean hasKind(RecordSchema schema, FieldKind kind) {
        return schema.getFields().stream().anyMatch(field -> field.requireKind() == kind);
    }

    /**
     * C typedef for a schema's record. Generated helpers use a {@code jpg_}
     * prefix and never end in {@code _record}.
     */
    public static String typeName(String schemaName) {
        return schemaName + "_record";
    }

    /**
     * C struct member for a field; the JSON key stays the plain field name.
     */
    public static String memberName(String fieldName) {
        return "f_" + fieldName;
    }

    private static String headerGuard(String schemaName) {
        return "JPG_" + schemaName + "_H";
    }

    private String render(String templateName, Map<String, Object> model) throws BuildException {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new BuildException(BuildFailure.TEMPLATE_FAILED,
                    "failed to generate C code from " + templateName + ": " + e.getMessage(), e);
        }
    }
}
