package com.mediator.generator.codegen.generator;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

import com.mediator.generator.codegen.model.GeneratedUnit;
import com.mediator.generator.codegen.model.HandlerRecord;
import com.mediator.generator.codegen.model.core.context.GeneratorConfig;

/**
 * Renders the registration class for an ordered list of handler records.
 *
 * Every type is written fully qualified so the generated file needs no imports.
 * Apart from the optional timestamp line the text depends only on the records and
 * the configuration.
 */
public class RegistrationEmitter {

    private static final String INDENT = "    ";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final GeneratorConfig config;

    public RegistrationEmitter(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Returns nothing for an empty list: no handlers means no file.
     */
    public Optional<GeneratedUnit> emit(List<HandlerRecord> handlers) {
        if (handlers.isEmpty()) {
            return Optional.empty();
        }
        String content = render(handlers);
        return Optional.of(new GeneratedUnit(config.getQualifiedClassName(), relativePath(), content));
    }

    private String render(List<HandlerRecord> handlers) {
        StringBuilder sb = new StringBuilder();
        String registry = config.getRegistryTypeName();

        line(sb, 0, "// <auto-generated/>");
        line(sb, 0, "// Generated by " + config.getGeneratorName() + " v" + config.getGeneratorVersion());
        if (config.isIncludeTimestamp()) {
            line(sb, 0, "// Generation time (informational, not reproducible): "
                    + TIMESTAMP_FORMAT.format(config.getClock().instant()) + " UTC");
        }
        line(sb, 0, "// Handlers discovered: " + handlers.size());
        if (!config.getTargetPackage().isEmpty()) {
            line(sb, 0, "package " + config.getTargetPackage() + ";");
        }
        sb.append('\n');

        line(sb, 0, "/**");
        line(sb, 0, " * Registers the request handlers discovered at build time.");
        line(sb, 0, " */");
        line(sb, 0, "@javax.annotation.processing.Generated(value = \"" + config.getGeneratorName()
                + "\", comments = \"version " + config.getGeneratorVersion() + "\")");
        line(sb, 0, "public final class " + config.getClassName() + " {");
        sb.append('\n');
        line(sb, 1, "private " + config.getClassName() + "() {");
        line(sb, 1, "}");
        sb.append('\n');
        line(sb, 1, "/**");
        line(sb, 1, " * Registers all " + handlers.size() + " discovered request handlers as scoped services.");
        line(sb, 1, " *");
        line(sb, 1, " * @param registry the registry to add handlers to");
        line(sb, 1, " * @return the registry, for chaining");
        line(sb, 1, " */");
        line(sb, 1, "public static <R extends " + registry + "> R registerHandlers(R registry) {");

        for (HandlerRecord handler : handlers) {
            line(sb, 2, registration(handler));
        }

        sb.append('\n');
        line(sb, 2, "return registry;");
        line(sb, 1, "}");
        line(sb, 0, "}");
        return sb.toString();
    }

    private String registration(HandlerRecord handler) {
        return "registry.registerScoped(new " + config.getHandlerTypeTokenName()
                + "<" + handler.getInputType().toDisplayString()
                + ", " + handler.getOutputType().toDisplayString() + ">() {}, "
                + handler.getHandlerName() + ".class);";
    }

    private String relativePath() {
        String directory = config.getTargetPackage().replace('.', '/');
        return directory.isEmpty()
                ? config.getClassName() + ".java"
                : directory + "/" + config.getClassName() + ".java";
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
