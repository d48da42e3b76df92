package com.sc2.replay.identity;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sc2.replay.exception.MissingFieldException;

import freemarker.core.InvalidReferenceException;
import freemarker.core.TemplateClassResolver;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders caller supplied templates against a flat field map.
 *
 * Templates may only contain plain {@code ${field}} interpolations. Directives, macros,
 * built-ins and default/existence operators are rejected before FreeMarker sees the text.
 */
final class PlayerTemplates {

    private static final Configuration CONFIG = createFreemarkerConfig();

    private static final Pattern INTERPOLATION = Pattern.compile("\\$\\{([^}]*)}");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)");
    private static final List<String> FORBIDDEN_MARKERS = List.of("<#", "</#", "[#", "[/#", "<@", "</@", "[@", "[/@", "#{", "[=");

    private PlayerTemplates() {
        // Utility class
    }

    private static Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setNewBuiltinClassResolver(TemplateClassResolver.ALLOWS_NOTHING_RESOLVER);
        cfg.setAPIBuiltinEnabled(false);
        // ids must render as plain digits, not "1,234,567"
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("true,false");
        return cfg;
    }

    static String render(String template, Map<String, Object> fields) {
        validate(template, fields);
        try {
            Template compiled = new Template("format", new StringReader(template), CONFIG);
            StringWriter out = new StringWriter();
            compiled.process(fields, out);
            return out.toString();
        } catch (InvalidReferenceException e) {
            throw new MissingFieldException("Template references an unknown field: "
                    + e.getBlamedExpressionString(), e);
        } catch (TemplateException | IOException e) {
            throw new IllegalArgumentException("Invalid format template: " + e.getMessage(), e);
        }
    }

    /**
     * Accept only {@code ${field}} placeholders naming a key of {@code fields}.
     *
     * @throws MissingFieldException    for a placeholder whose name is not a field
     * @throws IllegalArgumentException for directives or placeholders that are not a bare name
     */
    static void validate(String template, Map<String, Object> fields) {
        for (String marker : FORBIDDEN_MARKERS) {
            if (template.contains(marker)) {
                throw new IllegalArgumentException("Format templates may not contain '" + marker + "'");
            }
        }

        Matcher matcher = INTERPOLATION.matcher(template);
        while (matcher.find()) {
            String expression = matcher.group(1);
            Matcher leading = LEADING_IDENTIFIER.matcher(expression);
            if (leading.find() && !fields.containsKey(leading.group(1))) {
                throw new MissingFieldException("Template references an unknown field: " + leading.group(1), null);
            }
            if (!IDENTIFIER.matcher(expression).matches()) {
                throw new IllegalArgumentException("Only plain ${field} placeholders are allowed: ${" + expression + "}");
            }
        }
    }
}
