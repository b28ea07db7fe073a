package com.example.routex.service.delivery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Substitutes {@code {name}} placeholders. {@code {{} and {@code }}} produce literal braces.
 */
@Component
@Slf4j
public class TemplateRenderer {

    /**
     * @throws TemplateRenderingException on an unknown placeholder or an unbalanced brace.
     */
    public String render(String template, Map<String, String> values) {
        StringBuilder out = new StringBuilder(template.length() + 32);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new TemplateRenderingException("Single '{' encountered at position " + i);
                }
                String name = template.substring(i + 1, close);
                if (!values.containsKey(name)) {
                    throw new TemplateRenderingException("Unknown placeholder {" + name + "}");
                }
                out.append(values.get(name));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new TemplateRenderingException("Single '}' encountered at position " + i);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Renders the template, or returns it untouched if it cannot be rendered.
     */
    public String renderOrRaw(String template, Map<String, String> values) {
        try {
            return render(template, values);
        } catch (TemplateRenderingException e) {
            log.warn("Template rendering failed, sending raw text: {} (template: '{}')",
                    e.getMessage(), abbreviate(template));
            return template;
        }
    }

    private static String abbreviate(String template) {
        return template.length() <= 100 ? template : template.substring(0, 100) + "...";
    }
}
