package com.schemalens.render;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.cache.ConcurrentMapTemplateCache;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Handlebars template engine with helpers for Markdown output. Values are written as they
 * are; Markdown escaping is done explicitly through the helpers.
 */
public class HandlebarsEngine {
    private final Handlebars handlebars;

    public HandlebarsEngine() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader)
                .with(EscapingStrategy.NOOP)
                .with(new ConcurrentMapTemplateCache())
                .prettyPrint(true);
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("cell", (Helper<Object>) (value, options) ->
                value == null ? "" : Markdown.cell(value.toString()));

        handlebars.registerHelper("code", (Helper<Object>) (value, options) ->
                value == null ? "" : Markdown.code(value.toString()));

        handlebars.registerHelper("quote", (Helper<Object>) (value, options) ->
                value == null ? "" : Markdown.quote(value.toString()));

        handlebars.registerHelper("join", (Helper<Object>) (value, options) -> {
            if (!(value instanceof List)) {
                return value == null ? "" : value.toString();
            }
            String separator = options.hash("separator", ", ");
            return ((List<?>) value).stream().map(String::valueOf).collect(Collectors.joining(separator));
        });

        handlebars.registerHelper("eq", (Helper<Object>) (value, options) -> {
            Object param = options.param(0);
            boolean isEqual = value != null && value.toString().equals(param != null ? param.toString() : null);
            // As a sub-expression (eq x "y") inside {{#if}} there is no block: return the boolean
            CharSequence fn = options.fn();
            if (fn.length() == 0 && options.inverse().length() == 0) {
                return isEqual;
            }
            return isEqual ? fn : options.inverse();
        });
    }

    public Template compile(String templateName) throws IOException {
        return handlebars.compile(templateName);
    }

    public String render(String templateName, Object context) throws IOException {
        Template template = compile(templateName);
        return template.apply(context);
    }
}
