package com.loon.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Renders values for failure messages.
 * <p>
 * Strings are quoted, composite values (maps, collections, arrays, records) are
 * pretty-printed as JSON with sorted map keys so the text is stable between
 * runs, and everything else goes through {@link String#valueOf(Object)}.
 */
public class ValueFormatter {

    private static final Logger log = LoggerFactory.getLogger(ValueFormatter.class);

    private final ObjectWriter writer;

    public ValueFormatter() {
        var mapper = new ObjectMapper()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        var printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n"));
        this.writer = mapper.writer(printer);
    }

    public String format(Object value) {
        return format(value, UnaryOperator.identity());
    }

    /**
     * @param value the value to render, may be null
     * @param color decoration applied to the rendered text (inside the quotes for strings)
     */
    public String format(Object value, UnaryOperator<String> color) {
        if (value instanceof CharSequence text) {
            return "\"" + color.apply(text.toString()) + "\"";
        }
        if (isComposite(value)) {
            try {
                return color.apply(writer.writeValueAsString(value));
            } catch (JsonProcessingException e) {
                log.debug("Falling back to toString() for {}: {}", value.getClass().getName(), e.getMessage());
            }
        }
        return color.apply(String.valueOf(value));
    }

    static boolean isComposite(Object value) {
        if (value == null) {
            return false;
        }
        var type = value.getClass();
        return value instanceof Map<?, ?>
                || value instanceof Collection<?>
                || type.isArray()
                || type.isRecord();
    }
}
