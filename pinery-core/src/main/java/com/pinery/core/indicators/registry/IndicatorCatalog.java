package com.pinery.core.indicators.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exports the registry's mappings as JSON, for prompt building and documentation.
 */
public final class IndicatorCatalog {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * One exported entry.
     */
    public record Entry(
        String name,
        String implementation,
        List<String> params,
        Map<String, Object> defaults,
        List<String> returns,
        String description
    ) {
        static Entry of(IndicatorMapping mapping) {
            return new Entry(mapping.canonicalName(), mapping.implementationId().name(), mapping.paramNames(),
                mapping.defaults(), mapping.returnNames(), mapping.description());
        }
    }

    private IndicatorCatalog() {}

    public static List<Entry> entries(IndicatorRegistry registry) {
        List<Entry> entries = new ArrayList<>();
        for (IndicatorMapping mapping : registry.mappings()) {
            entries.add(Entry.of(mapping));
        }
        return entries;
    }

    public static String toJson(IndicatorRegistry registry) {
        try {
            return MAPPER.writeValueAsString(entries(registry));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize indicator catalog", e);
        }
    }

    /**
     * One line per indicator: "ta.rsi(source=close, length=14)".
     */
    public static String summary(IndicatorRegistry registry) {
        StringBuilder sb = new StringBuilder();
        for (IndicatorMapping mapping : registry.mappings()) {
            sb.append(mapping.canonicalName()).append('(');
            List<String> params = mapping.paramNames();
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(params.get(i));
                Object def = mapping.defaults().get(params.get(i));
                if (def != null) {
                    sb.append('=').append(def);
                }
            }
            sb.append(')');
            if (mapping.multi()) {
                sb.append(" -> [").append(String.join(", ", mapping.returnNames())).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public static void write(IndicatorRegistry registry, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(registry));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write indicator catalog to " + file, e);
        }
    }
}
