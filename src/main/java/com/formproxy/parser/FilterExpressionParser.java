package com.formproxy.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formproxy.domain.DomainModels.FieldValue;
import com.formproxy.domain.DomainModels.FilterClause;
import com.formproxy.domain.DomainModels.FilterCondition;
import com.formproxy.domain.DomainModels.NumberValue;
import com.formproxy.domain.DomainModels.TextValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class FilterExpressionParser {
    static final String SYNTAX_ERROR = "\"filters\" must be a JSON array of filter objects";
    private static final Set<String> KNOWN_KEYS = Set.of("id", "condition", "value");

    private final ObjectMapper objectMapper;

    public FilterExpressionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParseResult parse(String raw) {
        if (raw == null) return ParseResult.of(List.of());

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(SYNTAX_ERROR);
        }
        if (root == null || !root.isArray()) return ParseResult.failure(SYNTAX_ERROR);

        List<FilterClause> clauses = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) return ParseResult.failure(SYNTAX_ERROR);

            String path = "\"filters[" + i + "]";
            Optional<String> error = checkClause(element, path);
            if (error.isPresent()) return ParseResult.failure(error.get());

            clauses.add(new FilterClause(
                    element.get("id").asText(),
                    FilterCondition.fromWireName(element.get("condition").asText()).orElseThrow(),
                    toValue(element.get("value"))));
        }
        return ParseResult.of(clauses);
    }

    private Optional<String> checkClause(JsonNode element, String path) {
        JsonNode id = element.get("id");
        if (id == null || id.isNull()) return Optional.of(path + ".id\" is required");
        if (!id.isTextual()) return Optional.of(path + ".id\" must be a string");
        if (id.asText().isEmpty()) return Optional.of(path + ".id\" is not allowed to be empty");

        JsonNode condition = element.get("condition");
        if (condition == null || condition.isNull()) return Optional.of(path + ".condition\" is required");
        if (!condition.isTextual() || FilterCondition.fromWireName(condition.asText()).isEmpty()) {
            return Optional.of(path + ".condition\" must be one of " + FilterCondition.wireNames());
        }

        JsonNode value = element.get("value");
        if (value == null || value.isNull()) return Optional.of(path + ".value\" is required");
        if (!value.isNumber() && !value.isTextual()) return Optional.of(path + ".value\" must be one of [number, string]");

        Iterator<String> names = element.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) return Optional.of(path + "." + name + "\" is not allowed");
        }
        return Optional.empty();
    }

    private FieldValue toValue(JsonNode value) {
        return value.isNumber() ? new NumberValue(value.asDouble()) : new TextValue(value.asText());
    }

    public record ParseResult(List<FilterClause> filters, String error) {
        public static ParseResult of(List<FilterClause> filters) {
            return new ParseResult(List.copyOf(filters), null);
        }

        public static ParseResult failure(String error) {
            return new ParseResult(List.of(), error);
        }

        public boolean valid() {
            return error == null;
        }
    }
}
