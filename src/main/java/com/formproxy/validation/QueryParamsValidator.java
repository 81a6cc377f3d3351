package com.formproxy.validation;

import com.formproxy.domain.DomainModels.FilterClause;
import com.formproxy.filter.DateTimes;
import com.formproxy.parser.FilterExpressionParser;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class QueryParamsValidator {
    public static final int MAX_LIMIT = 150;
    public static final int DEFAULT_OFFSET = 0;
    public static final String DEFAULT_SORT = "asc";

    private final FilterExpressionParser filterParser;
    private final List<ParamRule<?>> rules;
    private final Set<String> knownNames;

    public QueryParamsValidator(FilterExpressionParser filterParser) {
        this.filterParser = filterParser;
        this.rules = List.of(
                new ParamRule<Integer>("limit", raw -> integer("limit", raw, 1, MAX_LIMIT), MAX_LIMIT, (p, v) -> p.limit = v),
                new ParamRule<Instant>("afterDate", raw -> isoDate("afterDate", raw), null, (p, v) -> p.afterDate = v),
                new ParamRule<Instant>("beforeDate", raw -> isoDate("beforeDate", raw), null, (p, v) -> p.beforeDate = v),
                new ParamRule<Integer>("offset", raw -> integer("offset", raw, 0, Integer.MAX_VALUE), DEFAULT_OFFSET, (p, v) -> p.offset = v),
                new ParamRule<String>("status", raw -> oneOf("status", raw, List.of("in_progress")), null, (p, v) -> p.status = v),
                new ParamRule<Boolean>("includeEditLink", raw -> bool("includeEditLink", raw), null, (p, v) -> p.includeEditLink = v),
                new ParamRule<String>("sort", raw -> oneOf("sort", raw, List.of("asc", "desc")), DEFAULT_SORT, (p, v) -> p.sort = v),
                new ParamRule<List<FilterClause>>("filters", this::filters, null, (p, v) -> p.filters = v)
        );
        this.knownNames = rules.stream().map(ParamRule::name).collect(Collectors.toSet());
    }

    public ValidationResult validate(MultiValueMap<String, String> rawParams) {
        MultiValueMap<String, String> raw = rawParams == null ? new LinkedMultiValueMap<>() : rawParams;
        ParamsBuilder builder = new ParamsBuilder();
        try {
            for (ParamRule<?> rule : rules) {
                rule.apply(raw, builder);
            }
            for (String name : raw.keySet()) {
                if (!knownNames.contains(name)) throw new ValidationException(quoted(name) + " is not allowed");
            }
        } catch (ValidationException e) {
            return ValidationResult.failure(e.getMessage());
        }
        return ValidationResult.of(builder.build());
    }

    private Integer integer(String name, String raw, int min, int max) {
        BigDecimal number;
        try {
            number = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(quoted(name) + " must be a number");
        }
        if (number.signum() != 0 && number.stripTrailingZeros().scale() > 0) {
            throw new ValidationException(quoted(name) + " must be an integer");
        }
        if (number.compareTo(BigDecimal.valueOf(min)) < 0) {
            throw new ValidationException(quoted(name) + " must be greater than or equal to " + min);
        }
        if (number.compareTo(BigDecimal.valueOf(max)) > 0) {
            throw new ValidationException(quoted(name) + " must be less than or equal to " + max);
        }
        return number.intValueExact();
    }

    private Instant isoDate(String name, String raw) {
        return DateTimes.parse(raw)
                .orElseThrow(() -> new ValidationException(quoted(name) + " must be in ISO 8601 date format"));
    }

    private String oneOf(String name, String raw, List<String> allowed) {
        if (allowed.contains(raw)) return raw;
        if (allowed.size() == 1) throw new ValidationException(quoted(name) + " must be " + allowed);
        throw new ValidationException(quoted(name) + " must be one of " + allowed);
    }

    private Boolean bool(String name, String raw) {
        if ("true".equalsIgnoreCase(raw)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(raw)) return Boolean.FALSE;
        throw new ValidationException(quoted(name) + " must be a boolean");
    }

    private List<FilterClause> filters(String raw) {
        FilterExpressionParser.ParseResult result = filterParser.parse(raw);
        if (!result.valid()) throw new ValidationException(result.error());
        return result.filters();
    }

    private static String quoted(String name) {
        return "\"" + name + "\"";
    }

    private record ParamRule<T>(String name,
                                Function<String, T> converter,
                                T defaultValue,
                                BiConsumer<ParamsBuilder, T> target) {
        void apply(MultiValueMap<String, String> raw, ParamsBuilder builder) {
            List<String> values = raw.get(name);
            if (values == null || values.isEmpty()) {
                target.accept(builder, defaultValue);
                return;
            }
            if (values.size() > 1) throw new ValidationException(quoted(name) + " must be a string");
            target.accept(builder, converter.apply(values.get(0)));
        }
    }

    private static final class ParamsBuilder {
        private int limit;
        private int offset;
        private Instant afterDate;
        private Instant beforeDate;
        private String status;
        private Boolean includeEditLink;
        private String sort;
        private List<FilterClause> filters;

        QueryParams build() {
            return new QueryParams(limit, offset, afterDate, beforeDate, status, includeEditLink, sort, filters);
        }
    }

    public record QueryParams(int limit,
                              int offset,
                              Instant afterDate,
                              Instant beforeDate,
                              String status,
                              Boolean includeEditLink,
                              String sort,
                              List<FilterClause> filters) {
        public boolean hasFilters() {
            return filters != null;
        }
    }

    public record ValidationResult(QueryParams params, String error) {
        public static ValidationResult of(QueryParams params) {
            return new ValidationResult(params, null);
        }

        public static ValidationResult failure(String error) {
            return new ValidationResult(null, error);
        }

        public boolean valid() {
            return error == null;
        }
    }
}
