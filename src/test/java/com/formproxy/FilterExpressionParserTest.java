package com.formproxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formproxy.domain.DomainModels.FilterCondition;
import com.formproxy.domain.DomainModels.NumberValue;
import com.formproxy.domain.DomainModels.TextValue;
import com.formproxy.parser.FilterExpressionParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterExpressionParserTest {
    private final FilterExpressionParser parser = new FilterExpressionParser(new ObjectMapper());

    @Test
    void parsesClausesInOrder() {
        var result = parser.parse("""
                [
                  {"id": "note", "condition": "equals", "value": "Nope"},
                  {"id": "employees", "condition": "greater_than", "value": 49},
                  {"id": "checkIn", "condition": "less_than", "value": "2024-02-25"}
                ]
                """);

        assertTrue(result.valid());
        assertEquals(3, result.filters().size());
        assertEquals("note", result.filters().get(0).id());
        assertEquals(FilterCondition.EQUALS, result.filters().get(0).condition());
        assertEquals(new TextValue("Nope"), result.filters().get(0).value());
        assertEquals(new NumberValue(49), result.filters().get(1).value());
        assertEquals(FilterCondition.LESS_THAN, result.filters().get(2).condition());
    }

    @Test
    void keepsNumericLookingStringsAsStrings() {
        var result = parser.parse("[{\"id\": \"count\", \"condition\": \"equals\", \"value\": \"5\"}]");
        assertTrue(result.valid());
        assertEquals(new TextValue("5"), result.filters().get(0).value());
    }

    @Test
    void absentInputAndEmptyArrayMeanNoClauses() {
        assertTrue(parser.parse(null).filters().isEmpty());
        assertTrue(parser.parse("[]").valid());
        assertTrue(parser.parse("[]").filters().isEmpty());
    }

    @Test
    void rejectsInputThatIsNotAnArrayOfObjects() {
        String expected = "\"filters\" must be a JSON array of filter objects";
        assertEquals(expected, parser.parse("not json").error());
        assertEquals(expected, parser.parse("").error());
        assertEquals(expected, parser.parse("{\"id\": \"a\"}").error());
        assertEquals(expected, parser.parse("[1, 2]").error());
        assertEquals(expected, parser.parse("[{\"id\": ").error());
    }

    @Test
    void reportsFirstSchemaViolation() {
        assertEquals("\"filters[0].id\" is required",
                parser.parse("[{\"condition\": \"equals\", \"value\": 1}]").error());
        assertEquals("\"filters[0].id\" must be a string",
                parser.parse("[{\"id\": 7, \"condition\": \"equals\", \"value\": 1}]").error());
        assertEquals("\"filters[0].id\" is not allowed to be empty",
                parser.parse("[{\"id\": \"\", \"condition\": \"equals\", \"value\": 1}]").error());
        assertEquals("\"filters[1].condition\" is required",
                parser.parse("[{\"id\": \"a\", \"condition\": \"equals\", \"value\": 1}, {\"id\": \"b\", \"value\": 1}]").error());
        assertEquals("\"filters[0].condition\" must be one of [equals, does_not_equal, greater_than, less_than]",
                parser.parse("[{\"id\": \"a\", \"condition\": \"contains\", \"value\": 1}]").error());
        assertEquals("\"filters[0].value\" is required",
                parser.parse("[{\"id\": \"a\", \"condition\": \"equals\"}]").error());
        assertEquals("\"filters[0].value\" is required",
                parser.parse("[{\"id\": \"a\", \"condition\": \"equals\", \"value\": null}]").error());
        assertEquals("\"filters[0].value\" must be one of [number, string]",
                parser.parse("[{\"id\": \"a\", \"condition\": \"equals\", \"value\": true}]").error());
        assertEquals("\"filters[0].extra\" is not allowed",
                parser.parse("[{\"id\": \"a\", \"condition\": \"equals\", \"value\": 1, \"extra\": 2}]").error());
    }
}
