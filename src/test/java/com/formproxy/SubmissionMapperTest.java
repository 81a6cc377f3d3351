package com.formproxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formproxy.domain.DomainModels.FieldValue;
import com.formproxy.domain.DomainModels.NumberValue;
import com.formproxy.domain.DomainModels.QuestionCategory;
import com.formproxy.domain.DomainModels.QuestionType;
import com.formproxy.domain.DomainModels.TextValue;
import com.formproxy.filter.DateTimes;
import com.formproxy.upstream.SubmissionMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionMapperTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SubmissionMapper mapper = new SubmissionMapper();

    @Test
    void mapsQuestionsToTaggedValues() throws Exception {
        JsonNode node = objectMapper.readTree("""
                {
                  "submissionId": "abc",
                  "submissionTime": "2024-02-05T19:37:08.000Z",
                  "lastUpdatedAt": "2024-02-05T19:37:08.000Z",
                  "questions": [
                    {"id": "q1", "name": "Employees", "type": "NumberInput", "value": 12},
                    {"id": "q2", "name": "Check-in", "type": "DatePicker", "value": "2024-02-22"},
                    {"id": "q3", "name": "Note", "type": "LongAnswer", "value": null},
                    {"id": "q4", "name": "Picked", "type": "MultiSelect", "value": ["a", "b"]},
                    {"id": "q5", "name": "New", "type": "Hologram", "value": "x"}
                  ],
                  "quiz": {"score": 1, "maxScore": 2}
                }
                """);

        var submission = mapper.toSubmission(node);

        assertEquals("abc", submission.submissionId());
        assertEquals(5, submission.questions().size());
        assertEquals(new NumberValue(12), submission.question("q1").orElseThrow().value());
        assertEquals(QuestionCategory.DATE_TIME, submission.question("q2").orElseThrow().type().category());
        assertEquals(FieldValue.absent(), submission.question("q3").orElseThrow().value());
        assertEquals(new TextValue("[\"a\",\"b\"]"), submission.question("q4").orElseThrow().value());
        assertEquals(QuestionType.UNRECOGNIZED, submission.question("q5").orElseThrow().type());
        assertSame(node, submission.raw());
    }

    @Test
    void toleratesSubmissionsWithoutQuestions() throws Exception {
        var submission = mapper.toSubmission(objectMapper.readTree("{\"submissionId\": \"x\"}"));
        assertTrue(submission.questions().isEmpty());
        assertTrue(submission.question("anything").isEmpty());
    }

    @Test
    void parsesDateFormsUsedByDateQuestions() {
        assertEquals(Instant.parse("2024-02-25T00:00:00Z"), DateTimes.parse("2024-02-25").orElseThrow());
        assertEquals(Instant.parse("2024-02-25T10:15:00Z"), DateTimes.parse("2024-02-25T10:15").orElseThrow());
        assertEquals(Instant.parse("2024-02-25T09:15:00Z"), DateTimes.parse("2024-02-25T10:15:00+01:00").orElseThrow());
        assertEquals(Instant.parse("2024-02-25T10:15:30.250Z"), DateTimes.parse("2024-02-25T10:15:30.250Z").orElseThrow());
        assertTrue(DateTimes.parse("2024-02-30").isEmpty());
        assertTrue(DateTimes.parse("10:30").isEmpty());
        assertTrue(DateTimes.parse(null).isEmpty());
        assertEquals("1970-01-01T00:00:00.000Z", DateTimes.format(Instant.EPOCH));
    }
}
