package com.formproxy.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.formproxy.domain.DomainModels.FieldValue;
import com.formproxy.domain.DomainModels.NumberValue;
import com.formproxy.domain.DomainModels.Question;
import com.formproxy.domain.DomainModels.QuestionType;
import com.formproxy.domain.DomainModels.Submission;
import com.formproxy.domain.DomainModels.TextValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SubmissionMapper {

    public List<Submission> toSubmissions(JsonNode responses) {
        List<Submission> submissions = new ArrayList<>();
        responses.forEach(node -> submissions.add(toSubmission(node)));
        return submissions;
    }

    public Submission toSubmission(JsonNode node) {
        List<Question> questions = new ArrayList<>();
        JsonNode questionNodes = node.path("questions");
        if (questionNodes.isArray()) {
            questionNodes.forEach(q -> {
                if (q.isObject() && q.path("id").isTextual()) {
                    questions.add(new Question(
                            q.get("id").asText(),
                            textOrNull(q.get("name")),
                            QuestionType.fromTag(textOrNull(q.get("type"))),
                            toValue(q.get("value"))));
                }
            });
        }
        return new Submission(
                textOrNull(node.get("submissionId")),
                textOrNull(node.get("submissionTime")),
                textOrNull(node.get("lastUpdatedAt")),
                List.copyOf(questions),
                node);
    }

    // Arrays, objects and booleans keep their JSON text so only an identical string can equal them.
    FieldValue toValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return FieldValue.absent();
        if (value.isNumber()) return new NumberValue(value.asDouble());
        if (value.isTextual()) return new TextValue(value.asText());
        return new TextValue(value.toString());
    }

    private String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
