package com.formproxy.filter;

import com.formproxy.domain.DomainModels.FieldValue;
import com.formproxy.domain.DomainModels.FilterClause;
import com.formproxy.domain.DomainModels.NumberValue;
import com.formproxy.domain.DomainModels.Question;
import com.formproxy.domain.DomainModels.Submission;
import com.formproxy.domain.DomainModels.TextValue;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

@Component
public class PredicateEvaluator {

    public boolean evaluate(Submission submission, FilterClause clause) {
        Optional<Question> question = submission.question(clause.id());
        if (question.isEmpty()) return false;

        Question q = question.get();
        return switch (clause.condition()) {
            case EQUALS -> sameValue(q.value(), clause.value());
            case DOES_NOT_EQUAL -> !sameValue(q.value(), clause.value());
            case GREATER_THAN -> compare(q, clause.value()).stream().anyMatch(c -> c > 0);
            case LESS_THAN -> compare(q, clause.value()).stream().anyMatch(c -> c < 0);
        };
    }

    private boolean sameValue(FieldValue actual, FieldValue expected) {
        if (actual instanceof NumberValue left && expected instanceof NumberValue right) {
            return left.value() == right.value();
        }
        return actual instanceof TextValue leftText
                && expected instanceof TextValue rightText
                && leftText.value().equals(rightText.value());
    }

    // gate by category only
    private OptionalInt compare(Question question, FieldValue expected) {
        return switch (question.type().category()) {
            case NUMERIC -> compareNumbers(question.value(), expected);
            case DATE_TIME -> compareDates(question.value(), expected);
            default -> OptionalInt.empty();
        };
    }

    private OptionalInt compareNumbers(FieldValue actual, FieldValue expected) {
        if (actual instanceof NumberValue a && expected instanceof NumberValue e) {
            return OptionalInt.of(Double.compare(a.value(), e.value()));
        }
        return OptionalInt.empty();
    }

    private OptionalInt compareDates(FieldValue actual, FieldValue expected) {
        if (!(actual instanceof TextValue a) || !(expected instanceof TextValue e)) {
            return OptionalInt.empty();
        }
        Optional<Instant> left = DateTimes.parse(a.value());
        Optional<Instant> right = DateTimes.parse(e.value());
        if (left.isEmpty() || right.isEmpty()) return OptionalInt.empty();
        return OptionalInt.of(left.get().compareTo(right.get()));
    }
}
