package com.formproxy.filter;

import com.formproxy.domain.DomainModels.FilterClause;
import com.formproxy.domain.DomainModels.Submission;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ResponseFilter {
    private final PredicateEvaluator evaluator;

    public ResponseFilter(PredicateEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public List<Submission> apply(List<Submission> submissions, List<FilterClause> filters) {
        return submissions.stream()
                .filter(s -> matches(s, filters))
                .toList();
    }

    public boolean matches(Submission submission, List<FilterClause> filters) {
        return filters.stream().allMatch(clause -> evaluator.evaluate(submission, clause));
    }
}
