package com.formproxy.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formproxy.domain.DomainModels.Submission;
import com.formproxy.filter.ResponseFilter;
import com.formproxy.pagination.Paginator;
import com.formproxy.upstream.SubmissionMapper;
import com.formproxy.upstream.UpstreamFetchException;
import com.formproxy.upstream.UpstreamSubmissionsClient;
import com.formproxy.validation.QueryParamsValidator;
import com.formproxy.validation.QueryParamsValidator.QueryParams;
import com.formproxy.validation.QueryParamsValidator.ValidationResult;
import com.formproxy.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;

import java.util.List;

@Service
public class FilteredResponsesService {
    private static final Logger log = LoggerFactory.getLogger(FilteredResponsesService.class);

    private final QueryParamsValidator validator;
    private final UpstreamSubmissionsClient upstreamClient;
    private final SubmissionMapper submissionMapper;
    private final ResponseFilter responseFilter;
    private final Paginator paginator;
    private final ObjectMapper objectMapper;

    public FilteredResponsesService(QueryParamsValidator validator,
                                    UpstreamSubmissionsClient upstreamClient,
                                    SubmissionMapper submissionMapper,
                                    ResponseFilter responseFilter,
                                    Paginator paginator,
                                    ObjectMapper objectMapper) {
        this.validator = validator;
        this.upstreamClient = upstreamClient;
        this.submissionMapper = submissionMapper;
        this.responseFilter = responseFilter;
        this.paginator = paginator;
        this.objectMapper = objectMapper;
    }

    // Only the single upstream page for limit/offset is filtered.
    public JsonNode filteredResponses(String formId, MultiValueMap<String, String> rawParams) {
        ValidationResult validation = validator.validate(rawParams);
        if (!validation.valid()) {
            throw new ValidationException(validation.error());
        }
        QueryParams params = validation.params();

        JsonNode payload = upstreamClient.fetchSubmissions(formId, params);
        if (!params.hasFilters()) {
            return payload;
        }

        JsonNode responses = payload.get("responses");
        if (responses == null || !responses.isArray()) {
            throw new UpstreamFetchException("Upstream payload for form " + formId + " has no responses array");
        }

        List<Submission> submissions = submissionMapper.toSubmissions(responses);
        List<Submission> matching = responseFilter.apply(submissions, params.filters());
        Paginator.Page<Submission> page = paginator.paginate(matching, params.offset(), params.limit());
        log.debug("Form {}: {} of {} submissions matched {} filter(s), returning {}",
                formId, matching.size(), submissions.size(), params.filters().size(), page.items().size());

        return objectMapper.valueToTree(new FilteredPage(
                page.items().stream().map(Submission::raw).toList(),
                page.totalResponses(),
                page.pageCount()));
    }

    public record FilteredPage(List<JsonNode> responses, int totalResponses, int pageCount) {}
}
