package com.formproxy.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.formproxy.service.FilteredResponsesService;
import com.formproxy.upstream.UpstreamFetchException;
import com.formproxy.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

@RestController
public class FilteredResponsesController {
    static final String FETCH_FAILED = "Failed to fetch data";

    private static final Logger log = LoggerFactory.getLogger(FilteredResponsesController.class);

    private final FilteredResponsesService service;

    public FilteredResponsesController(FilteredResponsesService service) {
        this.service = service;
    }

    @GetMapping("/{formId}/filteredResponses")
    public ResponseEntity<JsonNode> filteredResponses(@PathVariable String formId,
                                                      @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(service.filteredResponses(formId, params));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> badRequest(ValidationException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ErrorResponse> upstreamFailure(UpstreamFetchException e) {
        log.error("Upstream fetch failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(FETCH_FAILED));
    }

    public record ErrorResponse(String error) {}
}
