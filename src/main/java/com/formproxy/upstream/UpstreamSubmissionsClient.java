package com.formproxy.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.formproxy.filter.DateTimes;
import com.formproxy.validation.QueryParamsValidator.QueryParams;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

@Component
public class UpstreamSubmissionsClient {
    private final RestTemplate restTemplate;
    private final UpstreamProperties properties;

    public UpstreamSubmissionsClient(RestTemplate upstreamRestTemplate, UpstreamProperties properties) {
        this.restTemplate = upstreamRestTemplate;
        this.properties = properties;
    }

    public JsonNode fetchSubmissions(String formId, QueryParams params) {
        URI uri = submissionsUri(formId, params);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.bearerToken() == null ? "" : properties.bearerToken());
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new UpstreamFetchException("Upstream request failed for form " + formId, e);
        }

        JsonNode body = response.getBody();
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new UpstreamFetchException("Upstream returned an empty body for form " + formId);
        }
        return body;
    }

    URI submissionsUri(String formId, QueryParams params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
                .pathSegment(formId, "submissions")
                .queryParam("limit", params.limit())
                .queryParam("offset", params.offset());
        if (params.afterDate() != null) builder.queryParam("afterDate", DateTimes.format(params.afterDate()));
        if (params.beforeDate() != null) builder.queryParam("beforeDate", DateTimes.format(params.beforeDate()));
        if (params.status() != null) builder.queryParam("status", params.status());
        if (params.includeEditLink() != null) builder.queryParam("includeEditLink", params.includeEditLink());
        builder.queryParam("sort", params.sort());
        return builder.encode().build().toUri();
    }
}
