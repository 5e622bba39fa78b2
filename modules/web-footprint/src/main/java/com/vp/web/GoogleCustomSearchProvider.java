package com.vp.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vp.client.JsonNodes;
import com.vp.client.VpApiException;
import com.vp.client.VpClientProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Primary provider: Google Custom Search JSON API.
 * The API serves at most 10 items per call, so larger budgets page with "start".
 * Without an API key or engine id the provider answers empty and the fallback runs.
 */
@Component
@Order(1)
public class GoogleCustomSearchProvider implements WebSearchProvider {

    private static final Logger log = LoggerFactory.getLogger(GoogleCustomSearchProvider.class);

    static final int PAGE_SIZE = 10;
    /** The API refuses start values past 91. */
    private static final int MAX_START = 91;

    private final RestClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final VpClientProperties props;

    public GoogleCustomSearchProvider(RestClient vpRestClient, VpClientProperties props) {
        this.http = vpRestClient;
        this.props = props;
    }

    @Override
    public String id() {
        return "google";
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        if (!props.hasGoogleSearch()) {
            log.debug("Google search not configured (api key / cx missing)");
            return List.of();
        }
        if (!StringUtils.hasText(query) || maxResults <= 0) return List.of();

        List<SearchHit> hits = new ArrayList<>();
        int start = 1;
        while (hits.size() < maxResults && start <= MAX_START) {
            int num = Math.min(PAGE_SIZE, maxResults - hits.size());
            JsonNode items = page(query, start, num).path("items");
            if (!items.isArray() || items.isEmpty()) break;

            for (JsonNode item : items) {
                SearchHit hit = SearchHit.of(JsonNodes.first(item, "link"), JsonNodes.first(item, "title"));
                if (hit != null) hits.add(hit);
            }
            if (items.size() < num) break;
            start += num;
        }
        return hits.size() > maxResults ? hits.subList(0, maxResults) : hits;
    }

    /** GET {base}?key=..&cx=..&q=..&num=..&start=.. */
    private JsonNode page(String query, int start, int num) {
        URI uri = UriComponentsBuilder
                .fromUriString(props.getGoogleSearchBaseUrl())
                .queryParam("key", props.getGoogleApiKey())
                .queryParam("cx", props.getGoogleCx())
                .queryParam("q", query)
                .queryParam("num", num)
                .queryParam("start", start)
                .build()
                .encode()
                .toUri();

        String resp = http.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (rq, rs) -> {
                    throw VpApiException.from("Google search failed", rs);
                })
                .body(String.class);

        if (!StringUtils.hasText(resp)) return mapper.createObjectNode();
        try {
            return mapper.readTree(resp);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse Google search response", e);
        }
    }
}
