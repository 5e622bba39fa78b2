package com.vp.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs providers in order until one yields hits. Providers are tried one after
 * another, never in parallel, so a query is billed at most once per success.
 * Never throws: a failing provider counts as zero results.
 */
@Service
public class WebSearchAggregator {

  private static final Logger log = LoggerFactory.getLogger(WebSearchAggregator.class);

  private final List<WebSearchProvider> providers;

  public WebSearchAggregator(List<WebSearchProvider> providers) {
    this.providers = List.copyOf(providers);
  }

  /** @return up to {@code maxResults} hits with non-empty urls; empty when every provider came back empty or failed */
  public List<SearchHit> search(String query, int maxResults) {
    if (query == null || query.isBlank() || maxResults <= 0) return List.of();

    for (WebSearchProvider provider : providers) {
      List<SearchHit> hits = normalize(attempt(provider, query, maxResults), maxResults);
      if (!hits.isEmpty()) {
        log.info("{} returned {} results for '{}'", provider.id(), hits.size(), query);
        return hits;
      }
      log.info("{} returned 0 results for '{}', trying next provider", provider.id(), query);
    }
    return List.of();
  }

  private static List<SearchHit> attempt(WebSearchProvider provider, String query, int maxResults) {
    try {
      List<SearchHit> hits = provider.search(query, maxResults);
      return hits == null ? List.of() : hits;
    } catch (RuntimeException e) {
      log.warn("{} search failed: {}", provider.id(), e.getMessage());
      return List.of();
    }
  }

  /** Drops null hits, truncates to the budget. */
  private static List<SearchHit> normalize(List<SearchHit> raw, int maxResults) {
    List<SearchHit> out = new ArrayList<>();
    for (SearchHit hit : raw) {
      if (hit == null) continue;
      out.add(hit);
      if (out.size() == maxResults) break;
    }
    return List.copyOf(out);
  }
}
