package com.vp.web;

import java.util.List;

/**
 * One web search backend. Implementations may throw on transport or parse
 * failure; {@link WebSearchAggregator} turns that into zero results.
 * Spring injects providers ordered by {@code @Order}: lower runs first.
 */
public interface WebSearchProvider {

  String id();

  /** @return at most {@code maxResults} hits; may contain hits with blank urls (dropped later) */
  List<SearchHit> search(String query, int maxResults);
}
