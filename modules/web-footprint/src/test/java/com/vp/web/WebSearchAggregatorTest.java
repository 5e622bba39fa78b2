package com.vp.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebSearchAggregatorTest {

  @Mock
  private WebSearchProvider primary;

  @Mock
  private WebSearchProvider fallback;

  private static List<SearchHit> hits(int n) {
    List<SearchHit> out = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      out.add(new SearchHit("https://example.org/" + i, "Result " + i));
    }
    return out;
  }

  private WebSearchAggregator aggregator() {
    lenient().when(primary.id()).thenReturn("primary");
    lenient().when(fallback.id()).thenReturn("fallback");
    return new WebSearchAggregator(List.of(primary, fallback));
  }

  @Test
  @DisplayName("primary results win and the fallback is never called")
  void primaryWins() {
    WebSearchAggregator aggregator = aggregator();
    when(primary.search("john smith boston ma", 15)).thenReturn(hits(3));

    List<SearchHit> result = aggregator.search("john smith boston ma", 15);

    assertThat(result).hasSize(3);
    verify(fallback, never()).search(anyString(), anyInt());
  }

  @Test
  void emptyPrimaryFallsBack() {
    WebSearchAggregator aggregator = aggregator();
    when(primary.search("q", 5)).thenReturn(List.of());
    when(fallback.search("q", 5)).thenReturn(hits(2));

    assertThat(aggregator.search("q", 5)).extracting(SearchHit::url)
        .containsExactly("https://example.org/0", "https://example.org/1");
  }

  @Test
  @DisplayName("a throwing primary counts as zero results")
  void failingPrimaryFallsBack() {
    WebSearchAggregator aggregator = aggregator();
    when(primary.search("q", 5)).thenThrow(new IllegalStateException("quota exceeded"));
    when(fallback.search("q", 5)).thenReturn(hits(1));

    assertThat(aggregator.search("q", 5)).hasSize(1);
  }

  @Test
  void neverThrowsWhenEverythingFails() {
    WebSearchAggregator aggregator = aggregator();
    when(primary.search("q", 5)).thenThrow(new IllegalStateException("down"));
    when(fallback.search("q", 5)).thenThrow(new IllegalStateException("blocked"));

    assertThat(aggregator.search("q", 5)).isEmpty();
  }

  @Test
  void truncatesToTheBudgetAndDropsNulls() {
    WebSearchAggregator aggregator = aggregator();
    List<SearchHit> raw = new ArrayList<>(Arrays.asList(null, new SearchHit("https://a.org", "A")));
    raw.addAll(hits(10));
    when(primary.search("q", 5)).thenReturn(raw);

    List<SearchHit> result = aggregator.search("q", 5);

    assertThat(result).hasSize(5).doesNotContainNull();
    assertThat(result.get(0).url()).isEqualTo("https://a.org");
  }

  @Test
  void nullFromProviderIsEmpty() {
    WebSearchAggregator aggregator = aggregator();
    when(primary.search("q", 5)).thenReturn(null);
    when(fallback.search("q", 5)).thenReturn(List.of());

    assertThat(aggregator.search("q", 5)).isEmpty();
  }

  @Test
  void blankQueryOrZeroBudgetSkipsProviders() {
    WebSearchAggregator aggregator = aggregator();

    assertThat(aggregator.search(" ", 5)).isEmpty();
    assertThat(aggregator.search("q", 0)).isEmpty();
    verify(primary, never()).search(anyString(), anyInt());
  }
}
