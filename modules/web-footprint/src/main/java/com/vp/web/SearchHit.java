package com.vp.web;

import org.springframework.util.StringUtils;

/** One search result, normalized across providers. Title may be empty, url never is. */
public record SearchHit(String url, String title) {

  public SearchHit {
    if (!StringUtils.hasText(url)) {
      throw new IllegalArgumentException("Search hit needs a url");
    }
    url = url.trim();
    title = title == null ? "" : title.trim();
  }

  /** Null when the url is blank, so callers can drop the hit. */
  public static SearchHit of(String url, String title) {
    return StringUtils.hasText(url) ? new SearchHit(url, title) : null;
  }
}
