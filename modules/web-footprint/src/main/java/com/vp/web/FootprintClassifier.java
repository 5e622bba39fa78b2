package com.vp.web;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Sorts search hits into official site / social / directories / other.
 * Per hit, in input order, the first matching rule wins:
 * social domain, directory domain, official keyword (only while no official
 * site is chosen yet), otherwise "other". Buckets are then de-duplicated, so a url
 * appears at most once. Pure; no I/O.
 */
@Component
public class FootprintClassifier {

  public static final List<String> SOCIAL_DOMAINS = List.of(
      "linkedin.com", "instagram.com", "facebook.com", "twitter.com", "x.com",
      "youtube.com", "tiktok.com", "pinterest.com");

  public static final List<String> DIRECTORY_DOMAINS = List.of(
      "healthgrades.com", "webmd.com", "doximity.com", "vitals.com",
      "usnews.com", "yellowpages.com", "sharecare.com", "mapquest.com",
      "yelp.com", "zocdoc.com", "md.com", "health.usnews.com");

  public static final List<String> OFFICIAL_KEYWORDS = List.of(
      "clinic", "md", "associates", "heart", "care",
      "hospital", "health", "medical", "center",
      "system", "group", "dr", "physician", "surgery", "official", "home");

  private final List<String> socialDomains;
  private final List<String> directoryDomains;
  private final List<String> officialKeywords;

  public FootprintClassifier() {
    this(SOCIAL_DOMAINS, DIRECTORY_DOMAINS, OFFICIAL_KEYWORDS);
  }

  public FootprintClassifier(List<String> socialDomains, List<String> directoryDomains, List<String> officialKeywords) {
    this.socialDomains = List.copyOf(socialDomains);
    this.directoryDomains = List.copyOf(directoryDomains);
    this.officialKeywords = List.copyOf(officialKeywords);
  }

  public Footprint classify(List<SearchHit> hits) {
    String official = null;
    Set<String> social = new LinkedHashSet<>();
    Set<String> directories = new LinkedHashSet<>();
    Set<String> other = new LinkedHashSet<>();

    for (SearchHit hit : hits) {
      if (hit == null || hit.url().isBlank()) continue;
      String url = hit.url();
      String host = hostOf(url);
      if (matchesDomain(host, socialDomains)) {
        social.add(url);
      } else if (matchesDomain(host, directoryDomains)) {
        directories.add(url);
      } else if (official == null && hasKeyword(hit)) {
        official = url;
      } else {
        other.add(url);
      }
    }
    // social and directory buckets depend on the url alone; only "other" can also hold the official site
    if (official != null) other.remove(official);
    return new Footprint(official, new ArrayList<>(social), new ArrayList<>(directories), new ArrayList<>(other));
  }

  /** Host equals the domain or is a subdomain of it ("www.yelp.com" matches "yelp.com"). */
  static boolean matchesDomain(String host, List<String> domains) {
    if (host.isEmpty()) return false;
    for (String d : domains) {
      if (host.equals(d) || host.endsWith("." + d)) return true;
    }
    return false;
  }

  private boolean hasKeyword(SearchHit hit) {
    String title = hit.title().toLowerCase(Locale.ROOT);
    String url = hit.url().toLowerCase(Locale.ROOT);
    for (String kw : officialKeywords) {
      if (title.contains(kw) || url.contains(kw)) return true;
    }
    return false;
  }

  /** Lower-cased host, "" when the url has none or does not parse. */
  static String hostOf(String url) {
    String candidate = url.contains("://") ? url : "http://" + url;
    try {
      String host = URI.create(candidate.trim()).getHost();
      return host == null ? "" : host.toLowerCase(Locale.ROOT);
    } catch (IllegalArgumentException e) {
      return "";
    }
  }
}
