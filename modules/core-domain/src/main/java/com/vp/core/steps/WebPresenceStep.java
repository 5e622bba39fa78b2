package com.vp.core.steps;

import com.vp.client.IdentityRecord;
import com.vp.core.AuditLog;
import com.vp.core.InvestigationContext;
import com.vp.core.VerificationStep;
import com.vp.web.Footprint;
import com.vp.web.FootprintClassifier;
import com.vp.web.SearchHit;
import com.vp.web.WebSearchAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Searches the web for "name city state" and categorizes the hits.
 * With a claimed address, a second narrower query collects pages that
 * mention the claimed name together with that address.
 */
@Component
@Order(50)
public class WebPresenceStep implements VerificationStep {

  private static final Logger log = LoggerFactory.getLogger(WebPresenceStep.class);

  static final int FOOTPRINT_RESULTS = 15;
  static final int ADDRESS_RESULTS = 5;

  private final WebSearchAggregator search;
  private final FootprintClassifier classifier;

  public WebPresenceStep(WebSearchAggregator search, FootprintClassifier classifier) {
    this.search = search;
    this.classifier = classifier;
  }

  @Override
  public String name() {
    return "web-presence";
  }

  @Override
  public boolean independent() {
    return true;
  }

  @Override
  public void execute(InvestigationContext context, AuditLog audit) {
    IdentityRecord record = context.registryRecord().orElse(null);
    if (record == null) return;

    searchFootprint(context, record, audit);

    String claimedAddress = context.claimed().address();
    if (claimedAddress != null) {
      confirmAddress(context, claimedAddress, audit);
    }
  }

  private void searchFootprint(InvestigationContext context, IdentityRecord record, AuditLog audit) {
    String name = context.searchName().orElse(null);
    if (!StringUtils.hasText(name) || record.city() == null || record.state() == null) {
      audit.append("Insufficient data for web search.");
      return;
    }

    String query = name + " " + record.city() + " " + record.state();
    audit.append("Initiating web presence search for '" + query + "'...");
    try {
      List<SearchHit> hits = search.search(query, FOOTPRINT_RESULTS);
      if (hits.isEmpty()) {
        audit.append("Web search returned no results.");
        return;
      }

      Footprint footprint = classifier.classify(hits);
      context.setWebFootprint(footprint);
      if (footprint.officialSite() != null) {
        audit.append("Found official website: " + footprint.officialSite());
      }
      audit.append("Web search complete. Found " + footprint.socialMedia().size() + " social profiles and "
          + footprint.directories().size() + " directories.");
    } catch (RuntimeException e) {
      log.warn("Web presence search for '{}' failed", query, e);
      audit.append("Web tool error: " + e.getMessage());
    }
  }

  private void confirmAddress(InvestigationContext context, String claimedAddress, AuditLog audit) {
    String name = context.claimed().name() != null ? context.claimed().name() : context.searchName().orElse(null);
    if (!StringUtils.hasText(name)) {
      audit.append("No name to pair with the claimed address; address search skipped.");
      return;
    }

    String query = name + " " + claimedAddress;
    audit.append("Searching for pages linking '" + name + "' to the claimed address...");
    try {
      List<String> links = search.search(query, ADDRESS_RESULTS).stream()
          .map(SearchHit::url)
          .distinct()
          .toList();
      context.setAddressConfirmationLinks(links);
      audit.append("Found " + links.size() + " link(s) mentioning the claimed address.");
    } catch (RuntimeException e) {
      log.warn("Address confirmation search for '{}' failed", query, e);
      audit.append("Address search error: " + e.getMessage());
    }
  }
}
