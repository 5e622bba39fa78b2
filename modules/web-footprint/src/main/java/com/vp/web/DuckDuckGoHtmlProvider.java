package com.vp.web;

import com.vp.client.VpClientProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Fallback provider: scrapes the DuckDuckGo HTML endpoint (no API key needed).
 * Result anchors carry class "result__a"; their hrefs are usually redirect links
 * ("//duckduckgo.com/l/?uddg=&lt;encoded target&gt;") which are unwrapped here.
 */
@Component
@Order(2)
public class DuckDuckGoHtmlProvider implements WebSearchProvider {

    private static final String BROWSER_UA =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/124.0 Safari/537.36";

    private final VpClientProperties props;

    public DuckDuckGoHtmlProvider(VpClientProperties props) {
        this.props = props;
    }

    @Override
    public String id() {
        return "duckduckgo";
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        if (!StringUtils.hasText(query) || maxResults <= 0) return List.of();

        Document doc;
        try {
            doc = Jsoup.connect(props.getDuckduckgoHtmlUrl())
                    .userAgent(BROWSER_UA)
                    .referrer("https://duckduckgo.com/")
                    .data("q", query)
                    .timeout((int) props.getReadTimeout().toMillis())
                    .post();
        } catch (IOException e) {
            throw new UncheckedIOException("DuckDuckGo request failed: " + e.getMessage(), e);
        }
        return parseResults(doc, maxResults);
    }

    static List<SearchHit> parseResults(Document doc, int maxResults) {
        List<SearchHit> hits = new ArrayList<>();
        for (Element a : doc.select("a.result__a")) {
            if (hits.size() >= maxResults) break;
            SearchHit hit = SearchHit.of(unwrapRedirect(a.attr("href")), a.text());
            if (hit != null) hits.add(hit);
        }
        return hits;
    }

    /** "//duckduckgo.com/l/?uddg=https%3A%2F%2Fx.org&rut=.." -> "https://x.org"; other hrefs pass through. */
    static String unwrapRedirect(String href) {
        if (!StringUtils.hasText(href) || !href.contains("uddg=")) return href;
        String absolute = href.startsWith("//") ? "https:" + href : href;
        try {
            String target = UriComponentsBuilder.fromUriString(absolute).build().getQueryParams().getFirst("uddg");
            return StringUtils.hasText(target) ? URLDecoder.decode(target, StandardCharsets.UTF_8) : href;
        } catch (IllegalArgumentException e) {
            return href;
        }
    }
}
