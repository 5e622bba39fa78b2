package com.vp.client;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Bound to application.yml under the "app" prefix.
 * Kebab-case keys are supported: google-api-key -> googleApiKey and so on.
 *
 * Example:
 *
 * app:
 *   npi-base-url: https://npiregistry.cms.hhs.gov/api/
 *   nominatim-base-url: https://nominatim.openstreetmap.org
 *   user-agent: VeriProvider/1.0
 *
 *   google-api-key: ${GOOGLE_API_KEY:}
 *   google-cx: ${GOOGLE_CX:}
 *   gemini-api-key: ${GEMINI_API_KEY:}
 *
 *   connect-timeout: 5s
 *   read-timeout: 10s
 *   parallel-fanout: false
 */
@ConfigurationProperties(prefix = "app")
public class VpClientProperties {

    // --- registry ---
    private String npiBaseUrl = "https://npiregistry.cms.hhs.gov/api/";
    private String npiApiVersion = "2.1";

    // --- geocoding ---
    private String nominatimBaseUrl = "https://nominatim.openstreetmap.org";

    /** Nominatim rejects requests without an identifying User-Agent. */
    private String userAgent = "VeriProvider/1.0";

    // --- web search ---
    private String googleSearchBaseUrl = "https://www.googleapis.com/customsearch/v1";
    private String googleApiKey;
    private String googleCx;
    private String duckduckgoHtmlUrl = "https://html.duckduckgo.com/html/";

    // --- vision ---
    private String geminiBaseUrl = "https://generativelanguage.googleapis.com/v1beta";
    private String geminiApiKey;
    private String geminiModel = "gemini-2.5-flash";
    private int visionMaxRetries = 3;

    // --- phone ---
    private String phoneDefaultRegion = "US";

    // --- timeouts / execution ---
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);

    /** Run location, contact and web-presence checks concurrently. */
    private boolean parallelFanout = false;
    private Duration stepTimeout = Duration.ofSeconds(30);

    // ---------- getters / setters ----------

    public String getNpiBaseUrl() { return npiBaseUrl; }
    public void setNpiBaseUrl(String npiBaseUrl) { this.npiBaseUrl = npiBaseUrl; }

    public String getNpiApiVersion() { return npiApiVersion; }
    public void setNpiApiVersion(String npiApiVersion) { this.npiApiVersion = npiApiVersion; }

    public String getNominatimBaseUrl() { return nominatimBaseUrl; }
    public void setNominatimBaseUrl(String nominatimBaseUrl) { this.nominatimBaseUrl = nominatimBaseUrl; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public String getGoogleSearchBaseUrl() { return googleSearchBaseUrl; }
    public void setGoogleSearchBaseUrl(String googleSearchBaseUrl) { this.googleSearchBaseUrl = googleSearchBaseUrl; }

    public String getGoogleApiKey() { return googleApiKey; }
    public void setGoogleApiKey(String googleApiKey) { this.googleApiKey = googleApiKey; }

    public String getGoogleCx() { return googleCx; }
    public void setGoogleCx(String googleCx) { this.googleCx = googleCx; }

    public String getDuckduckgoHtmlUrl() { return duckduckgoHtmlUrl; }
    public void setDuckduckgoHtmlUrl(String duckduckgoHtmlUrl) { this.duckduckgoHtmlUrl = duckduckgoHtmlUrl; }

    public String getGeminiBaseUrl() { return geminiBaseUrl; }
    public void setGeminiBaseUrl(String geminiBaseUrl) { this.geminiBaseUrl = geminiBaseUrl; }

    public String getGeminiApiKey() { return geminiApiKey; }
    public void setGeminiApiKey(String geminiApiKey) { this.geminiApiKey = geminiApiKey; }

    public String getGeminiModel() { return geminiModel; }
    public void setGeminiModel(String geminiModel) { this.geminiModel = geminiModel; }

    public int getVisionMaxRetries() { return visionMaxRetries; }
    public void setVisionMaxRetries(int visionMaxRetries) { this.visionMaxRetries = visionMaxRetries; }

    public String getPhoneDefaultRegion() { return phoneDefaultRegion; }
    public void setPhoneDefaultRegion(String phoneDefaultRegion) { this.phoneDefaultRegion = phoneDefaultRegion; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public boolean isParallelFanout() { return parallelFanout; }
    public void setParallelFanout(boolean parallelFanout) { this.parallelFanout = parallelFanout; }

    public Duration getStepTimeout() { return stepTimeout; }
    public void setStepTimeout(Duration stepTimeout) { this.stepTimeout = stepTimeout; }

    // ---------- helpers ----------

    /** Primary search needs both an API key and a search engine id. */
    public boolean hasGoogleSearch() {
        return StringUtils.hasText(googleApiKey) && StringUtils.hasText(googleCx);
    }

    public boolean hasGemini() {
        return StringUtils.hasText(geminiApiKey);
    }
}
