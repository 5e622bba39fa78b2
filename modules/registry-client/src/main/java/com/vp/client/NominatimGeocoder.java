package com.vp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * OpenStreetMap Nominatim geocoder.
 * Tries the full address first; if that misses, retries with the last two
 * comma-separated parts (usually "City, ST 12345") and reports a PARTIAL match.
 */
@Component
public class NominatimGeocoder implements Geocoder {

    private static final Logger log = LoggerFactory.getLogger(NominatimGeocoder.class);

    private final RestClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final VpClientProperties props;

    public NominatimGeocoder(RestClient vpRestClient, VpClientProperties props) {
        this.http = vpRestClient;
        this.props = props;
    }

    @Override
    public Optional<GeoResult> geocode(String address) {
        if (!StringUtils.hasText(address)) return Optional.empty();

        JsonNode hit = search(address);
        if (hit != null) {
            return Optional.of(toResult(hit, GeoResult.MatchType.EXACT));
        }

        String fallback = cityStateQuery(address);
        if (fallback != null) {
            log.info("Exact geocode missed, retrying with '{}'", fallback);
            hit = search(fallback);
            if (hit != null) {
                return Optional.of(toResult(hit, GeoResult.MatchType.PARTIAL));
            }
        }
        return Optional.empty();
    }

    /** "Street, City, ST 12345" -> "City, ST 12345"; null when there is nothing to widen. */
    static String cityStateQuery(String address) {
        String[] parts = address.split(",");
        if (parts.length < 2) return null;
        return parts[parts.length - 2].trim() + ", " + parts[parts.length - 1].trim();
    }

    /* ------------ helpers ------------ */

    /** GET {base}/search?q=..&format=jsonv2&addressdetails=1&limit=1; first hit or null. */
    private JsonNode search(String query) {
        URI uri = UriComponentsBuilder
                .fromUriString(JsonNodes.trimSlash(props.getNominatimBaseUrl()))
                .path("/search")
                .queryParam("q", query)
                .queryParam("format", "jsonv2")
                .queryParam("addressdetails", 1)
                .queryParam("limit", 1)
                .build()
                .encode()
                .toUri();

        String resp = http.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (rq, rs) -> {
                    throw VpApiException.from("Geocoding failed", rs);
                })
                .body(String.class);

        if (!StringUtils.hasText(resp)) return null;
        try {
            JsonNode root = mapper.readTree(resp);
            return root.isArray() && !root.isEmpty() ? root.get(0) : null;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse geocoding response: " + VpApiException.sanitize(resp), e);
        }
    }

    private static GeoResult toResult(JsonNode hit, GeoResult.MatchType matchType) {
        JsonNode addr = hit.path("address");

        String street = null;
        if (matchType == GeoResult.MatchType.EXACT) {
            String road = JsonNodes.text(addr, "road");
            if (!road.isEmpty()) {
                street = (JsonNodes.text(addr, "house_number") + " " + road).trim();
            }
        }

        GeoResult.Components components = new GeoResult.Components(
                street,
                JsonNodes.first(addr, "city", "town", "village"),
                JsonNodes.first(addr, "state"),
                JsonNodes.first(addr, "postcode")
        );

        return new GeoResult(
                hit.path("lat").asDouble(),
                hit.path("lon").asDouble(),
                JsonNodes.first(hit, "display_name"),
                matchType,
                components
        );
    }
}
