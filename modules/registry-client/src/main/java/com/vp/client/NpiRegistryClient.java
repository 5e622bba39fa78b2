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
 * Client for the CMS NPI Registry (https://npiregistry.cms.hhs.gov/api/):
 * - lookup by NPI number;
 * - NPI search by first/last name and state when the number is unknown.
 */
@Component
public class NpiRegistryClient implements IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(NpiRegistryClient.class);

    private static final String UNKNOWN_SPECIALTY = "Unknown Specialty";

    private final RestClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final VpClientProperties props;

    public NpiRegistryClient(RestClient vpRestClient, VpClientProperties props) {
        this.http = vpRestClient;
        this.props = props;
    }

    /** GET {base}?number={npi}&version=2.1 */
    @Override
    public Optional<IdentityRecord> resolve(String identifier) {
        if (!StringUtils.hasText(identifier)) return Optional.empty();

        URI uri = UriComponentsBuilder
                .fromUriString(props.getNpiBaseUrl())
                .queryParam("number", identifier.trim())
                .queryParam("version", props.getNpiApiVersion())
                .build()
                .encode()
                .toUri();

        JsonNode first = firstResult(get(uri, "NPI lookup failed"));
        if (first == null) return Optional.empty();
        return Optional.of(toRecord(identifier.trim(), first));
    }

    /** GET {base}?first_name=..&last_name=..&state=..; first hit wins. */
    public Optional<String> searchByName(String firstName, String lastName, String state) {
        URI uri = UriComponentsBuilder
                .fromUriString(props.getNpiBaseUrl())
                .queryParam("first_name", firstName)
                .queryParam("last_name", lastName)
                .queryParam("state", state)
                .queryParam("version", props.getNpiApiVersion())
                .build()
                .encode()
                .toUri();

        JsonNode results = get(uri, "NPI search failed").path("results");
        if (!results.isArray() || results.isEmpty()) {
            log.info("No NPI found for {} {} ({})", firstName, lastName, state);
            return Optional.empty();
        }
        if (results.size() > 1) {
            log.warn("Found {} NPI matches for {} {} ({}), using the first", results.size(), firstName, lastName, state);
        }
        String number = JsonNodes.first(results.get(0), "number");
        return StringUtils.hasText(number) ? Optional.of(number) : Optional.empty();
    }

    /* ------------ helpers ------------ */

    private JsonNode get(URI uri, String errorPrefix) {
        String resp = http.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (rq, rs) -> {
                    throw VpApiException.from(errorPrefix, rs);
                })
                .body(String.class);

        if (!StringUtils.hasText(resp)) return mapper.createObjectNode();
        try {
            return mapper.readTree(resp);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse NPI response: " + VpApiException.sanitize(resp), e);
        }
    }

    /** The registry answers 200 with an "Errors" array for malformed numbers; both mean not found. */
    private static JsonNode firstResult(JsonNode root) {
        JsonNode results = root.path("results");
        if (!results.isArray() || results.isEmpty()) return null;
        return results.get(0);
    }

    IdentityRecord toRecord(String identifier, JsonNode result) {
        JsonNode basic = result.path("basic");

        JsonNode location = null;
        for (JsonNode addr : result.path("addresses")) {
            if ("LOCATION".equals(JsonNodes.first(addr, "address_purpose"))) {
                location = addr;
                break;
            }
        }

        String fullAddress = IdentityRecord.ADDRESS_NOT_FOUND;
        String city = "";
        String state = "";
        String phone = "";
        if (location != null) {
            String line1 = JsonNodes.text(location, "address_1");
            city = JsonNodes.text(location, "city");
            state = JsonNodes.text(location, "state");
            String postal = JsonNodes.text(location, "postal_code");
            if (postal.length() > 5) postal = postal.substring(0, 5);
            phone = JsonNodes.text(location, "telephone_number");
            fullAddress = (line1 + ", " + city + ", " + state + " " + postal).trim();
        }

        // NPI-2 (organization) entries win over any stray person fields
        String org = JsonNodes.first(basic, "organization_name");
        boolean isOrg = StringUtils.hasText(org);

        return new IdentityRecord(
                identifier,
                isOrg ? null : JsonNodes.first(basic, "first_name"),
                isOrg ? null : JsonNodes.first(basic, "last_name"),
                org,
                JsonNodes.first(basic, "credential"),
                fullAddress,
                city,
                state,
                phone,
                specialty(result.path("taxonomies"))
        );
    }

    /** Primary taxonomy description, else the first one, else a placeholder. */
    private static String specialty(JsonNode taxonomies) {
        if (!taxonomies.isArray() || taxonomies.isEmpty()) return UNKNOWN_SPECIALTY;
        JsonNode chosen = taxonomies.get(0);
        for (JsonNode t : taxonomies) {
            if (t.path("primary").asBoolean(false)) {
                chosen = t;
                break;
            }
        }
        String desc = JsonNodes.first(chosen, "desc");
        return StringUtils.hasText(desc) ? desc : UNKNOWN_SPECIALTY;
    }
}
