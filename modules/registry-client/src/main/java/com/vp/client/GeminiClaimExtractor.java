package com.vp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Vision extraction through the Gemini generateContent REST endpoint.
 * Images and PDFs travel as inline base64 parts. Plain text, and the paragraph text of
 * Word (.docx) documents, go as a text part.
 * Disabled (always empty) when no API key is configured.
 */
@Component
public class GeminiClaimExtractor implements ClaimExtractor {

    private static final Logger log = LoggerFactory.getLogger(GeminiClaimExtractor.class);

    static final String PROMPT =
            "Analyze this document (image, PDF, or text) regarding a healthcare provider. "
            + "Extract the following fields strictly as JSON: "
            + "\"provider_name\", \"npi_number\" (if visible, else null), "
            + "\"address_raw\" (full address string), \"phone\", \"website\". "
            + "Do not wrap the output in markdown. Return raw JSON only.";

    static final MediaType DOCX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final RestClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final VpClientProperties props;

    public GeminiClaimExtractor(RestClient vpRestClient, VpClientProperties props) {
        this.http = vpRestClient;
        this.props = props;
    }

    @Override
    public Optional<DocumentClaim> extract(byte[] content, String filename) {
        if (!props.hasGemini()) {
            log.warn("Gemini API key not configured, document extraction disabled");
            return Optional.empty();
        }
        if (content == null || content.length == 0) return Optional.empty();

        String body;
        try {
            body = requestBody(content, filename);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot prepare {}: {}", filename, e.getMessage());
            return Optional.empty();
        }
        int attempts = Math.max(1, props.getVisionMaxRetries());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                String text = generate(body);
                if (!StringUtils.hasText(text)) {
                    log.warn("Attempt {}/{}: empty answer from Gemini", attempt, attempts);
                    continue;
                }
                return Optional.of(parseClaim(text));
            } catch (RuntimeException e) {
                log.warn("Attempt {}/{}: document extraction failed - {}", attempt, attempts, e.getMessage());
            }
        }
        log.warn("Giving up on {} after {} attempts", filename, attempts);
        return Optional.empty();
    }

    /* ------------ helpers ------------ */

    /** POST {base}/models/{model}:generateContent?key=..: concatenated text of the first candidate. */
    private String generate(String body) {
        URI uri = UriComponentsBuilder
                .fromUriString(JsonNodes.trimSlash(props.getGeminiBaseUrl()))
                .path("/models/{model}:generateContent")
                .queryParam("key", props.getGeminiApiKey())
                .buildAndExpand(props.getGeminiModel())
                .encode()
                .toUri();

        String resp = http.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (rq, rs) -> {
                    throw VpApiException.from("Gemini generateContent failed", rs);
                })
                .body(String.class);

        if (!StringUtils.hasText(resp)) return null;
        try {
            JsonNode parts = mapper.readTree(resp).path("candidates").path(0).path("content").path("parts");
            StringBuilder sb = new StringBuilder();
            for (JsonNode p : parts) {
                sb.append(JsonNodes.text(p, "text"));
            }
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse Gemini response: " + VpApiException.sanitize(resp), e);
        }
    }

    String requestBody(byte[] content, String filename) {
        String name = filename == null ? "" : filename;
        MediaType type = MediaTypeFactory.getMediaType(name).orElse(MediaType.APPLICATION_OCTET_STREAM);

        ObjectNode root = mapper.createObjectNode();
        ArrayNode parts = root.putArray("contents").addObject().putArray("parts");
        parts.addObject().put("text", PROMPT);
        if (MediaType.TEXT_PLAIN.includes(type)) {
            parts.addObject().put("text", new String(content, StandardCharsets.UTF_8));
        } else if (DOCX.equalsTypeAndSubtype(type) || name.toLowerCase(Locale.ROOT).endsWith(".docx")) {
            parts.addObject().put("text", docxText(content));
        } else {
            ObjectNode inline = parts.addObject().putObject("inline_data");
            inline.put("mime_type", type.getType() + "/" + type.getSubtype());
            inline.put("data", Base64.getEncoder().encodeToString(content));
        }
        return root.toString();
    }

    /** Paragraph texts of a Word document, one per line. */
    static String docxText(byte[] content) {
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(content))) {
            return doc.getParagraphs().stream()
                    .map(XWPFParagraph::getText)
                    .collect(Collectors.joining("\n"));
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Could not open Word document: " + e.getMessage(), e);
        }
    }

    /** Strips ```json fences the model adds despite the prompt, then maps the fields. */
    DocumentClaim parseClaim(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) cleaned = cleaned.substring(7);
        if (cleaned.startsWith("```")) cleaned = cleaned.substring(3);
        if (cleaned.endsWith("```")) cleaned = cleaned.substring(0, cleaned.length() - 3);

        JsonNode node;
        try {
            node = mapper.readTree(cleaned.trim());
        } catch (Exception e) {
            throw new IllegalStateException("Gemini answer is not JSON: " + VpApiException.sanitize(raw), e);
        }
        if (!node.isObject()) {
            throw new IllegalStateException("Gemini answer is not a JSON object: " + VpApiException.sanitize(raw));
        }
        return new DocumentClaim(
                JsonNodes.first(node, "provider_name", "name"),
                JsonNodes.first(node, "npi_number", "npi"),
                JsonNodes.first(node, "address_raw", "address"),
                JsonNodes.first(node, "phone"),
                JsonNodes.first(node, "website")
        );
    }
}
