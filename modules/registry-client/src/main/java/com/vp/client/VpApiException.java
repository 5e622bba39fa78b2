package com.vp.client;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Transport-level failure of an external collaborator (non-2xx answer). */
public class VpApiException extends RuntimeException {

    private final HttpStatusCode status;
    private final String responseBody;

    public VpApiException(String message, HttpStatusCode status, String responseBody) {
        super(message);
        this.status = status;
        this.responseBody = responseBody;
    }

    public HttpStatusCode getStatus() { return status; }
    public String getResponseBody() { return responseBody; }

    /** Reads status and body of a failed response into an exception; never throws itself. */
    public static VpApiException from(String prefix, ClientHttpResponse res) {
        HttpStatusCode status;
        String body = null;
        try {
            status = res.getStatusCode();
            try (InputStream is = res.getBody()) {
                if (is != null) body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (Exception e) {
            status = HttpStatusCode.valueOf(500);
        }
        String msg = prefix + ": HTTP " + status + (body != null && !body.isBlank() ? " - " + sanitize(body) : "");
        return new VpApiException(msg, status, body);
    }

    /** Strips HTML and extra whitespace and caps the length. */
    static String sanitize(String s) {
        if (s == null || s.isBlank()) return null;
        String noTags = s.replaceAll("<[^>]+>", " ").replaceAll("\\s+", " ").trim();
        return noTags.length() > 400 ? noTags.substring(0, 400) + "..." : noTags;
    }
}
