package com.vp.client;

import java.util.Optional;

public interface ClaimExtractor {

  /**
   * Reads provider claims out of a document.
   * @param content  raw file bytes (image, PDF or plain text)
   * @param filename original name, used to pick the media type
   * @return the extracted claim, or empty when nothing usable came back
   */
  Optional<DocumentClaim> extract(byte[] content, String filename);
}
