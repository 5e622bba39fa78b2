package com.vp.portal.controllers;

import com.vp.client.ClaimExtractor;
import com.vp.client.DocumentClaim;
import com.vp.client.NpiRegistryClient;
import com.vp.core.ClaimedAttributes;
import com.vp.core.InvestigationReport;
import com.vp.core.InvestigationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping(path = "/investigations", produces = MediaType.APPLICATION_JSON_VALUE)
public class InvestigationController {

  private static final Logger log = LoggerFactory.getLogger(InvestigationController.class);

  private final InvestigationService investigations;
  private final ClaimExtractor claimExtractor;
  private final NpiRegistryClient registryClient;

  public InvestigationController(InvestigationService investigations,
                                 ClaimExtractor claimExtractor,
                                 NpiRegistryClient registryClient) {
    this.investigations = investigations;
    this.claimExtractor = claimExtractor;
    this.registryClient = registryClient;
  }

  /** POST /investigations {"identifier":"1952390643","claimedName":"..."} */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public InvestigationReport investigate(@Valid @RequestBody InvestigationRequest req) {
    return investigations.investigate(req.identifier(), req.claimedName(), req.claimedAddress(), req.claimedPhone());
  }

  /** GET /investigations/1952390643?claimedName=... */
  @GetMapping("/{identifier}")
  public InvestigationReport investigateById(@PathVariable("identifier") String identifier,
                                             @RequestParam(name = "claimedName", required = false) String claimedName,
                                             @RequestParam(name = "claimedAddress", required = false) String claimedAddress,
                                             @RequestParam(name = "claimedPhone", required = false) String claimedPhone) {
    return investigations.investigate(identifier, claimedName, claimedAddress, claimedPhone);
  }

  /**
   * Finds the identifier by name and state, then investigates it.
   * Example: GET /investigations/lookup?firstName=Ashish&lastName=Jha&state=RI
   */
  @GetMapping("/lookup")
  public ResponseEntity<?> lookup(@RequestParam("firstName") String firstName,
                                  @RequestParam("lastName") String lastName,
                                  @RequestParam("state") String state,
                                  @RequestParam(name = "claimedName", required = false) String claimedName,
                                  @RequestParam(name = "claimedAddress", required = false) String claimedAddress,
                                  @RequestParam(name = "claimedPhone", required = false) String claimedPhone) {
    Optional<String> identifier;
    try {
      identifier = registryClient.searchByName(firstName, lastName, state);
    } catch (RuntimeException e) {
      // an unreachable registry reads the same as an empty search
      log.warn("Registry search failed for {} {} ({}): {}", firstName, lastName, state, e.getMessage());
      identifier = Optional.empty();
    }
    if (identifier.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(Map.of("error", "No registry entry for " + firstName + " " + lastName + " (" + state + ")"));
    }
    return ResponseEntity.ok(
        investigations.investigate(identifier.get(), claimedName, claimedAddress, claimedPhone));
  }

  /**
   * Upload a document (card, letterhead, form scan); its claims are checked against the registry.
   * An explicit identifier wins over the one read from the document.
   */
  @PostMapping(path = "/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<?> investigateDocument(@RequestParam("file") MultipartFile file,
                                               @RequestParam(name = "identifier", required = false) String identifier)
      throws IOException {
    DocumentClaim claim = claimExtractor.extract(file.getBytes(), file.getOriginalFilename()).orElse(null);
    if (claim == null) {
      log.info("No claim extracted from {}", file.getOriginalFilename());
    }

    String target = StringUtils.hasText(identifier) ? identifier : (claim == null ? null : claim.identifier());
    if (!StringUtils.hasText(target)) {
      return ResponseEntity.unprocessableEntity()
          .body(Map.of("error", "No identifier given and none found in the document"));
    }

    ClaimedAttributes claimed = claim == null
        ? ClaimedAttributes.none()
        : new ClaimedAttributes(claim.name(), claim.address(), claim.phone());
    return ResponseEntity.ok(investigations.investigate(target, claimed));
  }
}
