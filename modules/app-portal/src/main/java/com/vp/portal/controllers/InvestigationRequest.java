package com.vp.portal.controllers;

import jakarta.validation.constraints.NotBlank;

/** Body of POST /investigations. */
public record InvestigationRequest(
    @NotBlank String identifier,
    String claimedName,
    String claimedAddress,
    String claimedPhone
) {}
