package com.vp.client;

/** What an unverified document (letterhead, card, form scan) says about a provider. */
public record DocumentClaim(
    String name,
    String identifier,
    String address,
    String phone,
    String website
) {}
