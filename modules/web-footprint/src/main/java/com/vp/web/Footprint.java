package com.vp.web;

import java.util.List;

/**
 * Categorized web presence. Every url sits in at most one bucket; lists keep
 * the order the hits were classified in.
 */
public record Footprint(
    String officialSite,
    List<String> socialMedia,
    List<String> directories,
    List<String> otherMentions
) {

  public Footprint {
    socialMedia = List.copyOf(socialMedia);
    directories = List.copyOf(directories);
    otherMentions = List.copyOf(otherMentions);
  }

  public static Footprint empty() {
    return new Footprint(null, List.of(), List.of(), List.of());
  }

  public boolean isEmpty() {
    return officialSite == null && socialMedia.isEmpty() && directories.isEmpty() && otherMentions.isEmpty();
  }
}
