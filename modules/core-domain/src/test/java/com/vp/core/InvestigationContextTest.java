package com.vp.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvestigationContextTest {

  @Test
  void startsPending() {
    InvestigationContext ctx = new InvestigationContext("1", null);

    assertThat(ctx.status()).isEqualTo(InvestigationStatus.PENDING);
    assertThat(ctx.claimed()).isEqualTo(ClaimedAttributes.none());
    assertThat(ctx.isShortCircuited()).isFalse();
    assertThat(ctx.isNameMismatch()).isFalse();
    assertThat(ctx.auditLog().isEmpty()).isTrue();
  }

  @Test
  void terminalStatusIsFinal() {
    InvestigationContext ctx = new InvestigationContext("1", ClaimedAttributes.none());
    ctx.markInvalidIdentifier();

    assertThat(ctx.isShortCircuited()).isTrue();
    assertThatThrownBy(ctx::markComplete).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(ctx::markInvalidIdentifier).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void sealedContextRejectsWrites() {
    InvestigationContext ctx = new InvestigationContext("1", ClaimedAttributes.none());
    ctx.setRegistryRecord(Fixtures.johnSmith());
    ctx.seal();

    assertThatThrownBy(() -> ctx.setGeoResult(Fixtures.exactGeo()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already reported");
    assertThat(ctx.registryRecord()).contains(Fixtures.johnSmith());
  }

  @Test
  void addressLinksAreCopied() {
    InvestigationContext ctx = new InvestigationContext("1", ClaimedAttributes.none());
    List<String> links = new ArrayList<>(List.of("https://a.org"));
    ctx.setAddressConfirmationLinks(links);
    links.add("https://b.org");

    assertThat(ctx.addressConfirmationLinks()).contains(List.of("https://a.org"));
  }

  @Test
  void stagedWritesOnlyLandOnCommit() {
    InvestigationContext ctx = new InvestigationContext("1", ClaimedAttributes.none());
    ctx.setRegistryRecord(Fixtures.johnSmith());
    ctx.auditLog().append("first");

    InvestigationContext staged = ctx.stage();
    staged.setGeoResult(Fixtures.exactGeo());
    staged.auditLog().append("geo");

    assertThat(staged.registryRecord()).contains(Fixtures.johnSmith());
    assertThat(ctx.geoResult()).isEmpty();

    ctx.commit(staged);

    assertThat(ctx.geoResult()).contains(Fixtures.exactGeo());
    assertThat(ctx.auditLog().entries()).containsExactly("first", "geo");
  }

  @Test
  void claimedBlanksAreAbsent() {
    ClaimedAttributes claimed = new ClaimedAttributes("  ", " 1 Main St ", "");

    assertThat(claimed.name()).isNull();
    assertThat(claimed.address()).isEqualTo("1 Main St");
    assertThat(claimed.phone()).isNull();
  }
}
