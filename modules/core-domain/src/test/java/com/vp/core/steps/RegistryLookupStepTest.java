package com.vp.core.steps;

import com.vp.client.IdentityRegistry;
import com.vp.client.VpApiException;
import com.vp.core.ClaimedAttributes;
import com.vp.core.Fixtures;
import com.vp.core.InvestigationContext;
import com.vp.core.InvestigationStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistryLookupStepTest {

  @Mock
  private IdentityRegistry registry;

  @Test
  void foundRecordIsStored() {
    when(registry.resolve(Fixtures.JOHN_SMITH_NPI)).thenReturn(Optional.of(Fixtures.johnSmith()));
    InvestigationContext ctx = new InvestigationContext(Fixtures.JOHN_SMITH_NPI, ClaimedAttributes.none());

    new RegistryLookupStep(registry).execute(ctx, ctx.auditLog());

    assertThat(ctx.registryRecord()).contains(Fixtures.johnSmith());
    assertThat(ctx.status()).isEqualTo(InvestigationStatus.PENDING);
    assertThat(ctx.auditLog().entries())
        .containsExactly("Querying NPI registry...", "Registry record found for John Smith");
  }

  @Test
  void unknownIdentifierShortCircuits() {
    when(registry.resolve("0000000000")).thenReturn(Optional.empty());
    InvestigationContext ctx = new InvestigationContext("0000000000", ClaimedAttributes.none());

    new RegistryLookupStep(registry).execute(ctx, ctx.auditLog());

    assertThat(ctx.isShortCircuited()).isTrue();
    assertThat(ctx.registryRecord()).isEmpty();
    assertThat(ctx.auditLog().entries()).last().isEqualTo("Identifier not found or invalid.");
  }

  @Test
  void transportFailureIsTreatedAsNotFound() {
    when(registry.resolve(Fixtures.JOHN_SMITH_NPI))
        .thenThrow(new VpApiException("NPI lookup failed: HTTP 503", HttpStatus.SERVICE_UNAVAILABLE, null));
    InvestigationContext ctx = new InvestigationContext(Fixtures.JOHN_SMITH_NPI, ClaimedAttributes.none());

    new RegistryLookupStep(registry).execute(ctx, ctx.auditLog());

    assertThat(ctx.isShortCircuited()).isTrue();
    assertThat(ctx.auditLog().entries()).containsExactly(
        "Querying NPI registry...",
        "Registry lookup error: NPI lookup failed: HTTP 503",
        "Identifier not found or invalid.");
  }
}
