package com.vp.core.steps;

import com.vp.client.IdentityRecord;
import com.vp.client.PhoneResult;
import com.vp.client.PhoneValidator;
import com.vp.core.ClaimedAttributes;
import com.vp.core.Fixtures;
import com.vp.core.InvestigationContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContactStepTest {

  @Mock
  private PhoneValidator validator;

  private static InvestigationContext context(IdentityRecord record, String claimedPhone) {
    InvestigationContext ctx = new InvestigationContext(record.identifier(), new ClaimedAttributes(null, null, claimedPhone));
    ctx.setRegistryRecord(record);
    return ctx;
  }

  @Test
  void registryPhoneOnly() {
    when(validator.validate("617-726-2000")).thenReturn(Optional.of(Fixtures.validPhone("617-726-2000", "+16177262000")));
    InvestigationContext ctx = context(Fixtures.johnSmith(), null);

    new ContactStep(validator).execute(ctx, ctx.auditLog());

    assertThat(ctx.phoneResult()).isPresent();
    assertThat(ctx.claimedPhoneResult()).isEmpty();
    assertThat(ctx.auditLog().entries()).containsExactly(
        "Validating registry phone '617-726-2000'...",
        "Phone valid (registry). Region: US");
  }

  @Test
  void claimedPhoneMatchingTheRegistry() {
    when(validator.validate("617-726-2000")).thenReturn(Optional.of(Fixtures.validPhone("617-726-2000", "+16177262000")));
    when(validator.validate("(617) 726 2000")).thenReturn(Optional.of(Fixtures.validPhone("(617) 726 2000", "+16177262000")));
    InvestigationContext ctx = context(Fixtures.johnSmith(), "(617) 726 2000");

    new ContactStep(validator).execute(ctx, ctx.auditLog());

    assertThat(ctx.claimedPhoneResult()).isPresent();
    assertThat(ctx.auditLog().entries()).last().isEqualTo("Claimed phone matches registry phone.");
  }

  @Test
  void claimedPhoneDiffering() {
    when(validator.validate("617-726-2000")).thenReturn(Optional.of(Fixtures.validPhone("617-726-2000", "+16177262000")));
    when(validator.validate("401-444-5000")).thenReturn(Optional.of(Fixtures.validPhone("401-444-5000", "+14014445000")));
    InvestigationContext ctx = context(Fixtures.johnSmith(), "401-444-5000");

    new ContactStep(validator).execute(ctx, ctx.auditLog());

    assertThat(ctx.auditLog().entries()).last()
        .isEqualTo("Claimed phone 401-444-5000 differs from registry phone 617-726-2000.");
  }

  @Test
  void invalidRegistryPhoneIsRecorded() {
    when(validator.validate("617-726-2000"))
        .thenReturn(Optional.of(PhoneResult.invalid("617-726-2000", "Invalid structure or non-existent number")));
    InvestigationContext ctx = context(Fixtures.johnSmith(), null);

    new ContactStep(validator).execute(ctx, ctx.auditLog());

    assertThat(ctx.phoneResult()).get().extracting(PhoneResult::valid).isEqualTo(false);
    assertThat(ctx.auditLog().entries()).last()
        .isEqualTo("Phone validation failed (registry): Invalid structure or non-existent number");
  }

  @Test
  void oneFailureDoesNotStopTheOther() {
    when(validator.validate("617-726-2000")).thenThrow(new IllegalStateException("metadata missing"));
    when(validator.validate("401-444-5000")).thenReturn(Optional.of(Fixtures.validPhone("401-444-5000", "+14014445000")));
    InvestigationContext ctx = context(Fixtures.johnSmith(), "401-444-5000");

    new ContactStep(validator).execute(ctx, ctx.auditLog());

    assertThat(ctx.phoneResult()).isEmpty();
    assertThat(ctx.claimedPhoneResult()).isPresent();
    assertThat(ctx.auditLog().entries()).contains("Phone tool error (registry): metadata missing", "Phone valid (claimed). Region: US");
  }

  @Test
  void noRegistryPhone() {
    InvestigationContext ctx = context(IdentityRecord.person("1", "Ana", "Lima", null, null, null, null, null), null);

    new ContactStep(validator).execute(ctx, ctx.auditLog());

    assertThat(ctx.auditLog().entries()).containsExactly("No registry phone number on file.");
  }
}
