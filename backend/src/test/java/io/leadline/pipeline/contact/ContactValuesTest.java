package io.leadline.pipeline.contact;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContactValuesTest {

  @Test
  void emailsCompareLowercaseAndTrimmed() {
    assertThat(ContactValues.normalizeEmail(" John@ACME.com ")).isEqualTo("john@acme.com");
  }

  @Test
  void phonesCompareAsDigits() {
    assertThat(ContactValues.normalizePhone("(713) 555-1234")).isEqualTo("7135551234");
    assertThat(ContactValues.normalizePhone("713.555.1234")).isEqualTo("7135551234");
  }

  @Test
  void usCountryCodeIsDropped() {
    assertThat(ContactValues.normalizePhone("+1 (713) 555-1234")).isEqualTo("7135551234");
    assertThat(ContactValues.normalize(ContactMethodType.PHONE, "1-713-555-1234"))
        .isEqualTo("7135551234");
  }

  @Test
  void otherCountryCodesAreKept() {
    assertThat(ContactValues.normalizePhone("+44 20 7946 0958")).isEqualTo("442079460958");
  }

  @Test
  void nullValuesNormalizeToEmpty() {
    assertThat(ContactValues.normalizeEmail(null)).isEmpty();
    assertThat(ContactValues.normalizePhone(null)).isEmpty();
  }
}
