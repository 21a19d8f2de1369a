package io.leadline.pipeline.contact;

import java.util.Locale;

/**
 * Normalization of contact values for matching. Emails compare lowercase; phones compare as digits
 * only, with the US country code removed from 11-digit numbers.
 */
public final class ContactValues {

  private ContactValues() {}

  public static String normalize(ContactMethodType type, String value) {
    return switch (type) {
      case EMAIL -> normalizeEmail(value);
      case PHONE -> normalizePhone(value);
    };
  }

  /** "John@ACME.com " becomes "john@acme.com". */
  public static String normalizeEmail(String email) {
    if (email == null) {
      return "";
    }
    return email.strip().toLowerCase(Locale.ROOT);
  }

  /** "+1 (713) 555-1234" becomes "7135551234". */
  public static String normalizePhone(String phone) {
    if (phone == null) {
      return "";
    }
    var digits = new StringBuilder(phone.length());
    for (int i = 0; i < phone.length(); i++) {
      char c = phone.charAt(i);
      if (c >= '0' && c <= '9') {
        digits.append(c);
      }
    }
    if (digits.length() == 11 && digits.charAt(0) == '1') {
      digits.deleteCharAt(0);
    }
    return digits.toString();
  }
}
