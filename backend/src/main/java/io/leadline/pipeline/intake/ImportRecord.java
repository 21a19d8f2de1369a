package io.leadline.pipeline.intake;

/**
 * One untyped row from an importer adapter (CSV, XLSX, CRM export). Every field may be blank; the
 * funnel decides what a row is.
 */
public record ImportRecord(
    String firstName,
    String lastName,
    String email,
    String phone,
    String companyName,
    String title,
    String state,
    String source,
    String notes) {

  public boolean hasName() {
    return !isBlank(firstName) || !isBlank(lastName);
  }

  public boolean hasEmail() {
    return !isBlank(email);
  }

  public boolean hasPhone() {
    return !isBlank(phone);
  }

  public boolean hasCompany() {
    return !isBlank(companyName);
  }

  public String fullName() {
    return ((firstName != null ? firstName.strip() : "")
            + " "
            + (lastName != null ? lastName.strip() : ""))
        .strip();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
