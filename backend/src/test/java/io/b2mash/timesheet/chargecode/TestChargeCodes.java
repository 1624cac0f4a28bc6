package io.b2mash.timesheet.chargecode;

public final class TestChargeCodes {

  private TestChargeCodes() {}

  public static ChargeCode withId(
      Long id, Long userId, String project, String task, String description, boolean active) {
    var chargeCode = new ChargeCode(userId, project, task, description, active);
    try {
      var idField = ChargeCode.class.getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(chargeCode, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set charge code ID", e);
    }
    return chargeCode;
  }
}
