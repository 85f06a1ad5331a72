package ca.gc.cra.scribe.infrastructure.format;

/**
 * Converts arbitrary field values to text without letting a broken {@code toString()} escape.
 */
final class ValueText {
  private ValueText() {}

  static String of(Object value) {
    try {
      return String.valueOf(value);
    } catch (RuntimeException | StackOverflowError ex) {
      // toString() of a cyclic collection recurses without bound
      return "<unrenderable " + value.getClass().getName() + ">";
    }
  }
}
