package com.fieldprofiler.profiler.service.collection;

/** Character classification shared by the collector and the text analyzer. */
public final class TextCharacters {

  private TextCharacters() {}

  /**
   * True if {@code text} holds a character that is not printable, ignoring tab, line feed and
   * carriage return. Separators other than the plain space count as non-printable.
   */
  public static boolean hasNonPrintable(String text) {
    if (text == null) {
      return false;
    }
    return text.codePoints()
        .anyMatch(cp -> cp != '\t' && cp != '\n' && cp != '\r' && !isPrintable(cp));
  }

  static boolean isPrintable(int codePoint) {
    if (codePoint == ' ') {
      return true;
    }
    switch (Character.getType(codePoint)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.SURROGATE:
      case Character.PRIVATE_USE:
      case Character.UNASSIGNED:
      case Character.LINE_SEPARATOR:
      case Character.PARAGRAPH_SEPARATOR:
      case Character.SPACE_SEPARATOR:
        return false;
      default:
        return true;
    }
  }
}
