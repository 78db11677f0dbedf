package io.intellixity.sqlchain.jdbc.dialect;

import java.util.ArrayList;
import java.util.List;

/** Splits dotted object names such as {@code sales."Order Lines"} or {@code [dbo].[Customer]}. */
public final class QualifiedNames {
  private QualifiedNames() {}

  /**
   * Parts of {@code text}, unquoted. A part may be wrapped in {@code open}/{@code close}; inside it a doubled
   * {@code close} is a literal and dots do not split.
   */
  public static List<String> split(String text, char open, char close) {
    if (text == null || text.isBlank()) throw new IllegalArgumentException("object name is required");
    List<String> parts = new ArrayList<>();
    StringBuilder cur = new StringBuilder();
    boolean quoted = false;
    boolean wasQuoted = false;
    String s = text.trim();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (quoted) {
        if (c == close) {
          if (i + 1 < s.length() && s.charAt(i + 1) == close) {
            cur.append(close);
            i++;
          } else {
            quoted = false;
          }
        } else {
          cur.append(c);
        }
      } else if (wasQuoted && c != '.') {
        if (!Character.isWhitespace(c)) {
          throw new IllegalArgumentException("Unexpected '" + c + "' after quoted part in " + text);
        }
      } else if (c == open && cur.toString().isBlank()) {
        quoted = true;
        wasQuoted = true;
        cur.setLength(0);
      } else if (c == '.') {
        parts.add(part(cur, wasQuoted, text));
        cur.setLength(0);
        wasQuoted = false;
      } else {
        cur.append(c);
      }
    }
    if (quoted) throw new IllegalArgumentException("Unterminated quoted identifier in " + text);
    parts.add(part(cur, wasQuoted, text));
    return parts;
  }

  private static String part(StringBuilder cur, boolean wasQuoted, String text) {
    String p = wasQuoted ? cur.toString() : cur.toString().trim();
    if (p.isEmpty()) throw new IllegalArgumentException("Empty name part in " + text);
    return p;
  }
}
