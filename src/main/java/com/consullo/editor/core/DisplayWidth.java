package com.consullo.editor.core;

import com.jediterm.terminal.util.CharUtils;

/**
 * Terminal cell widths of characters.
 *
 * <p>Wide and full-width East-Asian characters occupy two cells, combining marks and control characters occupy
 * none, and a tab occupies the configured tab width. Wide-character detection is delegated to JediTerm, so widths
 * agree with what a JediTerm-backed terminal renders. Ambiguous-width characters are treated as narrow.
 *
 * @since 1.0
 */
public final class DisplayWidth {

  public static final int TAB = '\t';

  private DisplayWidth() {
  }

  /**
   * Returns the number of display columns taken by a code point.
   *
   * @param codePoint Unicode code point
   * @param tabWidth columns taken by a tab
   * @return 0, 1, 2 or {@code tabWidth}
   */
  public static int of(int codePoint, int tabWidth) {
    if (codePoint == TAB) {
      return tabWidth;
    }
    // Printable ASCII
    if (codePoint > 31 && codePoint < 127) {
      return 1;
    }
    switch (Character.getType(codePoint)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.NON_SPACING_MARK:
      case Character.ENCLOSING_MARK:
        return 0;
      default:
        break;
    }
    return CharUtils.isDoubleWidthCharacter(codePoint, false) ? 2 : 1;
  }

  /**
   * Returns the total number of display columns taken by a string.
   *
   * @param s text
   * @param tabWidth columns taken by a tab
   * @return display width
   */
  public static int of(CharSequence s, int tabWidth) {
    int total = 0;
    int i = 0;
    int n = s.length();
    while (i < n) {
      int cp = Character.codePointAt(s, i);
      total += of(cp, tabWidth);
      i += Character.charCount(cp);
    }
    return total;
  }
}
