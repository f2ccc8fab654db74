package com.consullo.editor.core;

import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Small layout helpers for status lines and gutters.
 *
 * @since 1.0
 */
public final class TextLayout {

  private TextLayout() {
  }

  /**
   * Places {@code lhs} at the left edge and {@code rhs} at the right edge of a line {@code width} columns wide.
   *
   * @param lhs left-hand text
   * @param rhs right-hand text
   * @param width total display width
   * @param tabWidth columns taken by a tab
   * @return padded line, or empty when both sides do not fit
   */
  public static Optional<String> alignSides(String lhs, String rhs, int width, int tabWidth) {
    int used = DisplayWidth.of(lhs, tabWidth) + DisplayWidth.of(rhs, tabWidth);
    if (used > width) {
      return Optional.empty();
    }
    return Optional.of(lhs + StringUtils.repeat(' ', width - used) + rhs);
  }

  /**
   * Right-aligns a 1-based line number to the digit count of {@code total}.
   *
   * @param index 0-based row index
   * @param total number of rows
   * @return padded line number
   */
  public static String lineNumber(int index, int total) {
    int digits = Integer.toString(Math.max(total, 1)).length();
    return StringUtils.leftPad(Integer.toString(index + 1), digits);
  }
}
