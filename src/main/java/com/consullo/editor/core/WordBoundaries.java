package com.consullo.editor.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Word-boundary scanner used for word-jump navigation.
 *
 * <p>A single forward pass over a row's characters. Spaces and tabs separate words; every maximal run of other
 * characters contributes one boundary at its first character. Tabs met before any text are recorded as boundaries
 * so that word jumps can land on each indentation level. The row end is always the final boundary.
 *
 * @since 1.0
 */
public final class WordBoundaries {

  private WordBoundaries() {
  }

  /**
   * Scans a row's code points and returns the character indices of word starts, followed by the row length.
   *
   * @param text code points of one row
   * @return ordered boundary indices (never empty)
   */
  public static List<Integer> scan(List<Integer> text) {
    List<Integer> result = new ArrayList<>();
    int n = text.size();
    int chr = 0;
    boolean pad = true;
    while (chr < n) {
      int c = text.get(chr);
      if (c == ' ') {
        chr++;
      } else if (c == '\t') {
        if (pad) {
          result.add(chr);
        }
        chr++;
      } else {
        pad = false;
        result.add(chr);
        while (chr < n && !isWhitespace(text.get(chr))) {
          chr++;
        }
      }
    }
    result.add(n);
    return result;
  }

  /**
   * Returns the nearest boundary strictly after {@code from}, or the row end when there is none.
   *
   * @param boundaries boundaries produced by {@link #scan(List)}
   * @param from character index
   * @return boundary index
   */
  public static int nextForth(List<Integer> boundaries, int from) {
    for (int b : boundaries) {
      if (b > from) {
        return b;
      }
    }
    return boundaries.get(boundaries.size() - 1);
  }

  /**
   * Returns the nearest boundary strictly before {@code from}, or 0 when there is none.
   *
   * @param boundaries boundaries produced by {@link #scan(List)}
   * @param from character index
   * @return boundary index
   */
  public static int nextBack(List<Integer> boundaries, int from) {
    int found = 0;
    for (int b : boundaries) {
      if (b >= from) {
        break;
      }
      found = b;
    }
    return found;
  }

  private static boolean isWhitespace(int c) {
    return c == ' ' || c == '\t';
  }
}
