package com.consullo.editor.core;

import com.consullo.editor.core.events.Status;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * One line of a document.
 *
 * <p>A row holds its characters as Unicode code points together with a prefix-sum table of display widths:
 * {@code indices.get(i)} is the display column at which character {@code i} starts and the last entry is the row's
 * total width. The table always has {@code len() + 1} entries, starts at zero and never decreases.
 *
 * <p>A row does not know the document it belongs to. Operations whose result depends on how wide a tab is take the
 * tab width as an argument; the table itself is built with the tab width passed at construction or to
 * {@link #relink(int)}.
 *
 * @since 1.0
 */
public final class Row {

  /**
   * Tab width used by {@link #Row(String)}.
   */
  public static final int DEFAULT_TAB_WIDTH = 4;

  private final List<Integer> text;
  private final List<Integer> indices;
  private boolean modified;

  /**
   * The two rows produced by {@link #split(int)}.
   *
   * @param left characters before the split point
   * @param right characters from the split point on
   */
  public record Halves(Row left, Row right) {
  }

  /**
   * Creates a row using {@link #DEFAULT_TAB_WIDTH}.
   *
   * @param raw row text without line ending
   */
  public Row(String raw) {
    this(raw, DEFAULT_TAB_WIDTH);
  }

  /**
   * Creates a row.
   *
   * @param raw row text without line ending
   * @param tabWidth columns taken by a tab
   */
  public Row(String raw, int tabWidth) {
    Validate.notNull(raw, "raw must not be null");
    Validate.isTrue(tabWidth >= 1, "tabWidth must be >= 1");
    this.text = codePoints(raw);
    this.indices = new ArrayList<>(text.size() + 1);
    this.modified = false;
    relink(tabWidth);
  }

  private Row(List<Integer> text, List<Integer> indices, boolean modified) {
    this.text = text;
    this.indices = indices;
    this.modified = modified;
  }

  /**
   * Rebuilds the index table with a new tab width.
   *
   * @param tabWidth columns taken by a tab
   * @return this row
   */
  public Row relink(int tabWidth) {
    Validate.isTrue(tabWidth >= 1, "tabWidth must be >= 1");
    indices.clear();
    int acc = 0;
    indices.add(acc);
    for (int cp : text) {
      acc += DisplayWidth.of(cp, tabWidth);
      indices.add(acc);
    }
    return this;
  }

  /**
   * Inserts text before character {@code start}.
   *
   * <p>Only the part of the index table after {@code start} is rewritten.
   *
   * @param start character index to insert at
   * @param s text to insert
   * @param tabWidth columns taken by a tab
   * @return {@link Status#NONE}
   * @throws OutOfRangeException if {@code start} lies beyond the row
   */
  public Status insert(int start, String s, int tabWidth) throws OutOfRangeException {
    Validate.notNull(s, "s must not be null");
    checkStart(start);
    List<Integer> cps = codePoints(s);
    int base = indices.get(start);
    List<Integer> fresh = new ArrayList<>(cps.size());
    int added = 0;
    for (int cp : cps) {
      added += DisplayWidth.of(cp, tabWidth);
      fresh.add(base + added);
    }
    for (int i = start + 1; i < indices.size(); i++) {
      indices.set(i, indices.get(i) + added);
    }
    indices.addAll(start + 1, fresh);
    text.addAll(start, cps);
    modified = true;
    return Status.NONE;
  }

  /**
   * Removes the characters in {@code [start, end)}.
   *
   * @param start first character removed
   * @param end character after the last one removed
   * @return {@link Status#NONE}
   * @throws OutOfRangeException if the range does not lie within the row
   */
  public Status remove(int start, int end) throws OutOfRangeException {
    checkStart(start);
    if (end < start || end > len()) {
      throw new OutOfRangeException("character", end, len());
    }
    int removed = indices.get(end) - indices.get(start);
    text.subList(start, end).clear();
    indices.subList(start + 1, end + 1).clear();
    for (int i = start + 1; i < indices.size(); i++) {
      indices.set(i, indices.get(i) - removed);
    }
    modified = true;
    return Status.NONE;
  }

  /**
   * Removes the characters in {@code [start, endInclusive]}.
   *
   * @param start first character removed
   * @param endInclusive last character removed
   * @return {@link Status#NONE}
   * @throws OutOfRangeException if the range does not lie within the row
   */
  public Status removeInclusive(int start, int endInclusive) throws OutOfRangeException {
    return remove(start, endInclusive + 1);
  }

  /**
   * Splits this row at a character index. The left half is marked modified; the right half's index table is
   * re-based to start at zero.
   *
   * @param idx character index of the split
   * @return both halves
   * @throws OutOfRangeException if {@code idx} lies beyond the row
   */
  public Halves split(int idx) throws OutOfRangeException {
    if (idx < 0 || idx > len()) {
      throw new OutOfRangeException("character", idx, len());
    }
    Row left = new Row(
        new ArrayList<>(text.subList(0, idx)),
        new ArrayList<>(indices.subList(0, idx + 1)),
        true);
    int shift = indices.get(idx);
    List<Integer> rightIndices = new ArrayList<>(indices.size() - idx);
    for (int i = idx; i < indices.size(); i++) {
      rightIndices.add(indices.get(i) - shift);
    }
    Row right = new Row(new ArrayList<>(text.subList(idx, len())), rightIndices, false);
    return new Halves(left, right);
  }

  /**
   * Joins this row and {@code other} into a new, modified row. Neither operand is changed.
   *
   * @param other row appended after this one
   * @return joined row
   */
  public Row splice(Row other) {
    Validate.notNull(other, "other must not be null");
    List<Integer> joinedText = new ArrayList<>(len() + other.len());
    joinedText.addAll(text);
    joinedText.addAll(other.text);
    List<Integer> joinedIndices = new ArrayList<>(joinedText.size() + 1);
    joinedIndices.addAll(indices);
    int shift = width();
    for (int i = 1; i < other.indices.size(); i++) {
      joinedIndices.add(other.indices.get(i) + shift);
    }
    return new Row(joinedText, joinedIndices, true);
  }

  /**
   * Returns the character indices of word starts followed by the row length.
   *
   * @return word boundaries
   */
  public List<Integer> words() {
    return WordBoundaries.scan(text);
  }

  /**
   * Returns the nearest word boundary after {@code from}.
   *
   * @param from character index
   * @return boundary, or the row length when none follows
   */
  public int nextWordForth(int from) {
    return WordBoundaries.nextForth(words(), from);
  }

  /**
   * Returns the nearest word boundary before {@code from}.
   *
   * @param from character index
   * @return boundary, or 0 when none precedes
   */
  public int nextWordBack(int from) {
    return WordBoundaries.nextBack(words(), from);
  }

  /**
   * Renders the row from a display column on, with tabs expanded.
   *
   * <p>When {@code from} falls inside a wide character or an expanded tab, the visible remainder of that character
   * is shown as a single space and rendering continues at the next character.
   * <pre>
   * "He好llo好"  from 2 -> "好llo好"
   *             from 3 -> " llo好"
   *             from 4 -> "llo好"
   * </pre>
   *
   * @param from first display column to show
   * @param tabWidth columns taken by a tab
   * @return rendered text, empty when {@code from} is at or beyond the row's width
   */
  public String render(int from, int tabWidth) {
    if (from >= width()) {
      return "";
    }
    int start = 0;
    while (indices.get(start) < from) {
      start++;
    }
    StringBuilder sb = new StringBuilder();
    if (indices.get(start) != from) {
      sb.append(' ');
    }
    appendExpanded(sb, start, len(), tabWidth);
    return sb.toString();
  }

  /**
   * Renders the whole row with tabs expanded to spaces.
   *
   * @param tabWidth columns taken by a tab
   * @return rendered text
   */
  public String renderFull(int tabWidth) {
    StringBuilder sb = new StringBuilder();
    appendExpanded(sb, 0, len(), tabWidth);
    return sb.toString();
  }

  /**
   * Renders the row exactly as stored; tabs stay tabs.
   *
   * @return raw text
   */
  public String renderRaw() {
    StringBuilder sb = new StringBuilder(len());
    for (int cp : text) {
      sb.appendCodePoint(cp);
    }
    return sb.toString();
  }

  /**
   * Converts a display column to a character index.
   *
   * <p>Columns at or beyond the row's width map to {@link #len()}. A column inside a wide character maps to that
   * character.
   *
   * @param x display column
   * @return character index
   */
  public int getCharPtr(int x) {
    if (x >= width()) {
      return len();
    }
    for (int i = 0; i < indices.size(); i++) {
      int col = indices.get(i);
      if (col == x) {
        return i;
      }
      if (col > x) {
        return Math.max(i - 1, 0);
      }
    }
    return len();
  }

  /**
   * Returns true if a display column is the start of a character or the row end.
   *
   * @param x display column
   * @return true on a boundary
   */
  public boolean isBoundary(int x) {
    return Collections.binarySearch(indices, x) >= 0;
  }

  /**
   * Returns the display column at which a character starts.
   *
   * @param idx character index, {@code len()} for the row end
   * @return display column
   */
  public int displayColumn(int idx) {
    return indices.get(idx);
  }

  /**
   * Returns the display width of one character.
   *
   * @param idx character index
   * @return width in columns
   */
  public int widthAt(int idx) {
    return indices.get(idx + 1) - indices.get(idx);
  }

  /**
   * Returns the code point at a character index.
   *
   * @param idx character index
   * @return code point
   */
  public int charAt(int idx) {
    return text.get(idx);
  }

  public int width() {
    return indices.get(indices.size() - 1);
  }

  public int len() {
    return text.size();
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  public boolean isModified() {
    return modified;
  }

  public void setModified(boolean modified) {
    this.modified = modified;
  }

  public List<Integer> getText() {
    return Collections.unmodifiableList(text);
  }

  public List<Integer> getIndices() {
    return Collections.unmodifiableList(indices);
  }

  private void checkStart(int start) throws OutOfRangeException {
    if (start < 0 || start > width()) {
      throw new OutOfRangeException("column", start, width());
    }
    if (start > len()) {
      throw new OutOfRangeException("character", start, len());
    }
  }

  private void appendExpanded(StringBuilder sb, int from, int to, int tabWidth) {
    for (int i = from; i < to; i++) {
      int cp = text.get(i);
      if (cp == DisplayWidth.TAB) {
        sb.append(StringUtils.repeat(' ', tabWidth));
      } else {
        sb.appendCodePoint(cp);
      }
    }
  }

  private static List<Integer> codePoints(String s) {
    List<Integer> out = new ArrayList<>(s.length());
    s.codePoints().forEach(out::add);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    Row other = (Row) o;
    return text.equals(other.text) && indices.equals(other.indices);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, indices);
  }

  @Override
  public String toString() {
    return "Row{text=" + renderRaw() + ", indices=" + indices + ", modified=" + modified + "}";
  }
}
