package com.consullo.editor.core.events;

import com.consullo.editor.core.Loc;
import org.apache.commons.lang3.Validate;

/**
 * An atomic edit applied to a document.
 *
 * <p>Locations are {@code (character index, row index)}. Row-level events keep their row index in {@code loc.y}.
 * Removal events carry what they removed so the inverse event can be rebuilt for undo.
 *
 * @param type kind of edit
 * @param loc location the edit applies to
 * @param character inserted or removed code point ({@code INSERT} / {@code REMOVE} only, otherwise 0)
 * @param text inserted or removed row text ({@code INSERT_ROW} / {@code REMOVE_ROW} only, otherwise empty)
 * @since 1.0
 */
public record Event(Type type, Loc loc, int character, String text) {

  public enum Type {
    /**
     * Insert a character before {@code loc.x}.
     */
    INSERT,
    /**
     * Remove the character before {@code loc.x} (backspace).
     */
    REMOVE,
    /**
     * Insert a row at index {@code loc.y}.
     */
    INSERT_ROW,
    /**
     * Remove the row at index {@code loc.y}.
     */
    REMOVE_ROW,
    /**
     * Cut row {@code loc.y} at {@code loc.x} and move the tail onto a new row below.
     */
    SPLIT_DOWN,
    /**
     * Join row {@code loc.y} onto the end of the row above. {@code loc.x} records the join column on the upper row.
     */
    SPLICE_UP
  }

  public Event {
    Validate.notNull(type, "type must not be null");
    Validate.notNull(loc, "loc must not be null");
    Validate.notNull(text, "text must not be null");
  }

  public static Event insert(Loc loc, int character) {
    return new Event(Type.INSERT, loc, character, "");
  }

  public static Event remove(Loc loc, int character) {
    return new Event(Type.REMOVE, loc, character, "");
  }

  public static Event insertRow(int row, String text) {
    return new Event(Type.INSERT_ROW, new Loc(0, row), 0, text);
  }

  public static Event removeRow(int row, String text) {
    return new Event(Type.REMOVE_ROW, new Loc(0, row), 0, text);
  }

  public static Event splitDown(Loc loc) {
    return new Event(Type.SPLIT_DOWN, loc, 0, "");
  }

  public static Event spliceUp(Loc loc) {
    return new Event(Type.SPLICE_UP, loc, 0, "");
  }

  /**
   * Returns the row index a row-level event applies to.
   *
   * @return row index
   */
  public int row() {
    return loc.y();
  }

  /**
   * Returns the event that undoes this one.
   *
   * <ul>
   * <li>{@code INSERT(x, y)} is undone by a backspace just after the inserted character.</li>
   * <li>{@code REMOVE(x, y)} is undone by inserting the removed character at {@code x - 1}.</li>
   * <li>{@code SPLIT_DOWN(x, y)} is undone by joining row {@code y + 1} back at column {@code x}.</li>
   * <li>{@code SPLICE_UP(x, y)} is undone by splitting row {@code y - 1} at its join column {@code x}.</li>
   * <li>{@code INSERT_ROW} and {@code REMOVE_ROW} undo each other.</li>
   * </ul>
   *
   * @return inverse event
   */
  public Event inverse() {
    switch (type) {
      case INSERT:
        return remove(loc.plusX(1), character);
      case REMOVE:
        return insert(loc.plusX(-1), character);
      case INSERT_ROW:
        return removeRow(loc.y(), text);
      case REMOVE_ROW:
        return insertRow(loc.y(), text);
      case SPLIT_DOWN:
        return spliceUp(loc.plusY(1));
      case SPLICE_UP:
        return splitDown(loc.plusY(-1));
      default:
        throw new IllegalStateException("Unhandled event type: " + type);
    }
  }
}
