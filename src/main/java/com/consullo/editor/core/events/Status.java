package com.consullo.editor.core.events;

/**
 * Advisory outcome of a cursor movement or an executed event.
 *
 * <p>These are control-flow signals for the client (for example to wrap the cursor onto the next row), not errors.
 *
 * @since 1.0
 */
public enum Status {
  /**
   * Nothing of note.
   */
  NONE,
  /**
   * The cursor is at the start of its row.
   */
  START_OF_ROW,
  /**
   * The cursor is at the end of its row.
   */
  END_OF_ROW,
  /**
   * The cursor is on the first row.
   */
  START_OF_DOCUMENT,
  /**
   * The cursor is on the last row.
   */
  END_OF_DOCUMENT
}
