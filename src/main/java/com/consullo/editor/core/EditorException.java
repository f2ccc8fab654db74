package com.consullo.editor.core;

/**
 * Base checked exception for failures surfaced to clients of the text buffer.
 *
 * <p>Navigation boundaries are reported as {@link com.consullo.editor.core.events.Status} values and never as
 * exceptions.
 *
 * @since 1.0
 */
public abstract class EditorException extends Exception {

  protected EditorException(String msg) {
    super(msg);
  }

  protected EditorException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
