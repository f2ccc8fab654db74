package com.consullo.editor.core;

/**
 * Thrown when saving a document that has no associated path.
 *
 * @since 1.0
 */
public final class NoFileNameException extends EditorException {

  public NoFileNameException() {
    super("No file name for this document");
  }
}
