package com.consullo.editor.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when reading or writing a document fails.
 *
 * @since 1.0
 */
public final class FileException extends EditorException {

  private final Path path;

  /**
   * Wraps an I/O failure.
   *
   * @param path file being read or written
   * @param cause underlying I/O error
   */
  public FileException(Path path, IOException cause) {
    super("I/O failure on " + path + ": " + cause.getMessage(), cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
