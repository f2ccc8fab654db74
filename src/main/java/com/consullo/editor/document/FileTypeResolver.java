package com.consullo.editor.document;

/**
 * Lookup from a file extension to a human-readable file type label for status lines.
 *
 * @since 1.0
 */
public interface FileTypeResolver {

  /**
   * Returns the file type label for an extension.
   *
   * @param extension extension without the dot, possibly empty
   * @return label, never null
   */
  String resolve(String extension);
}
