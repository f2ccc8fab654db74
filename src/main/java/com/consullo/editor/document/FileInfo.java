package com.consullo.editor.document;

import java.nio.file.Path;

/**
 * Information about the file behind a document.
 *
 * @param file associated path, or null for an unsaved buffer
 * @param dos true if the file uses CRLF line endings
 * @param tabWidth display columns taken by a tab character
 * @since 1.0
 */
public record FileInfo(Path file, boolean dos, int tabWidth) {

  public static FileInfo empty(int tabWidth) {
    return new FileInfo(null, false, tabWidth);
  }

  public String lineEnding() {
    return dos ? "\r\n" : "\n";
  }

  public FileInfo withTabWidth(int tabWidth) {
    return new FileInfo(file, dos, tabWidth);
  }
}
