package com.consullo.editor.driver;

import com.consullo.editor.core.FileException;
import com.consullo.editor.core.Size;
import com.consullo.editor.document.Document;
import com.consullo.editor.document.DocumentConfig;
import com.consullo.editor.history.DefaultCommitPolicy;
import com.consullo.editor.history.EditStack;
import java.nio.file.Path;

/**
 * Factory for editor sessions with sensible defaults: a fresh edit stack and word-grouped undo steps.
 */
public final class EditorSessionFactory {

  private EditorSessionFactory() {
  }

  /**
   * Opens a file into a new session.
   *
   * @param path file to open
   * @param size viewport size
   * @param tabWidth display columns taken by a tab
   * @return session
   * @throws FileException if the file cannot be read
   */
  public static EditorSession open(Path path, Size size, int tabWidth) throws FileException {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null.");
    }
    Document document = Document.open(path, size, new DocumentConfig(tabWidth));
    return EditorSession.create(document, new EditStack(), new DefaultCommitPolicy());
  }

  /**
   * Creates a session over an empty, unnamed buffer.
   *
   * @param size viewport size
   * @param tabWidth display columns taken by a tab
   * @return session
   */
  public static EditorSession scratch(Size size, int tabWidth) {
    Document document = new Document(size, new DocumentConfig(tabWidth));
    return EditorSession.create(document, new EditStack(), new DefaultCommitPolicy());
  }
}
