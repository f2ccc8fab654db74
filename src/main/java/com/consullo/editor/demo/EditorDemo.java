package com.consullo.editor.demo;

import com.consullo.editor.core.Loc;
import com.consullo.editor.core.Size;
import com.consullo.editor.core.TextLayout;
import com.consullo.editor.document.Document;
import com.consullo.editor.driver.EditorSession;
import com.consullo.editor.driver.EditorSessionFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scripted walk through the engine: opens a file with tabs and wide characters in a small viewport, edits it,
 * undoes and redoes, and prints each frame the way a terminal client would draw it.
 *
 * @since 1.0
 */
public final class EditorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditorDemo.class);

  private EditorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional path of a file to open; a temporary fixture is used otherwise
   * @throws Exception if the demo fails
   */
  public static void main(final String[] args) throws Exception {
    final Path path;
    if (args.length > 0) {
      path = Path.of(args[0]);
    } else {
      path = Files.createTempFile("editor-demo", ".rs");
      path.toFile().deleteOnExit();
      Files.writeString(path, "fn main() {\n\tprintln!(\"你好, world\");\n}\n", StandardCharsets.UTF_8);
    }

    final EditorSession session = EditorSessionFactory.open(path, new Size(16, 4), 4);
    final Document doc = session.document();
    LOGGER.info("Opened {} ({} rows)", path, doc.rowCount());
    printFrame("opened", doc);

    // Word-jump to the string literal on the second row, then scroll right across the wide characters.
    doc.goTo(session.caret().plusY(1));
    doc.goToX(doc.currentRow().nextWordForth(session.caret().x()));
    for (int i = 0; i < 12; i++) {
      doc.moveRight();
    }
    printFrame("scrolled", doc);

    session.type("!!");
    session.backspace();
    printFrame("typed", doc);

    doc.goTo(new Loc(doc.row(2).len(), 2));
    session.type("\n// done");
    printFrame("appended", doc);

    session.undo();
    printFrame("undo", doc);
    session.redo();
    printFrame("redo", doc);

    if (args.length > 0) {
      doc.save();
      LOGGER.info("Saved {}", path);
    }
    LOGGER.info("Demo completed");
  }

  private static void printFrame(String title, Document doc) {
    final int width = doc.getSize().w();
    final List<String> lines = doc.visibleLines();
    System.out.println("=== " + title + " ===");
    for (int i = 0; i < doc.getSize().h(); i++) {
      final int idx = doc.offset().y() + i;
      if (i < lines.size()) {
        System.out.println(doc.lineNumber(idx) + " |" + lines.get(i));
      } else {
        System.out.println("~ |");
      }
    }
    final Map<String, String> info = doc.statusLineInfo();
    final String lhs = " " + info.get("file") + info.get("modified") + " | " + info.get("type");
    final String rhs = info.get("row") + "/" + info.get("total") + ":" + info.get("column") + " ";
    System.out.println(TextLayout.alignSides(lhs, rhs, width + 4, doc.getTabWidth()).orElse(lhs));
  }
}
