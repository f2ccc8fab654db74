package com.consullo.editor.driver;

import com.consullo.editor.core.Loc;
import com.consullo.editor.core.OutOfRangeException;
import com.consullo.editor.core.Row;
import com.consullo.editor.core.events.Event;
import com.consullo.editor.core.events.Status;
import com.consullo.editor.document.Document;
import com.consullo.editor.history.CommitPolicy;
import com.consullo.editor.history.EditStack;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One open buffer in an editor.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the document (rows, cursor, viewport)</li>
 * <li>its edit stack (undo/redo history)</li>
 * <li>the commit policy that groups events into undo steps</li>
 * </ul>
 * </p>
 *
 * <p>Edits go through {@link #apply(Event)} so that they are recorded; edits made on the document directly are
 * not undoable.
 */
public final class EditorSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditorSession.class);

  private final Document document;
  private final EditStack history;
  private final CommitPolicy commitPolicy;

  private EditorSession(Document document, EditStack history, CommitPolicy commitPolicy) {
    this.document = document;
    this.history = history;
    this.commitPolicy = commitPolicy;
  }

  public static EditorSession create(Document document, EditStack history, CommitPolicy commitPolicy) {
    if (document == null || history == null || commitPolicy == null) {
      throw new IllegalArgumentException("document/history/commitPolicy must not be null.");
    }
    return new EditorSession(document, history, commitPolicy);
  }

  public Document document() {
    return document;
  }

  public EditStack history() {
    return history;
  }

  /**
   * Executes an event and records it for undo.
   *
   * <p>The payload needed to invert the event (removed character, removed row text, join column) is taken from
   * the document before execution, so callers may leave it blank. Events that leave the document unchanged
   * (backspace at the start of a row, joining the first row upwards) are not recorded.
   *
   * @param event event to apply
   * @return status reported by the document
   * @throws OutOfRangeException if the event addresses a position outside the document
   */
  public Status apply(Event event) throws OutOfRangeException {
    if (event == null) {
      throw new IllegalArgumentException("event must not be null.");
    }
    Event recorded = normalize(event);
    Status status = document.execute(recorded);
    if (mutates(recorded)) {
      history.exe(recorded);
      if (commitPolicy.shouldCommitAfter(recorded)) {
        history.commit();
      }
    }
    return status;
  }

  /**
   * Types text at the cursor. A newline splits the row; typing on the line after the last row creates it first.
   *
   * @param text text to type
   * @throws OutOfRangeException if the cursor is outside the document
   */
  public void type(String text) throws OutOfRangeException {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      ensureRow();
      if (cp == '\n') {
        apply(Event.splitDown(caret()));
      } else {
        apply(Event.insert(caret(), cp));
      }
    }
  }

  /**
   * Deletes the character before the cursor, joining onto the previous row at the start of a row.
   *
   * @return status reported by the document
   * @throws OutOfRangeException if the cursor is outside the document
   */
  public Status backspace() throws OutOfRangeException {
    Loc at = caret();
    if (at.y() >= document.rowCount()) {
      return Status.START_OF_ROW;
    }
    if (at.x() == 0) {
      return apply(Event.spliceUp(at));
    }
    return apply(Event.remove(at, 0));
  }

  /**
   * Closes the current undo step.
   */
  public void commit() {
    history.commit();
  }

  /**
   * Reverts the latest undo step.
   *
   * @return true if something was undone
   * @throws OutOfRangeException if the document no longer matches the recorded history
   */
  public boolean undo() throws OutOfRangeException {
    Optional<List<Event>> patch = history.undo();
    if (patch.isEmpty()) {
      return false;
    }
    for (Event event : patch.get()) {
      replay(event.inverse());
    }
    LOGGER.debug("undo: reverted {} events", patch.get().size());
    return true;
  }

  /**
   * Re-applies the latest undone step.
   *
   * @return true if something was redone
   * @throws OutOfRangeException if the document no longer matches the recorded history
   */
  public boolean redo() throws OutOfRangeException {
    Optional<List<Event>> patch = history.redo();
    if (patch.isEmpty()) {
      return false;
    }
    for (Event event : patch.get()) {
      replay(event);
    }
    LOGGER.debug("redo: re-applied {} events", patch.get().size());
    return true;
  }

  /**
   * Returns the cursor as {@code (character index, row index)}, the form events are addressed in.
   *
   * @return cursor location
   */
  public Loc caret() {
    return new Loc(document.getCharPtr(), document.loc().y());
  }

  private void replay(Event event) throws OutOfRangeException {
    try {
      document.execute(event);
    } catch (OutOfRangeException e) {
      LOGGER.warn("replay: {} failed: {}", event, e.getMessage());
      throw e;
    }
  }

  private void ensureRow() throws OutOfRangeException {
    int y = document.loc().y();
    if (y == document.rowCount()) {
      apply(Event.insertRow(y, ""));
    }
  }

  private Event normalize(Event event) throws OutOfRangeException {
    Loc loc = event.loc();
    switch (event.type()) {
      case REMOVE: {
        if (loc.x() == 0) {
          return event;
        }
        Row row = document.row(loc.y());
        if (loc.x() > row.len()) {
          throw new OutOfRangeException("character", loc.x(), row.len());
        }
        return Event.remove(loc, row.charAt(loc.x() - 1));
      }
      case REMOVE_ROW:
        return Event.removeRow(event.row(), document.row(event.row()).renderRaw());
      case SPLICE_UP: {
        if (loc.y() == 0) {
          return event;
        }
        return Event.spliceUp(new Loc(document.row(loc.y() - 1).len(), loc.y()));
      }
      default:
        return event;
    }
  }

  private static boolean mutates(Event event) {
    switch (event.type()) {
      case REMOVE:
        return event.loc().x() != 0;
      case SPLICE_UP:
        return event.loc().y() != 0;
      default:
        return true;
    }
  }
}
