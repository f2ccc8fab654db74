package com.consullo.editor.history;

import com.consullo.editor.core.events.Event;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undo/redo journal of edit events grouped into patches.
 *
 * <p>Events recorded with {@link #exe(Event)} accumulate in an open patch until {@link #commit()} closes it as one
 * undo step. The stack only records; replaying a returned patch through a document is the caller's job.
 *
 * @since 1.0
 */
public final class EditStack {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditStack.class);

  private List<Event> patch = new ArrayList<>();
  private final Deque<List<Event>> done = new ArrayDeque<>();
  private final Deque<List<Event>> undone = new ArrayDeque<>();

  /**
   * Records an executed event in the open patch. Any redo history is discarded.
   *
   * @param event executed event
   */
  public void exe(Event event) {
    Validate.notNull(event, "event must not be null");
    patch.add(event);
    undone.clear();
  }

  /**
   * Closes the open patch as one undo step. Does nothing if the patch is empty.
   */
  public void commit() {
    if (patch.isEmpty()) {
      return;
    }
    done.push(Collections.unmodifiableList(patch));
    LOGGER.debug("commit: {} events (undo depth {})", patch.size(), done.size());
    patch = new ArrayList<>();
  }

  /**
   * Commits the open patch, then pops the latest patch for undo.
   *
   * @return the patch in reverse application order; replay the inverse of each event in this order. Empty when there
   *     is nothing to undo.
   */
  public Optional<List<Event>> undo() {
    commit();
    List<Event> last = done.poll();
    if (last == null) {
      return Optional.empty();
    }
    List<Event> reversed = reversed(last);
    undone.push(reversed);
    return Optional.of(reversed);
  }

  /**
   * Pops the latest undone patch for redo.
   *
   * @return the patch in forward application order; replay each event as is. Empty when there is nothing to redo.
   */
  public Optional<List<Event>> redo() {
    List<Event> last = undone.poll();
    if (last == null) {
      return Optional.empty();
    }
    List<Event> forward = reversed(last);
    done.push(forward);
    return Optional.of(forward);
  }

  public List<Event> getPatch() {
    return Collections.unmodifiableList(patch);
  }

  public int undoDepth() {
    return done.size();
  }

  public int redoDepth() {
    return undone.size();
  }

  private static List<Event> reversed(List<Event> events) {
    List<Event> out = new ArrayList<>(events);
    Collections.reverse(out);
    return Collections.unmodifiableList(out);
  }
}
