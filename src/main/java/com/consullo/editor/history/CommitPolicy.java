package com.consullo.editor.history;

import com.consullo.editor.core.events.Event;

/**
 * Decides where one undo step ends.
 *
 * @since 1.0
 */
public interface CommitPolicy {

  /**
   * Returns true if the open patch should be committed after recording {@code event}.
   *
   * @param event event just recorded
   * @return true to close the patch
   */
  boolean shouldCommitAfter(Event event);
}
