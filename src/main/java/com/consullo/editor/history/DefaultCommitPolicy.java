package com.consullo.editor.history;

import com.consullo.editor.core.events.Event;

/**
 * Groups typing into words: a patch closes after a space or tab is inserted and after every row-level event.
 * Consecutive backspaces stay in one patch.
 */
public final class DefaultCommitPolicy implements CommitPolicy {

  @Override
  public boolean shouldCommitAfter(Event event) {
    if (event == null) {
      return false;
    }
    switch (event.type()) {
      case INSERT:
        return event.character() == ' ' || event.character() == '\t';
      case REMOVE:
        return false;
      default:
        return true;
    }
  }
}
