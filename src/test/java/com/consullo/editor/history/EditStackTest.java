package com.consullo.editor.history;

import com.consullo.editor.core.Loc;
import com.consullo.editor.core.events.Event;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for patch grouping and undo/redo bookkeeping.
 *
 * @since 1.0
 */
public class EditStackTest {

  private static final Event A = Event.insert(new Loc(0, 0), 'a');
  private static final Event B = Event.insert(new Loc(1, 0), 'b');
  private static final Event C = Event.insert(new Loc(2, 0), 'c');

  @Test
  @DisplayName("Should group recorded events into one patch on commit")
  void commit_OpenPatch_PushesUndoStep() {
    final EditStack stack = new EditStack();
    stack.exe(A);
    stack.exe(B);
    assertThat(stack.getPatch()).containsExactly(A, B);

    stack.commit();

    assertThat(stack.getPatch()).isEmpty();
    assertThat(stack.undoDepth()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should ignore commits of an empty patch")
  void commit_EmptyPatch_NoOp() {
    final EditStack stack = new EditStack();

    stack.commit();

    assertThat(stack.undoDepth()).isZero();
    assertThat(stack.undo()).isEmpty();
    assertThat(stack.redo()).isEmpty();
  }

  @Test
  @DisplayName("Should return patches reversed for undo and in order for redo")
  void undoRedo_CommittedPatch_ReturnsOrderedEvents() {
    final EditStack stack = new EditStack();
    stack.exe(A);
    stack.exe(B);
    stack.commit();

    final Optional<List<Event>> undo = stack.undo();
    assertThat(undo).isPresent();
    assertThat(undo.get()).containsExactly(B, A);
    assertThat(stack.undoDepth()).isZero();
    assertThat(stack.redoDepth()).isEqualTo(1);

    final Optional<List<Event>> redo = stack.redo();
    assertThat(redo).isPresent();
    assertThat(redo.get()).containsExactly(A, B);
    assertThat(stack.undoDepth()).isEqualTo(1);
    assertThat(stack.redoDepth()).isZero();
  }

  @Test
  @DisplayName("Should commit the open patch before undoing")
  void undo_OpenPatch_CommitsFirst() {
    final EditStack stack = new EditStack();
    stack.exe(A);
    stack.commit();
    stack.exe(B);
    stack.exe(C);

    assertThat(stack.undo()).contains(List.of(C, B));
    assertThat(stack.undo()).contains(List.of(A));
    assertThat(stack.undo()).isEmpty();
  }

  @Test
  @DisplayName("Should discard redo history when a new event is recorded")
  void exe_AfterUndo_ClearsRedo() {
    final EditStack stack = new EditStack();
    stack.exe(A);
    stack.undo();
    assertThat(stack.redoDepth()).isEqualTo(1);

    stack.exe(B);

    assertThat(stack.redoDepth()).isZero();
    assertThat(stack.redo()).isEmpty();
  }
}
