package com.consullo.editor.core;

/**
 * Thrown when a character index, display column or row index lies outside the valid bounds.
 *
 * @since 1.0
 */
public final class OutOfRangeException extends EditorException {

  private final int index;
  private final int bound;

  /**
   * Creates an exception for an index that exceeded its bound.
   *
   * @param what what was being addressed (e.g. "row", "character")
   * @param index offending index
   * @param bound largest valid index
   */
  public OutOfRangeException(String what, int index, int bound) {
    super(what + " index " + index + " out of range (max " + bound + ")");
    this.index = index;
    this.bound = bound;
  }

  public int getIndex() {
    return index;
  }

  public int getBound() {
    return bound;
  }
}
