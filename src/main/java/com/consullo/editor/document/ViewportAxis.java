package com.consullo.editor.document;

import org.apache.commons.lang3.Validate;

/**
 * Cursor and scroll offset along one axis of the viewport.
 *
 * <p>Instances are immutable; every movement returns the new state, so scrolling rules can be exercised without a
 * document. {@code cursor} is the position inside the viewport, {@code offset} the first document coordinate shown,
 * and their sum the absolute position.
 *
 * @param cursor position within the viewport, {@code 0 <= cursor < extent}
 * @param offset scroll offset, {@code >= 0}
 * @since 1.0
 */
public record ViewportAxis(int cursor, int offset) {

  public static final ViewportAxis ORIGIN = new ViewportAxis(0, 0);

  public ViewportAxis {
    Validate.isTrue(cursor >= 0, "cursor must be non-negative: %d", cursor);
    Validate.isTrue(offset >= 0, "offset must be non-negative: %d", offset);
  }

  /**
   * Returns the absolute position, {@code cursor + offset}.
   *
   * @return absolute position
   */
  public int position() {
    return cursor + offset;
  }

  /**
   * Returns true if an absolute position is visible, i.e. lies in {@code [offset, offset + extent)}.
   *
   * @param target absolute position
   * @param extent viewport length along this axis
   * @return true if visible
   */
  public boolean inView(int target, int extent) {
    return target >= offset && target < offset + extent;
  }

  /**
   * Jumps to an absolute position. Positions within the first screen reset the offset to zero; visible positions
   * only move the cursor; anything else scrolls so the target sits at the leading edge.
   *
   * @param target absolute position
   * @param extent viewport length along this axis
   * @return new state
   */
  public ViewportAxis jumpTo(int target, int extent) {
    if (target < extent) {
      return new ViewportAxis(target, 0);
    }
    if (inView(target, extent)) {
      return new ViewportAxis(target - offset, offset);
    }
    return new ViewportAxis(0, target);
  }

  /**
   * Scrolls to an absolute position with the least movement: like {@link #jumpTo(int, int)}, except that targets
   * past the trailing edge are anchored to the trailing edge.
   *
   * @param target absolute position
   * @param extent viewport length along this axis
   * @return new state
   */
  public ViewportAxis scrollTo(int target, int extent) {
    if (target < extent || inView(target, extent) || target < offset) {
      return jumpTo(target, extent);
    }
    return new ViewportAxis(extent - 1, target - (extent - 1));
  }

  /**
   * Steps forward {@code n} units. The cursor moves until it is pinned at the trailing edge, then the offset
   * scrolls.
   *
   * @param n units to move
   * @param extent viewport length along this axis
   * @return new state
   */
  public ViewportAxis advance(int n, int extent) {
    int room = Math.max(extent - 1 - cursor, 0);
    int step = Math.min(n, room);
    return new ViewportAxis(cursor + step, offset + (n - step));
  }

  /**
   * Steps back {@code n} units. The cursor moves until it reaches the leading edge, then the offset scrolls.
   *
   * @param n units to move, at most {@link #position()}
   * @return new state
   */
  public ViewportAxis retreat(int n) {
    int step = Math.min(n, cursor);
    return new ViewportAxis(cursor - step, offset - (n - step));
  }

  /**
   * Keeps the absolute position but pulls the cursor inside a (possibly smaller) viewport.
   *
   * @param extent viewport length along this axis
   * @return new state
   */
  public ViewportAxis clampTo(int extent) {
    if (cursor < extent) {
      return this;
    }
    int over = cursor - (extent - 1);
    return new ViewportAxis(extent - 1, offset + over);
  }
}
