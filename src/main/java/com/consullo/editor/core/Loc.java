package com.consullo.editor.core;

/**
 * A position in the document or on screen.
 *
 * <p>Depending on the caller, {@code x} is either a character index or a display column. {@code y} is always a
 * row index (rows have a uniform height of one).
 *
 * @param x horizontal component
 * @param y vertical component
 * @since 1.0
 */
public record Loc(int x, int y) {

  /**
   * The origin.
   */
  public static final Loc ZERO = new Loc(0, 0);

  /**
   * Creates a location.
   *
   * @param x horizontal component
   * @param y vertical component
   * @return location
   */
  public static Loc of(int x, int y) {
    return new Loc(x, y);
  }

  /**
   * Returns this location shifted horizontally.
   *
   * @param dx amount to add to {@code x}
   * @return shifted location
   */
  public Loc plusX(int dx) {
    return new Loc(x + dx, y);
  }

  /**
   * Returns this location shifted vertically.
   *
   * @param dy amount to add to {@code y}
   * @return shifted location
   */
  public Loc plusY(int dy) {
    return new Loc(x, y + dy);
  }
}
