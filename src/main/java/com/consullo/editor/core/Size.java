package com.consullo.editor.core;

import org.apache.commons.lang3.Validate;

/**
 * Viewport dimensions in display columns ({@code w}) and rows ({@code h}).
 *
 * @param w width in display columns
 * @param h height in rows
 * @since 1.0
 */
public record Size(int w, int h) {

  public Size {
    Validate.isTrue(w > 0, "w must be positive: %d", w);
    Validate.isTrue(h > 0, "h must be positive: %d", h);
  }

  public static Size of(int w, int h) {
    return new Size(w, h);
  }
}
