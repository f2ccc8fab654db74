package com.consullo.editor.document;

import org.apache.commons.lang3.Validate;

/**
 * Document configuration values.
 *
 * @param tabWidth display columns taken by a tab character
 * @since 1.0
 */
public record DocumentConfig(int tabWidth) {

  public static final int DEFAULT_TAB_WIDTH = 4;

  public static final DocumentConfig DEFAULTS = new DocumentConfig(DEFAULT_TAB_WIDTH);

  public DocumentConfig {
    Validate.isTrue(tabWidth >= 1, "tabWidth must be >= 1: %d", tabWidth);
  }
}
