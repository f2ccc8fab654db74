package com.consullo.editor.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Scrolling rules, checked without a document.
 */
public class ViewportAxisTest {

  private static final int EXTENT = 10;

  @Test
  @DisplayName("Should reset the offset for targets on the first screen")
  void jumpTo_FirstScreen_ResetsOffset() {
    final ViewportAxis axis = new ViewportAxis(0, 25);

    assertThat(axis.jumpTo(5, EXTENT)).isEqualTo(new ViewportAxis(5, 0));
  }

  @Test
  @DisplayName("Should only move the cursor for visible targets")
  void jumpTo_Visible_KeepsOffset() {
    final ViewportAxis axis = new ViewportAxis(0, 25);

    assertThat(axis.jumpTo(28, EXTENT)).isEqualTo(new ViewportAxis(3, 25));
    assertThat(axis.jumpTo(34, EXTENT)).isEqualTo(new ViewportAxis(9, 25));
  }

  @Test
  @DisplayName("Should put targets outside the viewport at the leading edge")
  void jumpTo_OutOfView_AnchorsLeadingEdge() {
    assertThat(ViewportAxis.ORIGIN.jumpTo(25, EXTENT)).isEqualTo(new ViewportAxis(0, 25));
    assertThat(new ViewportAxis(0, 25).jumpTo(35, EXTENT)).isEqualTo(new ViewportAxis(0, 35));
    assertThat(new ViewportAxis(0, 25).jumpTo(12, EXTENT)).isEqualTo(new ViewportAxis(0, 12));
  }

  @Test
  @DisplayName("Should anchor targets below the viewport at the trailing edge when scrolling")
  void scrollTo_BelowView_AnchorsTrailingEdge() {
    assertThat(ViewportAxis.ORIGIN.scrollTo(3, 2)).isEqualTo(new ViewportAxis(1, 2));
    assertThat(ViewportAxis.ORIGIN.scrollTo(1, 2)).isEqualTo(new ViewportAxis(1, 0));
    assertThat(new ViewportAxis(0, 10).scrollTo(4, 3)).isEqualTo(new ViewportAxis(0, 4));
  }

  @Test
  @DisplayName("Should pin the cursor at the trailing edge and scroll when advancing")
  void advance_AtEdge_ScrollsOffset() {
    assertThat(ViewportAxis.ORIGIN.advance(1, EXTENT)).isEqualTo(new ViewportAxis(1, 0));
    assertThat(new ViewportAxis(9, 0).advance(1, EXTENT)).isEqualTo(new ViewportAxis(9, 1));
    assertThat(new ViewportAxis(8, 0).advance(2, EXTENT)).isEqualTo(new ViewportAxis(9, 1));
  }

  @Test
  @DisplayName("Should scroll back once the cursor reaches the leading edge")
  void retreat_AtEdge_ScrollsOffset() {
    assertThat(new ViewportAxis(3, 4).retreat(1)).isEqualTo(new ViewportAxis(2, 4));
    assertThat(new ViewportAxis(0, 4).retreat(1)).isEqualTo(new ViewportAxis(0, 3));
    assertThat(new ViewportAxis(1, 4).retreat(2)).isEqualTo(new ViewportAxis(0, 3));
  }

  @Test
  @DisplayName("Should keep the absolute position when the viewport shrinks")
  void clampTo_Smaller_KeepsPosition() {
    final ViewportAxis clamped = new ViewportAxis(8, 0).clampTo(5);

    assertThat(clamped).isEqualTo(new ViewportAxis(4, 4));
    assertThat(clamped.position()).isEqualTo(8);
    assertThat(new ViewportAxis(2, 3).clampTo(5)).isEqualTo(new ViewportAxis(2, 3));
  }

  @Test
  @DisplayName("Should report visibility over a half-open range")
  void inView_Edges_HalfOpen() {
    final ViewportAxis axis = new ViewportAxis(0, 5);

    assertThat(axis.inView(5, EXTENT)).isTrue();
    assertThat(axis.inView(14, EXTENT)).isTrue();
    assertThat(axis.inView(15, EXTENT)).isFalse();
    assertThat(axis.inView(4, EXTENT)).isFalse();
  }

  @Test
  @DisplayName("Should reject negative coordinates")
  void new_Negative_Throws() {
    assertThatThrownBy(() -> new ViewportAxis(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ViewportAxis(0, -1)).isInstanceOf(IllegalArgumentException.class);
  }
}
