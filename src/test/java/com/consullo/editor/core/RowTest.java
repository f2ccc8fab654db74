package com.consullo.editor.core;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for row editing, index tables and rendering.
 *
 * @since 1.0
 */
public class RowTest {

  private static final int TABS = 4;

  @Test
  @DisplayName("Should build prefix widths counting wide characters as two columns")
  void new_WideCharacters_BuildsIndexTable() {
    final Row row = new Row("aa好b好c");

    assertThat(row.getIndices()).containsExactly(0, 1, 2, 4, 5, 7, 8);
    assertThat(row.len()).isEqualTo(6);
    assertThat(row.width()).isEqualTo(8);
    assertThat(row.isModified()).isFalse();
  }

  @Test
  @DisplayName("Should insert and remove while keeping the index table consistent")
  void insertRemove_MixedWidths_MatchesExpectedRendering() throws Exception {
    final Row row = new Row("aa好b好c");

    row.insert(3, "hao", TABS);
    row.insert(2, "ni", TABS);
    assertThat(row.renderFull(TABS)).isEqualTo("aani好haob好c");
    assertThat(row.isModified()).isTrue();

    row.remove(3, 7);
    assertThat(row.renderFull(TABS)).isEqualTo("aanob好c");
    assertThat(row.getIndices()).containsExactly(0, 1, 2, 3, 4, 5, 7, 8);
    assertThat(row).isEqualTo(new Row("aanob好c"));
  }

  @Test
  @DisplayName("Should keep each index step equal to the tab-aware width of its character")
  void indices_TabsAndWideCharacters_StepsMatchWidths() throws Exception {
    final Row row = new Row("\tab好 c\t", TABS);
    row.insert(1, "好\t", TABS);
    row.remove(0, 1);

    final List<Integer> indices = row.getIndices();
    assertThat(indices.get(0)).isZero();
    assertThat(indices).isSorted();
    for (int i = 0; i < row.len(); i++) {
      assertThat(indices.get(i + 1) - indices.get(i)).isEqualTo(DisplayWidth.of(row.charAt(i), TABS));
    }
  }

  @Test
  @DisplayName("Should show a space for the visible half of a character cut by the render start")
  void render_StartInsideWideCharacter_PrefixesSpace() {
    final Row row = new Row("aanob好c");

    assertThat(row.render(5, TABS)).isEqualTo("好c");
    assertThat(row.render(6, TABS)).isEqualTo(" c");
    assertThat(row.render(7, TABS)).isEqualTo("c");
    assertThat(row.render(8, TABS)).isEmpty();
    assertThat(row.render(40, TABS)).isEmpty();
  }

  @Test
  @DisplayName("Should expand tabs when rendering and keep them when rendering raw")
  void render_Tabs_ExpandedOnlyInDisplayForms() {
    final Row row = new Row("\tx", TABS);

    assertThat(row.renderFull(TABS)).isEqualTo("    x");
    assertThat(row.render(2, TABS)).isEqualTo(" x");
    assertThat(row.renderRaw()).isEqualTo("\tx");
  }

  @Test
  @DisplayName("Should round-trip raw text including tabs and supplementary characters")
  void renderRaw_AnyText_RoundTrips() {
    final String raw = "\tfoo 好\t" + new String(Character.toChars(0x12327)) + " end";

    assertThat(new Row(raw).renderRaw()).isEqualTo(raw);
  }

  @Test
  @DisplayName("Should map display columns back to character indices")
  void getCharPtr_WideCharacters_MapsColumns() {
    final Row row = new Row("呢逆反驳船r舱s");

    assertThat(row.getCharPtr(0)).isEqualTo(0);
    assertThat(row.getCharPtr(2)).isEqualTo(1);
    assertThat(row.getCharPtr(4)).isEqualTo(2);
    assertThat(row.getCharPtr(6)).isEqualTo(3);
    assertThat(row.getCharPtr(8)).isEqualTo(4);
    assertThat(row.getCharPtr(10)).isEqualTo(5);
    assertThat(row.getCharPtr(11)).isEqualTo(6);
    assertThat(row.getCharPtr(13)).isEqualTo(7);
    assertThat(row.getCharPtr(14)).isEqualTo(8);
    // Inside a wide character
    assertThat(row.getCharPtr(3)).isEqualTo(1);
    assertThat(row.isBoundary(3)).isFalse();
    assertThat(row.isBoundary(4)).isTrue();
  }

  @Test
  @DisplayName("Should clamp columns at or past the row end to the row length")
  void getCharPtr_PastEnd_ReturnsLength() {
    final Row row = new Row("sr饿t肚子rsf萨t订");

    assertThat(row.getCharPtr(row.width())).isEqualTo(row.len());
    assertThat(row.getCharPtr(row.width() + 10)).isEqualTo(row.len());
    assertThat(new Row("").getCharPtr(0)).isZero();
  }

  @Test
  @DisplayName("Should split into a modified left half and a re-based right half that splice back together")
  void splitSplice_AnyIndex_ReconstructsRow() throws Exception {
    final Row row = new Row("hello 好 world");

    final Row.Halves halves = row.split(6);
    assertThat(halves.left().renderRaw()).isEqualTo("hello ");
    assertThat(halves.left().isModified()).isTrue();
    assertThat(halves.right().renderRaw()).isEqualTo("好 world");
    assertThat(halves.right().getIndices().get(0)).isZero();
    assertThat(halves.right().getIndices()).containsExactly(0, 2, 3, 4, 5, 6, 7, 8, 9);

    final Row joined = halves.left().splice(halves.right());
    assertThat(joined.getText()).isEqualTo(row.getText());
    assertThat(joined.width()).isEqualTo(row.width());
    assertThat(joined).isEqualTo(row);
    assertThat(joined.isModified()).isTrue();
  }

  @Test
  @DisplayName("Should split at both ends")
  void split_Edges_ProducesEmptyHalf() throws Exception {
    final Row row = new Row("qx");

    assertThat(row.split(0).left().isEmpty()).isTrue();
    assertThat(row.split(2).right().isEmpty()).isTrue();
    assertThat(row.split(2).right().getIndices()).containsExactly(0);
  }

  @Test
  @DisplayName("Should reject out-of-range insert, remove and split")
  void edits_OutOfRange_Throw() {
    final Row row = new Row("ab");

    assertThatThrownBy(() -> row.insert(3, "x", TABS)).isInstanceOf(OutOfRangeException.class);
    assertThatThrownBy(() -> row.remove(3, 4)).isInstanceOf(OutOfRangeException.class);
    assertThatThrownBy(() -> row.remove(1, 5)).isInstanceOf(OutOfRangeException.class);
    assertThatThrownBy(() -> row.split(3)).isInstanceOf(OutOfRangeException.class);
    assertThat(row.isModified()).isFalse();
  }

  @Test
  @DisplayName("Should remove an inclusive range")
  void removeInclusive_Range_RemovesBothEnds() throws Exception {
    final Row row = new Row("abcdef");

    row.removeInclusive(1, 3);

    assertThat(row.renderRaw()).isEqualTo("aef");
    assertThat(row.getIndices()).containsExactly(0, 1, 2, 3);
  }

  @Test
  @DisplayName("Should rebuild the index table for a new tab width")
  void relink_NewTabWidth_RecomputesWidths() {
    final Row row = new Row("\ta");

    row.relink(8);

    assertThat(row.getIndices()).containsExactly(0, 8, 9);
  }

  @Test
  @DisplayName("Should find word boundaries and jump between them")
  void words_Sentence_ReturnsWordStarts() {
    final Row row = new Row("The quick brown fox");

    assertThat(row.words()).containsExactly(0, 4, 10, 16, 19);
    assertThat(row.nextWordForth(0)).isEqualTo(4);
    assertThat(row.nextWordForth(5)).isEqualTo(10);
    assertThat(row.nextWordForth(19)).isEqualTo(19);
    assertThat(row.nextWordBack(12)).isEqualTo(10);
    assertThat(row.nextWordBack(10)).isEqualTo(4);
    assertThat(row.nextWordBack(0)).isEqualTo(0);
  }

  @Test
  @DisplayName("Should ignore the modified flag when comparing rows")
  void equals_ModifiedFlag_Ignored() {
    final Row a = new Row("x");
    final Row b = new Row("x");
    b.setModified(true);

    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
  }
}
