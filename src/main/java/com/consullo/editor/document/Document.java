package com.consullo.editor.document;

import com.consullo.editor.core.FileException;
import com.consullo.editor.core.Loc;
import com.consullo.editor.core.NoFileNameException;
import com.consullo.editor.core.OutOfRangeException;
import com.consullo.editor.core.Row;
import com.consullo.editor.core.Size;
import com.consullo.editor.core.TextLayout;
import com.consullo.editor.core.events.Event;
import com.consullo.editor.core.events.Status;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An editable document: its rows, the file behind it, and the cursor and viewport over it.
 *
 * <p>Three coordinate spaces are kept in lockstep:
 * <ul>
 * <li>character index: {@link #getCharPtr()}, the authoritative horizontal position within the current row;</li>
 * <li>display column: {@code cursor.x + offset.x}, after tab expansion and wide-character accounting;</li>
 * <li>screen coordinate: {@link #cursor()} inside the viewport plus {@link #offset()} for scrolling.</li>
 * </ul>
 * After every cursor-moving operation {@code charPtr == currentRow().getCharPtr(loc().x())}.
 *
 * <p>{@link #execute(Event)} is the single mutating entry point. Rows changed directly through {@link #row(int)}
 * do not update the cursor or the modified flag.
 *
 * <p>Not thread-safe. A document is owned by one client thread at a time.
 *
 * @since 1.0
 */
public final class Document {

  private static final Logger LOGGER = LoggerFactory.getLogger(Document.class);

  private static final String NO_NAME = "[No Name]";

  private final List<Row> rows = new ArrayList<>();
  private final FileTypeResolver fileTypes;

  private FileInfo info;
  private Size size;
  private boolean modified;
  private int charPtr;
  private ViewportAxis horizontal = ViewportAxis.ORIGIN;
  private ViewportAxis vertical = ViewportAxis.ORIGIN;

  /**
   * Creates an empty, unnamed document with default configuration.
   *
   * @param size viewport size
   */
  public Document(Size size) {
    this(size, DocumentConfig.DEFAULTS);
  }

  /**
   * Creates an empty, unnamed document.
   *
   * @param size viewport size
   * @param config document configuration
   */
  public Document(Size size, DocumentConfig config) {
    this(size, config, new DefaultFileTypeResolver());
  }

  /**
   * Creates an empty, unnamed document.
   *
   * @param size viewport size
   * @param config document configuration
   * @param fileTypes file type lookup used by {@link #statusLineInfo()}
   */
  public Document(Size size, DocumentConfig config, FileTypeResolver fileTypes) {
    Validate.notNull(size, "size must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(fileTypes, "fileTypes must not be null");
    this.size = size;
    this.fileTypes = fileTypes;
    this.info = FileInfo.empty(config.tabWidth());
  }

  /**
   * Creates a document from a file.
   *
   * @param path file to read
   * @param size viewport size
   * @return document
   * @throws FileException if the file cannot be read
   */
  public static Document open(Path path, Size size) throws FileException {
    return open(path, size, DocumentConfig.DEFAULTS);
  }

  /**
   * Creates a document from a file.
   *
   * @param path file to read
   * @param size viewport size
   * @param config document configuration
   * @return document
   * @throws FileException if the file cannot be read
   */
  public static Document open(Path path, Size size, DocumentConfig config) throws FileException {
    Document doc = new Document(size, config);
    doc.open(path);
    return doc;
  }

  /**
   * Replaces this document's contents with a file's. Cursor, offset, character pointer and modified flag are reset.
   *
   * @param path file to read
   * @throws FileException if the file cannot be read
   */
  public void open(Path path) throws FileException {
    Validate.notNull(path, "path must not be null");
    final String raw;
    try {
      raw = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new FileException(path, e);
    }
    info = new FileInfo(path, raw.contains("\r\n"), info.tabWidth());
    horizontal = ViewportAxis.ORIGIN;
    vertical = ViewportAxis.ORIGIN;
    charPtr = 0;
    modified = false;
    rows.clear();
    for (String line : splitLines(raw)) {
      rows.add(new Row(line, info.tabWidth()));
    }
    LOGGER.debug("open: {} rows from {} (dos={})", rows.size(), path, info.dos());
  }

  /**
   * Writes the document back to its file and clears the modified flag.
   *
   * @throws NoFileNameException if the document has no path
   * @throws FileException if the file cannot be written
   */
  public void save() throws NoFileNameException, FileException {
    if (info.file() == null) {
      throw new NoFileNameException();
    }
    write(info.file());
    modified = false;
  }

  /**
   * Writes the document to another path. Neither the associated path nor the modified flag change.
   *
   * @param path file to write
   * @throws FileException if the file cannot be written
   */
  public void saveAs(Path path) throws FileException {
    Validate.notNull(path, "path must not be null");
    write(path);
  }

  private void write(Path path) throws FileException {
    try {
      Files.writeString(path, render(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new FileException(path, e);
    }
    LOGGER.debug("save: {} rows to {}", rows.size(), path);
  }

  /**
   * Applies an edit event, keeping the cursor consistent with the change.
   *
   * <ul>
   * <li>{@code INSERT}: moves to the location, inserts, then moves right; the result of that move is returned.</li>
   * <li>{@code REMOVE}: deletes the character before the location; {@link Status#START_OF_ROW} without change when
   * the location is at the start of a row.</li>
   * <li>{@code INSERT_ROW} / {@code REMOVE_ROW}: inserts or removes a whole row; the cursor moves to the inserted row
   * or to the row above the removed one.</li>
   * <li>{@code SPLIT_DOWN}: breaks the row; the cursor moves to the start of the new row.</li>
   * <li>{@code SPLICE_UP}: joins the row onto the one above; the cursor lands on the join;
   * {@link Status#START_OF_DOCUMENT} without change on the first row.</li>
   * </ul>
   *
   * @param event edit to apply
   * @return movement status
   * @throws OutOfRangeException if the event addresses a position outside the document
   */
  public Status execute(Event event) throws OutOfRangeException {
    Validate.notNull(event, "event must not be null");
    Loc loc = event.loc();
    switch (event.type()) {
      case INSERT: {
        goTo(loc);
        row(loc.y()).insert(loc.x(), new String(Character.toChars(event.character())), info.tabWidth());
        modified = true;
        return moveRight();
      }
      case REMOVE: {
        goTo(loc);
        if (loc.x() == 0) {
          return Status.START_OF_ROW;
        }
        moveLeft();
        row(loc.y()).remove(loc.x() - 1, loc.x());
        modified = true;
        return Status.NONE;
      }
      case INSERT_ROW: {
        int idx = event.row();
        if (idx < 0 || idx > rows.size()) {
          throw new OutOfRangeException("row", idx, rows.size());
        }
        rows.add(idx, new Row(event.text(), info.tabWidth()));
        modified = true;
        goToY(idx);
        LOGGER.debug("execute: inserted row {}", idx);
        return Status.NONE;
      }
      case REMOVE_ROW: {
        int idx = event.row();
        if (idx < 0 || idx >= rows.size()) {
          throw new OutOfRangeException("row", idx, rows.size() - 1);
        }
        rows.remove(idx);
        modified = true;
        goToY(idx == 0 ? 0 : idx - 1);
        LOGGER.debug("execute: removed row {}", idx);
        return Status.NONE;
      }
      case SPLIT_DOWN: {
        Row.Halves halves = row(loc.y()).split(loc.x());
        rows.set(loc.y(), halves.left());
        rows.add(loc.y() + 1, halves.right());
        modified = true;
        goTo(new Loc(0, loc.y() + 1));
        LOGGER.debug("execute: split row {} at {}", loc.y(), loc.x());
        return Status.NONE;
      }
      case SPLICE_UP: {
        if (loc.y() == 0) {
          return Status.START_OF_DOCUMENT;
        }
        Row lower = row(loc.y());
        Row upper = row(loc.y() - 1);
        int join = upper.len();
        rows.set(loc.y() - 1, upper.splice(lower));
        rows.remove(loc.y());
        modified = true;
        goTo(new Loc(join, loc.y() - 1));
        LOGGER.debug("execute: spliced row {} onto {} at {}", loc.y(), loc.y() - 1, join);
        return Status.NONE;
      }
      default:
        throw new IllegalStateException("Unhandled event type: " + event.type());
    }
  }

  /**
   * Moves the cursor to a character index on a row: vertically first, then horizontally.
   *
   * @param loc {@code (character index, row index)}
   * @throws OutOfRangeException if the row or character does not exist
   */
  public void goTo(Loc loc) throws OutOfRangeException {
    Validate.notNull(loc, "loc must not be null");
    goToY(loc.y());
    goToX(loc.x());
  }

  /**
   * Moves the cursor to a character index on the current row. Targets within the first screen width reset the
   * horizontal offset; visible targets only move the cursor; others scroll so the target is at the left edge.
   *
   * @param x character index, at most the row length
   * @throws OutOfRangeException if {@code x} exceeds the current row
   */
  public void goToX(int x) throws OutOfRangeException {
    if (charPtr == x) {
      return;
    }
    Row row = currentRow();
    if (x < 0 || x > row.len()) {
      throw new OutOfRangeException("character", x, row.len());
    }
    horizontal = horizontal.jumpTo(row.displayColumn(x), size.w());
    charPtr = x;
  }

  /**
   * Moves the cursor to a row, then snaps it onto a character boundary of that row. Row index
   * {@code rowCount()} is accepted and denotes the empty line after the last row.
   *
   * @param y row index
   * @throws OutOfRangeException if {@code y} exceeds the row count
   */
  public void goToY(int y) throws OutOfRangeException {
    if (y < 0 || y > rows.size()) {
      throw new OutOfRangeException("row", y, rows.size());
    }
    vertical = vertical.scrollTo(y, size.h());
    snapToBoundary();
  }

  /**
   * Moves one character left.
   *
   * @return {@link Status#START_OF_ROW} if already at the start of the row
   * @throws OutOfRangeException if the cursor is not on a row
   */
  public Status moveLeft() throws OutOfRangeException {
    if (charPtr == 0) {
      return Status.START_OF_ROW;
    }
    horizontal = horizontal.retreat(currentRow().widthAt(charPtr - 1));
    charPtr--;
    return Status.NONE;
  }

  /**
   * Moves one character right.
   *
   * @return {@link Status#END_OF_ROW} if already at the end of the row
   * @throws OutOfRangeException if the cursor is not on a row
   */
  public Status moveRight() throws OutOfRangeException {
    if (loc().y() >= rows.size()) {
      return Status.END_OF_ROW;
    }
    Row row = currentRow();
    if (charPtr == row.len()) {
      return Status.END_OF_ROW;
    }
    horizontal = horizontal.advance(row.widthAt(charPtr), size.w());
    charPtr++;
    return Status.NONE;
  }

  /**
   * Moves one row up, scrolling when the cursor is at the top edge.
   *
   * @return {@link Status#START_OF_DOCUMENT} if already on the first row
   * @throws OutOfRangeException if the cursor is not on a row
   */
  public Status moveUp() throws OutOfRangeException {
    if (loc().y() == 0) {
      return Status.START_OF_DOCUMENT;
    }
    vertical = vertical.retreat(1);
    snapToBoundary();
    return Status.NONE;
  }

  /**
   * Moves one row down, scrolling when the cursor is at the bottom edge.
   *
   * @return {@link Status#END_OF_DOCUMENT} if already on the last row
   * @throws OutOfRangeException if the cursor is not on a row
   */
  public Status moveDown() throws OutOfRangeException {
    if (loc().y() >= rows.size() - 1) {
      return Status.END_OF_DOCUMENT;
    }
    vertical = vertical.advance(1, size.h());
    snapToBoundary();
    return Status.NONE;
  }

  // Pulls the display column back onto a boundary of the current row and recomputes the character pointer.
  private void snapToBoundary() {
    if (loc().y() >= rows.size()) {
      horizontal = ViewportAxis.ORIGIN;
      charPtr = 0;
      return;
    }
    Row row = rows.get(loc().y());
    int start = horizontal.position();
    if (start > row.width()) {
      horizontal = horizontal.jumpTo(row.width(), size.w());
      charPtr = row.len();
      return;
    }
    int ptr = start;
    while (!row.isBoundary(ptr)) {
      ptr--;
    }
    horizontal = horizontal.retreat(start - ptr);
    charPtr = row.getCharPtr(ptr);
  }

  /**
   * Changes the viewport size, keeping the absolute cursor position.
   *
   * @param size new viewport size
   */
  public void resize(Size size) {
    Validate.notNull(size, "size must not be null");
    this.size = size;
    horizontal = horizontal.clampTo(size.w());
    vertical = vertical.clampTo(size.h());
  }

  /**
   * Changes the tab width and rebuilds every row's index table. The cursor keeps its character index.
   *
   * @param tabWidth display columns taken by a tab
   */
  public void setTabWidth(int tabWidth) {
    Validate.isTrue(tabWidth >= 1, "tabWidth must be >= 1: %d", tabWidth);
    info = info.withTabWidth(tabWidth);
    for (Row row : rows) {
      row.relink(tabWidth);
    }
    if (loc().y() < rows.size()) {
      horizontal = horizontal.jumpTo(rows.get(loc().y()).displayColumn(charPtr), size.w());
    }
  }

  /**
   * Serializes the document: raw rows joined by the detected line ending, with a trailing line ending.
   *
   * @return file contents
   */
  public String render() {
    if (rows.isEmpty()) {
      return "";
    }
    String ending = info.lineEnding();
    StringBuilder sb = new StringBuilder();
    for (Row row : rows) {
      sb.append(row.renderRaw());
      sb.append(ending);
    }
    return sb.toString();
  }

  /**
   * Renders the rows covered by the viewport, each starting at the horizontal offset.
   *
   * @return visible lines, top to bottom (fewer than the viewport height past the end of the document)
   */
  public List<String> visibleLines() {
    int top = vertical.offset();
    int end = Math.min(top + size.h(), rows.size());
    List<String> out = new ArrayList<>(Math.max(end - top, 0));
    for (int y = top; y < end; y++) {
      out.add(rows.get(y).render(horizontal.offset(), info.tabWidth()));
    }
    return out;
  }

  /**
   * Returns a row's 1-based number, right-aligned to the width of the largest row number.
   *
   * @param index row index
   * @return padded line number
   */
  public String lineNumber(int index) {
    return TextLayout.lineNumber(index, rows.size());
  }

  /**
   * Returns the values a status line shows, in display order: {@code file}, {@code full_path}, {@code type},
   * {@code extension}, {@code modified}, {@code row} (1-based), {@code column} (0-based character index) and
   * {@code total}.
   *
   * @return status line values
   */
  public Map<String, String> statusLineInfo() {
    Path file = info.file();
    String name = file == null || file.getFileName() == null ? NO_NAME : file.getFileName().toString();
    String extension = file == null ? "" : StringUtils.substringAfterLast(name, ".");

    Map<String, String> out = new LinkedHashMap<>();
    out.put("file", name);
    out.put("full_path", file == null ? NO_NAME : file.toString());
    out.put("type", fileTypes.resolve(extension));
    out.put("extension", extension);
    out.put("modified", modified ? "[+]" : "");
    out.put("row", Integer.toString(loc().y() + 1));
    out.put("column", Integer.toString(charPtr));
    out.put("total", Integer.toString(rows.size()));
    return out;
  }

  /**
   * Returns a row.
   *
   * @param index row index
   * @return row
   * @throws OutOfRangeException if no such row exists
   */
  public Row row(int index) throws OutOfRangeException {
    if (index < 0 || index >= rows.size()) {
      throw new OutOfRangeException("row", index, rows.size() - 1);
    }
    return rows.get(index);
  }

  /**
   * Returns the row under the cursor.
   *
   * @return current row
   * @throws OutOfRangeException if the cursor is past the last row
   */
  public Row currentRow() throws OutOfRangeException {
    return row(loc().y());
  }

  public List<Row> rows() {
    return Collections.unmodifiableList(rows);
  }

  public int rowCount() {
    return rows.size();
  }

  /**
   * Returns the absolute display position of the cursor, {@code cursor + offset}.
   *
   * @return {@code (display column, row index)}
   */
  public Loc loc() {
    return new Loc(horizontal.position(), vertical.position());
  }

  public Loc cursor() {
    return new Loc(horizontal.cursor(), vertical.cursor());
  }

  public Loc offset() {
    return new Loc(horizontal.offset(), vertical.offset());
  }

  public int getCharPtr() {
    return charPtr;
  }

  public Size getSize() {
    return size;
  }

  public FileInfo getInfo() {
    return info;
  }

  public int getTabWidth() {
    return info.tabWidth();
  }

  public boolean isModified() {
    return modified;
  }

  // Splits on \n and \r\n. A line ending at the very end of the text does not start another row.
  private static List<String> splitLines(String raw) {
    List<String> out = new ArrayList<>();
    int start = 0;
    int n = raw.length();
    for (int i = 0; i < n; i++) {
      if (raw.charAt(i) == '\n') {
        int end = i;
        if (end > start && raw.charAt(end - 1) == '\r') {
          end--;
        }
        out.add(raw.substring(start, end));
        start = i + 1;
      }
    }
    if (start < n || out.isEmpty()) {
      out.add(raw.substring(start));
    }
    return out;
  }
}
