package io.kern.syntax;

/**
 * Location of a character in a KERN source buffer.
 *
 * @param line 1-based line number
 * @param column 1-based column within the line
 * @param offset 0-based character index into the buffer
 */
public record SourcePosition(int line, int column, int offset) {

  /** Position of the first character of any buffer. */
  public static final SourcePosition START = new SourcePosition(1, 1, 0);

  public SourcePosition {
    if (line < 1 || column < 1 || offset < 0) {
      throw new IllegalArgumentException(
          "Invalid position: line=" + line + ", column=" + column + ", offset=" + offset);
    }
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
