package uibridge.command;

/**
 * Cell coordinates on a grid surface. Both values are unsigned.
 *
 * @param column zero-based column
 * @param row zero-based row
 */
public record GridPosition(int column, int row) {

  public GridPosition {
    if (column < 0) {
      throw new IllegalArgumentException("column must be >= 0");
    }
    if (row < 0) {
      throw new IllegalArgumentException("row must be >= 0");
    }
  }

  public static GridPosition of(int column, int row) {
    return new GridPosition(column, row);
  }
}
