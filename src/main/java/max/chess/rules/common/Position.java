package max.chess.rules.common;

/**
 * A square of the board. {@code row} is the rank (row 0 is rank 1, White's back rank), {@code col} is the file
 * (col 0 is the a-file) and {@code index} is {@code row * 8 + col}.
 * <p>
 * Instances are cached: there are exactly 64 of them, so they can be compared by reference.
 */
public final class Position {
    private static final Position[] POSITION_CACHE = new Position[64];
    static {
        for(int i = 0; i < 64; i++) {
            POSITION_CACHE[i] = new Position(i / 8, i % 8);
        }
    }

    public final int row;
    public final int col;
    public final int index;

    private Position(int row, int col) {
        this.row = row;
        this.col = col;
        this.index = row * 8 + col;
    }

    /**
     * @throws ChessException {@link ChessException.Kind#INVALID_POSITION} if row or col is not in [0,7]
     */
    public static Position of(int row, int col) throws ChessException {
        if(!isOnBoard(row, col)) {
            throw new ChessException(ChessException.Kind.INVALID_POSITION,
                    "Invalid row: " + row + " or col: " + col + "; input should be between 0-7");
        }
        return POSITION_CACHE[row * 8 + col];
    }

    /**
     * @throws ChessException {@link ChessException.Kind#INVALID_POSITION} if index is not in [0,63]
     */
    public static Position fromIndex(int index) throws ChessException {
        if(index < 0 || index > 63) {
            throw new ChessException(ChessException.Kind.INVALID_POSITION,
                    "Invalid index: " + index + "; input should be between 0-63");
        }
        return POSITION_CACHE[index];
    }

    /**
     * Parses algebraic notation such as {@code e4}: one file letter a-h followed by one rank digit 1-8.
     * Surrounding whitespace and an uppercase file letter are tolerated.
     *
     * @throws ChessException {@link ChessException.Kind#INVALID_POSITION} if the input does not name a square
     */
    public static Position parse(String square) throws ChessException {
        if(square == null) {
            throw new ChessException(ChessException.Kind.INVALID_POSITION, "Missing square");
        }
        String trimmed = square.trim();
        if(trimmed.length() != 2) {
            throw new ChessException(ChessException.Kind.INVALID_POSITION, "Input '" + square + "' is of invalid length");
        }
        char file = Character.toLowerCase(trimmed.charAt(0));
        char rank = trimmed.charAt(1);
        if(file < 'a' || file > 'h') {
            throw new ChessException(ChessException.Kind.INVALID_POSITION,
                    "First character '" + trimmed.charAt(0) + "' of '" + square + "' should be a letter between a-h");
        }
        if(rank < '1' || rank > '8') {
            throw new ChessException(ChessException.Kind.INVALID_POSITION,
                    "Second character '" + rank + "' of '" + square + "' should be a number between 1-8");
        }
        return POSITION_CACHE[(rank - '1') * 8 + (file - 'a')];
    }

    // Internal lookup, the index is trusted
    public static Position at(int index) {
        if(index < 0 || index > 63) {
            throw new IllegalArgumentException("Index out of the board: " + index);
        }
        return POSITION_CACHE[index];
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < 8 && col >= 0 && col < 8;
    }

    /**
     * Returns the position shifted by the given offsets.
     *
     * @throws ChessException {@link ChessException.Kind#INVALID_POSITION} if the result falls off the board
     */
    public Position offset(int rowOffset, int colOffset) throws ChessException {
        Position shifted = tryOffset(rowOffset, colOffset);
        if(shifted == null) {
            throw new ChessException(ChessException.Kind.INVALID_POSITION,
                    "New position row: " + (row + rowOffset) + " col: " + (col + colOffset) + " is not on the board");
        }
        return shifted;
    }

    // Returns null when the shift leaves the board, handy on the move generation path
    public Position tryOffset(int rowOffset, int colOffset) {
        int newRow = row + rowOffset;
        int newCol = col + colOffset;
        if(!isOnBoard(newRow, newCol)) {
            return null;
        }
        return POSITION_CACHE[newRow * 8 + newCol];
    }

    public boolean isLightSquare() {
        return ((row + col) & 1) == 1;
    }

    public char fileLetter() {
        return (char) ('a' + col);
    }

    public char rankDigit() {
        return (char) ('1' + row);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "" + fileLetter() + rankDigit();
    }
}
