package max.chess.rules.common;

public enum Color {
    BLACK, WHITE;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    public boolean isBlack() {
        return this == BLACK;
    }

    // White pawns walk up the rows, black pawns walk down
    public int pawnDirection() {
        return isWhite() ? 1 : -1;
    }

    public int pawnStartRow() {
        return isWhite() ? 1 : 6;
    }

    public int promotionRow() {
        return isWhite() ? 7 : 0;
    }

    public int backRow() {
        return isWhite() ? 0 : 7;
    }

    public char toFENChar() {
        return isWhite() ? 'w' : 'b';
    }
}
