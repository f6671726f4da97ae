package max.chess.rules.common;

import java.util.Objects;

public record Piece(PieceType type, Color color) {
    public Piece {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
    }

    public static Piece white(PieceType type) {
        return new Piece(type, Color.WHITE);
    }

    public static Piece black(PieceType type) {
        return new Piece(type, Color.BLACK);
    }

    public boolean is(PieceType pieceType) {
        return type == pieceType;
    }

    public boolean isWhite() {
        return color.isWhite();
    }

    // FEN letter: uppercase for white, lowercase for black
    public char toFENChar() {
        return isWhite() ? type.letter() : Character.toLowerCase(type.letter());
    }

    public static Piece fromFENChar(char c) {
        PieceType pieceType = PieceType.fromChar(c);
        return new Piece(pieceType, Character.isUpperCase(c) ? Color.WHITE : Color.BLACK);
    }

    @Override
    public String toString() {
        return color + " " + type;
    }
}
