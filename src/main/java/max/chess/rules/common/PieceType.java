package max.chess.rules.common;

import java.util.Locale;

public enum PieceType {
    PAWN('P'), KNIGHT('N'), BISHOP('B'), ROOK('R'), QUEEN('Q'), KING('K');

    public static final PieceType[] VALUES = PieceType.values();

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    /** Uppercase letter used by algebraic notation and FEN. */
    public char letter() {
        return letter;
    }

    public boolean isSliding() {
        return this == BISHOP || this == ROOK || this == QUEEN;
    }

    public boolean isMinor() {
        return this == KNIGHT || this == BISHOP;
    }

    public boolean isValidPromotion() {
        return this != PAWN && this != KING;
    }

    /**
     * Parses a piece type from a single character: a letter in either case or a Unicode chess symbol of either color.
     *
     * @throws IllegalArgumentException if the character does not represent a piece
     */
    public static PieceType fromChar(char c) {
        return switch (c) {
            case 'p', 'P', '♙', '♟' -> PAWN;
            case 'n', 'N', '♘', '♞' -> KNIGHT;
            case 'b', 'B', '♗', '♝' -> BISHOP;
            case 'r', 'R', '♖', '♜' -> ROOK;
            case 'q', 'Q', '♕', '♛' -> QUEEN;
            case 'k', 'K', '♔', '♚' -> KING;
            default -> throw new IllegalArgumentException("'" + c + "' does not represent a piece");
        };
    }

    /**
     * Parses a piece type from a single character (see {@link #fromChar(char)}) or an English piece name in any case.
     *
     * @throws IllegalArgumentException if the input does not represent a piece
     */
    public static PieceType fromString(String s) {
        if(s == null) {
            throw new IllegalArgumentException("null does not represent a piece");
        }
        String trimmed = s.trim();
        if(trimmed.length() == 1) {
            return fromChar(trimmed.charAt(0));
        }
        return switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "pawn" -> PAWN;
            case "knight" -> KNIGHT;
            case "bishop" -> BISHOP;
            case "rook" -> ROOK;
            case "queen" -> QUEEN;
            case "king" -> KING;
            default -> throw new IllegalArgumentException("'" + s + "' does not represent a piece");
        };
    }
}
