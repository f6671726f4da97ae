package max.chess.rules.common;

/**
 * Failure of a game operation caused by the caller's input. The game is left exactly as it was before the call,
 * so the caller can inspect {@link #kind()} and retry with corrected input.
 */
public class ChessException extends Exception {
    public enum Kind {
        /** Malformed coordinate input: out-of-range indices or unparsable notation. */
        INVALID_POSITION,
        /** No piece on the source square, or the piece belongs to the side not on move. */
        WRONG_TURN,
        /** Destination is not one of the legal destinations of the source piece. */
        INVALID_MOVE,
        /** A promotion choice is outstanding and must be submitted first. */
        PROMOTION_PENDING,
        /** Promotion to a pawn or a king. */
        INVALID_PROMOTION_CHOICE,
        /** A promotion choice was submitted while none is awaited. */
        NO_PROMOTION_PENDING,
        /** The game is over, nothing can change it anymore. */
        GAME_ALREADY_OVER,
        /** Malformed Forsyth-Edwards record. */
        INVALID_FEN
    }

    private final Kind kind;

    public ChessException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChessException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "ChessException{" + kind + ": " + getMessage() + '}';
    }
}
