package max.chess.rules.game;

public enum GameOverReason {
    CHECKMATE,
    STALEMATE,
    /** Insufficient material: no sequence of legal moves can lead to a checkmate. */
    DEAD_POSITION,
    FIVEFOLD_REPETITION_RULE,
    SEVENTY_FIVE_MOVE_RULE,
    /** Draw agreed by the players through {@link Game#submitDraw()}. */
    MUTUAL_DRAW;

    public boolean isDraw() {
        return this != CHECKMATE;
    }
}
