package max.chess.rules.game;

public enum GameState {
    /** Playable, the active color's king is not attacked. */
    IN_PROGRESS,
    /** Playable, the active color's king is attacked and only moves removing the check are legal. */
    CHECK,
    /** A pawn reached the last row, the game waits for {@link Game#setPromotion} before anything else. */
    WAITING_ON_PROMOTION_CHOICE,
    /** Terminal. {@link Game#getGameOverReason()} tells why. */
    GAME_OVER
}
