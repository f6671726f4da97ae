package max.chess.rules.game.board.utils;

import max.chess.rules.common.ChessException;
import max.chess.rules.game.Game;
import max.chess.rules.game.GameConfig;
import max.chess.rules.game.board.Board;
import max.chess.rules.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public static Board newStandardBoard() {
        try {
            return FENUtils.getBoardFrom(STANDARD_GAME);
        } catch (ChessException e) {
            throw new IllegalStateException("Standard starting position could not be loaded", e);
        }
    }

    public static Game newStandardGame() {
        return new Game();
    }

    public static Game from(String FEN) throws ChessException {
        return FENUtils.getGameFrom(FEN, GameConfig.DEFAULT);
    }

    public static Game from(String FEN, GameConfig config) throws ChessException {
        return FENUtils.getGameFrom(FEN, config);
    }
}
