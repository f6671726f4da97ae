package max.chess.rules.game;

import max.chess.rules.common.ChessException;
import max.chess.rules.common.Color;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class ZobristHashKeysTest {

    private static long hash(String fen) throws ChessException {
        Board board = FENUtils.getBoardFrom(fen);
        return ZobristHashKeys.getHashKey(board, fen.split(" ")[1].equals("w") ? Color.WHITE : Color.BLACK);
    }

    @Test
    public void sameMovesInADifferentOrderGiveTheSameKey() throws ChessException {
        // Given
        Game game1 = new Game();
        Game game2 = new Game();

        // When
        game1.makeMove("g1", "f3");
        game1.makeMove("g8", "f6");
        game1.makeMove("b1", "c3");
        game2.makeMove("b1", "c3");
        game2.makeMove("g8", "f6");
        game2.makeMove("g1", "f3");

        // Then
        assertEquals(ZobristHashKeys.print(ZobristHashKeys.getHashKey(game1.board(), game1.getActiveColor())),
                ZobristHashKeys.print(ZobristHashKeys.getHashKey(game2.board(), game2.getActiveColor())));
    }

    @Test
    public void everyComponentOfThePositionChangesTheKey() throws ChessException {
        long reference = hash(BoardGenerator.STANDARD_GAME);

        assertEquals(reference, hash(BoardGenerator.STANDARD_GAME));
        // side to move
        assertNotEquals(reference, hash("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR b KQkq - 0 1"));
        // castling rights
        assertNotEquals(reference, hash("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w Kkq - 0 1"));
        // clocks are not part of the position
        assertEquals(reference, hash("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 12 40"));
        // en passant target, even when no pawn can take
        assertNotEquals(hash("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1"),
                hash("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq - 0 1"));
    }

    @Test
    public void repetitionCounterKeepsTheWholeHistory() {
        RepetitionCounter repetitionCounter = new RepetitionCounter();

        repetitionCounter.inc(42L);
        repetitionCounter.inc(7L);
        repetitionCounter.inc(42L);

        assertEquals(2, repetitionCounter.get(42L));
        assertEquals(1, repetitionCounter.get(7L));
        assertEquals(0, repetitionCounter.get(1L));
        assertEquals(3, repetitionCounter.size());
        assertEquals(42L, repetitionCounter.history().getLong(2));
    }
}
