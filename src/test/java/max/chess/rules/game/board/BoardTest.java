package max.chess.rules.game.board;

import max.chess.rules.common.ChessException;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BoardTest {

    private static int idx(String square) throws ChessException {
        return Position.parse(square).index;
    }

    @Test
    public void standardBoardLayout() throws ChessException {
        Board board = BoardGenerator.newStandardBoard();

        assertEquals(32, board.countPieces());
        assertEquals(Piece.white(PieceType.KING), board.getPiece(idx("e1")));
        assertEquals(Piece.black(PieceType.QUEEN), board.getPiece(idx("d8")));
        assertEquals(Board.WHITE_KING_START, board.findKing(Color.WHITE));
        assertEquals(Board.BLACK_KING_START, board.findKing(Color.BLACK));
        assert board.canCastleKingSide(Color.WHITE) && board.canCastleQueenSide(Color.WHITE);
        assert board.canCastleKingSide(Color.BLACK) && board.canCastleQueenSide(Color.BLACK);
        assertEquals(-1, board.getEnPassantIndex());
    }

    @Test
    public void doublePushSetsEnPassantTargetAndNextMoveClearsIt() throws ChessException {
        // Given
        Board board = BoardGenerator.newStandardBoard();

        // When
        board.playMove(idx("e2"), idx("e4"));

        // Then
        assertEquals(idx("e3"), board.getEnPassantIndex());

        board.playMove(idx("g8"), idx("f6"));
        assertEquals(-1, board.getEnPassantIndex());
    }

    @Test
    public void enPassantCaptureRemovesThePawnBehindTheTarget() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 1");

        // When
        MovePlayed movePlayed = board.playMove(idx("e5"), idx("d6"));

        // Then
        assert movePlayed.enPassant();
        assertEquals(idx("d5"), movePlayed.pieceEatenIndex());
        assertEquals(Piece.black(PieceType.PAWN), movePlayed.pieceEaten());
        assertNull(board.getPiece(idx("d5")));
        assertEquals(Piece.white(PieceType.PAWN), board.getPiece(idx("d6")));
        assertEquals(2, board.countPieces());
    }

    @Test
    public void castlingMovesTheRookAndClearsBothRights() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        MovePlayed kingSide = board.playMove(idx("e1"), idx("g1"));
        MovePlayed queenSide = board.playMove(idx("e8"), idx("c8"));

        // Then
        assert kingSide.castleKingSide();
        assert queenSide.castleQueenSide();
        assertEquals(Piece.white(PieceType.ROOK), board.getPiece(idx("f1")));
        assertNull(board.getPiece(idx("h1")));
        assertEquals(Piece.black(PieceType.ROOK), board.getPiece(idx("d8")));
        assertNull(board.getPiece(idx("a8")));
        assert !board.canCastleKingSide(Color.WHITE) && !board.canCastleQueenSide(Color.WHITE);
        assert !board.canCastleKingSide(Color.BLACK) && !board.canCastleQueenSide(Color.BLACK);
    }

    @Test
    public void rookLeavingAndComingBackDoesNotRestoreTheRight() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        board.playMove(idx("h1"), idx("h2"));
        board.playMove(idx("h2"), idx("h1"));

        // Then
        assert !board.canCastleKingSide(Color.WHITE);
        assert board.canCastleQueenSide(Color.WHITE);
    }

    @Test
    public void capturingARookOnItsCornerClearsTheOpponentRight() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        MovePlayed movePlayed = board.playMove(idx("a1"), idx("a8"));

        // Then
        assert movePlayed.isCapture();
        assert !board.canCastleQueenSide(Color.WHITE);
        assert !board.canCastleQueenSide(Color.BLACK);
        assert board.canCastleKingSide(Color.BLACK);
    }

    @Test
    public void pawnOnLastRowIsOnlyReplacedThroughPromote() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/P7/8/8/8/8/8/4K3 w - - 0 1");

        // When
        board.playMove(idx("a7"), idx("a8"));

        // Then
        assertEquals(Piece.white(PieceType.PAWN), board.getPiece(idx("a8")));
        board.promote(idx("a8"), PieceType.KNIGHT);
        assertEquals(Piece.white(PieceType.KNIGHT), board.getPiece(idx("a8")));
        assertThrows(IllegalStateException.class, () -> board.promote(idx("a8"), PieceType.QUEEN));
    }

    @Test
    public void copyIsIndependent() throws ChessException {
        Board board = BoardGenerator.newStandardBoard();
        Board copy = new Board(board);

        copy.playMove(idx("e2"), idx("e4"));

        assertEquals(Piece.white(PieceType.PAWN), board.getPiece(idx("e2")));
        assertNull(board.getPiece(idx("e4")));
        assertEquals(-1, board.getEnPassantIndex());
        assertEquals(board.getOccupiedBB() ^ copy.getOccupiedBB(),
                (1L << idx("e2")) | (1L << idx("e4")));
    }
}
