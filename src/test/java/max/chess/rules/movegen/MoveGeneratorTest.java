package max.chess.rules.movegen;

import max.chess.rules.common.ChessException;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.utils.BitUtils;
import max.chess.rules.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class MoveGeneratorTest {

    private static String destinations(Board board, String square) throws ChessException {
        long movesBB = MoveGenerator.getPseudoLegalMovesBB(board, Position.parse(square).index);
        return squares(movesBB);
    }

    private static String squares(long bb) {
        List<Position> positions = BitUtils.toPositions(bb);
        return positions.stream().map(Position::toString).collect(Collectors.joining(" "));
    }

    @Test
    public void knightInTheCornerHasTwoMoves() throws ChessException {
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/N3K3 w - - 0 1");

        assertEquals("c2 b3", destinations(board, "a1"));
    }

    @Test
    public void pawnPushesAndCaptures() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/3p1n2/4P3/4K3 w - - 0 1");

        // Then
        assertEquals("d3 e3 f3 e4", destinations(board, "e2"));
    }

    @Test
    public void blockedPawnCannotDoublePush() throws ChessException {
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/4n3/4P3/4K3 w - - 0 1");

        assertEquals("", destinations(board, "e2"));
    }

    @Test
    public void enPassantTargetIsACaptureDestination() throws ChessException {
        Board board = FENUtils.getBoardFrom("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 1");

        assertEquals("d6 e6", destinations(board, "e5"));
    }

    @Test
    public void slidersStopOnTheFirstBlocker() throws ChessException {
        // Given
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/1p6/8/8/RN2K3 w - - 0 1");

        // Then
        assertEquals("a2 a3 a4 a5 a6 a7 a8", destinations(board, "a1"));
        board.setPiece(Position.parse("a1").index, null);
        board.setPiece(Position.parse("c2").index, Piece.white(PieceType.BISHOP));
        assertEquals("d1 b3 d3 a4 e4 f5 g6 h7", destinations(board, "c2"));
    }

    @Test
    public void castlingRequiresEmptyAndUnattackedSquares() throws ChessException {
        // Given
        // The f8 rook covers f1, the queen side is clear
        Board board = FENUtils.getBoardFrom("4kr2/8/8/8/8/8/8/R3K2R w KQ - 0 1");

        // When
        long kingMovesBB = MoveGenerator.getPseudoLegalMovesBB(board, Position.parse("e1").index);

        // Then
        assert !BitUtils.isSet(kingMovesBB, Position.parse("g1").index);
        assert BitUtils.isSet(kingMovesBB, Position.parse("c1").index);
    }

    @Test
    public void queenSideCastlingIsAllowedWhenOnlyTheBFileSquareIsAttacked() throws ChessException {
        Board board = FENUtils.getBoardFrom("1r2k3/8/8/8/8/8/8/R3K3 w Q - 0 1");

        long kingMovesBB = MoveGenerator.getPseudoLegalMovesBB(board, Position.parse("e1").index);

        assert BitUtils.isSet(kingMovesBB, Position.parse("c1").index);
    }

    @Test
    public void noCastlingOutOfCheck() throws ChessException {
        Board board = FENUtils.getBoardFrom("4r1k1/8/8/8/8/8/8/R3K2R w KQ - 0 1");

        long kingMovesBB = MoveGenerator.getPseudoLegalMovesBB(board, Position.parse("e1").index);

        assert !BitUtils.isSet(kingMovesBB, Position.parse("g1").index);
        assert !BitUtils.isSet(kingMovesBB, Position.parse("c1").index);
    }

    @Test
    public void pawnsAttackDiagonallyOnly() throws ChessException {
        // Given
        Board board = BoardGenerator.newStandardBoard();

        // When
        long whiteAttackBB = MoveGenerator.getAttackBB(board, Color.WHITE);

        // Then
        // Every square of the third row is covered, nothing beyond it
        assertEquals("a3 b3 c3 d3 e3 f3 g3 h3", squares(whiteAttackBB & ~board.getOccupiedBB()));
        assert !MoveGenerator.isKingInCheck(board, Color.WHITE);
    }
}
