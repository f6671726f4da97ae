package max.chess.rules.movegen;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.utils.BitUtils;

import java.util.List;

/**
 * Keeps the pseudo-legal moves which do not leave the mover's king attacked. Each candidate is played on a scratch
 * copy of the board, side effects included, and the opponent's attack coverage is computed on the result.
 */
public final class LegalityFilter {

    public static long getLegalMovesBB(Board board, int positionIndex) {
        Piece piece = board.getPiece(positionIndex);
        if(piece == null) {
            return 0;
        }
        long pseudoLegalMovesBB = MoveGenerator.getPseudoLegalMovesBB(board, positionIndex);
        long legalMovesBB = 0;
        while(pseudoLegalMovesBB != 0) {
            int endPosition = BitUtils.bitScanForward(pseudoLegalMovesBB);
            pseudoLegalMovesBB &= pseudoLegalMovesBB - 1;
            if(!wouldKingBeInCheck(board, positionIndex, endPosition, piece.color())) {
                legalMovesBB |= BitUtils.getPositionIndexBitMask(endPosition);
            }
        }
        return legalMovesBB;
    }

    public static List<Position> getLegalMoves(Board board, Position position) {
        return BitUtils.toPositions(getLegalMovesBB(board, position.index));
    }

    public static boolean isLegalMove(Board board, int startPosition, int endPosition) {
        return BitUtils.isSet(getLegalMovesBB(board, startPosition), endPosition);
    }

    public static boolean wouldKingBeInCheck(Board board, int startPosition, int endPosition, Color kingColor) {
        Board scratchBoard = new Board(board);
        scratchBoard.playMove(startPosition, endPosition);
        return MoveGenerator.isKingInCheck(scratchBoard, kingColor);
    }

    public static boolean hasAnyLegalMove(Board board, Color color) {
        long piecesBB = board.getColorBB(color);
        while(piecesBB != 0) {
            int positionIndex = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            if(getLegalMovesBB(board, positionIndex) != 0) {
                return true;
            }
        }
        return false;
    }

    public static int countLegalMoves(Board board, Color color) {
        int count = 0;
        long piecesBB = board.getColorBB(color);
        while(piecesBB != 0) {
            int positionIndex = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            count += BitUtils.bitCount(getLegalMovesBB(board, positionIndex));
        }
        return count;
    }

    private LegalityFilter() {
    }
}
