package max.chess.rules.movegen;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.pieces.Bishop;
import max.chess.rules.movegen.pieces.King;
import max.chess.rules.movegen.pieces.Knight;
import max.chess.rules.movegen.pieces.Pawn;
import max.chess.rules.movegen.pieces.Queen;
import max.chess.rules.movegen.pieces.Rook;
import max.chess.rules.utils.BitUtils;

/**
 * Pseudo-legal move generation: destinations that respect each piece's geometry and the occupancy of the board,
 * but which may still leave the mover's own king attacked. See {@link LegalityFilter} for the final filtering.
 * <p>
 * Every move set is a bitboard: bit {@code i} is set when square index {@code i} is reachable.
 */
public final class MoveGenerator {

    /**
     * Pseudo-legal destinations of the piece standing on the given square, castling and en passant included.
     * Returns 0 for an empty square.
     */
    public static long getPseudoLegalMovesBB(Board board, int positionIndex) {
        Piece piece = board.getPiece(positionIndex);
        if(piece == null) {
            return 0;
        }
        Color color = piece.color();
        long friendlyOccupiedSquareBB = board.getColorBB(color);
        long occupiedSquareBB = board.getOccupiedBB();
        return switch (piece.type()) {
            case PAWN -> Pawn.getPseudoLegalMovesBB(board, positionIndex, color);
            case KNIGHT -> Knight.getPseudoLegalMovesBB(positionIndex, friendlyOccupiedSquareBB);
            case BISHOP -> Bishop.getPseudoLegalMovesBB(positionIndex, friendlyOccupiedSquareBB, occupiedSquareBB);
            case ROOK -> Rook.getPseudoLegalMovesBB(positionIndex, friendlyOccupiedSquareBB, occupiedSquareBB);
            case QUEEN -> Queen.getPseudoLegalMovesBB(positionIndex, friendlyOccupiedSquareBB, occupiedSquareBB);
            case KING -> King.getPseudoLegalMovesBB(board, positionIndex, color);
        };
    }

    /**
     * Squares attacked by the piece standing on the given square. Castling and en passant are not attacks and are
     * never part of it, which is what keeps the castling generation from recursing into itself.
     */
    public static long getPieceAttackBB(Board board, int positionIndex) {
        Piece piece = board.getPiece(positionIndex);
        if(piece == null) {
            return 0;
        }
        long occupiedSquareBB = board.getOccupiedBB();
        return switch (piece.type()) {
            case PAWN -> Pawn.getAttackBB(positionIndex, piece.color());
            case KNIGHT -> Knight.getAttackBB(positionIndex);
            case BISHOP -> Bishop.getAttackBB(positionIndex, occupiedSquareBB);
            case ROOK -> Rook.getAttackBB(positionIndex, occupiedSquareBB);
            case QUEEN -> Queen.getAttackBB(positionIndex, occupiedSquareBB);
            case KING -> King.getAttackBB(positionIndex);
        };
    }

    /** Attack coverage of a whole side: every square at least one of its pieces attacks. */
    public static long getAttackBB(Board board, Color color) {
        long attackBB = 0;
        long piecesBB = board.getColorBB(color);
        while(piecesBB != 0) {
            int positionIndex = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            attackBB |= getPieceAttackBB(board, positionIndex);
        }
        return attackBB;
    }

    public static boolean isSquareAttacked(Board board, int positionIndex, Color attacker) {
        return BitUtils.isSet(getAttackBB(board, attacker), positionIndex);
    }

    // A side without a king on the board is never in check
    public static boolean isKingInCheck(Board board, Color kingColor) {
        int kingPosition = board.findKing(kingColor);
        if(kingPosition == -1) {
            return false;
        }
        return isSquareAttacked(board, kingPosition, kingColor.getOppositeColor());
    }

    private MoveGenerator() {
    }
}
