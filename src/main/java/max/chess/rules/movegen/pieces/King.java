package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.MoveGenerator;
import max.chess.rules.utils.BitUtils;

public final class King {
    private static final long[] KING_MOVES_BB = new long[64];

    static {
        generateKingMovesBB();
    }

    public static long getPseudoLegalMovesBB(Board board, int positionIndex, Color color) {
        return (KING_MOVES_BB[positionIndex] & ~board.getColorBB(color))
                | getCastleMovesBB(board, positionIndex, color);
    }

    public static long getAttackBB(int positionIndex) {
        return KING_MOVES_BB[positionIndex];
    }

    /**
     * Castling destinations (two squares toward the rook). Requires the right to be still held, the rook on its
     * corner, every square between king and rook empty, and the king's start, transit and destination squares not
     * attacked on the current board.
     */
    public static long getCastleMovesBB(Board board, int positionIndex, Color color) {
        int kingStart = color.isWhite() ? Board.WHITE_KING_START : Board.BLACK_KING_START;
        if(positionIndex != kingStart) {
            return 0;
        }
        boolean kingSide = board.canCastleKingSide(color) && isRookOn(board, kingStart + 3, color)
                && board.isEmpty(kingStart + 1) && board.isEmpty(kingStart + 2);
        boolean queenSide = board.canCastleQueenSide(color) && isRookOn(board, kingStart - 4, color)
                && board.isEmpty(kingStart - 1) && board.isEmpty(kingStart - 2) && board.isEmpty(kingStart - 3);
        if(!kingSide && !queenSide) {
            return 0;
        }

        long enemyAttackBB = MoveGenerator.getAttackBB(board, color.getOppositeColor());
        if(BitUtils.isSet(enemyAttackBB, kingStart)) {
            // No castling out of check
            return 0;
        }

        long castleMovesBB = 0;
        if(kingSide && !BitUtils.isSet(enemyAttackBB, kingStart + 1) && !BitUtils.isSet(enemyAttackBB, kingStart + 2)) {
            castleMovesBB |= BitUtils.getPositionIndexBitMask(kingStart + 2);
        }
        // b-file square may be attacked, the king does not cross it
        if(queenSide && !BitUtils.isSet(enemyAttackBB, kingStart - 1) && !BitUtils.isSet(enemyAttackBB, kingStart - 2)) {
            castleMovesBB |= BitUtils.getPositionIndexBitMask(kingStart - 2);
        }
        return castleMovesBB;
    }

    private static boolean isRookOn(Board board, int index, Color color) {
        Piece piece = board.getPiece(index);
        return piece != null && piece.is(PieceType.ROOK) && piece.color() == color;
    }

    private static void generateKingMovesBB() {
        for(int i = 0; i < 64; i++) {
            Position kingPosition = Position.at(i);
            long kingMovesBitboard = 0;
            // move in any of the 8 directions
            for(int rowOffset = -1; rowOffset <= 1; rowOffset++) {
                for(int colOffset = -1; colOffset <= 1; colOffset++) {
                    if(rowOffset == 0 && colOffset == 0) {
                        continue;
                    }
                    Position target = kingPosition.tryOffset(rowOffset, colOffset);
                    if(target != null) {
                        kingMovesBitboard |= BitUtils.getPositionIndexBitMask(target.index);
                    }
                }
            }
            KING_MOVES_BB[i] = kingMovesBitboard;
        }
    }

    private King() {
    }
}
