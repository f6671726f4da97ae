package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.utils.BitUtils;

public final class Pawn {
    private static final long[] WHITE_PAWN_ATTACKING_MOVES_BB = new long[64];
    private static final long[] BLACK_PAWN_ATTACKING_MOVES_BB = new long[64];

    static {
        generatePawnAttackingMovesLookUp();
    }

    /**
     * Single push onto an empty square, double push from the start row through two empty squares, and diagonal
     * captures onto an enemy piece or onto the current en passant target.
     */
    public static long getPseudoLegalMovesBB(Board board, int positionIndex, Color color) {
        Position position = Position.at(positionIndex);
        int direction = color.pawnDirection();
        long movesBB = 0;

        Position singlePush = position.tryOffset(direction, 0);
        if(singlePush != null && board.isEmpty(singlePush.index)) {
            movesBB |= BitUtils.getPositionIndexBitMask(singlePush.index);
            if(position.row == color.pawnStartRow()) {
                Position doublePush = singlePush.tryOffset(direction, 0);
                if(doublePush != null && board.isEmpty(doublePush.index)) {
                    movesBB |= BitUtils.getPositionIndexBitMask(doublePush.index);
                }
            }
        }

        long capturableBB = board.getColorBB(color.getOppositeColor());
        int enPassantIndex = board.getEnPassantIndex();
        if(enPassantIndex != -1) {
            capturableBB |= BitUtils.getPositionIndexBitMask(enPassantIndex);
        }
        movesBB |= getAttackBB(positionIndex, color) & capturableBB;

        return movesBB;
    }

    // Diagonals only: a pawn never attacks the square in front of it
    public static long getAttackBB(int positionIndex, Color color) {
        return color.isWhite()
                ? WHITE_PAWN_ATTACKING_MOVES_BB[positionIndex]
                : BLACK_PAWN_ATTACKING_MOVES_BB[positionIndex];
    }

    private static void generatePawnAttackingMovesLookUp() {
        for(int i = 0; i < 64; i++) {
            Position position = Position.at(i);
            WHITE_PAWN_ATTACKING_MOVES_BB[i] = generatePawnAttackingMovesAt(position, Color.WHITE);
            BLACK_PAWN_ATTACKING_MOVES_BB[i] = generatePawnAttackingMovesAt(position, Color.BLACK);
        }
    }

    private static long generatePawnAttackingMovesAt(Position position, Color color) {
        long movesBB = 0;
        for(int colOffset : new int[]{-1, 1}) {
            Position target = position.tryOffset(color.pawnDirection(), colOffset);
            if(target != null) {
                movesBB |= BitUtils.getPositionIndexBitMask(target.index);
            }
        }
        return movesBB;
    }

    private Pawn() {
    }
}
