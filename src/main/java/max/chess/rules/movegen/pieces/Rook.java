package max.chess.rules.movegen.pieces;

import max.chess.rules.movegen.utils.SlidingMoveUtils;

public final class Rook {
    public static long getPseudoLegalMovesBB(int positionIndex, long friendlyOccupiedSquareBB, long occupiedSquareBB) {
        return getAttackBB(positionIndex, occupiedSquareBB) & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex, long occupiedSquareBB) {
        return SlidingMoveUtils.getRaysBB(positionIndex, SlidingMoveUtils.ORTHOGONAL_DIRECTIONS, occupiedSquareBB);
    }

    private Rook() {
    }
}
