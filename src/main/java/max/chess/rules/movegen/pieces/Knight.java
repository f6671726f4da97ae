package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Position;
import max.chess.rules.utils.BitUtils;

public final class Knight {
    private static final int[][] KNIGHT_OFFSETS = {{2, 1}, {2, -1}, {1, 2}, {1, -2}, {-1, 2}, {-1, -2}, {-2, 1}, {-2, -1}};
    private static final long[] KNIGHT_MOVES_BB = new long[64];

    static {
        generateKnightMovesBB();
    }

    public static long getPseudoLegalMovesBB(int positionIndex, long friendlyOccupiedSquareBB) {
        return KNIGHT_MOVES_BB[positionIndex] & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KNIGHT_MOVES_BB[positionIndex];
    }

    private static void generateKnightMovesBB() {
        // 1 move set per square
        for(int i = 0; i < 64; i++) {
            Position knightPosition = Position.at(i);
            long movesBB = 0;
            for(int[] offset : KNIGHT_OFFSETS) {
                Position target = knightPosition.tryOffset(offset[0], offset[1]);
                if(target != null) {
                    movesBB |= BitUtils.getPositionIndexBitMask(target.index);
                }
            }
            KNIGHT_MOVES_BB[i] = movesBB;
        }
    }

    private Knight() {
    }
}
