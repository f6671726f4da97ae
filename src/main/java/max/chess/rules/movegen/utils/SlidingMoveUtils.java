package max.chess.rules.movegen.utils;

import max.chess.rules.common.Position;
import max.chess.rules.utils.BitUtils;

public final class SlidingMoveUtils {
    public static final int[][] DIAGONAL_DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    public static final int[][] ORTHOGONAL_DIRECTIONS = {{1, 0}, {0, 1}, {0, -1}, {-1, 0}};

    /**
     * Walks every direction from the given square until the edge of the board or the first occupied square,
     * which is included whatever its color: it is either a capture or a defended piece.
     */
    public static long getRaysBB(int positionIndex, int[][] directions, long occupiedSquaresBB) {
        Position origin = Position.at(positionIndex);
        long raysBB = 0;
        for(int[] direction : directions) {
            Position next = origin.tryOffset(direction[0], direction[1]);
            while(next != null) {
                raysBB |= BitUtils.getPositionIndexBitMask(next.index);
                if(BitUtils.isSet(occupiedSquaresBB, next.index)) {
                    // blocked
                    break;
                }
                next = next.tryOffset(direction[0], direction[1]);
            }
        }
        return raysBB;
    }

    private SlidingMoveUtils() {
    }
}
