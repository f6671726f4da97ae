package max.chess.rules.utils;

import max.chess.rules.common.Position;

import java.util.ArrayList;
import java.util.List;

public final class BitUtils {

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the bitboard provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param bb the bitboard for which the LS1B is to be returned
     * @return the index of the first bit set to 1
     */
    public static int bitScanForward(long bb) {
        return Long.numberOfTrailingZeros(bb);
    }

    public static long getPositionIndexBitMask(int positionIndex) {
        return 1L << positionIndex;
    }

    public static boolean isSet(long bb, int positionIndex) {
        return (bb & getPositionIndexBitMask(positionIndex)) != 0;
    }

    public static int bitCount(long bb) {
        return Long.bitCount(bb);
    }

    // Squares are listed from a1 to h8
    public static List<Position> toPositions(long bb) {
        List<Position> positions = new ArrayList<>(bitCount(bb));
        while(bb != 0) {
            positions.add(Position.at(bitScanForward(bb)));
            bb &= bb - 1;
        }
        return positions;
    }

    private BitUtils() {
    }
}
