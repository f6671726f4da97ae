package max.chess.rules.movegen.pieces;

// A queen is a rook and a bishop standing on the same square
public final class Queen {
    public static long getPseudoLegalMovesBB(int positionIndex, long friendlyOccupiedSquareBB, long occupiedSquareBB) {
        return getAttackBB(positionIndex, occupiedSquareBB) & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex, long occupiedSquareBB) {
        return Rook.getAttackBB(positionIndex, occupiedSquareBB) | Bishop.getAttackBB(positionIndex, occupiedSquareBB);
    }

    private Queen() {
    }
}
