package max.chess.rules.game;

import max.chess.rules.common.Piece;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.utils.BitUtils;

public final class DrawDetector {

    /**
     * Dead position by insufficient material: bare kings, king and a single minor piece against a bare king, or
     * kings with bishops only, all of them standing on squares of the same color.
     */
    public static boolean isInsufficientMaterial(Board board) {
        int knights = 0;
        int bishopsOnLight = 0;
        int bishopsOnDark = 0;

        long occupiedBB = board.getOccupiedBB();
        while(occupiedBB != 0) {
            int index = BitUtils.bitScanForward(occupiedBB);
            occupiedBB &= occupiedBB - 1;
            Piece piece = board.getPiece(index);
            switch (piece.type()) {
                case KING -> {
                }
                case KNIGHT -> knights++;
                case BISHOP -> {
                    if(Position.at(index).isLightSquare()) {
                        bishopsOnLight++;
                    } else {
                        bishopsOnDark++;
                    }
                }
                default -> {
                    // a pawn, a rook or a queen can always mate
                    return false;
                }
            }
        }

        int bishops = bishopsOnLight + bishopsOnDark;
        if(knights + bishops <= 1) {
            return true;
        }
        return knights == 0 && (bishopsOnLight == 0 || bishopsOnDark == 0);
    }

    public static boolean canClaimMoveRule(int halfMoveClock, GameConfig config) {
        return halfMoveClock >= config.claimableMoveRulePlies;
    }

    public static boolean isAutomaticMoveRule(int halfMoveClock, GameConfig config) {
        return halfMoveClock >= config.automaticMoveRulePlies;
    }

    public static boolean canClaimRepetition(int occurrences, GameConfig config) {
        return occurrences >= config.claimableRepetitions;
    }

    public static boolean isAutomaticRepetition(int occurrences, GameConfig config) {
        return occurrences >= config.automaticRepetitions;
    }

    private DrawDetector() {
    }
}
