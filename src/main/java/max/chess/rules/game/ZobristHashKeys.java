package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.game.board.Board;
import max.chess.rules.utils.BitUtils;

/**
 * Position fingerprints: a 64-bit key over the board layout, the active color, the castling rights and the en
 * passant target square. The en passant target counts as soon as it is set, whether or not a pawn can take.
 */
public final class ZobristHashKeys {
    private static final long SEED = 0x2545F4914F6CDD1DL;

    // [color * 6 + pieceType][square]
    private static final long[][] PIECE_SQUARE = new long[12][64];
    private static final long BLACK_TO_MOVE;
    private static final long WHITE_KING_SIDE_CASTLE;
    private static final long WHITE_QUEEN_SIDE_CASTLE;
    private static final long BLACK_KING_SIDE_CASTLE;
    private static final long BLACK_QUEEN_SIDE_CASTLE;
    private static final long[] EN_PASSANT_SQUARE = new long[64];

    static {
        long state = SEED;
        for(int piece = 0; piece < 12; piece++) {
            for(int square = 0; square < 64; square++) {
                state = mix(state);
                PIECE_SQUARE[piece][square] = state;
            }
        }
        for(int square = 0; square < 64; square++) {
            state = mix(state);
            EN_PASSANT_SQUARE[square] = state;
        }
        BLACK_TO_MOVE = state = mix(state);
        WHITE_KING_SIDE_CASTLE = state = mix(state);
        WHITE_QUEEN_SIDE_CASTLE = state = mix(state);
        BLACK_KING_SIDE_CASTLE = state = mix(state);
        BLACK_QUEEN_SIDE_CASTLE = mix(state);
    }

    /** SplitMix64 step, used to fill the key tables deterministically. */
    private static long mix(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    public static long getHashKey(Board board, Color activeColor) {
        long key = 0;
        long occupiedBB = board.getOccupiedBB();
        while(occupiedBB != 0) {
            int square = BitUtils.bitScanForward(occupiedBB);
            occupiedBB &= occupiedBB - 1;
            Piece piece = board.getPiece(square);
            int pieceIndex = (piece.isWhite() ? 0 : 6) + piece.type().ordinal();
            key ^= PIECE_SQUARE[pieceIndex][square];
        }
        if(activeColor.isBlack()) {
            key ^= BLACK_TO_MOVE;
        }
        if(board.canCastleKingSide(Color.WHITE)) {
            key ^= WHITE_KING_SIDE_CASTLE;
        }
        if(board.canCastleQueenSide(Color.WHITE)) {
            key ^= WHITE_QUEEN_SIDE_CASTLE;
        }
        if(board.canCastleKingSide(Color.BLACK)) {
            key ^= BLACK_KING_SIDE_CASTLE;
        }
        if(board.canCastleQueenSide(Color.BLACK)) {
            key ^= BLACK_QUEEN_SIDE_CASTLE;
        }
        if(board.getEnPassantIndex() != -1) {
            key ^= EN_PASSANT_SQUARE[board.getEnPassantIndex()];
        }
        return key;
    }

    public static String print(long key) {
        return String.format("%016x", key);
    }

    private ZobristHashKeys() {
    }
}
