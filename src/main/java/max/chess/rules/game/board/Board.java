package max.chess.rules.game.board;

import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;
import max.chess.rules.utils.BitUtils;

/**
 * Flat 64-slot board (index = row * 8 + col) plus the auxiliary state the move rules need: castling rights for
 * each side and the en passant target square.
 * <p>
 * Occupancy bitboards are kept in sync with the slots so that move generation can mask destinations cheaply.
 * Copying a board is a plain value copy, which is what the legality filter relies on.
 */
public class Board {
    public static final int WHITE_KING_START = 4;
    public static final int BLACK_KING_START = 60;
    public static final int WHITE_KING_SIDE_ROOK = 7;
    public static final int WHITE_QUEEN_SIDE_ROOK = 0;
    public static final int BLACK_KING_SIDE_ROOK = 63;
    public static final int BLACK_QUEEN_SIDE_ROOK = 56;

    private final Piece[] pieceAt;

    private long whiteBB = 0;
    private long blackBB = 0;

    private boolean whiteCanCastleKingSide = false;
    private boolean whiteCanCastleQueenSide = false;
    private boolean blackCanCastleKingSide = false;
    private boolean blackCanCastleQueenSide = false;

    private int enPassantIndex = -1;

    public Board() {
        this.pieceAt = new Piece[64];
    }

    public Board(Board other) {
        this.pieceAt = other.pieceAt.clone();
        this.whiteBB = other.whiteBB;
        this.blackBB = other.blackBB;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.enPassantIndex = other.enPassantIndex;
    }

    public Piece getPiece(int index) {
        return pieceAt[index];
    }

    public Piece getPiece(Position position) {
        return pieceAt[position.index];
    }

    public boolean isEmpty(int index) {
        return pieceAt[index] == null;
    }

    public void setPiece(int index, Piece piece) {
        removePiece(index);
        if(piece == null) {
            return;
        }
        pieceAt[index] = piece;
        long positionBB = BitUtils.getPositionIndexBitMask(index);
        if(piece.isWhite()) {
            whiteBB |= positionBB;
        } else {
            blackBB |= positionBB;
        }
    }

    public Piece removePiece(int index) {
        Piece removed = pieceAt[index];
        pieceAt[index] = null;
        long positionBB = BitUtils.getPositionIndexBitMask(index);
        whiteBB &= ~positionBB;
        blackBB &= ~positionBB;
        return removed;
    }

    public Piece[] getSquares() {
        return pieceAt.clone();
    }

    public long getOccupiedBB() {
        return whiteBB | blackBB;
    }

    public long getColorBB(Color color) {
        return color.isWhite() ? whiteBB : blackBB;
    }

    public int findKing(Color color) {
        long colorBB = getColorBB(color);
        while(colorBB != 0) {
            int index = BitUtils.bitScanForward(colorBB);
            colorBB &= colorBB - 1;
            if(pieceAt[index].is(PieceType.KING)) {
                return index;
            }
        }
        return -1;
    }

    public int countPieces() {
        return BitUtils.bitCount(getOccupiedBB());
    }

    public boolean canCastleKingSide(Color color) {
        return color.isWhite() ? whiteCanCastleKingSide : blackCanCastleKingSide;
    }

    public boolean canCastleQueenSide(Color color) {
        return color.isWhite() ? whiteCanCastleQueenSide : blackCanCastleQueenSide;
    }

    public void setCanCastleKingSide(Color color, boolean canCastle) {
        if(color.isWhite()) {
            whiteCanCastleKingSide = canCastle;
        } else {
            blackCanCastleKingSide = canCastle;
        }
    }

    public void setCanCastleQueenSide(Color color, boolean canCastle) {
        if(color.isWhite()) {
            whiteCanCastleQueenSide = canCastle;
        } else {
            blackCanCastleQueenSide = canCastle;
        }
    }

    public int getEnPassantIndex() {
        return enPassantIndex;
    }

    public void setEnPassantIndex(int enPassantIndex) {
        this.enPassantIndex = enPassantIndex;
    }

    /**
     * Applies a move which has already been validated, with all its side effects: capture (including the en passant
     * one), rook relocation when castling, castling rights invalidation and en passant target update.
     * <p>
     * A pawn reaching the last row stays a pawn: the promotion is applied separately through {@link #promote}.
     */
    public MovePlayed playMove(int startPosition, int endPosition) {
        Piece piece = pieceAt[startPosition];
        if(piece == null) {
            throw new IllegalStateException("No piece to move on " + Position.at(startPosition));
        }
        Color color = piece.color();
        int previousEnPassantIndex = enPassantIndex;

        boolean castleKingSide = false;
        boolean castleQueenSide = false;
        if(piece.is(PieceType.KING)) {
            // We have to assume we castle as it must be a legal move
            if(endPosition - startPosition == 2) {
                castleKingSide = true;
            } else if(startPosition - endPosition == 2) {
                castleQueenSide = true;
            }
        }

        boolean enPassant = false;
        int pieceEatenIndex = endPosition;
        if(piece.is(PieceType.PAWN) && endPosition == enPassantIndex && (endPosition - startPosition) % 8 != 0) {
            // The captured pawn sits behind the target square
            pieceEatenIndex = endPosition - 8 * color.pawnDirection();
            enPassant = true;
        }
        Piece pieceEaten = pieceAt[pieceEatenIndex];
        if(pieceEaten == null) {
            pieceEatenIndex = -1;
        } else {
            removePiece(pieceEatenIndex);
        }

        removePiece(startPosition);
        setPiece(endPosition, piece);

        if(castleKingSide) {
            int rookStart = startPosition + 3;
            setPiece(startPosition + 1, removePiece(rookStart));
        } else if(castleQueenSide) {
            int rookStart = startPosition - 4;
            setPiece(startPosition - 1, removePiece(rookStart));
        }

        if(piece.is(PieceType.PAWN) && Math.abs(endPosition - startPosition) == 16) {
            setEnPassantIndex((startPosition + endPosition) / 2);
        } else {
            setEnPassantIndex(-1);
        }

        updateCastlingRights(piece, startPosition, endPosition);

        return new MovePlayed(piece, startPosition, endPosition, pieceEaten, pieceEatenIndex, enPassant,
                castleKingSide, castleQueenSide, previousEnPassantIndex);
    }

    // Rights are only ever removed: a piece standing again on a rook corner later does not bring them back
    private void updateCastlingRights(Piece piece, int startPosition, int endPosition) {
        if(piece.is(PieceType.KING)) {
            setCanCastleKingSide(piece.color(), false);
            setCanCastleQueenSide(piece.color(), false);
        }
        if(startPosition == WHITE_KING_SIDE_ROOK || endPosition == WHITE_KING_SIDE_ROOK) {
            whiteCanCastleKingSide = false;
        }
        if(startPosition == WHITE_QUEEN_SIDE_ROOK || endPosition == WHITE_QUEEN_SIDE_ROOK) {
            whiteCanCastleQueenSide = false;
        }
        if(startPosition == BLACK_KING_SIDE_ROOK || endPosition == BLACK_KING_SIDE_ROOK) {
            blackCanCastleKingSide = false;
        }
        if(startPosition == BLACK_QUEEN_SIDE_ROOK || endPosition == BLACK_QUEEN_SIDE_ROOK) {
            blackCanCastleQueenSide = false;
        }
    }

    public void promote(int index, PieceType promotion) {
        Piece pawn = pieceAt[index];
        if(pawn == null || !pawn.is(PieceType.PAWN)) {
            throw new IllegalStateException("No pawn to promote on " + Position.at(index));
        }
        setPiece(index, new Piece(promotion, pawn.color()));
    }
}
