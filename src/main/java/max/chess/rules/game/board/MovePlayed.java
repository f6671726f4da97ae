package max.chess.rules.game.board;

import max.chess.rules.common.Piece;

/**
 * What {@link Board#playMove(int, int)} did to the board. {@code pieceEaten} is null for a quiet move, and
 * {@code pieceEatenIndex} is -1 in that case (for en passant it differs from {@code endPosition}).
 */
public record MovePlayed(Piece pieceMoved, int startPosition, int endPosition, Piece pieceEaten, int pieceEatenIndex,
                         boolean enPassant, boolean castleKingSide, boolean castleQueenSide,
                         int previousEnPassantIndex) {

    public boolean isCapture() {
        return pieceEaten != null;
    }

    public boolean isCastle() {
        return castleKingSide || castleQueenSide;
    }
}
