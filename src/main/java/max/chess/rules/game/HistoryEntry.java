package max.chess.rules.game;

import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;

import java.util.Optional;

/**
 * One move of the game as recorded by {@link Game}: the position before the move (FEN), the squares, the piece
 * that moved, the piece it captured (null when none) and the promotion chosen (null when none, or not chosen yet).
 */
public record HistoryEntry(String fen, Position from, Position to, Piece pieceMoved, Piece pieceCaptured,
                           PieceType promotion) {

    public Optional<Piece> captured() {
        return Optional.ofNullable(pieceCaptured);
    }

    public Optional<PieceType> promotedTo() {
        return Optional.ofNullable(promotion);
    }

    HistoryEntry withPromotion(PieceType pieceType) {
        return new HistoryEntry(fen, from, to, pieceMoved, pieceCaptured, pieceType);
    }

    @Override
    public String toString() {
        return "" + from + to + (promotion == null ? "" : String.valueOf(promotion.letter()));
    }
}
