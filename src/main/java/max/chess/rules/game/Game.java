package max.chess.rules.game;

import max.chess.rules.common.ChessException;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.MovePlayed;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.movegen.LegalityFilter;
import max.chess.rules.movegen.MoveGenerator;
import max.chess.rules.utils.BitUtils;
import max.chess.rules.utils.notations.FENUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A game of chess played by the rules: it accepts only legal moves and detects check, checkmate, stalemate and
 * every draw condition on its own.
 * <p>
 * A game is a single mutable aggregate and is not thread-safe: one owner submits moves to it, one call at a time.
 * Every operation either succeeds or throws a {@link ChessException} without having changed anything.
 */
public class Game {
    private final GameConfig config;
    private final Board board;
    private final RepetitionCounter repetitionCounter = new RepetitionCounter();
    private final List<HistoryEntry> history = new ArrayList<>();

    private Color activeColor;
    private GameState state = GameState.IN_PROGRESS;
    private GameOverReason gameOverReason = null;
    private int halfMoveClock;
    private int fullMoveNumber;
    private int pendingPromotionIndex = -1;

    /** Standard starting position with the default configuration. */
    public Game() {
        this(GameConfig.DEFAULT);
    }

    public Game(GameConfig config) {
        this(BoardGenerator.newStandardBoard(), Color.WHITE, 0, 1, config);
    }

    /**
     * Starts a game from an arbitrary position. The board is copied. The position is classified right away, so the
     * game may start in check or even be over already.
     */
    public Game(Board board, Color activeColor, int halfMoveClock, int fullMoveNumber, GameConfig config) {
        this.board = new Board(board);
        this.activeColor = activeColor;
        this.halfMoveClock = halfMoveClock;
        this.fullMoveNumber = fullMoveNumber;
        this.config = config;
        repetitionCounter.inc(zobristKey());
        updateGameState();
    }

    public static Game fromFen(String fen) throws ChessException {
        return fromFen(fen, GameConfig.DEFAULT);
    }

    public static Game fromFen(String fen, GameConfig config) throws ChessException {
        return FENUtils.getGameFrom(fen, config);
    }

    public GameState makeMove(String from, String to) throws ChessException {
        return makeMove(Position.parse(from), Position.parse(to));
    }

    /**
     * Plays the piece on {@code from} to {@code to} and returns the resulting state.
     *
     * @throws ChessException {@code INVALID_POSITION} for a missing square, {@code GAME_ALREADY_OVER} once the game
     *                        is over, {@code PROMOTION_PENDING} while a promotion choice is awaited,
     *                        {@code WRONG_TURN} if {@code from} does not hold a piece of the active color and
     *                        {@code INVALID_MOVE} if {@code to} is not a legal destination of that piece
     */
    public GameState makeMove(Position from, Position to) throws ChessException {
        if(from == null || to == null) {
            throw new ChessException(ChessException.Kind.INVALID_POSITION, "Both squares of a move are required");
        }
        if(state == GameState.GAME_OVER) {
            throw new ChessException(ChessException.Kind.GAME_ALREADY_OVER,
                    "The game is over (" + gameOverReason + "), no move can be made");
        }
        if(state == GameState.WAITING_ON_PROMOTION_CHOICE) {
            throw new ChessException(ChessException.Kind.PROMOTION_PENDING,
                    "The pawn on " + Position.at(pendingPromotionIndex) + " must be promoted first");
        }

        Piece piece = board.getPiece(from);
        if(piece == null) {
            throw new ChessException(ChessException.Kind.WRONG_TURN, "There is no piece on " + from);
        }
        if(piece.color() != activeColor) {
            throw new ChessException(ChessException.Kind.WRONG_TURN,
                    "It is " + activeColor + "'s turn, the " + piece + " on " + from + " cannot move");
        }
        if(!LegalityFilter.isLegalMove(board, from.index, to.index)) {
            throw new ChessException(ChessException.Kind.INVALID_MOVE,
                    "Illegal move " + from + to + ": the " + piece.type() + " cannot move this way or it would leave its king in check");
        }

        String fenBeforeMove = getFen();
        MovePlayed movePlayed = board.playMove(from.index, to.index);
        history.add(new HistoryEntry(fenBeforeMove, from, to, piece, movePlayed.pieceEaten(), null));

        if(piece.is(PieceType.PAWN) || movePlayed.isCapture()) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }
        if(activeColor.isBlack()) {
            fullMoveNumber++;
        }
        config.log(activeColor + " played " + from + to + (movePlayed.isCapture() ? " capturing " + movePlayed.pieceEaten() : ""));

        if(piece.is(PieceType.PAWN) && to.row == activeColor.promotionRow()) {
            pendingPromotionIndex = to.index;
            state = GameState.WAITING_ON_PROMOTION_CHOICE;
            config.log("Waiting on promotion choice for the pawn on " + to);
            return state;
        }

        return completeMove();
    }

    public GameState setPromotion(String pieceType) throws ChessException {
        PieceType parsed;
        try {
            parsed = PieceType.fromString(pieceType);
        } catch (IllegalArgumentException e) {
            throw new ChessException(ChessException.Kind.INVALID_PROMOTION_CHOICE, e.getMessage(), e);
        }
        return setPromotion(parsed);
    }

    /**
     * Promotes the pawn which just reached the last row, then hands the turn over.
     *
     * @throws ChessException {@code GAME_ALREADY_OVER} once the game is over, {@code NO_PROMOTION_PENDING} if no
     *                        promotion is awaited and {@code INVALID_PROMOTION_CHOICE} for a pawn or a king
     */
    public GameState setPromotion(PieceType pieceType) throws ChessException {
        if(state == GameState.GAME_OVER) {
            throw new ChessException(ChessException.Kind.GAME_ALREADY_OVER, "The game is over (" + gameOverReason + ")");
        }
        if(state != GameState.WAITING_ON_PROMOTION_CHOICE) {
            throw new ChessException(ChessException.Kind.NO_PROMOTION_PENDING,
                    "The game is not waiting for a promotion, its state is " + state);
        }
        if(pieceType == null || !pieceType.isValidPromotion()) {
            throw new ChessException(ChessException.Kind.INVALID_PROMOTION_CHOICE,
                    "A pawn cannot be promoted to " + (pieceType == null ? "nothing" : "a " + pieceType));
        }

        board.promote(pendingPromotionIndex, pieceType);
        history.set(history.size() - 1, history.get(history.size() - 1).withPromotion(pieceType));
        config.log(activeColor + " promoted the pawn on " + Position.at(pendingPromotionIndex) + " to " + pieceType);
        pendingPromotionIndex = -1;

        return completeMove();
    }

    /** Ends the game immediately as a draw agreed by both players. */
    public void submitDraw() throws ChessException {
        if(state == GameState.GAME_OVER) {
            throw new ChessException(ChessException.Kind.GAME_ALREADY_OVER, "The game is over (" + gameOverReason + ")");
        }
        pendingPromotionIndex = -1;
        gameOver(GameOverReason.MUTUAL_DRAW);
    }

    /** True once 50 moves (100 plies) went by without a pawn move or a capture. Claimable, never automatic. */
    public boolean canEnact50MoveRule() {
        return DrawDetector.canClaimMoveRule(halfMoveClock, config);
    }

    /** True once the current position occurred three times. Claimable, never automatic. */
    public boolean canEnactThreefoldRepetitionRule() {
        return DrawDetector.canClaimRepetition(getRepetitionCount(), config);
    }

    // Hand the turn over, record the position and classify it
    private GameState completeMove() {
        activeColor = activeColor.getOppositeColor();
        repetitionCounter.inc(zobristKey());
        updateGameState();
        return state;
    }

    private void updateGameState() {
        boolean inCheck = MoveGenerator.isKingInCheck(board, activeColor);
        if(!LegalityFilter.hasAnyLegalMove(board, activeColor)) {
            gameOver(inCheck ? GameOverReason.CHECKMATE : GameOverReason.STALEMATE);
            return;
        }
        if(DrawDetector.isInsufficientMaterial(board)) {
            gameOver(GameOverReason.DEAD_POSITION);
            return;
        }
        if(DrawDetector.isAutomaticRepetition(getRepetitionCount(), config)) {
            gameOver(GameOverReason.FIVEFOLD_REPETITION_RULE);
            return;
        }
        if(DrawDetector.isAutomaticMoveRule(halfMoveClock, config)) {
            gameOver(GameOverReason.SEVENTY_FIVE_MOVE_RULE);
            return;
        }

        GameState newState = inCheck ? GameState.CHECK : GameState.IN_PROGRESS;
        if(newState != state) {
            config.log("Game state " + state + " -> " + newState);
        }
        state = newState;
    }

    private void gameOver(GameOverReason reason) {
        state = GameState.GAME_OVER;
        gameOverReason = reason;
        config.log("Game over: " + reason);
    }

    private long zobristKey() {
        return ZobristHashKeys.getHashKey(board, activeColor);
    }

    /** How many times the current position was reached, counting this occurrence. */
    public int getRepetitionCount() {
        return repetitionCounter.get(zobristKey());
    }

    /** Snapshot of the 64 squares, index = row * 8 + col, null for an empty square. */
    public Piece[] getBoard() {
        return board.getSquares();
    }

    public Optional<Piece> getPieceAt(Position position) {
        return Optional.ofNullable(board.getPiece(position));
    }

    public Color getActiveColor() {
        return activeColor;
    }

    public GameState getGameState() {
        return state;
    }

    /** Present only once the game is over. */
    public Optional<GameOverReason> getGameOverReason() {
        return Optional.ofNullable(gameOverReason);
    }

    public boolean isGameOver() {
        return state == GameState.GAME_OVER;
    }

    public boolean isCheck() {
        return state == GameState.CHECK;
    }

    public boolean isCheckmate() {
        return gameOverReason == GameOverReason.CHECKMATE;
    }

    public int getHalfMoveClock() {
        return halfMoveClock;
    }

    public int getFullMoveNumber() {
        return fullMoveNumber;
    }

    public Optional<Position> getEnPassantTarget() {
        int enPassantIndex = board.getEnPassantIndex();
        return enPassantIndex == -1 ? Optional.empty() : Optional.of(Position.at(enPassantIndex));
    }

    public boolean canCastleKingSide(Color color) {
        return board.canCastleKingSide(color);
    }

    public boolean canCastleQueenSide(Color color) {
        return board.canCastleQueenSide(color);
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public GameConfig getConfig() {
        return config;
    }

    public String getFen() {
        return FENUtils.getFENFromGame(this);
    }

    /**
     * Legal destinations of the piece on {@code position}. Empty when the square is empty, holds a piece of the side
     * not on move, or when the game is over or waiting on a promotion choice.
     */
    public List<Position> getPossibleMoves(Position position) {
        return BitUtils.toPositions(getPossibleMovesBB(position));
    }

    public List<Position> getPossibleMoves(String square) throws ChessException {
        return getPossibleMoves(Position.parse(square));
    }

    public List<Position> getPossibleCaptureMoves(Position position) {
        return BitUtils.toPositions(getPossibleMovesBB(position) & getCaptureTargetsBB(position));
    }

    public List<Position> getPossibleNonCaptureMoves(Position position) {
        return BitUtils.toPositions(getPossibleMovesBB(position) & ~getCaptureTargetsBB(position));
    }

    private long getPossibleMovesBB(Position position) {
        if(position == null || (state != GameState.IN_PROGRESS && state != GameState.CHECK)) {
            return 0;
        }
        Piece piece = board.getPiece(position);
        if(piece == null || piece.color() != activeColor) {
            return 0;
        }
        return LegalityFilter.getLegalMovesBB(board, position.index);
    }

    // Enemy pieces, plus the en passant target when the piece moving is a pawn
    private long getCaptureTargetsBB(Position position) {
        long targetsBB = board.getColorBB(activeColor.getOppositeColor());
        Piece piece = position == null ? null : board.getPiece(position);
        if(piece != null && piece.is(PieceType.PAWN) && board.getEnPassantIndex() != -1) {
            targetsBB |= BitUtils.getPositionIndexBitMask(board.getEnPassantIndex());
        }
        return targetsBB;
    }

    // Read-only use by the notation utilities
    public Board board() {
        return new Board(board);
    }

    @Override
    public String toString() {
        return "Game{" + getFen() + ", " + state + (gameOverReason == null ? "" : " " + gameOverReason) + '}';
    }
}
