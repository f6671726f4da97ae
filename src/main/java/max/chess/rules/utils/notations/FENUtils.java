package max.chess.rules.utils.notations;

import max.chess.rules.common.ChessException;
import max.chess.rules.common.Color;
import max.chess.rules.common.Piece;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Position;
import max.chess.rules.game.Game;
import max.chess.rules.game.GameConfig;
import max.chess.rules.game.board.Board;
import max.chess.rules.movegen.MoveGenerator;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public class FENUtils {
    private static final String FEN_PIECE_LETTERS = "PNBRQKpnbrqk";

    private record ParsedFEN(Board board, Color activeColor, int halfMoveClock, int fullMoveNumber) {}

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    public static Game getGameFrom(String FEN, GameConfig config) throws ChessException {
        ParsedFEN parsed = parse(FEN);
        return new Game(parsed.board(), parsed.activeColor(), parsed.halfMoveClock(), parsed.fullMoveNumber(), config);
    }

    /**
     * Board part of a FEN record: piece placement, castling rights and en passant target. Clocks and active color
     * are validated but not returned.
     */
    public static Board getBoardFrom(String FEN) throws ChessException {
        return parse(FEN).board();
    }

    private static ParsedFEN parse(String FEN) throws ChessException {
        if(FEN == null) {
            throw invalid("Missing FEN record");
        }
        String[] fenFields = FEN.trim().split("\\s+");
        if(fenFields.length != 6 && fenFields.length != 4) {
            throw invalid("Invalid FEN record '" + FEN + "': expected 6 fields, got " + fenFields.length);
        }

        Board board = new Board();
        injectPiecePlacement(board, fenFields[0]);
        Color activeColor = parseCurrentTurn(fenFields[1]);
        injectCastlingRights(board, fenFields[2]);
        injectEnPassantSquare(board, fenFields[3], activeColor);
        int halfMoveClock = fenFields.length == 6 ? parseCounter(fenFields[4], "half-move clock", 0) : 0;
        int fullMoveNumber = fenFields.length == 6 ? parseCounter(fenFields[5], "full-move number", 1) : 1;

        validatePosition(board, activeColor);
        return new ParsedFEN(board, activeColor, halfMoveClock, fullMoveNumber);
    }

    public static String getFENFromGame(Game game) {
        return getFENFrom(game.board(), game.getActiveColor(), game.getHalfMoveClock(), game.getFullMoveNumber());
    }

    public static String getFENFrom(Board board, Color activeColor, int halfMoveClock, int fullMoveNumber) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(board, fen);
        fen.append(' ').append(activeColor.toFENChar());
        injectCastlingRights(board, fen);
        injectEnPassantSquare(board, fen);
        fen.append(' ').append(halfMoveClock);
        fen.append(' ').append(fullMoveNumber);
        return fen.toString();
    }

    private static void injectPiecePlacement(Board board, StringBuilder fen) {
        for(int row = 7 ; row >= 0 ; row--) {
            int emptySpaceCounter = 0;
            if(row != 7) {
                fen.append('/');
            }
            for(int col = 0 ; col < 8 ; col++) {
                Piece piece = board.getPiece(row * 8 + col);
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.toFENChar());
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectCastlingRights(Board board, StringBuilder fen) {
        fen.append(' ');
        int lengthBefore = fen.length();
        if(board.canCastleKingSide(Color.WHITE)) {
            fen.append('K');
        }
        if(board.canCastleQueenSide(Color.WHITE)) {
            fen.append('Q');
        }
        if(board.canCastleKingSide(Color.BLACK)) {
            fen.append('k');
        }
        if(board.canCastleQueenSide(Color.BLACK)) {
            fen.append('q');
        }
        if(fen.length() == lengthBefore) {
            fen.append('-');
        }
    }

    private static void injectEnPassantSquare(Board board, StringBuilder fen) {
        fen.append(' ');
        int enPassantIndex = board.getEnPassantIndex();
        if(enPassantIndex != -1) {
            fen.append(Position.at(enPassantIndex));
        } else {
            fen.append('-');
        }
    }

    private static void injectPiecePlacement(Board board, String piecePlacement) throws ChessException {
        String[] piecePlacementRows = piecePlacement.split("/", -1);
        if(piecePlacementRows.length != 8) {
            throw invalid("Piece placement '" + piecePlacement + "' should describe 8 rows");
        }
        int row = 7;
        for(String piecePlacementRow : piecePlacementRows) {
            int col = 0;
            for(char character : piecePlacementRow.toCharArray()) {
                if(character >= '1' && character <= '8') {
                    col += character - '0';
                } else if(FEN_PIECE_LETTERS.indexOf(character) != -1) {
                    if(col > 7) {
                        throw invalid("Row '" + piecePlacementRow + "' describes more than 8 squares");
                    }
                    board.setPiece(row * 8 + col, Piece.fromFENChar(character));
                    col++;
                } else {
                    throw invalid("Unknown piece letter '" + character + "' in '" + piecePlacementRow + "'");
                }
            }
            if(col != 8) {
                throw invalid("Row '" + piecePlacementRow + "' describes " + col + " squares instead of 8");
            }
            row--;
        }
    }

    private static Color parseCurrentTurn(String currentTurn) throws ChessException {
        return switch (currentTurn) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw invalid("Active color should be 'w' or 'b', got '" + currentTurn + "'");
        };
    }

    // A right whose king or rook is not home anymore is dropped
    private static void injectCastlingRights(Board board, String castlingRights) throws ChessException {
        if("-".equals(castlingRights)) {
            return;
        }
        for(char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> board.setCanCastleKingSide(Color.WHITE,
                        isHome(board, Board.WHITE_KING_START, Board.WHITE_KING_SIDE_ROOK, Color.WHITE));
                case 'Q' -> board.setCanCastleQueenSide(Color.WHITE,
                        isHome(board, Board.WHITE_KING_START, Board.WHITE_QUEEN_SIDE_ROOK, Color.WHITE));
                case 'k' -> board.setCanCastleKingSide(Color.BLACK,
                        isHome(board, Board.BLACK_KING_START, Board.BLACK_KING_SIDE_ROOK, Color.BLACK));
                case 'q' -> board.setCanCastleQueenSide(Color.BLACK,
                        isHome(board, Board.BLACK_KING_START, Board.BLACK_QUEEN_SIDE_ROOK, Color.BLACK));
                default -> throw invalid("Unknown castling right '" + character + "' in '" + castlingRights + "'");
            }
        }
    }

    private static boolean isHome(Board board, int kingIndex, int rookIndex, Color color) {
        return new Piece(PieceType.KING, color).equals(board.getPiece(kingIndex))
                && new Piece(PieceType.ROOK, color).equals(board.getPiece(rookIndex));
    }

    private static void injectEnPassantSquare(Board board, String enPassantSquare, Color activeColor) throws ChessException {
        if("-".equals(enPassantSquare)) {
            board.setEnPassantIndex(-1);
            return;
        }
        Position position;
        try {
            position = Position.parse(enPassantSquare);
        } catch (ChessException e) {
            throw new ChessException(ChessException.Kind.INVALID_FEN, "Invalid en passant square: " + e.getMessage(), e);
        }
        // The target sits right behind the pawn of the side which just moved
        int expectedRow = activeColor.isWhite() ? 5 : 2;
        if(position.row != expectedRow) {
            throw invalid("En passant square " + position + " is not possible with " + activeColor + " to move");
        }
        // The pawn went from the start square, over the target, to the square in front of it
        Color pushedColor = activeColor.getOppositeColor();
        int pawnIndex = position.index + 8 * pushedColor.pawnDirection();
        int startIndex = position.index - 8 * pushedColor.pawnDirection();
        if(!board.isEmpty(position.index) || !board.isEmpty(startIndex)
                || !new Piece(PieceType.PAWN, pushedColor).equals(board.getPiece(pawnIndex))) {
            throw invalid("En passant square " + position + " does not follow a " + pushedColor + " pawn double push");
        }
        board.setEnPassantIndex(position.index);
    }

    private static int parseCounter(String counter, String name, int minimum) throws ChessException {
        int value;
        try {
            value = Integer.parseInt(counter);
        } catch (NumberFormatException e) {
            throw new ChessException(ChessException.Kind.INVALID_FEN, "Invalid " + name + " '" + counter + "'", e);
        }
        if(value < minimum) {
            throw invalid("The " + name + " cannot be lower than " + minimum + ", got " + value);
        }
        return value;
    }

    private static void validatePosition(Board board, Color activeColor) throws ChessException {
        for(Color color : Color.values()) {
            int kings = 0;
            for(int index = 0 ; index < 64 ; index++) {
                Piece piece = board.getPiece(index);
                if(piece == null || piece.color() != color) {
                    continue;
                }
                if(piece.is(PieceType.KING)) {
                    kings++;
                } else if(piece.is(PieceType.PAWN) && (index < 8 || index >= 56)) {
                    throw invalid(color + " pawn on " + Position.at(index) + " cannot stand on the first or last row");
                }
            }
            if(kings != 1) {
                throw invalid(color + " should have exactly one king, found " + kings);
            }
        }
        if(MoveGenerator.isKingInCheck(board, activeColor.getOppositeColor())) {
            throw invalid(activeColor.getOppositeColor() + " is in check while " + activeColor + " is on move");
        }
    }

    private static ChessException invalid(String message) {
        return new ChessException(ChessException.Kind.INVALID_FEN, message);
    }
}
