package max.chess.rules.game;

import max.chess.rules.common.ChessException;
import max.chess.rules.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class DrawDetectorTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "4k3/8/8/8/8/8/8/4K3 w - - 0 1",      // bare kings
            "4k3/8/8/8/8/8/8/2B1K3 w - - 0 1",    // bishop
            "4k3/8/8/8/8/8/8/1N2K3 w - - 0 1",    // knight
            "4kn2/8/8/8/8/8/8/4K3 w - - 0 1",     // black knight
    })
    public void insufficientMaterialIsDetected(String fen) throws ChessException {
        assert DrawDetector.isInsufficientMaterial(FENUtils.getBoardFrom(fen));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "4k3/8/8/8/8/8/8/B1B1K3 w - - 0 1",   // a1 and c1 bishops, both dark squares
            "4kb2/8/8/8/8/8/8/B3K3 w - - 0 1",   // opposite sides, both dark squares
    })
    public void bishopsOnOneSquareColorAreADeadPosition(String fen) throws ChessException {
        assert DrawDetector.isInsufficientMaterial(FENUtils.getBoardFrom(fen));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "4k3/8/8/8/8/8/4P3/4K3 w - - 0 1",    // pawn
            "4k3/8/8/8/8/8/8/R3K3 w - - 0 1",     // rook
            "3qk3/8/8/8/8/8/8/4K3 w - - 0 1",     // queen
            "4k3/8/8/8/8/8/8/1NN1K3 w - - 0 1",   // two knights
            "4kb2/8/8/8/8/8/8/1N2K3 w - - 0 1",   // knight against bishop
            "2b5/4k3/8/8/8/8/8/2B1K3 w - - 0 1",  // bishops on opposite colors
            "4k3/8/8/8/8/8/8/2B1KB2 w - - 0 1",   // bishop pair
    })
    public void matingMaterialIsNotADeadPosition(String fen) throws ChessException {
        assert !DrawDetector.isInsufficientMaterial(FENUtils.getBoardFrom(fen));
    }

    @Test
    public void moveRuleAndRepetitionThresholds() {
        GameConfig config = GameConfig.DEFAULT;

        assert !DrawDetector.canClaimMoveRule(99, config);
        assert DrawDetector.canClaimMoveRule(100, config);
        assert !DrawDetector.isAutomaticMoveRule(149, config);
        assert DrawDetector.isAutomaticMoveRule(150, config);
        assert !DrawDetector.canClaimRepetition(2, config);
        assert DrawDetector.canClaimRepetition(3, config);
        assert !DrawDetector.isAutomaticRepetition(4, config);
        assert DrawDetector.isAutomaticRepetition(5, config);
    }
}
