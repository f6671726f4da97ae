package max.chess.rules.game;

import max.chess.rules.common.ChessException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GameConfigTest {

    @AfterEach
    public void clearProperties() {
        System.clearProperty("chess.rules.debug");
        System.clearProperty("chess.rules.fiftyMovePlies");
        System.clearProperty("chess.rules.threefold");
    }

    @Test
    public void defaultsAreTheFideValues() {
        GameConfig config = GameConfig.DEFAULT;

        assert !config.debug;
        assertEquals(100, config.claimableMoveRulePlies);
        assertEquals(150, config.automaticMoveRulePlies);
        assertEquals(3, config.claimableRepetitions);
        assertEquals(5, config.automaticRepetitions);
    }

    @Test
    public void systemPropertiesOverrideDefaults() {
        // Given
        System.setProperty("chess.rules.debug", "true");
        System.setProperty("chess.rules.fiftyMovePlies", "80");
        System.setProperty("chess.rules.threefold", "2");

        // When
        GameConfig config = GameConfig.fromSystemProperties();

        // Then
        assert config.debug;
        assertEquals(80, config.claimableMoveRulePlies);
        assertEquals(150, config.automaticMoveRulePlies);
        assertEquals(2, config.claimableRepetitions);
        assertEquals(5, config.automaticRepetitions);
    }

    @Test
    public void inconsistentThresholdsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new GameConfig.Builder().claimableMoveRulePlies(200).build());
        assertThrows(IllegalArgumentException.class,
                () -> new GameConfig.Builder().automaticRepetitions(2).build());
        assertThrows(IllegalArgumentException.class,
                () -> new GameConfig.Builder().claimableRepetitions(1).build());
        assertThrows(NullPointerException.class,
                () -> new GameConfig.Builder().logSink(null));
    }

    @Test
    public void customThresholdsDriveTheGame() throws ChessException {
        // Given
        GameConfig config = new GameConfig.Builder().claimableRepetitions(2).automaticRepetitions(2).build();
        Game game = new Game(config);

        // When
        game.makeMove("g1", "f3");
        game.makeMove("g8", "f6");
        game.makeMove("f3", "g1");
        GameState state = game.makeMove("f6", "g8");

        // Then
        assertEquals(GameState.GAME_OVER, state);
        assertEquals(GameOverReason.FIVEFOLD_REPETITION_RULE, game.getGameOverReason().orElseThrow());
    }
}
