package max.chess.rules.game;

import java.util.Objects;
import java.util.function.Consumer;

public final class GameConfig {
    public static final GameConfig DEFAULT = new Builder().build();

    public final boolean debug;
    public final Consumer<String> logSink;

    // Draw thresholds, in plies for the move rules
    public final int claimableMoveRulePlies;    // 50-move rule, claimable
    public final int automaticMoveRulePlies;    // 75-move rule, ends the game
    public final int claimableRepetitions;      // threefold repetition, claimable
    public final int automaticRepetitions;      // fivefold repetition, ends the game

    private GameConfig(Builder b) {
        debug = b.debug;
        logSink = b.logSink;
        claimableMoveRulePlies = b.claimableMoveRulePlies;
        automaticMoveRulePlies = b.automaticMoveRulePlies;
        claimableRepetitions = b.claimableRepetitions;
        automaticRepetitions = b.automaticRepetitions;
    }

    /**
     * Defaults overridden by the JVM system properties {@code chess.rules.debug}, {@code chess.rules.fiftyMovePlies},
     * {@code chess.rules.seventyFiveMovePlies}, {@code chess.rules.threefold} and {@code chess.rules.fivefold}.
     */
    public static GameConfig fromSystemProperties() {
        Builder builder = new Builder();
        return builder
                .debug(Boolean.parseBoolean(System.getProperty("chess.rules.debug", "false")))
                .claimableMoveRulePlies(Integer.getInteger("chess.rules.fiftyMovePlies", builder.claimableMoveRulePlies))
                .automaticMoveRulePlies(Integer.getInteger("chess.rules.seventyFiveMovePlies", builder.automaticMoveRulePlies))
                .claimableRepetitions(Integer.getInteger("chess.rules.threefold", builder.claimableRepetitions))
                .automaticRepetitions(Integer.getInteger("chess.rules.fivefold", builder.automaticRepetitions))
                .build();
    }

    void log(String message) {
        if(debug) {
            logSink.accept(message);
        }
    }

    @Override
    public String toString() {
        return "GameConfig{" +
                "debug=" + debug +
                ", claimableMoveRulePlies=" + claimableMoveRulePlies +
                ", automaticMoveRulePlies=" + automaticMoveRulePlies +
                ", claimableRepetitions=" + claimableRepetitions +
                ", automaticRepetitions=" + automaticRepetitions +
                '}';
    }

    public static class Builder {
        private boolean debug = false;
        private Consumer<String> logSink = System.err::println;

        private int claimableMoveRulePlies = 100;
        private int automaticMoveRulePlies = 150;
        private int claimableRepetitions = 3;
        private int automaticRepetitions = 5;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder logSink(Consumer<String> v){logSink=Objects.requireNonNull(v, "logSink");return this;}
        public Builder claimableMoveRulePlies(int v){claimableMoveRulePlies=v;return this;}
        public Builder automaticMoveRulePlies(int v){automaticMoveRulePlies=v;return this;}
        public Builder claimableRepetitions(int v){claimableRepetitions=v;return this;}
        public Builder automaticRepetitions(int v){automaticRepetitions=v;return this;}

        public GameConfig build() {
            if(claimableMoveRulePlies <= 0 || claimableRepetitions <= 1) {
                throw new IllegalArgumentException("Draw thresholds must be positive and repetitions at least 2");
            }
            if(claimableMoveRulePlies > automaticMoveRulePlies) {
                throw new IllegalArgumentException("Claimable move rule (" + claimableMoveRulePlies
                        + " plies) cannot come after the automatic one (" + automaticMoveRulePlies + " plies)");
            }
            if(claimableRepetitions > automaticRepetitions) {
                throw new IllegalArgumentException("Claimable repetition count (" + claimableRepetitions
                        + ") cannot exceed the automatic one (" + automaticRepetitions + ")");
            }
            return new GameConfig(this);
        }
    }
}
