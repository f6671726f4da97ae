package max.chess.rules.game;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

/**
 * Ordered history of position fingerprints with an occurrence count per fingerprint.
 * Nothing is ever forgotten: a pawn move or a capture makes older positions unreachable, it does not clear them.
 */
public final class RepetitionCounter {
    private final LongArrayList history = new LongArrayList();
    private final Long2IntOpenHashMap counts = new Long2IntOpenHashMap();

    public RepetitionCounter() {
        counts.defaultReturnValue(0);
    }

    public void inc(long key) {
        history.add(key);
        counts.addTo(key, 1);
    }

    /** Current count (0 if absent). */
    public int get(long key) {
        return counts.get(key);
    }

    public int size() {
        return history.size();
    }

    public LongList history() {
        return LongLists.unmodifiable(history);
    }
}
