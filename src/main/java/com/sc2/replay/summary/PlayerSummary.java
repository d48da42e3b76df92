package com.sc2.replay.summary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.sc2.replay.exception.UnknownStatCodeException;

import lombok.Getter;
import lombok.Setter;

/**
 * A player as seen in a game summary file: identity, score-screen graphs and stats.
 * Filled in by the summary decoder; the stats map keeps insertion order.
 */
@Getter
@Setter
public class PlayerSummary {

    private final int pid;
    private int teamId;
    private String race = "";
    private boolean ai;
    private long bnetId;
    private int subregion;
    private Graph armyGraph;
    private Graph incomeGraph;

    @Getter(lombok.AccessLevel.NONE)
    @Setter(lombok.AccessLevel.NONE)
    private final Map<String, Long> stats = new LinkedHashMap<>();

    public PlayerSummary(int pid) {
        this.pid = pid;
    }

    public void putStat(String shortCode, long value) {
        stats.put(shortCode, value);
    }

    public Map<String, Long> getStatValues() {
        return Collections.unmodifiableMap(stats);
    }

    /**
     * One "{label}: {value}" line per stat, in insertion order.
     *
     * @throws UnknownStatCodeException if a stored key has no label
     */
    public String getStats() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> entry : stats.entrySet()) {
            StatCode code = StatCode.fromShortCode(entry.getKey())
                    .orElseThrow(() -> new UnknownStatCodeException(entry.getKey()));
            sb.append(code.getPrettyName()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString().strip();
    }

    @Override
    public String toString() {
        if (ai) {
            return teamId + " - " + race + " - AI";
        }
        return teamId + " - " + race + " - " + subregion + "/" + bnetId + "/";
    }
}
