package com.sc2.replay.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/**
 * A team of players in join order, with the game result for the team.
 *
 * Players hold a back reference to their team which is maintained here: {@link #addPlayer}
 * sets it, {@link #removePlayer} clears it.
 */
@Getter
public class Team implements Iterable<Player> {

    private final int number;

    @Getter(lombok.AccessLevel.NONE)
    private final List<Player> players = new ArrayList<>();

    /**
     * Single source of truth for the result of every player on the team.
     */
    @Setter
    @NonNull
    private TeamResult result = TeamResult.UNKNOWN;

    /**
     * Non-random pick races in join order, like "PZ". Assembled by the caller.
     */
    @Setter
    @NonNull
    private String lineup = "";

    public Team(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Team number must be at least 1: " + number);
        }
        this.number = number;
    }

    /**
     * Append a player, moving it off any team it was on before.
     */
    public void addPlayer(@NonNull Player player) {
        if (player.hasTeam()) {
            Team current = player.getTeam();
            if (current == this) {
                return;
            }
            current.removePlayer(player);
        }
        players.add(player);
        player.setTeam(this);
    }

    public boolean removePlayer(@NonNull Player player) {
        boolean removed = players.remove(player);
        if (removed) {
            player.setTeam(null);
        }
        return removed;
    }

    public List<Player> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public int size() {
        return players.size();
    }

    @Override
    public Iterator<Player> iterator() {
        return getPlayers().iterator();
    }

    /**
     * SHA-256 (lowercase hex) of the players' profile urls, sorted and comma joined.
     * Recomputed on every call so it always reflects the current membership.
     */
    public String getHash() {
        String raw = players.stream()
                .map(Player::getUrl)
                .sorted()
                .collect(Collectors.joining(","));
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "Team " + number + ": " + players.stream()
                .map(Player::getName)
                .collect(Collectors.joining(", "));
    }
}
