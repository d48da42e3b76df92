package com.sc2.replay.identity;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Team membership and hashing.
 */
class TeamTest {

    @Test
    void testHashIsIndependentOfJoinOrder() {
        Team first = new Team(1);
        first.addPlayer(PlayerTest.identified(1, "bob", 200));
        first.addPlayer(PlayerTest.identified(2, "alice", 100));

        Team second = new Team(2);
        second.addPlayer(PlayerTest.identified(2, "alice", 100));
        second.addPlayer(PlayerTest.identified(1, "bob", 200));

        assertThat(first.getHash()).isEqualTo(second.getHash());
    }

    @Test
    void testHashMatchesSortedJoinedUrls() throws Exception {
        Team team = new Team(1);
        Player bob = PlayerTest.identified(1, "bob", 200);
        Player alice = PlayerTest.identified(2, "alice", 100);
        team.addPlayer(bob);
        team.addPlayer(alice);

        String raw = alice.getUrl() + "," + bob.getUrl();
        String expected = HexFormat.of().formatHex(
                MessageDigest.getInstance("SHA-256").digest(raw.getBytes(StandardCharsets.UTF_8)));

        assertThat(team.getHash()).isEqualTo(expected).matches("[0-9a-f]{64}");
    }

    @Test
    void testHashTracksMembershipAndUrls() {
        Team team = new Team(1);
        Player alice = PlayerTest.identified(1, "alice", 100);
        team.addPlayer(alice);
        String before = team.getHash();

        alice.setSubregion(2);
        String afterUrlChange = team.getHash();

        team.addPlayer(PlayerTest.identified(2, "bob", 200));

        assertThat(afterUrlChange).isNotEqualTo(before);
        assertThat(team.getHash()).isNotEqualTo(afterUrlChange);
    }

    @Test
    void testAddPlayerSetsBackReferenceAndKeepsJoinOrder() {
        Team team = new Team(2);
        Player alice = new Player(1, "alice");
        Player bob = new Player(2, "bob");
        team.addPlayer(bob);
        team.addPlayer(alice);
        team.addPlayer(bob);

        assertThat(team.getPlayers()).containsExactly(bob, alice);
        assertThat(team).containsExactly(bob, alice);
        assertThat(alice.getTeam()).isSameAs(team);
    }

    @Test
    void testMovingPlayerDetachesFromOldTeam() {
        Team one = new Team(1);
        Team two = new Team(2);
        Player alice = new Player(1, "alice");
        one.addPlayer(alice);

        two.addPlayer(alice);

        assertThat(one.getPlayers()).isEmpty();
        assertThat(two.getPlayers()).containsExactly(alice);
        assertThat(alice.getTeam()).isSameAs(two);
    }

    @Test
    void testRemovePlayerClearsBackReference() {
        Team team = new Team(1);
        Player alice = new Player(1, "alice");
        team.addPlayer(alice);

        assertThat(team.removePlayer(alice)).isTrue();
        assertThat(alice.hasTeam()).isFalse();
        assertThat(team.removePlayer(alice)).isFalse();
    }

    @Test
    void testDefaults() {
        Team team = new Team(1);

        assertThat(team.getResult()).isEqualTo(TeamResult.UNKNOWN);
        assertThat(team.getLineup()).isEmpty();
        assertThat(team.size()).isZero();
    }

    @Test
    void testLineupIsStoredAsGiven() {
        Team team = new Team(1);
        team.setLineup("PZ");

        assertThat(team.getLineup()).isEqualTo("PZ");
    }

    @Test
    void testTeamNumberMustBePositive() {
        assertThatThrownBy(() -> new Team(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testResultLabels() {
        assertThat(TeamResult.fromCode(1)).isEqualTo(TeamResult.WIN);
        assertThat(TeamResult.fromCode(2)).isEqualTo(TeamResult.LOSS);
        assertThat(TeamResult.fromCode(0)).isEqualTo(TeamResult.UNKNOWN);
        assertThat(TeamResult.LOSS).hasToString("Loss");
    }
}
