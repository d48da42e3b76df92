package com.sc2.replay.identity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Roster ownership of teams and people.
 */
class RosterTest {

    @Test
    void testAddPeopleAndTeams() {
        Roster roster = new Roster();
        Player alice = roster.addPlayer(1, "alice");
        Player bob = roster.addPlayer(2, "bob");
        Observer caster = roster.addObserver(3, "caster");

        roster.assign(alice, 1);
        roster.assign(bob, 2);

        assertThat(roster.getPlayers()).containsExactly(alice, bob);
        assertThat(roster.getObservers()).containsExactly(caster);
        assertThat(roster.getPeople()).hasSize(3);
        assertThat(roster.getTeams()).extracting(Team::getNumber).containsExactly(1, 2);
        assertThat(roster.findPlayer(3)).isEmpty();
        assertThat(roster.findPerson(3)).contains(caster);
        assertThat(alice.getTeam()).isSameAs(roster.team(1));
    }

    @Test
    void testDuplicatePidRejected() {
        Roster roster = new Roster();
        roster.addPlayer(1, "alice");

        assertThatThrownBy(() -> roster.addObserver(1, "impostor"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testAssignRejectsForeignPlayer() {
        Roster roster = new Roster();

        assertThatThrownBy(() -> roster.assign(new Player(1, "stranger"), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMarkRecorderKeepsSingleRecorder() {
        Roster roster = new Roster();
        Player alice = roster.addPlayer(1, "alice");
        Observer caster = roster.addObserver(2, "caster");

        roster.markRecorder(1);
        roster.markRecorder(2);

        assertThat(alice.isRecorder()).isFalse();
        assertThat(caster.isRecorder()).isTrue();
        assertThat(roster.getRecorder()).contains(caster);
        assertThatThrownBy(() -> roster.markRecorder(99)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testApplyDetailsFillsIdentityAndTeamResult() {
        Roster roster = new Roster();
        Player player = roster.addPlayer(1, "placeholder");
        Player mate = roster.addPlayer(2, "mate");
        roster.assign(player, 1);
        roster.assign(mate, 1);

        PlayerDetails details = PlayerDetails.builder()
                .name("alice")
                .bnet(new BnetDetails(1, 1234567))
                .race("Terran")
                .color(new PlayerColor(255, 180, 20, 30))
                .handicap(100)
                .result(1)
                .build();
        roster.applyDetails(player, details, "eu");

        assertThat(player.getUrl()).isEqualTo("http://eu.battle.net/sc2/en/profile/1234567/1/alice/");
        assertThat(player.getPlayRace()).isEqualTo("Terran");
        assertThat(player.getColor().toHex()).isEqualTo("#B4141E");
        assertThat(mate.getResult()).isEqualTo(TeamResult.WIN);
    }

    @Test
    void testApplyDetailsWithUnknownResultLeavesTeamAlone() {
        Roster roster = new Roster();
        Player player = roster.addPlayer(1, "alice");

        roster.applyDetails(player, PlayerDetails.builder().name("alice").handicap(50).result(0).build(), "us");

        assertThat(player.hasTeam()).isFalse();
        assertThat(player.getHandicap()).isEqualTo(50);
    }

    @Test
    void testApplyDetailsWithoutTeamLeavesPlayerUnchanged() {
        Roster roster = new Roster();
        Player player = roster.addPlayer(1, "placeholder");
        PlayerDetails details = PlayerDetails.builder()
                .name("alice")
                .bnet(new BnetDetails(1, 1234567))
                .race("Zerg")
                .handicap(80)
                .result(2)
                .build();

        assertThatThrownBy(() -> roster.applyDetails(player, details, "eu"))
                .isInstanceOf(IllegalStateException.class);

        assertThat(player.getName()).isEqualTo("placeholder");
        assertThat(player.getRegion()).isEmpty();
        assertThat(player.getBnetUid()).isZero();
        assertThat(player.getPlayRace()).isEmpty();
        assertThat(player.getHandicap()).isEqualTo(100);
    }

    @Test
    void testApplyDetailsWithBadHandicapLeavesPlayerUnchanged() {
        Roster roster = new Roster();
        Player player = roster.addPlayer(1, "placeholder");

        assertThatThrownBy(() -> roster.applyDetails(player,
                PlayerDetails.builder().name("alice").handicap(150).build(), "eu"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(player.getName()).isEqualTo("placeholder");
        assertThat(player.getRegion()).isEmpty();
    }

    @Test
    void testColorChannelRange() {
        assertThatThrownBy(() -> new PlayerColor(255, 256, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
