package com.sc2.replay.identity;

import com.sc2.replay.attribute.AttributeDecoder;
import com.sc2.replay.attribute.AttributeSet;
import com.sc2.replay.attribute.DecodeDiagnostics;
import com.sc2.replay.model.Attribute;
import com.sc2.replay.model.RawAttributeRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests binding decoded attributes onto a roster.
 */
class AttributeBinderTest {

    private final AttributeBinder binder = new AttributeBinder();

    @Test
    void testBindDecodedAttributes() {
        Roster roster = new Roster();
        Player human = roster.addPlayer(1, "alice");
        Player computer = roster.addPlayer(2, "A.I. 1");
        roster.addObserver(3, "caster");

        AttributeSet attributes = new AttributeDecoder().decodeAll(List.of(
                record(0x01F4, 1, "Humn"),
                record(0x0BB9, 1, "Prot"),
                record(0x0BBB, 1, "90\0"),
                record(0x01F4, 2, "Comp"),
                record(0x0BB9, 2, "RAND"),
                record(0x0BBC, 2, "Insa"),
                record(0x0BB9, 3, "Zerg"),
                record(0x0BB8, 16, "Fasr"),
                record(0x07D2, 16, "2\0")), new DecodeDiagnostics());

        int bound = binder.bind(roster, attributes);

        assertThat(bound).isEqualTo(6);
        assertThat(human.isHuman()).isTrue();
        assertThat(human.getPickRace()).isEqualTo("Protoss");
        assertThat(human.getHandicap()).isEqualTo(90);
        assertThat(computer.isHuman()).isFalse();
        assertThat(computer.getPickRace()).isEqualTo("Random");
        assertThat(computer.getDifficulty()).isEqualTo("Insane");
        assertThat(human.getAttributes()).hasSize(3);
        assertThat(roster.getGameAttributes()).extracting(Attribute::getDisplayName)
                .containsExactly("Game Speed", "Teams1v1");
    }

    @Test
    void testInvalidHandicapIsIgnored() {
        Roster roster = new Roster();
        Player player = roster.addPlayer(1, "alice");

        binder.bind(roster, new AttributeSet(List.of(Attribute.ofString(0x0BBB, 1, "Handicap", "lots"))));

        assertThat(player.getHandicap()).isEqualTo(100);
        assertThat(player.getAttributes()).hasSize(1);
    }

    private static RawAttributeRecord record(int code, int owner, String value) {
        return new RawAttributeRecord(999, code, owner, value.getBytes(StandardCharsets.ISO_8859_1));
    }
}
