package com.sc2.replay.attribute;

import com.sc2.replay.model.Attribute;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AttributeSet grouping and lookup.
 */
class AttributeSetTest {

    private final AttributeSet set = new AttributeSet(List.of(
            Attribute.ofString(0x0BB9, 2, "Race", "Zerg"),
            Attribute.ofString(0x0BB8, 16, "Game Speed", "Faster"),
            Attribute.ofString(0x0BB9, 1, "Race", "Protoss"),
            Attribute.ofString(0x0BBC, 2, "Difficulty", "Medium")));

    @Test
    void testGroupByOwnerOrdersOwnersAndKeepsRecordOrder() {
        Map<Integer, List<Attribute>> groups = set.groupByOwner();

        assertThat(groups.keySet()).containsExactly(1, 2, 16);
        assertThat(groups.get(2)).extracting(Attribute::getDisplayName).containsExactly("Race", "Difficulty");
    }

    @Test
    void testFindByCodeAndName() {
        assertThat(set.find(1, AttributeCode.RACE)).map(Attribute::getValue).contains("Protoss");
        assertThat(set.find(2, "Difficulty")).map(Attribute::getValue).contains("Medium");
        assertThat(set.find(16, AttributeCode.RACE)).isEmpty();
    }

    @Test
    void testForOwner() {
        assertThat(set.forOwner(16)).hasSize(1);
        assertThat(set.forOwner(7)).isEmpty();
        assertThat(AttributeSet.empty().isEmpty()).isTrue();
    }
}
