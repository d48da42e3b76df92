package com.sc2.replay.identity;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sc2.replay.attribute.AttributeCode;
import com.sc2.replay.attribute.AttributeCodeTable;
import com.sc2.replay.attribute.AttributeSet;
import com.sc2.replay.model.Attribute;

/**
 * Attaches decoded attributes to the roster's players by owner index (owner index == pid)
 * and copies the lobby settings they carry onto the player.
 * Attributes owned by nobody in the roster become game attributes.
 */
public class AttributeBinder {
    private static final Logger log = LoggerFactory.getLogger(AttributeBinder.class);

    /**
     * @return the number of attributes attached to a player
     */
    public int bind(Roster roster, AttributeSet attributes) {
        int bound = 0;
        for (Attribute attribute : attributes) {
            Optional<Person> owner = roster.findPerson(attribute.getOwnerIndex());
            if (owner.isEmpty()) {
                roster.addGameAttribute(attribute);
            } else if (owner.get() instanceof Player player) {
                player.addAttribute(attribute);
                apply(player, attribute);
                bound++;
            } else {
                log.debug("Ignoring attribute {} owned by observer {}", attribute, owner.get().getPid());
            }
        }
        return bound;
    }

    private void apply(Player player, Attribute attribute) {
        Optional<AttributeCode> code = AttributeCodeTable.lookup(attribute.getCode());
        if (code.isEmpty()) {
            return;
        }
        switch (code.get()) {
            case RACE -> player.setPickRace(attribute.getStringValue());
            case DIFFICULTY -> player.setDifficulty(attribute.getStringValue());
            case PLAYER_TYPE -> player.setHuman("Human".equals(attribute.getStringValue()));
            case HANDICAP -> applyHandicap(player, attribute.getStringValue());
            default -> {
                // kept on the player's attribute list only
            }
        }
    }

    private void applyHandicap(Player player, String value) {
        try {
            player.setHandicap(Integer.parseInt(value.trim()));
        } catch (IllegalArgumentException e) {
            log.warn("Player {} has an invalid handicap '{}': {}", player.getPid(), value, e.getMessage());
        }
    }
}
