package com.sc2.replay.identity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sc2.replay.exception.IncompleteIdentityException;
import com.sc2.replay.model.Attribute;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/**
 * A person taking part in the game on a team.
 */
@Getter
@Setter
public class Player extends Person {

    public static final String URL_TEMPLATE = "http://%s.battle.net/sc2/en/profile/%d/%d/%s/";

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.PACKAGE)
    private Team team;

    private PlayerColor color;

    /**
     * Race chosen in the lobby: Protoss, Terran, Zerg or Random.
     */
    @NonNull
    private String pickRace = "";

    /**
     * Race actually played: Protoss, Terran or Zerg.
     */
    @NonNull
    private String playRace = "";

    @NonNull
    private String difficulty = "";

    @Setter(AccessLevel.NONE)
    private int handicap = 100;

    @NonNull
    private String region = "";

    private int subregion;

    private long bnetUid;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<Attribute> attributes = new ArrayList<>();

    public Player(int pid, String name) {
        super(pid, name, false);
    }

    public void setHuman(boolean human) {
        this.human = human;
    }

    public void setHandicap(int handicap) {
        if (handicap < 0 || handicap > 100) {
            throw new IllegalArgumentException("Handicap must be within 0..100: " + handicap);
        }
        this.handicap = handicap;
    }

    public boolean hasTeam() {
        return team != null;
    }

    /**
     * @throws IllegalStateException if the player has not been added to a team yet
     */
    public Team getTeam() {
        if (team == null) {
            throw new IllegalStateException("Player " + getPid() + " (" + getName() + ") has no team yet");
        }
        return team;
    }

    /**
     * The game result, always read through the team.
     */
    public TeamResult getResult() {
        return getTeam().getResult();
    }

    /**
     * The player's battle.net profile url.
     *
     * @throws IncompleteIdentityException if region, uid, subregion or name is unset
     */
    public String getUrl() {
        List<String> missing = new ArrayList<>();
        if (region.isBlank()) {
            missing.add("region");
        }
        if (bnetUid == 0) {
            missing.add("bnetUid");
        }
        if (subregion == 0) {
            missing.add("subregion");
        }
        if (getName().isBlank()) {
            missing.add("name");
        }
        if (!missing.isEmpty()) {
            throw new IncompleteIdentityException("Player " + getPid(), missing);
        }
        return String.format(URL_TEMPLATE, region, bnetUid, subregion, getName());
    }

    /**
     * Attributes decoded for this player, in record order.
     */
    public List<Attribute> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    void addAttribute(Attribute attribute) {
        attributes.add(attribute);
    }

    /**
     * Render a template such as {@code "${name} (${playRace})"} from this player's own fields.
     * Team fields are not available.
     *
     * @throws com.sc2.replay.exception.MissingFieldException for a placeholder naming no field
     */
    public String format(String template) {
        return PlayerTemplates.render(template, fields());
    }

    Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("pid", getPid());
        fields.put("name", getName());
        fields.put("observer", isObserver());
        fields.put("human", isHuman());
        fields.put("recorder", isRecorder());
        fields.put("color", color != null ? color.toHex() : "");
        fields.put("pickRace", pickRace);
        fields.put("playRace", playRace);
        fields.put("difficulty", difficulty);
        fields.put("handicap", handicap);
        fields.put("region", region);
        fields.put("subregion", subregion);
        fields.put("bnetUid", bnetUid);
        return fields;
    }

    @Override
    public String toString() {
        return "Player " + getPid() + " - " + getName() + " (" + playRace + ")";
    }
}
