package com.sc2.replay.codes;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Secondary code tables referenced by the attribute code table.
 */
@UtilityClass
public class GameCodes {

    public static final NamedCodeTable PLAYER_TYPE = table("Player Type",
            "Humn", "Human",
            "Comp", "Computer",
            "Open", "Open",
            "Clsd", "Closed");

    public static final NamedCodeTable GAME_FORMAT = table("Game Format",
            "1v1", "1v1",
            "2v2", "2v2",
            "3v3", "3v3",
            "4v4", "4v4",
            "5v5", "5v5",
            "6v6", "6v6",
            "FFA", "FFA",
            "Cust", "Custom");

    public static final NamedCodeTable GAME_SPEED = table("Game Speed",
            "Slor", "Slower",
            "Slow", "Slow",
            "Norm", "Normal",
            "Fast", "Fast",
            "Fasr", "Faster");

    public static final NamedCodeTable RACE = table("Race",
            "Terr", "Terran",
            "Zerg", "Zerg",
            "Prot", "Protoss",
            "RAND", "Random");

    public static final NamedCodeTable TEAM_COLOR = table("Team Color",
            "tc01", "Red",
            "tc02", "Blue",
            "tc03", "Teal",
            "tc04", "Purple",
            "tc05", "Yellow",
            "tc06", "Orange",
            "tc07", "Green",
            "tc08", "Light Pink",
            "tc09", "Violet",
            "tc10", "Light Grey",
            "tc11", "Dark Green",
            "tc12", "Brown",
            "tc13", "Light Green",
            "tc14", "Dark Grey",
            "tc15", "Pink");

    public static final NamedCodeTable DIFFICULTY = table("Difficulty",
            "VyEy", "Very easy",
            "Easy", "Easy",
            "Medi", "Medium",
            "Hard", "Hard",
            "VyHd", "Very hard",
            "Insa", "Insane");

    public static final NamedCodeTable GAME_CATEGORY = table("Game Category",
            "Priv", "Private",
            "Pub", "Public",
            "Amm", "Ladder",
            "", "Single");

    private static NamedCodeTable table(String name, String... pairs) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            entries.put(pairs[i], pairs[i + 1]);
        }
        return new NamedCodeTable(name, entries);
    }
}
