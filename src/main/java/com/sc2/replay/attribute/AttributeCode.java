package com.sc2.replay.attribute;

import com.sc2.replay.codes.GameCodes;

import lombok.Getter;

/**
 * Every attribute code this decoder understands, with its display name and value rule.
 */
@Getter
public enum AttributeCode {
    PLAYER_TYPE(0x01F4, "Player Type", ValueTransform.lookup(GameCodes.PLAYER_TYPE)),
    GAME_TYPE(0x07D1, "Game Type", ValueTransform.lookup(GameCodes.GAME_FORMAT)),
    GAME_SPEED(0x0BB8, "Game Speed", ValueTransform.lookup(GameCodes.GAME_SPEED)),
    RACE(0x0BB9, "Race", ValueTransform.lookup(GameCodes.RACE)),
    COLOR(0x0BBA, "Color", ValueTransform.lookup(GameCodes.TEAM_COLOR)),
    HANDICAP(0x0BBB, "Handicap", ValueTransform.NONE),
    DIFFICULTY(0x0BBC, "Difficulty", ValueTransform.lookup(GameCodes.DIFFICULTY)),
    CATEGORY(0x0BC1, "Category", ValueTransform.lookup(GameCodes.GAME_CATEGORY)),
    TEAMS_1V1(0x07D2, "Teams1v1", ValueTransform.FIRST_DIGIT),
    TEAMS_2V2(0x07D3, "Teams2v2", ValueTransform.FIRST_DIGIT),
    TEAMS_3V3(0x07D4, "Teams3v3", ValueTransform.FIRST_DIGIT),
    TEAMS_4V4(0x07D5, "Teams4v4", ValueTransform.FIRST_DIGIT),
    TEAMS_FFA(0x07D6, "TeamsFFA", ValueTransform.FIRST_DIGIT),
    TEAMS_5V5(0x07D7, "Teams5v5", ValueTransform.FIRST_DIGIT);

    private final int code;
    private final String displayName;
    private final ValueTransform transform;

    AttributeCode(int code, String displayName, ValueTransform transform) {
        this.code = code;
        this.displayName = displayName;
        this.transform = transform;
    }
}
