package com.sc2.replay.exception;

/**
 * A short code was not found in the secondary table named by {@link #getTableName()}.
 */
public class UnknownCodeException extends AttributeDecodeException {

    private static final long serialVersionUID = 1L;

    private final String tableName;
    private final String key;

    public UnknownCodeException(String tableName, String key) {
        this(NO_ATTRIBUTE, NO_ATTRIBUTE, tableName, key, null);
    }

    private UnknownCodeException(int code, int ownerIndex, String tableName, String key, Throwable cause) {
        super(code, ownerIndex, "no entry for '" + key + "' in " + tableName + " codes", cause);
        this.tableName = tableName;
        this.key = key;
    }

    public String getTableName() {
        return tableName;
    }

    public String getKey() {
        return key;
    }

    /**
     * Re-attach the attribute the lookup was made for, keeping this miss as the cause.
     */
    public UnknownCodeException forAttribute(int code, int ownerIndex) {
        return new UnknownCodeException(code, ownerIndex, tableName, key, this);
    }
}
