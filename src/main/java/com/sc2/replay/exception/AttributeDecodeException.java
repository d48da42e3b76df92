package com.sc2.replay.exception;

/**
 * Raised when a single attribute record cannot be decoded.
 * Callers decoding a batch may catch it per record and keep going.
 */
public class AttributeDecodeException extends ReplayCoreException {

    private static final long serialVersionUID = 1L;

    /**
     * Marks an exception not yet tied to a particular attribute record.
     */
    public static final int NO_ATTRIBUTE = -1;

    private final int code;
    private final int ownerIndex;

    public AttributeDecodeException(int code, int ownerIndex, String message) {
        this(code, ownerIndex, message, null);
    }

    public AttributeDecodeException(int code, int ownerIndex, String message, Throwable cause) {
        super(describe(code, ownerIndex, message), cause);
        this.code = code;
        this.ownerIndex = ownerIndex;
    }

    public int getCode() {
        return code;
    }

    public int getOwnerIndex() {
        return ownerIndex;
    }

    public boolean hasAttribute() {
        return code != NO_ATTRIBUTE;
    }

    private static String describe(int code, int ownerIndex, String message) {
        if (code == NO_ATTRIBUTE) {
            return message;
        }
        return String.format("Attribute 0x%04X (owner %d): %s", code, ownerIndex, message);
    }
}
