package com.planningpoker.model;

/**
 * Estimation values in deck order.
 * SECRET is a display placeholder for blinded votes and is never stored.
 */
public enum Vote {
    UNKNOWN("Unknown"),
    ONE("One"),
    TWO("Two"),
    THREE("Three"),
    FIVE("Five"),
    EIGHT("Eight"),
    THIRTEEN("Thirteen"),
    TWENTY_ONE("TwentyOne"),
    INFINITE("Infinite"),
    SECRET("Secret");

    private final String wireName;

    Vote(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True for values that count towards an outcome (everything but UNKNOWN and SECRET).
     */
    public boolean isEstimate() {
        return this != UNKNOWN && this != SECRET;
    }

    /**
     * @return the vote with the given wire name, or null if there is none
     */
    public static Vote fromWireName(String wireName) {
        for (Vote vote : values()) {
            if (vote.wireName.equals(wireName)) {
                return vote;
            }
        }
        return null;
    }
}
