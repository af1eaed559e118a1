package io.github.chirino.access.model;

/** Organization membership levels, stored as ordinals. Anything at or above ADMIN is an admin. */
public enum OrganizationMembershipLevel {
    MEMBER(1),
    ADMIN(8),
    OWNER(15);

    private final int value;

    OrganizationMembershipLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public boolean isAtLeast(OrganizationMembershipLevel other) {
        return value >= other.value;
    }

    public static OrganizationMembershipLevel fromValue(int value) {
        OrganizationMembershipLevel result = MEMBER;
        for (OrganizationMembershipLevel level : values()) {
            if (level.value <= value) {
                result = level;
            }
        }
        return result;
    }
}
