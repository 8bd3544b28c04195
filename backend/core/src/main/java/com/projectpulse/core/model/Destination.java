package com.projectpulse.core.model;

/**
 * Publishing targets. The microblog slots are bound to concrete services by configuration.
 */
public enum Destination {
    MICROBLOG_A(500),
    MICROBLOG_B(280),
    BLOG(0);

    private final int characterLimit;

    Destination(int characterLimit) {
        this.characterLimit = characterLimit;
    }

    /**
     * @return maximum rendered length, or 0 when the destination has no limit
     */
    public int characterLimit() {
        return characterLimit;
    }
}
