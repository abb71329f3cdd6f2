package com.testweaver.executor;

/**
 * Mutable state carried across the steps of one scenario run.
 */
public class PageState {

    private long lastScrollHeight = -1;

    /** Page height at the last "new content" check, or -1 before the first. */
    public long getLastScrollHeight() {
        return lastScrollHeight;
    }

    public void setLastScrollHeight(long height) {
        this.lastScrollHeight = height;
    }
}
