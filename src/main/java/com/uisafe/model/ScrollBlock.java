package com.uisafe.model;

/**
 * Vertical alignment used when an element is scrolled into view.
 * Values map one-to-one onto the {@code block} option of {@code Element.scrollIntoView()}.
 */
public enum ScrollBlock {
    START,
    CENTER,
    END,
    NEAREST;

    public String cssValue() {
        return name().toLowerCase();
    }
}
