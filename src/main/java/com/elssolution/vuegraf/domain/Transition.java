package com.elssolution.vuegraf.domain;

public enum Transition {
    ON("on"),
    OFF("off");

    private final String value;

    Transition(String value) {
        this.value = value;
    }

    /** Field value written to the sink. */
    public String value() {
        return value;
    }
}
