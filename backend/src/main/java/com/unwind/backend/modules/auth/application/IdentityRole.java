package com.unwind.backend.modules.auth.application;

public enum IdentityRole {
    AUTHENTICATED("authenticated"),
    SERVICE("service");

    private final String value;

    IdentityRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
