package com.sparrowlogic.lbaudit.model;

public enum Scheme {
    INTERNET_FACING,
    INTERNAL;

    public static Scheme fromValue(String value) {
        return "internet-facing".equalsIgnoreCase(value) ? INTERNET_FACING : INTERNAL;
    }
}
