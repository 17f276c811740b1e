package com.plcexport.l5k.state;

/**
 * View filter over inclusion flags.
 */
public enum FilterMode {
    ALL,
    ENABLED,
    DISABLED;

    public boolean matches(boolean included) {
        return switch (this) {
            case ALL -> true;
            case ENABLED -> included;
            case DISABLED -> !included;
        };
    }
}
