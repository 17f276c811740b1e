package com.plcexport.l5k.model;

import java.util.Locale;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Well-known atomic type names.
 */
@UtilityClass
public class BaseTypes {

    public static final String BOOL = "BOOL";

    private static final Set<String> INTEGER = Set.of(
            "SINT", "INT", "DINT", "LINT", "USINT", "UINT", "UDINT", "ULINT"
    );

    public static boolean isInteger(String type) {
        return type != null && INTEGER.contains(type.toUpperCase(Locale.ROOT));
    }
}
