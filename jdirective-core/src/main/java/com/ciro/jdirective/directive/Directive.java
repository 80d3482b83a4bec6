package com.ciro.jdirective.directive;

import java.util.HashMap;
import java.util.Map;

/**
 * Vocabulario de directivas que el motor reconoce sobre los elementos.
 * Es el contrato entre quien escribe la plantilla y el motor.
 */
public enum Directive {

    IF("s:if"),
    ELIF("s:elif"),
    ELSE("s:else"),
    FOR("s:for"),
    FOR_ITEM("s:for-item"),
    FOR_INDEX("s:for-index"),
    SET("s:set"),
    BIND("s:bind"),
    TRANS_NODE("s:trans-node"),
    TRANS_TEXT("s:trans-text"),
    TRANS_ESCAPE("s:trans-escape"),
    TRANS_FMT("s:trans-fmt"),
    RAW("s:raw"),
    JIT("s:jit"),
    NS("s:ns"),
    CN("s:cn"),
    READY("s:ready"),
    EVENT("s:event");

    /** Prefijo común de todas las directivas y marcadores internos. */
    public static final String PREFIX = "s:";
    /** {@code s:trans-attr-<nombre>}: traducir el atributo {@code <nombre>}. */
    public static final String TRANS_ATTR_PREFIX = "s:trans-attr-";
    /** {@code s:attr-<nombre>}: atributo booleano condicional. */
    public static final String ATTR_PREFIX = "s:attr-";

    private static final Map<String, Directive> BY_NAME = new HashMap<>();

    static {
        for (Directive d : values()) BY_NAME.put(d.attribute, d);
    }

    private final String attribute;

    Directive(String attribute) {
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }

    /** Ganchos que el finalizador conserva para el runtime del cliente. */
    public boolean isClientHook() {
        return this == NS || this == CN || this == READY || this == EVENT;
    }

    public static Directive fromAttribute(String name) {
        return BY_NAME.get(name);
    }
}
