package com.agentflow.fgc.ir;

/**
 * A typed parameter of an IR node.
 *
 * @param name         parameter name as declared by the flow component
 * @param value        the configured value, or the default when none was set
 * @param type         declared parameter type ({@code string}, {@code number},
 *                     {@code password}, ...)
 * @param required     whether conversion needs a value
 * @param defaultValue the declared default, may be null
 */
public record IRParameter(String name, Object value, String type, boolean required, Object defaultValue) {

    /** A value counts as set when it is non-null and not a blank string. */
    public boolean isSet() {
        if (value == null)
            return false;
        if (value instanceof String s)
            return !s.isBlank();
        return true;
    }

    public boolean isSecret() {
        return "password".equalsIgnoreCase(type) || "credential".equalsIgnoreCase(type);
    }
}
