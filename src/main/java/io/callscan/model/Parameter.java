package io.callscan.model;

/**
 * A declared parameter.
 *
 * @param name Parameter name, empty when the parameter is unnamed
 * @param type Type as written in the source (variadic types keep the {@code ...} prefix)
 */
public record Parameter(String name, String type) {

    public Parameter {
        name = name != null ? name : "";
    }

    public String render() {
        return name.isEmpty() ? type : name + " " + type;
    }
}
