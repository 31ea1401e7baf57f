package com.raditha.treeflat.config;

import java.util.List;

/**
 * A configuration parameter outside its accepted set. Raised before any unit is
 * read, so a rejected call never returns partial results.
 */
public class InvalidParameterException extends IllegalArgumentException {

    private final String parameter;

    public InvalidParameterException(String parameter, String value, List<String> validValues) {
        super("Invalid " + parameter + " parameter '" + value + "'. Valid values are: "
                + String.join(", ", validValues));
        this.parameter = parameter;
    }

    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
