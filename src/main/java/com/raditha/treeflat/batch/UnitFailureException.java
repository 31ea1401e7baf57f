package com.raditha.treeflat.batch;

/**
 * A unit could not be read or its language could not be determined, and the
 * read was not told to ignore errors.
 */
public class UnitFailureException extends Exception {

    private final String unit;

    public UnitFailureException(String unit, String message, Throwable cause) {
        super(message, cause);
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
