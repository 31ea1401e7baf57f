package com.raditha.treeflat.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Parsing of the textual configuration parameters accepted by the entry points.
 */
public class Parameters {

    public static final String CONTEXT = "context";
    public static final String SOURCE = "source";
    public static final String STRUCTURE = "structure";
    public static final String PREVIEW = "preview";
    public static final String BATCH_SIZE = "batch_size";
    public static final String IGNORE_ERRORS = "ignore_errors";
    public static final String LANGUAGE = "language";

    private Parameters() {
        /* this is only a utility class */
    }

    /**
     * Matches a value against the parameter values of an enum. Hyphens are read as
     * underscores and case is ignored.
     *
     * @throws InvalidParameterException naming the parameter, the value and every accepted value
     */
    static <E extends Enum<E>> E parseEnum(String parameter, String value, E[] constants,
                                           Function<E, String> parameterValue) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (E constant : constants) {
                if (parameterValue.apply(constant).equals(normalized)) {
                    return constant;
                }
            }
        }
        List<String> valid = new ArrayList<>();
        for (E constant : constants) {
            valid.add(parameterValue.apply(constant));
        }
        throw new InvalidParameterException(parameter, String.valueOf(value), valid);
    }

    /**
     * Parses a batch size.
     *
     * @throws InvalidParameterException for non numeric values and for values below one
     */
    public static int parseBatchSize(String value) {
        int size;
        try {
            size = Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(BATCH_SIZE, String.valueOf(value), List.of("positive integers"));
        }
        return checkBatchSize(size);
    }

    public static int checkBatchSize(int size) {
        if (size <= 0) {
            throw new InvalidParameterException(BATCH_SIZE, "batch_size must be positive");
        }
        return size;
    }

    public static boolean parseBoolean(String parameter, String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new InvalidParameterException(parameter, String.valueOf(value), List.of("true", "false"));
        };
    }
}
