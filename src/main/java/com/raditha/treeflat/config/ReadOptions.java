package com.raditha.treeflat.config;

/**
 * Validated options of one read.
 *
 * @param extraction   detail levels
 * @param batchSize    number of units handed to a consumer at a time
 * @param ignoreErrors replace failing units by error nodes instead of aborting
 */
public record ReadOptions(ExtractionConfig extraction, int batchSize, boolean ignoreErrors) {

    public static final String DEFAULT_CONTEXT = "native";
    public static final String DEFAULT_SOURCE = "lines";
    public static final String DEFAULT_STRUCTURE = "full";
    public static final String DEFAULT_PREVIEW = "smart";
    public static final int DEFAULT_BATCH_SIZE = 1;

    public ReadOptions {
        if (extraction == null) {
            throw new IllegalArgumentException("extraction cannot be null");
        }
        Parameters.checkBatchSize(batchSize);
    }

    public static ReadOptions defaults() {
        return new ReadOptions(ExtractionConfig.defaults(), DEFAULT_BATCH_SIZE, false);
    }

    public static ReadOptions of(ExtractionConfig extraction) {
        return new ReadOptions(extraction, DEFAULT_BATCH_SIZE, false);
    }

    /**
     * Validates textual parameters as received from a query surface or command line.
     *
     * @throws InvalidParameterException for the first invalid parameter
     */
    public static ReadOptions parse(String context, String source, String structure, String preview,
                                    String batchSize, String ignoreErrors) {
        ExtractionConfig extraction = ExtractionConfig.parse(context, source, structure, preview);
        int size = Parameters.parseBatchSize(batchSize);
        boolean ignore = Parameters.parseBoolean(Parameters.IGNORE_ERRORS, ignoreErrors);
        return new ReadOptions(extraction, size, ignore);
    }

    public ReadOptions withIgnoreErrors(boolean ignore) {
        return new ReadOptions(extraction, batchSize, ignore);
    }

    public ReadOptions withBatchSize(int size) {
        return new ReadOptions(extraction, size, ignoreErrors);
    }
}
