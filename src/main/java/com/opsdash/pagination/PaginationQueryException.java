package com.opsdash.pagination;

/**
 * The backing store failed while serving a page. Never retried by the engine.
 */
public class PaginationQueryException extends RuntimeException {

    private final String dataset;

    public PaginationQueryException(String dataset, Throwable cause) {
        super("Query failed for dataset '" + dataset + "': " + cause.getMessage(), cause);
        this.dataset = dataset;
    }

    public String getDataset() {
        return dataset;
    }
}
