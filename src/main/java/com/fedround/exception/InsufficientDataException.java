package com.fedround.exception;

/**
 * Thrown when a partition would be empty, i.e. there are more workers than usable rows.
 * Fatal at worker startup.
 */
public class InsufficientDataException extends FedRoundException {
    private static final long serialVersionUID = 1L;

    private final int datasetSize;
    private final int workerCount;

    public InsufficientDataException(int datasetSize, int workerCount) {
        super(String.format("Cannot split %d rows across %d workers (shard size would be 0)",
                datasetSize, workerCount));
        this.datasetSize = datasetSize;
        this.workerCount = workerCount;
    }

    public int getDatasetSize() {
        return datasetSize;
    }

    public int getWorkerCount() {
        return workerCount;
    }
}
