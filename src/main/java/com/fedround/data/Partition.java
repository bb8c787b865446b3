package com.fedround.data;

import java.util.List;

/**
 * A worker's exclusive slice of the dataset, already split into a train and a held-out part.
 * Immutable after creation by {@link Partitioner}.
 */
public final class Partition {

    private final int workerId;
    private final int workerCount;
    private final int startIndex;
    private final int endIndex;
    private final List<Row> trainRows;
    private final List<Row> evalRows;

    Partition(int workerId, int workerCount, int startIndex, int endIndex,
              List<Row> trainRows, List<Row> evalRows) {
        this.workerId = workerId;
        this.workerCount = workerCount;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.trainRows = List.copyOf(trainRows);
        this.evalRows = List.copyOf(evalRows);
    }

    public int getWorkerId() {
        return workerId;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * @return first dataset index of the shard (inclusive)
     */
    public int getStartIndex() {
        return startIndex;
    }

    /**
     * @return last dataset index of the shard (exclusive)
     */
    public int getEndIndex() {
        return endIndex;
    }

    public List<Row> getTrainRows() {
        return trainRows;
    }

    public List<Row> getEvalRows() {
        return evalRows;
    }

    public int getTotalSize() {
        return trainRows.size() + evalRows.size();
    }

    @Override
    public String toString() {
        return String.format("Partition[worker=%d/%d, rows=[%d,%d), train=%d, eval=%d]",
            workerId, workerCount, startIndex, endIndex, trainRows.size(), evalRows.size());
    }
}
