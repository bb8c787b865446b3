package com.fedround.data;

import com.fedround.exception.InsufficientDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Deterministic contiguous partitioning of a dataset by worker ordinal.
 * 
 * Formula: {@code shardSize = floor(size / workerCount)}; worker {@code i} owns
 * rows {@code [i * shardSize, (i + 1) * shardSize)}, the last worker also owns the
 * remainder. Union of all shards = the whole dataset, no overlap, no gaps.
 * 
 * Inside a shard, rows are shuffled with a fixed seed and the first
 * {@code floor(n * splitRatio)} go to training, the rest are held out.
 * The split is NOT stratified by label.
 */
public final class Partitioner {

    private static final Logger log = LoggerFactory.getLogger(Partitioner.class);

    /** Seed of the in-shard shuffle. Same inputs always give the same partition. */
    public static final long SHUFFLE_SEED = 42L;

    private Partitioner() {
    }

    /**
     * Builds the partition owned by {@code workerId}.
     * 
     * @param dataset the full dataset, identical on every worker
     * @param workerId ordinal of the worker, {@code 0 <= workerId < workerCount}
     * @param workerCount number of workers in the run
     * @param splitRatio fraction of the shard used for training, {@code 0 < splitRatio < 1}
     * @return the worker's partition
     * @throws InsufficientDataException if there are more workers than rows
     * @throws IllegalArgumentException on invalid arguments
     */
    public static Partition partition(Dataset dataset, int workerId, int workerCount, double splitRatio)
            throws InsufficientDataException {
        if (dataset == null) {
            throw new IllegalArgumentException("dataset cannot be null");
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (workerId < 0 || workerId >= workerCount) {
            throw new IllegalArgumentException(
                "workerId must be in [0, " + workerCount + "), got " + workerId);
        }
        if (!(splitRatio > 0.0 && splitRatio < 1.0)) {
            throw new IllegalArgumentException("splitRatio must be in (0, 1), got " + splitRatio);
        }

        int shardSize = dataset.size() / workerCount;
        if (shardSize == 0) {
            throw new InsufficientDataException(dataset.size(), workerCount);
        }

        int start = workerId * shardSize;
        // Last worker takes the remainder
        int end = (workerId == workerCount - 1) ? dataset.size() : start + shardSize;

        List<Row> shard = new ArrayList<>(dataset.slice(start, end));
        Collections.shuffle(shard, new Random(SHUFFLE_SEED));

        int trainCount = trainCount(shard.size(), splitRatio);
        List<Row> train = shard.subList(0, trainCount);
        List<Row> eval = shard.subList(trainCount, shard.size());

        Partition partition = new Partition(workerId, workerCount, start, end, train, eval);
        log.debug("Built {}", partition);
        return partition;
    }

    /**
     * Number of training rows for a shard of {@code shardRows} rows.
     * Floors {@code shardRows * splitRatio}; the small epsilon absorbs binary
     * representation error (5 * 0.8 must give 4, not 3).
     */
    static int trainCount(int shardRows, double splitRatio) {
        return (int) Math.floor(shardRows * splitRatio + 1e-9);
    }

    /**
     * Computes every partition of a run, in worker order.
     * Used by in-process simulation and setup verification.
     */
    public static List<Partition> partitionAll(Dataset dataset, int workerCount, double splitRatio)
            throws InsufficientDataException {
        List<Partition> partitions = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            partitions.add(partition(dataset, i, workerCount, splitRatio));
        }
        return partitions;
    }
}
