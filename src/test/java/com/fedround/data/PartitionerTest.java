package com.fedround.data;

import com.fedround.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionerTest {

    static Dataset dataset(int size) {
        List<double[]> features = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            features.add(new double[]{i, i * 0.5});
            labels.add(i % 2 == 0 ? "even" : "odd");
        }
        return Dataset.of(features, labels);
    }

    private static List<Integer> indices(List<Row> rows) {
        List<Integer> result = new ArrayList<>();
        for (Row row : rows) {
            result.add(row.getIndex());
        }
        return result;
    }

    @Test
    public void testNineRowsTwoWorkers() throws Exception {
        Dataset data = dataset(9);

        Partition first = Partitioner.partition(data, 0, 2, 0.8);
        assertEquals(0, first.getStartIndex());
        assertEquals(4, first.getEndIndex());
        assertEquals(3, first.getTrainRows().size());
        assertEquals(1, first.getEvalRows().size());

        // Last worker takes the remainder
        Partition second = Partitioner.partition(data, 1, 2, 0.8);
        assertEquals(4, second.getStartIndex());
        assertEquals(9, second.getEndIndex());
        assertEquals(4, second.getTrainRows().size());
        assertEquals(1, second.getEvalRows().size());
    }

    @Test
    public void testShardsCoverDatasetWithoutOverlap() throws Exception {
        Dataset data = dataset(23);

        for (int workers = 1; workers <= 23; workers++) {
            List<Integer> seen = new ArrayList<>();
            for (Partition partition : Partitioner.partitionAll(data, workers, 0.8)) {
                List<Integer> own = new ArrayList<>(indices(partition.getTrainRows()));
                own.addAll(indices(partition.getEvalRows()));
                for (int index : own) {
                    assertTrue(index >= partition.getStartIndex() && index < partition.getEndIndex(),
                        "row " + index + " outside shard of worker " + partition.getWorkerId());
                }
                assertEquals(partition.getEndIndex() - partition.getStartIndex(), own.size());
                seen.addAll(own);
            }
            Collections.sort(seen);
            List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < 23; i++) {
                expected.add(i);
            }
            assertEquals(expected, seen, "coverage with " + workers + " worker(s)");
        }
    }

    @Test
    public void testPartitionIsDeterministic() throws Exception {
        Dataset data = dataset(50);

        Partition a = Partitioner.partition(data, 1, 3, 0.8);
        Partition b = Partitioner.partition(data, 1, 3, 0.8);

        assertEquals(a.getTrainRows(), b.getTrainRows());
        assertEquals(a.getEvalRows(), b.getEvalRows());
    }

    @Test
    public void testShuffleMixesShard() throws Exception {
        Dataset data = dataset(40);

        Partition partition = Partitioner.partition(data, 0, 1, 0.5);
        List<Integer> train = indices(partition.getTrainRows());

        assertNotEquals(indices(data.slice(0, 20)), train, "train rows should not be the first half in order");
    }

    @Test
    public void testTrainCountFloors() {
        assertEquals(4, Partitioner.trainCount(5, 0.8));
        assertEquals(3, Partitioner.trainCount(4, 0.8));
        assertEquals(0, Partitioner.trainCount(1, 0.8));
        assertEquals(8, Partitioner.trainCount(10, 0.8));
    }

    @Test
    public void testMoreWorkersThanRows() {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
            () -> Partitioner.partition(dataset(3), 0, 4, 0.8));
        assertEquals(3, e.getDatasetSize());
        assertEquals(4, e.getWorkerCount());
    }

    @Test
    public void testInvalidArguments() {
        Dataset data = dataset(10);

        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(data, 2, 2, 0.8));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(data, -1, 2, 0.8));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(data, 0, 0, 0.8));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(data, 0, 2, 1.0));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(data, 0, 2, 0.0));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(null, 0, 2, 0.8));
    }
}
