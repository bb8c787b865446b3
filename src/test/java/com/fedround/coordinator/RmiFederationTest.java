package com.fedround.coordinator;

import com.fedround.data.Dataset;
import com.fedround.data.Partitioner;
import com.fedround.model.Ack;
import com.fedround.model.RunStatus;
import com.fedround.trainer.SoftmaxRegressionTrainer;
import com.fedround.worker.FederatedWorker;
import com.fedround.worker.WorkerNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coordinator and workers talking over real RMI registries on loopback.
 */
public class RmiFederationTest {

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static Dataset dataset() {
        List<double[]> features = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            features.add(new double[]{i, 30 - i});
            labels.add(i % 3 == 0 ? "a" : "b");
        }
        return Dataset.of(features, labels);
    }

    @Test
    public void testRunOverRmi() throws Exception {
        RunConfig config = new RunConfig.Builder()
            .totalRounds(2)
            .minParticipants(2)
            .workerCount(2)
            .perRoundTimeoutMs(10_000)
            .build();
        Dataset data = dataset();
        SoftmaxRegressionTrainer trainer = SoftmaxRegressionTrainer.forDataset(data);

        int coordinatorPort = freePort();
        CoordinatorNode coordinatorNode = new CoordinatorNode("localhost", coordinatorPort, new Coordinator(config));
        List<WorkerNode> workerNodes = new ArrayList<>();
        try {
            for (int id = 0; id < 2; id++) {
                FederatedWorker worker = new FederatedWorker(Partitioner.partition(data, id, 2, 0.8), trainer);
                WorkerNode node = new WorkerNode("localhost", freePort(), worker);
                workerNodes.add(node);

                Ack ack = node.joinCoordinator("localhost", coordinatorPort);
                assertTrue(ack.isAccepted());
                assertEquals(1, ack.getAcceptedRoundStart());
            }

            RunResult result = coordinatorNode.getCoordinator().run();

            assertEquals(RunStatus.COMPLETED, result.getStatus());
            assertEquals(2, result.getHistory().size());
            assertEquals(trainer.parameterCount(), result.getGlobalParameters().size());
            for (WorkerNode node : workerNodes) {
                assertTrue(node.getWorker().awaitRunFinished(5, TimeUnit.SECONDS));
                assertEquals(RunStatus.COMPLETED, node.getWorker().getFinalStatus());
            }
        } finally {
            for (WorkerNode node : workerNodes) {
                node.shutdown();
            }
            coordinatorNode.shutdown();
        }
    }
}
