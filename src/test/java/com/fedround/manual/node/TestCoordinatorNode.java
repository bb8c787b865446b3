package com.fedround.manual.node;

import com.fedround.coordinator.Coordinator;
import com.fedround.coordinator.CoordinatorNode;
import com.fedround.coordinator.RunConfig;
import com.fedround.coordinator.RunResult;
import com.fedround.model.RoundMetrics;

/**
 * Manual test: coordinator waiting for real workers over RMI.
 * 
 * How to run:
 *   Terminal 1: mvn exec:java -Dexec.mainClass="com.fedround.manual.node.TestCoordinatorNode" -Dexec.classpathScope=test
 *   Terminal 2: mvn exec:java -Dexec.mainClass="com.fedround.manual.node.TestWorkerNode" -Dexec.classpathScope=test -Dexec.args="0 5002"
 *   Terminal 3: mvn exec:java -Dexec.mainClass="com.fedround.manual.node.TestWorkerNode" -Dexec.classpathScope=test -Dexec.args="1 5003"
 * 
 * Expected behavior:
 *   - Coordinator binds "coordinator" on port 5001
 *   - Waits (logging every 5s) until 2 workers joined
 *   - Plays 3 rounds, prints one line per round
 *   - Workers print "Run finished: COMPLETED" and exit
 */
public class TestCoordinatorNode {

    public static void main(String[] args) throws Exception {
        System.out.println("========================================");
        System.out.println("  TEST: Coordinator Node");
        System.out.println("========================================");
        System.out.println();

        RunConfig config = new RunConfig.Builder()
            .totalRounds(3)
            .minParticipants(2)
            .workerCount(2)
            .build();
        CoordinatorNode node = new CoordinatorNode("localhost", 5001, new Coordinator(config));

        System.out.println("[OK] Coordinator running on port 5001, start 2 workers now");
        RunResult result = node.getCoordinator().run();

        System.out.println();
        for (RoundMetrics round : result.getHistory()) {
            System.out.println("  " + round);
        }
        System.out.println("[OK] " + result);

        node.shutdown();
    }
}
