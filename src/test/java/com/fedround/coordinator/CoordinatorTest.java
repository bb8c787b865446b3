package com.fedround.coordinator;

import com.fedround.exception.QuorumTimeoutException;
import com.fedround.exception.RunAbortedException;
import com.fedround.exception.ShapeMismatchException;
import com.fedround.model.Ack;
import com.fedround.model.ParameterVector;
import com.fedround.model.RoundMetrics;
import com.fedround.model.RunStatus;
import com.fedround.model.WorkerFailure;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CoordinatorTest {

    private Coordinator coordinator;

    private static RunConfig.Builder config() {
        return new RunConfig.Builder()
            .totalRounds(3)
            .minParticipants(2)
            .workerCount(3)
            .perRoundTimeoutMs(2_000)
            .maxRoundRetries(2)
            .quorumLogIntervalMs(50);
    }

    @AfterEach
    public void tearDown() {
        if (coordinator != null) {
            coordinator.shutdown();
        }
    }

    @Test
    public void testNoRoundBelowQuorum() throws Exception {
        coordinator = new Coordinator(config().build(), ParameterVector.zeros(2));
        FakeWorker only = new FakeWorker(0, 10, 1.0, 1.0);
        coordinator.registerWorker(0, only);

        assertFalse(coordinator.isQuorumReached());
        assertFalse(coordinator.awaitQuorum(0));
        assertEquals(CoordinatorPhase.AWAITING_QUORUM, coordinator.getPhase());

        QuorumTimeoutException e = assertThrows(QuorumTimeoutException.class, () -> coordinator.playRound());
        assertEquals("configuration", e.getPhase());
        assertEquals(0, only.fitCalls.get());
        assertEquals(0, coordinator.getRunState().getCurrentRound());
        assertEquals(CoordinatorPhase.AWAITING_QUORUM, coordinator.getPhase());
    }

    @Test
    public void testRoundAggregatesWeightedUpdates() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).minParticipants(2).workerCount(2).build(),
            ParameterVector.zeros(2));
        coordinator.registerWorker(0, new FakeWorker(0, 3, 1.0, 2.0));
        coordinator.registerWorker(1, new FakeWorker(1, 1, 4.0, 6.0));

        RunResult result = coordinator.run();

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertArrayEquals(new double[]{1.75, 3.0}, result.getGlobalParameters().toArray(), 1e-12);
        RoundMetrics round = result.lastRound();
        assertEquals(1, round.getRoundNumber());
        assertEquals(2, round.getParticipantCount());
        assertEquals(0.25, round.getAggregatedLoss(), 1e-12);
        assertEquals(0.75, round.getAggregatedEvalMetric(), 1e-12);
        assertEquals(CoordinatorPhase.TERMINATED, coordinator.getPhase());
    }

    @Test
    public void testRoundsAreSequentialAndMonotonic() throws Exception {
        coordinator = new Coordinator(config().build(), ParameterVector.zeros(1));
        FakeWorker a = new FakeWorker(0, 5, 1.0);
        FakeWorker b = new FakeWorker(1, 5, 3.0);
        coordinator.registerWorker(0, a);
        coordinator.registerWorker(1, b);

        RunResult result = coordinator.run();

        List<RoundMetrics> history = result.getHistory();
        assertEquals(3, history.size());
        for (int i = 0; i < history.size(); i++) {
            assertEquals(i + 1, history.get(i).getRoundNumber());
            assertEquals(1, history.get(i).getAttempts());
        }
        assertEquals(List.of(1, 2, 3), a.fitRounds);
        assertEquals(3, coordinator.getRunState().getCurrentRound());
        assertEquals(RunStatus.COMPLETED, a.finishedWith);
        assertEquals(RunStatus.COMPLETED, b.finishedWith);
    }

    @Test
    public void testFailedWorkerIsExcludedFromAggregate() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).build(), ParameterVector.zeros(1));
        coordinator.registerWorker(0, new FakeWorker(0, 10, 2.0));
        coordinator.registerWorker(1, new FakeWorker(1, 10, 4.0));
        coordinator.registerWorker(2, new FakeWorker(2, 10, 100.0).mode(FakeWorker.Mode.FAIL_FIT));

        RunResult result = coordinator.run();

        RoundMetrics round = result.lastRound();
        assertEquals(2, round.getParticipantCount());
        assertEquals(3.0, result.getGlobalParameters().get(0), 1e-12);
        assertEquals(1, round.getFailures().size());
        WorkerFailure failure = round.getFailures().get(0);
        assertEquals(2, failure.getWorkerId());
        assertEquals(WorkerFailure.Stage.FIT, failure.getStage());
        assertEquals(WorkerFailure.Kind.LOCAL_TRAINING, failure.getKind());
    }

    @Test
    public void testEvalGoesOnlyToFitSurvivors() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).build(), ParameterVector.zeros(1));
        FakeWorker broken = new FakeWorker(2, 10, 1.0).mode(FakeWorker.Mode.UNREACHABLE);
        coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0));
        coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0));
        coordinator.registerWorker(2, broken);

        RunResult result = coordinator.run();

        assertEquals(0, broken.evalCalls.get());
        assertEquals(2, result.lastRound().getEvalParticipantCount());
        assertEquals(WorkerFailure.Kind.DELIVERY, result.lastRound().getFailures().get(0).getKind());
    }

    @Test
    public void testSlowWorkerTimesOut() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).perRoundTimeoutMs(300).build(),
            ParameterVector.zeros(1));
        coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0));
        coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0));
        coordinator.registerWorker(2, new FakeWorker(2, 10, 1.0).mode(FakeWorker.Mode.HANG_FIT));

        long start = System.currentTimeMillis();
        RunResult result = coordinator.run();

        assertTrue(System.currentTimeMillis() - start < 5_000, "barrier must not wait for the slow worker");
        assertEquals(2, result.lastRound().getParticipantCount());
        assertEquals(WorkerFailure.Kind.TIMEOUT, result.lastRound().getFailures().get(0).getKind());
    }

    @Test
    public void testRetryThenAbortKeepsLastGoodParameters() throws Exception {
        coordinator = new Coordinator(config().totalRounds(3).perRoundTimeoutMs(200).build(),
            ParameterVector.zeros(1));
        FakeWorker a = new FakeWorker(0, 10, 2.0);
        FakeWorker b = new FakeWorker(1, 10, 4.0);
        coordinator.registerWorker(0, a);
        coordinator.registerWorker(1, b);

        coordinator.playRound();
        assertEquals(1, coordinator.getRunState().getCurrentRound());
        ParameterVector afterRoundOne = coordinator.getRunState().getGlobalParameters();

        b.mode(FakeWorker.Mode.FAIL_FIT);
        RunAbortedException e = assertThrows(RunAbortedException.class, () -> coordinator.run());

        assertEquals(2, e.getRoundNumber());
        assertEquals(3, e.getAttempts());
        assertEquals(afterRoundOne, e.getLastGoodParameters());
        assertEquals(1, e.getHistory().size());
        assertEquals(List.of(1, 2, 2, 2), a.fitRounds);
        assertEquals(RunStatus.ABORTED, coordinator.getRunState().getStatus());
        assertEquals(RunStatus.ABORTED, a.finishedWith);
    }

    @Test
    public void testRetrySucceedsWhenWorkerRecovers() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).build(), ParameterVector.zeros(1));
        FakeWorker a = new FakeWorker(0, 10, 2.0);
        FakeWorker b = new FakeWorker(1, 10, 4.0).mode(FakeWorker.Mode.FAIL_EVAL);
        coordinator.registerWorker(0, a);
        coordinator.registerWorker(1, b);

        assertThrows(QuorumTimeoutException.class, () -> coordinator.playRound());
        // eval failed, nothing committed
        assertEquals(0, coordinator.getRunState().getCurrentRound());
        assertEquals(ParameterVector.zeros(1), coordinator.getRunState().getGlobalParameters());

        b.mode(FakeWorker.Mode.OK);
        RoundMetrics round = coordinator.playRound();

        assertEquals(1, round.getRoundNumber());
        assertEquals(2, round.getAttempts());
        assertEquals(1, coordinator.getRunState().getHistory().size());
        assertEquals(RunStatus.COMPLETED, coordinator.getRunState().getStatus());
    }

    @Test
    public void testShapeMismatchAbortsRun() throws Exception {
        coordinator = new Coordinator(config().build(), ParameterVector.zeros(2));
        coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0, 2.0));
        coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0, 2.0, 3.0));

        assertThrows(ShapeMismatchException.class, () -> coordinator.playRound());
        assertEquals(RunStatus.ABORTED, coordinator.getRunState().getStatus());
        assertThrows(IllegalStateException.class, () -> coordinator.playRound());
    }

    @Test
    public void testInitialParametersFromWorker() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).build());
        coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0, 1.0).mode(FakeWorker.Mode.UNREACHABLE));
        coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0, 1.0));
        coordinator.registerWorker(2, new FakeWorker(2, 10, 3.0, 3.0));

        assertNull(coordinator.getRunState().getGlobalParameters());
        RunResult result = coordinator.run();

        assertArrayEquals(new double[]{2.0, 2.0}, result.getGlobalParameters().toArray(), 1e-12);
    }

    @Test
    public void testRegistrationAck() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).workerCount(2).build(), ParameterVector.zeros(1));

        Ack first = coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0));
        assertTrue(first.isAccepted());
        assertEquals(1, first.getAcceptedRoundStart());

        // re-registration replaces the stale reference
        FakeWorker restarted = new FakeWorker(0, 10, 1.0);
        coordinator.registerWorker(0, restarted);
        coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0));
        assertEquals(2, coordinator.getRunState().getConnectedWorkers().size());

        coordinator.run();
        assertEquals(1, restarted.fitCalls.get());

        Ack late = coordinator.registerWorker(2, new FakeWorker(2, 10, 1.0));
        assertFalse(late.isAccepted());
    }

    @Test
    public void testRemovedWorkerIsNotSelected() throws Exception {
        coordinator = new Coordinator(config().totalRounds(2).build(), ParameterVector.zeros(1));
        FakeWorker gone = new FakeWorker(2, 10, 1.0);
        coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0));
        coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0));
        coordinator.registerWorker(2, gone);

        coordinator.playRound();
        assertTrue(coordinator.removeWorker(2));
        RoundMetrics second = coordinator.playRound();

        assertEquals(1, gone.fitCalls.get());
        assertEquals(2, second.getParticipantCount());
    }

    @Test
    public void testRunBlocksUntilQuorum() throws Exception {
        coordinator = new Coordinator(config().totalRounds(1).build(), ParameterVector.zeros(1));
        coordinator.registerWorker(0, new FakeWorker(0, 10, 1.0));

        Thread late = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            coordinator.registerWorker(1, new FakeWorker(1, 10, 1.0));
        });
        late.start();

        RunResult result = coordinator.run();
        late.join();

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.lastRound().getParticipantCount());
    }
}
