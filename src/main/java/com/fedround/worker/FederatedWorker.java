package com.fedround.worker;

import com.fedround.data.Partition;
import com.fedround.exception.LocalTrainingException;
import com.fedround.model.EvalRequest;
import com.fedround.model.EvalResult;
import com.fedround.model.FitResult;
import com.fedround.model.ParameterVector;
import com.fedround.model.RoundConfig;
import com.fedround.model.RunStatus;
import com.fedround.rmi.WorkerService;
import com.fedround.trainer.Evaluation;
import com.fedround.trainer.ModelTrainer;
import com.fedround.trainer.TrainingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One autonomous participant owning exactly one partition.
 * 
 * Answers fit and evaluate calls from the coordinator using only its own rows.
 * Holds no state that a call could mutate, so fit and evaluate can never leak
 * one round into another. Trainer failures are reported back as
 * {@link LocalTrainingException}, they never bring the worker down.
 * 
 * Transport-free: {@link WorkerNode} exports an instance over RMI, tests and the
 * in-process simulation call it directly.
 */
public class FederatedWorker implements WorkerService {
    private static final Logger log = LoggerFactory.getLogger(FederatedWorker.class);

    private final Partition partition;
    private final ModelTrainer trainer;
    private final CountDownLatch runFinished = new CountDownLatch(1);

    private volatile RunStatus finalStatus = RunStatus.RUNNING;

    public FederatedWorker(Partition partition, ModelTrainer trainer) {
        this.partition = Objects.requireNonNull(partition, "partition cannot be null");
        this.trainer = Objects.requireNonNull(trainer, "trainer cannot be null");

        log.info("[Worker {}] Initialized: {} train rows, {} held-out rows, trainer={}",
            partition.getWorkerId(), partition.getTrainRows().size(), partition.getEvalRows().size(),
            trainer.getName());
    }

    // ==================== WorkerService Implementation ====================

    @Override
    public int getWorkerId() {
        return partition.getWorkerId();
    }

    @Override
    public boolean ping() {
        log.debug("[Worker {}] Ping received", partition.getWorkerId());
        return true;
    }

    @Override
    public ParameterVector getInitialParameters() {
        return trainer.initialParameters();
    }

    @Override
    public FitResult fit(RoundConfig config) throws LocalTrainingException {
        int id = partition.getWorkerId();
        log.info("[Worker {}] Round {}: training on {} rows", id, config.getRoundNumber(),
            partition.getTrainRows().size());

        long start = System.currentTimeMillis();
        TrainingOutcome outcome;
        try {
            outcome = trainer.train(config.getParameters(), partition.getTrainRows(), config.getHyperparameters());
        } catch (LocalTrainingException e) {
            log.warn("[Worker {}] Round {}: local training failed: {}", id, config.getRoundNumber(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[Worker {}] Round {}: trainer crashed", id, config.getRoundNumber(), e);
            throw new LocalTrainingException("Trainer crashed: " + e.getMessage(), e);
        }

        log.info("[Worker {}] Round {}: training completed in {} ms, train accuracy {}",
            id, config.getRoundNumber(), System.currentTimeMillis() - start,
            String.format("%.2f%%", outcome.getTrainMetric() * 100));

        return new FitResult(id, outcome.getParameters(), partition.getTrainRows().size(), outcome.getTrainMetric());
    }

    @Override
    public EvalResult evaluate(EvalRequest request) throws LocalTrainingException {
        int id = partition.getWorkerId();
        log.info("[Worker {}] Round {}: evaluating on {} held-out rows", id, request.getRoundNumber(),
            partition.getEvalRows().size());

        Evaluation evaluation;
        try {
            evaluation = trainer.evaluate(request.getParameters(), partition.getEvalRows());
        } catch (LocalTrainingException e) {
            log.warn("[Worker {}] Round {}: evaluation failed: {}", id, request.getRoundNumber(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[Worker {}] Round {}: evaluation crashed", id, request.getRoundNumber(), e);
            throw new LocalTrainingException("Evaluation crashed: " + e.getMessage(), e);
        }

        log.info("[Worker {}] Round {}: accuracy {}, loss {}", id, request.getRoundNumber(),
            String.format("%.2f%%", evaluation.getAccuracy() * 100), String.format("%.4f", evaluation.getLoss()));

        return new EvalResult(id, partition.getEvalRows().size(), evaluation.getLoss(), evaluation.getAccuracy());
    }

    @Override
    public void onRunFinished(RunStatus status, int roundsCompleted) {
        log.info("[Worker {}] Run finished: {} after {} round(s)", partition.getWorkerId(), status, roundsCompleted);
        finalStatus = status;
        runFinished.countDown();
    }

    // ==================== Local API ====================

    /**
     * Blocks until the coordinator reports the end of the run.
     * 
     * @param timeout maximum wait
     * @param unit unit of the timeout
     * @return true if the run finished, false on timeout
     */
    public boolean awaitRunFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return runFinished.await(timeout, unit);
    }

    /**
     * Releases anyone waiting for the run, e.g. when the coordinator died.
     */
    void abandon() {
        if (finalStatus == RunStatus.RUNNING) {
            finalStatus = RunStatus.ABORTED;
        }
        runFinished.countDown();
    }

    /**
     * @return status reported by the coordinator, RUNNING until then
     */
    public RunStatus getFinalStatus() {
        return finalStatus;
    }

    public Partition getPartition() {
        return partition;
    }
}
