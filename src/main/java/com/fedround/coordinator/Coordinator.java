package com.fedround.coordinator;

import com.fedround.aggregation.Aggregator;
import com.fedround.aggregation.WeightedValue;
import com.fedround.exception.QuorumTimeoutException;
import com.fedround.exception.RunAbortedException;
import com.fedround.exception.ShapeMismatchException;
import com.fedround.model.Ack;
import com.fedround.model.EvalRequest;
import com.fedround.model.EvalResult;
import com.fedround.model.FitResult;
import com.fedround.model.ParameterVector;
import com.fedround.model.RoundConfig;
import com.fedround.model.RoundMetrics;
import com.fedround.model.RunStatus;
import com.fedround.model.WorkerFailure;
import com.fedround.rmi.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.rmi.RemoteException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Owns the round lifecycle of a federated run.
 * 
 * Lifecycle:
 *   1. Workers register (any time before termination)
 *   2. run() blocks in AWAITING_QUORUM until minParticipants workers are connected
 *   3. Each round: broadcast RoundConfig to all connected workers (fit barrier),
 *      aggregate the updated parameters, broadcast them for evaluation (eval barrier),
 *      commit parameters + metrics to the history
 *   4. A round whose barrier ends below quorum is retried with the same round number,
 *      up to maxRoundRetries times; then the run aborts
 *   5. After totalRounds rounds the run terminates; state stays readable
 * 
 * Rounds never overlap: round n+1 is configured only after round n was committed.
 * Worker failures are absorbed per round and never reach other workers.
 * 
 * @see RoundDispatcher
 * @see RunState
 */
public class Coordinator {
    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final RunConfig config;
    private final RunState state;
    private final RoundDispatcher dispatcher;

    // Attempts made so far for the round currently being played, only touched by the round thread
    private int attemptsForCurrentRound = 0;

    /**
     * Creates a coordinator that fetches its initial parameters from the first worker.
     */
    public Coordinator(RunConfig config) {
        this(config, null);
    }

    /**
     * @param config run configuration
     * @param initialParameters starting global parameters, or null to ask a worker for them
     */
    public Coordinator(RunConfig config, ParameterVector initialParameters) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.state = new RunState(initialParameters);
        this.dispatcher = new RoundDispatcher();
        log.info("Coordinator initialized with {}", config);
    }

    // ==================== Membership ====================

    /**
     * Registers (or re-registers) a worker.
     * 
     * @param workerId ordinal of the worker
     * @param worker reference used to call the worker
     * @return ack with the first round the worker takes part in, rejected if the run is over
     */
    public Ack registerWorker(int workerId, WorkerService worker) {
        Objects.requireNonNull(worker, "worker cannot be null");
        if (state.isTerminated()) {
            log.warn("Worker {} tried to join a terminated run", workerId);
            return Ack.rejected();
        }

        state.getConnectedWorkers().register(workerId, worker);

        // Participants of a round are fixed when it is configured
        int nextRound = state.getCurrentRound() + 1;
        int roundStart = state.getPhase().isRoundInFlight() ? nextRound + 1 : nextRound;
        return Ack.accepted(roundStart);
    }

    /**
     * Removes a worker from later rounds (dead or gone).
     */
    public boolean removeWorker(int workerId) {
        return state.getConnectedWorkers().remove(workerId);
    }

    /**
     * @return true if enough workers are connected to start a round
     */
    public boolean isQuorumReached() {
        return state.getConnectedWorkers().size() >= config.getMinParticipants();
    }

    /**
     * Waits for quorum without starting anything.
     * 
     * @param timeoutMs maximum wait, 0 = just check
     * @return true if quorum is reached
     */
    public boolean awaitQuorum(long timeoutMs) throws InterruptedException {
        return state.getConnectedWorkers().awaitSize(config.getMinParticipants(), timeoutMs);
    }

    // ==================== Run ====================

    /**
     * Plays the whole run: waits for quorum, then all rounds with bounded retries.
     * 
     * @return final parameters and full history
     * @throws RunAbortedException if a round failed more than maxRoundRetries times
     * @throws ShapeMismatchException if workers reported parameters of different shapes
     * @throws InterruptedException if the calling thread is interrupted
     */
    public RunResult run() throws RunAbortedException, InterruptedException {
        if (state.isTerminated()) {
            throw new IllegalStateException("Run already terminated with status " + state.getStatus());
        }

        blockUntilQuorum();

        while (!state.isTerminated()) {
            try {
                playRound();
            } catch (QuorumTimeoutException e) {
                int roundNumber = e.getRoundNumber();
                if (attemptsForCurrentRound > config.getMaxRoundRetries()) {
                    throw abort(roundNumber, e);
                }
                log.warn("Round {} attempt {} failed: {}. Retrying ({} of {} retries used)",
                    roundNumber, attemptsForCurrentRound, e.getMessage(),
                    attemptsForCurrentRound, config.getMaxRoundRetries());

                // Give lost workers a chance to come back before the retry
                if (!awaitQuorum(config.getPerRoundTimeoutMs())) {
                    log.warn("Quorum still not reached after {} ms", config.getPerRoundTimeoutMs());
                }
            }
        }

        log.info("[OK] Run completed: {} round(s)", state.getCurrentRound());
        return new RunResult(state.getStatus(), state.getGlobalParameters(), state.getHistory());
    }

    /**
     * Plays one attempt of the next round.
     * 
     * The attempt never starts below quorum: if fewer than minParticipants workers
     * are connected, it fails immediately without contacting any worker.
     * 
     * @return metrics of the committed round
     * @throws QuorumTimeoutException if the attempt ended below quorum; the round is not committed
     * @throws ShapeMismatchException if the fit replies have different shapes; the run is aborted
     * @throws IllegalStateException if the run is already terminated
     * @throws InterruptedException if interrupted at a barrier
     */
    public RoundMetrics playRound() throws QuorumTimeoutException, InterruptedException {
        if (state.isTerminated()) {
            throw new IllegalStateException("Run already terminated with status " + state.getStatus());
        }

        int roundNumber = state.getCurrentRound() + 1;
        attemptsForCurrentRound++;

        try {
            RoundMetrics metrics = playRoundAttempt(roundNumber);
            attemptsForCurrentRound = 0;

            if (state.getCurrentRound() >= config.getTotalRounds()) {
                terminate(RunStatus.COMPLETED);
            }
            return metrics;
        } catch (QuorumTimeoutException e) {
            state.setPhase(CoordinatorPhase.AWAITING_QUORUM);
            throw e;
        } catch (ShapeMismatchException e) {
            log.error("Round {}: {}. Aborting run (configuration error)", roundNumber, e.getMessage());
            terminate(RunStatus.ABORTED);
            throw e;
        }
    }

    private RoundMetrics playRoundAttempt(int roundNumber) throws QuorumTimeoutException, InterruptedException {
        int quorum = config.getMinParticipants();

        // ---- ConfiguringRound: select every connected worker (fraction = 1.0)
        Map<Integer, WorkerService> participants = state.getConnectedWorkers().snapshot();
        if (participants.size() < quorum) {
            throw new QuorumTimeoutException(roundNumber, "configuration", participants.size(), quorum);
        }
        state.setPhase(CoordinatorPhase.CONFIGURING_ROUND);
        ensureInitialParameters(roundNumber, participants);

        RoundConfig roundConfig = new RoundConfig(roundNumber, state.getGlobalParameters(),
            config.getHyperparameters());
        log.info("Round {}/{} (attempt {}): configuring {} worker(s) {}",
            roundNumber, config.getTotalRounds(), attemptsForCurrentRound, participants.size(),
            participants.keySet());

        // ---- CollectingFit
        state.setPhase(CoordinatorPhase.COLLECTING_FIT);
        RoundDispatcher.Barrier<FitResult> fit = dispatcher.dispatch(roundNumber, WorkerFailure.Stage.FIT,
            participants, worker -> worker.fit(roundConfig), config.getPerRoundTimeoutMs());
        List<WorkerFailure> failures = new ArrayList<>(fit.getFailures());

        if (fit.successCount() < quorum) {
            throw new QuorumTimeoutException(roundNumber, "fit", fit.successCount(), quorum);
        }

        // ---- Aggregating (staged, committed only once eval reached quorum too)
        state.setPhase(CoordinatorPhase.AGGREGATING);
        List<WeightedValue<ParameterVector>> parameterUpdates = new ArrayList<>();
        List<WeightedValue<Double>> trainMetrics = new ArrayList<>();
        for (FitResult result : fit.getResults().values()) {
            parameterUpdates.add(WeightedValue.of(result.getParameters(), result.getSampleCount()));
            trainMetrics.add(WeightedValue.of(result.getTrainMetric(), result.getSampleCount()));
        }
        ParameterVector aggregated = Aggregator.aggregateParameters(parameterUpdates);
        double trainMetric = Aggregator.aggregateScalar(trainMetrics);
        log.info("Round {}: aggregated {} fit result(s), train metric {}",
            roundNumber, fit.successCount(), String.format("%.4f", trainMetric));

        // ---- CollectingEval, on the subset that completed fit
        state.setPhase(CoordinatorPhase.COLLECTING_EVAL);
        Map<Integer, WorkerService> evaluators = new TreeMap<>(participants);
        evaluators.keySet().retainAll(fit.getResults().keySet());
        EvalRequest evalRequest = new EvalRequest(roundNumber, aggregated);
        RoundDispatcher.Barrier<EvalResult> eval = dispatcher.dispatch(roundNumber, WorkerFailure.Stage.EVAL,
            evaluators, worker -> worker.evaluate(evalRequest), config.getPerRoundTimeoutMs());
        failures.addAll(eval.getFailures());

        if (eval.successCount() < quorum) {
            throw new QuorumTimeoutException(roundNumber, "eval", eval.successCount(), quorum);
        }

        List<WeightedValue<Double>> losses = new ArrayList<>();
        List<WeightedValue<Double>> evalMetrics = new ArrayList<>();
        for (EvalResult result : eval.getResults().values()) {
            losses.add(WeightedValue.of(result.getLoss(), result.getSampleCount()));
            evalMetrics.add(WeightedValue.of(result.getEvalMetric(), result.getSampleCount()));
        }
        double loss = Aggregator.aggregateScalar(losses);
        double evalMetric = Aggregator.aggregateScalar(evalMetrics);

        // ---- RoundComplete
        RoundMetrics metrics = new RoundMetrics(roundNumber, trainMetric, loss, evalMetric,
            fit.successCount(), eval.successCount(), attemptsForCurrentRound, failures);
        state.commitRound(aggregated, metrics);

        log.info("[OK] Round {}/{} complete: loss {}, eval metric {}, participants {} ({} failure(s))",
            roundNumber, config.getTotalRounds(), String.format("%.4f", loss), String.format("%.4f", evalMetric),
            fit.successCount(), failures.size());
        return metrics;
    }

    /**
     * Obtains the starting parameters from a worker if none were configured.
     * Tries the participants in order; all of them failing counts as a failed attempt.
     */
    private void ensureInitialParameters(int roundNumber, Map<Integer, WorkerService> participants)
            throws QuorumTimeoutException {
        if (state.getGlobalParameters() != null) {
            return;
        }
        for (Map.Entry<Integer, WorkerService> entry : participants.entrySet()) {
            try {
                ParameterVector initial = entry.getValue().getInitialParameters();
                if (initial != null) {
                    state.setGlobalParameters(initial);
                    log.info("Initial parameters ({} element(s)) obtained from worker {}",
                        initial.size(), entry.getKey());
                    return;
                }
            } catch (RemoteException e) {
                log.warn("Worker {} could not provide initial parameters: {}", entry.getKey(), e.getMessage());
            }
        }
        throw new QuorumTimeoutException(roundNumber, "initialization", 0, 1);
    }

    private void blockUntilQuorum() throws InterruptedException {
        state.setPhase(CoordinatorPhase.AWAITING_QUORUM);
        log.info("Waiting for {} worker(s) to connect...", config.getMinParticipants());
        while (!awaitQuorum(config.getQuorumLogIntervalMs())) {
            log.info("Still waiting for quorum: {}/{} worker(s) connected",
                state.getConnectedWorkers().size(), config.getMinParticipants());
        }
        log.info("[OK] Quorum reached: {} worker(s) connected", state.getConnectedWorkers().size());
    }

    private RunAbortedException abort(int roundNumber, QuorumTimeoutException cause) {
        log.error("Round {} failed {} time(s), aborting run. Last good parameters kept from round {}",
            roundNumber, attemptsForCurrentRound, state.getCurrentRound());
        terminate(RunStatus.ABORTED);
        return new RunAbortedException(roundNumber, attemptsForCurrentRound, state.getGlobalParameters(),
            state.getHistory(), cause);
    }

    private void terminate(RunStatus status) {
        state.terminate(status);
        log.info("Run terminated: {} after {} round(s)", status, state.getCurrentRound());
        notifyWorkers(status);
    }

    /**
     * Best-effort end-of-run notification. Unreachable workers are only logged.
     */
    private void notifyWorkers(RunStatus status) {
        int rounds = state.getCurrentRound();
        for (Map.Entry<Integer, WorkerService> entry : state.getConnectedWorkers().snapshot().entrySet()) {
            try {
                entry.getValue().onRunFinished(status, rounds);
            } catch (RemoteException e) {
                log.warn("Could not notify worker {} of run end: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    // ==================== Queries ====================

    public RunState getRunState() {
        return state;
    }

    public CoordinatorPhase getPhase() {
        return state.getPhase();
    }

    public RunConfig getConfig() {
        return config;
    }

    /**
     * Releases the dispatcher threads. The run state stays readable.
     */
    public void shutdown() {
        dispatcher.shutdown();
        log.info("Coordinator shut down");
    }
}
