package com.fedround.coordinator;

import com.fedround.exception.LocalTrainingException;
import com.fedround.model.EvalRequest;
import com.fedround.model.EvalResult;
import com.fedround.model.FitResult;
import com.fedround.model.ParameterVector;
import com.fedround.model.RoundConfig;
import com.fedround.model.RunStatus;
import com.fedround.rmi.WorkerService;

import java.rmi.RemoteException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker with scripted behaviour, drives the coordinator without RMI.
 */
class FakeWorker implements WorkerService {

    enum Mode { OK, FAIL_FIT, UNREACHABLE, HANG_FIT, FAIL_EVAL }

    private final int workerId;
    private final int sampleCount;
    private final double[] update;
    private volatile Mode mode = Mode.OK;

    final AtomicInteger fitCalls = new AtomicInteger();
    final AtomicInteger evalCalls = new AtomicInteger();
    final List<Integer> fitRounds = new CopyOnWriteArrayList<>();
    volatile RunStatus finishedWith;

    /**
     * @param update parameters returned by every fit
     */
    FakeWorker(int workerId, int sampleCount, double... update) {
        this.workerId = workerId;
        this.sampleCount = sampleCount;
        this.update = update;
    }

    FakeWorker mode(Mode mode) {
        this.mode = mode;
        return this;
    }

    @Override
    public int getWorkerId() {
        return workerId;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public ParameterVector getInitialParameters() throws RemoteException {
        if (mode == Mode.UNREACHABLE) {
            throw new RemoteException("connection refused");
        }
        return ParameterVector.zeros(update.length);
    }

    @Override
    public FitResult fit(RoundConfig config) throws LocalTrainingException, RemoteException {
        fitCalls.incrementAndGet();
        fitRounds.add(config.getRoundNumber());
        switch (mode) {
            case FAIL_FIT:
                throw new LocalTrainingException("scripted failure");
            case UNREACHABLE:
                throw new RemoteException("connection refused");
            case HANG_FIT:
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new RemoteException("interrupted");
            default:
                return new FitResult(workerId, ParameterVector.of(update), sampleCount, 0.5);
        }
    }

    @Override
    public EvalResult evaluate(EvalRequest request) throws LocalTrainingException, RemoteException {
        evalCalls.incrementAndGet();
        if (mode == Mode.FAIL_EVAL) {
            throw new LocalTrainingException("scripted eval failure");
        }
        if (mode == Mode.UNREACHABLE) {
            throw new RemoteException("connection refused");
        }
        return new EvalResult(workerId, sampleCount, 0.25, 0.75);
    }

    @Override
    public void onRunFinished(RunStatus status, int roundsCompleted) {
        finishedWith = status;
    }
}
