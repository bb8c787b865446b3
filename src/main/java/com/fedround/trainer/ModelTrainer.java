package com.fedround.trainer;

import com.fedround.data.Row;
import com.fedround.exception.LocalTrainingException;
import com.fedround.model.Hyperparameters;
import com.fedround.model.ParameterVector;

import java.util.List;

/**
 * Swappable local learning capability used by a worker.
 * 
 * The coordination protocol only relies on the parameter vector having a
 * fixed shape for a given dataset schema; how the trainer fits is its own business.
 */
public interface ModelTrainer {

    /**
     * @return starting parameters for a fresh run (shape defines the model)
     */
    ParameterVector initialParameters();

    /**
     * Trains from {@code start} on the given rows only.
     * Must not modify {@code start}.
     * 
     * @param start global parameters of the current round
     * @param rows local train rows
     * @param hyperparameters round hyperparameters
     * @return updated parameters and training metric
     * @throws LocalTrainingException if training cannot be done on these rows
     */
    TrainingOutcome train(ParameterVector start, List<Row> rows, Hyperparameters hyperparameters)
        throws LocalTrainingException;

    /**
     * Scores parameters against held-out rows without changing any state.
     * 
     * @param parameters parameters to score
     * @param rows local held-out rows
     * @return loss and metric
     * @throws LocalTrainingException if the rows cannot be scored
     */
    Evaluation evaluate(ParameterVector parameters, List<Row> rows) throws LocalTrainingException;

    /**
     * @return descriptive name of the trainer (for logging)
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
