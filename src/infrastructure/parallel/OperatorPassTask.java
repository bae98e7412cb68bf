package infrastructure.parallel;

import domain.engine.SolutionCombiner;
import domain.model.Operator;
import domain.model.Solution;
import domain.model.SubexpressionTable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RecursiveTask;

/**
 * {@link RecursiveTask} that runs the combination passes of several operators
 * in parallel, one subtask per operator.
 *
 * <p>Both tables are only read during a pass, so the passes share them without
 * locking. Results are concatenated in operator order, matching a sequential
 * {@link SolutionCombiner#combine} call.
 */
public final class OperatorPassTask extends RecursiveTask<List<Solution>> {

    private final SolutionCombiner combiner;
    private final Operator[] operators;
    private final SubexpressionTable left;
    private final SubexpressionTable right;

    public OperatorPassTask(SolutionCombiner combiner, Operator[] operators,
                            SubexpressionTable left, SubexpressionTable right) {
        this.combiner = combiner;
        this.operators = operators;
        this.left = left;
        this.right = right;
    }

    @Override
    protected List<Solution> compute() {
        if (operators.length == 1) {
            return combiner.pass(operators[0], left, right);
        }

        List<OperatorPassTask> subtasks = new ArrayList<>(operators.length);
        for (Operator op : operators) {
            subtasks.add(new OperatorPassTask(combiner, new Operator[] {op}, left, right));
        }
        invokeAll(subtasks);

        List<Solution> solutions = new ArrayList<>();
        for (OperatorPassTask subtask : subtasks) {
            solutions.addAll(subtask.join());
        }
        return solutions;
    }
}
