package infrastructure.parallel;

import domain.engine.SubexpressionGenerator;
import domain.model.SubexpressionTable;

import java.util.concurrent.RecursiveTask;

import static application.OrchestratorConfiguration.DIRECT_GENERATION_MAX_COUNT;

/**
 * {@link RecursiveTask} that generates a subexpression table by generating its
 * two halves in parallel.
 *
 * <p>Counts up to {@value application.OrchestratorConfiguration#DIRECT_GENERATION_MAX_COUNT}
 * are enumerated directly on the worker thread. Larger counts fork the left half,
 * compute the right half in place, then combine. Each table is built by a single
 * thread, so tables need no synchronisation.
 */
public final class GenerationTask extends RecursiveTask<SubexpressionTable> {

    private final SubexpressionGenerator generator;
    private final int count;

    public GenerationTask(SubexpressionGenerator generator, int count) {
        this.generator = generator;
        this.count = count;
    }

    @Override
    protected SubexpressionTable compute() {
        if (count <= DIRECT_GENERATION_MAX_COUNT) {
            return generator.generateDirect(count);
        }

        int leftCount = count / 2;
        GenerationTask leftTask = new GenerationTask(generator, leftCount);
        leftTask.fork();
        SubexpressionTable right = new GenerationTask(generator, count - leftCount).compute();
        SubexpressionTable left = leftTask.join();

        return generator.combineHalves(left, right);
    }
}
