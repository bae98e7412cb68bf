package domain.engine;

import domain.model.Solution;
import domain.model.SubexpressionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Meet-in-the-middle search: an expression of {@code c} integers is split into
 * a left part of {@code left} integers and a right part of {@code c - left},
 * whose subexpression tables are generated and matched against the target.
 *
 * <h3>Splits</h3>
 * Every {@code left} in {@code 1..(c + 1) / 2} is tried. The mirrored splits are
 * covered because every non-commutative operator is matched in both directions
 * by {@link SolutionCombiner}.
 *
 * <p>Tables are generated once per size within one {@link #searchSize} call and
 * dropped when it returns, so memory is bounded by the tables of one count.
 *
 * <p>Reachability is limited by the generator's cap: outside exhaustive mode,
 * some expressions of a count are never produced.
 */
public final class MeetInTheMiddleEngine implements SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(MeetInTheMiddleEngine.class);

    private final SubexpressionGenerator generator;
    private final SolutionCombiner combiner;

    public MeetInTheMiddleEngine(SubexpressionGenerator generator, SolutionCombiner combiner) {
        this.generator = generator;
        this.combiner = combiner;
    }

    @Override
    public List<Solution> searchSize(int integerCount) {
        List<Solution> solutions = new ArrayList<>();
        if (integerCount < 2) return solutions;

        Map<Integer, SubexpressionTable> tables = new HashMap<>();
        int maxLeft = (integerCount + 1) / 2;

        for (int leftCount = 1; leftCount <= maxLeft; leftCount++) {
            int rightCount = integerCount - leftCount;
            if (rightCount < 1) continue;

            SubexpressionTable left = tables.computeIfAbsent(leftCount, generator::generate);
            SubexpressionTable right = tables.computeIfAbsent(rightCount, generator::generate);

            List<Solution> found = combiner.combine(left, right);
            logger.debug("Split {}+{}: {} x {} values, {} solutions",
                leftCount, rightCount, left.distinctValueCount(), right.distinctValueCount(), found.size());
            solutions.addAll(found);
        }
        return solutions;
    }
}
