package benchmark;

import application.SearchConfiguration;
import application.SearchOrchestrator;
import domain.model.Operator;
import domain.model.Solution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Benchmark comparing the best solution found under three operator sets.
 *
 * <p>For each target the search runs with
 * <ul>
 *   <li><b>Basic</b>: addition only</li>
 *   <li><b>Standard</b>: {@code + - * /}</li>
 *   <li><b>With exponentiation</b>: {@code + - * / ^}</li>
 * </ul>
 * and reports solution count, best expression and elapsed time per scenario,
 * followed by a verdict whether exponentiation improved on the standard set.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * java -cp target/classes benchmark.OperatorComparisonBenchmark [target ...]
 * }</pre>
 *
 * <h3>Output Format</h3>
 * <pre>
 * ========================================
 * TARGET: 343 (max_int=8, max_numbers=6)
 * ========================================
 * | Scenario                  | Count | Time (ms) | Best
 * | With exponentiation       |     5 |        41 | 7 ^ 3 (ops=1, distinct=2)
 * Verdict: IMPROVED_FEWER_OPERATIONS
 * </pre>
 */
public class OperatorComparisonBenchmark {

    // Benchmark configuration
    static final int DEFAULT_MAX_INTEGER = 8;
    static final int DEFAULT_MAX_INTEGER_COUNT = 6;
    static final int RESULT_COUNT = 5;
    private static final long[] DEFAULT_TARGETS = {2285, 100, 512, 128, 343};

    /**
     * Operator set of one run.
     */
    public enum Scenario {
        BASIC("Basic (+ only)", EnumSet.of(Operator.ADD)),
        STANDARD("Standard (+, -, *, /)",
            EnumSet.of(Operator.ADD, Operator.SUBTRACT, Operator.MULTIPLY, Operator.DIVIDE)),
        WITH_EXPONENTIATION("With exponentiation", EnumSet.allOf(Operator.class));

        private final String label;
        private final Set<Operator> operators;

        Scenario(String label, Set<Operator> operators) {
            this.label = label;
            this.operators = Collections.unmodifiableSet(operators);
        }

        public String getLabel() { return label; }
        public Set<Operator> getOperators() { return operators; }
    }

    /**
     * Outcome of comparing the standard set against the set with exponentiation.
     */
    public enum Verdict {
        IMPROVED_FEWER_OPERATIONS,
        IMPROVED_FEWER_INTEGERS,
        NOT_IMPROVED,
        ENABLED_SOLUTION,
        LOST_SOLUTION,
        NO_SOLUTIONS
    }

    /**
     * Benchmark result for a single scenario.
     */
    public static final class ScenarioResult {
        final Scenario scenario;
        final List<Solution> solutions;
        final long elapsedMs;

        ScenarioResult(Scenario scenario, List<Solution> solutions, long elapsedMs) {
            this.scenario = scenario;
            this.solutions = solutions;
            this.elapsedMs = elapsedMs;
        }

        public Scenario getScenario() { return scenario; }
        public List<Solution> getSolutions() { return solutions; }
        public long getElapsedMs() { return elapsedMs; }

        @Override
        public String toString() {
            String best = solutions.isEmpty()
                ? "none"
                : String.format("%s (ops=%d, distinct=%d)", solutions.get(0).getExpression(),
                    solutions.get(0).getOperatorCount(), solutions.get(0).getDistinctIntegerCount());
            return String.format(Locale.ROOT, "| %-25s | %5d | %9d | %s",
                scenario.getLabel(), solutions.size(), elapsedMs, best);
        }
    }

    public static void main(String[] args) {
        long[] targets = DEFAULT_TARGETS;
        if (args.length > 0) {
            targets = new long[args.length];
            for (int i = 0; i < args.length; i++) {
                targets[i] = Long.parseLong(args[i]);
            }
        }

        for (long target : targets) {
            printHeader(target);
            List<ScenarioResult> results = compare(target, DEFAULT_MAX_INTEGER, DEFAULT_MAX_INTEGER_COUNT);
            System.out.printf("| %-25s | %5s | %9s | %s%n", "Scenario", "Count", "Time (ms)", "Best");
            for (ScenarioResult result : results) {
                System.out.println(result);
            }
            System.out.println("Verdict: " + verdict(results));
            System.out.println();
        }
    }

    /**
     * Runs every {@link Scenario} for one target.
     *
     * @param target          the target
     * @param maxInteger      pool is {@code 1..maxInteger}
     * @param maxIntegerCount largest number of integers per expression
     * @return one result per scenario, in declaration order
     */
    public static List<ScenarioResult> compare(long target, int maxInteger, int maxIntegerCount) {
        List<ScenarioResult> results = new ArrayList<>();
        for (Scenario scenario : Scenario.values()) {
            SearchConfiguration config = new SearchConfiguration.Builder()
                .setTarget(target)
                .setMaxInteger(maxInteger)
                .setOperators(scenario.getOperators())
                .setMaxIntegerCount(maxIntegerCount)
                .setResultCount(RESULT_COUNT)
                .build();

            long start = System.currentTimeMillis();
            List<Solution> solutions;
            try (SearchOrchestrator orchestrator = new SearchOrchestrator(config)) {
                solutions = orchestrator.search();
            }
            results.add(new ScenarioResult(scenario, solutions, System.currentTimeMillis() - start));
        }
        return results;
    }

    /**
     * Judges whether exponentiation improved on the standard operator set.
     *
     * @param results output of {@link #compare}
     * @return the verdict
     */
    public static Verdict verdict(List<ScenarioResult> results) {
        List<Solution> standard = solutionsOf(results, Scenario.STANDARD);
        List<Solution> withExp = solutionsOf(results, Scenario.WITH_EXPONENTIATION);

        if (standard.isEmpty() && withExp.isEmpty()) return Verdict.NO_SOLUTIONS;
        if (standard.isEmpty()) return Verdict.ENABLED_SOLUTION;
        if (withExp.isEmpty()) return Verdict.LOST_SOLUTION;

        Solution standardBest = standard.get(0);
        Solution expBest = withExp.get(0);
        if (expBest.getOperatorCount() < standardBest.getOperatorCount()) {
            return Verdict.IMPROVED_FEWER_OPERATIONS;
        }
        if (expBest.getOperatorCount() == standardBest.getOperatorCount()
                && expBest.getDistinctIntegerCount() < standardBest.getDistinctIntegerCount()) {
            return Verdict.IMPROVED_FEWER_INTEGERS;
        }
        return Verdict.NOT_IMPROVED;
    }

    private static List<Solution> solutionsOf(List<ScenarioResult> results, Scenario scenario) {
        for (ScenarioResult result : results) {
            if (result.scenario == scenario) return result.solutions;
        }
        return Collections.emptyList();
    }

    private static void printHeader(long target) {
        System.out.println("========================================");
        System.out.printf("TARGET: %d (max_int=%d, max_numbers=%d)%n",
            target, DEFAULT_MAX_INTEGER, DEFAULT_MAX_INTEGER_COUNT);
        System.out.println("========================================");
    }
}
