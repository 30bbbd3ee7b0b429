package org.calista.grila.crossword.model;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.Literal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CpSatSolver — {@link ConstraintSolver} on top of OR-Tools CP-SAT.
 *
 * <p>
 * Перевод модели:
 * - переменная клетки -> IntVar 0..25;
 * - таблица слота -> addAllowedAssignments по переменным позициям (константы отфильтрованы заранее);
 * - дизъюнкция -> по булеву флагу на позицию ({@code a != b} only-enforce-if флаг) + addBoolOr.
 * Первый кортеж каждой таблицы уходит в hints, чтобы поиск начинал с лучших по рангу слов.
 * </p>
 *
 * <p>Один worker по умолчанию: тогда результат воспроизводим для одного и того же seed.</p>
 */
public final class CpSatSolver implements ConstraintSolver {

    private static final Logger log = LogManager.getLogger(CpSatSolver.class);

    private static volatile boolean nativeLoaded;

    // =========================
    // Config
    // =========================

    public static final class Config {
        public int numWorkers = 1;
        public int randomSeed = 0;
        public boolean logSearchProgress = false;

        public Config validate() {
            if (numWorkers < 1) numWorkers = 1;
            if (randomSeed < 0) randomSeed = 0;
            return this;
        }
    }

    private final Config cfg;

    public CpSatSolver() {
        this(null);
    }

    public CpSatSolver(Config cfg) {
        this.cfg = (cfg == null ? new Config() : cfg).validate();
        loadNative();
    }

    private static void loadNative() {
        if (nativeLoaded) return;
        synchronized (CpSatSolver.class) {
            if (nativeLoaded) return;
            Loader.loadNativeLibraries();
            nativeLoaded = true;
            log.debug("OR-Tools native libraries loaded");
        }
    }

    @Override
    public Solution solve(ConstraintModel model, Duration budget, Instant deadline) {
        Objects.requireNonNull(model, "model");
        if (model.isTriviallyInfeasible()) return Solution.infeasible(model.infeasibleReason());

        double limitSeconds = limitSeconds(budget, deadline);
        if (limitSeconds <= 0.0) return Solution.timeout("time budget exhausted before solving");
        if (Thread.currentThread().isInterrupted()) return Solution.timeout("interrupted");

        CpModel cp = new CpModel();
        int nVars = model.variableCount();
        IntVar[] vars = new IntVar[nVars];
        for (int v = 0; v < nVars; v++) {
            vars[v] = cp.newIntVar(0, Term.ALPHABET - 1, "v" + v + "@" + model.variablePosition(v));
        }

        boolean[] hinted = new boolean[nVars];
        for (TableConstraint table : model.tables()) {
            String failure = addTable(cp, vars, table, hinted);
            if (failure != null) return Solution.infeasible(failure);
        }
        for (Disjunction d : model.disjunctions()) {
            String failure = addDisjunction(cp, vars, d);
            if (failure != null) return Solution.infeasible(failure);
        }

        if (nVars == 0) {
            // constants only: every table and disjunction was already checked above
            return Solution.feasible(new int[0]);
        }

        CpSolver solver = new CpSolver();
        solver.getParameters()
                .setNumWorkers(cfg.numWorkers)
                .setRandomSeed(cfg.randomSeed)
                .setLogSearchProgress(cfg.logSearchProgress);
        if (Double.isFinite(limitSeconds)) solver.getParameters().setMaxTimeInSeconds(limitSeconds);

        CpSolverStatus status = solver.solve(cp);
        long tookMs = (long) (solver.wallTime() * 1000.0);

        switch (status) {
            case OPTIMAL, FEASIBLE -> {
                int[] values = new int[nVars];
                for (int v = 0; v < nVars; v++) values[v] = (int) solver.value(vars[v]);
                log.debug("CP-SAT solved {} in {} ms", model, tookMs);
                return Solution.feasible(values);
            }
            case INFEASIBLE -> {
                log.debug("CP-SAT proved {} infeasible in {} ms", model, tookMs);
                return Solution.infeasible("CP-SAT: infeasible after " + tookMs + " ms");
            }
            case UNKNOWN -> {
                log.warn("CP-SAT stopped after {} ms without a solution", tookMs);
                return Solution.timeout("CP-SAT: no solution within " + limitSeconds + " s");
            }
            default -> {
                log.warn("CP-SAT rejected {}: {}", model, status);
                return Solution.infeasible("CP-SAT status " + status);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Translation
    // ---------------------------------------------------------------------

    /** @return failure detail when the table has no tuple compatible with its constants */
    private static String addTable(CpModel cp, IntVar[] vars, TableConstraint table, boolean[] hinted) {
        List<Term> terms = table.terms();
        List<Integer> varPositions = new ArrayList<>(terms.size());
        for (int i = 0; i < terms.size(); i++) {
            if (terms.get(i).isVariable()) varPositions.add(i);
        }

        List<int[]> projected = new ArrayList<>(table.tuples().size());
        for (int[] tuple : table.tuples()) {
            boolean match = true;
            for (int i = 0; i < terms.size() && match; i++) {
                Term t = terms.get(i);
                if (!t.isVariable() && t.value() != tuple[i]) match = false;
            }
            if (!match) continue;
            int[] row = new int[varPositions.size()];
            for (int k = 0; k < row.length; k++) row[k] = tuple[varPositions.get(k)];
            projected.add(row);
        }

        if (projected.isEmpty()) return "no tuple fits " + table;
        if (varPositions.isEmpty()) return null;

        IntVar[] scope = new IntVar[varPositions.size()];
        for (int k = 0; k < scope.length; k++) scope[k] = vars[terms.get(varPositions.get(k)).variable()];

        com.google.ortools.sat.TableConstraint allowed = cp.addAllowedAssignments(scope);
        for (int[] row : projected) allowed.addTuple(row);

        int[] best = projected.get(0);
        for (int k = 0; k < scope.length; k++) {
            int v = terms.get(varPositions.get(k)).variable();
            if (hinted[v]) continue;
            cp.addHint(scope[k], best[k]);
            hinted[v] = true;
        }
        return null;
    }

    /** @return failure detail when no position can differ */
    private static String addDisjunction(CpModel cp, IntVar[] vars, Disjunction d) {
        List<Literal> differ = new ArrayList<>(d.pairs().size());
        for (Term[] pair : d.pairs()) {
            Term a = pair[0], b = pair[1];
            if (!a.isVariable() && !b.isVariable()) {
                if (a.value() != b.value()) return null;
                continue;
            }
            if (a.isVariable() && b.isVariable() && a.variable() == b.variable()) continue;

            Literal flag = cp.newBoolVar("diff");
            if (a.isVariable() && b.isVariable()) {
                cp.addDifferent(vars[a.variable()], vars[b.variable()]).onlyEnforceIf(flag);
            } else if (a.isVariable()) {
                cp.addDifferent(vars[a.variable()], b.value()).onlyEnforceIf(flag);
            } else {
                cp.addDifferent(vars[b.variable()], a.value()).onlyEnforceIf(flag);
            }
            differ.add(flag);
        }
        if (differ.isEmpty()) return "violated " + d;
        cp.addBoolOr(differ.toArray(new Literal[0]));
        return null;
    }

    /** Seconds left; infinite without budget and deadline. */
    static double limitSeconds(Duration budget, Instant deadline) {
        double limit = Double.POSITIVE_INFINITY;
        if (budget != null) limit = Math.min(limit, budget.toMillis() / 1000.0);
        if (deadline != null) limit = Math.min(limit, Duration.between(Instant.now(), deadline).toMillis() / 1000.0);
        return limit;
    }
}
