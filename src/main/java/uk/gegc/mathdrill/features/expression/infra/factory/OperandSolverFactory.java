package uk.gegc.mathdrill.features.expression.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mathdrill.features.expression.domain.model.OperatorType;
import uk.gegc.mathdrill.features.expression.infra.solver.OperandSolver;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the range solver for an operator. Every {@link OperandSolver} bean registers itself
 * under the operator it reports; a second solver for the same operator is a wiring error.
 */
@Component
@Slf4j
public class OperandSolverFactory {
    private final Map<OperatorType, OperandSolver> solversByOperator = new EnumMap<>(OperatorType.class);

    public OperandSolverFactory(List<OperandSolver> solvers) {
        for (OperandSolver solver : solvers) {
            OperandSolver previous = solversByOperator.put(solver.supportedOperator(), solver);
            if (previous != null) {
                throw new IllegalStateException("Operator " + solver.supportedOperator() + " is served by both "
                        + previous.getClass().getSimpleName() + " and " + solver.getClass().getSimpleName());
            }
        }
        log.info("Registered operand solvers {}", solversByOperator.keySet());
    }

    public OperandSolver getSolver(OperatorType operator) {
        OperandSolver solver = solversByOperator.get(operator);
        if (solver == null) {
            throw new UnsupportedOperationException("No solver for operator " + operator);
        }
        return solver;
    }
}
