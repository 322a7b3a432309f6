package translate.builder;

import java.util.ArrayList;
import java.util.List;

import qasm.ast.BinaryExpression;
import qasm.ast.BinaryOperator;
import qasm.ast.Expression;
import qasm.ast.Identifier;
import qasm.ast.IntegerLiteral;
import qasm.ast.QuantumGate;
import qasm.ast.QuantumGateDefinition;
import qasm.ast.UnaryExpression;
import qasm.ast.UnaryOperator;

/**
 * Gate definitions for operations that are not in the standard gate set.
 */
public final class GateDefinitions {
    private static final Identifier THETA = new Identifier("_theta");
    private static final Identifier Q0 = new Identifier("q0");
    private static final Identifier Q1 = new Identifier("q1");

    private GateDefinitions() {
    }

    /**
     * Two-qubit rotation {@code rxx}, {@code ryy} or {@code rzz} as
     * basis change, {@code cx; rz(_theta); cx}, inverse basis change.
     */
    public static QuantumGateDefinition rotation2Q(String name) {
        List<QuantumGate> before = new ArrayList<>();
        List<QuantumGate> after = new ArrayList<>();
        switch (name) {
        case "rxx" -> {
            before.add(QuantumGate.of("h", Q0));
            before.add(QuantumGate.of("h", Q1));
            after.add(QuantumGate.of("h", Q0));
            after.add(QuantumGate.of("h", Q1));
        }
        case "ryy" -> {
            Expression halfPi = new BinaryExpression(BinaryOperator.DIV, new Identifier("pi"), new IntegerLiteral(2));
            Expression minusHalfPi = new UnaryExpression(UnaryOperator.NEG, halfPi);
            before.add(rx(halfPi, Q0));
            before.add(rx(halfPi, Q1));
            after.add(rx(minusHalfPi, Q0));
            after.add(rx(minusHalfPi, Q1));
        }
        case "rzz" -> {
            // 已经在 z 基下
        }
        default -> throw new IllegalArgumentException("No two-qubit rotation named " + name);
        }

        List<QuantumGate> body = new ArrayList<>(before);
        body.add(QuantumGate.of("cx", Q0, Q1));
        body.add(new QuantumGate(new Identifier("rz"), List.of(THETA), List.of(Q1)));
        body.add(QuantumGate.of("cx", Q0, Q1));
        body.addAll(after);
        return new QuantumGateDefinition(new Identifier(name), List.of(THETA), List.of(Q0, Q1), body);
    }

    private static QuantumGate rx(Expression angle, Expression qubit) {
        return new QuantumGate(new Identifier("rx"), List.of(angle), List.of(qubit));
    }
}
