package qasm;

import org.junit.jupiter.api.Test;
import qasm.ast.ArrayType;
import qasm.ast.BinaryExpression;
import qasm.ast.BinaryOperator;
import qasm.ast.BitType;
import qasm.ast.BooleanLiteral;
import qasm.ast.BranchingStatement;
import qasm.ast.CalibrationDefinition;
import qasm.ast.ClassicalAssignment;
import qasm.ast.ClassicalType;
import qasm.ast.Expression;
import qasm.ast.FloatLiteral;
import qasm.ast.FloatType;
import qasm.ast.FunctionCall;
import qasm.ast.IODeclaration;
import qasm.ast.IOKeyword;
import qasm.ast.Identifier;
import qasm.ast.Include;
import qasm.ast.IndexedIdentifier;
import qasm.ast.IntType;
import qasm.ast.IntegerLiteral;
import qasm.ast.Program;
import qasm.ast.QuantumGate;
import qasm.ast.QuantumGateDefinition;
import qasm.ast.QuantumMeasurement;
import qasm.ast.QuantumMeasurementStatement;
import qasm.ast.QubitDeclaration;
import qasm.ast.Statement;
import qasm.ast.UnaryExpression;
import qasm.ast.UnaryOperator;
import qasm.ast.WhileLoop;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QasmPrinterTest {
    private static final QasmPrinter printer = QasmPrinter.getInstance();

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static Expression bin(BinaryOperator op, Expression l, Expression r) {
        return new BinaryExpression(op, l, r);
    }

    private static Statement x(int qubit) {
        return QuantumGate.of("x", IndexedIdentifier.of("Qubits", qubit));
    }

    @Test
    void left_associative_operators_parenthesize_right_operand() {
        assertEquals("a - (b - c)",
                     printer.printExpression(bin(BinaryOperator.SUB, id("a"), bin(BinaryOperator.SUB, id("b"), id("c")))));
        assertEquals("a - b - c",
                     printer.printExpression(bin(BinaryOperator.SUB, bin(BinaryOperator.SUB, id("a"), id("b")), id("c"))));
    }

    @Test
    void lower_precedence_operand_is_parenthesized() {
        assertEquals("(a + b) * c",
                     printer.printExpression(bin(BinaryOperator.MUL, bin(BinaryOperator.ADD, id("a"), id("b")), id("c"))));
        assertEquals("a + b * c",
                     printer.printExpression(bin(BinaryOperator.ADD, id("a"), bin(BinaryOperator.MUL, id("b"), id("c")))));
        assertEquals("a < b == c",
                     printer.printExpression(bin(BinaryOperator.EQ, bin(BinaryOperator.LT, id("a"), id("b")), id("c"))));
    }

    @Test
    void unary_operators() {
        assertEquals("-(pi / 2)",
                     printer.printExpression(new UnaryExpression(UnaryOperator.NEG,
                                                                 bin(BinaryOperator.DIV, id("pi"), new IntegerLiteral(2)))));
        assertEquals("!x", printer.printExpression(UnaryExpression.not(id("x"))));
        assertEquals("!(a && b)",
                     printer.printExpression(UnaryExpression.not(bin(BinaryOperator.LOGICAL_AND, id("a"), id("b")))));
    }

    @Test
    void literals_and_calls() {
        assertEquals("-12", printer.printExpression(new IntegerLiteral(-12)));
        assertEquals("false", printer.printExpression(new BooleanLiteral(false)));
        assertEquals("f(1, Results[2])",
                     printer.printExpression(new FunctionCall(id("f"),
                                                              List.of(new IntegerLiteral(1), IndexedIdentifier.of("Results", 2)))));
        assertEquals("measure Qubits[1]",
                     printer.printExpression(new QuantumMeasurement(IndexedIdentifier.of("Qubits", 1))));
    }

    @Test
    void floats_always_have_a_decimal_point() {
        assertEquals("2.0", QasmPrinter.formatFloat(2.0));
        assertEquals("0.5", QasmPrinter.formatFloat(0.5));
        assertEquals("-1.25", QasmPrinter.formatFloat(-1.25));
        assertEquals("100000000000000000000.0", QasmPrinter.formatFloat(1e20));
        assertEquals("0.5", printer.printExpression(new FloatLiteral(0.5)));
    }

    @Test
    void non_finite_floats_have_no_literal() {
        assertThrows(IllegalArgumentException.class, () -> QasmPrinter.formatFloat(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> QasmPrinter.formatFloat(Double.POSITIVE_INFINITY));
    }

    @Test
    void types() {
        assertEquals("bit", printer.printType(new BitType()));
        assertEquals("bit[4]", printer.printType(new BitType(new IntegerLiteral(4))));
        assertEquals("float[64]", printer.printType(new FloatType(new IntegerLiteral(64))));
        assertEquals("array[int[32], 3]",
                     printer.printType(new ArrayType(new IntType(new IntegerLiteral(32)), List.of(new IntegerLiteral(3)))));
    }

    @Test
    void defcal_forms() {
        ClassicalType bit = new BitType();
        assertEquals("defcal my_test(bit) -> bit {}\n", printer.printStatement(
            new CalibrationDefinition(id("my_test"), List.of(bit), List.of(), bit, null)));
        assertEquals("defcal allocate_qubit q_ret {}\n", printer.printStatement(
            new CalibrationDefinition(id("allocate_qubit"), List.of(), List.of(id("q_ret")), null, "")));
        assertEquals("defcal apply(float[64], int[32]) q0, q1 {}\n", printer.printStatement(
            new CalibrationDefinition(id("apply"),
                                      List.of(new FloatType(new IntegerLiteral(64)), new IntType(new IntegerLiteral(32))),
                                      List.of(id("q0"), id("q1")), null, null)));
        assertEquals("defcal g(int[64]) {}\n", printer.printStatement(
            new CalibrationDefinition(id("g"), List.of(new IntType(new IntegerLiteral(64))), List.of(), null, null)));
    }

    @Test
    void gate_definition_on_one_line() {
        var def = new QuantumGateDefinition(id("rzz"), List.of(id("_theta")), List.of(id("q0"), id("q1")), List.of(
            QuantumGate.of("cx", id("q0"), id("q1")),
            new QuantumGate(id("rz"), List.of(id("_theta")), List.of(id("q1"))),
            QuantumGate.of("cx", id("q0"), id("q1"))));
        assertEquals("gate rzz(_theta) q0, q1 { cx q0, q1; rz(_theta) q1; cx q0, q1; }\n",
                     printer.printStatement(def));
    }

    @Test
    void nested_blocks_indent_two_spaces() {
        Statement inner = new BranchingStatement(id("b"), List.of(x(0)), List.of());
        Statement loop = new WhileLoop(id("a"), List.of(inner, x(1)));
        assertEquals("""
            while (a) {
              if (b) {
                x Qubits[0];
              }
              x Qubits[1];
            }
            """, printer.printStatement(loop));
    }

    @Test
    void if_with_only_else_block() {
        Statement stmt = new BranchingStatement(id("c"), List.of(), List.of(x(0)));
        assertEquals("""
            if (c) {
            } else {
              x Qubits[0];
            }
            """, printer.printStatement(stmt));
    }

    @Test
    void whole_program() {
        Program program = new Program(List.of(
            new Include("stdgates.inc"),
            new QubitDeclaration(id("Qubits"), new IntegerLiteral(1)),
            new IODeclaration(IOKeyword.INPUT, new IntType(new IntegerLiteral(32)), id("IntType_i0")),
            new QuantumMeasurementStatement(new QuantumMeasurement(IndexedIdentifier.of("Qubits", 0)), null),
            new ClassicalAssignment(id("IntType_o0"), id("IntType_i0"))));
        assertEquals("""
            OPENQASM 3.0;
            include "stdgates.inc";
            qubit[1] Qubits;
            input int[32] IntType_i0;
            measure Qubits[0];
            IntType_o0 = IntType_i0;
            """, printer.printToString(program));
    }
}
