package qasm;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import qasm.ast.ArrayType;
import qasm.ast.BinaryExpression;
import qasm.ast.BitType;
import qasm.ast.BoolType;
import qasm.ast.BooleanLiteral;
import qasm.ast.BranchingStatement;
import qasm.ast.CalibrationDefinition;
import qasm.ast.ClassicalAssignment;
import qasm.ast.ClassicalDeclaration;
import qasm.ast.ClassicalType;
import qasm.ast.Expression;
import qasm.ast.ExpressionStatement;
import qasm.ast.FloatLiteral;
import qasm.ast.FloatType;
import qasm.ast.FunctionCall;
import qasm.ast.IODeclaration;
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
import qasm.ast.QuantumReset;
import qasm.ast.QubitDeclaration;
import qasm.ast.Statement;
import qasm.ast.UnaryExpression;
import qasm.ast.UnaryOperator;
import qasm.ast.WhileLoop;

/**
 * OpenQASM 3 打印器
 * 负责将 qasm.ast 的语法树转换为文本, 每条语句一行, 块内缩进两个空格
 * 使用单例模式实现
 */
public class QasmPrinter {
    private static final String INDENT = "  ";
    // 原子表达式 (标识符, 字面量, 调用) 的优先级
    private static final int ATOM_PRECEDENCE = 12;

    private static QasmPrinter instance;

    private QasmPrinter() {
    }

    /**
     * 获取QasmPrinter单例实例
     * @return QasmPrinter实例
     */
    public static QasmPrinter getInstance() {
        if (instance == null) {
            instance = new QasmPrinter();
        }
        return instance;
    }

    /**
     * 将整个程序转换为 OpenQASM 文本
     * @param program 程序
     * @return 以换行结尾的文本
     */
    public String printToString(Program program) {
        StringBuilder sb = new StringBuilder();
        sb.append("OPENQASM ").append(program.version()).append(";\n");
        for (Statement stmt : program.statements()) {
            printStatement(sb, stmt, 0);
        }
        return sb.toString();
    }

    /**
     * 单条语句 (含嵌套块) 的文本, 主要用于日志与测试
     */
    public String printStatement(Statement stmt) {
        StringBuilder sb = new StringBuilder();
        printStatement(sb, stmt, 0);
        return sb.toString();
    }

    private void printStatement(StringBuilder sb, Statement stmt, int depth) {
        String pad = INDENT.repeat(depth);
        if (stmt instanceof BranchingStatement branch) {
            sb.append(pad).append("if (").append(printExpression(branch.condition())).append(") {\n");
            printBlock(sb, branch.ifBlock(), depth + 1);
            if (branch.elseBlock().isEmpty()) {
                sb.append(pad).append("}\n");
            } else {
                sb.append(pad).append("} else {\n");
                printBlock(sb, branch.elseBlock(), depth + 1);
                sb.append(pad).append("}\n");
            }
            return;
        }
        if (stmt instanceof WhileLoop loop) {
            sb.append(pad).append("while (").append(printExpression(loop.condition())).append(") {\n");
            printBlock(sb, loop.block(), depth + 1);
            sb.append(pad).append("}\n");
            return;
        }
        sb.append(pad).append(printSimpleStatement(stmt)).append("\n");
    }

    private void printBlock(StringBuilder sb, List<Statement> block, int depth) {
        for (Statement stmt : block) {
            printStatement(sb, stmt, depth);
        }
    }

    private String printSimpleStatement(Statement stmt) {
        if (stmt instanceof Include include) {
            return "include \"" + include.filename() + "\";";
        }
        if (stmt instanceof QubitDeclaration decl) {
            String size = decl.size() == null ? "" : "[" + printExpression(decl.size()) + "]";
            return "qubit" + size + " " + decl.qubit().name() + ";";
        }
        if (stmt instanceof ClassicalDeclaration decl) {
            return printType(decl.type()) + " " + decl.identifier().name() + ";";
        }
        if (stmt instanceof IODeclaration decl) {
            return decl.io().getKeyword() + " " + printType(decl.type()) + " " + decl.identifier().name() + ";";
        }
        if (stmt instanceof CalibrationDefinition defcal) {
            return printDefcal(defcal);
        }
        if (stmt instanceof QuantumGateDefinition gateDef) {
            return printGateDefinition(gateDef);
        }
        if (stmt instanceof QuantumGate gate) {
            return printGate(gate);
        }
        if (stmt instanceof QuantumReset reset) {
            return "reset " + printExpression(reset.qubit()) + ";";
        }
        if (stmt instanceof QuantumMeasurementStatement measure) {
            String rhs = printExpression(measure.measure());
            return measure.target() == null ? rhs + ";" : printExpression(measure.target()) + " = " + rhs + ";";
        }
        if (stmt instanceof ClassicalAssignment assign) {
            return printExpression(assign.lvalue()) + " = " + printExpression(assign.rvalue()) + ";";
        }
        if (stmt instanceof ExpressionStatement exprStmt) {
            return printExpression(exprStmt.expression()) + ";";
        }
        throw new IllegalArgumentException("Cannot print statement " + stmt);
    }

    // defcal name(args) qubits -> ret {body}
    private String printDefcal(CalibrationDefinition defcal) {
        StringBuilder sb = new StringBuilder("defcal ").append(defcal.name().name());
        if (!defcal.arguments().isEmpty()) {
            List<String> args = new ArrayList<>();
            for (ClassicalType type : defcal.arguments()) {
                args.add(printType(type));
            }
            sb.append("(").append(String.join(", ", args)).append(")");
        }
        if (!defcal.qubits().isEmpty()) {
            sb.append(" ").append(joinIdentifiers(defcal.qubits()));
        }
        if (defcal.returnType() != null) {
            sb.append(" -> ").append(printType(defcal.returnType()));
        }
        return sb.append(" {").append(defcal.body()).append("}").toString();
    }

    private String printGateDefinition(QuantumGateDefinition gateDef) {
        StringBuilder sb = new StringBuilder("gate ").append(gateDef.name().name());
        if (!gateDef.arguments().isEmpty()) {
            sb.append("(").append(joinIdentifiers(gateDef.arguments())).append(")");
        }
        sb.append(" ").append(joinIdentifiers(gateDef.qubits())).append(" {");
        for (QuantumGate gate : gateDef.body()) {
            sb.append(" ").append(printGate(gate));
        }
        return sb.append(" }").toString();
    }

    private String printGate(QuantumGate gate) {
        StringBuilder sb = new StringBuilder(gate.name().name());
        if (!gate.arguments().isEmpty()) {
            sb.append("(").append(joinExpressions(gate.arguments())).append(")");
        }
        return sb.append(" ").append(joinExpressions(gate.qubits())).append(";").toString();
    }

    public String printType(ClassicalType type) {
        if (type instanceof BitType bit) {
            return bit.size() == null ? "bit" : "bit[" + printExpression(bit.size()) + "]";
        }
        if (type instanceof BoolType) {
            return "bool";
        }
        if (type instanceof IntType intType) {
            return intType.size() == null ? "int" : "int[" + printExpression(intType.size()) + "]";
        }
        if (type instanceof FloatType floatType) {
            return floatType.size() == null ? "float" : "float[" + printExpression(floatType.size()) + "]";
        }
        if (type instanceof ArrayType array) {
            return "array[" + printType(array.baseType()) + ", " + joinExpressions(array.dimensions()) + "]";
        }
        throw new IllegalArgumentException("Cannot print type " + type);
    }

    public String printExpression(Expression expr) {
        if (expr instanceof Identifier id) {
            return id.name();
        }
        if (expr instanceof IndexedIdentifier indexed) {
            StringBuilder sb = new StringBuilder(indexed.name().name());
            for (Expression index : indexed.indices()) {
                sb.append("[").append(printExpression(index)).append("]");
            }
            return sb.toString();
        }
        if (expr instanceof IntegerLiteral literal) {
            return Long.toString(literal.value());
        }
        if (expr instanceof FloatLiteral literal) {
            return formatFloat(literal.value());
        }
        if (expr instanceof BooleanLiteral literal) {
            return literal.value() ? "true" : "false";
        }
        if (expr instanceof BinaryExpression binary) {
            int prec = binary.op().getPrecedence();
            return printOperand(binary.lhs(), prec, false)
                + " " + binary.op().getSymbol() + " "
                + printOperand(binary.rhs(), prec, true);
        }
        if (expr instanceof UnaryExpression unary) {
            return unary.op().getSymbol() + printOperand(unary.expression(), UnaryOperator.PRECEDENCE, false);
        }
        if (expr instanceof FunctionCall call) {
            return call.name().name() + "(" + joinExpressions(call.arguments()) + ")";
        }
        if (expr instanceof QuantumMeasurement measure) {
            return "measure " + printExpression(measure.qubit());
        }
        throw new IllegalArgumentException("Cannot print expression " + expr);
    }

    // 左结合: 右操作数同级也要加括号
    private String printOperand(Expression operand, int parentPrecedence, boolean rightSide) {
        int prec = precedenceOf(operand);
        boolean wrap = prec < parentPrecedence || (rightSide && prec == parentPrecedence);
        String text = printExpression(operand);
        return wrap ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expression expr) {
        if (expr instanceof BinaryExpression binary) {
            return binary.op().getPrecedence();
        }
        if (expr instanceof UnaryExpression) {
            return UnaryOperator.PRECEDENCE;
        }
        return ATOM_PRECEDENCE;
    }

    static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("No OpenQASM literal for " + value);
        }
        String text = BigDecimal.valueOf(value).toPlainString();
        return text.contains(".") ? text : text + ".0";
    }

    private String joinIdentifiers(List<Identifier> ids) {
        List<String> parts = new ArrayList<>();
        for (Identifier id : ids) {
            parts.add(id.name());
        }
        return String.join(", ", parts);
    }

    private String joinExpressions(List<Expression> exprs) {
        List<String> parts = new ArrayList<>();
        for (Expression e : exprs) {
            parts.add(printExpression(e));
        }
        return String.join(", ", parts);
    }
}
