package translate;

import exception.CompileException;
import exception.CompileException.Kind;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.TypeKind;
import ir.value.Argument;
import ir.value.Opcode;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import ir.type.FloatType;
import org.junit.jupiter.api.Test;
import qasm.QasmPrinter;
import qasm.ast.BoolType;
import qasm.ast.Expression;
import qasm.ast.Identifier;
import qasm.ast.IndexedIdentifier;
import qasm.ast.IntType;
import qasm.ast.IntegerLiteral;
import qasm.ast.IOKeyword;
import qasm.ast.QuantumGate;
import qasm.ast.Statement;
import translate.profile.BaseProfile;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    private static final TargetType I32 = TargetType.ofClassical(TypeKind.INTEGER, new IntType(new IntegerLiteral(32)));
    private static final TargetType BOOL = TargetType.ofClassical(TypeKind.INTEGER, new BoolType());

    private static SymbolTable withBaseProfile() {
        SymbolTable symbols = new SymbolTable();
        BaseProfile profile = new BaseProfile();
        profile.getStructs().values().forEach(symbols::registerStruct);
        profile.getInstructions().values().forEach(symbols::registerInstruction);
        return symbols;
    }

    private static String print(Object node) {
        QasmPrinter printer = QasmPrinter.getInstance();
        if (node instanceof Statement stmt) {
            return printer.printStatement(stmt).strip();
        }
        return printer.printExpression((Expression) node);
    }

    private static List<String> printAll(List<Statement> stmts) {
        List<String> out = new ArrayList<>();
        for (Statement s : stmts) {
            out.add(print(s));
        }
        return out;
    }

    private static Statement gate(String name, int qubit) {
        return QuantumGate.of(name, IndexedIdentifier.of("Qubits", qubit));
    }

    @Test
    void temporaries_are_counted_per_type_name() {
        SymbolTable symbols = withBaseProfile();
        assertEquals("IntType_tmp[0]", print(symbols.allocateTemporary(I32)));
        assertEquals("BoolType_tmp[0]", print(symbols.allocateTemporary(BOOL)));
        assertEquals("IntType_tmp[1]", print(symbols.allocateTemporary(I32)));
        assertEquals("Results_tmp[0]",
                     print(symbols.allocateTemporary(TargetType.ofStruct(TypeKind.POINTER, "Result"))));
    }

    @Test
    void io_names_count_per_direction() {
        SymbolTable symbols = withBaseProfile();
        var i32 = new IntType(new IntegerLiteral(32));
        assertEquals("IntType_i0", symbols.allocateIO(i32, IOKeyword.INPUT).name());
        assertEquals("IntType_o0", symbols.allocateIO(i32, IOKeyword.OUTPUT).name());
        assertEquals("IntType_i1", symbols.allocateIO(i32, IOKeyword.INPUT).name());
    }

    @Test
    void io_of_quantum_value_is_rejected() {
        SymbolTable symbols = withBaseProfile();
        assertThrows(IllegalArgumentException.class, () -> symbols.allocateIO(null, IOKeyword.INPUT));
    }

    @Test
    void no_allocation_after_freeze() {
        SymbolTable symbols = withBaseProfile();
        symbols.allocateTemporary(I32);
        symbols.freeze();
        assertThrows(IllegalStateException.class, () -> symbols.allocateTemporary(I32));
        assertThrows(IllegalStateException.class, () -> symbols.noteStructUse("Qubit", 0));
        assertThrows(IllegalStateException.class,
                     () -> symbols.allocateIO(new IntType(new IntegerLiteral(32)), IOKeyword.OUTPUT));
    }

    @Test
    void declarations_follow_registration_and_first_use_order() {
        SymbolTable symbols = withBaseProfile();
        symbols.allocateIO(new IntType(new IntegerLiteral(32)), IOKeyword.OUTPUT);
        symbols.allocateTemporary(BOOL);
        symbols.allocateTemporary(TargetType.ofStruct(TypeKind.POINTER, "Result"));
        symbols.noteStructUse("Result", 2);
        symbols.noteStructUse("Qubit", 0);
        symbols.allocateTemporary(I32);
        symbols.allocateIO(new IntType(new IntegerLiteral(32)), IOKeyword.INPUT);

        assertEquals(List.of(
            "qubit[1] Qubits;",
            "bit[3] Results;",
            "bit[1] Results_tmp;",
            "array[bool, 1] BoolType_tmp;",
            "array[int[32], 1] IntType_tmp;",
            "input int[32] IntType_i0;",
            "output int[32] IntType_o0;"
        ), printAll(symbols.buildVariableDeclarations()));
    }

    @Test
    void nothing_used_means_no_declarations() {
        assertTrue(withBaseProfile().buildVariableDeclarations().isEmpty());
    }

    @Test
    void struct_count_is_highest_index_plus_one() {
        SymbolTable symbols = withBaseProfile();
        symbols.noteStructUse("Qubit", 4);
        symbols.noteStructUse("Qubit", 1);
        assertEquals(5, symbols.getStructCount("Qubit"));
        assertEquals(0, symbols.getStructCount("Result"));
    }

    @Test
    void unknown_struct_fails() {
        var e = assertThrows(CompileException.class, () -> withBaseProfile().getStruct("Array"));
        assertEquals(Kind.UNKNOWN_STRUCT, e.getKind());
    }

    @Test
    void constants_map_to_literals_and_static_addresses() {
        SymbolTable symbols = withBaseProfile();
        PointerType qubitPtr = PointerType.get(StructType.createNamed("Qubit"));

        assertEquals("true", print(symbols.mapValue(ConstantInt.getBool(true))));
        assertEquals("-7", print(symbols.mapValue(ConstantInt.get(64, -7))));
        assertEquals("0.25", print(symbols.mapValue(new ConstantFloat(FloatType.getDouble(), 0.25))));
        assertEquals("Qubits[0]", print(symbols.mapValue(new ConstantNull(qubitPtr))));
        var three = new ConstantExpr(Opcode.INTTOPTR, qubitPtr, List.of(ConstantInt.get(64, 3)));
        assertEquals("Qubits[3]", print(symbols.mapValue(three)));
        assertEquals(4, symbols.getStructCount("Qubit"));
    }

    @Test
    void null_of_non_struct_pointer_has_no_encoding() {
        SymbolTable symbols = withBaseProfile();
        var e = assertThrows(CompileException.class,
                             () -> symbols.mapValue(new ConstantNull(PointerType.get(IntegerType.getI8()))));
        assertEquals(Kind.UNDEFINED_INSTRUCTION_ENCODING, e.getKind());
    }

    @Test
    void values_bind_once() {
        SymbolTable symbols = withBaseProfile();
        var arg = new Argument(IntegerType.getI32(), "x", 0, null);
        assertThrows(IllegalStateException.class, () -> symbols.mapValue(arg));

        symbols.bind(arg, new Identifier("IntType_i0"));
        assertTrue(symbols.isBound(arg));
        assertEquals("IntType_i0", print(symbols.mapValue(arg)));
        assertThrows(IllegalStateException.class, () -> symbols.bind(arg, new Identifier("other")));
    }

    @Test
    void rewrite_block_keeps_graph_in_sync() {
        SymbolTable symbols = withBaseProfile();
        symbols.addBlock("a", List.of(gate("h", 0)), BranchInfo.unconditional("b"));
        symbols.addBlock("b", List.of(gate("x", 0)), BranchInfo.terminal());

        symbols.rewriteBlock("a", symbols.getStatements("b"), symbols.getBranch("b"), List.of("b"));

        assertEquals(List.of("a"), symbols.getCfg().nodes());
        assertEquals(0, symbols.getCfg().edgeCount());
        assertEquals(List.of("h Qubits[0];", "x Qubits[0];"), printAll(symbols.getStatements("a")));
        assertThrows(CompileException.class, () -> symbols.getStatements("b"));
    }

    @Test
    void block_cannot_absorb_itself() {
        SymbolTable symbols = withBaseProfile();
        symbols.addBlock("a", List.of(), BranchInfo.terminal());
        var e = assertThrows(CompileException.class,
                             () -> symbols.rewriteBlock("a", List.of(), BranchInfo.terminal(), List.of("a")));
        assertEquals(Kind.INCONSISTENT_BLOCK_STATE, e.getKind());
    }

    @Test
    void duplicate_gives_edge_a_private_copy() {
        SymbolTable symbols = withBaseProfile();
        symbols.addBlock("p", List.of(), BranchInfo.conditional(new Identifier("c"), "shared", "q"));
        symbols.addBlock("q", List.of(), BranchInfo.unconditional("shared"));
        symbols.addBlock("shared", List.of(gate("z", 1)), BranchInfo.unconditional("end"));
        symbols.addBlock("end", List.of(), BranchInfo.terminal());

        String copy = symbols.duplicateBlock("p", "shared");

        assertEquals("shared.dup0", copy);
        assertEquals(List.of(copy, "q"), symbols.getBranch("p").targets());
        assertEquals(List.of("q"), symbols.getCfg().predecessors("shared"));
        assertEquals(List.of("end"), symbols.getCfg().successors(copy));
        assertEquals(List.of("z Qubits[1];"), printAll(symbols.getStatements(copy)));

        // 副本与原块的语句列表互不影响
        symbols.getStatements(copy).add(gate("x", 0));
        assertEquals(1, symbols.getStatements("shared").size());
        symbols.verifyBlockState();
    }

    @Test
    void duplicate_without_edge_fails() {
        SymbolTable symbols = withBaseProfile();
        symbols.addBlock("a", List.of(), BranchInfo.terminal());
        symbols.addBlock("b", List.of(), BranchInfo.terminal());
        var e = assertThrows(CompileException.class, () -> symbols.duplicateBlock("a", "b"));
        assertEquals(Kind.INCONSISTENT_BLOCK_STATE, e.getKind());
    }

    @Test
    void verify_detects_missing_block() {
        SymbolTable symbols = withBaseProfile();
        symbols.addBlock("a", List.of(), BranchInfo.unconditional("never_added"));
        var e = assertThrows(CompileException.class, symbols::verifyBlockState);
        assertEquals(Kind.INCONSISTENT_BLOCK_STATE, e.getKind());
    }
}
