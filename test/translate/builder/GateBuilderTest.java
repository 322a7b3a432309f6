package translate.builder;

import exception.CompileException;
import exception.CompileException.Kind;
import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.VoidType;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantNull;
import org.junit.jupiter.api.Test;
import qasm.QasmPrinter;
import translate.SymbolTable;
import translate.profile.BaseProfile;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GateBuilderTest {

    private static SymbolTable symbols() {
        SymbolTable symbols = new SymbolTable();
        BaseProfile profile = new BaseProfile();
        profile.getStructs().values().forEach(symbols::registerStruct);
        profile.getInstructions().values().forEach(symbols::registerInstruction);
        return symbols;
    }

    @Test
    void adjoint_appends_dg() {
        assertEquals("sdg", new GateBuilder("s", true).getGateName());
        assertEquals("t", new GateBuilder("t").getGateName());
    }

    @Test
    void angles_become_arguments_and_qubits_keep_call_order() {
        var qubit = new ConstantNull(PointerType.get(StructType.createNamed("Qubit")));
        LoweringResult result = new GateBuilder("rx").build(symbols(), VoidType.getVoid(),
            List.of(new ConstantFloat(FloatType.getDouble(), 0.25), qubit));
        assertFalse(result.hasResult());
        assertEquals("rx(0.25) Qubits[0];\n", QasmPrinter.getInstance().printStatement(result.statements().get(0)));
    }

    @Test
    void gate_with_return_value_is_malformed() {
        var e = assertThrows(CompileException.class,
                             () -> new GateBuilder("h").build(symbols(), IntegerType.getI1(), List.of()));
        assertEquals(Kind.MALFORMED_GATE_SIGNATURE, e.getKind());
    }
}
