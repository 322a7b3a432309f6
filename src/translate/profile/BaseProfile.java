package translate.profile;

import java.util.List;

import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.type.VoidType;
import qasm.ast.BinaryOperator;
import qasm.ast.BitType;
import qasm.ast.BooleanLiteral;
import translate.builder.BinaryExpressionBuilder;
import translate.builder.ConstantBuilder;
import translate.builder.GateBuilder;
import translate.builder.GateDefinitions;
import translate.builder.InputBuilder;
import translate.builder.InttoptrBuilder;
import translate.builder.LoadBuilder;
import translate.builder.MeasurementBuilder;
import translate.builder.OutputBuilder;
import translate.builder.QubitDeclarationBuilder;
import translate.builder.RecordBuilder;
import translate.builder.ResetBuilder;
import translate.builder.ResultDeclarationBuilder;

/**
 * QIR base profile: statically addressed qubits and results, the standard
 * gate set, measurements and the runtime output recording calls.
 */
public class BaseProfile extends Profile {
    public static final String NAME = "base_profile";

    public BaseProfile() {
        super(NAME);
    }

    @Override
    protected void defineStructs() {
        registerStruct("Qubit", null, new QubitDeclarationBuilder());
        registerStruct(MeasurementBuilder.RESULT_STRUCT, new BitType(), new ResultDeclarationBuilder());
    }

    @Override
    protected void defineFunctions() {
        PointerType qubit = structPointer("Qubit");
        PointerType result = structPointer(MeasurementBuilder.RESULT_STRUCT);
        Type voidType = VoidType.getVoid();
        Type doubleType = FloatType.getDouble();
        Type i1 = IntegerType.getI1();
        Type i64 = IntegerType.getI64();
        PointerType i8Ptr = PointerType.get(IntegerType.getI8());

        // 单比特门及其共轭
        registerGates(List.of("h", "s", "t", "x", "y", "z"), List.of(qubit), false);
        registerGates(List.of("s", "t"), List.of(qubit), true);

        registerFunction("__quantum__qis__cnot__body", voidType, List.of(qubit, qubit), null, new GateBuilder("cx"));
        registerGates(List.of("cy", "cz", "swap"), List.of(qubit, qubit), false);
        registerGates(List.of("rx", "ry", "rz"), List.of(doubleType, qubit), false);
        registerGates(List.of("ccx"), List.of(qubit, qubit, qubit), false);

        for (String gate : List.of("rxx", "ryy", "rzz")) {
            registerFunction(qisName(gate, false), voidType, List.of(doubleType, qubit, qubit),
                             GateDefinitions.rotation2Q(gate), new GateBuilder(gate));
        }

        registerFunction("__quantum__qis__reset__body", voidType, List.of(qubit), null, new ResetBuilder());

        // 测量
        registerFunction("__quantum__qis__m__body", result, List.of(qubit), null, new MeasurementBuilder("m"));
        for (String op : List.of("mz", "mresetz")) {
            registerFunction(qisName(op, false), voidType, List.of(qubit, result), null, new MeasurementBuilder(op));
        }
        registerFunction("__quantum__qis__read_result__body", i1, List.of(result), null, new LoadBuilder());

        // runtime
        registerFunction("__quantum__rt__initialize", voidType, List.of(i8Ptr), null, new RecordBuilder());
        registerFunction("__quantum__rt__result_record_output", voidType, List.of(result, i8Ptr), null, new RecordBuilder());
        registerFunction("__quantum__rt__array_record_output", voidType, List.of(i64, i8Ptr), null, new RecordBuilder());
        registerFunction("__quantum__rt__tuple_record_output", voidType, List.of(i64, i8Ptr), null, new RecordBuilder());
        registerFunction("__quantum__rt__bool_record_output", voidType, List.of(i1, i8Ptr), null, new RecordBuilder());
        registerFunction("__quantum__rt__int_record_output", voidType, List.of(i64, i8Ptr), null, new RecordBuilder());
        registerFunction("__quantum__rt__double_record_output", voidType, List.of(doubleType, i8Ptr), null, new RecordBuilder());

        registerFunction("__quantum__rt__result_get_one", result, List.of(), null,
                         new ConstantBuilder(new BooleanLiteral(true)));
        registerFunction("__quantum__rt__result_get_zero", result, List.of(), null,
                         new ConstantBuilder(new BooleanLiteral(false)));
        registerFunction("__quantum__rt__result_equal", i1, List.of(result, result), null,
                         new BinaryExpressionBuilder(BinaryOperator.EQ));

        registerFunction("get_int", IntegerType.getI32(), List.of(), null, new InputBuilder());
        registerFunction("take_int", voidType, List.of(IntegerType.getI32()), null, new OutputBuilder());
    }

    @Override
    protected void defineInstructions() {
        registerInstruction("inttoptr", new InttoptrBuilder());
    }

    private void registerGates(List<String> gates, List<Type> argTypes, boolean adjoint) {
        for (String gate : gates) {
            registerFunction(qisName(gate, adjoint), VoidType.getVoid(), argTypes, null, new GateBuilder(gate, adjoint));
        }
    }

    private static String qisName(String op, boolean adjoint) {
        return "__quantum__qis__" + op + "__" + (adjoint ? "adj" : "body");
    }
}
