package util.llvm;

import ir.QIRModule;
import ir.type.FloatType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.TypeKind;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Opcode;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.GenericInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QIRParserTest {

    private static QIRModule parse(String ir) throws LLVMParseException {
        return QIRLoader.parseFromString(ir, "test");
    }

    private static List<Instruction> body(QIRModule module, String function, String block) {
        BasicBlock bb = module.getFunction(function).getBlockByName(block);
        assertNotNull(bb, "no block " + block);
        return bb.getInstructions();
    }

    @Test
    void structs_declarations_and_entry_point() throws Exception {
        QIRModule module = parse("""
            ; ModuleID = 'bell'
            source_filename = "bell"

            %Qubit = type opaque
            %Result = type opaque

            define void @main() #0 {
            entry:
              ret void
            }

            declare void @__quantum__qis__h__body(%Qubit*)
            declare i64 @counter(i64) #1

            attributes #0 = { "entry_point" "output_labeling_schema" "qir_profiles"="custom" "required_num_qubits"="2" }
            attributes #1 = { "irreversible" }

            !llvm.module.flags = !{!0}
            !0 = !{i32 1, !"qir_major_version", i32 1}
            """);

        assertEquals("bell", module.getSourceFileName());
        assertTrue(module.getStruct("Qubit").isOpaque());
        assertEquals(2, module.getStructTypes().size());

        Function main = module.getFunction("main");
        assertTrue(main.isEntryPoint());
        assertEquals("custom", main.getAttributes().get("qir_profiles"));
        assertEquals("2", main.getAttributes().get("required_num_qubits"));
        assertFalse(main.isDeclaration());

        Function h = module.getFunction("__quantum__qis__h__body");
        assertTrue(h.isDeclaration());
        assertFalse(h.isEntryPoint());
        assertEquals(PointerType.get(StructType.createNamed("Qubit")), h.getFunctionType().getParamTypes().get(0));
        assertTrue(module.getFunction("counter").hasAttribute("irreversible"));
    }

    @Test
    void call_operands_null_inttoptr_and_hex_float() throws Exception {
        QIRModule module = parse("""
            %Qubit = type opaque

            declare void @__quantum__qis__rx__body(double, %Qubit*)

            define void @main() {
            entry:
              call void @__quantum__qis__rx__body(double 0x3FE0000000000000, %Qubit* null)
              call void @__quantum__qis__rx__body(double 1.500000e+00, %Qubit* inttoptr (i64 3 to %Qubit*))
              ret void
            }
            """);

        List<Instruction> insts = body(module, "main", "entry");
        assertEquals(3, insts.size());

        CallInst first = (CallInst) insts.get(0);
        assertEquals(0.5, ((ConstantFloat) first.getArg(0)).getValue());
        assertInstanceOf(ConstantNull.class, first.getArg(1));

        CallInst second = (CallInst) insts.get(1);
        assertEquals(1.5, ((ConstantFloat) second.getArg(0)).getValue());
        ConstantExpr cast = (ConstantExpr) second.getArg(1);
        assertEquals(Opcode.INTTOPTR, cast.getOpcode());
        assertEquals(3, ((ConstantInt) cast.getOperand(0)).getValue());
        assertEquals(Opcode.RET, insts.get(2).opCode());
    }

    @Test
    void getelementptr_constant_and_global_string() throws Exception {
        QIRModule module = parse("""
            @0 = internal constant [3 x i8] c"r;\\00"

            declare void @record(i8*)

            define void @main() {
            entry:
              call void @record(i8* getelementptr inbounds ([3 x i8], [3 x i8]* @0, i32 0, i32 0))
              ret void
            }
            """);

        GlobalVariable str = module.getGlobalVariable("0");
        assertTrue(str.isConst());
        assertEquals("c\"r;\\00\"", str.getInitializer());

        CallInst call = (CallInst) body(module, "main", "entry").get(0);
        ConstantExpr gep = (ConstantExpr) call.getArg(0);
        assertEquals(Opcode.GETELEMENTPTR, gep.getOpcode());
        assertSame(str, gep.getOperand(0));
        assertEquals(TypeKind.ARRAY, gep.getSourceElementType().getKind());
    }

    @Test
    void blocks_branches_and_comparisons() throws Exception {
        QIRModule module = parse("""
            declare i32 @get_int()

            define void @main() {
            entry:
              %0 = call i32 @get_int()
              %1 = add nsw i32 %0, 1
              %cmp = icmp sgt i32 %1, 0
              br i1 %cmp, label %then, label %done

            then:                                             ; preds = %entry
              br label %done

            done:
              ret void
            }
            """);

        Function main = module.getFunction("main");
        assertEquals(List.of("entry", "then", "done"),
                     main.getBlocks().stream().map(BasicBlock::getName).toList());

        List<Instruction> entry = body(module, "main", "entry");
        BinOperator add = (BinOperator) entry.get(1);
        assertEquals(Opcode.ADD, add.opCode());
        assertSame(entry.get(0), add.getLHS());

        ICmpInst cmp = (ICmpInst) entry.get(2);
        assertEquals(Opcode.ICMP_SGT, cmp.opCode());

        BranchInst br = (BranchInst) entry.get(3);
        assertTrue(br.isConditional());
        assertSame(cmp, br.getCondition());
        assertSame(main.getBlockByName("then"), br.getThenBlock());
        assertSame(main.getBlockByName("done"), br.getElseBlock());
    }

    @Test
    void unlabeled_entry_block_is_numbered() throws Exception {
        QIRModule module = parse("""
            define void @main() {
              br label %1
            1:
              ret void
            }
            """);
        assertEquals(List.of("0", "1"),
                     module.getFunction("main").getBlocks().stream().map(BasicBlock::getName).toList());
    }

    @Test
    void forward_references_are_resolved() throws Exception {
        QIRModule module = parse("""
            define void @main() {
            entry:
              br label %second
            first:
              %x = add i32 %y, 1
              ret void
            second:
              %y = add i32 2, 3
              br label %first
            }
            """);
        BinOperator x = (BinOperator) body(module, "main", "first").get(0);
        assertSame(body(module, "main", "second").get(0), x.getLHS());
    }

    @Test
    void call_split_over_lines_and_debug_attachments() throws Exception {
        QIRModule module = parse("""
            %Qubit = type opaque

            declare void @__quantum__qis__cnot__body(%Qubit*, %Qubit*)

            define void @main() {
            entry:
              call void @__quantum__qis__cnot__body(%Qubit* null,
                                                    %Qubit* inttoptr (i64 1 to %Qubit*)), !dbg !7
              ret void
            }
            """);
        CallInst call = (CallInst) body(module, "main", "entry").get(0);
        assertEquals(2, call.getNumArgs());
    }

    @Test
    void unknown_instruction_is_kept_as_generic() throws Exception {
        QIRModule module = parse("""
            define void @main() {
            entry:
              %p = alloca i32, align 4
              %d = fptosi double 1.0 to i64
              ret void
            }
            """);
        List<Instruction> insts = body(module, "main", "entry");
        GenericInst alloca = (GenericInst) insts.get(0);
        assertEquals("alloca", alloca.getOpcodeName());
        assertTrue(alloca.getType() instanceof PointerType);
        assertEquals(TypeKind.INTEGER, insts.get(1).getType().getKind());
    }

    @Test
    void unknown_instruction_can_be_refused() {
        var config = LoaderConfig.defaultConfig().setAllowUnknownInstructions(false);
        var e = assertThrows(LLVMParseException.class, () -> QIRLoader.parseFromString("""
            define void @main() {
            entry:
              %p = alloca i32
              ret void
            }
            """, "test", config));
        assertTrue(e.getMessage().contains("alloca"), e.getMessage());
    }

    @Test
    void undefined_label_fails() {
        var e = assertThrows(LLVMParseException.class, () -> parse("""
            define void @main() {
            entry:
              br label %nowhere
            }
            """));
        assertEquals(1, e.getErrors().size());
        assertTrue(e.getErrors().get(0).getErrorMessage().contains("%nowhere"));
    }

    @Test
    void undefined_value_fails_at_end_of_function() {
        var e = assertThrows(LLVMParseException.class, () -> parse("""
            define void @main() {
            entry:
              %x = add i32 %missing, 1
              ret void
            }
            """));
        assertTrue(e.getMessage().contains("%missing"), e.getMessage());
    }

    @Test
    void call_to_undeclared_function_fails() {
        assertThrows(LLVMParseException.class, () -> parse("""
            define void @main() {
            entry:
              call void @nobody()
              ret void
            }
            """));
    }

    @Test
    void lenient_mode_skips_bad_lines() throws Exception {
        QIRModule module = QIRLoader.parseFromString("""
            this is not llvm
            define void @main() {
            entry:
              ret void
            }
            """, "test", LoaderConfig.lenientConfig());
        assertNotNull(module.getFunction("main"));
        assertEquals(1, module.getFunction("main").getBlocks().size());
    }

    @Test
    void collect_mode_reports_every_error() {
        var config = LoaderConfig.defaultConfig().setErrorHandling(LoaderConfig.ErrorHandling.COLLECT);
        var e = assertThrows(LLVMParseException.class, () -> QIRLoader.parseFromString("""
            first bad line
            second bad line
            define void @main() {
            entry:
              ret void
            }
            """, "test", config));
        assertEquals(2, e.getErrors().size());
    }

    @Test
    void float_types_from_text() throws Exception {
        QIRModule module = parse("""
            declare half @h(float, double)
            """);
        var type = module.getFunction("h").getFunctionType();
        assertEquals(FloatType.getHalf(), type.getReturnType());
        assertEquals(FloatType.getFloat(), type.getParamTypes().get(0));
    }

    @Test
    void missing_resource_is_io_error() {
        assertThrows(java.io.IOException.class, () -> QIRLoader.loadFromResource("qir/does_not_exist.ll"));
    }
}
