package translate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import exception.CompileException;
import ir.InstructionVisitor;
import ir.QIRModule;
import ir.type.FunctionType;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.GenericInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.ReturnInst;
import pass.PassManager;
import qasm.ast.BinaryOperator;
import qasm.ast.CalibrationDefinition;
import qasm.ast.ClassicalType;
import qasm.ast.Identifier;
import qasm.ast.Include;
import qasm.ast.Program;
import qasm.ast.Statement;
import translate.builder.BinaryExpressionBuilder;
import translate.builder.DefCalBuilder;
import translate.builder.FunctionBuilder;
import translate.builder.LoweringResult;
import translate.profile.Profile;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Builds the OpenQASM program for one module.
 *
 * <p>Order of work: register the profile and the used externs (synthesizing
 * a {@code defcal} for every unknown one), lower each block of the entry
 * function, structure the block graph, and finally size the variable
 * declarations from what lowering allocated.
 */
public class QASM3Builder implements InstructionVisitor<Void> {
    private static final Map<Opcode, BinaryOperator> CLASSICAL_OPS = new EnumMap<>(Opcode.class);

    static {
        CLASSICAL_OPS.put(Opcode.ADD, BinaryOperator.ADD);
        CLASSICAL_OPS.put(Opcode.SUB, BinaryOperator.SUB);
        CLASSICAL_OPS.put(Opcode.MUL, BinaryOperator.MUL);
        CLASSICAL_OPS.put(Opcode.SDIV, BinaryOperator.DIV);
        CLASSICAL_OPS.put(Opcode.SREM, BinaryOperator.MOD);
        CLASSICAL_OPS.put(Opcode.AND, BinaryOperator.BIT_AND);
        CLASSICAL_OPS.put(Opcode.OR, BinaryOperator.BIT_OR);
        CLASSICAL_OPS.put(Opcode.XOR, BinaryOperator.BIT_XOR);
        CLASSICAL_OPS.put(Opcode.SHL, BinaryOperator.SHL);
        CLASSICAL_OPS.put(Opcode.ASHR, BinaryOperator.SHR);
        CLASSICAL_OPS.put(Opcode.FADD, BinaryOperator.ADD);
        CLASSICAL_OPS.put(Opcode.FSUB, BinaryOperator.SUB);
        CLASSICAL_OPS.put(Opcode.FMUL, BinaryOperator.MUL);
        CLASSICAL_OPS.put(Opcode.FDIV, BinaryOperator.DIV);

        // int[N] 是有符号的, 无符号运算不在表里
        CLASSICAL_OPS.put(Opcode.ICMP_EQ, BinaryOperator.EQ);
        CLASSICAL_OPS.put(Opcode.ICMP_NE, BinaryOperator.NE);
        CLASSICAL_OPS.put(Opcode.ICMP_SLT, BinaryOperator.LT);
        CLASSICAL_OPS.put(Opcode.ICMP_SLE, BinaryOperator.LE);
        CLASSICAL_OPS.put(Opcode.ICMP_SGT, BinaryOperator.GT);
        CLASSICAL_OPS.put(Opcode.ICMP_SGE, BinaryOperator.GE);
    }

    private final Logger log = LoggingManager.getLogger(this.getClass());

    private final QIRModule module;
    private final List<String> includes;
    private final Profile profile;
    private final SymbolTable symbols = new SymbolTable();

    // 当前正在翻译的块
    private String currentBlock;
    private List<Statement> currentStatements;
    private BranchInfo currentBranch;

    public QASM3Builder(QIRModule module, List<String> includes, Profile profile) {
        this.module = module;
        this.includes = List.copyOf(includes);
        this.profile = profile;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    /**
     * version, includes, variable declarations, function declarations, body
     */
    public Program buildProgram() {
        List<Statement> includeStatements = new ArrayList<>();
        for (String filename : includes) {
            includeStatements.add(new Include(filename));
        }

        List<Statement> funcDeclarations = buildFunctionDeclarations();
        List<Statement> main = buildMain();
        List<Statement> varDeclarations = symbols.buildVariableDeclarations();

        List<Statement> statements = new ArrayList<>(includeStatements);
        statements.addAll(varDeclarations);
        statements.addAll(funcDeclarations);
        statements.addAll(main);
        return new Program(statements);
    }

    /**
     * Registers the profile and every declared extern. Known externs
     * contribute their definition (once), unknown ones get a {@code defcal}.
     *
     * @return the defcals followed by the gate definitions
     */
    public List<Statement> buildFunctionDeclarations() {
        for (StructInfo info : profile.getStructs().values()) {
            symbols.registerStruct(info);
        }
        for (InstructionInfo info : profile.getInstructions().values()) {
            symbols.registerInstruction(info);
        }

        List<Statement> defcals = new ArrayList<>();
        List<Statement> definitions = new ArrayList<>();
        for (Function func : module.getFunctions()) {
            if (!func.isDeclaration()) {
                continue;
            }
            FunctionInfo known = profile.getFunction(func.getName());
            if (known != null) {
                symbols.registerFunction(known);
                if (known.hasDefinition()) {
                    definitions.add(known.definition());
                }
                continue;
            }
            defcals.add(synthesizeDefcal(func));
            symbols.registerFunction(new FunctionInfo(func.getName(), func.getFunctionType(), null,
                                                      new DefCalBuilder(func.getName())));
        }

        List<Statement> result = new ArrayList<>(defcals);
        result.addAll(definitions);
        return result;
    }

    /*
     * Qubit* f(...)       => defcal f(...) q_ret, ...
     * void f(T* out, ...) => defcal f(T, ...) ... -> T
     */
    private CalibrationDefinition synthesizeDefcal(Function func) {
        FunctionType type = func.getFunctionType();
        List<ClassicalType> arguments = new ArrayList<>();
        List<Identifier> qubits = new ArrayList<>();

        ClassicalType returnType = null;
        TargetType ret = symbols.mapType(type.getReturnType());
        if (!ret.isVoid()) {
            if (symbols.isQubit(ret)) {
                qubits.add(new Identifier("q_ret"));
            } else {
                returnType = symbols.toClassical(ret);
            }
        }

        int numQubits = 0;
        for (Type paramType : type.getParamTypes()) {
            TargetType param = symbols.mapType(paramType);
            if (symbols.isQubit(param)) {
                numQubits++;
                continue;
            }
            ClassicalType classical = symbols.toClassical(param);
            arguments.add(classical);
            if (param.isPointer()) {
                if (returnType != null) {
                    throw CompileException.tooManyReturnValues(func.getName());
                }
                returnType = classical;
            }
        }

        if (numQubits == 1) {
            qubits.add(new Identifier("q"));
        } else {
            for (int k = 0; k < numQubits; k++) {
                qubits.add(new Identifier("q" + k));
            }
        }
        log.debug("synthesized defcal for @{}", func.getName());
        return new CalibrationDefinition(new Identifier(func.getName()), arguments, qubits, returnType, "");
    }

    /**
     * Lowers the entry function and structures its blocks.
     *
     * @return the statements of the single block left
     */
    public List<Statement> buildMain() {
        Function main = null;
        for (Function func : module.getFunctions()) {
            if (func.isEntryPoint()) {
                main = func;
                break;
            }
        }
        if (main == null) {
            throw CompileException.missingEntry();
        }
        if (main.isDeclaration()) {
            throw CompileException.missingEntry();
        }

        symbols.setEntryBlock(main.getEntryBlock().getName());
        for (BasicBlock block : main.getBlocks()) {
            buildBlock(block);
        }
        log.info("lowered @{}: {} blocks", main.getName(), main.getBlocks().size());

        symbols.freeze();
        List<String> remaining = PassManager.getInstance().run(symbols);
        String survivor = remaining.get(0);
        if (!survivor.equals(symbols.getEntryBlock())) {
            log.warn("entry block {} was absorbed into {}", symbols.getEntryBlock(), survivor);
        }
        return symbols.getStatements(survivor);
    }

    private void buildBlock(BasicBlock block) {
        currentBlock = block.getName();
        currentStatements = new ArrayList<>();
        currentBranch = null;
        for (Instruction inst : block.getInstructions()) {
            inst.accept(this);
        }
        if (currentBranch == null) {
            throw CompileException.inconsistentBlockState("block " + currentBlock + " has no terminator");
        }
        symbols.addBlock(currentBlock, currentStatements, currentBranch);
    }

    private void lowerClassical(Instruction inst, Opcode opcode) {
        BinaryOperator op = CLASSICAL_OPS.get(opcode);
        if (op == null) {
            throw CompileException.unsupportedInstruction(inst.getOpcodeName(), currentBlock);
        }
        LoweringResult result = new BinaryExpressionBuilder(op).build(symbols, inst.getType(), inst.getOperands());
        symbols.bind(inst, result.result());
        currentStatements.addAll(result.statements());
    }

    @Override
    public Void visit(BinOperator inst) {
        lowerClassical(inst, inst.opCode());
        return null;
    }

    @Override
    public Void visit(ICmpInst inst) {
        lowerClassical(inst, inst.opCode());
        return null;
    }

    @Override
    public Void visit(CallInst inst) {
        Function callee = inst.getCalledFunction();
        FunctionInfo info = symbols.getFunction(callee.getName());
        if (info == null) {
            throw CompileException.unsupportedInstruction("call @" + callee.getName(), currentBlock);
        }
        if (!callee.getFunctionType().equals(info.type())) {
            throw CompileException.signatureMismatch(callee.getName(), info.type().toIR(),
                                                     callee.getFunctionType().toIR());
        }
        FunctionBuilder builder = info.builder();
        LoweringResult result = builder.build(symbols, inst.getType(), inst.getArgs());
        if (result.hasResult()) {
            symbols.bind(inst, result.result());
        }
        currentStatements.addAll(result.statements());
        return null;
    }

    @Override
    public Void visit(BranchInst inst) {
        if (inst.isConditional()) {
            currentBranch = BranchInfo.conditional(symbols.mapValue(inst.getCondition()),
                                                   inst.getThenBlock().getName(),
                                                   inst.getElseBlock().getName());
        } else {
            currentBranch = BranchInfo.unconditional(inst.getThenBlock().getName());
        }
        return null;
    }

    @Override
    public Void visit(ReturnInst inst) {
        currentBranch = BranchInfo.terminal();
        return null;
    }

    @Override
    public Void visit(GenericInst inst) {
        throw CompileException.unsupportedInstruction(inst.getOpcodeName(), currentBlock);
    }
}
