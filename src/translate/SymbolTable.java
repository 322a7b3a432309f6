package translate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import driver.Config;
import exception.CompileException;
import ir.type.Type;
import ir.value.Value;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import pass.cfg.ControlFlowGraph;
import qasm.ast.BooleanLiteral;
import qasm.ast.ClassicalType;
import qasm.ast.Expression;
import qasm.ast.FloatLiteral;
import qasm.ast.IODeclaration;
import qasm.ast.IOKeyword;
import qasm.ast.Identifier;
import qasm.ast.IndexedIdentifier;
import qasm.ast.IntegerLiteral;
import qasm.ast.Statement;
import translate.builder.ClassicalDeclarationBuilder;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Translation state of one module.
 *
 * <p>Holds the registries copied from the profile, the value bindings, the
 * storage counters that size the variable declarations, and the per-block
 * statements and branches together with the control-flow graph over them.
 * Block state is only changed through {@link #addBlock}, {@link #rewriteBlock}
 * and {@link #duplicateBlock}, which keep the three views in sync.
 */
public class SymbolTable {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    /* registries */
    private final Map<String, StructInfo> structs = new LinkedHashMap<>();
    private final Map<String, FunctionInfo> functions = new LinkedHashMap<>();
    private final Map<String, InstructionInfo> instructions = new LinkedHashMap<>();

    /* storage counters */
    private final Map<String, Integer> structCounts = new LinkedHashMap<>();
    private final Map<String, Integer> structTmpCounts = new LinkedHashMap<>();
    // 临时变量按类型名分组, 首次使用的具体类型为准
    private final Map<String, ClassicalType> classicalTmpTypes = new LinkedHashMap<>();
    private final Map<String, Integer> classicalTmpCounts = new LinkedHashMap<>();
    private final List<IODeclaration> inputs = new ArrayList<>();
    private final List<IODeclaration> outputs = new ArrayList<>();
    private boolean frozen = false;

    // SSA 值只绑定一次
    private final Map<Value, Expression> bindings = new IdentityHashMap<>();

    /* block state */
    private final Map<String, List<Statement>> blockStatements = new LinkedHashMap<>();
    private final Map<String, BranchInfo> blockBranches = new LinkedHashMap<>();
    private final ControlFlowGraph cfg = new ControlFlowGraph();
    private String entryBlock;
    private int copyCounter = 0;

    // ---------------------------------------------------------------- registries

    public void registerStruct(StructInfo info) {
        structs.put(info.name(), info);
        structCounts.putIfAbsent(info.name(), 0);
        structTmpCounts.putIfAbsent(info.name(), 0);
    }

    public void registerFunction(FunctionInfo info) {
        functions.put(info.name(), info);
    }

    public void registerInstruction(InstructionInfo info) {
        instructions.put(info.name(), info);
    }

    public StructInfo getStruct(String name) {
        StructInfo info = structs.get(name);
        if (info == null) {
            throw CompileException.unknownStruct(name);
        }
        return info;
    }

    public FunctionInfo getFunction(String name) {
        return functions.get(name);
    }

    public Collection<FunctionInfo> getFunctions() {
        return functions.values();
    }

    // ---------------------------------------------------------------- types and values

    public TargetType mapType(Type type) {
        return TypeMapper.map(type);
    }

    public boolean isQubit(TargetType type) {
        return type.isStruct() && getStruct(type.structName()).isQuantum();
    }

    /**
     * @return the classical type a value of {@code type} is stored as, null for void and qubits
     */
    public ClassicalType toClassical(TargetType type) {
        if (type.isStruct()) {
            return getStruct(type.structName()).targetType();
        }
        return type.classical();
    }

    /**
     * Maps an operand: numeric constants become literals, other constants
     * are offered to every registered instruction builder, anything else
     * must already be bound.
     */
    public Expression mapValue(Value value) {
        if (value.isConstant()) {
            if (value instanceof ConstantInt ci) {
                return ci.isBool() ? new BooleanLiteral(ci.getValue() != 0) : new IntegerLiteral(ci.getValue());
            }
            if (value instanceof ConstantFloat cf) {
                return new FloatLiteral(cf.getValue());
            }
            for (InstructionInfo info : instructions.values()) {
                Expression expr = info.builder().build(this, value);
                if (expr != null) {
                    return expr;
                }
            }
            throw CompileException.undefinedEncoding(value.toIR());
        }
        Expression bound = bindings.get(value);
        if (bound == null) {
            throw new IllegalStateException("Value used before it was lowered: " + value.getReference());
        }
        return bound;
    }

    public void bind(Value value, Expression expr) {
        if (bindings.containsKey(value)) {
            throw new IllegalStateException("Value bound twice: " + value.getReference());
        }
        bindings.put(value, expr);
    }

    public boolean isBound(Value value) {
        return bindings.containsKey(value);
    }

    // ---------------------------------------------------------------- storage

    /**
     * Records that element {@code index} of the struct's static array is used.
     */
    public void noteStructUse(String structName, long index) {
        checkNotFrozen();
        getStruct(structName);
        structCounts.merge(structName, (int) (index + 1), Math::max);
    }

    public int getStructCount(String structName) {
        return structCounts.getOrDefault(structName, 0);
    }

    /**
     * Allocates the next temporary for a value of {@code type}:
     * {@code Results_tmp[k]} for structs, {@code IntType_tmp[k]} for classical values.
     */
    public IndexedIdentifier allocateTemporary(TargetType type) {
        checkNotFrozen();
        if (type.isVoid()) {
            throw new IllegalStateException("Cannot allocate a temporary of void type");
        }
        if (type.isStruct()) {
            StructInfo info = getStruct(type.structName());
            int index = structTmpCounts.merge(info.name(), 1, Integer::sum) - 1;
            return IndexedIdentifier.of(info.temporaryName(), index);
        }
        String typeName = type.classical().getName();
        classicalTmpTypes.putIfAbsent(typeName, type.classical());
        int index = classicalTmpCounts.merge(typeName, 1, Integer::sum) - 1;
        return IndexedIdentifier.of(typeName + "_tmp", index);
    }

    /**
     * Declares a fresh {@code input}/{@code output} variable, named
     * {@code <TypeName>_i<k>} / {@code <TypeName>_o<k>} with k counting per direction.
     */
    public Identifier allocateIO(ClassicalType type, IOKeyword io) {
        checkNotFrozen();
        if (type == null) {
            throw new IllegalArgumentException("Only classical values can be program inputs or outputs");
        }
        List<IODeclaration> list = io == IOKeyword.INPUT ? inputs : outputs;
        Identifier id = new Identifier(type.getName() + "_" + io.getSuffix() + list.size());
        list.add(new IODeclaration(io, type, id));
        return id;
    }

    /**
     * Stops all further allocation; called once lowering is done and the
     * declarations have been sized.
     */
    public void freeze() {
        frozen = true;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Storage is frozen, no allocation after lowering");
        }
    }

    /**
     * Struct arrays and their temporaries in registration order, then the
     * classical temporaries in first-use order, then inputs, then outputs.
     * Empty arrays are left out.
     */
    public List<Statement> buildVariableDeclarations() {
        List<Statement> decls = new ArrayList<>();
        for (StructInfo info : structs.values()) {
            int count = structCounts.getOrDefault(info.name(), 0);
            if (count > 0) {
                decls.add(info.declarationBuilder().build(info.staticName(), count));
            }
            int tmpCount = structTmpCounts.getOrDefault(info.name(), 0);
            if (tmpCount > 0) {
                decls.add(info.declarationBuilder().build(info.temporaryName(), tmpCount));
            }
        }
        for (Map.Entry<String, ClassicalType> e : classicalTmpTypes.entrySet()) {
            int count = classicalTmpCounts.get(e.getKey());
            decls.add(new ClassicalDeclarationBuilder(e.getValue()).build(e.getKey() + "_tmp", count));
        }
        decls.addAll(inputs);
        decls.addAll(outputs);
        return decls;
    }

    // ---------------------------------------------------------------- blocks

    /**
     * Adds a lowered block. Edges to blocks that are added later are fine;
     * the node appears as soon as it is referenced.
     */
    public void addBlock(String name, List<Statement> statements, BranchInfo branch) {
        if (blockStatements.containsKey(name)) {
            throw new IllegalStateException("Block added twice: " + name);
        }
        blockStatements.put(name, new ArrayList<>(statements));
        blockBranches.put(name, branch);
        cfg.addNode(name);
        for (String target : branch.targets()) {
            cfg.addEdge(name, target);
        }
    }

    public void setEntryBlock(String name) {
        this.entryBlock = name;
    }

    public String getEntryBlock() {
        return entryBlock;
    }

    public List<Statement> getStatements(String block) {
        List<Statement> stmts = blockStatements.get(block);
        if (stmts == null) {
            throw CompileException.inconsistentBlockState("no statements for block " + block);
        }
        return stmts;
    }

    public BranchInfo getBranch(String block) {
        BranchInfo branch = blockBranches.get(block);
        if (branch == null) {
            throw CompileException.inconsistentBlockState("no branch for block " + block);
        }
        return branch;
    }

    public ControlFlowGraph getCfg() {
        return cfg;
    }

    /**
     * Contraction step shared by every structuring rewrite: appends
     * {@code appended} to {@code target}, gives it {@code newBranch}, and
     * drops the {@code absorbed} blocks from the maps and the graph.
     */
    public void rewriteBlock(String target, List<Statement> appended, BranchInfo newBranch,
                             Collection<String> absorbed) {
        List<Statement> stmts = getStatements(target);
        for (String name : absorbed) {
            if (name.equals(target)) {
                throw CompileException.inconsistentBlockState("block " + target + " cannot absorb itself");
            }
            blockStatements.remove(name);
            blockBranches.remove(name);
            cfg.removeNode(name);
        }
        stmts.addAll(appended);
        blockBranches.put(target, newBranch);
        cfg.setSuccessors(target, newBranch.targets());
        verifyIfEnabled();
    }

    /**
     * Gives the edge {@code pred -> block} its own copy of {@code block}.
     * @return the copy's name
     */
    public String duplicateBlock(String pred, String block) {
        if (!cfg.hasEdge(pred, block)) {
            throw CompileException.inconsistentBlockState("no edge " + pred + " -> " + block);
        }
        String copy = freshBlockName(block);
        BranchInfo branch = getBranch(block);
        blockStatements.put(copy, new ArrayList<>(getStatements(block)));
        blockBranches.put(copy, branch);
        blockBranches.put(pred, getBranch(pred).retarget(block, copy));

        cfg.removeEdge(pred, block);
        cfg.addEdge(pred, copy);
        for (String succ : branch.targets()) {
            cfg.addEdge(copy, succ);
        }
        log.debug("isolated {} -> {} as {}", pred, block, copy);
        verifyIfEnabled();
        return copy;
    }

    private String freshBlockName(String base) {
        String name;
        do {
            name = base + ".dup" + (copyCounter++);
        } while (blockStatements.containsKey(name) || cfg.containsNode(name));
        return name;
    }

    private void verifyIfEnabled() {
        if (Config.getInstance().verifyStructuring) {
            verifyBlockState();
        }
    }

    /**
     * Checks that the statement map, the branch map and the graph describe
     * the same blocks and that every block's edges match its branch targets.
     */
    public void verifyBlockState() {
        Set<String> graphNodes = new HashSet<>(cfg.nodes());
        if (!graphNodes.equals(blockStatements.keySet()) || !graphNodes.equals(blockBranches.keySet())) {
            throw CompileException.inconsistentBlockState(
                "graph " + graphNodes + ", statements " + blockStatements.keySet()
                + ", branches " + blockBranches.keySet());
        }
        for (String node : graphNodes) {
            Set<String> edges = new HashSet<>(cfg.successors(node));
            Set<String> targets = new HashSet<>(blockBranches.get(node).targets());
            if (!edges.equals(targets)) {
                throw CompileException.inconsistentBlockState(
                    "block " + node + " branches to " + targets + " but graph has " + edges);
            }
        }
    }
}
