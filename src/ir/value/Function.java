package ir.value;

import ir.QIRModule;
import ir.type.FunctionType;
import ir.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A declared or defined function. Attributes come from the
 * {@code attributes #N = { ... }} groups attached to the function: keys
 * without a value (like {@code "entry_point"}) map to the empty string.
 */
public class Function extends Value {
    public static final String ENTRY_POINT_ATTR = "entry_point";

    private final QIRModule module;
    private final List<Argument> arguments;
    private final List<BasicBlock> blocks;
    private final Map<String, String> attributes;
    private final Map<String, Integer> nameCounts;

    public Function(QIRModule parent, FunctionType type, String name) {
        super(type, name);
        this.module = parent;
        this.arguments = new ArrayList<>();
        this.blocks = new ArrayList<>();
        this.attributes = new LinkedHashMap<>();
        this.nameCounts = new HashMap<>();

        // 根据FunctionType创建参数
        List<Type> paramTypes = type.getParamTypes();
        for (int i = 0; i < paramTypes.size(); i++) {
            arguments.add(new Argument(paramTypes.get(i), String.valueOf(i), i, this));
        }
    }

    public BasicBlock getBlockByName(String name) {
        for (BasicBlock block : blocks) {
            if (block.getName().equals(name)) {
                return block;
            }
        }
        return null;
    }

    /* getter setter */
    public QIRModule getParent() {
        return module;
    }

    public FunctionType getFunctionType() {
        return (FunctionType) super.getType();
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Argument getParam(int index) {
        return arguments.get(index);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public BasicBlock appendBasicBlock(String name) {
        return new BasicBlock(getUniqueName(name), this);
    }

    void addBlock(BasicBlock block) {
        blocks.add(block);
        block.setParent(this);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public void addAttribute(String key, String value) {
        attributes.put(key, value == null ? "" : value);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public boolean isEntryPoint() {
        return hasAttribute(ENTRY_POINT_ATTR);
    }

    /* 获得该函数中一个未被使用的名字 */
    public String getUniqueName(String name) {
        int count = nameCounts.getOrDefault(name, 0);
        nameCounts.put(name, count + 1);
        if (count == 0) {
            return name;
        }
        return name + "." + count;
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    @Override
    public String toIR() {
        FunctionType fnType = getFunctionType();
        if (isDeclaration()) {
            String params = fnType.getParamTypes().stream()
                .map(Type::toIR)
                .collect(Collectors.joining(", "));
            return "declare " + fnType.getReturnType().toIR() + " @" + getName() + "(" + params + ")\n";
        }

        StringBuilder sb = new StringBuilder();
        String argsStr = arguments.stream()
            .map(Argument::toIR)
            .collect(Collectors.joining(", "));
        sb.append("define ").append(fnType.getReturnType().toIR())
            .append(" @").append(getName()).append("(")
            .append(argsStr).append(") {\n");
        for (BasicBlock block : blocks) {
            sb.append(block.toIR());
        }
        sb.append("}\n");
        return sb.toString();
    }
}
