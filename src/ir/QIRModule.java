package ir;

import ir.type.FunctionType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.Function;
import ir.value.GlobalVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory QIR module: named struct types, globals and functions, each in
 * source order. One instance per loaded file.
 */
public class QIRModule {
    private final String moduleName;
    private String sourceFileName;

    // 维护结构体名到结构体类型的映射
    private final Map<String, StructType> structTypes = new LinkedHashMap<>();

    // 维护全局变量名到全局变量的映射
    private final Map<String, GlobalVariable> globalVariables = new LinkedHashMap<>();

    // 维护函数名到函数的映射
    private final Map<String, Function> functions = new LinkedHashMap<>();

    public QIRModule(String moduleName) {
        this.moduleName = moduleName;
    }

    public String getName() {
        return moduleName;
    }

    public String getSourceFileName() {
        return sourceFileName;
    }

    public void setSourceFileName(String sourceFileName) {
        this.sourceFileName = sourceFileName;
    }

    /* struct types */
    public StructType getOrCreateStruct(String name) {
        return structTypes.computeIfAbsent(name, StructType::createNamed);
    }

    public StructType getStruct(String name) {
        return structTypes.get(name);
    }

    public List<StructType> getStructTypes() {
        return Collections.unmodifiableList(new ArrayList<>(structTypes.values()));
    }

    /* functions */
    public Function addFunction(String name, FunctionType type) {
        if (functions.containsKey(name)) {
            throw new IllegalArgumentException(
                "Function '" + name + "' has already been declared.");
        }
        Function newFunc = new Function(this, type, name);
        functions.put(name, newFunc);
        return newFunc;
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(new ArrayList<>(functions.values()));
    }

    /* globals */
    public GlobalVariable addGlobal(String name, Type valueType, String initializer, boolean isConst) {
        if (globalVariables.containsKey(name)) {
            throw new IllegalArgumentException(
                "Global '" + name + "' has already been declared.");
        }
        GlobalVariable gv = new GlobalVariable(this, valueType, name, initializer, isConst);
        globalVariables.put(name, gv);
        return gv;
    }

    public GlobalVariable getGlobalVariable(String name) {
        return globalVariables.get(name);
    }

    public List<GlobalVariable> getGlobalVariables() {
        return Collections.unmodifiableList(new ArrayList<>(globalVariables.values()));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(moduleName).append("'\n");
        if (sourceFileName != null) {
            sb.append("source_filename = \"").append(sourceFileName).append("\"\n");
        }
        sb.append("\n");
        for (StructType st : structTypes.values()) {
            sb.append("%").append(st.getName()).append(" = type ").append(st.getBodyIR()).append("\n");
        }
        for (GlobalVariable gv : globalVariables.values()) {
            sb.append(gv.toIR()).append("\n");
        }
        for (Function f : functions.values()) {
            sb.append("\n").append(f.toIR());
        }
        return sb.toString();
    }
}
