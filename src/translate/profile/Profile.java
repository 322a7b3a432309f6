package translate.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ir.type.FunctionType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import qasm.ast.ClassicalType;
import qasm.ast.Statement;
import translate.FunctionInfo;
import translate.InstructionInfo;
import translate.StructInfo;
import translate.builder.DeclarationBuilder;
import translate.builder.FunctionBuilder;
import translate.builder.InstructionBuilder;

/**
 * Registry of everything a QIR dialect can lower: structs, external
 * functions and constant encodings. Subclasses fill it in through the
 * three {@code define*} hooks, which run once from the constructor.
 */
public abstract class Profile {
    private final String name;
    private final Map<String, StructInfo> structs = new LinkedHashMap<>();
    private final Map<String, FunctionInfo> functions = new LinkedHashMap<>();
    private final Map<String, InstructionInfo> instructions = new LinkedHashMap<>();

    protected Profile(String name) {
        this.name = name;
        defineStructs();
        defineFunctions();
        defineInstructions();
    }

    protected abstract void defineStructs();

    protected abstract void defineFunctions();

    protected abstract void defineInstructions();

    public String getName() {
        return name;
    }

    protected void registerStruct(String structName, ClassicalType targetType, DeclarationBuilder declBuilder) {
        structs.put(structName, new StructInfo(structName, targetType, declBuilder));
    }

    protected void registerFunction(String funcName, Type retType, List<Type> argTypes,
                                    Statement definition, FunctionBuilder builder) {
        functions.put(funcName, new FunctionInfo(funcName, FunctionType.get(retType, argTypes), definition, builder));
    }

    protected void registerInstruction(String instName, InstructionBuilder builder) {
        instructions.put(instName, new InstructionInfo(instName, builder));
    }

    /**
     * {@code %Name*} for a registered struct. Struct types compare by name, so
     * the pointer equals the one the loader builds for the same spelling.
     */
    protected PointerType structPointer(String structName) {
        if (!structs.containsKey(structName)) {
            throw new IllegalStateException("struct " + structName + " must be registered first");
        }
        return PointerType.get(StructType.createNamed(structName));
    }

    public Map<String, StructInfo> getStructs() {
        return Collections.unmodifiableMap(structs);
    }

    public Map<String, FunctionInfo> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public Map<String, InstructionInfo> getInstructions() {
        return Collections.unmodifiableMap(instructions);
    }

    public FunctionInfo getFunction(String funcName) {
        return functions.get(funcName);
    }
}
