package translate;

import exception.CompileException;
import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.type.TypeKind;
import qasm.ast.BoolType;
import qasm.ast.IntType;
import qasm.ast.IntegerLiteral;

/**
 * IR type to OpenQASM type. Pointers are transparent (one level only),
 * structs map to their name and are resolved through the profile later.
 */
public final class TypeMapper {

    private TypeMapper() {
    }

    public static TargetType map(Type type) {
        TypeKind kind = type.getKind();
        if (kind == TypeKind.VOID) {
            return TargetType.ofVoid();
        }
        if (kind.isFloatingPoint()) {
            int width = ((FloatType) type).getBitWidth();
            return TargetType.ofClassical(kind, new qasm.ast.FloatType(new IntegerLiteral(width)));
        }
        if (type instanceof IntegerType intType) {
            if (intType.isI1()) {
                return TargetType.ofClassical(kind, new BoolType());
            }
            return TargetType.ofClassical(kind, new IntType(new IntegerLiteral(intType.getBitWidth())));
        }
        if (type instanceof StructType struct) {
            if (struct.isLiteral()) {
                throw CompileException.unsupportedType(type.toIR());
            }
            return TargetType.ofStruct(kind, struct.getName());
        }
        if (type instanceof PointerType pointer) {
            if (pointer.isOpaque()) {
                throw CompileException.unsupportedType(type.toIR());
            }
            TargetType inner = map(pointer.getPointeeType());
            if (inner.isPointer()) {
                throw CompileException.pointerToPointer(type.toIR());
            }
            return inner.asPointer();
        }
        // vector, array, function, label
        throw CompileException.unsupportedType(kind.name().toLowerCase());
    }
}
