package exception;

/**
 * Unrecoverable translation failure. Every failure aborts the whole
 * translation; {@link #getKind()} tells callers which category it belongs to.
 */
public class CompileException extends RuntimeException {

    public enum Kind {
        UNSUPPORTED_IR_TYPE,
        UNSUPPORTED_POINTER_TO_POINTER,
        UNDEFINED_INSTRUCTION_ENCODING,
        MALFORMED_GATE_SIGNATURE,
        TOO_MANY_RETURN_VALUES,
        MISSING_ENTRY_FUNCTION,
        STRUCTURING_DID_NOT_CONVERGE,
        UNSUPPORTED_INSTRUCTION,
        SIGNATURE_MISMATCH,
        UNKNOWN_STRUCT,
        INCONSISTENT_BLOCK_STATE,
        INVALID_ARGUMENTS
    }

    private final Kind kind;

    public CompileException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /* command line */
    public static CompileException noArgs() {
        return new CompileException(Kind.INVALID_ARGUMENTS, "need args to process");
    }

    public static CompileException wrongArgs(String msg) {
        return new CompileException(Kind.INVALID_ARGUMENTS, "Unexpected args: " + msg);
    }

    /* type mapping */
    public static CompileException unsupportedType(String typeText) {
        return new CompileException(Kind.UNSUPPORTED_IR_TYPE, typeText + " Undefined!");
    }

    public static CompileException pointerToPointer(String typeText) {
        return new CompileException(Kind.UNSUPPORTED_POINTER_TO_POINTER,
                                    "Unsupported ptr to ptr! (" + typeText + ")");
    }

    public static CompileException unknownStruct(String name) {
        return new CompileException(Kind.UNKNOWN_STRUCT, "Unregistered struct: %" + name);
    }

    /* lowering */
    public static CompileException undefinedEncoding(String constantText) {
        return new CompileException(Kind.UNDEFINED_INSTRUCTION_ENCODING,
                                    "Undefined llvm insturction encoding: " + constantText);
    }

    public static CompileException malformedGate(String gate, String retType) {
        return new CompileException(Kind.MALFORMED_GATE_SIGNATURE,
                                    "Gate " + gate + " must return void, got " + retType);
    }

    public static CompileException tooManyReturnValues(String function) {
        return new CompileException(Kind.TOO_MANY_RETURN_VALUES,
                                    "Too much return value! (in " + function + ")");
    }

    public static CompileException unsupportedInstruction(String opcode, String block) {
        return new CompileException(Kind.UNSUPPORTED_INSTRUCTION,
                                    "Undefined llvm instruction: " + opcode + " (block " + block + ")");
    }

    public static CompileException signatureMismatch(String function, String expected, String actual) {
        return new CompileException(Kind.SIGNATURE_MISMATCH,
                                    "Call to " + function + " has type " + actual + ", expected " + expected);
    }

    public static CompileException missingEntry() {
        return new CompileException(Kind.MISSING_ENTRY_FUNCTION, "No main function defined!");
    }

    /* structuring */
    public static CompileException notConverged(int remaining, String nodes) {
        return new CompileException(Kind.STRUCTURING_DID_NOT_CONVERGE,
                                    "Control flow could not be structured, " + remaining
                                    + " blocks remain: " + nodes);
    }

    public static CompileException inconsistentBlockState(String msg) {
        return new CompileException(Kind.INCONSISTENT_BLOCK_STATE, "Illegal block state: " + msg);
    }
}
