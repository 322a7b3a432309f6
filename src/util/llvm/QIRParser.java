package util.llvm;

import ir.Builder;
import ir.QIRModule;
import ir.type.ArrayType;
import ir.type.FloatType;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.LabelType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.type.TypeKind;
import ir.type.VectorType;
import ir.type.VoidType;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import ir.value.instructions.GenericInst;
import ir.value.instructions.Instruction;
import util.logging.LogManager;
import util.logging.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * QIR 文本解析器
 *
 * 两阶段解析: 第一阶段建立结构体类型, 全局变量, 函数和基本块;
 * 第二阶段解析指令内容. 类型和带类型的值由 {@link Cursor} 递归下降读取,
 * 其余部分按行匹配.
 */
public class QIRParser {
    private static final Logger logger = LogManager.getLogger(QIRParser.class);

    private static final String NAME = "(?:[-\\w.$]+|\"[^\"]*\")";

    private static final Pattern SOURCE_FILENAME_PATTERN =
        Pattern.compile("^source_filename\\s*=\\s*\"(.*)\"$");
    private static final Pattern STRUCT_TYPE_PATTERN =
        Pattern.compile("^%(" + NAME + ")\\s*=\\s*type\\s+(.+)$");
    // @name = [linkage ...] global|constant <type> [<init>] [, align N]
    private static final Pattern GLOBAL_VAR_PATTERN =
        Pattern.compile("^@(" + NAME + ")\\s*=\\s*(?:[\\w()\\s]*?\\s)?(global|constant)\\s+(.+)$");
    private static final Pattern FUNCTION_HEADER_PATTERN =
        Pattern.compile("^(declare|define)\\b(.*?)@(" + NAME + ")\\s*\\((.*)$");
    private static final Pattern ATTRIBUTE_GROUP_PATTERN =
        Pattern.compile("^attributes\\s+#(\\d+)\\s*=\\s*\\{(.*)\\}$");
    private static final Pattern ATTRIBUTE_ENTRY_PATTERN =
        Pattern.compile("\"([^\"]*)\"(?:\\s*=\\s*\"([^\"]*)\")?|#(\\d+)|([A-Za-z_]\\w*)(?:\\(([^)]*)\\))?");
    private static final Pattern LABEL_PATTERN = Pattern.compile("^(" + NAME + "):$");
    private static final Pattern RESULT_PATTERN = Pattern.compile("^%(" + NAME + ")\\s*=\\s*(.+)$");
    private static final Pattern METADATA_ATTACHMENT_PATTERN =
        Pattern.compile(",\\s*![\\w.]+\\s+!(?:\\d+|\\{[^}]*\\})");
    private static final Pattern GLOBAL_TRAILER_PATTERN =
        Pattern.compile(",\\s*(?:align\\s+\\d+|section\\s+\"[^\"]*\"|comdat(?:\\([^)]*\\))?)");
    private static final Pattern INTEGER_TYPE_PATTERN = Pattern.compile("i(\\d+)");

    // 出现在值位置上的关键字, 跳过参数属性时遇到它们就停下
    private static final Set<String> VALUE_KEYWORDS = Set.of(
        "true", "false", "null", "undef", "poison", "zeroinitializer", "none",
        "trunc", "zext", "sext", "bitcast", "inttoptr", "ptrtoint", "addrspacecast", "getelementptr");
    private static final Set<String> CALL_PREFIXES = Set.of("tail", "musttail", "notail");
    private static final Set<String> CAST_MNEMONICS = Set.of(
        "trunc", "zext", "sext", "fptrunc", "fpext", "fptoui", "fptosi", "uitofp", "sitofp",
        "ptrtoint", "inttoptr", "bitcast", "addrspacecast");
    private static final Set<String> FLAG_WORDS = Set.of(
        "nuw", "nsw", "exact", "disjoint", "fast", "nnan", "ninf", "nsz", "arcp", "contract", "afn", "reassoc");

    private final LoaderConfig config;
    private final List<LLVMParseException.ParseError> errors;
    private final Map<String, Value> localValues;       // 当前函数内 %name -> Value
    private final Map<String, ForwardRef> forwardRefs;  // 尚未定义的 %name
    private final Map<String, Map<String, String>> attributeGroups;
    private final Map<Function, List<String>> attributeRefs;

    private QIRModule module;
    private Builder builder;
    private Function currentFunction;
    private BasicBlock currentBlock;
    private boolean inBody;
    private int currentLineNumber;

    private record LogicalLine(int number, String text) {}

    public QIRParser(LoaderConfig config) {
        this.config = config;
        this.errors = new ArrayList<>();
        this.localValues = new HashMap<>();
        this.forwardRefs = new LinkedHashMap<>();
        this.attributeGroups = new HashMap<>();
        this.attributeRefs = new LinkedHashMap<>();
    }

    /**
     * 解析 .ll 文本行
     *
     * @param lines 原始文本行
     * @param moduleName 模块名称
     * @return 解析得到的模块
     * @throws LLVMParseException STRICT 模式下的第一个错误, 或 COLLECT 模式下的全部错误
     */
    public QIRModule parse(List<String> lines, String moduleName) throws LLVMParseException {
        this.module = new QIRModule(moduleName);
        this.builder = new Builder(module);
        List<LogicalLine> logicalLines = preprocess(lines);

        // 第一阶段：类型, 全局变量, 函数签名, 基本块
        firstPass(logicalLines);
        applyAttributeGroups();

        // 第二阶段：指令
        secondPass(logicalLines);

        if (!errors.isEmpty()) {
            if (config.getErrorHandling() != LoaderConfig.ErrorHandling.LENIENT) {
                throw new LLVMParseException("Parse failed with errors", errors);
            }
            logger.warn("skipped {} malformed line(s) in {}", errors.size(), moduleName);
        }
        return module;
    }

    /* ---------------------------------------------------------------- */
    /* 预处理                                                            */
    /* ---------------------------------------------------------------- */

    /**
     * Strips comments and debug attachments and joins lines whose brackets
     * are still open (multi-line {@code switch} tables and the like).
     */
    private static List<LogicalLine> preprocess(List<String> lines) {
        List<LogicalLine> result = new ArrayList<>();
        StringBuilder pending = null;
        int pendingStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            String text = stripComment(lines.get(i)).trim();
            if (text.isEmpty()) {
                continue;
            }
            if (pending == null) {
                pending = new StringBuilder(text);
                pendingStart = i + 1;
            } else {
                pending.append(' ').append(text);
            }
            if (bracketDepth(pending) <= 0) {
                result.add(new LogicalLine(pendingStart, stripMetadata(pending.toString())));
                pending = null;
            }
        }
        if (pending != null) {
            result.add(new LogicalLine(pendingStart, stripMetadata(pending.toString())));
        }
        return result;
    }

    private static String stripComment(String line) {
        boolean inQuote = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                inQuote = !inQuote;
            } else if (ch == ';' && !inQuote) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static int bracketDepth(CharSequence text) {
        int depth = 0;
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '"') {
                inQuote = !inQuote;
            } else if (!inQuote && (ch == '[' || ch == '(')) {
                depth++;
            } else if (!inQuote && (ch == ']' || ch == ')')) {
                depth--;
            }
        }
        return depth;
    }

    private static String stripMetadata(String line) {
        return METADATA_ATTACHMENT_PATTERN.matcher(line).replaceAll("");
    }

    private static boolean isIgnoredTopLevel(String line) {
        return line.startsWith("target ") || line.startsWith("!") || line.startsWith("$")
            || line.startsWith("module asm") || line.startsWith("uselistorder");
    }

    /* ---------------------------------------------------------------- */
    /* 第一阶段                                                          */
    /* ---------------------------------------------------------------- */

    private void firstPass(List<LogicalLine> lines) throws LLVMParseException {
        inBody = false;
        currentFunction = null;
        for (LogicalLine line : lines) {
            currentLineNumber = line.number();
            try {
                parseLineFirstPass(line.text());
            } catch (RuntimeException e) {
                handleError(new LLVMParseException.ParseError(currentLineNumber, line.text(), e.getMessage()));
            }
        }
    }

    private void parseLineFirstPass(String line) {
        if (inBody) {
            if (line.equals("}")) {
                inBody = false;
                currentFunction = null;
                currentBlock = null;
                return;
            }
            if (currentFunction == null) {
                return; // 函数头解析失败, 跳过整个函数体
            }
            Matcher label = LABEL_PATTERN.matcher(line);
            if (label.matches()) {
                currentBlock = currentFunction.appendBasicBlock(unquote(label.group(1)));
            } else if (currentBlock == null) {
                // 没有标签的入口块按 LLVM 的编号规则命名
                currentBlock = currentFunction.appendBasicBlock(String.valueOf(countNumberedArguments(currentFunction)));
            }
            return;
        }

        Matcher m;
        if ((m = SOURCE_FILENAME_PATTERN.matcher(line)).matches()) {
            module.setSourceFileName(m.group(1));
        } else if (isIgnoredTopLevel(line)) {
            return;
        } else if ((m = STRUCT_TYPE_PATTERN.matcher(line)).matches()) {
            parseStructDefinition(unquote(m.group(1)), m.group(2).trim());
        } else if ((m = GLOBAL_VAR_PATTERN.matcher(line)).matches()) {
            parseGlobalVariable(m);
        } else if ((m = ATTRIBUTE_GROUP_PATTERN.matcher(line)).matches()) {
            Map<String, String> group = new LinkedHashMap<>();
            parseAttributeEntries(m.group(2), group, new ArrayList<>(), true);
            attributeGroups.put(m.group(1), group);
        } else if ((m = FUNCTION_HEADER_PATTERN.matcher(line)).matches()) {
            boolean isDefine = m.group(1).equals("define");
            inBody = isDefine;
            currentFunction = null;
            currentBlock = null;
            Function fn = parseFunctionHeader(m);
            if (isDefine) {
                currentFunction = fn;
            }
        } else {
            throw new IllegalArgumentException("Unrecognized top-level entity");
        }
    }

    private static int countNumberedArguments(Function fn) {
        int count = 0;
        for (Argument arg : fn.getArguments()) {
            if (arg.getName().chars().allMatch(Character::isDigit)) {
                count++;
            }
        }
        return count;
    }

    private void parseStructDefinition(String name, String body) {
        StructType struct = module.getOrCreateStruct(name);
        if (body.equals("opaque")) {
            return;
        }
        Cursor c = new Cursor(body);
        boolean packed = c.eat('<');
        List<Type> elements = parseStructElements(c);
        if (packed) {
            c.expect('>');
        }
        struct.setBody(elements);
    }

    private void parseGlobalVariable(Matcher m) {
        String name = unquote(m.group(1));
        boolean isConst = m.group(2).equals("constant");
        Cursor c = new Cursor(m.group(3));
        Type valueType = parseType(c);
        String initializer = GLOBAL_TRAILER_PATTERN.matcher(c.rest()).replaceAll("").trim();
        GlobalVariable gv = module.addGlobal(name, valueType, initializer.isEmpty() ? null : initializer, isConst);
        logger.trace("global {}", gv.getReference());
    }

    private Function parseFunctionHeader(Matcher m) {
        boolean isDefine = m.group(1).equals("define");
        Type returnType = parseTypePrefix(m.group(2));
        String name = unquote(m.group(3));

        Cursor c = new Cursor(m.group(4));
        List<Type> paramTypes = new ArrayList<>();
        List<String> paramNames = new ArrayList<>();
        boolean varArg = parseParameters(c, paramTypes, paramNames);

        Function fn = module.addFunction(name, FunctionType.get(returnType, paramTypes, varArg));
        for (int i = 0; i < paramNames.size(); i++) {
            if (paramNames.get(i) != null) {
                fn.getParam(i).setName(paramNames.get(i));
            }
        }

        String trailer = c.rest().trim();
        if (isDefine && trailer.endsWith("{")) {
            trailer = trailer.substring(0, trailer.length() - 1);
        }
        Map<String, String> inline = new LinkedHashMap<>();
        List<String> refs = new ArrayList<>();
        parseAttributeEntries(trailer, inline, refs, false);
        inline.forEach(fn::addAttribute);
        if (!refs.isEmpty()) {
            attributeRefs.put(fn, refs);
        }
        return fn;
    }

    private boolean parseParameters(Cursor c, List<Type> types, List<String> names) {
        boolean varArg = false;
        if (c.eat(')')) {
            return false;
        }
        do {
            c.skipWs();
            if (c.startsWith("...")) {
                c.advance(3);
                varArg = true;
                break;
            }
            types.add(parseType(c));
            skipAttributes(c);
            c.skipWs();
            String paramName = null;
            if (c.peek() == '%') {
                c.advance(1);
                paramName = c.readName();
            }
            names.add(paramName);
        } while (c.eat(','));
        c.expect(')');
        return varArg;
    }

    /**
     * 解析属性列表. 带引号的键值对和 #N 引用总是收集;
     * 裸关键字 (nounwind 等) 只在属性组里收集.
     */
    private static void parseAttributeEntries(String text, Map<String, String> into,
                                              List<String> refs, boolean includeWords) {
        Matcher m = ATTRIBUTE_ENTRY_PATTERN.matcher(text);
        while (m.find()) {
            if (m.group(1) != null) {
                into.put(m.group(1), m.group(2) == null ? "" : m.group(2));
            } else if (m.group(3) != null) {
                refs.add(m.group(3));
            } else if (includeWords) {
                into.put(m.group(4), m.group(5) == null ? "" : m.group(5));
            }
        }
    }

    private void applyAttributeGroups() {
        for (Map.Entry<Function, List<String>> entry : attributeRefs.entrySet()) {
            Function fn = entry.getKey();
            for (String id : entry.getValue()) {
                Map<String, String> group = attributeGroups.get(id);
                if (group == null) {
                    logger.warn("@{} references undefined attribute group #{}", fn.getName(), id);
                    continue;
                }
                group.forEach(fn::addAttribute);
            }
        }
    }

    /* ---------------------------------------------------------------- */
    /* 第二阶段                                                          */
    /* ---------------------------------------------------------------- */

    private void secondPass(List<LogicalLine> lines) throws LLVMParseException {
        inBody = false;
        currentFunction = null;
        for (LogicalLine line : lines) {
            currentLineNumber = line.number();
            try {
                parseLineSecondPass(line.text());
            } catch (LLVMParseException e) {
                handleError(e.getErrors().isEmpty()
                            ? new LLVMParseException.ParseError(currentLineNumber, line.text(), e.getMessage())
                            : e.getErrors().get(0));
            } catch (RuntimeException e) {
                handleError(new LLVMParseException.ParseError(currentLineNumber, line.text(), e.getMessage()));
            }
        }
    }

    private void parseLineSecondPass(String line) throws LLVMParseException {
        if (!inBody) {
            Matcher m = FUNCTION_HEADER_PATTERN.matcher(line);
            if (m.matches() && m.group(1).equals("define")) {
                enterFunction(unquote(m.group(3)));
            }
            return;
        }

        if (line.equals("}")) {
            inBody = false;
            if (currentFunction != null) {
                resolveForwardReferences();
            }
            currentFunction = null;
            return;
        }
        if (currentFunction == null) {
            return;
        }

        Matcher label = LABEL_PATTERN.matcher(line);
        if (label.matches()) {
            String blockName = unquote(label.group(1));
            currentBlock = currentFunction.getBlockByName(blockName);
            if (currentBlock == null) {
                throw new IllegalArgumentException("Unknown block " + blockName);
            }
            builder.positionAtEnd(currentBlock);
            return;
        }
        if (currentBlock == null) {
            currentBlock = currentFunction.getEntryBlock();
            builder.positionAtEnd(currentBlock);
        }

        Matcher result = RESULT_PATTERN.matcher(line);
        if (result.matches()) {
            parseInstruction(unquote(result.group(1)), result.group(2), line);
        } else {
            parseInstruction("", line, line);
        }
    }

    private void enterFunction(String name) {
        inBody = true;
        currentBlock = null;
        localValues.clear();
        forwardRefs.clear();
        Function fn = module.getFunction(name);
        currentFunction = fn != null && !fn.isDeclaration() ? fn : null;
        if (currentFunction != null) {
            for (Argument arg : currentFunction.getArguments()) {
                localValues.put(arg.getName(), arg);
            }
        }
    }

    private void parseInstruction(String name, String body, String line) throws LLVMParseException {
        Cursor c = new Cursor(body);
        String mnemonic = c.readWord();
        if (CALL_PREFIXES.contains(mnemonic)) {
            mnemonic = c.readWord();
        }

        Value value = switch (mnemonic) {
            case "call" -> parseCall(c, name);
            case "icmp" -> parseICmp(c, name);
            case "br" -> {
                parseBranch(c);
                yield null;
            }
            case "ret" -> {
                parseReturn(c);
                yield null;
            }
            default -> {
                Opcode opcode = Opcode.fromIRName(mnemonic);
                if (opcode != null && opcode.isBinary()) {
                    yield parseBinary(c, opcode, name);
                }
                yield parseUnknownInstruction(mnemonic, c, name, body, line);
            }
        };

        if (!name.isEmpty() && value != null) {
            defineLocal(name, value);
        }
    }

    private Value parseBinary(Cursor c, Opcode opcode, String name) {
        skipFlags(c);
        Type type = parseType(c);
        Value lhs = parseValue(c, type);
        c.expect(',');
        Value rhs = parseValue(c, type);
        return builder.buildBinary(opcode, lhs, rhs, name);
    }

    private Value parseICmp(Cursor c, String name) {
        String predicate = c.readWord();
        Opcode opcode = Opcode.fromIRName("icmp " + predicate);
        if (opcode == null) {
            throw new IllegalArgumentException("Unknown icmp predicate " + predicate);
        }
        Type type = parseType(c);
        Value lhs = parseValue(c, type);
        c.expect(',');
        Value rhs = parseValue(c, type);
        return builder.buildICmp(opcode, lhs, rhs, name);
    }

    private void parseBranch(Cursor c) {
        if ("label".equals(c.peekWord())) {
            builder.buildBr(parseLabel(c));
            return;
        }
        Type condType = parseType(c);
        Value condition = parseValue(c, condType);
        c.expect(',');
        BasicBlock thenBlock = parseLabel(c);
        c.expect(',');
        BasicBlock elseBlock = parseLabel(c);
        builder.buildCondBr(condition, thenBlock, elseBlock);
    }

    private BasicBlock parseLabel(Cursor c) {
        c.expectWord("label");
        c.expect('%');
        String name = c.readName();
        BasicBlock block = currentFunction.getBlockByName(name);
        if (block == null) {
            throw new IllegalArgumentException("Branch to undefined label %" + name);
        }
        return block;
    }

    private void parseReturn(Cursor c) {
        if ("void".equals(c.peekWord())) {
            builder.buildRetVoid();
            return;
        }
        Type type = parseType(c);
        builder.buildRet(parseValue(c, type));
    }

    private Value parseCall(Cursor c, String name) {
        skipFlags(c);
        int at = c.indexOf('@');
        if (at < 0) {
            throw new IllegalArgumentException("Indirect calls are not supported");
        }
        Type written = parseTypePrefix(c.slice(at));
        if (written instanceof FunctionType fnType) {
            written = fnType.getReturnType();
        }
        c.seek(at + 1);
        String calleeName = c.readName();
        Function callee = module.getFunction(calleeName);
        if (callee == null) {
            throw new IllegalArgumentException("Call to undeclared function @" + calleeName);
        }
        if (!written.equals(callee.getFunctionType().getReturnType())) {
            throw new IllegalArgumentException("Call to @" + calleeName + " returns " + written
                                               + " but the function returns "
                                               + callee.getFunctionType().getReturnType());
        }

        c.expect('(');
        List<Value> args = new ArrayList<>();
        if (!c.eat(')')) {
            do {
                Type argType = parseType(c);
                skipAttributes(c);
                args.add(parseValue(c, argType));
            } while (c.eat(','));
            c.expect(')');
        }
        // 调用点后面的 #N 属性忽略
        return builder.buildCall(callee, args, name);
    }

    /**
     * 不认识的指令保留为 {@link GenericInst}; 有结果名时尽量推断结果类型,
     * 这样后续引用它的指令仍能解析.
     */
    private Value parseUnknownInstruction(String mnemonic, Cursor c, String name,
                                          String body, String line) throws LLVMParseException {
        if (!config.isAllowUnknownInstructions()) {
            throw LLVMParseException.unsupportedInstruction(mnemonic, currentLineNumber, line);
        }
        Type type = VoidType.getVoid();
        if (!name.isEmpty()) {
            if (mnemonic.equals("alloca")) {
                type = PointerType.get(parseType(c));
            } else if (mnemonic.equals("fcmp")) {
                type = IntegerType.getI1();
            } else if (CAST_MNEMONICS.contains(mnemonic) && body.contains(" to ")) {
                type = parseType(new Cursor(body.substring(body.lastIndexOf(" to ") + 4)));
            } else if (mnemonic.equals("load") || mnemonic.equals("phi") || mnemonic.equals("freeze")) {
                type = parseType(c);
            }
        }
        logger.debug("keeping unknown instruction '{}' as generic", mnemonic);
        return builder.insert(new GenericInst(mnemonic, type, name, body));
    }

    private void defineLocal(String name, Value value) {
        if (localValues.containsKey(name)) {
            throw new IllegalArgumentException("Redefinition of %" + name);
        }
        localValues.put(name, value);
    }

    private Value lookupLocal(String name, Type type) {
        Value value = localValues.get(name);
        if (value != null) {
            return value;
        }
        return forwardRefs.computeIfAbsent(name, n -> new ForwardRef(type, n));
    }

    private void resolveForwardReferences() throws LLVMParseException {
        if (forwardRefs.isEmpty()) {
            return;
        }
        for (BasicBlock block : currentFunction.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                for (int i = 0; i < inst.getNumOperands(); i++) {
                    if (inst.getOperand(i) instanceof ForwardRef ref) {
                        Value actual = localValues.get(ref.getName());
                        if (actual == null) {
                            throw LLVMParseException.referenceError(
                                "Use of undefined value %" + ref.getName() + " in @" + currentFunction.getName(),
                                currentLineNumber, "}");
                        }
                        inst.setOperand(i, actual);
                    }
                }
            }
        }
        forwardRefs.clear();
    }

    /* ---------------------------------------------------------------- */
    /* 类型                                                              */
    /* ---------------------------------------------------------------- */

    private Type parseType(Cursor c) {
        c.skipWs();
        Type type = parseBaseType(c);
        while (true) {
            c.skipWs();
            if ("addrspace".equals(c.peekWord())) {
                c.readWord();
                c.skipBalanced('(', ')');
            } else if (c.peek() == '*') {
                if (type.isVoid() || type.isLabel()) {
                    throw new IllegalArgumentException("Pointer to " + type + " is not a valid type");
                }
                c.advance(1);
                type = PointerType.get(type);
            } else if (c.peek() == '(') {
                type = parseFunctionType(c, type);
            } else {
                return type;
            }
        }
    }

    private Type parseBaseType(Cursor c) {
        char ch = c.peek();
        switch (ch) {
            case '%': {
                c.advance(1);
                return module.getOrCreateStruct(c.readName());
            }
            case '{':
                return StructType.literal(parseStructElements(c));
            case '<': {
                c.advance(1);
                c.skipWs();
                if (c.peek() == '{') {
                    List<Type> elements = parseStructElements(c);
                    c.expect('>');
                    return StructType.literal(elements);
                }
                long count = c.readNumber();
                c.expectWord("x");
                Type element = parseType(c);
                c.expect('>');
                return VectorType.get(element, (int) count);
            }
            case '[': {
                c.advance(1);
                long length = c.readNumber();
                c.expectWord("x");
                Type element = parseType(c);
                c.expect(']');
                return ArrayType.get(element, length);
            }
            default:
                break;
        }

        String word = c.readWord();
        switch (word) {
            case "void":
                return VoidType.getVoid();
            case "label":
                return LabelType.getLabel();
            case "ptr":
                return PointerType.getOpaque();
            case "half":
            case "float":
            case "double":
            case "x86_fp80":
            case "fp128":
            case "ppc_fp128":
                return FloatType.get(TypeKind.valueOf(word.toUpperCase()));
            default:
                Matcher m = INTEGER_TYPE_PATTERN.matcher(word);
                if (m.matches()) {
                    return IntegerType.get(Integer.parseInt(m.group(1)));
                }
                throw new IllegalArgumentException("Unknown type '" + word + "'");
        }
    }

    private List<Type> parseStructElements(Cursor c) {
        c.expect('{');
        List<Type> elements = new ArrayList<>();
        if (c.eat('}')) {
            return elements;
        }
        do {
            elements.add(parseType(c));
        } while (c.eat(','));
        c.expect('}');
        return elements;
    }

    private FunctionType parseFunctionType(Cursor c, Type returnType) {
        c.expect('(');
        List<Type> params = new ArrayList<>();
        boolean varArg = false;
        if (!c.eat(')')) {
            do {
                c.skipWs();
                if (c.startsWith("...")) {
                    c.advance(3);
                    varArg = true;
                    break;
                }
                params.add(parseType(c));
            } while (c.eat(','));
            c.expect(')');
        }
        return FunctionType.get(returnType, params, varArg);
    }

    /**
     * 从 "dso_local noundef i32" 之类的前缀中找出类型:
     * 取最左边一个能完整解析为类型 (后面只跟属性关键字) 的位置.
     */
    private Type parseTypePrefix(String text) {
        String[] tokens = text.trim().split("\\s+");
        for (int i = 0; i < tokens.length; i++) {
            String candidate = String.join(" ", Arrays.copyOfRange(tokens, i, tokens.length));
            if (candidate.isEmpty() || !startsLikeType(candidate)) {
                continue;
            }
            Cursor c = new Cursor(candidate);
            try {
                Type type = parseType(c);
                if (c.rest().trim().matches("[\\w\\s()#]*")) {
                    return type;
                }
            } catch (IllegalArgumentException e) {
                logger.trace("'{}' is not a type: {}", candidate, e.getMessage());
            }
        }
        throw new IllegalArgumentException("Cannot find a type in '" + text.trim() + "'");
    }

    private static boolean startsLikeType(String text) {
        char ch = text.charAt(0);
        if (ch == '%' || ch == '{' || ch == '<' || ch == '[') {
            return true;
        }
        String word = text.split("[\\s*(]", 2)[0];
        return switch (word) {
            case "void", "label", "ptr", "half", "float", "double", "x86_fp80", "fp128", "ppc_fp128" -> true;
            default -> INTEGER_TYPE_PATTERN.matcher(word).matches();
        };
    }

    /* ---------------------------------------------------------------- */
    /* 值                                                                */
    /* ---------------------------------------------------------------- */

    private Value parseValue(Cursor c, Type type) {
        c.skipWs();
        char ch = c.peek();
        if (ch == '%') {
            c.advance(1);
            return lookupLocal(c.readName(), type);
        }
        if (ch == '@') {
            c.advance(1);
            String name = c.readName();
            Value global = module.getGlobalVariable(name);
            if (global == null) {
                global = module.getFunction(name);
            }
            if (global == null) {
                throw new IllegalArgumentException("Use of undefined global @" + name);
            }
            return global;
        }
        if (ch == '-' || ch == '+' || Character.isDigit(ch)) {
            return parseNumber(c.readNumberToken(), type);
        }

        String word = c.readWord();
        switch (word) {
            case "true":
            case "false":
                if (type instanceof IntegerType it) {
                    long bit = word.equals("true") ? 1 : 0;
                    return it.isI1() ? ConstantInt.getBool(bit == 1) : new ConstantInt(it, bit);
                }
                throw new IllegalArgumentException("Boolean literal used as " + type);
            case "null":
                if (type instanceof PointerType pt) {
                    return new ConstantNull(pt);
                }
                throw new IllegalArgumentException("null used as " + type);
            case "getelementptr":
                return parseGepExpression(c, type);
            default:
                Opcode opcode = Opcode.fromIRName(word);
                if (opcode != null && CAST_MNEMONICS.contains(word)) {
                    return parseCastExpression(c, opcode);
                }
                throw new IllegalArgumentException("Unsupported value '" + word + "'");
        }
    }

    private static Value parseNumber(String text, Type type) {
        if (type instanceof IntegerType it) {
            return new ConstantInt(it, new BigInteger(text).longValue());
        }
        if (type instanceof FloatType ft) {
            double value;
            if (text.startsWith("0x") || text.startsWith("-0x")) {
                // LLVM 的十六进制浮点总是 double 的位模式
                boolean negative = text.startsWith("-");
                String hex = text.substring(negative ? 3 : 2);
                value = Double.longBitsToDouble(Long.parseUnsignedLong(hex, 16));
                if (negative) {
                    value = -value;
                }
            } else {
                value = Double.parseDouble(text);
            }
            return new ConstantFloat(ft, value);
        }
        throw new IllegalArgumentException("Numeric literal " + text + " used as " + type);
    }

    private ConstantExpr parseCastExpression(Cursor c, Opcode opcode) {
        c.expect('(');
        Type sourceType = parseType(c);
        Value source = parseValue(c, sourceType);
        c.expectWord("to");
        Type resultType = parseType(c);
        c.expect(')');
        return new ConstantExpr(opcode, resultType, List.of(source));
    }

    private ConstantExpr parseGepExpression(Cursor c, Type resultType) {
        if ("inbounds".equals(c.peekWord())) {
            c.readWord();
        }
        c.expect('(');
        Type sourceElementType = parseType(c);
        c.expect(',');
        List<Value> operands = new ArrayList<>();
        do {
            Type operandType = parseType(c);
            if ("inrange".equals(c.peekWord())) {
                c.readWord();
            }
            operands.add(parseValue(c, operandType));
        } while (c.eat(','));
        c.expect(')');
        return new ConstantExpr(Opcode.GETELEMENTPTR, resultType, sourceElementType, operands);
    }

    private static void skipFlags(Cursor c) {
        while (FLAG_WORDS.contains(c.peekWord())) {
            c.readWord();
        }
    }

    /* 跳过 noundef, nocapture, align 8, dereferenceable(8) 之类的参数属性 */
    private static void skipAttributes(Cursor c) {
        while (true) {
            String word = c.peekWord();
            if (word == null || VALUE_KEYWORDS.contains(word)) {
                return;
            }
            c.readWord();
            c.skipWs();
            if (c.peek() == '(') {
                c.skipBalanced('(', ')');
            } else if (Character.isDigit(c.peek())) {
                c.readNumber();
            }
        }
    }

    private static String unquote(String name) {
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }

    private void handleError(LLVMParseException.ParseError error) throws LLVMParseException {
        errors.add(error);
        if (config.isDebugMode()) {
            logger.debug("Parse error: {}", error);
        }
        if (config.getErrorHandling() == LoaderConfig.ErrorHandling.STRICT) {
            throw new LLVMParseException("Parse error", List.of(error));
        }
        if (errors.size() >= config.getMaxErrors()) {
            throw new LLVMParseException("Too many parse errors", errors);
        }
    }

    /**
     * Placeholder for a local used before its definition; replaced once the
     * enclosing function has been read.
     */
    private static final class ForwardRef extends Value {
        ForwardRef(Type type, String name) {
            super(type, name);
        }

        @Override
        public String toIR() {
            return "%" + getName();
        }
    }

    /** 字符游标 */
    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
            this.pos = 0;
        }

        void skipWs() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        char peek() {
            skipWs();
            return pos < text.length() ? text.charAt(pos) : '\0';
        }

        void advance(int n) {
            pos += n;
        }

        void seek(int position) {
            pos = position;
        }

        int indexOf(char ch) {
            return text.indexOf(ch, pos);
        }

        String slice(int end) {
            return text.substring(pos, end);
        }

        boolean startsWith(String s) {
            return text.startsWith(s, pos);
        }

        boolean eat(char ch) {
            if (peek() == ch) {
                pos++;
                return true;
            }
            return false;
        }

        void expect(char ch) {
            if (!eat(ch)) {
                throw new IllegalArgumentException("Expected '" + ch + "' at '" + rest() + "'");
            }
        }

        String peekWord() {
            skipWs();
            int end = pos;
            if (end < text.length() && (Character.isLetter(text.charAt(end)) || text.charAt(end) == '_')) {
                end++;
                while (end < text.length()
                       && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
                    end++;
                }
            }
            if (end == pos || (end < text.length() && text.charAt(end) == '"')) {
                return null; // c"..." 字符串常量不是关键字
            }
            return text.substring(pos, end);
        }

        String readWord() {
            String word = peekWord();
            if (word == null) {
                throw new IllegalArgumentException("Expected keyword at '" + rest() + "'");
            }
            pos += word.length();
            return word;
        }

        void expectWord(String expected) {
            String word = readWord();
            if (!word.equals(expected)) {
                throw new IllegalArgumentException("Expected '" + expected + "' but found '" + word + "'");
            }
        }

        long readNumber() {
            skipWs();
            int start = pos;
            if (pos < text.length() && text.charAt(pos) == '-') {
                pos++;
            }
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException("Expected number at '" + rest() + "'");
            }
            return Long.parseLong(text.substring(start, pos));
        }

        String readNumberToken() {
            skipWs();
            int start = pos;
            if (text.charAt(pos) == '-' || text.charAt(pos) == '+') {
                pos++;
            }
            boolean hex = text.startsWith("0x", pos);
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                char prev = text.charAt(pos - 1 < start ? start : pos - 1);
                if (Character.isLetterOrDigit(ch) || ch == '.') {
                    pos++;
                } else if ((ch == '+' || ch == '-') && !hex && (prev == 'e' || prev == 'E')) {
                    pos++;
                } else {
                    break;
                }
            }
            String token = text.substring(start, pos);
            return token.startsWith("+") ? token.substring(1) : token;
        }

        String readName() {
            if (pos < text.length() && text.charAt(pos) == '"') {
                int end = text.indexOf('"', pos + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("Unterminated quoted name");
                }
                String name = text.substring(pos + 1, end);
                pos = end + 1;
                return name;
            }
            int start = pos;
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == '$' || ch == '-') {
                    pos++;
                } else {
                    break;
                }
            }
            if (start == pos) {
                throw new IllegalArgumentException("Expected name at '" + rest() + "'");
            }
            return text.substring(start, pos);
        }

        void skipBalanced(char open, char close) {
            expect(open);
            int depth = 1;
            while (pos < text.length() && depth > 0) {
                char ch = text.charAt(pos++);
                if (ch == open) {
                    depth++;
                } else if (ch == close) {
                    depth--;
                }
            }
        }

        String rest() {
            return pos < text.length() ? text.substring(pos) : "";
        }
    }
}
