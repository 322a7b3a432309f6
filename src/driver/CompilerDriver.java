package driver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import util.logging.Logger;
import util.logging.LogManager;

import exception.CompileException;
import ir.QIRModule;
import translate.QasmExporter;
import translate.profile.BaseProfile;
import util.llvm.LLVMParseException;
import util.llvm.LoaderConfig;
import util.llvm.QIRLoader;

public class CompilerDriver {
    private static CompilerDriver compilerDriver = new CompilerDriver();
    private static String source = null;
    private static String target = null;
    // include 指令, 按命令行顺序输出
    private static final List<String> includes = new ArrayList<>();
    private static final Logger logger = LogManager.getLogger(CompilerDriver.class);

    private CompilerDriver() {
    }

    public static CompilerDriver getInstance() {
        return compilerDriver;
    }

    /*
     * parse the args based on the input
     * Compiler [-o out.qasm] [-I file]... in.ll
     */
    public void parseArgs(String[] args) throws CompileException {
        if (args == null || args.length == 0) {
            throw CompileException.noArgs();
        }
        source = null;
        target = null;
        includes.clear();

        var cmds = Arrays.asList(args);
        var iter = cmds.iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw CompileException
                                .wrongArgs("Need arg after -o but got nothing");
                    }
                }
                case "-I", "--include" -> {
                    if (iter.hasNext()) {
                        includes.add(iter.next());
                    } else {
                        throw CompileException
                                .wrongArgs("Need arg after " + cmd + " but got nothing");
                    }
                }
                default -> {
                    if (cmd.endsWith(".ll") && source == null) {
                        source = cmd;
                    } else {
                        throw CompileException.wrongArgs(cmd);
                    }
                }
            }
        }
        if (source == null) {
            throw CompileException.noArgs();
        }
    }

    /*
     * real driver
     * load the module, translate it, write the program to -o or stdout
     * @return the OpenQASM text
     */
    public String run() {
        QIRModule module = loadIR(Path.of(source));

        String qasm;
        try {
            qasm = new QasmExporter(includes, new BaseProfile()).dumps(module);
        } catch (CompileException e) {
            logger.error("translation of " + source + " failed", e);
            throw e;
        }

        if (target == null) {
            System.out.print(qasm);
        } else {
            try {
                Files.writeString(Path.of(target), qasm, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuntimeException("failed to write " + target, e);
            }
            logger.info("wrote " + target);
        }
        return qasm;
    }

    private QIRModule loadIR(Path llPath) {
        try {
            LoaderConfig cfg = LoaderConfig
                    .defaultConfig()
                    .setErrorHandling(LoaderConfig.ErrorHandling.STRICT);
            return QIRLoader.loadFromFile(llPath, cfg);
        } catch (IOException e) {
            throw new RuntimeException("failed to read .ll", e);
        } catch (LLVMParseException e) {
            logger.error("failed to parse " + llPath, e);
            throw new RuntimeException("failed to parse LLVM IR: " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public List<String> getIncludes() {
        return List.copyOf(includes);
    }
}
