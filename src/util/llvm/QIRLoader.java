package util.llvm;

import ir.QIRModule;
import util.logging.LogManager;
import util.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * QIR 加载器工具类
 *
 * 将 .ll 文件 (或字符串) 解析为 {@link QIRModule}
 */
public class QIRLoader {
    private static final Logger logger = LogManager.getLogger(QIRLoader.class);

    private QIRLoader() {
    }

    /**
     * 从文件路径加载单个 .ll 文件
     *
     * @param path .ll 文件路径
     * @return 解析后的模块
     * @throws IOException 文件读取错误
     * @throws LLVMParseException 解析错误
     */
    public static QIRModule loadFromFile(Path path) throws IOException, LLVMParseException {
        return loadFromFile(path, LoaderConfig.defaultConfig());
    }

    public static QIRModule loadFromFile(Path path, LoaderConfig config) throws IOException, LLVMParseException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        return parseLines(lines, extractModuleName(path.getFileName().toString()), config);
    }

    /**
     * 从 classpath 资源加载 .ll 文件
     *
     * @param resourcePath 资源路径，例如 "qir/bell.ll"
     */
    public static QIRModule loadFromResource(String resourcePath) throws IOException, LLVMParseException {
        return loadFromResource(resourcePath, LoaderConfig.defaultConfig());
    }

    public static QIRModule loadFromResource(String resourcePath, LoaderConfig config)
            throws IOException, LLVMParseException {
        try (InputStream inputStream = QIRLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                List<String> lines = reader.lines().collect(Collectors.toList());
                String fileName = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
                return parseLines(lines, extractModuleName(fileName), config);
            }
        }
    }

    /**
     * 从字符串内容解析 QIR
     *
     * @param content .ll 文本
     * @param moduleName 模块名称
     */
    public static QIRModule parseFromString(String content, String moduleName) throws LLVMParseException {
        return parseFromString(content, moduleName, LoaderConfig.defaultConfig());
    }

    public static QIRModule parseFromString(String content, String moduleName, LoaderConfig config)
            throws LLVMParseException {
        return parseLines(Arrays.asList(content.split("\\R", -1)), moduleName, config);
    }

    private static QIRModule parseLines(List<String> lines, String moduleName, LoaderConfig config)
            throws LLVMParseException {
        QIRModule module = new QIRParser(config).parse(lines, moduleName);
        logger.info("loaded module {}: {} functions, {} struct types",
                    moduleName, module.getFunctions().size(), module.getStructTypes().size());
        return module;
    }

    private static String extractModuleName(String fileName) {
        if (fileName.endsWith(".ll")) {
            return fileName.substring(0, fileName.length() - 3);
        }
        return fileName;
    }
}
