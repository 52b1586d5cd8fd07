package com.afsun.procgraph.core.meta;

import com.afsun.procgraph.core.exceptions.SourceLoadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 从目录递归读取过程源码文件，文件名（去掉扩展名）即过程名
 *
 * @author afsun
 */
@Slf4j
public class FileProcedureSourceLoader implements ProcedureSourceLoader {

    public static final String DEFAULT_EXTENSION = "prc";

    private final String extension;

    public FileProcedureSourceLoader() {
        this(DEFAULT_EXTENSION);
    }

    public FileProcedureSourceLoader(String extension) {
        Validate.isTrue(StringUtils.isNotBlank(extension), "file extension must not be blank");
        this.extension = StringUtils.removeStart(extension.trim(), ".").toLowerCase(Locale.ROOT);
    }

    /**
     * @throws SourceLoadException 目录不存在、不是目录、没有匹配文件或文件读取失败
     */
    @Override
    public Map<String, String> loadProcedures(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            throw new SourceLoadException("目录不存在", directory);
        }
        if (!Files.isDirectory(directory)) {
            throw new SourceLoadException("路径不是目录", directory);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith("." + extension))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new SourceLoadException("遍历目录失败", directory, e);
        }

        Map<String, String> procedures = new LinkedHashMap<>();
        for (Path file : files) {
            String content = read(file).trim();
            if (content.isEmpty()) {
                log.warn("忽略空文件: {}", file.getFileName());
                continue;
            }
            procedures.put(procedureName(file), content);
            log.debug("已加载: {}", file.getFileName());
        }
        if (procedures.isEmpty()) {
            throw new SourceLoadException("目录中没有 ." + extension + " 文件", directory);
        }
        log.info("共加载 {} 个存储过程, 目录: {}", procedures.size(), directory);
        return procedures;
    }

    /**
     * 文件名去掉扩展名并转为大写，SCHEMA.NAME.prc 保留模式前缀
     */
    static String procedureName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return (dot > 0 ? fileName.substring(0, dot) : fileName).toUpperCase(Locale.ROOT);
    }

    private static String read(Path file) {
        try {
            return String.join("\n", Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (MalformedInputException e) {
            throw new SourceLoadException("文件编码错误", file, e);
        } catch (IOException e) {
            throw new SourceLoadException("读取文件失败", file, e);
        }
    }
}
