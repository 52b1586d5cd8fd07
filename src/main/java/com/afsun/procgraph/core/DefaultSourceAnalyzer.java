package com.afsun.procgraph.core;

import com.afsun.procgraph.core.util.SqlDialectDetector;
import com.afsun.procgraph.core.util.SqlIdentifiers;
import com.afsun.procgraph.core.util.SqlScriptUtils;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.Set;

/**
 * 基于词法规则的存储过程分析器
 * 不做完整语法解析：某条语句无法识别时只是不产生事实，不会中断整体分析
 *
 * @author afsun
 */
@Slf4j
public class DefaultSourceAnalyzer implements SourceAnalyzer {

    private final RoutineHeaderParser headerParser = new RoutineHeaderParser();
    private final DeclarationExtractor declarationExtractor = new DeclarationExtractor();
    private final ReferenceExtractor referenceExtractor = new ReferenceExtractor();
    private final FieldUsageExtractor fieldUsageExtractor = new FieldUsageExtractor();
    private final ControlStructureCounter controlStructureCounter = new ControlStructureCounter();

    @Override
    public AnalysisResult analyze(String sourceText, String procedureName) {
        AnalysisResult result = AnalysisResult.empty(procedureName);
        if (StringUtils.isBlank(sourceText)) {
            log.debug("过程源码为空, procedure={}", procedureName);
            return result;
        }
        long startTime = System.currentTimeMillis();

        // 1. 检测方言
        DbType dialect = SqlDialectDetector.detect(sourceText);
        result.setDialect(dialect);

        // 2. 移除注释并屏蔽字符串字面量
        String cleaned = SqlScriptUtils.stripComments(sourceText, SqlDialectDetector.supportsHashComments(dialect));
        String masked = SqlScriptUtils.maskStringLiterals(cleaned);

        // 3. 过程头：名称与参数，随后把头部清空，避免过程名被当成调用
        RoutineHeaderParser.RoutineHeader header = null;
        try {
            header = headerParser.parse(masked);
        } catch (RuntimeException e) {
            log.debug("过程头解析失败, procedure={}: {}", procedureName, e.getMessage());
        }
        String body = masked;
        int headerEnd = 0;
        if (header != null) {
            result.setDeclaredSchema(header.getSchema());
            result.setDeclaredName(header.getName());
            result.getParameters().addAll(header.getParameters());
            body = blank(masked, header.getStart(), header.getEnd());
            headerEnd = header.getEnd();
        }

        // 4. 变量声明
        final String routineBody = body;
        final int declarationStart = headerEnd;
        runStep("variables", procedureName, () ->
                result.getVariables().addAll(declarationExtractor.extract(routineBody, declarationStart, dialect)));

        Set<String> declared = new HashSet<>(result.getVariables());
        result.getParameters().forEach(p -> declared.add(p.getName()));

        // 5. 过程调用与表引用
        runStep("procedures", procedureName, () ->
                result.getProcedures().addAll(referenceExtractor.extractCalls(routineBody, declared)));
        runStep("tables", procedureName, () ->
                result.getTables().addAll(referenceExtractor.extractTables(routineBody, declared)));

        // 6. 字段使用
        Set<String> notFields = new HashSet<>(declared);
        for (String table : result.getTables()) {
            notFields.add(table);
            notFields.add(SqlIdentifiers.bareName(table));
        }
        runStep("fields", procedureName, () ->
                fieldUsageExtractor.extract(routineBody, procedureName, notFields, result.getFields()));

        // 7. 控制结构与复杂度
        runStep("control structures", procedureName, () ->
                result.setControlStructures(controlStructureCounter.count(routineBody, dialect)));
        result.setComplexityScore(ComplexityCalculator.score(result.getControlStructures(),
                ComplexityCalculator.countLines(cleaned)));

        log.debug("过程分析完成, procedure={}, dialect={}, procedures={}, tables={}, fields={}, 耗时={}ms",
                procedureName, dialect, result.getProcedures().size(), result.getTables().size(),
                result.getFields().size(), System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * 单个提取步骤失败只影响该步骤的结果
     */
    private void runStep(String step, String procedureName, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.debug("提取{}失败，保留已得到的部分结果, procedure={}: {}", step, procedureName, e.getMessage());
        }
    }

    private static String blank(String text, int start, int end) {
        StringBuilder sb = new StringBuilder(text);
        int to = Math.min(end, text.length());
        for (int i = Math.max(0, start); i < to; i++) {
            if (sb.charAt(i) != '\n') {
                sb.setCharAt(i, ' ');
            }
        }
        return sb.toString();
    }
}
