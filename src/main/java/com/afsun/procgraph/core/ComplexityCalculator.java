package com.afsun.procgraph.core;

/**
 * 存储过程复杂度评分
 * <p>
 * score = 1 + min(行数/50, 3)
 * + 0.5 * (IF + ELSIF/ELSE + CASE)
 * + 0.7 * 循环
 * + 0.8 * 游标
 * + 0.3 * 异常处理
 * + 0.5 * 嵌套块
 * + 0.5 * (最大嵌套深度 - 1)
 * <p>
 * 向下取整并限制在 1..10
 *
 * @author afsun
 */
public final class ComplexityCalculator {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    private static final int LINES_PER_POINT = 50;
    private static final double MAX_LENGTH_POINTS = 3.0;

    private ComplexityCalculator() {
    }

    public static int score(ControlStructureTally tally, int lineCount) {
        double score = MIN_SCORE;
        score += Math.min((double) Math.max(lineCount, 0) / LINES_PER_POINT, MAX_LENGTH_POINTS);
        if (tally != null) {
            score += 0.5 * (tally.getConditionals() + tally.getBranches() + tally.getCaseBlocks());
            score += 0.7 * tally.getLoops();
            score += 0.8 * tally.getCursors();
            score += 0.3 * tally.getExceptionHandlers();
            score += 0.5 * tally.getNestedBlocks();
            score += 0.5 * Math.max(0, tally.getMaxNestingDepth() - 1);
        }
        return clamp((int) Math.floor(score));
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static int countLines(String source) {
        if (source == null || source.trim().isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (String line : source.split("\r?\n")) {
            if (!line.trim().isEmpty()) {
                lines++;
            }
        }
        return lines;
    }
}
