package com.afsun.procgraph.controller;

import com.afsun.procgraph.config.ProcGraphProperties;
import com.afsun.procgraph.core.exceptions.NodeNotFoundException;
import com.afsun.procgraph.graph.NodeType;
import com.afsun.procgraph.service.ProcedureGraphService;
import com.afsun.procgraph.vo.CrawlResult;
import com.afsun.procgraph.vo.FieldFlowAnalysis;
import com.afsun.procgraph.vo.FieldSource;
import com.afsun.procgraph.vo.FieldUsageEntry;
import com.afsun.procgraph.vo.FieldUsageSummary;
import com.afsun.procgraph.vo.ImpactResult;
import com.afsun.procgraph.vo.ProcedureContext;
import com.afsun.procgraph.vo.Response;
import com.afsun.procgraph.vo.TableInfo;
import com.afsun.procgraph.vo.TracePath;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.annotation.Resource;
import java.util.List;
import java.util.Set;

/**
 * 依赖查询API控制器
 * 过程上下文、调用方、字段使用、依赖爬取、影响分析与字段流追踪
 *
 * @author afsun
 */
@RestController
@RequestMapping("/procgraph/query")
@Slf4j
public class DependencyQueryController {

    @Resource
    private ProcedureGraphService procedureGraphService;

    @Resource
    private ProcGraphProperties properties;

    /**
     * 查询过程上下文
     *
     * @param name 过程名，可带模式前缀，大小写不敏感
     */
    @GetMapping("/procedure")
    public Response<ProcedureContext> procedure(@RequestParam String name) {
        ProcedureContext context = procedureGraphService.getProcedureContext(name)
                .orElseThrow(() -> new NodeNotFoundException(NodeType.PROCEDURE, name));
        return Response.success(context);
    }

    @GetMapping("/table")
    public Response<TableInfo> table(@RequestParam String name) {
        TableInfo info = procedureGraphService.getTableInfo(name)
                .orElseThrow(() -> new NodeNotFoundException(NodeType.TABLE, name));
        return Response.success(info);
    }

    @GetMapping("/callers")
    public Response<Set<String>> callers(@RequestParam String name) {
        return Response.success(procedureGraphService.getCallers(name));
    }

    /**
     * 查询字段使用情况
     *
     * @param field     字段名
     * @param procedure 限定过程，可为空
     */
    @GetMapping("/field/usage")
    public Response<List<FieldUsageEntry>> fieldUsage(@RequestParam String field,
                                                      @RequestParam(required = false) String procedure) {
        return Response.success(procedureGraphService.queryFieldUsage(field, procedure));
    }

    @GetMapping("/field/summary")
    public Response<FieldUsageSummary> fieldSummary(@RequestParam String field) {
        return Response.success(procedureGraphService.getFieldUsageSummary(field));
    }

    /**
     * 爬取过程依赖树
     *
     * @param name          根过程名
     * @param depth         爬取深度，缺省取配置值
     * @param includeTables 是否把访问的表作为叶子节点
     */
    @GetMapping("/crawl")
    public Response<CrawlResult> crawl(@RequestParam String name,
                                       @RequestParam(required = false) Integer depth,
                                       @RequestParam(defaultValue = "true") boolean includeTables) {
        int maxDepth = depth == null ? properties.getDefaultDepth() : depth;
        if (maxDepth < 0 || maxDepth > properties.getMaxDepth()) {
            return Response.fail(400, "爬取深度必须在0-" + properties.getMaxDepth() + "之间");
        }
        log.info("爬取过程依赖: {}, depth={}, includeTables={}", name, maxDepth, includeTables);
        return Response.success(procedureGraphService.crawlProcedure(name, maxDepth, includeTables));
    }

    /**
     * 修改过程的影响分析
     */
    @GetMapping("/impact")
    public Response<ImpactResult> impact(@RequestParam String name,
                                         @RequestParam(required = false) Integer depth) {
        int maxDepth = depth == null ? properties.getDefaultDepth() : depth;
        if (maxDepth < 0 || maxDepth > properties.getMaxDepth()) {
            return Response.fail(400, "分析深度必须在0-" + properties.getMaxDepth() + "之间");
        }
        log.info("过程影响分析: {}, depth={}", name, maxDepth);
        ImpactResult result = procedureGraphService.getProcedureImpact(name, maxDepth)
                .orElseThrow(() -> new NodeNotFoundException(NodeType.PROCEDURE, name));
        return Response.success(result);
    }

    @GetMapping("/field/sources")
    public Response<List<FieldSource>> fieldSources(@RequestParam String field,
                                                    @RequestParam(defaultValue = "10") int maxResults) {
        return Response.success(procedureGraphService.findFieldSources(field, maxResults));
    }

    @GetMapping("/field/destinations")
    public Response<List<FieldSource>> fieldDestinations(@RequestParam String field,
                                                         @RequestParam(defaultValue = "10") int maxResults) {
        return Response.success(procedureGraphService.findFieldDestinations(field, maxResults));
    }

    /**
     * 追踪字段在过程间的流转；给出起点时只沿被调用方向追踪
     */
    @GetMapping("/field/trace")
    public Response<TracePath> trace(@RequestParam String field,
                                     @RequestParam(required = false) String start,
                                     @RequestParam(required = false) Integer depth) {
        int maxDepth = depth == null ? properties.getTraceDepth() : depth;
        if (maxDepth < 0 || maxDepth > properties.getMaxDepth()) {
            return Response.fail(400, "追踪深度必须在0-" + properties.getMaxDepth() + "之间");
        }
        if (StringUtils.isBlank(start)) {
            return Response.success(procedureGraphService.traceFieldFlow(field, maxDepth));
        }
        TracePath path = procedureGraphService.traceField(field, start, maxDepth)
                .orElseThrow(() -> new NodeNotFoundException(NodeType.PROCEDURE, start));
        return Response.success(path);
    }

    @GetMapping("/field/flow")
    public Response<FieldFlowAnalysis> flow(@RequestParam String field,
                                            @RequestParam(required = false) String start) {
        return Response.success(procedureGraphService.analyzeFieldFlow(field, start));
    }
}
