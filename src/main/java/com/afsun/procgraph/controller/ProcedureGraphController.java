package com.afsun.procgraph.controller;

import com.afsun.procgraph.core.AnalysisResult;
import com.afsun.procgraph.core.dto.FieldFacts;
import com.afsun.procgraph.core.dto.ProcedureFacts;
import com.afsun.procgraph.core.dto.TableFacts;
import com.afsun.procgraph.service.ProcedureGraphService;
import com.afsun.procgraph.vo.AnalyzeRequest;
import com.afsun.procgraph.vo.GraphStatistics;
import com.afsun.procgraph.vo.IndexingReport;
import com.afsun.procgraph.vo.ProcedureContext;
import com.afsun.procgraph.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.annotation.Resource;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * 图谱构建API控制器
 * 源码分析、注册、目录索引与快照管理
 *
 * @author afsun
 */
@RestController
@RequestMapping("/procgraph")
@Slf4j
public class ProcedureGraphController {

    @Resource
    private ProcedureGraphService procedureGraphService;

    /**
     * 仅分析源码，不写入图谱
     */
    @PostMapping("/analyze")
    public Response<AnalysisResult> analyze(@RequestBody AnalyzeRequest request) {
        if (StringUtils.isBlank(request.getSourceText())) {
            return Response.fail(400, "源码不能为空");
        }
        return Response.success(procedureGraphService.analyze(request.getSourceText(), request.getProcedureName()));
    }

    /**
     * 分析源码并注册到图谱
     */
    @PostMapping("/register")
    public Response<ProcedureContext> register(@RequestBody AnalyzeRequest request) {
        if (StringUtils.isBlank(request.getSourceText())) {
            return Response.fail(400, "源码不能为空");
        }
        log.info("分析并注册存储过程: {}", request.getProcedureName());
        return Response.success(procedureGraphService.analyzeAndRegister(request.getProcedureName(),
                request.getSourceText()));
    }

    @PostMapping("/procedures")
    public Response<String> registerProcedure(@RequestBody ProcedureFacts facts) {
        return Response.success(procedureGraphService.registerProcedure(facts));
    }

    @PostMapping("/tables")
    public Response<String> registerTable(@RequestBody TableFacts facts) {
        return Response.success(procedureGraphService.registerTable(facts));
    }

    @PostMapping("/fields")
    public Response<String> registerField(@RequestBody FieldFacts facts) {
        return Response.success(procedureGraphService.registerField(facts));
    }

    /**
     * 批量索引服务端目录中的源码文件
     *
     * @param directory 源码目录
     */
    @PostMapping("/index")
    public Response<IndexingReport> indexDirectory(@RequestParam String directory) {
        if (StringUtils.isBlank(directory)) {
            return Response.fail(400, "目录不能为空");
        }
        log.info("索引源码目录: {}", directory);
        return Response.success(procedureGraphService.indexDirectory(Paths.get(directory)));
    }

    @PostMapping("/snapshot/save")
    public Response<Boolean> saveSnapshot() {
        return Response.success(procedureGraphService.saveSnapshot());
    }

    @PostMapping("/snapshot/load")
    public Response<Boolean> loadSnapshot() {
        return Response.success(procedureGraphService.loadSnapshot());
    }

    @GetMapping("/procedures")
    public Response<List<String>> listProcedures() {
        return Response.success(procedureGraphService.listProcedures());
    }

    /**
     * 按依赖层级分组的过程清单
     */
    @GetMapping("/hierarchy")
    public Response<Map<Integer, List<String>>> hierarchy() {
        return Response.success(procedureGraphService.getProcedureHierarchy());
    }

    @GetMapping("/statistics")
    public Response<GraphStatistics> statistics() {
        return Response.success(procedureGraphService.getStatistics());
    }
}
