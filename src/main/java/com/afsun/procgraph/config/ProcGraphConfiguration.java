package com.afsun.procgraph.config;

import com.afsun.procgraph.core.DefaultSourceAnalyzer;
import com.afsun.procgraph.core.SourceAnalyzer;
import com.afsun.procgraph.core.meta.FileProcedureSourceLoader;
import com.afsun.procgraph.core.meta.ProcedureSourceLoader;
import com.afsun.procgraph.crawler.DependencyCrawler;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.afsun.procgraph.graph.snapshot.GraphSnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 核心组件装配
 * 分析器、图谱与爬取器本身不依赖 Spring，这里统一注册为单例 Bean
 *
 * @author afsun
 */
@Configuration
public class ProcGraphConfiguration {

    @Bean
    public KnowledgeGraph knowledgeGraph() {
        return new KnowledgeGraph();
    }

    @Bean
    public SourceAnalyzer sourceAnalyzer() {
        return new DefaultSourceAnalyzer();
    }

    @Bean
    public DependencyCrawler dependencyCrawler(KnowledgeGraph knowledgeGraph, ProcGraphProperties properties) {
        return new DependencyCrawler(knowledgeGraph, properties.getTraceDepth());
    }

    @Bean
    public GraphSnapshotStore graphSnapshotStore(ObjectMapper objectMapper) {
        return new GraphSnapshotStore(objectMapper);
    }

    @Bean
    public ProcedureSourceLoader procedureSourceLoader(ProcGraphProperties properties) {
        return new FileProcedureSourceLoader(properties.getSourceExtension());
    }
}
