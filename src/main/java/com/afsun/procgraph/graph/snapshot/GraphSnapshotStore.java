package com.afsun.procgraph.graph.snapshot;

import com.afsun.procgraph.core.exceptions.SnapshotException;
import com.afsun.procgraph.graph.KnowledgeGraph;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 快照文件读写（JSON）
 * 读取失败或版本不一致只返回空，由调用方重新构建图谱
 *
 * @author afsun
 */
@Slf4j
public class GraphSnapshotStore {

    private final ObjectMapper objectMapper;

    public GraphSnapshotStore() {
        this(new ObjectMapper());
    }

    public GraphSnapshotStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 写入快照，先写临时文件再替换，避免留下半个文件
     *
     * @throws SnapshotException 写入失败
     */
    public void save(KnowledgeGraph graph, Path path) {
        GraphSnapshot snapshot = graph.toSnapshot();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            log.info("图谱快照已保存: {}, 过程={}, 表={}, 边={}", path, snapshot.getProcedures().size(),
                    snapshot.getTables().size(), snapshot.getEdges().size());
        } catch (IOException e) {
            throw new SnapshotException("写入图谱快照失败", path, e);
        }
    }

    public Optional<GraphSnapshot> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("快照文件不存在: {}", path);
            return Optional.empty();
        }
        try {
            GraphSnapshot snapshot = objectMapper.readValue(path.toFile(), GraphSnapshot.class);
            if (!GraphSnapshot.CURRENT_VERSION.equals(snapshot.getVersion())) {
                log.warn("快照版本不一致，忽略快照: {}, 文件版本={}, 当前版本={}", path, snapshot.getVersion(),
                        GraphSnapshot.CURRENT_VERSION);
                return Optional.empty();
            }
            return Optional.of(snapshot);
        } catch (IOException e) {
            log.warn("快照文件无法读取，忽略快照: {}, 原因: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 加载快照并替换图谱内容
     *
     * @return 是否成功加载
     */
    public boolean loadInto(KnowledgeGraph graph, Path path) {
        Optional<GraphSnapshot> snapshot = load(path);
        snapshot.ifPresent(graph::restore);
        return snapshot.isPresent();
    }
}
