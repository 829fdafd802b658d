package com.cartographer.crawler;

import com.cartographer.config.CrawlProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 导航图检查点存储
 *
 * 每个会话一个固定文件，每次检查点整体覆盖写 (先写临时文件再原子替换)，
 * 进程中途被杀时磁盘上始终是上一个完整检查点。
 *
 * 存储结构：
 * ~/.cartographer/
 *   └── app_map_progress_v3.json   { "HomeScreen": {...}, "SettingsScreen": {...} }
 */
@Slf4j
@Component
public class GraphStore {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path mapFile;

    @Autowired
    public GraphStore(CrawlProperties crawlProperties) {
        this(Paths.get(crawlProperties.getSessionDir()).resolve(crawlProperties.getMapFileName()));
    }

    public GraphStore(Path mapFile) {
        this.mapFile = mapFile;
    }

    public Path getMapFile() {
        return mapFile;
    }

    /**
     * 写入检查点。失败只记录日志，不抛异常
     *
     * @return 是否写入成功
     */
    public boolean save(NavigationGraph graph) {
        Path tmp = mapFile.resolveSibling(mapFile.getFileName() + ".tmp");
        try {
            Path dir = mapFile.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Files.writeString(tmp, toJson(graph), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, mapFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, mapFile, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("💾 检查点已保存: {} ({} 个屏幕)", mapFile, graph.size());
            return true;
        } catch (IOException | UncheckedIOException e) {
            log.error("❌ 检查点保存失败: {}", mapFile, e);
            return false;
        }
    }

    /**
     * 读取最近一次检查点
     */
    public Optional<NavigationGraph> load() {
        if (!Files.exists(mapFile)) {
            log.warn("导航图文件不存在: {}", mapFile);
            return Optional.empty();
        }
        try {
            return Optional.of(fromJson(Files.readString(mapFile, StandardCharsets.UTF_8)));
        } catch (IOException | UncheckedIOException e) {
            log.error("读取导航图失败: {}", mapFile, e);
            return Optional.empty();
        }
    }

    public String toJson(NavigationGraph graph) {
        try {
            return mapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public NavigationGraph fromJson(String json) {
        try {
            NavigationGraph graph = mapper.readValue(json, NavigationGraph.class);
            return graph != null ? graph : new NavigationGraph();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
