package com.nightscan.core.progress;

import com.nightscan.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 模块说明：JsonFileProgressStore（class）。
 * 主要职责：把进度文档以 JSON 写入固定路径（先写临时文件再原子替换），终态文档归档到 history 目录。
 * 使用建议：写入失败抛出 ProgressPersistenceException，由调用方按结构性失败处理。
 */
public final class JsonFileProgressStore implements ProgressStore {
    private static final Logger LOG = LogManager.getLogger(JsonFileProgressStore.class);
    static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String ARCHIVE_PREFIX = "run_";

    private final Path progressPath;
    private final Path historyDir;

    public JsonFileProgressStore(Config config) {
        this(config.getPath("progress.path"), config.getPath("progress.history_dir"));
    }

    public JsonFileProgressStore(Path progressPath, Path historyDir) {
        this.progressPath = progressPath.toAbsolutePath().normalize();
        this.historyDir = historyDir.toAbsolutePath().normalize();
    }

    public Path progressPath() {
        return progressPath;
    }

    public Path historyDir() {
        return historyDir;
    }

    @Override
    public void write(JSONObject document) {
        try {
            writeAtomically(progressPath, document.toString(2));
        } catch (IOException e) {
            throw new ProgressPersistenceException("failed to write progress document " + progressPath, e);
        }
    }

    @Override
    public void archive(JSONObject document, LocalDateTime startTime) {
        Path target = historyDir.resolve(ARCHIVE_PREFIX + ARCHIVE_STAMP.format(startTime) + ".json");
        try {
            writeAtomically(target, document.toString(2));
            LOG.info("Progress archived: {}", target);
        } catch (IOException e) {
            throw new ProgressPersistenceException("failed to archive progress document " + target, e);
        }
    }

    @Override
    public Optional<JSONObject> read() {
        if (!Files.isRegularFile(progressPath)) {
            return Optional.empty();
        }
        return Optional.of(readDocument(progressPath));
    }

    @Override
    public List<JSONObject> history(int limit) {
        if (limit <= 0 || !Files.isDirectory(historyDir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(historyDir, ARCHIVE_PREFIX + "*.json")) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            throw new ProgressPersistenceException("failed to list progress history " + historyDir, e);
        }
        files.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        List<JSONObject> out = new ArrayList<>();
        for (Path file : files) {
            if (out.size() >= limit) {
                break;
            }
            try {
                out.add(readDocument(file));
            } catch (ProgressPersistenceException e) {
                LOG.warn("Skipping unreadable history file {}: {}", file, e.getMessage());
            }
        }
        return out;
    }

    private static JSONObject readDocument(Path file) {
        try {
            return new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | JSONException e) {
            throw new ProgressPersistenceException("failed to read progress document " + file, e);
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, replacing in place", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
