/**
 * PackageCatalogService.java
 *
 * 该服务缓存 spack 可安装包的完整目录（包名、版本、描述）。
 * 目录通过执行 "spack list --format html" 获得，可选地叠加一个自定义包仓库的临时浅克隆。
 * 缓存是一个原子替换的不可变列表，读取不会阻塞刷新。
 * 最近一次的原始输出会写入磁盘缓存目录，冷启动时如果内存中尚无缓存则直接读取它，避免缓慢的外部调用。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.model.CatalogPackage;
import club.ppmc.softpack.util.SpackHtmlParser;
import club.ppmc.softpack.util.SystemCommandExecutor;
import club.ppmc.softpack.util.SystemCommandExecutor.CommandResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.io.FileUtils;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class PackageCatalogService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PackageCatalogService.class);

    static final String CACHE_FILE = "spack-list.html";

    private final SoftpackSettings.Spack spack;
    private final SystemCommandExecutor commandExecutor;
    private final AtomicReference<List<CatalogPackage>> cache = new AtomicReference<>(List.of());
    private final ScheduledExecutorService refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        var thread = new Thread(r, "spack-catalog-refresh");
        thread.setDaemon(true);
        return thread;
    });
    private final Object loadLock = new Object();

    private ScheduledFuture<?> refreshTask;

    public PackageCatalogService(SoftpackSettings settings, SystemCommandExecutor commandExecutor) {
        this.spack = settings.getSpack();
        this.commandExecutor = commandExecutor;
    }

    @PostConstruct
    public void init() {
        loadFromDiskCache();
        if (spack.getUpdateIntervalSeconds() > 0) {
            keepUpdated(Duration.ofSeconds(spack.getUpdateIntervalSeconds()));
        }
    }

    /**
     * 返回缓存的包目录；缓存为空时同步加载一次。加载失败时返回空列表。
     */
    public List<CatalogPackage> packages() {
        List<CatalogPackage> current = cache.get();
        if (!current.isEmpty()) {
            return current;
        }
        synchronized (loadLock) {
            if (cache.get().isEmpty()) {
                try {
                    load();
                } catch (IOException e) {
                    LOGGER.error("加载 spack 包目录失败", e);
                }
            }
        }
        return cache.get();
    }

    /** 包名 -> 描述。 */
    public Map<String, String> descriptions() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (CatalogPackage pkg : packages()) {
            descriptions.put(pkg.name(), pkg.description());
        }
        return descriptions;
    }

    /**
     * 执行 spack 列出全部包，解析结果并原子替换缓存。
     *
     * @throws IOException 克隆自定义仓库失败、命令失败或超时。
     */
    public void load() throws IOException {
        Path checkout = null;
        try {
            var command = new ArrayList<String>();
            command.add(spack.getBin());
            if (StringUtils.hasText(spack.getRepo())) {
                checkout = Files.createTempDirectory("spack-repo-");
                checkoutCustomRepo(spack.getRepo(), checkout);
                command.add("--config");
                command.add("repos:[" + checkout + "]");
            }
            command.addAll(List.of("list", "--format", "html"));

            CommandResult result =
                    commandExecutor.execute(command, null, Duration.ofSeconds(spack.getCommandTimeoutSeconds()));
            if (!result.succeeded()) {
                throw new IOException("spack list 失败，退出码: " + result.exitCode());
            }
            String html = result.stdoutAsString();
            List<CatalogPackage> packages = SpackHtmlParser.parse(new StringReader(html));
            cache.set(List.copyOf(packages));
            LOGGER.info("spack 包目录已更新，共 {} 个包", packages.size());
            writeDiskCache(html);
        } finally {
            if (checkout != null) {
                try {
                    FileUtils.deleteDirectory(checkout.toFile());
                } catch (IOException e) {
                    LOGGER.warn("清理临时目录 {} 失败", checkout, e);
                }
            }
        }
    }

    /**
     * 在后台按固定间隔刷新目录。加载失败只记录日志，保留旧缓存。
     * 再次调用会替换之前的定时任务。
     */
    public synchronized void keepUpdated(Duration interval) {
        stopUpdating();
        long millis = interval.toMillis();
        refreshTask = refreshScheduler.scheduleWithFixedDelay(this::refreshQuietly, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.info("已启动 spack 包目录的后台刷新，间隔 {} 秒", interval.toSeconds());
    }

    /** 取消后台刷新。 */
    public synchronized void stopUpdating() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
    }

    synchronized boolean isUpdating() {
        return refreshTask != null && !refreshTask.isCancelled();
    }

    private void refreshQuietly() {
        try {
            load();
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("后台刷新 spack 包目录失败，继续使用旧缓存: {}", e.getMessage());
        }
    }

    private void checkoutCustomRepo(String url, Path target) throws IOException {
        LOGGER.info("正在浅克隆自定义 spack 仓库 {} 到 {}", url, target);
        try (Git ignored = Git.cloneRepository().setURI(url).setDirectory(target.toFile()).setDepth(1).call()) {
            LOGGER.debug("自定义 spack 仓库克隆完成");
        } catch (GitAPIException e) {
            throw new IOException("克隆自定义 spack 仓库失败: " + e.getMessage(), e);
        }
    }

    private Path cacheFile() {
        return StringUtils.hasText(spack.getCache()) ? Paths.get(spack.getCache(), CACHE_FILE) : null;
    }

    private void writeDiskCache(String html) {
        Path file = cacheFile();
        if (file == null) {
            return;
        }
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.warn("写入 spack 包目录缓存 {} 失败", file, e);
        }
    }

    /** 仅在内存缓存为空时读取磁盘缓存。 */
    void loadFromDiskCache() {
        Path file = cacheFile();
        if (file == null || !Files.isRegularFile(file) || !cache.get().isEmpty()) {
            return;
        }
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<CatalogPackage> packages = SpackHtmlParser.parse(reader);
            cache.updateAndGet(current -> current.isEmpty() ? List.copyOf(packages) : current);
            LOGGER.info("已从磁盘缓存 {} 读取 {} 个包", file, packages.size());
        } catch (IOException e) {
            LOGGER.warn("读取 spack 包目录缓存 {} 失败", file, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        stopUpdating();
        refreshScheduler.shutdown();
        try {
            if (!refreshScheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                refreshScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            refreshScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
