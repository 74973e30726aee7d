/**
 * BuilderClient.java
 *
 * 该服务负责与外部构建服务通信：发送构建请求（POST /environments/build）和查询构建状态
 * （GET /environments/status）。
 * 这一层不做重试；所有网络错误、超时和非 2xx 响应都被转换为 BuilderError 值返回，从不抛出。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.model.BuildStatus;
import club.ppmc.softpack.model.EnvironmentResult.BuilderError;
import club.ppmc.softpack.model.PackageSpec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.PreDestroy;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
public class BuilderClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(BuilderClient.class);

    private static final String CONNECTION_FAILED = "Connection to builder failed: ";

    private final RestTemplate restTemplate;
    private final SoftpackSettings.Builder builder;
    private final ExecutorService dispatchExecutor = Executors.newFixedThreadPool(2, r -> {
        var thread = new Thread(r, "builder-dispatch");
        thread.setDaemon(true);
        return thread;
    });

    public BuilderClient(RestTemplate restTemplate, SoftpackSettings settings) {
        this.restTemplate = restTemplate;
        this.builder = settings.getBuilder();
    }

    /** 构建请求的请求体。 */
    record BuildRequest(String name, String version, Model model) {}

    record Model(String description, List<PackageEntry> packages) {}

    record PackageEntry(String name, String version) {}

    /** 构建服务返回的单条状态，时间戳为 ISO-8601 字符串，未开始或未结束时为空。 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusEntry(
            @JsonProperty("Name") String name,
            @JsonProperty("Requested") String requested,
            @JsonProperty("BuildStart") String buildStart,
            @JsonProperty("BuildDone") String buildDone) {}

    /**
     * 状态查询的结果：成功时 statuses 有值，失败时 error 有值。
     */
    public record StatusResponse(List<BuildStatus> statuses, BuilderError error) {

        public boolean succeeded() {
            return error == null;
        }
    }

    /**
     * 异步发送构建请求。
     *
     * @param path 所有者路径，例如 "users/alice"。
     * @param baseName 不含后缀的环境名。
     * @param version 后缀（"1"、"2"...），没有后缀时为空字符串。
     * @return 发送成功时以 null 完成，失败时以 BuilderError 完成；从不异常完成。
     */
    public CompletableFuture<BuilderError> submit(
            String path, String baseName, String version, String description, List<PackageSpec> packages) {
        var request = new BuildRequest(
                path + "/" + baseName,
                version,
                new Model(
                        description,
                        packages.stream().map(p -> new PackageEntry(p.name(), p.version())).toList()));
        return CompletableFuture.supplyAsync(() -> post(request), dispatchExecutor);
    }

    /**
     * 发送构建请求，并最多等待配置的时间以获得结果。
     *
     * @return 发送失败时的 BuilderError，成功时为 null。
     */
    public BuilderError dispatch(
            String path, String baseName, String version, String description, List<PackageSpec> packages) {
        CompletableFuture<BuilderError> pending = submit(path, baseName, version, description, packages);
        try {
            return pending.get(builder.getDispatchWaitMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("等待构建服务响应超时: {}/{}", path, baseName);
            return new BuilderError(CONNECTION_FAILED + "timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BuilderError(CONNECTION_FAILED + "interrupted");
        } catch (ExecutionException e) {
            return new BuilderError(CONNECTION_FAILED + e.getCause().getMessage());
        }
    }

    private BuilderError post(BuildRequest request) {
        String url = baseUrl() + "/environments/build";
        try {
            restTemplate.postForEntity(url, request, String.class);
            LOGGER.info("已向构建服务发送构建请求: {} (version '{}')", request.name(), request.version());
            return null;
        } catch (RestClientException e) {
            LOGGER.warn("向构建服务发送 {} 的构建请求失败: {}", request.name(), e.getMessage());
            return new BuilderError(CONNECTION_FAILED + e.getMessage());
        }
    }

    /**
     * 查询构建服务已知的全部构建状态。
     */
    public StatusResponse statuses() {
        String url = baseUrl() + "/environments/status";
        try {
            StatusEntry[] entries = restTemplate.getForObject(url, StatusEntry[].class);
            List<BuildStatus> statuses = entries == null
                    ? List.of()
                    : Arrays.stream(entries)
                            .map(e -> new BuildStatus(
                                    e.name(), timestamp(e.requested()), timestamp(e.buildStart()), timestamp(e.buildDone())))
                            .toList();
            return new StatusResponse(statuses, null);
        } catch (RestClientException | DateTimeParseException e) {
            LOGGER.warn("查询构建状态失败: {}", e.getMessage());
            return new StatusResponse(List.of(), new BuilderError(CONNECTION_FAILED + e.getMessage()));
        }
    }

    private static OffsetDateTime timestamp(String value) {
        return StringUtils.hasText(value) ? OffsetDateTime.parse(value) : null;
    }

    private String baseUrl() {
        return "http://" + builder.getHost() + ":" + builder.getPort();
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
