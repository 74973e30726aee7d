/**
 * RecipeService.java
 *
 * 管理用户对新配方的请求。请求以 "name@version.yml" 的形式保存在制品仓库的 requested-recipes 文件夹中，
 * 环境可以在配方加入包目录之前以 "*name@version" 引用它，此时环境处于等待状态。
 * 管理员把配方加入包目录后完成请求：等待中的环境改为引用正式包，不再等待任何配方的环境随即发送构建请求。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.exception.ArtifactStoreException;
import club.ppmc.softpack.exception.ArtifactStoreException.Reason;
import club.ppmc.softpack.model.Artifact;
import club.ppmc.softpack.model.CatalogPackage;
import club.ppmc.softpack.model.EnvironmentFiles;
import club.ppmc.softpack.model.EnvironmentResult;
import club.ppmc.softpack.model.EnvironmentResult.InvalidInputError;
import club.ppmc.softpack.model.EnvironmentResult.RecipeSuccess;
import club.ppmc.softpack.model.PackageSpec;
import club.ppmc.softpack.model.RecipeRequest;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class RecipeService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecipeService.class);

    /** 配方名和版本会成为文件名的一部分。 */
    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.+-]*$");

    static final String INVALID_INPUT = "Invalid Input";
    static final String UNKNOWN_RECIPE = "Unknown Recipe";
    static final String FILE_EXISTS = "File already exists";
    static final String IN_USE = "There are environments relying on this requested recipe; can not delete.";

    private final ArtifactStore store;
    private final EnvironmentService environmentService;
    private final PackageCatalogService catalogService;
    private final EmailNotifier emailNotifier;
    private final SoftpackSettings settings;

    public RecipeService(
            ArtifactStore store,
            EnvironmentService environmentService,
            PackageCatalogService catalogService,
            EmailNotifier emailNotifier,
            SoftpackSettings settings) {
        this.store = store;
        this.environmentService = environmentService;
        this.catalogService = catalogService;
        this.emailNotifier = emailNotifier;
        this.settings = settings;
    }

    /**
     * 保存一个新的配方请求。同名同版本的请求已存在时返回 "File already exists"。
     * 给出了请求者时，按 softpack.recipes 的邮件配置通知管理员。
     */
    public EnvironmentResult request(RecipeRequest request) {
        if (request == null
                || Stream.of(request.name(), request.version(), request.description(), request.url(), request.username())
                        .anyMatch(value -> value == null)
                || !validToken(request.name())
                || !validToken(request.version())) {
            return new InvalidInputError(INVALID_INPUT);
        }

        try {
            byte[] content = EnvironmentService.writeYaml(request);
            environmentService.withRetries("request recipe " + request.name() + "@" + request.version(), () -> {
                store.commit(
                        store.createFile(EnvironmentFiles.REQUESTED_RECIPES_ROOT, request.fileName(), content, false, false),
                        "request recipe");
                store.push();
                return null;
            });
        } catch (ArtifactStoreException e) {
            if (e.getReason() == Reason.FILE_EXISTS) {
                return new InvalidInputError(FILE_EXISTS);
            }
            return environmentService.toError(e);
        }
        LOGGER.info("已记录配方请求 {}@{} (请求者 {})", request.name(), request.version(), request.username());

        if (StringUtils.hasText(request.username())) {
            String message = "User: " + request.username() + "\n"
                    + "Recipe: " + request.name() + "\n"
                    + "Version: " + request.version() + "\n"
                    + "URL: " + request.url() + "\n"
                    + "Description: " + request.description();
            emailNotifier.send(
                    settings.getRecipes(),
                    message,
                    "SoftPack Recipe Request: " + request.name() + "@" + request.version(),
                    request.username(),
                    false);
        }
        return new RecipeSuccess("Request Created");
    }

    /** 按名称和版本排序列出所有尚未完成的请求。无法解析的请求文件被跳过。 */
    public List<RecipeRequest> requested() {
        var requests = new ArrayList<RecipeRequest>();
        try {
            for (Artifact file : store.iterate(EnvironmentFiles.REQUESTED_RECIPES_ROOT)) {
                if (file.folder()) {
                    continue;
                }
                try {
                    RecipeRequest request = EnvironmentService.readYaml(store.read(file), RecipeRequest.class);
                    if (request != null) {
                        requests.add(request);
                    }
                } catch (IOException e) {
                    LOGGER.warn("配方请求 {} 无法解析，跳过: {}", file.path(), e.getMessage());
                }
            }
        } catch (ArtifactStoreException | IllegalStateException e) {
            LOGGER.error("列出配方请求失败", e);
            return List.of();
        }
        return requests;
    }

    /**
     * 用包目录中的 name@version 完成请求 requestedName@requestedVersion。
     * 请求不存在或目录中没有该包版本时返回 "Unknown Recipe"。
     */
    public EnvironmentResult fulfil(String name, String version, String requestedName, String requestedVersion) {
        if (!validToken(name) || !validToken(version) || !validToken(requestedName) || !validToken(requestedVersion)) {
            return new InvalidInputError(INVALID_INPUT);
        }
        String fileName = new RecipeRequest(requestedName, requestedVersion, null, null, null).fileName();
        try {
            Optional<Artifact> request = store.lookup(EnvironmentFiles.REQUESTED_RECIPES_ROOT + "/" + fileName);
            if (request.isEmpty() || !inCatalog(name, version)) {
                return new InvalidInputError(UNKNOWN_RECIPE);
            }

            environmentService.fulfilRecipe(
                    PackageSpec.requestedRecipe(requestedName, requestedVersion), new PackageSpec(name, version));
            removeRequest(fileName, "fulfil recipe request");
        } catch (ArtifactStoreException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return new InvalidInputError(UNKNOWN_RECIPE);
            }
            return environmentService.toError(e);
        }
        LOGGER.info("配方请求 {}@{} 已由 {}@{} 完成", requestedName, requestedVersion, name, version);
        return new RecipeSuccess("Recipe Fulfilled");
    }

    /** 移除一个请求。仍有环境引用它时拒绝移除。 */
    public EnvironmentResult remove(String name, String version) {
        if (!validToken(name) || !validToken(version)) {
            return new InvalidInputError(INVALID_INPUT);
        }
        if (!environmentService.relyingOn(PackageSpec.requestedRecipe(name, version)).isEmpty()) {
            return new InvalidInputError(IN_USE);
        }
        try {
            removeRequest(new RecipeRequest(name, version, null, null, null).fileName(), "remove requested recipe");
        } catch (ArtifactStoreException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return new InvalidInputError(UNKNOWN_RECIPE);
            }
            return environmentService.toError(e);
        }
        return new RecipeSuccess("Request Removed");
    }

    /** 包目录中某个配方的描述；目录中没有该配方时为空。 */
    public Optional<String> description(String recipe) {
        if (!StringUtils.hasText(recipe)) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalogService.descriptions().get(recipe));
    }

    private void removeRequest(String fileName, String message) throws ArtifactStoreException {
        environmentService.withRetries(message + " " + fileName, () -> {
            store.commit(store.deleteFile(EnvironmentFiles.REQUESTED_RECIPES_ROOT, fileName), message);
            store.push();
            return null;
        });
    }

    private boolean inCatalog(String name, String version) {
        for (CatalogPackage pkg : catalogService.packages()) {
            if (pkg.name().equals(name)) {
                return pkg.versions().contains(version);
            }
        }
        return false;
    }

    private static boolean validToken(String value) {
        return value != null && TOKEN.matcher(value).matches();
    }
}
