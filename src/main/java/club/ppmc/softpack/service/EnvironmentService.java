/**
 * EnvironmentService.java
 *
 * 环境的领域服务，建立在 ArtifactStore 之上。
 * 负责输入校验、"-N" 后缀分配、环境的增删改、标签与隐藏标记、构建服务上传结果的写入、
 * 从旧式模块文件创建环境，根据标记文件推导环境状态，以及用正式包替换清单中请求中的配方。
 *
 * 所有公开的写操作都返回 EnvironmentResult 的某个变体，从不抛出仓库异常。
 * 写入遵循 读取 -> 构建新树 -> 提交 -> 推送 的顺序；遇到并发修改或推送被拒绝时，
 * 整个序列会从新的 head 重新执行，最多 softpack.artifacts.retries 次。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.exception.ArtifactStoreException;
import club.ppmc.softpack.exception.ArtifactStoreException.Reason;
import club.ppmc.softpack.model.Artifact;
import club.ppmc.softpack.model.BuildStatus;
import club.ppmc.softpack.model.BuildStatusSummary;
import club.ppmc.softpack.model.Environment;
import club.ppmc.softpack.model.EnvironmentFiles;
import club.ppmc.softpack.model.EnvironmentInput;
import club.ppmc.softpack.model.EnvironmentMetadata;
import club.ppmc.softpack.model.EnvironmentResult;
import club.ppmc.softpack.model.EnvironmentResult.AddTagSuccess;
import club.ppmc.softpack.model.EnvironmentResult.BuilderError;
import club.ppmc.softpack.model.EnvironmentResult.ConcurrentModificationError;
import club.ppmc.softpack.model.EnvironmentResult.CreateEnvironmentSuccess;
import club.ppmc.softpack.model.EnvironmentResult.DeleteEnvironmentSuccess;
import club.ppmc.softpack.model.EnvironmentResult.EnvironmentAlreadyExistsError;
import club.ppmc.softpack.model.EnvironmentResult.EnvironmentNotFoundError;
import club.ppmc.softpack.model.EnvironmentResult.HiddenSuccess;
import club.ppmc.softpack.model.EnvironmentResult.InvalidInputError;
import club.ppmc.softpack.model.EnvironmentResult.RepositoryUnavailableError;
import club.ppmc.softpack.model.EnvironmentResult.UpdateEnvironmentSuccess;
import club.ppmc.softpack.model.EnvironmentResult.WriteArtifactSuccess;
import club.ppmc.softpack.model.EnvironmentState;
import club.ppmc.softpack.model.EnvironmentType;
import club.ppmc.softpack.model.FailureReason;
import club.ppmc.softpack.model.Interpreters;
import club.ppmc.softpack.model.Manifest;
import club.ppmc.softpack.model.PackageSpec;
import club.ppmc.softpack.model.ResendResult;
import club.ppmc.softpack.model.StagedTree;
import club.ppmc.softpack.model.UploadedFile;
import club.ppmc.softpack.util.ModuleTranslator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class EnvironmentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentService.class);

    private static final Pattern NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");
    private static final Pattern OWNER_PATH = Pattern.compile("^(users|groups)/([^/\\s]+)$");
    private static final Pattern SUFFIXED_NAME = Pattern.compile("^(.+)-(\\d+)$");
    private static final Pattern REPEATED_WHITESPACE = Pattern.compile("\\s{2,}");
    private static final Pattern PATH_TRAVERSAL = Pattern.compile("(^|/)\\.\\.(/|$)");

    static final String NOT_FOUND = "No environment with this name found in this location.";
    static final String ALREADY_EXISTS = "This name is already used in this location";
    static final String MISSING_FIELDS = "all fields must be filled in";

    private static final YAMLMapper YAML = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .build();
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ArtifactStore store;
    private final BuilderClient builderClient;
    private final GroupService groupService;
    private final EmailNotifier emailNotifier;
    private final SoftpackSettings settings;

    public EnvironmentService(
            ArtifactStore store,
            BuilderClient builderClient,
            GroupService groupService,
            EmailNotifier emailNotifier,
            SoftpackSettings settings) {
        this.store = store;
        this.builderClient = builderClient;
        this.groupService = groupService;
        this.emailNotifier = emailNotifier;
        this.settings = settings;
    }

    @FunctionalInterface
    interface StoreOperation<T> {
        T run() throws ArtifactStoreException;
    }

    // --- 创建 / 更新 / 删除 ---

    /**
     * 以下一个空闲的 "-N" 后缀创建环境，写入清单、元数据和排队标记，然后发送构建请求。
     * 构建请求失败不会回滚本地写入：返回值仍是 CreateEnvironmentSuccess，其 builderError 记录失败原因。
     * 后缀和新文件夹基于同一个快照计算，快照之后分支被移动时整个序列重做。
     * 清单引用了请求中的配方时环境处于等待状态，不发送构建请求。
     */
    public EnvironmentResult create(EnvironmentInput input) {
        Optional<EnvironmentResult> invalid = validate(input);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        String ownerFolder = ArtifactStore.environmentsFolder(input.path());

        int suffix;
        try {
            suffix = withRetries("create " + input.path() + "/" + input.name(), () -> {
                StagedTree staged = store.stage();
                int next = nextSuffix(staged, ownerFolder, input.name());
                String folderName = input.name() + "-" + next;

                staged = store.createFiles(
                        staged, ArtifactStore.environmentsFolder(input.path(), folderName), environmentFiles(input), true, false);
                staged = raiseSuffixMark(staged, input.path(), folderName);

                store.commit(staged, "create environment folder");
                store.push();
                return next;
            });
        } catch (ArtifactStoreException e) {
            return toError(e);
        }

        String name = input.name() + "-" + suffix;
        if (waitsForRecipes(input.packages())) {
            LOGGER.info("环境 {}/{} 引用了请求中的配方，暂不发送构建请求", input.path(), name);
            return new CreateEnvironmentSuccess("Successfully scheduled environment creation", input.path(), name, null);
        }
        BuilderError builderError = builderClient.dispatch(
                input.path(), input.name(), String.valueOf(suffix), input.description(), input.packages());
        if (builderError != null) {
            LOGGER.warn("环境 {}/{} 已写入仓库，但构建请求发送失败: {}", input.path(), name, builderError.message());
        }
        return new CreateEnvironmentSuccess("Successfully scheduled environment creation", input.path(), name, builderError);
    }

    /**
     * 覆盖已有环境的清单并重新发送构建请求。名称和路径不允许修改。
     */
    public EnvironmentResult update(EnvironmentInput input, String currentPath, String currentName) {
        if (!StringUtils.hasText(currentPath) || !StringUtils.hasText(currentName)) {
            return new InvalidInputError(MISSING_FIELDS);
        }
        Optional<EnvironmentResult> invalid = validate(input);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        if (!input.path().equals(currentPath) || !input.name().equals(currentName)) {
            return new InvalidInputError("change of name or path not currently supported");
        }

        String folder = ArtifactStore.environmentsFolder(currentPath, currentName);
        try {
            if (!isEnvironment(folder)) {
                return new EnvironmentNotFoundError(NOT_FOUND, currentPath, currentName);
            }
            withRetries("update " + folder, () -> {
                try {
                    StagedTree staged = store.createFile(folder, EnvironmentFiles.MANIFEST, manifestBytes(input), false, true);
                    store.commit(staged, "update environment");
                    store.push();
                } catch (ArtifactStoreException e) {
                    if (e.getReason() != Reason.NO_CHANGES) {
                        throw e;
                    }
                    LOGGER.info("环境 {} 的清单没有变化，仅重新发送构建请求", folder);
                }
                return null;
            });
        } catch (ArtifactStoreException e) {
            return toError(e);
        }

        BuilderError builderError = waitsForRecipes(input.packages())
                ? null
                : dispatch(currentPath, currentName, input.description(), input.packages());
        return new UpdateEnvironmentSuccess("Successfully updated environment", builderError);
    }

    public EnvironmentResult delete(String name, String path) {
        if (!validOwnerPath(path) || !StringUtils.hasText(name)) {
            return new EnvironmentNotFoundError(NOT_FOUND, path, name);
        }
        String folder = ArtifactStore.environmentsFolder(path, name);
        try {
            Optional<Artifact> existing = store.lookup(folder);
            if (existing.isEmpty() || !existing.get().folder()) {
                return new EnvironmentNotFoundError(NOT_FOUND, path, name);
            }
            withRetries("delete " + folder, () -> {
                store.commit(store.deleteEnvironment(name, path), "delete environment");
                store.push();
                return null;
            });
        } catch (ArtifactStoreException e) {
            if (e.getReason() == Reason.INVALID_PATH) {
                return new EnvironmentNotFoundError(NOT_FOUND, path, name);
            }
            return toError(e);
        }
        return new DeleteEnvironmentSuccess("Successfully deleted the environment");
    }

    // --- 元数据 ---

    /** 添加标签。标签已存在时不提交，返回 "Tag already present"。 */
    public EnvironmentResult addTag(String name, String path, String tag) {
        if (!validTag(tag)) {
            return new InvalidInputError(
                    "Tags must contain at least one non-whitespace character and no leading, trailing or repeated whitespace");
        }
        String folder = ArtifactStore.environmentsFolder(path, name);
        try {
            if (!validOwnerPath(path) || !isEnvironment(folder)) {
                return new EnvironmentNotFoundError(NOT_FOUND, path, name);
            }
            boolean added = withRetries("tag " + folder, () -> {
                EnvironmentMetadata metadata = readMetadata(folder);
                if (!metadata.addTag(tag)) {
                    return false;
                }
                store.commit(store.createFile(folder, EnvironmentFiles.METADATA, writeYaml(metadata), false, true), "add tag");
                store.push();
                return true;
            });
            return new AddTagSuccess(added ? "Tag successfully added" : "Tag already present");
        } catch (ArtifactStoreException e) {
            return toError(e);
        }
    }

    /** 设置或清除隐藏标记。已是目标值时不提交，返回 "Hidden metadata already set"。 */
    public EnvironmentResult setHidden(String name, String path, boolean hidden) {
        String folder = ArtifactStore.environmentsFolder(path, name);
        try {
            if (!validOwnerPath(path) || !isEnvironment(folder)) {
                return new EnvironmentNotFoundError(NOT_FOUND, path, name);
            }
            boolean changed = withRetries("hide " + folder, () -> {
                EnvironmentMetadata metadata = readMetadata(folder);
                if (metadata.isForceHidden() == hidden) {
                    return false;
                }
                metadata.setForceHidden(hidden);
                store.commit(store.createFile(folder, EnvironmentFiles.METADATA, writeYaml(metadata), false, true), "set hidden");
                store.push();
                return true;
            });
            return new HiddenSuccess(changed ? "Hidden metadata set" : "Hidden metadata already set");
        } catch (ArtifactStoreException e) {
            return toError(e);
        }
    }

    // --- 读取 ---

    /**
     * 列出环境，不包括被隐藏的环境。
     *
     * @param username 为 null 时列出所有用户和组的环境；否则只列出该用户自己的以及其所属组的环境。
     */
    public List<Environment> iter(String username) {
        return environments(username, false);
    }

    private List<Environment> environments(String username, boolean includeHidden) {
        var owners = new ArrayList<String>();
        try {
            if (username == null) {
                for (String kind : List.of(EnvironmentFiles.USERS_FOLDER, EnvironmentFiles.GROUPS_FOLDER)) {
                    for (Artifact owner : store.iterate(ArtifactStore.environmentsFolder(kind))) {
                        if (owner.folder()) {
                            owners.add(kind + "/" + owner.name());
                        }
                    }
                }
            } else {
                owners.add(EnvironmentFiles.USERS_FOLDER + "/" + username);
                groupService.groups(username).forEach(group -> owners.add(EnvironmentFiles.GROUPS_FOLDER + "/" + group));
            }

            var environments = new ArrayList<Environment>();
            for (String owner : owners) {
                for (Artifact folder : store.iterate(ArtifactStore.environmentsFolder(owner))) {
                    if (!folder.folder()) {
                        continue;
                    }
                    Environment env = fromArtifact(folder, owner);
                    if (env != null && (includeHidden || !env.isHidden())) {
                        environments.add(env);
                    }
                }
            }
            return environments;
        } catch (ArtifactStoreException | IllegalStateException e) {
            LOGGER.error("列出环境失败", e);
            return List.of();
        }
    }

    /** 直接查找一个环境，包括被隐藏的环境。 */
    public Optional<Environment> get(String path, String name) {
        if (!validOwnerPath(path) || !StringUtils.hasText(name)) {
            return Optional.empty();
        }
        try {
            Optional<Artifact> folder = store.lookup(ArtifactStore.environmentsFolder(path, name));
            if (folder.isEmpty() || !folder.get().folder()) {
                return Optional.empty();
            }
            return Optional.ofNullable(fromArtifact(folder.get(), path));
        } catch (ArtifactStoreException e) {
            LOGGER.error("读取环境 {}/{} 失败", path, name, e);
            return Optional.empty();
        }
    }

    /**
     * 把一个环境文件夹解析为领域对象。
     *
     * @param folder 环境文件夹。
     * @param ownerPath 所有者路径，例如 "groups/hgi"。
     * @return 文件夹中没有清单，或清单无法解析（缺少描述、包列表或包名）时返回 null。
     */
    Environment fromArtifact(Artifact folder, String ownerPath) throws ArtifactStoreException {
        Map<String, Artifact> files = new LinkedHashMap<>();
        for (Artifact child : store.children(folder)) {
            files.put(child.name(), child);
        }
        Artifact manifestFile = files.get(EnvironmentFiles.MANIFEST);
        if (manifestFile == null || manifestFile.folder()) {
            return null;
        }

        Manifest manifest;
        List<PackageSpec> packages;
        try {
            manifest = parseManifest(store.read(manifestFile));
            packages = manifest.packageSpecs();
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("环境 {} 的清单无法解析，跳过: {}", folder.path(), e.getMessage());
            return null;
        }
        EnvironmentMetadata metadata = parseMetadata(folder.path(), readOptional(files, EnvironmentFiles.METADATA));

        EnvironmentState state = waitsForRecipes(packages) ? EnvironmentState.WAITING : EnvironmentState.QUEUED;
        FailureReason failureReason = null;
        byte[] builderOut = readOptional(files, EnvironmentFiles.BUILDER_OUT);
        if (files.containsKey(EnvironmentFiles.MODULE)) {
            state = EnvironmentState.READY;
        } else if (builderOut != null && builderOut.length > 0) {
            state = EnvironmentState.FAILED;
            failureReason = FailureReason.fromBuilderOutput(new String(builderOut, StandardCharsets.UTF_8));
        }

        byte[] readme = readOptional(files, EnvironmentFiles.README);
        return Environment.builder()
                .id(folder.id().name())
                .name(folder.name())
                .path(ownerPath)
                .description(manifest.getDescription())
                .packages(packages)
                .state(state)
                .failureReason(failureReason)
                .type(files.containsKey(EnvironmentFiles.GENERATED_FROM_MODULE) ? EnvironmentType.MODULE : EnvironmentType.SOFTPACK)
                .tags(List.copyOf(metadata.getTags()))
                .hidden(metadata.isForceHidden())
                .username(metadata.getUsername())
                .interpreters(interpreters(folder.path(), readOptional(files, EnvironmentFiles.SPACK_LOCK)))
                .readme(readme == null ? null : new String(readme, StandardCharsets.UTF_8))
                .build();
    }

    /**
     * 从 spack.lock 的 concrete_specs（以哈希为键）中取出第一个 python 和第一个 r 的版本。
     */
    static Interpreters interpreters(String folderPath, byte[] lockFile) {
        if (lockFile == null) {
            return Interpreters.NONE;
        }
        String python = null;
        String r = null;
        try {
            JsonNode specs = JSON.readTree(lockFile).path("concrete_specs");
            Iterator<JsonNode> entries = specs.elements();
            while (entries.hasNext()) {
                JsonNode spec = entries.next();
                String name = spec.path("name").asText();
                String version = spec.path("version").asText(null);
                if ("python".equals(name) && python == null) {
                    python = version;
                } else if ("r".equals(name) && r == null) {
                    r = version;
                }
            }
        } catch (IOException e) {
            LOGGER.warn("环境 {} 的锁文件无法解析: {}", folderPath, e.getMessage());
        }
        return new Interpreters(python, r);
    }

    // --- 构建服务上传 ---

    /**
     * 写入构建服务上传的文件。环境不存在时先以占位清单创建它（同一次提交）。
     * 状态离开 queued 且元数据中记录了请求者时，通知请求者并移除用户名。
     *
     * @param environmentPath "users/alice/foo-1" 形式的环境路径。
     */
    public EnvironmentResult uploadArtifacts(String environmentPath, List<UploadedFile> uploads) {
        if (uploads == null || uploads.isEmpty()) {
            return new InvalidInputError("no files uploaded");
        }
        EnvironmentInput placeholder = EnvironmentInput.fromPath(environmentPath == null ? "" : environmentPath.strip());
        Optional<EnvironmentResult> invalid = validate(placeholder);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        String folder = ArtifactStore.environmentsFolder(placeholder.path(), placeholder.name());

        EnvironmentState newState = EnvironmentState.QUEUED;
        FailureReason failureReason = null;
        for (UploadedFile upload : uploads) {
            if (EnvironmentFiles.MODULE.equals(upload.name())) {
                newState = EnvironmentState.READY;
                break;
            }
            if (EnvironmentFiles.BUILDER_OUT.equals(upload.name())) {
                newState = EnvironmentState.FAILED;
                failureReason = FailureReason.fromBuilderOutput(new String(upload.content(), StandardCharsets.UTF_8));
            }
        }
        final EnvironmentState state = newState;

        var requester = new AtomicReference<String>();
        String commitOid;
        try {
            commitOid = withRetries("write artifacts to " + folder, () -> {
                requester.set(null);
                StagedTree staged = store.stage();
                Map<String, byte[]> files = new LinkedHashMap<>();
                boolean newFolder = !isEnvironment(staged, folder);
                if (newFolder) {
                    LOGGER.info("上传的环境 {} 尚不存在，先以占位清单创建", folder);
                    files.putAll(environmentFiles(placeholder));
                } else if (state != EnvironmentState.QUEUED) {
                    EnvironmentMetadata metadata = readMetadata(staged, folder);
                    if (StringUtils.hasText(metadata.getUsername())) {
                        requester.set(metadata.getUsername());
                        metadata.setUsername(null);
                        files.put(EnvironmentFiles.METADATA, writeYaml(metadata));
                    }
                }
                for (UploadedFile upload : uploads) {
                    files.put(upload.name(), upload.content());
                }
                staged = store.createFiles(staged, folder, files, false, true);
                if (newFolder) {
                    staged = raiseSuffixMark(staged, placeholder.path(), placeholder.name());
                }
                String oid = store.commit(staged, "write artifact").name();
                store.push();
                return oid;
            });
        } catch (ArtifactStoreException e) {
            if (e.getReason() == Reason.NO_CHANGES) {
                return new InvalidInputError("no changes made to the environment");
            }
            return toError(e);
        }

        if (requester.get() != null) {
            notifyRequester(environmentPath, requester.get(), state, failureReason);
        }
        return new WriteArtifactSuccess("Successfully written artifact(s)", commitOid);
    }

    private void notifyRequester(String environmentPath, String username, EnvironmentState state, FailureReason reason) {
        boolean ready = state == EnvironmentState.READY;
        String detail = "";
        if (!ready) {
            detail = reason == FailureReason.CONCRETIZATION
                    ? "\nThe error was a version conflict. Try relaxing which versions you've specified.\n"
                    : "\nThe error was a build error. Contact your softpack administrator.\n";
        }
        String message = "Hi " + username + ",\n\n"
                + "Your environment, " + environmentPath + ", has " + (ready ? "built successfully" : "failed to build") + ".\n"
                + detail
                + "\nSoftPack Team";
        String subject = ready ? "Your environment is ready!" : "Your environment failed to build";
        emailNotifier.send(settings.getEnvironments().getEmail(), message, subject, username, !ready);
    }

    /**
     * 对所有仍处于 queued 状态的环境重新发送构建请求。
     */
    public ResendResult resendPendingBuilds() {
        int successes = 0;
        int failures = 0;
        for (Environment env : iter(null)) {
            if (env.getState() != EnvironmentState.QUEUED) {
                continue;
            }
            if (dispatch(env.getPath(), env.getName(), env.getDescription(), env.getPackages()) == null) {
                successes++;
            } else {
                failures++;
            }
        }
        String message = failures == 0 ? "Successfully triggered resends" : "Failed to trigger all resends";
        LOGGER.info("重新发送构建请求: 成功 {}，失败 {}", successes, failures);
        return new ResendResult(message, successes, failures);
    }

    // --- 模块环境 ---

    /**
     * 从旧式模块文件创建环境：转换后的清单、模块文件副本、README 和来源标记在同一次提交中写入。
     *
     * @param moduleFile 模块文件内容。
     * @param modulePath module load 使用的模块路径。
     * @param environmentPath "groups/hgi/xxhash-0.8.1" 形式的环境路径。
     */
    public EnvironmentResult createFromModule(byte[] moduleFile, String modulePath, String environmentPath) {
        return writeModule(moduleFile, modulePath, environmentPath, true);
    }

    /** 重写一个已有模块环境的文件。 */
    public EnvironmentResult updateFromModule(byte[] moduleFile, String modulePath, String environmentPath) {
        return writeModule(moduleFile, modulePath, environmentPath, false);
    }

    private EnvironmentResult writeModule(byte[] moduleFile, String modulePath, String environmentPath, boolean create) {
        if (moduleFile == null || !StringUtils.hasText(modulePath) || !StringUtils.hasText(environmentPath)) {
            return new InvalidInputError(MISSING_FIELDS);
        }
        EnvironmentInput target = EnvironmentInput.fromPath(environmentPath.strip());
        if (!validOwnerPath(target.path())) {
            return new InvalidInputError("Invalid path");
        }
        if (!NAME.matcher(target.name()).matches()) {
            return new InvalidInputError("Invalid name");
        }
        String folder = ArtifactStore.environmentsFolder(target.path(), target.name());

        Map<String, byte[]> files = new LinkedHashMap<>();
        files.put(EnvironmentFiles.MANIFEST, ModuleTranslator.toManifest(target.name(), moduleFile));
        files.put(EnvironmentFiles.MODULE, moduleFile);
        files.put(EnvironmentFiles.README, ModuleTranslator.generateReadme(modulePath));
        files.put(EnvironmentFiles.GENERATED_FROM_MODULE, new byte[0]);

        try {
            boolean exists = isEnvironment(folder);
            if (create && exists) {
                return new EnvironmentAlreadyExistsError(ALREADY_EXISTS, target.path(), target.name());
            }
            if (!create && !exists) {
                return new EnvironmentNotFoundError(NOT_FOUND, target.path(), target.name());
            }
            if (create) {
                files.put(EnvironmentFiles.METADATA, new byte[0]);
            }
            withRetries((create ? "create module " : "update module ") + folder, () -> {
                StagedTree staged = store.createFiles(folder, files, create, !create);
                if (create) {
                    staged = raiseSuffixMark(staged, target.path(), target.name());
                }
                store.commit(staged, create ? "create environment folder" : "update module");
                store.push();
                return null;
            });
        } catch (ArtifactStoreException e) {
            if (create && e.getReason() == Reason.NO_CHANGES) {
                return new EnvironmentAlreadyExistsError(ALREADY_EXISTS, target.path(), target.name());
            }
            return toError(e);
        }
        return create
                ? new CreateEnvironmentSuccess("Successfully created environment in artifacts repo", target.path(), target.name(), null)
                : new UpdateEnvironmentSuccess("Successfully updated environment in artifacts repo", null);
    }

    // --- 请求中的配方 ---

    /** 清单中引用了该请求中配方的所有环境，包括被隐藏的环境。 */
    List<Environment> relyingOn(PackageSpec requested) {
        return environments(null, true).stream()
                .filter(env -> env.getPackages().contains(requested))
                .toList();
    }

    /**
     * 在所有等待中的环境里，把请求中的配方替换为目录中的正式包并写回清单。
     * 替换后不再引用任何请求中配方的环境随即发送构建请求，发送失败只记录日志，由 resend 补发。
     *
     * @return 被改写的环境数。
     */
    int fulfilRecipe(PackageSpec requested, PackageSpec replacement) throws ArtifactStoreException {
        int rewritten = 0;
        for (Environment env : relyingOn(requested)) {
            if (env.getState() != EnvironmentState.WAITING) {
                continue;
            }
            String folder = ArtifactStore.environmentsFolder(env.getPath(), env.getName());
            Manifest updated = withRetries("fulfil recipe in " + folder, () -> {
                Manifest manifest = readManifest(folder);
                List<PackageSpec> packages;
                try {
                    packages = manifest.packageSpecs().stream()
                            .map(spec -> spec.equals(requested) ? replacement : spec)
                            .toList();
                } catch (IllegalArgumentException e) {
                    throw new ArtifactStoreException(Reason.INVALID_PATH, "invalid manifest in " + folder, e);
                }
                var result = new Manifest(manifest.getDescription(), packages.stream().map(PackageSpec::toManifestEntry).toList());
                store.commit(store.createFile(folder, EnvironmentFiles.MANIFEST, writeYaml(result), false, true),
                        "fulfil recipe request for environment");
                store.push();
                return result;
            });
            rewritten++;

            List<PackageSpec> packages = updated.packageSpecs();
            if (!waitsForRecipes(packages)) {
                BuilderError builderError = dispatch(env.getPath(), env.getName(), updated.getDescription(), packages);
                if (builderError != null) {
                    LOGGER.warn("环境 {} 的配方已就绪，但构建请求发送失败: {}", folder, builderError.message());
                }
            }
        }
        LOGGER.info("配方 {} 已替换为 {}，改写了 {} 个环境", requested.toManifestEntry(), replacement.toManifestEntry(), rewritten);
        return rewritten;
    }

    private static boolean waitsForRecipes(List<PackageSpec> packages) {
        return packages.stream().anyMatch(PackageSpec::isRequestedRecipe);
    }

    // --- 构建状态 ---

    /**
     * 汇总构建状态：已完成构建的平均等待时间（秒，从请求到完成），以及已开始构建的开始时间。
     */
    public BuildStatusSummary buildStatus(List<BuildStatus> statuses) {
        double total = 0;
        int finished = 0;
        Map<String, OffsetDateTime> started = new TreeMap<>();
        for (BuildStatus status : statuses) {
            if (status.requested() != null && status.buildDone() != null) {
                total += Duration.between(status.requested(), status.buildDone()).toMillis() / 1000.0;
                finished++;
            }
            if (status.buildStart() != null) {
                started.put(status.name(), status.buildStart());
            }
        }
        return new BuildStatusSummary(finished == 0 ? null : total / finished, started);
    }

    // --- 内部工具 ---

    private BuilderError dispatch(String path, String folderName, String description, List<PackageSpec> packages) {
        Matcher suffixed = SUFFIXED_NAME.matcher(folderName);
        String baseName = suffixed.matches() ? suffixed.group(1) : folderName;
        String version = suffixed.matches() ? suffixed.group(2) : "";
        return builderClient.dispatch(path, baseName, version, description, packages);
    }

    /**
     * 执行一次完整的写入序列。并发修改和推送被拒绝时从新的 head 重做；推送被拒绝时先把本地分支重置到远程。
     */
    <T> T withRetries(String operation, StoreOperation<T> body) throws ArtifactStoreException {
        int attempts = Math.max(1, settings.getArtifacts().getRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return body.run();
            } catch (ArtifactStoreException e) {
                if (!e.isRetryable() || attempt >= attempts) {
                    throw e;
                }
                LOGGER.warn("{} 失败 (第 {}/{} 次): {}，重新读取后重试", operation, attempt, attempts, e.getMessage());
                if (e.getReason() == Reason.PUSH_REJECTED) {
                    store.resetToRemote();
                }
            }
        }
    }

    EnvironmentResult toError(ArtifactStoreException e) {
        return switch (e.getReason()) {
            case CONCURRENT_MODIFICATION, PUSH_REJECTED -> new ConcurrentModificationError(e.getMessage());
            case IO_FAILURE -> {
                LOGGER.error("制品仓库读写失败", e);
                yield new RepositoryUnavailableError(e.getMessage());
            }
            default -> new InvalidInputError(e.getMessage());
        };
    }

    private Optional<EnvironmentResult> validate(EnvironmentInput input) {
        if (input == null
                || !StringUtils.hasText(input.name())
                || !StringUtils.hasText(input.path())
                || input.description() == null
                || input.packages() == null
                || input.packages().isEmpty()) {
            return Optional.of(new InvalidInputError(MISSING_FIELDS));
        }
        if (!validOwnerPath(input.path())) {
            return Optional.of(new InvalidInputError("Invalid path"));
        }
        if (!NAME.matcher(input.name()).matches()) {
            return Optional.of(new InvalidInputError("Invalid name"));
        }
        return Optional.empty();
    }

    static boolean validOwnerPath(String path) {
        if (path == null) {
            return false;
        }
        Matcher matcher = OWNER_PATH.matcher(path);
        return matcher.matches() && !matcher.group(2).equals(".") && !matcher.group(2).equals("..");
    }

    static boolean validTag(String tag) {
        return tag != null
                && !tag.isBlank()
                && tag.equals(tag.strip())
                && !REPEATED_WHITESPACE.matcher(tag).find()
                && !PATH_TRAVERSAL.matcher(tag).find();
    }

    private boolean isEnvironment(String folder) throws ArtifactStoreException {
        return isEnvironment(store.stage(), folder);
    }

    private boolean isEnvironment(StagedTree staged, String folder) throws ArtifactStoreException {
        Optional<Artifact> manifest = store.lookup(staged, folder + "/" + EnvironmentFiles.MANIFEST);
        return manifest.isPresent() && !manifest.get().folder();
    }

    /**
     * 1 + max(快照中已存在的 name-N 文件夹, 后缀记录)。超出 int 范围的后缀文件夹被忽略。
     */
    private int nextSuffix(StagedTree staged, String ownerFolder, String name) throws ArtifactStoreException {
        int max = readSuffixes(staged, ownerFolder).getOrDefault(name, 0);
        Optional<Artifact> owner = store.lookup(staged, ownerFolder);
        if (owner.isPresent()) {
            for (Artifact existing : store.children(owner.get())) {
                OptionalInt taken = existing.folder() ? suffixOf(existing.name(), name) : OptionalInt.empty();
                if (taken.isPresent()) {
                    max = Math.max(max, taken.getAsInt());
                }
            }
        }
        if (max == Integer.MAX_VALUE) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "no free suffix left for " + name);
        }
        return max + 1;
    }

    /** 文件夹名为 "name-N" 时返回 N；不是该名称的后缀或 N 超出 int 范围时为空。 */
    private static OptionalInt suffixOf(String folderName, String name) {
        Matcher matcher = SUFFIXED_NAME.matcher(folderName);
        if (!matcher.matches() || !matcher.group(1).equals(name)) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            LOGGER.warn("忽略超出范围的后缀: {}", folderName);
            return OptionalInt.empty();
        }
    }

    /**
     * 在同一个暂存树中把所有者的后缀记录提高到新文件夹 "name-N" 的 N。
     * 文件夹名没有后缀，或记录已不低于 N 时原样返回。
     */
    private StagedTree raiseSuffixMark(StagedTree staged, String ownerPath, String folderName) throws ArtifactStoreException {
        Matcher matcher = SUFFIXED_NAME.matcher(folderName);
        if (!matcher.matches()) {
            return staged;
        }
        String name = matcher.group(1);
        OptionalInt suffix = suffixOf(folderName, name);
        String ownerFolder = ArtifactStore.environmentsFolder(ownerPath);
        Map<String, Integer> marks = readSuffixes(staged, ownerFolder);
        if (suffix.isEmpty() || marks.getOrDefault(name, 0) >= suffix.getAsInt()) {
            return staged;
        }
        marks.put(name, suffix.getAsInt());
        return store.createFiles(staged, ownerFolder, Map.of(EnvironmentFiles.SUFFIXES, writeYaml(marks)), false, true);
    }

    private Map<String, Integer> readSuffixes(StagedTree staged, String ownerFolder) throws ArtifactStoreException {
        Optional<Artifact> file = store.lookup(staged, ownerFolder + "/" + EnvironmentFiles.SUFFIXES);
        if (file.isEmpty() || file.get().folder()) {
            return new TreeMap<>();
        }
        byte[] content = store.read(file.get());
        if (content.length == 0) {
            return new TreeMap<>();
        }
        try {
            Map<String, Integer> suffixes = YAML.readValue(content, new TypeReference<TreeMap<String, Integer>>() {});
            return suffixes == null ? new TreeMap<>() : suffixes;
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "无法解析后缀记录 " + ownerFolder, e);
        }
    }

    private Map<String, byte[]> environmentFiles(EnvironmentInput input) throws ArtifactStoreException {
        Map<String, byte[]> files = new LinkedHashMap<>();
        files.put(EnvironmentFiles.MANIFEST, manifestBytes(input));
        if (StringUtils.hasText(input.username())) {
            var metadata = new EnvironmentMetadata();
            metadata.setUsername(input.username());
            files.put(EnvironmentFiles.METADATA, writeYaml(metadata));
        } else {
            files.put(EnvironmentFiles.METADATA, new byte[0]);
        }
        files.put(EnvironmentFiles.BUILT_BY_SOFTPACK, new byte[0]);
        return files;
    }

    private Manifest readManifest(String folder) throws ArtifactStoreException {
        Optional<Artifact> file = store.lookup(folder + "/" + EnvironmentFiles.MANIFEST);
        if (file.isEmpty() || file.get().folder()) {
            throw new ArtifactStoreException(Reason.NOT_FOUND, "no manifest in " + folder);
        }
        try {
            return parseManifest(store.read(file.get()));
        } catch (IOException | IllegalArgumentException e) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "invalid manifest in " + folder, e);
        }
    }

    /** @throws IllegalArgumentException 文件为空文档或缺少 description。 */
    private static Manifest parseManifest(byte[] content) throws IOException {
        Manifest manifest = YAML.readValue(content, Manifest.class);
        if (manifest == null || manifest.getDescription() == null) {
            throw new IllegalArgumentException("清单缺少 description。");
        }
        return manifest;
    }

    private static byte[] manifestBytes(EnvironmentInput input) throws ArtifactStoreException {
        var manifest = new Manifest(
                input.description(), input.packages().stream().map(PackageSpec::toManifestEntry).toList());
        return writeYaml(manifest);
    }

    private EnvironmentMetadata readMetadata(String folder) throws ArtifactStoreException {
        return readMetadata(store.stage(), folder);
    }

    private EnvironmentMetadata readMetadata(StagedTree staged, String folder) throws ArtifactStoreException {
        Optional<Artifact> file = store.lookup(staged, folder + "/" + EnvironmentFiles.METADATA);
        byte[] content = file.isPresent() && !file.get().folder() ? store.read(file.get()) : null;
        return parseMetadata(folder, content);
    }

    private static EnvironmentMetadata parseMetadata(String folder, byte[] content) {
        if (content == null || content.length == 0) {
            return new EnvironmentMetadata();
        }
        try {
            EnvironmentMetadata metadata = YAML.readValue(content, EnvironmentMetadata.class);
            if (metadata == null) {
                return new EnvironmentMetadata();
            }
            if (metadata.getTags() == null) {
                metadata.setTags(new ArrayList<>());
            }
            return metadata;
        } catch (IOException e) {
            LOGGER.warn("环境 {} 的元数据无法解析，按空元数据处理: {}", folder, e.getMessage());
            return new EnvironmentMetadata();
        }
    }

    private byte[] readOptional(Map<String, Artifact> files, String name) throws ArtifactStoreException {
        Artifact file = files.get(name);
        return file == null || file.folder() ? null : store.read(file);
    }

    static byte[] writeYaml(Object value) throws ArtifactStoreException {
        try {
            return YAML.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "YAML 序列化失败", e);
        }
    }

    static <T> T readYaml(byte[] content, Class<T> type) throws IOException {
        return YAML.readValue(content, type);
    }
}
