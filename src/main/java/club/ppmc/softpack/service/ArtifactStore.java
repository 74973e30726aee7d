/**
 * ArtifactStore.java
 *
 * 该服务封装了制品仓库（一个本地裸仓库及其远程 origin）的全部读写操作。
 * 它使用 JGit 直接操作 git 对象：读取时按路径逐段遍历 head 树；写入时以写时复制的方式
 * 构建新的 blob 和 tree（从不修改已有对象），再以 head 提交作为期望旧值原子地更新分支引用。
 *
 * 唯一允许的写入路径是 快照 -> 构建新树 -> 提交 -> 推送。两个写入方在同一分支上竞争时，
 * 后提交的一方会得到 CONCURRENT_MODIFICATION，需要重新读取后重试。
 * 读取不加锁；推送是一个很小的临界区，用互斥锁串行化。
 */
package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import club.ppmc.softpack.exception.ArtifactStoreException;
import club.ppmc.softpack.exception.ArtifactStoreException.Reason;
import club.ppmc.softpack.exception.RepositoryUnavailableException;
import club.ppmc.softpack.model.Artifact;
import club.ppmc.softpack.model.EnvironmentFiles;
import club.ppmc.softpack.model.StagedTree;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.io.FileUtils;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.RepositoryCache;
import org.eclipse.jgit.lib.TreeFormatter;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.TreeFilter;
import org.eclipse.jgit.util.FS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ArtifactStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactStore.class);

    private static final String REMOTE = "origin";
    private static final String TOO_MANY_CHANGES = "too many changes to the repo";
    private static final String NO_CHANGES = "no changes made to the environment";
    private static final Pattern OWNER_PATH = Pattern.compile("^(users|groups)/[^/\\s]+$");

    /** git 树条目的排序：文件夹按 "name/" 参与比较，逐字节无符号比较。 */
    private static final Comparator<TreeEntry> GIT_ORDER = (a, b) -> Arrays.compareUnsigned(a.sortKey(), b.sortKey());

    private final SoftpackSettings settings;
    private final ReentrantLock pushLock = new ReentrantLock();

    private volatile Repository repository;
    private String branchRef;
    private String trackingRef;

    public ArtifactStore(SoftpackSettings settings) {
        this.settings = settings;
    }

    private record TreeEntry(String name, FileMode mode, ObjectId id) {
        boolean isFolder() {
            return FileMode.TREE.equals(mode);
        }

        byte[] sortKey() {
            return (isFolder() ? name + "/" : name).getBytes(StandardCharsets.UTF_8);
        }
    }

    private record Snapshot(ObjectId commit, ObjectId tree) {}

    @FunctionalInterface
    private interface FolderEdit {
        void apply(Map<String, TreeEntry> entries) throws ArtifactStoreException;
    }

    // --- 打开 / 关闭 ---

    /**
     * 打开本地裸仓库；本地不存在时从配置的远程地址克隆。
     *
     * @throws RepositoryUnavailableException 本地仓库不存在且克隆失败。
     */
    @PostConstruct
    public synchronized void open() {
        if (repository != null) {
            return;
        }
        var artifacts = settings.getArtifacts();
        String branch = artifacts.getRepo().getBranch();
        this.branchRef = Constants.R_HEADS + branch;
        this.trackingRef = Constants.R_REMOTES + REMOTE + "/" + branch;

        Path localPath = Paths.get(artifacts.getPath()).toAbsolutePath().normalize();
        String remoteUrl = artifacts.getRepo().getUrl();

        if (RepositoryCache.FileKey.isGitRepository(localPath.toFile(), FS.DETECTED)) {
            try {
                this.repository = new FileRepositoryBuilder().setGitDir(localPath.toFile()).setMustExist(true).build();
                LOGGER.info("已打开本地制品仓库: {} (分支 {})", localPath, branch);
                return;
            } catch (IOException e) {
                throw new RepositoryUnavailableException("无法打开本地制品仓库: " + localPath, localPath.toString(), remoteUrl, e);
            }
        }

        if (!StringUtils.hasText(remoteUrl)) {
            throw new RepositoryUnavailableException(
                    "本地制品仓库不存在，且未配置远程地址: " + localPath, localPath.toString(), null, null);
        }

        LOGGER.info("正在克隆制品仓库 {} 到 {}", remoteUrl, localPath);
        try {
            Git git = Git.cloneRepository()
                    .setURI(remoteUrl)
                    .setDirectory(localPath.toFile())
                    .setBare(true)
                    .setBranch(branch)
                    .setCredentialsProvider(credentials())
                    .setTimeout(artifacts.getTransportTimeoutSeconds())
                    .call();
            this.repository = git.getRepository();
            LOGGER.info("制品仓库已成功克隆到: {}", repository.getDirectory());
        } catch (GitAPIException | RuntimeException e) {
            LOGGER.error("克隆制品仓库 {} 失败", remoteUrl, e);
            deleteQuietly(localPath);
            throw new RepositoryUnavailableException("克隆制品仓库失败: " + e.getMessage(), localPath.toString(), remoteUrl, e);
        }
    }

    @PreDestroy
    public synchronized void close() {
        if (repository != null) {
            repository.close();
            repository = null;
        }
    }

    private void deleteQuietly(Path localPath) {
        if (Files.exists(localPath)) {
            try {
                FileUtils.deleteDirectory(localPath.toFile());
            } catch (IOException cleanupError) {
                LOGGER.warn("清理未完成的克隆目录 {} 失败", localPath, cleanupError);
            }
        }
    }

    private CredentialsProvider credentials() {
        var repo = settings.getArtifacts().getRepo();
        if (!StringUtils.hasText(repo.getUsername())) {
            return null;
        }
        return new UsernamePasswordCredentialsProvider(repo.getUsername(), repo.getWriter() == null ? "" : repo.getWriter());
    }

    private Repository repository() throws ArtifactStoreException {
        Repository repo = this.repository;
        if (repo == null) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "制品仓库尚未打开。");
        }
        return repo;
    }

    // --- 路径 ---

    /** 拼接 environments 根目录下的路径，忽略空段。 */
    public static String environmentsFolder(String... parts) {
        var segments = new ArrayList<String>();
        segments.add(EnvironmentFiles.ENVIRONMENTS_ROOT);
        for (String part : parts) {
            if (StringUtils.hasText(part)) {
                segments.add(normalize(part));
            }
        }
        return String.join("/", segments);
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static List<String> segments(String path) throws ArtifactStoreException {
        String normalized = normalize(path);
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> segments = Arrays.asList(normalized.split("/"));
        for (String segment : segments) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new ArtifactStoreException(Reason.INVALID_PATH, "无效的路径: " + path);
            }
        }
        return segments;
    }

    private static String child(String folder, String name) {
        return folder.isEmpty() ? name : folder + "/" + name;
    }

    // --- 读取 ---

    private Snapshot snapshot() throws ArtifactStoreException {
        Repository repo = repository();
        try {
            Ref ref = repo.exactRef(branchRef);
            if (ref == null || ref.getObjectId() == null) {
                return new Snapshot(ObjectId.zeroId(), null);
            }
            try (RevWalk walk = new RevWalk(repo)) {
                RevCommit commit = walk.parseCommit(ref.getObjectId());
                return new Snapshot(commit.getId(), commit.getTree().getId());
            }
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "读取分支 " + branchRef + " 失败", e);
        }
    }

    /** 当前分支 head 的提交 id；分支尚无提交时为 {@link ObjectId#zeroId()}。 */
    public ObjectId headCommit() throws ArtifactStoreException {
        return snapshot().commit();
    }

    /**
     * 从当前 head 树按路径逐段查找节点。
     *
     * @param path 相对仓库根目录的路径，"" 表示根。
     * @return 找到的节点；路径不存在时为空。
     */
    public Optional<Artifact> lookup(String path) throws ArtifactStoreException {
        return lookup(snapshot().tree(), path);
    }

    /** 以当前 head 作为快照，返回一个尚无改动的 StagedTree，可在其上读取并继续写入。 */
    public StagedTree stage() throws ArtifactStoreException {
        Snapshot head = snapshot();
        return new StagedTree(head.commit(), head.tree(), head.tree());
    }

    /** 在给定快照（而不是当前 head）的树中查找节点。 */
    public Optional<Artifact> lookup(StagedTree staged, String path) throws ArtifactStoreException {
        return lookup(staged.tree(), path);
    }

    /** 与 {@link #lookup(String)} 相同，但路径不存在时抛出 NOT_FOUND。 */
    public Artifact get(String path) throws ArtifactStoreException {
        return lookup(path).orElseThrow(() -> new ArtifactStoreException(Reason.NOT_FOUND, "路径不存在: " + path));
    }

    private Optional<Artifact> lookup(ObjectId rootTree, String path) throws ArtifactStoreException {
        if (rootTree == null) {
            return Optional.empty();
        }
        String normalized = normalize(path);
        if (normalized.isEmpty()) {
            return Optional.of(new Artifact("", "", rootTree, true));
        }
        segments(normalized);
        try (TreeWalk walk = TreeWalk.forPath(repository(), normalized, rootTree)) {
            if (walk == null) {
                return Optional.empty();
            }
            return Optional.of(new Artifact(
                    normalized, walk.getNameString(), walk.getObjectId(0), FileMode.TREE.equals(walk.getFileMode(0))));
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "查找路径 " + path + " 失败", e);
        }
    }

    /**
     * 列出文件夹的直接子节点。
     * 返回的序列是惰性的、可重复遍历的：每次 iterator() 都重新读取该 tree 对象。
     * 根路径不存在或不是文件夹时返回空序列。
     */
    public Iterable<Artifact> iterate(String root) throws ArtifactStoreException {
        Optional<Artifact> node = lookup(root);
        if (node.isEmpty() || !node.get().folder()) {
            return Collections.emptyList();
        }
        Artifact folder = node.get();
        return () -> {
            try {
                return children(folder).iterator();
            } catch (ArtifactStoreException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        };
    }

    /** 读取一个文件夹节点的所有直接子节点。 */
    public List<Artifact> children(Artifact folder) throws ArtifactStoreException {
        if (!folder.folder()) {
            return List.of();
        }
        try (ObjectReader reader = repository().newObjectReader()) {
            return readEntries(reader, folder.id()).values().stream()
                    .sorted(GIT_ORDER)
                    .map(e -> new Artifact(child(folder.path(), e.name()), e.name(), e.id(), e.isFolder()))
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "读取文件夹 " + folder.path() + " 失败", e);
        }
    }

    /** 在文件夹节点下按名称查找子节点。 */
    public Optional<Artifact> child(Artifact folder, String name) throws ArtifactStoreException {
        return children(folder).stream().filter(a -> a.name().equals(name)).findFirst();
    }

    /** 读取文件节点的内容。 */
    public byte[] read(Artifact file) throws ArtifactStoreException {
        if (file.folder()) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "无法读取文件夹的内容: " + file.path());
        }
        try {
            return repository().open(file.id(), Constants.OBJ_BLOB).getBytes();
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "读取文件 " + file.path() + " 失败", e);
        }
    }

    private static Map<String, TreeEntry> readEntries(ObjectReader reader, ObjectId treeId) throws IOException {
        Map<String, TreeEntry> entries = new HashMap<>();
        if (treeId == null) {
            return entries;
        }
        var parser = new CanonicalTreeParser(null, reader, treeId);
        while (!parser.eof()) {
            String name = parser.getEntryPathString();
            entries.put(name, new TreeEntry(name, parser.getEntryFileMode(), parser.getEntryObjectId()));
            parser.next();
        }
        return entries;
    }

    // --- 写入 ---

    /** 在文件夹中写入单个文件，见 {@link #createFiles(StagedTree, String, Map, boolean, boolean)}。 */
    public StagedTree createFile(
            String folder, String fileName, byte[] contents, boolean expectNewFolder, boolean allowOverwrite)
            throws ArtifactStoreException {
        return createFiles(folder, Map.of(fileName, contents), expectNewFolder, allowOverwrite);
    }

    /** 以当前 head 为快照写入文件。 */
    public StagedTree createFiles(
            String folder, Map<String, byte[]> files, boolean expectNewFolder, boolean allowOverwrite)
            throws ArtifactStoreException {
        return createFiles(stage(), folder, files, expectNewFolder, allowOverwrite);
    }

    /**
     * 在一个尚未提交的树之上继续写入文件，从而让多个文件夹的改动进入同一次提交。
     *
     * <p>步骤：以 onto 为快照；以写时复制方式创建 blob 并重建从目标文件夹到根的每一层 tree；
     * 然后检查当前 head 自快照以来是否发生了变化，以及新树与快照的差异是否仅限于本次写入的文件。
     *
     * @param onto 快照，可以是上一次 createFiles 的结果。
     * @param folder 目标文件夹（相对仓库根目录），缺失的中间文件夹会被创建。
     * @param files 文件名 -> 内容，文件名不能包含 "/"。
     * @param expectNewFolder 为 true 时要求目标文件夹尚不存在。
     * @param allowOverwrite 为 false 时已存在的文件会导致 FILE_EXISTS。
     * @return 新的根树，需要调用 {@link #commit(StagedTree, String)} 才会生效。
     */
    public StagedTree createFiles(
            StagedTree onto, String folder, Map<String, byte[]> files, boolean expectNewFolder, boolean allowOverwrite)
            throws ArtifactStoreException {
        String folderPath = normalize(folder);
        List<String> folderSegments = segments(folderPath);
        if (files.isEmpty()) {
            throw new ArtifactStoreException(Reason.NO_CHANGES, NO_CHANGES);
        }
        for (String fileName : files.keySet()) {
            if (!StringUtils.hasText(fileName) || fileName.contains("/") || fileName.equals("..") || fileName.equals(".")) {
                throw new ArtifactStoreException(Reason.INVALID_PATH, "无效的文件名: " + fileName);
            }
        }

        Optional<Artifact> existing = lookup(onto.tree(), folderPath);
        if (existing.isPresent() && !existing.get().folder()) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "目标不是文件夹: " + folderPath);
        }
        if (expectNewFolder && existing.isPresent()) {
            throw new ArtifactStoreException(Reason.NO_CHANGES, NO_CHANGES);
        }

        try (ObjectInserter inserter = repository().newObjectInserter();
                ObjectReader reader = repository().newObjectReader()) {
            Map<String, ObjectId> blobs = new LinkedHashMap<>();
            for (Map.Entry<String, byte[]> file : files.entrySet()) {
                blobs.put(file.getKey(), inserter.insert(Constants.OBJ_BLOB, file.getValue()));
            }

            ObjectId newTree = rewrite(reader, inserter, onto.tree(), folderSegments, 0, entries -> {
                for (Map.Entry<String, ObjectId> blob : blobs.entrySet()) {
                    TreeEntry current = entries.get(blob.getKey());
                    if (current != null && current.isFolder()) {
                        throw new ArtifactStoreException(Reason.INVALID_PATH, "同名文件夹已存在: " + blob.getKey());
                    }
                    if (current != null && !allowOverwrite) {
                        throw new ArtifactStoreException(Reason.FILE_EXISTS, "File already exists: " + child(folderPath, blob.getKey()));
                    }
                    entries.put(blob.getKey(), new TreeEntry(blob.getKey(), FileMode.REGULAR_FILE, blob.getValue()));
                }
            });
            inserter.flush();

            Set<String> expected = files.keySet().stream().map(name -> child(folderPath, name)).collect(Collectors.toSet());
            verify(reader, onto, newTree, expected::contains);
            return new StagedTree(onto.baseCommit(), onto.baseTree(), newTree);
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "写入文件夹 " + folderPath + " 失败", e);
        }
    }

    /**
     * 删除一个环境文件夹。
     *
     * @param name 环境文件夹名。
     * @param ownerPath 所有者路径（相对 environments 根目录），必须是 "users/<x>" 或 "groups/<x>"，
     *                  且其下存在名为 name 的文件夹。
     */
    public StagedTree deleteEnvironment(String name, String ownerPath) throws ArtifactStoreException {
        String owner = normalize(ownerPath);
        if (!OWNER_PATH.matcher(owner).matches() || !StringUtils.hasText(name) || name.contains("/")) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "无效的环境路径: " + ownerPath + "/" + name);
        }
        Snapshot head = snapshot();
        String ownerFolder = environmentsFolder(owner);
        Optional<Artifact> parent = lookup(head.tree(), ownerFolder);
        if (parent.isEmpty() || !parent.get().folder()) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "所有者文件夹不存在: " + ownerFolder);
        }
        Optional<Artifact> target = lookup(head.tree(), child(ownerFolder, name));
        if (target.isEmpty() || !target.get().folder()) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "环境文件夹不存在: " + child(ownerFolder, name));
        }

        var onto = new StagedTree(head.commit(), head.tree(), head.tree());
        String prefix = child(ownerFolder, name) + "/";
        try (ObjectInserter inserter = repository().newObjectInserter();
                ObjectReader reader = repository().newObjectReader()) {
            ObjectId newTree = rewrite(reader, inserter, head.tree(), segments(ownerFolder), 0, entries -> entries.remove(name));
            inserter.flush();
            verify(reader, onto, newTree, path -> path.startsWith(prefix));
            return new StagedTree(head.commit(), head.tree(), newTree);
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "删除环境 " + prefix + " 失败", e);
        }
    }

    /**
     * 删除文件夹中的单个文件。文件夹因此变空时一并消失。
     *
     * @throws ArtifactStoreException 文件不存在时为 NOT_FOUND。
     */
    public StagedTree deleteFile(String folder, String fileName) throws ArtifactStoreException {
        String folderPath = normalize(folder);
        List<String> folderSegments = segments(folderPath);
        if (!StringUtils.hasText(fileName) || fileName.contains("/")) {
            throw new ArtifactStoreException(Reason.INVALID_PATH, "无效的文件名: " + fileName);
        }
        String path = child(folderPath, fileName);
        StagedTree onto = stage();
        Optional<Artifact> target = lookup(onto.tree(), path);
        if (target.isEmpty() || target.get().folder()) {
            throw new ArtifactStoreException(Reason.NOT_FOUND, "文件不存在: " + path);
        }

        try (ObjectInserter inserter = repository().newObjectInserter();
                ObjectReader reader = repository().newObjectReader()) {
            ObjectId newTree = rewrite(reader, inserter, onto.tree(), folderSegments, 0, entries -> entries.remove(fileName));
            inserter.flush();
            verify(reader, onto, newTree, path::equals);
            return new StagedTree(onto.baseCommit(), onto.baseTree(), newTree);
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "删除文件 " + path + " 失败", e);
        }
    }

    /**
     * 自顶向下重建从根到目标文件夹路径上的每一层 tree。未被触及的子树原样复用其对象 id。
     *
     * @return 新 tree 的 id；结果为空文件夹时返回 null（git 中不存在空文件夹）。
     */
    private ObjectId rewrite(
            ObjectReader reader, ObjectInserter inserter, ObjectId treeId, List<String> path, int depth, FolderEdit edit)
            throws IOException, ArtifactStoreException {
        Map<String, TreeEntry> entries = readEntries(reader, treeId);
        if (depth == path.size()) {
            edit.apply(entries);
        } else {
            String segment = path.get(depth);
            TreeEntry current = entries.get(segment);
            if (current != null && !current.isFolder()) {
                throw new ArtifactStoreException(Reason.INVALID_PATH, "路径中包含文件: " + String.join("/", path.subList(0, depth + 1)));
            }
            ObjectId rewritten = rewrite(reader, inserter, current == null ? null : current.id(), path, depth + 1, edit);
            if (rewritten == null) {
                entries.remove(segment);
            } else {
                entries.put(segment, new TreeEntry(segment, FileMode.TREE, rewritten));
            }
        }
        if (entries.isEmpty() && depth > 0) {
            return null;
        }
        var formatter = new TreeFormatter();
        entries.values().stream().sorted(GIT_ORDER).forEach(e -> formatter.append(e.name(), e.mode(), e.id()));
        return inserter.insert(formatter);
    }

    /**
     * 写入前的检查：head 自快照以来不能有任何改动；新树相对快照的改动必须全部在预期范围内。
     */
    private void verify(ObjectReader reader, StagedTree onto, ObjectId newTree, Predicate<String> expected)
            throws IOException, ArtifactStoreException {
        Snapshot current = snapshot();
        if (!current.commit().equals(onto.baseCommit()) && !diff(reader, onto.baseTree(), current.tree()).isEmpty()) {
            LOGGER.warn("快照 {} 之后分支已被移动到 {}，放弃本次写入", onto.baseCommit().name(), current.commit().name());
            throw new ArtifactStoreException(Reason.CONCURRENT_MODIFICATION, TOO_MANY_CHANGES);
        }
        List<String> changed = diff(reader, onto.tree(), newTree);
        if (changed.isEmpty()) {
            throw new ArtifactStoreException(Reason.NO_CHANGES, NO_CHANGES);
        }
        List<String> unexpected = changed.stream().filter(expected.negate()).toList();
        if (!unexpected.isEmpty()) {
            LOGGER.warn("新树包含预期之外的改动: {}", unexpected);
            throw new ArtifactStoreException(Reason.CONCURRENT_MODIFICATION, TOO_MANY_CHANGES);
        }
    }

    private static List<String> diff(ObjectReader reader, ObjectId from, ObjectId to) throws IOException {
        if (from == null ? to == null : from.equals(to)) {
            return List.of();
        }
        var changed = new ArrayList<String>();
        try (TreeWalk walk = new TreeWalk(reader)) {
            walk.setRecursive(true);
            if (from == null) {
                walk.addTree(new EmptyTreeIterator());
            } else {
                walk.addTree(from);
            }
            if (to == null) {
                walk.addTree(new EmptyTreeIterator());
            } else {
                walk.addTree(to);
            }
            walk.setFilter(TreeFilter.ANY_DIFF);
            while (walk.next()) {
                changed.add(walk.getPathString());
            }
        }
        return changed;
    }

    // --- 提交 / 同步 ---

    /**
     * 在当前分支上创建一个提交，父提交为快照时的 head。
     * 分支引用以快照 head 作为期望旧值原子更新；分支已被其他写入方移动时抛出 CONCURRENT_MODIFICATION。
     *
     * @return 新提交的 id。
     */
    public ObjectId commit(StagedTree staged, String message) throws ArtifactStoreException {
        Repository repo = repository();
        Snapshot head = snapshot();
        if (!head.commit().equals(staged.baseCommit())) {
            LOGGER.warn("提交 '{}' 时分支已从 {} 移动到 {}", message, staged.baseCommit().name(), head.commit().name());
            throw new ArtifactStoreException(Reason.CONCURRENT_MODIFICATION, TOO_MANY_CHANGES);
        }
        if (staged.tree().equals(head.tree())) {
            throw new ArtifactStoreException(Reason.NOTHING_TO_COMMIT, "nothing to commit");
        }

        var repo0 = settings.getArtifacts().getRepo();
        var ident = new PersonIdent(repo0.getAuthor(), repo0.getEmail());
        var builder = new CommitBuilder();
        builder.setTreeId(staged.tree());
        if (!ObjectId.zeroId().equals(head.commit())) {
            builder.setParentId(head.commit());
        }
        builder.setAuthor(ident);
        builder.setCommitter(ident);
        builder.setMessage(message);

        try (ObjectInserter inserter = repo.newObjectInserter()) {
            ObjectId commitId = inserter.insert(builder);
            inserter.flush();

            RefUpdate update = repo.updateRef(branchRef);
            update.setNewObjectId(commitId);
            update.setExpectedOldObjectId(head.commit());
            update.setRefLogMessage("commit: " + message, false);
            RefUpdate.Result result = update.update();
            switch (result) {
                case NEW, FAST_FORWARD -> {
                    LOGGER.info("已提交 '{}': {}", message, commitId.name());
                    return commitId;
                }
                case LOCK_FAILURE, REJECTED, REJECTED_CURRENT_BRANCH -> {
                    LOGGER.warn("提交 '{}' 时更新分支失败: {}", message, result);
                    throw new ArtifactStoreException(Reason.CONCURRENT_MODIFICATION, TOO_MANY_CHANGES);
                }
                default -> throw new ArtifactStoreException(Reason.IO_FAILURE, "更新分支失败: " + result);
            }
        } catch (IOException e) {
            throw new ArtifactStoreException(Reason.IO_FAILURE, "提交 '" + message + "' 失败", e);
        }
    }

    /**
     * 将本地分支推送到远程同名分支。从不强制推送；非快进时抛出 PUSH_REJECTED，由调用方重新同步后重试。
     */
    public void push() throws ArtifactStoreException {
        Repository repo = repository();
        pushLock.lock();
        try {
            Iterable<PushResult> results = Git.wrap(repo).push()
                    .setRemote(REMOTE)
                    .setRefSpecs(new RefSpec(branchRef + ":" + branchRef))
                    .setCredentialsProvider(credentials())
                    .setTimeout(settings.getArtifacts().getTransportTimeoutSeconds())
                    .call();
            for (PushResult result : results) {
                for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                    switch (update.getStatus()) {
                        case OK, UP_TO_DATE -> LOGGER.info("已推送 {} -> {}", branchRef, update.getNewObjectId().name());
                        default -> {
                            LOGGER.warn("推送 {} 被拒绝: {} {}", branchRef, update.getStatus(), update.getMessage());
                            throw new ArtifactStoreException(Reason.PUSH_REJECTED, "push rejected: " + update.getStatus());
                        }
                    }
                }
            }
        } catch (GitAPIException e) {
            LOGGER.error("推送 {} 失败", branchRef, e);
            throw new ArtifactStoreException(Reason.IO_FAILURE, "推送失败: " + e.getMessage(), e);
        } finally {
            pushLock.unlock();
        }
    }

    /**
     * 抓取远程分支，并把本地分支强制重置到远程 head，丢弃尚未推送的本地提交。
     * 推送被拒绝后调用，随后调用方从新的 head 重新读取并重做自己的改动。
     */
    public void resetToRemote() throws ArtifactStoreException {
        Repository repo = repository();
        pushLock.lock();
        try {
            Git.wrap(repo).fetch()
                    .setRemote(REMOTE)
                    .setRefSpecs(new RefSpec("+" + branchRef + ":" + trackingRef))
                    .setCredentialsProvider(credentials())
                    .setTimeout(settings.getArtifacts().getTransportTimeoutSeconds())
                    .call();
            Ref tracking = repo.exactRef(trackingRef);
            if (tracking == null) {
                throw new ArtifactStoreException(Reason.NOT_FOUND, "远程分支不存在: " + trackingRef);
            }
            RefUpdate update = repo.updateRef(branchRef);
            update.setNewObjectId(tracking.getObjectId());
            update.setRefLogMessage("reset to " + trackingRef, false);
            RefUpdate.Result result = update.forceUpdate();
            LOGGER.info("已将 {} 重置到远程 {}: {}", branchRef, tracking.getObjectId().name(), result);
        } catch (GitAPIException | IOException e) {
            LOGGER.error("从远程同步 {} 失败", branchRef, e);
            throw new ArtifactStoreException(Reason.IO_FAILURE, "同步远程分支失败: " + e.getMessage(), e);
        } finally {
            pushLock.unlock();
        }
    }
}
