package club.ppmc.softpack.service;

import club.ppmc.softpack.config.SoftpackSettings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.TreeFormatter;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.TreeWalk;

/** 测试用的裸仓库：带有一个包含 README.md 的初始提交，分支为 main。 */
final class TestRepositories {

    static final String BRANCH = "main";

    private TestRepositories() {}

    static Path createOrigin(Path dir) throws IOException {
        try (Repository repo = FileRepositoryBuilder.create(dir.toFile())) {
            repo.create(true);
            try (ObjectInserter inserter = repo.newObjectInserter()) {
                ObjectId blob = inserter.insert(Constants.OBJ_BLOB, "softpack artifacts\n".getBytes(StandardCharsets.UTF_8));
                var tree = new TreeFormatter();
                tree.append("README.md", FileMode.REGULAR_FILE, blob);
                ObjectId treeId = inserter.insert(tree);

                var ident = new PersonIdent("test", "test@example.com");
                var commit = new CommitBuilder();
                commit.setTreeId(treeId);
                commit.setAuthor(ident);
                commit.setCommitter(ident);
                commit.setMessage("initial commit");
                ObjectId commitId = inserter.insert(commit);
                inserter.flush();

                RefUpdate update = repo.updateRef(Constants.R_HEADS + BRANCH);
                update.setNewObjectId(commitId);
                update.update();
                repo.updateRef(Constants.HEAD).link(Constants.R_HEADS + BRANCH);
            }
        }
        return dir;
    }

    static SoftpackSettings settings(Path origin, Path local) {
        var settings = new SoftpackSettings();
        settings.getArtifacts().setPath(local.toString());
        settings.getArtifacts().getRepo().setUrl(origin.toUri().toString());
        settings.getArtifacts().getRepo().setBranch(BRANCH);
        settings.getArtifacts().getRepo().setAuthor("tester");
        settings.getArtifacts().getRepo().setEmail("tester@example.com");
        return settings;
    }

    static ArtifactStore openStore(SoftpackSettings settings) {
        var store = new ArtifactStore(settings);
        store.open();
        return store;
    }

    /** 直接从远程裸仓库的 main 分支读取文件。 */
    static Optional<String> readFromOrigin(Path origin, String path) throws IOException {
        try (Repository repo = new FileRepositoryBuilder().setGitDir(origin.toFile()).setMustExist(true).build();
                RevWalk walk = new RevWalk(repo)) {
            Ref ref = repo.exactRef(Constants.R_HEADS + BRANCH);
            ObjectId tree = walk.parseCommit(ref.getObjectId()).getTree().getId();
            try (TreeWalk treeWalk = TreeWalk.forPath(repo, path, tree)) {
                if (treeWalk == null) {
                    return Optional.empty();
                }
                byte[] content = repo.open(treeWalk.getObjectId(0)).getBytes();
                return Optional.of(new String(content, StandardCharsets.UTF_8));
            }
        }
    }

    static ObjectId originHead(Path origin) throws IOException {
        try (Repository repo = new FileRepositoryBuilder().setGitDir(origin.toFile()).setMustExist(true).build()) {
            return repo.exactRef(Constants.R_HEADS + BRANCH).getObjectId();
        }
    }
}
