/**
 * EnvironmentFiles.java
 *
 * 制品仓库中约定的目录名和文件名。构建服务上传的文件按这些固定名称驱动状态迁移。
 */
package club.ppmc.softpack.model;

public final class EnvironmentFiles {

    public static final String ENVIRONMENTS_ROOT = "environments";
    public static final String USERS_FOLDER = "users";
    public static final String GROUPS_FOLDER = "groups";
    /** 请求中的配方，每个请求一个 "name@version.yml" 文件。 */
    public static final String REQUESTED_RECIPES_ROOT = "requested-recipes";

    /** 清单：description + packages。 */
    public static final String MANIFEST = "softpack.yml";
    /** 元数据：tags、force_hidden 以及可选的请求者用户名。 */
    public static final String METADATA = "meta.yml";
    /** 由本系统调度构建的标记，创建时即写入，表示已排队。 */
    public static final String BUILT_BY_SOFTPACK = ".built_by_softpack";
    /** 构建服务的输出，非空即表示构建失败。 */
    public static final String BUILDER_OUT = "builder.out";
    /** 模块加载文件，构建成功后由构建服务上传；模块环境中它同时是原始模块文件的副本。 */
    public static final String MODULE = "module";
    /** 记录具体版本的锁文件。 */
    public static final String SPACK_LOCK = "spack.lock";
    public static final String README = "README.md";
    /** 由模块文件生成的来源标记。 */
    public static final String GENERATED_FROM_MODULE = ".generated_from_module";
    /** 所有者文件夹中记录每个名称已分配过的最大后缀。 */
    public static final String SUFFIXES = ".suffixes.yml";

    private EnvironmentFiles() {}
}
