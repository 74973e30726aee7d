/**
 * Environment.java
 *
 * 环境领域对象，由 EnvironmentService 从制品仓库中的一个环境文件夹解析得到。
 * 状态 (state) 不被存储，而是根据文件夹中标记文件的存在与否推导。
 */
package club.ppmc.softpack.model;

import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Environment {

    /** 环境文件夹 tree 对象的 id。 */
    private String id;

    /** 文件夹名，包含 "-N" 后缀。 */
    private String name;

    /** 所有者路径，例如 "users/alice"。 */
    private String path;

    private String description;
    private List<PackageSpec> packages;
    private EnvironmentState state;
    private EnvironmentType type;
    private List<String> tags;
    private boolean hidden;
    private Interpreters interpreters;

    /** 仅当 state 为 FAILED 时有值。 */
    private FailureReason failureReason;

    private String readme;
    private String username;

    public String fullPath() {
        return path + "/" + name;
    }
}
