/**
 * EnvironmentInput.java
 *
 * 创建或更新环境时由调用方提供的数据。它是一个不可变的记录。
 *
 * @param name 环境名称（不含 "-N" 后缀）。
 * @param path 所有者路径，"users/<用户>" 或 "groups/<组>"。
 * @param description 环境描述。
 * @param packages 请求的包。
 * @param username (可选) 请求者，构建结束后会收到通知。
 */
package club.ppmc.softpack.model;

import java.util.List;

public record EnvironmentInput(
        String name, String path, String description, List<PackageSpec> packages, String username) {

    public EnvironmentInput(String name, String path, String description, List<PackageSpec> packages) {
        this(name, path, description, packages, null);
    }

    public EnvironmentInput withName(String newName) {
        return new EnvironmentInput(newName, path, description, packages, username);
    }

    /** 用 "path/name" 形式的环境路径构造一个占位输入，供构建服务上传未知环境时使用。 */
    public static EnvironmentInput fromPath(String environmentPath) {
        int lastSlash = environmentPath.lastIndexOf('/');
        String path = lastSlash < 0 ? "" : environmentPath.substring(0, lastSlash);
        String name = environmentPath.substring(lastSlash + 1);
        return new EnvironmentInput(name, path, "not yet implemented", List.of(PackageSpec.of("from_path")));
    }
}
