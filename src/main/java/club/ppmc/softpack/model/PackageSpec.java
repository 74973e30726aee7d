/**
 * PackageSpec.java
 *
 * 清单中的一个包请求。在清单文件里写作 "name" 或 "name@version"，版本是可选的，名称必须存在。
 * 以 "*" 开头的名称指向一个尚未加入包目录的请求中的配方。
 */
package club.ppmc.softpack.model;

import org.springframework.util.StringUtils;

public record PackageSpec(String name, String version) {

    public PackageSpec {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("包名不能为空。");
        }
        if (version != null && version.isBlank()) {
            version = null;
        }
    }

    public static final String REQUESTED_RECIPE_PREFIX = "*";

    public static PackageSpec of(String name) {
        return new PackageSpec(name, null);
    }

    /** 指向请求中的配方的包，例如 "*a_recipe@1.2"。 */
    public static PackageSpec requestedRecipe(String name, String version) {
        return new PackageSpec(REQUESTED_RECIPE_PREFIX + name, version);
    }

    /** 解析 "name@version"。只按第一个 "@" 切分。 */
    public static PackageSpec parse(String entry) {
        if (entry == null) {
            throw new IllegalArgumentException("包条目不能为空。");
        }
        int at = entry.indexOf('@');
        if (at < 0) {
            return new PackageSpec(entry.trim(), null);
        }
        return new PackageSpec(entry.substring(0, at).trim(), entry.substring(at + 1).trim());
    }

    public boolean isRequestedRecipe() {
        return name.startsWith(REQUESTED_RECIPE_PREFIX);
    }

    public String toManifestEntry() {
        return version == null ? name : name + "@" + version;
    }
}
