/**
 * RecipeRequest.java
 *
 * 用户请求加入包目录的新配方。每个请求以 YAML 保存在制品仓库的 requested-recipes 文件夹中。
 *
 * @param name 配方名称。
 * @param version 配方版本。
 * @param description 配方描述。
 * @param url 软件主页或源码地址。
 * @param username 请求者，可以为空字符串。
 */
package club.ppmc.softpack.model;

public record RecipeRequest(String name, String version, String description, String url, String username) {

    public String fileName() {
        return name + "@" + version + ".yml";
    }
}
