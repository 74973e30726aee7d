/**
 * SoftpackSettings.java
 *
 * 该文件定义了一个POJO，用于表示服务的全部配置项。
 * 它由 Spring 从 application.properties 中以 "softpack." 为前缀绑定，并通过构造函数注入到各个服务，
 * 不存在任何全局单例。测试中可以直接 new 出来并手动赋值。
 */
package club.ppmc.softpack.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "softpack")
public class SoftpackSettings {

    private Artifacts artifacts = new Artifacts();
    private Builder builder = new Builder();
    private Spack spack = new Spack();
    private Groups groups = new Groups();
    private Environments environments = new Environments();
    private Email recipes = new Email();

    // --- 制品仓库 ---
    @Data
    public static class Artifacts {
        /** 本地裸仓库所在目录。不存在时会从 repo.url 克隆。 */
        private String path = "./artifacts";

        private Repo repo = new Repo();

        /** 遇到并发修改或推送被拒绝时，整个 读取-构建-提交-推送 流程的最大尝试次数。 */
        private int retries = 3;

        /** 推送、抓取的网络超时（秒）。 */
        private int transportTimeoutSeconds = 60;
    }

    @Data
    public static class Repo {
        private String url;
        private String username;
        /** 具有写权限的访问令牌。 */
        private String writer;
        private String author = "softpack";
        private String email = "softpack@example.com";
        private String branch = "main";
    }

    // --- 构建服务 ---
    @Data
    public static class Builder {
        private String host = "0.0.0.0";
        private int port = 7080;
        private int connectTimeoutMillis = 5000;
        private int readTimeoutMillis = 30000;
        /** 创建环境时等待构建请求发送结果的最长时间。 */
        private int dispatchWaitMillis = 35000;
    }

    // --- spack 包目录 ---
    @Data
    public static class Spack {
        private String bin = "spack";
        /** 自定义 spack 包仓库的 git 地址，为空则只使用 spack 自带的仓库。 */
        private String repo = "";
        /** 原始包列表的磁盘缓存目录，为空则不缓存。 */
        private String cache = "";
        /** 后台刷新的间隔（秒），0 表示关闭自动刷新。 */
        private long updateIntervalSeconds = 0;
        private int commandTimeoutSeconds = 600;
    }

    // --- 用户组 ---
    @Data
    public static class Groups {
        /** 只有匹配该正则的组才会被返回。 */
        private String pattern = ".*";
        private int retries = 3;
        private long backoffMillis = 1000;
        /** 静态的 用户名 -> 组 对照表，用作目录服务的默认实现。 */
        private Map<String, List<String>> members = new HashMap<>();
    }

    @Data
    public static class Environments {
        private Email email = new Email();
    }

    @Data
    public static class Email {
        private String fromAddr;
        private String toAddr;
        private String adminAddr;
        private String smtp;
        private String localHostname;
    }
}
