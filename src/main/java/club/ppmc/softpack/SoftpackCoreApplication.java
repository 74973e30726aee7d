/**
 * SoftpackCoreApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序。制品仓库在 ArtifactStore 初始化时打开（或克隆），
 * spack 包目录的后台刷新由 PackageCatalogService 按配置自行调度。
 */
package club.ppmc.softpack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SoftpackCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(SoftpackCoreApplication.class, args);
    }
}
