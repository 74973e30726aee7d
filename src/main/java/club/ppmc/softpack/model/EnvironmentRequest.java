/**
 * EnvironmentRequest.java
 *
 * 创建或更新环境的请求体。packages 中每一项为 "name" 或 "name@version"。
 */
package club.ppmc.softpack.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record EnvironmentRequest(
        @NotBlank String name,
        @NotBlank String path,
        @NotNull String description,
        @NotEmpty List<String> packages,
        String username) {

    public EnvironmentInput toInput() {
        return new EnvironmentInput(name, path, description, packages.stream().map(PackageSpec::parse).toList(), username);
    }
}
