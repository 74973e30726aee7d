package club.ppmc.softpack.model;

import jakarta.validation.constraints.NotNull;

/** 用目录中已有的 name@version 完成一个配方请求 requestedName@requestedVersion。 */
public record FulfilRecipeRequest(
        @NotNull String name, @NotNull String version, @NotNull String requestedName, @NotNull String requestedVersion) {}
