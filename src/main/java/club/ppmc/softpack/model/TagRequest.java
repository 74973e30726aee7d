package club.ppmc.softpack.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TagRequest(@NotBlank String path, @NotBlank String name, @NotNull String tag) {}
