package club.ppmc.softpack.model;

import jakarta.validation.constraints.NotBlank;

public record HiddenRequest(@NotBlank String path, @NotBlank String name, boolean hidden) {}
