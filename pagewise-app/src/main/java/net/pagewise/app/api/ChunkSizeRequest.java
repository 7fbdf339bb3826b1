package net.pagewise.app.api;

import jakarta.validation.constraints.NotNull;

public record ChunkSizeRequest(@NotNull Integer chunkSize) {}
