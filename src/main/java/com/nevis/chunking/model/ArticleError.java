package com.nevis.chunking.model;

import java.util.UUID;

public record ArticleError(UUID articleId, ErrorKind kind, String message) {
}
