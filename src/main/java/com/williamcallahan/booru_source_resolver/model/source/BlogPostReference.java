package com.williamcallahan.booru_source_resolver.model.source;

import lombok.Builder;
import lombok.Getter;

/**
 * Identifies the root post a draft repost is parented to, and which media of it is wanted.
 */
@Getter
@Builder
public class BlogPostReference {
    private final String blogName;
    private final String blogUuid;
    private final String postId;
    private final String reblogKey;
    private final int mediaIndex;
}
