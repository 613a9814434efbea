package com.example.changefeed.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Audience context of a comment, attached by the write path to comment
 * change events.
 *
 * @param campaignId            campaign the comment belongs to
 * @param commentAuthorId       author of the comment
 * @param parentCommentAuthorId author of the comment being replied to, {@code null} for top-level comments
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommentContext(
        Long campaignId,
        Long commentAuthorId,
        Long parentCommentAuthorId
) {

    public boolean isReply() {
        return parentCommentAuthorId != null;
    }
}
