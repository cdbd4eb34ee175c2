package com.albumsocial.domain.dto;

/**
 * 动态发生时的内容快照。rating 类型只有 rating，review 类型只有 content。
 */
public record ActivityPayload(Integer rating, String content) {

    public static ActivityPayload ofRating(int rating) {
        return new ActivityPayload(rating, null);
    }

    public static ActivityPayload ofReview(String content) {
        return new ActivityPayload(null, content);
    }
}
