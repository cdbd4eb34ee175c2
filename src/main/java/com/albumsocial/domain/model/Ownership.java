package com.albumsocial.domain.model;

import java.util.Optional;

/**
 * 评分/评论/动态的归属：属于某个用户，或者已随账号注销匿名化。
 *
 * <p>数据库里就是一个可空的 user_id 列；读出来之后统一转成这个类型，调用方必须显式处理 ANONYMIZED。</p>
 */
public record Ownership(State state, Long userId) {

    public enum State {
        OWNED,
        ANONYMIZED
    }

    private static final Ownership ANONYMIZED = new Ownership(State.ANONYMIZED, null);

    public Ownership {
        if (state == null) {
            throw new IllegalArgumentException("state is required");
        }
        if (state == State.OWNED && (userId == null || userId <= 0)) {
            throw new IllegalArgumentException("owned requires a positive userId");
        }
        if (state == State.ANONYMIZED && userId != null) {
            throw new IllegalArgumentException("anonymized must not carry a userId");
        }
    }

    public static Ownership owned(long userId) {
        return new Ownership(State.OWNED, userId);
    }

    public static Ownership anonymized() {
        return ANONYMIZED;
    }

    /**
     * 从数据库列值转换：null 即已匿名化。
     */
    public static Ownership of(Long nullableUserId) {
        return nullableUserId == null ? ANONYMIZED : owned(nullableUserId);
    }

    public boolean isAnonymized() {
        return state == State.ANONYMIZED;
    }

    public boolean isOwnedBy(long candidate) {
        return state == State.OWNED && userId == candidate;
    }

    public Optional<Long> owner() {
        return Optional.ofNullable(userId);
    }
}
