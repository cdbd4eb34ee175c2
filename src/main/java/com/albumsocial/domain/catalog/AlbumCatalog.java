package com.albumsocial.domain.catalog;

/**
 * 专辑目录。评分/评论写入前只用它确认 albumId 有效。
 */
public interface AlbumCatalog {

    boolean itemExists(long albumId);
}
