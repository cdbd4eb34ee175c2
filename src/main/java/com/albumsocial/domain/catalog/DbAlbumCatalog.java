package com.albumsocial.domain.catalog;

import com.albumsocial.domain.mapper.AlbumMapper;
import org.springframework.stereotype.Component;

/**
 * 基于本地 t_album 镜像的目录实现。
 */
@Component
public class DbAlbumCatalog implements AlbumCatalog {

    private final AlbumMapper albumMapper;

    public DbAlbumCatalog(AlbumMapper albumMapper) {
        this.albumMapper = albumMapper;
    }

    @Override
    public boolean itemExists(long albumId) {
        return albumId > 0 && albumMapper.countById(albumId) > 0;
    }
}
