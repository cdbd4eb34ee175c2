package com.albumsocial.domain.dto;

import com.albumsocial.domain.entity.AlbumEntity;

public record AlbumDto(Long id, String title, String artist, String coverUrl) {

    public static AlbumDto from(AlbumEntity a) {
        if (a == null) {
            return null;
        }
        return new AlbumDto(a.getId(), a.getTitle(), a.getArtist(), a.getCoverUrl());
    }
}
