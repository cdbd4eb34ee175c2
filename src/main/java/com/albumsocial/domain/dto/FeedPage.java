package com.albumsocial.domain.dto;

import com.albumsocial.common.page.Pagination;

import java.util.List;

public record FeedPage(List<ActivityDto> activities, Pagination pagination) {
}
