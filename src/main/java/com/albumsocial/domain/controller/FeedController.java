package com.albumsocial.domain.controller;

import com.albumsocial.auth.web.AuthContext;
import com.albumsocial.common.api.Result;
import com.albumsocial.common.page.PageQuery;
import com.albumsocial.domain.dto.ActivityDto;
import com.albumsocial.domain.dto.FeedPage;
import com.albumsocial.domain.service.ActivityFeedService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/feed")
public class FeedController {

    private static final String DEFAULT_LIMIT = "" + PageQuery.DEFAULT_LIMIT;

    private final ActivityFeedService feedService;

    public FeedController(ActivityFeedService feedService) {
        this.feedService = feedService;
    }

    /**
     * 我关注的人的动态，带总数。
     */
    @GetMapping
    public Result<FeedPage> feed(@RequestParam(value = "page", defaultValue = "1") int page,
                                 @RequestParam(value = "limit", defaultValue = DEFAULT_LIMIT) int limit) {
        long me = AuthContext.requireUserId();
        return Result.ok(feedService.getFeedWithPagination(me, page, limit));
    }

    @GetMapping("/list")
    public Result<List<ActivityDto>> feedList(@RequestParam(value = "limit", defaultValue = DEFAULT_LIMIT) int limit,
                                              @RequestParam(value = "offset", defaultValue = "0") int offset) {
        long me = AuthContext.requireUserId();
        return Result.ok(feedService.getFeed(me, limit, offset));
    }

    @GetMapping("/users/{userId}")
    public Result<FeedPage> userActivities(@PathVariable("userId") long userId,
                                           @RequestParam(value = "page", defaultValue = "1") int page,
                                           @RequestParam(value = "limit", defaultValue = DEFAULT_LIMIT) int limit) {
        return Result.ok(feedService.getUserActivitiesWithPagination(userId, page, limit));
    }

    @GetMapping("/users/{userId}/list")
    public Result<List<ActivityDto>> userFeed(@PathVariable("userId") long userId,
                                              @RequestParam(value = "limit", defaultValue = DEFAULT_LIMIT) int limit,
                                              @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return Result.ok(feedService.getUserFeed(userId, limit, offset));
    }

    public record ActivitySummaryResponse(long count, boolean hasActivities) {
    }

    @GetMapping("/users/{userId}/summary")
    public Result<ActivitySummaryResponse> summary(@PathVariable("userId") long userId) {
        return Result.ok(new ActivitySummaryResponse(
                feedService.getUserActivityCount(userId),
                feedService.hasUserActivities(userId)));
    }

    /**
     * 全站动态，type 可选 rating / review。
     */
    @GetMapping("/recent")
    public Result<List<ActivityDto>> recent(@RequestParam(value = "type", required = false) String type,
                                            @RequestParam(value = "limit", defaultValue = DEFAULT_LIMIT) int limit,
                                            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        if (type == null) {
            return Result.ok(feedService.getRecentActivities(limit, offset));
        }
        return Result.ok(feedService.getActivitiesByType(type, limit, offset));
    }
}
