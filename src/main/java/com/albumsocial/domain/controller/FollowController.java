package com.albumsocial.domain.controller;

import com.albumsocial.auth.web.AuthContext;
import com.albumsocial.common.api.Result;
import com.albumsocial.domain.dto.FollowDto;
import com.albumsocial.domain.dto.UserProfileDto;
import com.albumsocial.domain.dto.UserProfileWithStats;
import com.albumsocial.domain.service.FollowService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/social")
public class FollowController {

    private final FollowService followService;

    public FollowController(FollowService followService) {
        this.followService = followService;
    }

    @PostMapping("/follow/{userId}")
    public Result<FollowDto> follow(@PathVariable("userId") long userId) {
        long me = AuthContext.requireUserId();
        return Result.ok(followService.follow(me, userId));
    }

    @DeleteMapping("/follow/{userId}")
    public Result<Void> unfollow(@PathVariable("userId") long userId) {
        long me = AuthContext.requireUserId();
        followService.unfollow(me, userId);
        return Result.okVoid();
    }

    public record FollowingStatusResponse(boolean following) {
    }

    @GetMapping("/following/{userId}/status")
    public Result<FollowingStatusResponse> status(@PathVariable("userId") long userId) {
        long me = AuthContext.requireUserId();
        return Result.ok(new FollowingStatusResponse(followService.isFollowing(me, userId)));
    }

    public record FollowingStatusBatchRequest(List<Long> userIds) {
    }

    @PostMapping("/following/status")
    public Result<Map<Long, Boolean>> statusBatch(@RequestBody FollowingStatusBatchRequest req) {
        long me = AuthContext.requireUserId();
        return Result.ok(followService.isFollowingMultiple(me, req == null ? null : req.userIds()));
    }

    @GetMapping("/users/{userId}/followers")
    public Result<List<UserProfileDto>> followers(@PathVariable("userId") long userId) {
        return Result.ok(followService.getFollowers(userId));
    }

    @GetMapping("/users/{userId}/following")
    public Result<List<UserProfileDto>> following(@PathVariable("userId") long userId) {
        return Result.ok(followService.getFollowing(userId));
    }

    @GetMapping("/users/{userId}/mutual")
    public Result<List<UserProfileDto>> mutual(@PathVariable("userId") long userId) {
        return Result.ok(followService.getMutualFollows(userId));
    }

    @GetMapping("/users/{userId}/stats")
    public Result<UserProfileWithStats> stats(@PathVariable("userId") long userId) {
        return Result.ok(followService.getUserProfileWithStats(userId));
    }

    @GetMapping("/suggestions")
    public Result<List<UserProfileDto>> suggestions(@RequestParam(value = "limit", defaultValue = "10") int limit) {
        long me = AuthContext.requireUserId();
        return Result.ok(followService.getFollowSuggestions(me, limit));
    }

    public record CountResponse(long count) {
    }

    @GetMapping("/users/{userId}/followers/count")
    public Result<CountResponse> followerCount(@PathVariable("userId") long userId) {
        return Result.ok(new CountResponse(followService.getFollowerCount(userId)));
    }

    @GetMapping("/users/{userId}/following/count")
    public Result<CountResponse> followingCount(@PathVariable("userId") long userId) {
        return Result.ok(new CountResponse(followService.getFollowingCount(userId)));
    }
}
