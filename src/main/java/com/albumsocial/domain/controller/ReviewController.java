package com.albumsocial.domain.controller;

import com.albumsocial.auth.web.AuthContext;
import com.albumsocial.common.api.Result;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.domain.dto.ReviewDto;
import com.albumsocial.domain.service.ReviewService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/reviews")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    public record ReviewRequest(String content) {
    }

    public record ReviewCountResponse(long count) {
    }

    public record ReviewedResponse(boolean reviewed) {
    }

    @PutMapping("/albums/{albumId}")
    public Result<ReviewDto> upsert(@PathVariable("albumId") long albumId, @RequestBody ReviewRequest req) {
        long me = AuthContext.requireUserId();
        return Result.ok(reviewService.upsert(me, albumId, req == null ? null : req.content()));
    }

    @PostMapping("/albums/{albumId}")
    public Result<ReviewDto> create(@PathVariable("albumId") long albumId, @RequestBody ReviewRequest req) {
        long me = AuthContext.requireUserId();
        return Result.ok(reviewService.create(me, albumId, req == null ? null : req.content()));
    }

    @GetMapping("/albums/{albumId}")
    public Result<List<ReviewDto>> byAlbum(@PathVariable("albumId") long albumId) {
        return Result.ok(reviewService.findByAlbum(albumId));
    }

    @GetMapping("/albums/{albumId}/count")
    public Result<ReviewCountResponse> count(@PathVariable("albumId") long albumId) {
        return Result.ok(new ReviewCountResponse(reviewService.getReviewCount(albumId)));
    }

    @GetMapping("/albums/{albumId}/mine")
    public Result<ReviewDto> mine(@PathVariable("albumId") long albumId) {
        long me = AuthContext.requireUserId();
        return Result.ok(reviewService.findByUserAndAlbum(me, albumId)
                .orElseThrow(() -> new NotFoundException("Review not found")));
    }

    @GetMapping("/albums/{albumId}/reviewed")
    public Result<ReviewedResponse> reviewed(@PathVariable("albumId") long albumId) {
        long me = AuthContext.requireUserId();
        return Result.ok(new ReviewedResponse(reviewService.hasUserReviewed(me, albumId)));
    }

    @DeleteMapping("/albums/{albumId}")
    public Result<Void> deleteMine(@PathVariable("albumId") long albumId) {
        long me = AuthContext.requireUserId();
        reviewService.delete(me, albumId);
        return Result.okVoid();
    }

    @GetMapping("/users/{userId}")
    public Result<List<ReviewDto>> byUser(@PathVariable("userId") long userId) {
        return Result.ok(reviewService.findByUser(userId));
    }

    @GetMapping("/{reviewId}")
    public Result<ReviewDto> get(@PathVariable("reviewId") long reviewId) {
        return Result.ok(reviewService.findById(reviewId)
                .orElseThrow(() -> new NotFoundException("Review not found")));
    }

    @PatchMapping("/{reviewId}")
    public Result<ReviewDto> updateContent(@PathVariable("reviewId") long reviewId, @RequestBody ReviewRequest req) {
        long me = AuthContext.requireUserId();
        return Result.ok(reviewService.updateContent(me, reviewId, req == null ? null : req.content()));
    }

    @DeleteMapping("/{reviewId}")
    public Result<Void> delete(@PathVariable("reviewId") long reviewId) {
        long me = AuthContext.requireUserId();
        reviewService.deleteById(me, reviewId);
        return Result.okVoid();
    }
}
