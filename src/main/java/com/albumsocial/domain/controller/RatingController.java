package com.albumsocial.domain.controller;

import com.albumsocial.auth.web.AuthContext;
import com.albumsocial.common.api.Result;
import com.albumsocial.common.error.NotFoundException;
import com.albumsocial.domain.dto.AlbumStatsDto;
import com.albumsocial.domain.dto.RatingDto;
import com.albumsocial.domain.service.RatingService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/ratings")
public class RatingController {

    private final RatingService ratingService;

    public RatingController(RatingService ratingService) {
        this.ratingService = ratingService;
    }

    /**
     * rating 用 Number 接收，4.5 这类非整数交给 service 统一报错。
     */
    public record RatingRequest(Number rating) {
    }

    @PutMapping("/albums/{albumId}")
    public Result<RatingDto> upsert(@PathVariable("albumId") long albumId, @RequestBody RatingRequest req) {
        long me = AuthContext.requireUserId();
        return Result.ok(ratingService.upsert(me, albumId, req == null ? null : req.rating()));
    }

    @PostMapping("/albums/{albumId}")
    public Result<RatingDto> create(@PathVariable("albumId") long albumId, @RequestBody RatingRequest req) {
        long me = AuthContext.requireUserId();
        return Result.ok(ratingService.create(me, albumId, req == null ? null : req.rating()));
    }

    @GetMapping("/albums/{albumId}")
    public Result<List<RatingDto>> byAlbum(@PathVariable("albumId") long albumId) {
        return Result.ok(ratingService.findByAlbum(albumId));
    }

    @GetMapping("/albums/{albumId}/stats")
    public Result<AlbumStatsDto> stats(@PathVariable("albumId") long albumId) {
        return Result.ok(ratingService.getStats(albumId));
    }

    @GetMapping("/albums/{albumId}/mine")
    public Result<RatingDto> mine(@PathVariable("albumId") long albumId) {
        long me = AuthContext.requireUserId();
        return Result.ok(ratingService.findByUserAndAlbum(me, albumId)
                .orElseThrow(() -> new NotFoundException("Rating not found")));
    }

    @DeleteMapping("/albums/{albumId}")
    public Result<Void> deleteMine(@PathVariable("albumId") long albumId) {
        long me = AuthContext.requireUserId();
        ratingService.delete(me, albumId);
        return Result.okVoid();
    }

    @GetMapping("/users/{userId}")
    public Result<List<RatingDto>> byUser(@PathVariable("userId") long userId) {
        return Result.ok(ratingService.findByUser(userId));
    }

    @GetMapping("/{ratingId}")
    public Result<RatingDto> get(@PathVariable("ratingId") long ratingId) {
        return Result.ok(ratingService.findById(ratingId)
                .orElseThrow(() -> new NotFoundException("Rating not found")));
    }

    @DeleteMapping("/{ratingId}")
    public Result<Void> delete(@PathVariable("ratingId") long ratingId) {
        long me = AuthContext.requireUserId();
        ratingService.deleteById(me, ratingId);
        return Result.okVoid();
    }
}
