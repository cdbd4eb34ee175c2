package com.albumsocial.domain.controller;

import com.albumsocial.auth.web.AuthContext;
import com.albumsocial.common.api.Result;
import com.albumsocial.domain.dto.UserProfileDto;
import com.albumsocial.domain.service.UserService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    public record UpdateProfileRequest(String displayName, String bio, String avatarUrl) {
    }

    @GetMapping("/me")
    public Result<UserProfileDto> me() {
        long me = AuthContext.requireUserId();
        return Result.ok(userService.getProfile(me));
    }

    @PutMapping("/me")
    public Result<UserProfileDto> updateMe(@RequestBody UpdateProfileRequest req) {
        long me = AuthContext.requireUserId();
        if (req == null) {
            return Result.ok(userService.getProfile(me));
        }
        return Result.ok(userService.updateProfile(me, req.displayName(), req.bio(), req.avatarUrl()));
    }

    @GetMapping("/search")
    public Result<List<UserProfileDto>> search(@RequestParam("q") String q,
                                               @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return Result.ok(userService.search(q, limit));
    }

    @GetMapping("/{userId}")
    public Result<UserProfileDto> get(@PathVariable("userId") long userId) {
        return Result.ok(userService.getProfile(userId));
    }
}
