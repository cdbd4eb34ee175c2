package com.albumsocial.integration;

import com.albumsocial.auth.config.AuthProperties;
import com.albumsocial.auth.service.AccessTokens;
import com.albumsocial.auth.service.SessionVersionStore;
import com.albumsocial.common.api.ApiCodes;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.domain.entity.AlbumEntity;
import com.albumsocial.domain.mapper.AlbumMapper;
import com.albumsocial.domain.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP 层：鉴权拦截、错误码映射、注销后 token 失效。
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AccountApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private UserService userService;
    @Autowired
    private AuthProperties authProperties;
    @Autowired
    private SessionVersionStore sessionVersionStore;
    @Autowired
    private AlbumMapper albumMapper;

    private long userId;
    private String bearer;

    @BeforeEach
    void setUp() {
        String name = "api_" + UUID.randomUUID().toString().substring(0, 8);
        userId = userService.create(name, name + "@example.com", "hash", null).id();
        bearer = "Bearer " + AccessTokens.issue(authProperties, userId, sessionVersionStore.current(userId));
    }

    @Test
    void writeWithoutToken_ShouldBeUnauthorized() throws Exception {
        mockMvc.perform(delete("/account"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.code").value(ApiCodes.UNAUTHORIZED));
    }

    @Test
    void garbageToken_ShouldBeRejectedByInterceptor() throws Exception {
        mockMvc.perform(get("/users/me").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("unauthorized"));
    }

    @Test
    void selfFollow_ShouldMapToBadRequest() throws Exception {
        mockMvc.perform(post("/social/follow/" + userId).header("Authorization", bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ApiCodes.SELF_FOLLOW))
                .andExpect(jsonPath("$.message").value("Users cannot follow themselves"));
    }

    @Test
    void fractionalRating_ShouldMapToBadRequest() throws Exception {
        AlbumEntity album = AlbumEntity.builder().title("t").artist("a").createdAt(DbTime.now()).build();
        albumMapper.insert(album);

        mockMvc.perform(put("/ratings/albums/" + album.getId())
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":4.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Rating must be an integer between 1 and 5"));

        mockMvc.perform(put("/ratings/albums/" + album.getId())
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rating").value(4))
                .andExpect(jsonPath("$.data.albumId").value(String.valueOf(album.getId())));
    }

    @Test
    void unknownAlbum_ShouldMapToNotFound() throws Exception {
        mockMvc.perform(put("/ratings/albums/123")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":3}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Album not found"));
    }

    @Test
    void deleteAccount_ShouldReturnAuditAndInvalidateToken() throws Exception {
        mockMvc.perform(delete("/account").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.userId").value(String.valueOf(userId)))
                .andExpect(jsonPath("$.data.ratingsCount").value(0));

        mockMvc.perform(get("/users/me").header("Authorization", bearer))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("session_invalid"));
    }
}
