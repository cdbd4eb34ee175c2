package com.albumsocial.integration;

import com.albumsocial.common.error.AlreadyFollowingException;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.domain.dto.ActivityDto;
import com.albumsocial.domain.entity.AlbumEntity;
import com.albumsocial.domain.mapper.AlbumMapper;
import com.albumsocial.domain.service.ActivityFeedService;
import com.albumsocial.domain.service.FollowService;
import com.albumsocial.domain.service.RatingService;
import com.albumsocial.domain.service.ReviewService;
import com.albumsocial.domain.service.UserService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 同一自然键上的并发写：唯一键决定胜负，调用方看到的结果必须收敛。
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentWriteIntegrationTest {

    private static final int THREADS = 8;

    @Autowired
    private UserService userService;
    @Autowired
    private FollowService followService;
    @Autowired
    private RatingService ratingService;
    @Autowired
    private ReviewService reviewService;
    @Autowired
    private ActivityFeedService feedService;
    @Autowired
    private AlbumMapper albumMapper;

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void concurrentFollow_ShouldLeaveOneEdgeAndRejectTheRest() throws Exception {
        long a = newUser("fa");
        long b = newUser("fb");

        List<Throwable> outcomes = race(() -> followService.follow(a, b));

        assertThat(outcomes).filteredOn(t -> t == null).hasSize(1);
        assertThat(outcomes).filteredOn(t -> t != null)
                .hasSize(THREADS - 1)
                .allSatisfy(t -> assertThat(t).isInstanceOf(AlreadyFollowingException.class));
        assertThat(followService.getFollowerCount(b)).isEqualTo(1);
        assertThat(followService.isFollowing(a, b)).isTrue();
    }

    @Test
    void concurrentFirstRating_ShouldAllSucceedOnOneRow() throws Exception {
        long u = newUser("ru");
        long x = newAlbum();

        List<Throwable> outcomes = race(() -> ratingService.upsert(u, x, 3));

        assertThat(outcomes).containsOnlyNulls();
        assertThat(ratingService.getCount(x)).isEqualTo(1);
        assertThat(ratingService.findByAlbum(x)).singleElement()
                .satisfies(r -> assertThat(r.rating()).isEqualTo(3));
        assertThat(ratingService.getAverage(x)).isEqualTo(3.0);
        assertThat(feedService.getUserFeed(u, 20, 0)).extracting(ActivityDto::type).containsExactly("rating");
    }

    @Test
    void concurrentFirstReview_ShouldAllSucceedOnOneRow() throws Exception {
        long u = newUser("wu");
        long x = newAlbum();

        List<Throwable> outcomes = race(() -> reviewService.upsert(u, x, "same text"));

        assertThat(outcomes).containsOnlyNulls();
        assertThat(reviewService.getReviewCount(x)).isEqualTo(1);
    }

    /**
     * 所有线程在同一时刻放行，返回每个调用的异常（成功为 null）。
     */
    private List<Throwable> race(Callable<?> call) throws InterruptedException {
        CountDownLatch ready = new CountDownLatch(THREADS);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(pool.submit(() -> {
                ready.countDown();
                go.await();
                return call.call();
            }));
        }
        ready.await(5, TimeUnit.SECONDS);
        go.countDown();

        List<Throwable> out = new ArrayList<>();
        for (Future<?> f : futures) {
            try {
                f.get(30, TimeUnit.SECONDS);
                out.add(null);
            } catch (ExecutionException e) {
                out.add(e.getCause());
            } catch (TimeoutException e) {
                throw new AssertionError("concurrent call did not finish", e);
            }
        }
        return out;
    }

    private long newUser(String prefix) {
        String name = prefix + "_" + UUID.randomUUID().toString().substring(0, 8);
        return userService.create(name, name + "@example.com", "hash", null).id();
    }

    private long newAlbum() {
        AlbumEntity album = AlbumEntity.builder()
                .title("album-" + UUID.randomUUID())
                .artist("artist")
                .createdAt(DbTime.now())
                .build();
        albumMapper.insert(album);
        return album.getId();
    }
}
