package com.albumsocial.domain.service.impl;

import com.albumsocial.auth.service.SessionVersionStore;
import com.albumsocial.common.error.AccountNotFoundException;
import com.albumsocial.common.error.DeletionFailedException;
import com.albumsocial.common.time.DbTime;
import com.albumsocial.common.tx.UnitOfWork;
import com.albumsocial.domain.cache.FollowingIdsCache;
import com.albumsocial.domain.dto.DeletionAuditDto;
import com.albumsocial.domain.entity.AccountDeletionAuditEntity;
import com.albumsocial.domain.mapper.AccountDeletionAuditMapper;
import com.albumsocial.domain.mapper.FollowMapper;
import com.albumsocial.domain.mapper.RatingMapper;
import com.albumsocial.domain.mapper.ReviewMapper;
import com.albumsocial.domain.mapper.UserMapper;
import com.albumsocial.domain.service.AccountDeletionService;
import com.albumsocial.domain.service.ActivityLogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 账号注销。
 *
 * <p>六个步骤放在同一个 UnitOfWork 里提交：</p>
 * <ol>
 *   <li>audit：按变更前的数据统计评分/评论/关注边数，写审计记录</li>
 *   <li>invalidate-sessions：bump 会话版本（best-effort，失败只记日志；不在数据库事务内，回滚不会恢复）</li>
 *   <li>anonymize-content：评分、评论 user_id 置空，均值与条数不变</li>
 *   <li>anonymize-activities：动态 user_id 置空，其他人的 feed 历史保留</li>
 *   <li>delete-follows：删除该用户作为关注者或被关注者的所有边</li>
 *   <li>delete-user：删除用户行，影响 0 行则整体回滚并报 AccountNotFound</li>
 * </ol>
 */
@Slf4j
@Service
public class AccountDeletionServiceImpl implements AccountDeletionService {

    private final UserMapper userMapper;
    private final RatingMapper ratingMapper;
    private final ReviewMapper reviewMapper;
    private final FollowMapper followMapper;
    private final AccountDeletionAuditMapper auditMapper;
    private final ActivityLogService activityLogService;
    private final SessionVersionStore sessionVersionStore;
    private final FollowingIdsCache followingIdsCache;
    private final TransactionTemplate transactionTemplate;

    public AccountDeletionServiceImpl(
            UserMapper userMapper,
            RatingMapper ratingMapper,
            ReviewMapper reviewMapper,
            FollowMapper followMapper,
            AccountDeletionAuditMapper auditMapper,
            ActivityLogService activityLogService,
            SessionVersionStore sessionVersionStore,
            FollowingIdsCache followingIdsCache,
            @Qualifier("unitOfWorkTransactionTemplate") TransactionTemplate transactionTemplate
    ) {
        this.userMapper = userMapper;
        this.ratingMapper = ratingMapper;
        this.reviewMapper = reviewMapper;
        this.followMapper = followMapper;
        this.auditMapper = auditMapper;
        this.activityLogService = activityLogService;
        this.sessionVersionStore = sessionVersionStore;
        this.followingIdsCache = followingIdsCache;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public DeletionAuditDto deleteAccount(long userId) {
        AtomicReference<AccountDeletionAuditEntity> audit = new AtomicReference<>();
        List<Long> affectedFollowers = new ArrayList<>();

        UnitOfWork work = UnitOfWork.named("account-deletion")
                .step("audit", () -> audit.set(writeAudit(userId)))
                .bestEffortStep("invalidate-sessions", () -> sessionVersionStore.invalidateAll(userId))
                .step("anonymize-content", () -> {
                    int ratings = ratingMapper.anonymizeByUser(userId);
                    int reviews = reviewMapper.anonymizeByUser(userId);
                    log.debug("content anonymized: userId={}, ratings={}, reviews={}", userId, ratings, reviews);
                })
                .step("anonymize-activities", () -> activityLogService.anonymizeByUser(userId))
                .step("delete-follows", () -> {
                    affectedFollowers.addAll(followMapper.selectFollowerIds(userId));
                    followMapper.deleteByUser(userId);
                })
                .step("delete-user", () -> {
                    if (userMapper.deleteById(userId) == 0) {
                        throw new AccountNotFoundException(userId);
                    }
                });

        try {
            work.commit(transactionTemplate);
        } catch (AccountNotFoundException e) {
            log.info("account deletion rejected, user not found: userId={}", userId);
            throw e;
        } catch (RuntimeException e) {
            log.error("account deletion failed, rolled back: userId={}", userId, e);
            throw new DeletionFailedException(userId, e);
        }

        // 关注他的人的 feed 来源集合也变了
        List<Long> evict = new ArrayList<>(affectedFollowers);
        evict.add(userId);
        followingIdsCache.evictAfterCommit(evict);

        AccountDeletionAuditEntity a = audit.get();
        log.info("account deleted: userId={}, ratings={}, reviews={}, follows={}",
                userId, a.getRatingsCount(), a.getReviewsCount(), a.getFollowsCount());
        return DeletionAuditDto.from(a);
    }

    private AccountDeletionAuditEntity writeAudit(long userId) {
        AccountDeletionAuditEntity a = AccountDeletionAuditEntity.builder()
                .userId(userId)
                .deletedAt(DbTime.now())
                .ratingsCount(Math.toIntExact(ratingMapper.countByUser(userId)))
                .reviewsCount(Math.toIntExact(reviewMapper.countByUser(userId)))
                .followsCount(Math.toIntExact(followMapper.countByUser(userId)))
                .build();
        auditMapper.insert(a);
        return a;
    }
}
