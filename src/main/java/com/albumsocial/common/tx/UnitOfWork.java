package com.albumsocial.common.tx;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一组按顺序执行、整体提交或整体回滚的步骤。
 *
 * <p>required 步骤抛异常：后续步骤不再执行，事务回滚，异常原样抛给调用方。
 * bestEffort 步骤抛异常：只记 warn 日志，继续执行。bestEffort 步骤若操作的是事务外资源（如 Redis），回滚时不会被撤销。</p>
 *
 * <pre>{@code
 * UnitOfWork.named("account-deletion")
 *         .step("audit", () -> ...)
 *         .bestEffortStep("invalidate-sessions", () -> ...)
 *         .step("delete-user", () -> ...)
 *         .commit(transactionTemplate);
 * }</pre>
 */
@Slf4j
public final class UnitOfWork {

    public record Step(String name, boolean required, Runnable action) {
    }

    private final String name;
    private final List<Step> steps = new ArrayList<>();
    private boolean committed;

    private UnitOfWork(String name) {
        this.name = name;
    }

    public static UnitOfWork named(String name) {
        return new UnitOfWork(name);
    }

    public UnitOfWork step(String stepName, Runnable action) {
        return add(new Step(stepName, true, action));
    }

    public UnitOfWork bestEffortStep(String stepName, Runnable action) {
        return add(new Step(stepName, false, action));
    }

    public List<Step> steps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * 在 template 描述的事务边界内依次执行全部步骤。同一实例只能提交一次。
     */
    public void commit(TransactionTemplate transactionTemplate) {
        if (committed) {
            throw new IllegalStateException("unit of work already committed: " + name);
        }
        committed = true;
        transactionTemplate.executeWithoutResult(status -> {
            for (Step step : steps) {
                run(step);
            }
        });
        log.debug("unit of work committed: name={}, steps={}", name, steps.size());
    }

    private void run(Step step) {
        if (step.required()) {
            step.action().run();
            return;
        }
        try {
            step.action().run();
        } catch (RuntimeException e) {
            log.warn("best-effort step failed, continue: unitOfWork={}, step={}, err={}", name, step.name(), e.toString());
        }
    }

    private UnitOfWork add(Step step) {
        if (committed) {
            throw new IllegalStateException("unit of work already committed: " + name);
        }
        steps.add(step);
        return this;
    }
}
