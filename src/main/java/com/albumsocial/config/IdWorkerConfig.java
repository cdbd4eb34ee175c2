package com.albumsocial.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 多实例部署时每个实例需要不同的雪花 workerId，否则同毫秒内可能生成重复 id。
 *
 * <p>优先读 albumsocial.id.worker-id；未配置时从 instance-id 末尾数字推导（api-3 → 2）；都没有则用默认生成器。</p>
 */
@Configuration
public class IdWorkerConfig {
    private static final Logger log = LoggerFactory.getLogger(IdWorkerConfig.class);
    private static final Pattern LAST_NUMBER = Pattern.compile("(\\d+)(?!.*\\d)");

    private final long datacenterId;
    private final long workerId;
    private final String instanceId;

    public IdWorkerConfig(
            @Value("${albumsocial.id.datacenter-id:1}") long datacenterId,
            @Value("${albumsocial.id.worker-id:-1}") long workerId,
            @Value("${albumsocial.instance-id:}") String instanceId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.instanceId = instanceId;
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        long[] resolved = resolveIds();
        if (resolved == null) {
            log.info("IdWorker: keep default (no albumsocial.id.worker-id and no numeric instance-id)");
            return DefaultIdentifierGenerator.getInstance();
        }
        log.info("IdWorker: workerId={}, datacenterId={}, instanceId={}", resolved[0], resolved[1], instanceId);
        return new DefaultIdentifierGenerator(resolved[0], resolved[1]);
    }

    long[] resolveIds() {
        long dc = normalize5Bits(datacenterId);
        long wid = workerId;
        if (wid < 0) {
            wid = parseWorkerIdFromInstanceId(instanceId);
        }
        if (wid < 0) {
            return null;
        }
        return new long[]{normalize5Bits(wid), dc};
    }

    private static long parseWorkerIdFromInstanceId(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return -1;
        }
        Matcher matcher = LAST_NUMBER.matcher(instanceId);
        if (!matcher.find()) {
            return -1;
        }
        try {
            return Long.parseLong(matcher.group(1)) - 1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long normalize5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
