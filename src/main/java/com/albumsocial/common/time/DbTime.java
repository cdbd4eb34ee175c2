package com.albumsocial.common.time;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 与 DATETIME(3) 对齐的时间工具：写库前统一截断到毫秒，读回来的值与写入值完全一致。
 */
public final class DbTime {

    private DbTime() {
    }

    public static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * 更新时间必须严格前进：同一毫秒内连续更新（或时钟回拨）时取 previous + 1ms。
     */
    public static LocalDateTime nextUpdate(LocalDateTime previous) {
        LocalDateTime now = now();
        if (previous == null) {
            return now;
        }
        LocalDateTime floor = previous.truncatedTo(ChronoUnit.MILLIS).plus(1, ChronoUnit.MILLIS);
        return now.isBefore(floor) ? floor : now;
    }
}
