package com.albumsocial.config;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import org.apache.ibatis.reflection.MetaObject;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Configuration
@MapperScan("com.albumsocial.**.mapper")
public class MybatisPlusConfig {

    /**
     * createdAt/updatedAt 兜底填充。
     *
     * <p>业务层已显式赋值的字段不会被覆盖（strictFill 只填 null）。列精度为毫秒，这里同样截断。</p>
     */
    @Bean
    public MetaObjectHandler timestampMetaObjectHandler() {
        return new MetaObjectHandler() {
            @Override
            public void insertFill(MetaObject metaObject) {
                LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
                this.strictInsertFill(metaObject, "createdAt", LocalDateTime.class, now);
                this.strictInsertFill(metaObject, "updatedAt", LocalDateTime.class, now);
            }

            @Override
            public void updateFill(MetaObject metaObject) {
                this.strictUpdateFill(metaObject, "updatedAt", LocalDateTime.class,
                        LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS));
            }
        };
    }
}
