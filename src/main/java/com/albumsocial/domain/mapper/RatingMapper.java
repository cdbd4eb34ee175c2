package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.RatingEntity;
import com.albumsocial.domain.model.RatingAggregate;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface RatingMapper extends BaseMapper<RatingEntity> {

    @Select("select * from t_rating where user_id = #{userId} and album_id = #{albumId}")
    RatingEntity selectByUserAndAlbum(@Param("userId") long userId, @Param("albumId") long albumId);

    /**
     * upsert 用：锁住自然键对应的行，直到事务结束。
     * 行不存在时不能在 REPEATABLE READ 下调用（InnoDB 会加间隙锁，两个并发首评互相等待而死锁），调用方需用 READ COMMITTED。
     */
    @Select("select * from t_rating where user_id = #{userId} and album_id = #{albumId} for update")
    RatingEntity selectByUserAndAlbumForUpdate(@Param("userId") long userId, @Param("albumId") long albumId);

    @Update("update t_rating set rating = #{rating}, updated_at = #{updatedAt} where id = #{id}")
    int updateRating(@Param("id") long id, @Param("rating") int rating, @Param("updatedAt") LocalDateTime updatedAt);

    @Select("select * from t_rating where user_id = #{userId} order by created_at desc, id desc")
    List<RatingEntity> selectByUser(@Param("userId") long userId);

    @Select("select * from t_rating where album_id = #{albumId} order by created_at desc, id desc")
    List<RatingEntity> selectByAlbum(@Param("albumId") long albumId);

    /**
     * 含已匿名化的行。
     */
    @Select("select count(1) from t_rating where album_id = #{albumId}")
    long countByAlbum(@Param("albumId") long albumId);

    @Select("""
            select count(1) as rating_count, coalesce(sum(rating), 0) as rating_sum
            from t_rating
            where album_id = #{albumId}
            """)
    RatingAggregate selectAggregateByAlbum(@Param("albumId") long albumId);

    @Select("select count(1) from t_rating where user_id = #{userId}")
    long countByUser(@Param("userId") long userId);

    @Update("update t_rating set user_id = null where user_id = #{userId}")
    int anonymizeByUser(@Param("userId") long userId);

    @Delete("delete from t_rating where user_id = #{userId} and album_id = #{albumId}")
    int deleteByUserAndAlbum(@Param("userId") long userId, @Param("albumId") long albumId);
}
