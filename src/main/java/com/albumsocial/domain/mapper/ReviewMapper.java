package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.ReviewEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface ReviewMapper extends BaseMapper<ReviewEntity> {

    @Select("select * from t_review where user_id = #{userId} and album_id = #{albumId}")
    ReviewEntity selectByUserAndAlbum(@Param("userId") long userId, @Param("albumId") long albumId);

    /**
     * 隔离级别要求同 {@link RatingMapper#selectByUserAndAlbumForUpdate}。
     */
    @Select("select * from t_review where user_id = #{userId} and album_id = #{albumId} for update")
    ReviewEntity selectByUserAndAlbumForUpdate(@Param("userId") long userId, @Param("albumId") long albumId);

    @Select("select * from t_review where id = #{id} for update")
    ReviewEntity selectByIdForUpdate(@Param("id") long id);

    @Update("update t_review set content = #{content}, updated_at = #{updatedAt} where id = #{id}")
    int updateContent(@Param("id") long id, @Param("content") String content, @Param("updatedAt") LocalDateTime updatedAt);

    @Select("select * from t_review where user_id = #{userId} order by created_at desc, id desc")
    List<ReviewEntity> selectByUser(@Param("userId") long userId);

    /**
     * 专辑页按时间正序展示。
     */
    @Select("select * from t_review where album_id = #{albumId} order by created_at asc, id asc")
    List<ReviewEntity> selectByAlbum(@Param("albumId") long albumId);

    @Select("select count(1) from t_review where album_id = #{albumId}")
    long countByAlbum(@Param("albumId") long albumId);

    @Select("select count(1) from t_review where user_id = #{userId}")
    long countByUser(@Param("userId") long userId);

    @Update("update t_review set user_id = null where user_id = #{userId}")
    int anonymizeByUser(@Param("userId") long userId);

    @Delete("delete from t_review where user_id = #{userId} and album_id = #{albumId}")
    int deleteByUserAndAlbum(@Param("userId") long userId, @Param("albumId") long albumId);
}
