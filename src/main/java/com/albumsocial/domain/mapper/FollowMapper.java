package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.FollowEntity;
import com.albumsocial.domain.entity.UserEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface FollowMapper extends BaseMapper<FollowEntity> {

    @Select("select count(1) from t_follow where follower_id = #{followerId} and followee_id = #{followeeId}")
    long countEdge(@Param("followerId") long followerId, @Param("followeeId") long followeeId);

    @Delete("delete from t_follow where follower_id = #{followerId} and followee_id = #{followeeId}")
    int deleteEdge(@Param("followerId") long followerId, @Param("followeeId") long followeeId);

    @Select("""
            select u.*
            from t_follow f
            join t_user u on u.id = f.follower_id
            where f.followee_id = #{userId}
            order by f.created_at desc, f.id desc
            """)
    List<UserEntity> selectFollowers(@Param("userId") long userId);

    @Select("""
            select u.*
            from t_follow f
            join t_user u on u.id = f.followee_id
            where f.follower_id = #{userId}
            order by f.created_at desc, f.id desc
            """)
    List<UserEntity> selectFollowing(@Param("userId") long userId);

    /**
     * 互相关注：userId -> x 且 x -> userId。
     */
    @Select("""
            select u.*
            from t_follow f
            join t_follow b
              on b.follower_id = f.followee_id
             and b.followee_id = f.follower_id
            join t_user u on u.id = f.followee_id
            where f.follower_id = #{userId}
            order by f.created_at desc, f.id desc
            """)
    List<UserEntity> selectMutual(@Param("userId") long userId);

    @Select("select count(1) from t_follow where followee_id = #{userId}")
    long countFollowers(@Param("userId") long userId);

    @Select("select count(1) from t_follow where follower_id = #{userId}")
    long countFollowing(@Param("userId") long userId);

    @Select("select followee_id from t_follow where follower_id = #{userId}")
    List<Long> selectFollowingIds(@Param("userId") long userId);

    @Select("select follower_id from t_follow where followee_id = #{userId}")
    List<Long> selectFollowerIds(@Param("userId") long userId);

    @Select("""
            <script>
            select followee_id
            from t_follow
            where follower_id = #{followerId}
              and followee_id in
            <foreach collection="ids" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    List<Long> selectFollowedAmong(@Param("followerId") long followerId, @Param("ids") List<Long> ids);

    /**
     * 涉及该用户的边数，关注与被关注都算。
     */
    @Select("select count(1) from t_follow where follower_id = #{userId} or followee_id = #{userId}")
    long countByUser(@Param("userId") long userId);

    @Delete("delete from t_follow where follower_id = #{userId} or followee_id = #{userId}")
    int deleteByUser(@Param("userId") long userId);
}
