package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.UserEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface UserMapper extends BaseMapper<UserEntity> {

    @Select("select count(1) from t_user where id = #{id}")
    long countById(@Param("id") long id);

    @Select("select count(1) from t_user where username = #{username}")
    long countByUsername(@Param("username") String username);

    @Select("select count(1) from t_user where email = #{email}")
    long countByEmail(@Param("email") String email);

    /**
     * 用户名/昵称模糊匹配，keyword 需由调用方转义 % 与 _。
     */
    @Select("""
            <script>
            select *
            from t_user
            where username like concat('%', #{keyword}, '%')
               or display_name like concat('%', #{keyword}, '%')
            order by username asc
            limit #{limit}
            </script>
            """)
    List<UserEntity> searchByKeyword(@Param("keyword") String keyword, @Param("limit") int limit);

    /**
     * 关注推荐：排除自己与已关注的人，按注册时间倒序。
     */
    @Select("""
            <script>
            select u.*
            from t_user u
            where u.id != #{userId}
              and not exists (
                select 1 from t_follow f
                where f.follower_id = #{userId}
                  and f.followee_id = u.id
              )
            order by u.created_at desc, u.id desc
            limit #{limit}
            </script>
            """)
    List<UserEntity> selectFollowSuggestions(@Param("userId") long userId, @Param("limit") int limit);
}
