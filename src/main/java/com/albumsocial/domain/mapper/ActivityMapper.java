package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.ActivityEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * 所有读取只返回每个 (type, source_id) 的最新一条：同一条评分改了三次，feed 里只出现最后一次。
 * 排序统一为 created_at desc, id asc。
 */
public interface ActivityMapper extends BaseMapper<ActivityEntity> {

    String LATEST_PER_SOURCE = """
              and not exists (
                select 1 from t_activity n
                where n.type = a.type
                  and n.source_id = a.source_id
                  and (n.created_at &gt; a.created_at
                       or (n.created_at = a.created_at and n.id &gt; a.id))
              )
            """;

    String FEED_ORDER = """
            order by a.created_at desc, a.id asc
            limit #{limit} offset #{offset}
            """;

    @Select("""
            <script>
            select a.*
            from t_activity a
            where a.user_id in
            <foreach collection="userIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            """ + LATEST_PER_SOURCE + FEED_ORDER + """
            </script>
            """)
    List<ActivityEntity> selectByUserIds(@Param("userIds") List<Long> userIds,
                                         @Param("limit") int limit,
                                         @Param("offset") int offset);

    @Select("""
            <script>
            select count(1)
            from t_activity a
            where a.user_id in
            <foreach collection="userIds" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            """ + LATEST_PER_SOURCE + """
            </script>
            """)
    long countByUserIds(@Param("userIds") List<Long> userIds);

    @Select("""
            <script>
            select a.*
            from t_activity a
            where a.user_id = #{userId}
            """ + LATEST_PER_SOURCE + FEED_ORDER + """
            </script>
            """)
    List<ActivityEntity> selectByUser(@Param("userId") long userId,
                                      @Param("limit") int limit,
                                      @Param("offset") int offset);

    @Select("""
            <script>
            select count(1)
            from t_activity a
            where a.user_id = #{userId}
            """ + LATEST_PER_SOURCE + """
            </script>
            """)
    long countByUser(@Param("userId") long userId);

    /**
     * 全站动态，type 为 null 表示不过滤。
     */
    @Select("""
            <script>
            select a.*
            from t_activity a
            where 1 = 1
            <if test="type != null">
              and a.type = #{type}
            </if>
            """ + LATEST_PER_SOURCE + FEED_ORDER + """
            </script>
            """)
    List<ActivityEntity> selectRecent(@Param("type") String type,
                                      @Param("limit") int limit,
                                      @Param("offset") int offset);

    @Update("update t_activity set user_id = null where user_id = #{userId}")
    int anonymizeByUser(@Param("userId") long userId);
}
