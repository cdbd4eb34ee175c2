package com.albumsocial.domain.mapper;

import com.albumsocial.domain.entity.AlbumEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface AlbumMapper extends BaseMapper<AlbumEntity> {

    @Select("select count(1) from t_album where id = #{id}")
    long countById(@Param("id") long id);
}
