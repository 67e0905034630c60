package com.github.basking2.initiative.db;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * Store and load things. Each row is the thing's JSON document plus copies of its key fields.
 */
public interface ThingMapper {

    @Select("SELECT data FROM things WHERE uuid = #{value}")
    List<String> get(String uuid);

    @Select("SELECT data FROM things WHERE name = #{value}")
    List<String> getByName(String name);

    @Select("SELECT data FROM things ORDER BY uuid")
    List<String> all();

    @Update("MERGE INTO things (uuid, name, type, data) KEY (uuid) "
            + "VALUES (#{uuid}, #{name,jdbcType=VARCHAR}, #{type,jdbcType=VARCHAR}, #{data,jdbcType=CLOB})")
    int put(@Param("uuid") String uuid, @Param("name") String name, @Param("type") String type, @Param("data") String data);

    @Delete("DELETE FROM things WHERE uuid = #{value}")
    int delete(String uuid);

    @Delete("DELETE FROM things")
    void clear();
}
