package com.github.basking2.initiative.db;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * Store and load key values. The data column holds the document {@code {"key": ..., "value": ...}}.
 */
public interface KeyValueMapper {

    @Select("SELECT data FROM key_value WHERE key = #{value}")
    List<String> get(String key);

    @Select("SELECT data FROM key_value ORDER BY key")
    List<String> all();

    @Update("MERGE INTO key_value (key, data) KEY (key) VALUES (#{key}, #{data,jdbcType=CLOB})")
    int put(@Param("key") String key, @Param("data") String data);

    @Delete("DELETE FROM key_value WHERE key = #{value}")
    int delete(String key);

    @Delete("DELETE FROM key_value")
    void clear();
}
