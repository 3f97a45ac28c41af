package com.threadmail.mapper;

import com.threadmail.mapper.row.EventRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ThreadEventMapper {

    void insert(EventRow event);

    List<EventRow> findByThreadId(@Param("threadId") String threadId);

    Long findLastVersion(@Param("threadId") String threadId);

    void deleteByThreadId(@Param("threadId") String threadId);
}
