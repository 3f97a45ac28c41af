package com.threadmail.mapper;

import com.threadmail.mapper.row.MessageRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface ThreadMessageMapper {

    void insert(MessageRow message);

    void updateFlags(@Param("messageId") String messageId,
                     @Param("isRead") int isRead,
                     @Param("isFlagged") int isFlagged,
                     @Param("labels") String labels);

    List<MessageRow> findByThreadId(@Param("threadId") String threadId);

    List<String> findIdsByThreadId(@Param("threadId") String threadId);

    List<String> findThreadIdsByExternalMessageIds(@Param("externalMessageIds") Collection<String> externalMessageIds);

    void deleteById(@Param("messageId") String messageId);

    void deleteByThreadId(@Param("threadId") String threadId);
}
