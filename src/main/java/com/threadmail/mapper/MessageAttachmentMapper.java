package com.threadmail.mapper;

import com.threadmail.mapper.row.AttachmentRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MessageAttachmentMapper {

    void insert(AttachmentRow attachment);

    List<AttachmentRow> findByThreadId(@Param("threadId") String threadId);

    void deleteByMessageId(@Param("messageId") String messageId);

    void deleteByThreadId(@Param("threadId") String threadId);
}
