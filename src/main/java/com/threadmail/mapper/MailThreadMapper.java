package com.threadmail.mapper;

import com.threadmail.mapper.row.ThreadRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MailThreadMapper {

    void insert(ThreadRow thread);

    /**
     * Optimistic update: only touches the row while its version is still expectedVersion
     *
     * @return number of updated rows (0 on conflict)
     */
    int updateIfVersion(@Param("thread") ThreadRow thread, @Param("expectedVersion") long expectedVersion);

    ThreadRow findById(@Param("threadId") String threadId);

    Long findVersion(@Param("threadId") String threadId);

    List<String> findAllIds();

    List<String> findIdsByNormalizedSubject(@Param("normalizedSubject") String normalizedSubject,
                                            @Param("limit") int limit);

    int deleteById(@Param("threadId") String threadId);
}
