package com.forumapi.domain.thread;

public interface ThreadRepository {

    AddedThread addThread(NewThread newThread);

    /**
     * @throws com.forumapi.commons.exceptions.NotFoundException if the thread does not exist
     */
    void verifyThreadExists(String threadId);

    ForumThread getThreadById(String threadId);
}
