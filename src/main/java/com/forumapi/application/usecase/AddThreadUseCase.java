package com.forumapi.application.usecase;

import com.forumapi.domain.thread.AddedThread;
import com.forumapi.domain.thread.NewThread;
import com.forumapi.domain.thread.ThreadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class AddThreadUseCase {

    private static final Logger LOG = LoggerFactory.getLogger(AddThreadUseCase.class);

    private final ThreadRepository threadRepository;

    public AddThreadUseCase(ThreadRepository threadRepository) {
        this.threadRepository = threadRepository;
    }

    public AddedThread execute(Map<String, ?> payload) {
        AddedThread added = threadRepository.addThread(NewThread.from(payload));
        LOG.info("Thread created: id={}, owner={}", added.id(), added.owner());
        return added;
    }
}
