package com.driftwatch.service.window;

import com.driftwatch.entity.BaselineWindow;
import com.driftwatch.entity.LlmWindow;
import com.driftwatch.repository.BaselineWindowRepository;
import com.driftwatch.repository.LlmWindowRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * First-time baseline inserts. Each insert commits in its own transaction so a
 * unique-key violation from a concurrent creator rolls back only the insert and the
 * caller can re-read the winner's row.
 */
@Component
@RequiredArgsConstructor
public class BaselineStore {

    private final BaselineWindowRepository baselineRepository;
    private final LlmWindowRepository llmWindowRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BaselineWindow insert(BaselineWindow baseline) {
        return baselineRepository.saveAndFlush(baseline);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public LlmWindow insert(LlmWindow baseline) {
        return llmWindowRepository.saveAndFlush(baseline);
    }
}
