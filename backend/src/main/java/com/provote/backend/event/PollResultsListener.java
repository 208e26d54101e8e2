package com.provote.backend.event;

import com.provote.backend.service.ResultsBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PollResultsListener {

    private final ResultsBroadcastService resultsBroadcastService;

    @EventListener
    public void onResultsChanged(PollResultsChangedEvent event) {
        try {
            resultsBroadcastService.broadcast(event.pollId());
        } catch (RuntimeException e) {
            log.warn("Could not broadcast results of poll {}: {}", event.pollId(), e.getMessage());
        }
    }
}
