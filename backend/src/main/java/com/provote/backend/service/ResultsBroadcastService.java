package com.provote.backend.service;

import com.provote.backend.domain.Poll;
import com.provote.backend.domain.PollOption;
import com.provote.backend.dto.PollResultsMessage;
import com.provote.backend.repository.PollOptionRepository;
import com.provote.backend.repository.PollRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ResultsBroadcastService {

    private final PollRepository pollRepository;
    private final PollOptionRepository pollOptionRepository;
    private final SimpMessagingTemplate messagingTemplate;

    public static String topicFor(UUID pollId) {
        return "/topic/polls/" + pollId + "/results";
    }

    @Transactional(readOnly = true)
    public void broadcast(UUID pollId) {
        Poll poll = pollRepository.findById(pollId).orElse(null);
        if (poll == null) {
            log.debug("Poll {} vanished before results broadcast", pollId);
            return;
        }
        Map<UUID, Integer> counts = new LinkedHashMap<>();
        for (PollOption option : pollOptionRepository.findByPollId(pollId)) {
            counts.put(option.getId(), option.getCachedVoteCount());
        }
        PollResultsMessage message = new PollResultsMessage(pollId, poll.getCachedTotalVotes(),
                poll.getCachedUniqueVoters(), counts);
        messagingTemplate.convertAndSend(topicFor(pollId), message);
    }
}
