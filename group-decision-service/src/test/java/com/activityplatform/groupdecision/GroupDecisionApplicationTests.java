package com.activityplatform.groupdecision;

import com.activityplatform.common.scoring.ScoringWeights;
import com.activityplatform.common.voting.CondorcetResolver;
import com.activityplatform.common.voting.VoteResolver;
import com.activityplatform.groupdecision.service.GroupVotingService;
import com.activityplatform.groupdecision.service.RecommendationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class GroupDecisionApplicationTests {

    @Autowired
    private ScoringWeights scoringWeights;

    @Autowired
    private VoteResolver voteResolver;

    @Autowired
    private GroupVotingService groupVotingService;

    @Autowired
    private RecommendationService recommendationService;

    @Test
    void contextLoadsWithConfiguredWeights() {
        assertEquals(0.4, scoringWeights.weatherWeight(), 1e-9);
        assertEquals(0.6, scoringWeights.preferenceWeight(), 1e-9);
        assertInstanceOf(CondorcetResolver.class, voteResolver);
        assertNotNull(groupVotingService);
        assertNotNull(recommendationService);
    }
}
