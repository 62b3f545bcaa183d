package com.flagship.wager_engine.game.slide;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_engine.game.GameChannelHandler;
import com.flagship.wager_engine.game.GameChannelRegistry;
import org.springframework.stereotype.Component;

/**
 * {@code /ws/slide}
 */
@Component
public class SlideChannelHandler extends GameChannelHandler {

    public SlideChannelHandler(SlideRoundScheduler scheduler, GameChannelRegistry registry, ObjectMapper objectMapper) {
        super(scheduler, registry, objectMapper);
    }
}
