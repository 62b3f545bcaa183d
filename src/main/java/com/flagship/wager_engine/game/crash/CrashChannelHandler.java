package com.flagship.wager_engine.game.crash;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_engine.game.GameChannelHandler;
import com.flagship.wager_engine.game.GameChannelRegistry;
import org.springframework.stereotype.Component;

/**
 * {@code /ws/crash}
 */
@Component
public class CrashChannelHandler extends GameChannelHandler {

    public CrashChannelHandler(CrashRoundScheduler scheduler, GameChannelRegistry registry, ObjectMapper objectMapper) {
        super(scheduler, registry, objectMapper);
    }
}
