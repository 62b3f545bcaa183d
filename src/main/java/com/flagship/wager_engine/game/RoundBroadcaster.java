package com.flagship.wager_engine.game;

/**
 * Outbound side of a game's real-time channel.
 */
public interface RoundBroadcaster {

    /**
     * Sends a message to every client connected to the game.
     */
    void broadcast(GameType gameType, String type, Object data);

    /**
     * Sends a message to the clients of one player only.
     */
    void sendTo(GameType gameType, String address, String type, Object data);
}
