package com.bit.werewolf.event;

import lombok.Value;

/**
 * 玩家死亡
 */
@Value
public class PlayerDeathEvent {
    int playerId;
    String cause;
    int turn;
}
