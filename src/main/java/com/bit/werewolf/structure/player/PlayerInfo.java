package com.bit.werewolf.structure.player;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 玩家信息快照
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlayerInfo {
    int id;
    String name;
    boolean alive;
    //角色名，未知时为null
    String roleName;
}
