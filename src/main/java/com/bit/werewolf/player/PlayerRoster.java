package com.bit.werewolf.player;

import com.bit.werewolf.structure.player.PlayerInfo;

import java.util.List;

/**
 * 玩家名册
 * 投票子系统只通过它查询玩家和执行处刑，不持有玩家状态
 */
public interface PlayerRoster {

    /**
     * @return 不存在时返回null
     */
    PlayerInfo getPlayer(int id);

    List<PlayerInfo> getAlivePlayers();

    /**
     * 玩家死亡
     * @param cause 死因 如 execution
     */
    void kill(int id, String cause);

    /**
     * 是否拥有双倍票（警长等）
     */
    default boolean hasDoubleVote(int id) {
        return false;
    }

    default boolean isAlive(int id) {
        PlayerInfo player = getPlayer(id);
        return player != null && player.isAlive();
    }
}
