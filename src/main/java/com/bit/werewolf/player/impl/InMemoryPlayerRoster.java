package com.bit.werewolf.player.impl;

import com.bit.werewolf.event.PhaseEvent;
import com.bit.werewolf.event.PlayerDeathEvent;
import com.bit.werewolf.player.PlayerRoster;
import com.bit.werewolf.structure.player.PlayerInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存玩家名册，按加入顺序保存
 * 玩家死亡时发布 PlayerDeathEvent
 */
@Slf4j
@Component
public class InMemoryPlayerRoster implements PlayerRoster {

    private final Map<Integer, PlayerInfo> players = new LinkedHashMap<>();

    private final Set<Integer> doubleVoters = new HashSet<>();

    private int currentTurn = 1;

    @Autowired
    private ApplicationEventPublisher publisher;

    public synchronized void addPlayer(PlayerInfo player) {
        players.put(player.getId(), player);
    }

    public void addPlayer(int id, String name, String roleName) {
        addPlayer(PlayerInfo.builder().id(id).name(name).alive(true).roleName(roleName).build());
    }

    public synchronized void setDoubleVote(int id, boolean enabled) {
        if (enabled) {
            doubleVoters.add(id);
        } else {
            doubleVoters.remove(id);
        }
    }

    /**
     * 死亡事件里带的天数
     */
    public synchronized void setCurrentTurn(int turn) {
        this.currentTurn = turn;
    }

    @EventListener
    public void onPhase(PhaseEvent event) {
        setCurrentTurn(event.getTurn());
    }

    public synchronized void clear() {
        players.clear();
        doubleVoters.clear();
        currentTurn = 1;
    }

    @Override
    public synchronized PlayerInfo getPlayer(int id) {
        return players.get(id);
    }

    @Override
    public synchronized List<PlayerInfo> getAlivePlayers() {
        List<PlayerInfo> alive = new ArrayList<>();
        for (PlayerInfo player : players.values()) {
            if (player.isAlive()) {
                alive.add(player);
            }
        }
        return alive;
    }

    @Override
    public void kill(int id, String cause) {
        int turn;
        synchronized (this) {
            PlayerInfo player = players.get(id);
            if (player == null || !player.isAlive()) {
                log.warn("玩家{}不存在或已死亡，忽略死亡处理", id);
                return;
            }
            players.put(id, player.toBuilder().alive(false).build());
            turn = currentTurn;
        }
        log.info("玩家{}死亡 原因={}", id, cause);
        //锁外发布，监听方可能回查名册
        publisher.publishEvent(new PlayerDeathEvent(id, cause, turn));
    }

    @Override
    public synchronized boolean hasDoubleVote(int id) {
        return doubleVoters.contains(id);
    }
}
