package com.bit.werewolf.phase.impl;

import com.bit.werewolf.event.PhaseEvent;
import com.bit.werewolf.phase.PhaseSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 跟踪阶段切换事件
 * 优先于其他监听器执行，保证它们读到的是新阶段
 */
@Slf4j
@Component
public class PhaseTracker implements PhaseSource {

    private volatile String currentPhase;

    private volatile int currentTurn = 1;

    @EventListener
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void onPhase(PhaseEvent event) {
        if (event.getStage() == PhaseEvent.Stage.START) {
            enter(event.getPhase(), event.getTurn());
        }
    }

    public synchronized void enter(String phase, int turn) {
        log.debug("进入阶段 {} 第{}天", phase, turn);
        this.currentPhase = phase;
        this.currentTurn = turn;
    }

    @Override
    public String getCurrentPhase() {
        return currentPhase;
    }

    @Override
    public int getCurrentTurn() {
        return currentTurn;
    }
}
