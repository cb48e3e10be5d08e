package com.bit.werewolf.phase;

/**
 * 当前游戏阶段和天数
 */
public interface PhaseSource {

    /**
     * @return 尚未进入任何阶段时为null
     */
    String getCurrentPhase();

    int getCurrentTurn();
}
