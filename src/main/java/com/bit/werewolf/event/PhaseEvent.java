package com.bit.werewolf.event;

import lombok.Value;

/**
 * 游戏阶段切换，由游戏流程发布
 * 投票子系统在 vote 阶段开始时开启处刑投票，结束时计票
 */
@Value
public class PhaseEvent {

    public static final String VOTE = "vote";
    public static final String RUNOFF_VOTE = "runoffVote";

    public enum Stage {
        START,
        END
    }

    Stage stage;
    String phase;
    int turn;

    public static PhaseEvent start(String phase, int turn) {
        return new PhaseEvent(Stage.START, phase, turn);
    }

    public static PhaseEvent end(String phase, int turn) {
        return new PhaseEvent(Stage.END, phase, turn);
    }

    public boolean isVotePhase() {
        return VOTE.equals(phase) || RUNOFF_VOTE.equals(phase);
    }
}
