package com.bit.werewolf.visibility;

import lombok.Builder;
import lombok.Value;

/**
 * 投票信息的公开范围
 */
@Value
@Builder(toBuilder = true)
public class VisibilitySettings {
    //显示投票者
    @Builder.Default
    boolean showVoterNames = true;
    //显示得票数
    @Builder.Default
    boolean showVoteCount = true;
    //投票过程中实时公开
    @Builder.Default
    boolean showRealTimeVotes = false;
    //投票结束前匿名
    @Builder.Default
    boolean anonymousUntilEnd = false;

    public static VisibilitySettings defaults() {
        return VisibilitySettings.builder().build();
    }
}
