package com.bit.werewolf.structure.dto;

import com.bit.werewolf.structure.vote.VoteType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 当前投票进度
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoteStatus {
    private boolean active;
    private VoteType type;
    private int turn;
    private int totalVoters;
    private int submitted;
    private boolean complete;
    private List<Integer> remainingVoters;

    //以下按观察者过滤，不可见时为null
    private List<VisibleVote> votes;
    private VisibleVote ownVote;
    private Map<Integer, Integer> counts;
}
