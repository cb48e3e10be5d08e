package com.bit.werewolf.error;

/**
 * 投票子系统错误码表
 */
public enum VoteErrorCode {
    INVALID_BALLOT(VoteErrorCategory.VALIDATION, "E5004", "无效的投票数据"),
    INVALID_VOTER(VoteErrorCategory.VALIDATION, "E5101", "投票者不存在"),
    INVALID_TARGET(VoteErrorCategory.VALIDATION, "E5102", "投票对象不存在"),
    DEAD_VOTER(VoteErrorCategory.VALIDATION, "E5103", "死亡的玩家不能投票"),
    INELIGIBLE_TARGET(VoteErrorCategory.VALIDATION, "E5104", "不能投票给该对象"),
    SELF_VOTE_FORBIDDEN(VoteErrorCategory.VALIDATION, "E5105", "不能投票给自己"),
    ROLE_CONSTRAINT_VIOLATION(VoteErrorCategory.VALIDATION, "E5106", "角色限制不允许该投票"),
    NO_PREVIOUS_VOTE(VoteErrorCategory.VALIDATION, "E5107", "没有可以变更的投票"),

    INVALID_PHASE(VoteErrorCategory.PRECONDITION, "E5201", "当前阶段不能投票"),
    NO_VOTERS(VoteErrorCategory.PRECONDITION, "E5202", "没有可以投票的玩家"),
    NO_TARGETS(VoteErrorCategory.PRECONDITION, "E5203", "没有可以投票的对象"),
    ALREADY_DEAD(VoteErrorCategory.PRECONDITION, "E5204", "处刑对象已经死亡"),
    NO_CANDIDATES(VoteErrorCategory.PRECONDITION, "E5205", "没有可以处刑的候选人"),

    NO_ACTIVE_ROUND(VoteErrorCategory.CONSISTENCY, "E5301", "当前没有进行中的投票"),
    ROUND_CLOSED(VoteErrorCategory.CONSISTENCY, "E5302", "本轮投票已经计票，不能再修改"),

    ;

    private final VoteErrorCategory category;
    private final String code;
    private final String defaultMessage;

    VoteErrorCode(VoteErrorCategory category, String code, String defaultMessage) {
        this.category = category;
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public VoteErrorCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
