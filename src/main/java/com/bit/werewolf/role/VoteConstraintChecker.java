package com.bit.werewolf.role;

/**
 * 角色对投票的限制（如恋人不能互投）
 * 容器中所有实现都会在登记和变更投票时依次检查，第一个拒绝的生效
 */
public interface VoteConstraintChecker {

    ConstraintResult check(int voterId, int targetId);
}
