package com.bit.werewolf.config;

import com.bit.werewolf.policy.ExecutionRule;
import com.bit.werewolf.policy.VotingPolicy;
import com.bit.werewolf.visibility.VisibilitySettings;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 投票规则配置 application.yml 中 werewolf.vote.*
 * 只在启动时读取一次，转换成不可变的 VotingPolicy
 */
@Slf4j
@Data
@Component
@Order(0)
@ConfigurationProperties(prefix = "werewolf.vote")
public class VoteProperties {
    private String executionRule = "runoff";//首轮平票规则 runoff/random/no_execution/all_execution
    private String runoffTieRule = "random";//决选平票规则
    private boolean allowSelfVote = false;
    private boolean revealRoleOnDeath = true;
    private boolean firstDayExecution = true;
    private int maxRunoffAttempts = 3;
    private boolean autoExecute = true;
    private Long tieBreakSeed;//随机决胜的种子，不配置则每次不同

    private Visibility visibility = new Visibility();

    @Data
    public static class Visibility {
        private boolean showVoterNames = true;
        private boolean showVoteCount = true;
        private boolean showRealTimeVotes = false;
        private boolean anonymousUntilEnd = false;
    }

    @PostConstruct
    public void init() {
        log.info("投票规则: 首轮平票={}, 决选平票={}, 允许自投={}, 公开角色={}, 首日处刑={}, 决选上限={}",
                executionRule, runoffTieRule, allowSelfVote, revealRoleOnDeath, firstDayExecution, maxRunoffAttempts);
        if (ExecutionRule.fromValue(executionRule) == ExecutionRule.UNRECOGNIZED) {
            log.warn("无法识别的首轮平票规则[{}]，平票时按决选投票处理", executionRule);
        }
        if (ExecutionRule.fromValue(runoffTieRule) == ExecutionRule.UNRECOGNIZED) {
            log.warn("无法识别的决选平票规则[{}]，平票时随机选出", runoffTieRule);
        }
    }

    public VotingPolicy toPolicy() {
        return VotingPolicy.builder()
                .executionRule(ExecutionRule.fromValue(executionRule))
                .runoffTieRule(ExecutionRule.fromValue(runoffTieRule))
                .allowSelfVote(allowSelfVote)
                .revealRoleOnDeath(revealRoleOnDeath)
                .firstDayExecution(firstDayExecution)
                .maxRunoffAttempts(maxRunoffAttempts)
                .autoExecute(autoExecute)
                .build();
    }

    public VisibilitySettings toVisibilitySettings() {
        return VisibilitySettings.builder()
                .showVoterNames(visibility.isShowVoterNames())
                .showVoteCount(visibility.isShowVoteCount())
                .showRealTimeVotes(visibility.isShowRealTimeVotes())
                .anonymousUntilEnd(visibility.isAnonymousUntilEnd())
                .build();
    }
}
