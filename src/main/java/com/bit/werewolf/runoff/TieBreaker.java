package com.bit.werewolf.runoff;

import java.util.List;

/**
 * 平票时从候选人中选出一人
 */
public interface TieBreaker {

    /**
     * @return 候选为空时返回null
     */
    Integer pick(List<Integer> candidates);
}
