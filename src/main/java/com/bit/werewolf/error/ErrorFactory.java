package com.bit.werewolf.error;

import java.util.Map;

/**
 * 结构化错误工厂
 */
public interface ErrorFactory {

    /**
     * 创建结构化错误
     * @param category 错误分类，必须与错误码所属分类一致
     * @param code 错误码
     * @param details 附加信息，"message" 键会作为异常消息
     * @return 未抛出的异常对象，由调用方决定抛出或转换成 Result
     */
    VoteException createError(VoteErrorCategory category, VoteErrorCode code, Map<String, Object> details);

    default VoteException createError(VoteErrorCode code, Map<String, Object> details) {
        return createError(code.getCategory(), code, details);
    }
}
