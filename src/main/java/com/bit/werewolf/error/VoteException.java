package com.bit.werewolf.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 投票子系统的结构化异常
 * 组件内部以异常报告错误，VoteFacade 统一转换为 Result 返回
 */
@Getter
public class VoteException extends RuntimeException {

    private final VoteErrorCode errorCode;

    /**
     * 附加信息 如 phase / turn / targetId
     */
    private final Map<String, Object> details;

    public VoteException(VoteErrorCode errorCode, String message, Map<String, Object> details) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode;
        this.details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static VoteException of(VoteErrorCode errorCode, String message) {
        return new VoteException(errorCode, message, null);
    }

    public static VoteException of(VoteErrorCode errorCode) {
        return new VoteException(errorCode, null, null);
    }

    public VoteErrorCategory getCategory() {
        return errorCode.getCategory();
    }

    @Override
    public String toString() {
        return "VoteException{" + errorCode.getCode() + "/" + errorCode.name()
                + ", message=" + getMessage() + ", details=" + details + "}";
    }
}
