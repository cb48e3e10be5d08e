package com.bit.werewolf.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class VoteErrors implements ErrorFactory {

    @Override
    public VoteException createError(VoteErrorCategory category, VoteErrorCode code, Map<String, Object> details) {
        if (code.getCategory() != category) {
            throw new IllegalArgumentException("错误码" + code + "不属于分类" + category);
        }
        Object message = details == null ? null : details.get("message");
        VoteException e = new VoteException(code, message == null ? null : message.toString(), details);
        log.debug("创建投票错误 {} {}", code.getCode(), e.getDetails());
        return e;
    }
}
