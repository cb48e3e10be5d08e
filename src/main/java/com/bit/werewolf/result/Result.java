package com.bit.werewolf.result;


import com.bit.werewolf.error.VoteErrorCode;
import com.bit.werewolf.error.VoteException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import java.io.Serializable;

/**
 *   投票引擎统一返回格式
 *   可失败的操作（登记/变更投票、开启投票、执行处刑）都以它返回，不抛异常
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Integer SC_OK_200 = 200;
    public static final Integer SC_VALIDATION_400 = 400;
    public static final Integer SC_PRECONDITION_409 = 409;


    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码
     */
    private Integer code = 0;

    /**
     * 失败原因 如 DEAD_VOTER / SELF_VOTE_FORBIDDEN，成功时为null
     */
    private String reason;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public Result() {
    }

    public static<T> Result<T> ok(T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<T>();
        r.setCode(code);
        r.setMessage(msg);
        r.setSuccess(false);
        return r;
    }

    /**
     * 按错误码构造失败结果，reason 即错误码名
     */
    public static<T> Result<T> error(VoteErrorCode errorCode, String msg) {
        return reject(errorCode.name(), errorCode.getCategory().getStatus(), msg);
    }

    public static<T> Result<T> error(VoteErrorCode errorCode) {
        return error(errorCode, errorCode.getDefaultMessage());
    }

    /**
     * 结构化异常转换为失败结果
     */
    public static<T> Result<T> error(VoteException e) {
        return error(e.getErrorCode(), e.getMessage());
    }

    /**
     * 自定义原因的失败结果（角色限制钩子返回的原因不一定在错误码表里）
     */
    public static<T> Result<T> reject(String reason, int code, String msg) {
        Result<T> r = error(code, msg);
        r.setReason(reason);
        return r;
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }

}
