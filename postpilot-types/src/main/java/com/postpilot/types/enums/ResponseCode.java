package com.postpilot.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 每一种业务错误类型对应一个响应码，调用方可以只依据 code 渲染提示信息，无需了解内部实现。
 * </p>
 *
 * @author postpilot
 * @since 2026-09-14
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 发帖偏好或计划窗口不合法 */
    INVALID_PREFERENCES("P001", "发帖偏好不合法"),

    /** 计划窗口内没有可用的发帖日 */
    INSUFFICIENT_SLOTS("P002", "计划窗口内没有可用发帖日"),

    /** 候选内容为空 */
    EMPTY_CANDIDATES("P003", "候选内容为空"),

    /** 批量规划失败且已回滚 */
    PLANNING_ABORTED("P004", "规划失败，已回滚"),

    /** 非法状态迁移 */
    ILLEGAL_TRANSITION("L001", "当前状态不支持该操作"),

    /** 同一帖子已有操作在进行中 */
    ALREADY_IN_PROGRESS("L002", "帖子正在处理中"),

    /** 发布中或已发布的帖子不可编辑 */
    IMMUTABLE_POST("L003", "帖子内容已锁定，不可编辑"),

    /** 外部调用超时 */
    TIMEOUT("E001", "调用超时"),

    /** 记录不存在 */
    NOT_FOUND("E002", "记录不存在"),

    /** 乐观锁冲突或发帖时段冲突 */
    CONFLICT("E003", "数据冲突"),

    /** 外部发布渠道返回错误 */
    PUBLISHER_ERROR("E004", "发布渠道返回错误");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
