package com.postpilot.types.common;

/**
 * 全局常量定义类。
 *
 * @author postpilot
 * @since 2026-09-14
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 每周天数 */
    public final static int DAYS_PER_WEEK = 7;

    /** 单周最大发帖频率 */
    public final static int MAX_WEEKLY_FREQUENCY = 7;

}
