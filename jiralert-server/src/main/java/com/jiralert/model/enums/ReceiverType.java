package com.jiralert.model.enums;

/**
 * 接收者类型, 决定由哪个 Notifier 变体投递
 */
public enum ReceiverType {

    /** 在 Jira 中创建工单 */
    JIRA,

    /** 仅打印日志（演练/调试） */
    LOG
}
