package com.tencent.taskboard.domain.workflow;

import lombok.Value;

import java.util.List;

/**
 * ExecutionPage - 规则评估记录分页
 *
 * @author taskboard
 */
@Value
public class ExecutionPage {

    List<RuleExecution> records;

    long total;

    int pageIndex;

    int pageSize;
}
