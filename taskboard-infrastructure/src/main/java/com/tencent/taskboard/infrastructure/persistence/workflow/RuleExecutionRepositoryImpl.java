package com.tencent.taskboard.infrastructure.persistence.workflow;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.tencent.taskboard.domain.workflow.ExecutionOutcome;
import com.tencent.taskboard.domain.workflow.ExecutionPage;
import com.tencent.taskboard.domain.workflow.ResourceType;
import com.tencent.taskboard.domain.workflow.RuleExecution;
import com.tencent.taskboard.domain.workflow.RuleMetrics;
import com.tencent.taskboard.domain.workflow.WorkflowMetrics;
import com.tencent.taskboard.domain.workflow.repository.RuleExecutionRepository;
import com.tencent.taskboard.infrastructure.persistence.workflow.converter.RuleExecutionConverter;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleExecutionDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.entity.RuleExecutionViewDO;
import com.tencent.taskboard.infrastructure.persistence.workflow.mapper.RuleExecutionMapper;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * RuleExecutionRepositoryImpl - 规则评估记录仓储实现
 * <p>
 * 写路径只有 insert；同一来源的 applied 记录由部分唯一索引去重
 * </p>
 *
 * @author taskboard
 */
@Repository
@Validated
public class RuleExecutionRepositoryImpl implements RuleExecutionRepository {

    private final RuleExecutionMapper ruleExecutionMapper;

    public RuleExecutionRepositoryImpl(RuleExecutionMapper ruleExecutionMapper) {
        this.ruleExecutionMapper = ruleExecutionMapper;
    }

    @Override
    public RuleExecution append(RuleExecution execution) {
        RuleExecutionDO executionDO = RuleExecutionConverter.toDataObject(execution);
        if (executionDO.getCreatedAt() == null) {
            executionDO.setCreatedAt(Instant.now());
        }
        ruleExecutionMapper.insert(executionDO);
        return execution.toBuilder()
            .id(executionDO.getId())
            .createdAt(executionDO.getCreatedAt())
            .build();
    }

    @Override
    public boolean existsApplied(long ruleId, ResourceType originType, long originId) {
        Long count = ruleExecutionMapper.selectCount(
            new LambdaQueryWrapper<RuleExecutionDO>()
                .eq(RuleExecutionDO::getRuleId, ruleId)
                .eq(RuleExecutionDO::getOriginType, originType.getCode())
                .eq(RuleExecutionDO::getOriginId, originId)
                .eq(RuleExecutionDO::getOutcome, ExecutionOutcome.APPLIED.getCode())
        );
        return count != null && count > 0;
    }

    @Override
    public Optional<RuleMetrics> metricsForRule(long ruleId, Instant from, Instant to) {
        return Optional.ofNullable(ruleExecutionMapper.selectRuleMetrics(ruleId, from, to))
            .map(RuleExecutionConverter::metricsToDomain);
    }

    @Override
    public List<WorkflowMetrics> metricsForProject(long projectId, Instant from, Instant to) {
        return ruleExecutionMapper.selectProjectMetrics(projectId, from, to).stream()
            .map(RuleExecutionConverter::workflowMetricsToDomain)
            .collect(Collectors.toList());
    }

    @Override
    public ExecutionPage page(long ruleId, Instant from, Instant to, int pageIndex, int pageSize) {
        IPage<RuleExecutionViewDO> page = ruleExecutionMapper.selectPageByRule(
            new Page<>(pageIndex, pageSize), ruleId, from, to);
        List<RuleExecution> records = page.getRecords().stream()
            .map(RuleExecutionConverter::toDomain)
            .collect(Collectors.toList());
        return new ExecutionPage(records, page.getTotal(), pageIndex, pageSize);
    }
}
