package com.tencent.taskboard.infrastructure.persistence.workflow;

import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.TaskTemplate;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import com.tencent.taskboard.domain.workflow.repository.RuleRepository;
import com.tencent.taskboard.infrastructure.persistence.workflow.converter.RuleConverter;
import com.tencent.taskboard.infrastructure.persistence.workflow.mapper.RuleMapper;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RuleRepositoryImpl - 工作流规则仓储实现
 *
 * @author taskboard
 */
@Repository
@Validated
public class RuleRepositoryImpl implements RuleRepository {

    private final RuleMapper ruleMapper;

    public RuleRepositoryImpl(RuleMapper ruleMapper) {
        this.ruleMapper = ruleMapper;
    }

    @Override
    public List<Rule> findMatching(TransitionEvent event) {
        return ruleMapper.selectMatching(
                event.getProjectId(),
                event.getResourceType().getCode(),
                event.getToState(),
                event.isTaskEvent(),
                event.getTaskTypeId())
            .stream()
            .map(RuleConverter::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    public boolean isActive(long ruleId) {
        return ruleMapper.countActive(ruleId) > 0;
    }

    @Override
    public List<TaskTemplate> findTemplates(long ruleId) {
        return ruleMapper.selectTemplates(ruleId).stream()
            .map(RuleConverter::templateToDomain)
            .collect(Collectors.toList());
    }
}
