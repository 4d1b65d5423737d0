package com.tencent.taskboard.domain.workflow.service;

import com.tencent.taskboard.domain.project.repository.ProjectRepository;
import com.tencent.taskboard.domain.task.Task;
import com.tencent.taskboard.domain.task.TaskStatus;
import com.tencent.taskboard.domain.task.repository.TaskRepository;
import com.tencent.taskboard.domain.workflow.AutomationError;
import com.tencent.taskboard.domain.workflow.AutomationException;
import com.tencent.taskboard.domain.workflow.Rule;
import com.tencent.taskboard.domain.workflow.TaskTemplate;
import com.tencent.taskboard.domain.workflow.TransitionEvent;
import com.tencent.taskboard.domain.workflow.repository.RuleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * TemplateMaterializer - 按规则挂载的模板生成任务
 * <p>
 * 生成的任务落在事件所在项目；任务事件沿用任务所在卡片，卡片事件落在卡片本身；
 * 不在卡片下的任务来源会把自己的里程碑传给新任务。
 * 创建人取触发用户，级联触发时取工作流创建人。
 * </p>
 *
 * @author taskboard
 */
@Service
@RequiredArgsConstructor
public class TemplateMaterializer {

    private final RuleRepository ruleRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;

    public List<Task> materialize(Rule rule, TransitionEvent event) {
        List<TaskTemplate> templates = ruleRepository.findTemplates(rule.getId());
        Long createdBy = event.getTriggeringUser().orElse(rule.getWorkflowCreatedBy());

        List<Task> created = new ArrayList<>(templates.size());
        for (TaskTemplate template : templates) {
            if (!projectRepository.taskTypeBelongsTo(template.getTypeId(), event.getProjectId())) {
                throw new AutomationException(AutomationError.INVALID_TEMPLATE,
                    "Template " + template.getId() + " of rule " + rule.getId() + " uses task type "
                        + template.getTypeId() + " which does not belong to project " + event.getProjectId());
            }
            Task task = Task.builder()
                .projectId(event.getProjectId())
                .typeId(template.getTypeId())
                .cardId(event.getCardId())
                .milestoneId(event.getCardId() == null ? event.getMilestoneId() : null)
                .title(template.getName())
                .description(template.getDescription())
                .priority(template.getPriority())
                .status(TaskStatus.AVAILABLE)
                .createdBy(createdBy)
                .createdFromRuleId(rule.getId())
                .build();
            created.add(taskRepository.insert(task));
        }
        return created;
    }
}
