package com.tencent.taskboard.infrastructure.persistence.task;

import com.tencent.taskboard.domain.task.TaskEvent;
import com.tencent.taskboard.domain.task.repository.TaskEventRepository;
import com.tencent.taskboard.infrastructure.persistence.task.converter.TaskConverter;
import com.tencent.taskboard.infrastructure.persistence.task.mapper.TaskEventMapper;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.validation.annotation.Validated;

/**
 * TaskEventRepositoryImpl - 任务事件仓储实现
 *
 * @author taskboard
 */
@Repository
@Validated
public class TaskEventRepositoryImpl implements TaskEventRepository {

    private final TaskEventMapper taskEventMapper;

    public TaskEventRepositoryImpl(TaskEventMapper taskEventMapper) {
        this.taskEventMapper = taskEventMapper;
    }

    @Override
    public void append(TaskEvent event) {
        int inserted = taskEventMapper.insertForProject(TaskConverter.eventToDataObject(event));
        if (inserted == 0) {
            throw new DataIntegrityViolationException(
                "Project " + event.getProjectId() + " not found for task event on task " + event.getTaskId());
        }
    }
}
