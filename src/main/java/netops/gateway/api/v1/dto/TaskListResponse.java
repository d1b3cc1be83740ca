package netops.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import netops.gateway.model.Task;

import java.util.List;

public record TaskListResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("count") int count) {

    public static TaskListResponse from(List<Task> tasks) {
        List<TaskResponse> views = tasks.stream().map(TaskResponse::from).toList();
        return new TaskListResponse(views, views.size());
    }
}
