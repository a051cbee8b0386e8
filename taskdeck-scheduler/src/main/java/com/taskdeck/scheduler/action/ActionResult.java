package com.taskdeck.scheduler.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform outcome of an action: success with optional data, or failure with
 * an error message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {
    private boolean success;
    private Map<String, Object> data;
    private String error;

    public static ActionResult ok(Map<String, Object> data) {
        return ActionResult.builder()
                .success(true)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .build();
    }

    public static ActionResult fail(String error) {
        return ActionResult.builder().success(false).error(error).build();
    }
}
