package com.actiongate.api;

import com.actiongate.driver.DriverRegistry;
import com.actiongate.execution.ActionExecutor;
import com.actiongate.execution.ExecuteResult;
import com.actiongate.execution.PrepareRequest;
import com.actiongate.execution.PrepareResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/actions")
public class ActionController {

    private final ActionExecutor actionExecutor;
    private final DriverRegistry driverRegistry;

    public ActionController(ActionExecutor actionExecutor, DriverRegistry driverRegistry) {
        this.actionExecutor = actionExecutor;
        this.driverRegistry = driverRegistry;
    }

    @GetMapping
    public Map<String, Object> capabilities() {
        return driverRegistry.describe();
    }

    @PostMapping("/prepare")
    public PrepareResult prepare(@RequestBody PrepareRequest request) {
        return actionExecutor.prepare(request);
    }

    @PostMapping("/execute")
    public ExecuteResult execute(@RequestBody ExecuteRequest request) {
        return actionExecutor.execute(
            request.preparedId(),
            Boolean.TRUE.equals(request.confirm()),
            Boolean.TRUE.equals(request.waitForConfirmation())
        );
    }
}
